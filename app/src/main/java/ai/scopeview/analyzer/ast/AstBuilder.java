package ai.scopeview.analyzer.ast;

import ai.scopeview.analyzer.AstNode;
import ai.scopeview.analyzer.CstNode;
import ai.scopeview.analyzer.ImportDirective;
import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.NodeType;
import ai.scopeview.analyzer.QualifiedNames;
import ai.scopeview.analyzer.ReferenceKind;
import ai.scopeview.analyzer.ReferenceSite;
import ai.scopeview.analyzer.SourceRange;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Derives the semantic AST from a canonical CST. The walk itself is shared by every language and driven by the
 * language's {@link ComplianceRules}: each grammar node is mapped to a {@link NodeType} and dispatched to the matching
 * {@code visit*} hook, which subclasses implement for their grammar.
 *
 * <p>Instances hold per-build state and are not thread safe; create one per parse with {@link #forLanguage}.
 */
public abstract class AstBuilder {
    private static final Logger log = LogManager.getLogger(AstBuilder.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    protected final ComplianceRules rules;
    protected final Language language;

    private final List<ImportDirective> imports = new ArrayList<>();
    private final List<PendingReference> references = new ArrayList<>();
    private String path = "";

    protected AstBuilder(ComplianceRules rules) {
        this.rules = rules;
        this.language = rules.language();
    }

    public static AstBuilder forLanguage(Language language) {
        return switch (language) {
            case C -> new CAstBuilder();
            case CPP -> new CppAstBuilder();
            case PYTHON -> new PythonAstBuilder();
            case JAVASCRIPT -> new JsTsAstBuilder(Language.JAVASCRIPT);
            case TYPESCRIPT -> new JsTsAstBuilder(Language.TYPESCRIPT);
            case UNKNOWN -> throw new IllegalArgumentException("No AST builder for " + language);
        };
    }

    public ComplianceRules rules() {
        return rules;
    }

    public AstBuildResult build(CstNode cstRoot, String path) {
        this.path = path;
        imports.clear();
        references.clear();

        var root = AstNode.builder(NodeType.ROOT)
                .path(path)
                .range(cstRoot.range())
                .rawContent(cstRoot.content());
        walkScope(cstRoot, Frame.root(root));

        var ids = assignIds(root);
        var sites = new ArrayList<ReferenceSite>(references.size());
        for (var ref : references) {
            sites.add(new ReferenceSite(ref.name, ref.kind, ref.range, ids.get(ref.scope), language, ref.source));
        }
        var built = root.build();
        log.debug(
                "Built AST for {}: {} nodes, {} imports, {} reference sites",
                path,
                ids.size(),
                imports.size(),
                sites.size());
        return new AstBuildResult(built, imports, sites);
    }

    protected String path() {
        return path;
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Generic walk

    /**
     * Visits the named children of {@code container} as items of the scope described by {@code frame}. Comments
     * directly above an item are offered to it as documentation; if the item does not take them they become COMMENT
     * nodes.
     */
    protected void walkScope(CstNode container, Frame frame) {
        var pending = new ArrayList<CstNode>();
        boolean atLineStart = true;
        for (var child : container.children()) {
            if (child.isTrivia()) {
                var text = child.content();
                if (newlines(text) >= 2) {
                    flushComments(pending, frame, -1);
                }
                if (text.indexOf('\n') >= 0) {
                    atLineStart = true;
                }
                continue;
            }
            if (!child.named()) {
                atLineStart = false;
                continue;
            }
            if (rules.isComment(child.type())) {
                if (atLineStart && rules.docstringStyle() == DocstringStyle.PRECEDING_COMMENT && !frame.inFunction) {
                    pending.add(child);
                } else {
                    flushComments(pending, frame, -1);
                    emitComment(child, frame);
                }
                atLineStart = false;
                continue;
            }
            int insertAt = frame.owner.children().size();
            boolean consumed = visitItem(child, frame, cleanComments(pending));
            if (!consumed) {
                flushComments(pending, frame, insertAt);
            }
            pending.clear();
            atLineStart = false;
        }
        flushComments(pending, frame, -1);
    }

    /** Dispatches one item. Returns true when {@code doc} was attached to a node. */
    protected boolean visitItem(CstNode item, Frame frame, String doc) {
        var type = item.type();
        if (item.isError() || rules.isTransparent(type)) {
            walkScope(item, frame);
            return false;
        }
        var mapped = rules.semanticType(type);
        if (mapped == null) {
            return visitUnmapped(item, frame, doc);
        }
        log.trace("{} -> {} at {}", type, mapped, item.range());
        return switch (mapped) {
            case FUNCTION, METHOD, LAMBDA -> visitFunction(item, mapped, frame, doc);
            case CLASS, STRUCT, UNION, INTERFACE -> visitClass(item, mapped, frame, doc);
            case ENUM -> visitEnum(item, frame, doc);
            case NAMESPACE, MODULE -> visitNamespace(item, mapped, frame, doc);
            case VARIABLE, PROPERTY -> visitVariable(item, mapped, frame, doc);
            case TYPEDEF -> visitTypedef(item, frame, doc);
            case MACRO -> visitMacro(item, frame, doc);
            case USING -> visitUsing(item, frame, doc);
            case INCLUDE, IMPORT -> {
                visitImport(item, frame);
                yield false;
            }
            case COMMENT, DOCSTRING -> {
                emitComment(item, frame);
                yield false;
            }
            case ROOT, UNKNOWN -> visitUnmapped(item, frame, doc);
        };
    }

    protected boolean visitFunction(CstNode item, NodeType type, Frame frame, String doc) {
        return visitUnmapped(item, frame, doc);
    }

    protected boolean visitClass(CstNode item, NodeType type, Frame frame, String doc) {
        return visitUnmapped(item, frame, doc);
    }

    protected boolean visitEnum(CstNode item, Frame frame, String doc) {
        return visitUnmapped(item, frame, doc);
    }

    protected boolean visitNamespace(CstNode item, NodeType type, Frame frame, String doc) {
        return visitUnmapped(item, frame, doc);
    }

    protected boolean visitVariable(CstNode item, NodeType type, Frame frame, String doc) {
        return visitUnmapped(item, frame, doc);
    }

    protected boolean visitTypedef(CstNode item, Frame frame, String doc) {
        return visitUnmapped(item, frame, doc);
    }

    protected boolean visitMacro(CstNode item, Frame frame, String doc) {
        return visitUnmapped(item, frame, doc);
    }

    protected boolean visitUsing(CstNode item, Frame frame, String doc) {
        return visitUnmapped(item, frame, doc);
    }

    protected void visitImport(CstNode item, Frame frame) {
        collectReferences(item, frame);
    }

    /** Grammar types the table does not map: by default only scanned for references. */
    protected boolean visitUnmapped(CstNode item, Frame frame, String doc) {
        collectReferences(item, frame);
        return false;
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Node creation

    /** Adds a node named {@code name} under the frame's owner, qualified relative to the frame. */
    protected AstNode.Builder declare(NodeType type, String name, CstNode cst, Frame frame) {
        return declareQualified(type, name, QualifiedNames.of(frame.qualifiedName, name, language), cst, frame);
    }

    protected AstNode.Builder declareQualified(
            NodeType type, String name, String qualifiedName, CstNode cst, Frame frame) {
        var b = AstNode.builder(type)
                .name(name)
                .qualifiedName(qualifiedName)
                .range(cst.range())
                .rawContent(cst.content());
        if (frame.access != null && !frame.inFunction) {
            b.attribute("access", frame.access);
        }
        frame.owner.addChild(b);
        log.trace("Declared {} {} at {}", type, qualifiedName, cst.range());
        return b;
    }

    /** Emits the include/import node in the language's normalized form. */
    protected AstNode.Builder emitImportNode(CstNode cst, String target, boolean system, Frame frame) {
        var b = AstNode.builder(rules.importNodeType())
                .name(target)
                .path(target)
                .system(system)
                .range(cst.range())
                .rawContent(cst.content())
                .attribute("import", "true");
        frame.owner.addChild(b);
        return b;
    }

    protected void emitComment(CstNode cst, Frame frame) {
        if (frame.inFunction) {
            return;
        }
        frame.owner.addChild(AstNode.builder(NodeType.COMMENT).range(cst.range()).rawContent(cst.content()));
    }

    private void flushComments(List<CstNode> pending, Frame frame, int insertAt) {
        if (pending.isEmpty()) {
            return;
        }
        int at = insertAt;
        for (var comment : pending) {
            var b = AstNode.builder(NodeType.COMMENT).range(comment.range()).rawContent(comment.content());
            if (at < 0) {
                frame.owner.addChild(b);
            } else {
                frame.owner.children().add(at++, b);
            }
        }
        pending.clear();
    }

    protected Frame enter(AstNode.Builder owner, Frame parent) {
        return new Frame(
                owner, owner.qualifiedName(), owner.type(), parent.inFunction || owner.type().isFunctionLike());
    }

    protected void addImport(ImportDirective directive) {
        imports.add(directive);
    }

    protected void addReference(String name, ReferenceKind kind, CstNode at, Frame frame) {
        addReference(name, kind, at.range(), frame, "");
    }

    protected void addReference(String name, ReferenceKind kind, SourceRange range, Frame frame, String source) {
        if (name.isEmpty()) {
            return;
        }
        references.add(new PendingReference(name, kind, range, frame.owner, source));
    }

    // ---------------------------------------------------------------------------------------------------------------
    // References

    /** Scans a subtree for call sites, type uses and (inside functions) identifier uses. */
    protected void collectReferences(@Nullable CstNode subtree, Frame frame) {
        if (subtree == null) {
            return;
        }
        var stack = new ArrayDeque<CstNode>();
        stack.push(subtree);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            var type = node.type();
            if (referenceHook(node, frame)) {
                continue;
            }
            CstNode skip = null;
            if (rules.callTypes().contains(type)) {
                var callee = node.childByField(rules.calleeField());
                if (callee != null) {
                    var name = calleeName(callee);
                    if (!name.isEmpty()) {
                        addReference(name, ReferenceKind.CALL, callee, frame);
                        skip = callee;
                    }
                }
            } else if (rules.typeReferenceTypes().contains(type)) {
                addReference(typeName(node), ReferenceKind.TYPE, node, frame);
                continue;
            } else if (frame.inFunction && rules.useReferenceTypes().contains(type)) {
                addReference(node.content(), ReferenceKind.USE, node, frame);
                continue;
            }
            var children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                var child = children.get(i);
                if (child != skip && child.named() && !child.isTrivia() && !rules.isComment(child.type())) {
                    stack.push(child);
                }
            }
        }
    }

    /**
     * Gives a language the first look at a node during the reference scan. Returning true means the node and its
     * subtree have been handled.
     */
    protected boolean referenceHook(CstNode node, Frame frame) {
        return false;
    }

    /** Name called by a call site's callee subtree, or "" when it is not a plain (possibly qualified) name. */
    protected String calleeName(CstNode callee) {
        return rules.useReferenceTypes().contains(callee.type()) || "identifier".equals(callee.type())
                ? callee.content()
                : "";
    }

    /** Name of a type reference node. */
    protected String typeName(CstNode node) {
        return collapse(node.content());
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Text helpers

    /**
     * Text of {@code node} up to (not including) {@code body}, whitespace collapsed. Without a body the whole text is
     * used with a trailing semicolon removed.
     */
    protected static String signatureBefore(CstNode node, @Nullable CstNode body) {
        if (body == null) {
            var text = collapse(node.content());
            return text.endsWith(";") ? text.substring(0, text.length() - 1).strip() : text;
        }
        var sb = new StringBuilder();
        for (var child : node.children()) {
            if (child == body) {
                break;
            }
            sb.append(child.content());
        }
        return collapse(sb.toString());
    }

    protected static String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    protected static String stripQuotes(String text) {
        var s = text.strip();
        if (s.length() >= 2) {
            char first = s.charAt(0);
            char last = s.charAt(s.length() - 1);
            if ((first == '"' || first == '\'' || first == '`' || first == '<') && (last == first || last == '>')) {
                return s.substring(1, s.length() - 1);
            }
        }
        return s;
    }

    /** Documentation text of a run of comments with the comment markers removed. */
    static String cleanComments(List<CstNode> comments) {
        if (comments.isEmpty()) {
            return "";
        }
        var lines = new ArrayList<String>();
        for (var comment : comments) {
            var text = comment.content().strip();
            if (text.startsWith("/*")) {
                text = text.substring(text.startsWith("/**") ? 3 : 2);
                if (text.endsWith("*/")) {
                    text = text.substring(0, text.length() - 2);
                }
                for (var line : text.split("\\R", -1)) {
                    var l = line.strip();
                    if (l.startsWith("*")) {
                        l = l.substring(1).strip();
                    }
                    lines.add(l);
                }
            } else if (text.startsWith("//")) {
                lines.add(text.substring(text.startsWith("///") ? 3 : 2).strip());
            } else if (text.startsWith("#")) {
                lines.add(text.substring(1).strip());
            } else {
                lines.add(text);
            }
        }
        return String.join("\n", lines).strip();
    }

    private static int newlines(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') count++;
        }
        return count;
    }

    private static Map<AstNode.Builder, Integer> assignIds(AstNode.Builder root) {
        var ids = new IdentityHashMap<AstNode.Builder, Integer>();
        var stack = new ArrayDeque<AstNode.Builder>();
        stack.push(root);
        int next = 0;
        while (!stack.isEmpty()) {
            var b = stack.pop();
            ids.put(b, next++);
            var children = b.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return ids;
    }

    private record PendingReference(
            String name, ReferenceKind kind, SourceRange range, AstNode.Builder scope, String source) {}

    /** The scope new declarations are attached to. */
    protected static final class Frame {
        final AstNode.Builder owner;
        final String qualifiedName;
        final NodeType ownerType;
        final boolean inFunction;
        /** Current access level inside a C++ class body; null elsewhere. */
        @Nullable
        String access;

        Frame(AstNode.Builder owner, String qualifiedName, NodeType ownerType, boolean inFunction) {
            this.owner = owner;
            this.qualifiedName = qualifiedName;
            this.ownerType = ownerType;
            this.inFunction = inFunction;
        }

        static Frame root(AstNode.Builder root) {
            return new Frame(root, "", NodeType.ROOT, false);
        }
    }
}
