package ai.scopeview.analyzer.ast;

import static ai.scopeview.analyzer.ast.CTreeSitterNodeTypes.*;
import static ai.scopeview.analyzer.ast.CppTreeSitterNodeTypes.*;

import ai.scopeview.analyzer.AstNode;
import ai.scopeview.analyzer.CstNode;
import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.NodeType;
import ai.scopeview.analyzer.QualifiedNames;
import ai.scopeview.analyzer.ReferenceKind;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * AST construction for C++: namespaces, classes with access specifiers and base classes, templates, out-of-line
 * member definitions ({@code Foo::bar}), operator overloads and using declarations, on top of the C rules.
 */
public class CppAstBuilder extends CAstBuilder {

    private static final Pattern TEMPLATE_ARGS = Pattern.compile("<[^<>]*>");

    static final ComplianceRules RULES;

    static {
        Map<String, NodeType> types = new HashMap<>(C_NODE_TYPES);
        types.put(CLASS_SPECIFIER, NodeType.CLASS);
        types.put(NAMESPACE_DEFINITION, NodeType.NAMESPACE);
        types.put(ALIAS_DECLARATION, NodeType.TYPEDEF);
        types.put(USING_DECLARATION, NodeType.USING);
        Set<String> transparent = new HashSet<>(C_TRANSPARENT_TYPES);
        transparent.addAll(Set.of("try_statement", "catch_clause", "for_range_loop"));
        RULES = new ComplianceRules(
                Language.CPP,
                types,
                transparent,
                Set.of(COMMENT),
                NodeType.COMMENT,
                DocstringStyle.PRECEDING_COMMENT,
                "declarator",
                "parameters",
                "body",
                "type",
                Set.of(CALL_EXPRESSION),
                "function",
                Set.of(TYPE_IDENTIFIER),
                Set.of(IDENTIFIER),
                Set.of("static", "extern", "inline", "virtual", "constexpr"));
    }

    public CppAstBuilder() {
        super(RULES);
    }

    @Override
    protected boolean isNameNode(CstNode node) {
        return switch (node.type()) {
            case IDENTIFIER,
                    FIELD_IDENTIFIER,
                    TYPE_IDENTIFIER,
                    QUALIFIED_IDENTIFIER,
                    DESTRUCTOR_NAME,
                    OPERATOR_NAME,
                    TEMPLATE_FUNCTION,
                    NAMESPACE_IDENTIFIER -> true;
            default -> false;
        };
    }

    @Override
    protected String nameText(CstNode nameNode) {
        var text = collapse(nameNode.content());
        if (OPERATOR_NAME.equals(nameNode.type()) || text.contains("operator")) {
            // operator overloads are named without inner spaces: "operator==", "operator()"
            return text.replace(" ", "");
        }
        return stripTemplateArguments(text);
    }

    static String stripTemplateArguments(String name) {
        var result = name;
        var previous = "";
        while (!result.equals(previous)) {
            previous = result;
            result = TEMPLATE_ARGS.matcher(result).replaceAll("");
        }
        return result.strip();
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Functions

    @Override
    protected AstNode.Builder declareFunction(CstNode item, CstNode fd, Frame frame, boolean definition) {
        var spelled = declaratorName(fd);
        var segments = QualifiedNames.split(spelled, language);
        var simple = segments.isEmpty() ? spelled : segments.get(segments.size() - 1);
        boolean qualified = segments.size() > 1;
        var type = qualified || frame.ownerType.isClassLike() ? NodeType.METHOD : NodeType.FUNCTION;
        var b = declareQualified(type, simple, QualifiedNames.of(frame.qualifiedName, spelled, language), item, frame)
                .parameters(parameters(fd.childByField("parameters")))
                .attribute("definition", Boolean.toString(definition));
        if (qualified) {
            b.attribute("owner", QualifiedNames.join(segments.subList(0, segments.size() - 1), language));
        }
        if (simple.startsWith("operator")) {
            b.attribute("operator", "true");
        }
        applyStorageClass(item, b);
        for (var child : item.children()) {
            var keyword = child.content().strip();
            if (!child.isTrivia() && ("virtual".equals(keyword) || "inline".equals(keyword))) {
                b.attribute(keyword, "true");
            }
        }
        return b;
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Classes

    @Override
    protected boolean visitClass(CstNode item, NodeType type, Frame frame, String doc) {
        var body = item.childByField("body");
        if (body == null) {
            recordTypeReference(item, frame);
            return false;
        }
        var nameNode = item.childByField("name");
        var name = nameNode == null ? "" : nameText(nameNode);
        var b = declare(type, name, item, frame).docstring(doc).signature(signatureBefore(item, body));
        var bases = new ArrayList<String>();
        var clause = item.firstChildOfType(BASE_CLASS_CLAUSE);
        if (clause != null) {
            for (var base : clause.namedChildren()) {
                switch (base.type()) {
                    case TYPE_IDENTIFIER, QUALIFIED_IDENTIFIER, TEMPLATE_TYPE -> {
                        var baseName = nameText(base);
                        bases.add(baseName);
                        addReference(baseName, ReferenceKind.INHERITANCE, base, frame);
                    }
                    default -> {
                        // access specifiers and virtual markers
                    }
                }
            }
        }
        if (!bases.isEmpty()) {
            b.attribute("bases", String.join(",", bases));
        }
        var inner = enter(b, frame);
        inner.access = CLASS_SPECIFIER.equals(item.type()) ? "private" : "public";
        walkScope(body, inner);
        return true;
    }

    @Override
    protected boolean visitEnum(CstNode item, Frame frame, String doc) {
        var before = frame.owner.children().size();
        boolean consumed = super.visitEnum(item, frame, doc);
        if (frame.owner.children().size() > before) {
            for (var child : item.children()) {
                var keyword = child.content().strip();
                if (!child.named() && ("class".equals(keyword) || "struct".equals(keyword))) {
                    frame.owner.children().get(before).attribute("scoped", "true");
                }
            }
        }
        return consumed;
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Namespaces, templates, using

    @Override
    protected boolean visitNamespace(CstNode item, NodeType type, Frame frame, String doc) {
        var nameNode = item.childByField("name");
        var name = nameNode == null ? "" : collapse(nameNode.content()).replace(" ", "");
        var body = item.childByField("body");
        var b = declare(NodeType.NAMESPACE, name, item, frame)
                .docstring(doc)
                .signature(signatureBefore(item, body));
        if (name.isEmpty()) {
            b.attribute("anonymous", "true");
        }
        if (body != null) {
            walkScope(body, enter(b, frame));
        }
        return true;
    }

    @Override
    protected boolean visitTypedef(CstNode item, Frame frame, String doc) {
        if (!ALIAS_DECLARATION.equals(item.type())) {
            return super.visitTypedef(item, frame, doc);
        }
        var nameNode = item.childByField("name");
        var typeNode = item.childByField("type");
        if (nameNode == null) {
            return false;
        }
        declare(NodeType.TYPEDEF, nameNode.content(), item, frame)
                .docstring(doc)
                .signature(signatureBefore(item, null))
                .attribute("type", typeNode == null ? "" : collapse(typeNode.content()));
        collectReferences(typeNode, frame);
        return true;
    }

    @Override
    protected boolean visitUsing(CstNode item, Frame frame, String doc) {
        boolean namespace = false;
        String target = "";
        for (var child : item.children()) {
            if (child.isTrivia()) {
                continue;
            }
            if (!child.named() && "namespace".equals(child.content())) {
                namespace = true;
            } else if (child.named() && !COMMENT.equals(child.type())) {
                target = collapse(child.content()).replace(" ", "");
            }
        }
        if (target.isEmpty()) {
            return false;
        }
        var b = AstNode.builder(NodeType.USING)
                .name(target)
                .range(item.range())
                .rawContent(item.content())
                .signature(signatureBefore(item, null))
                .attribute("namespace", Boolean.toString(namespace));
        frame.owner.addChild(b);
        return false;
    }

    @Override
    protected boolean visitUnmapped(CstNode item, Frame frame, String doc) {
        switch (item.type()) {
            case TEMPLATE_DECLARATION -> {
                return visitTemplate(item, frame, doc);
            }
            case LINKAGE_SPECIFICATION -> {
                var body = item.childByField("body");
                if (body == null) {
                    return false;
                }
                if (DECLARATION_LIST.equals(body.type())) {
                    walkScope(body, frame);
                    return false;
                }
                return visitItem(body, frame, doc);
            }
            case ACCESS_SPECIFIER -> {
                frame.access = item.content().replace(":", "").strip();
                return false;
            }
            case FRIEND_DECLARATION -> {
                return false;
            }
            default -> {
                return super.visitUnmapped(item, frame, doc);
            }
        }
    }

    private boolean visitTemplate(CstNode item, Frame frame, String doc) {
        var params = item.childByField("parameters");
        CstNode inner = null;
        for (var child : item.namedChildren()) {
            if (!TEMPLATE_PARAMETER_LIST.equals(child.type()) && !COMMENT.equals(child.type())) {
                inner = child;
            }
        }
        if (inner == null) {
            return false;
        }
        int before = frame.owner.children().size();
        boolean consumed = visitItem(inner, frame, doc);
        var template = params == null ? "<>" : collapse(params.content());
        var children = frame.owner.children();
        for (int i = before; i < children.size(); i++) {
            children.get(i).attribute("template", template).range(item.range()).rawContent(item.content());
        }
        return consumed;
    }

    // ---------------------------------------------------------------------------------------------------------------
    // References

    @Override
    protected String calleeName(CstNode callee) {
        return switch (callee.type()) {
            case IDENTIFIER, QUALIFIED_IDENTIFIER -> nameText(callee);
            case TEMPLATE_FUNCTION -> {
                var name = callee.childByField("name");
                yield name == null ? "" : nameText(name);
            }
            default -> "";
        };
    }

    @Override
    protected boolean referenceHook(CstNode node, Frame frame) {
        switch (node.type()) {
            case QUALIFIED_IDENTIFIER -> {
                var last = node;
                while (QUALIFIED_IDENTIFIER.equals(last.type()) && last.childByField("name") != null) {
                    last = last.childByField("name");
                }
                var kind = TYPE_IDENTIFIER.equals(last.type()) || TEMPLATE_TYPE.equals(last.type())
                        ? ReferenceKind.TYPE
                        : ReferenceKind.USE;
                if (kind == ReferenceKind.TYPE || frame.inFunction) {
                    addReference(nameText(node), kind, node, frame);
                }
                return true;
            }
            case TEMPLATE_TYPE -> {
                var name = node.childByField("name");
                if (name != null) {
                    addReference(nameText(name), ReferenceKind.TYPE, name, frame);
                }
                collectReferences(node.childByField("arguments"), frame);
                return true;
            }
            case "lambda_capture_specifier", "field_identifier", NAMESPACE_IDENTIFIER -> {
                return true;
            }
            default -> {
                return false;
            }
        }
    }
}
