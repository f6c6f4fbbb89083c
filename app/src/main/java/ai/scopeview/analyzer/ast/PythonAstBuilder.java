package ai.scopeview.analyzer.ast;

import static ai.scopeview.analyzer.ast.PythonTreeSitterNodeTypes.*;

import ai.scopeview.analyzer.AstNode;
import ai.scopeview.analyzer.CstNode;
import ai.scopeview.analyzer.ImportDirective;
import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.NodeType;
import ai.scopeview.analyzer.Parameter;
import ai.scopeview.analyzer.ReferenceKind;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/** AST construction for Python: decorators, async functions, docstrings, imports and assignments. */
public class PythonAstBuilder extends AstBuilder {

    static final ComplianceRules RULES = new ComplianceRules(
            Language.PYTHON,
            Map.of(
                    FUNCTION_DEFINITION, NodeType.FUNCTION,
                    CLASS_DEFINITION, NodeType.CLASS,
                    IMPORT_STATEMENT, NodeType.INCLUDE,
                    IMPORT_FROM_STATEMENT, NodeType.INCLUDE,
                    FUTURE_IMPORT_STATEMENT, NodeType.INCLUDE),
            Set.of(
                    BLOCK,
                    "if_statement",
                    "elif_clause",
                    "else_clause",
                    "for_statement",
                    "while_statement",
                    "try_statement",
                    "except_clause",
                    "finally_clause",
                    "with_statement"),
            Set.of(COMMENT),
            NodeType.IMPORT,
            DocstringStyle.FIRST_STRING_STATEMENT,
            "name",
            "parameters",
            "body",
            "return_type",
            Set.of(CALL),
            "function",
            Set.of(),
            Set.of(),
            Set.of("async"));

    /** Names already bound in each scope; Python rebinding does not declare a new variable. */
    private final Map<AstNode.Builder, Set<String>> bound = new HashMap<>();

    private List<String> pendingDecorators = List.of();
    private @Nullable CstNode pendingOuter;

    public PythonAstBuilder() {
        super(RULES);
    }

    @Override
    public AstBuildResult build(CstNode cstRoot, String path) {
        bound.clear();
        pendingDecorators = List.of();
        pendingOuter = null;
        return super.build(cstRoot, path);
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Definitions

    @Override
    protected boolean visitFunction(CstNode item, NodeType type, Frame frame, String doc) {
        var nameNode = item.childByField("name");
        if (nameNode == null) {
            return false;
        }
        var outer = takeOuter(item);
        var decorators = takeDecorators();
        var body = item.childByField("body");
        var nodeType = frame.ownerType == NodeType.CLASS ? NodeType.METHOD : NodeType.FUNCTION;
        var returnTypeNode = item.childByField("return_type");
        var b = declare(nodeType, nameNode.content(), item, frame)
                .range(outer.range())
                .rawContent(outer.content())
                .signature(stripColon(signatureBefore(item, body)))
                .returnType(returnTypeNode == null ? "" : collapse(returnTypeNode.content()))
                .docstring(bodyDocstring(body))
                .parameters(parameters(item.childByField("parameters")));
        if (item.children().stream().anyMatch(c -> !c.named() && "async".equals(c.content()))) {
            b.attribute("async", "true");
        }
        applyDecorators(b, decorators);
        var inner = enter(b, frame);
        recordAnnotations(item.childByField("parameters"), returnTypeNode, inner);
        if (body != null) {
            walkScope(body, inner);
        }
        return false;
    }

    @Override
    protected boolean visitClass(CstNode item, NodeType type, Frame frame, String doc) {
        var nameNode = item.childByField("name");
        if (nameNode == null) {
            return false;
        }
        var outer = takeOuter(item);
        var decorators = takeDecorators();
        var body = item.childByField("body");
        var b = declare(NodeType.CLASS, nameNode.content(), item, frame)
                .range(outer.range())
                .rawContent(outer.content())
                .signature(stripColon(signatureBefore(item, body)))
                .docstring(bodyDocstring(body));
        applyDecorators(b, decorators);
        var superclasses = item.childByField("superclasses");
        if (superclasses != null) {
            var bases = new ArrayList<String>();
            for (var base : superclasses.namedChildren()) {
                if (IDENTIFIER.equals(base.type()) || ATTRIBUTE.equals(base.type())) {
                    bases.add(base.content());
                    addReference(base.content(), ReferenceKind.INHERITANCE, base, frame);
                } else {
                    collectReferences(base, frame);
                }
            }
            if (!bases.isEmpty()) {
                b.attribute("bases", String.join(",", bases));
            }
        }
        if (body != null) {
            walkScope(body, enter(b, frame));
        }
        return false;
    }

    private CstNode takeOuter(CstNode item) {
        var outer = pendingOuter == null ? item : pendingOuter;
        pendingOuter = null;
        return outer;
    }

    private List<String> takeDecorators() {
        var decorators = pendingDecorators;
        pendingDecorators = List.of();
        return decorators;
    }

    private static void applyDecorators(AstNode.Builder b, List<String> decorators) {
        if (decorators.isEmpty()) {
            return;
        }
        b.attribute("decorators", String.join(",", decorators));
        if (decorators.contains("staticmethod")) {
            b.attribute("static", "true");
        }
        if (decorators.contains("classmethod")) {
            b.attribute("classmethod", "true");
        }
        if (decorators.contains("property")) {
            b.attribute("property", "true");
        }
    }

    /** The first statement of a body when it is a bare string literal, with quotes removed and indentation cleaned. */
    static String bodyDocstring(@Nullable CstNode body) {
        if (body == null) {
            return "";
        }
        for (var statement : body.namedChildren()) {
            if (COMMENT.equals(statement.type())) {
                continue;
            }
            if (!EXPRESSION_STATEMENT.equals(statement.type())) {
                return "";
            }
            var expressions = statement.namedChildren();
            if (expressions.size() != 1 || !STRING.equals(expressions.get(0).type())) {
                return "";
            }
            return cleanDocstring(stringValue(expressions.get(0).content()));
        }
        return "";
    }

    /** Removes the prefix and quotes of a Python string literal. */
    static String stringValue(String literal) {
        int i = 0;
        while (i < literal.length() && Character.isLetter(literal.charAt(i))) {
            i++;
        }
        var s = literal.substring(i);
        for (var quote : List.of("\"\"\"", "'''", "\"", "'")) {
            if (s.length() >= 2 * quote.length() && s.startsWith(quote) && s.endsWith(quote)) {
                return s.substring(quote.length(), s.length() - quote.length());
            }
        }
        return s;
    }

    /** Strips surrounding blank lines and the common indentation of all lines after the first. */
    static String cleanDocstring(String raw) {
        var lines = raw.split("\\R", -1);
        int indent = Integer.MAX_VALUE;
        for (int i = 1; i < lines.length; i++) {
            var line = lines[i];
            var stripped = line.stripLeading();
            if (!stripped.isEmpty()) {
                indent = Math.min(indent, line.length() - stripped.length());
            }
        }
        var sb = new StringBuilder(lines[0].strip());
        for (int i = 1; i < lines.length; i++) {
            var line = lines[i];
            sb.append('\n').append(indent == Integer.MAX_VALUE || line.length() < indent ? line.strip() : line.substring(indent).stripTrailing());
        }
        return sb.toString().strip();
    }

    private static String stripColon(String signature) {
        return signature.endsWith(":") ? signature.substring(0, signature.length() - 1).strip() : signature;
    }

    private List<Parameter> parameters(@Nullable CstNode params) {
        if (params == null) {
            return List.of();
        }
        var result = new ArrayList<Parameter>();
        for (var param : params.namedChildren()) {
            switch (param.type()) {
                case IDENTIFIER, LIST_SPLAT_PATTERN, DICTIONARY_SPLAT_PATTERN -> result.add(Parameter.named(param.content()));
                case TYPED_PARAMETER -> {
                    var typeNode = param.childByField("type");
                    var named = param.namedChildren();
                    var name = named.isEmpty() ? "" : named.get(0).content();
                    result.add(Parameter.of(name, typeNode == null ? "" : collapse(typeNode.content()), ""));
                }
                case DEFAULT_PARAMETER, TYPED_DEFAULT_PARAMETER -> {
                    var name = param.childByField("name");
                    var typeNode = param.childByField("type");
                    var value = param.childByField("value");
                    result.add(Parameter.of(
                            name == null ? "" : name.content(),
                            typeNode == null ? "" : collapse(typeNode.content()),
                            value == null ? "" : collapse(value.content())));
                }
                default -> {
                    // bare '*' and '/' separators
                }
            }
        }
        return result;
    }

    private void recordAnnotations(@Nullable CstNode params, @Nullable CstNode returnType, Frame inner) {
        if (params != null) {
            for (var param : params.namedChildren()) {
                recordTypeNames(param.childByField("type"), inner);
                collectReferences(param.childByField("value"), inner);
            }
        }
        recordTypeNames(returnType, inner);
    }

    /** Every plain or dotted name inside a type annotation becomes a TYPE reference. */
    private void recordTypeNames(@Nullable CstNode type, Frame frame) {
        if (type == null) {
            return;
        }
        if (IDENTIFIER.equals(type.type()) || ATTRIBUTE.equals(type.type())) {
            addReference(type.content(), ReferenceKind.TYPE, type, frame);
            return;
        }
        for (var child : type.namedChildren()) {
            recordTypeNames(child, frame);
        }
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Statements

    @Override
    protected boolean visitUnmapped(CstNode item, Frame frame, String doc) {
        switch (item.type()) {
            case DECORATED_DEFINITION -> {
                var definition = item.childByField("definition");
                if (definition == null) {
                    collectReferences(item, frame);
                    return false;
                }
                var decorators = new ArrayList<String>();
                for (var child : item.namedChildren()) {
                    if (DECORATOR.equals(child.type())) {
                        var text = collapse(child.content());
                        decorators.add(text.startsWith("@") ? text.substring(1).strip() : text);
                        collectReferences(child, frame);
                    }
                }
                pendingDecorators = decorators;
                pendingOuter = item;
                return visitItem(definition, frame, doc);
            }
            case EXPRESSION_STATEMENT -> {
                var expressions = item.namedChildren();
                if (expressions.size() == 1 && ASSIGNMENT.equals(expressions.get(0).type())) {
                    visitAssignment(expressions.get(0), item, frame);
                    return false;
                }
                return super.visitUnmapped(item, frame, doc);
            }
            default -> {
                return super.visitUnmapped(item, frame, doc);
            }
        }
    }

    private void visitAssignment(CstNode assignment, CstNode statement, Frame frame) {
        var left = assignment.childByField("left");
        var right = assignment.childByField("right");
        var typeNode = assignment.childByField("type");
        if (left != null) {
            for (var target : assignedNames(left)) {
                bindVariable(target, statement, typeNode, frame);
            }
            if (!IDENTIFIER.equals(left.type())) {
                collectReferences(left, frame);
            }
        }
        recordTypeNames(typeNode, frame);
        if (right != null && ASSIGNMENT.equals(right.type())) {
            visitAssignment(right, statement, frame);
        } else {
            collectReferences(right, frame);
        }
    }

    private static List<CstNode> assignedNames(CstNode left) {
        if (IDENTIFIER.equals(left.type())) {
            return List.of(left);
        }
        if ("pattern_list".equals(left.type()) || "tuple_pattern".equals(left.type())) {
            var names = new ArrayList<CstNode>();
            for (var child : left.namedChildren()) {
                if (IDENTIFIER.equals(child.type())) {
                    names.add(child);
                }
            }
            return names;
        }
        return List.of();
    }

    private void bindVariable(CstNode nameNode, CstNode statement, @Nullable CstNode typeNode, Frame frame) {
        var name = nameNode.content();
        if (!bound.computeIfAbsent(frame.owner, k -> new HashSet<>()).add(name)) {
            return;
        }
        var type = frame.ownerType == NodeType.CLASS ? NodeType.PROPERTY : NodeType.VARIABLE;
        var b = declare(type, name, statement, frame).signature(collapse(statement.content()));
        if (typeNode != null) {
            b.attribute("type", collapse(typeNode.content()));
        }
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Imports

    @Override
    protected void visitImport(CstNode item, Frame frame) {
        switch (item.type()) {
            case IMPORT_STATEMENT -> {
                for (var nameNode : item.childrenByField("name")) {
                    String module;
                    String alias = null;
                    if (ALIASED_IMPORT.equals(nameNode.type())) {
                        var moduleNode = nameNode.childByField("name");
                        var aliasNode = nameNode.childByField("alias");
                        module = moduleNode == null ? "" : moduleNode.content();
                        alias = aliasNode == null ? null : aliasNode.content();
                    } else {
                        module = nameNode.content();
                    }
                    var b = emitImportNode(item, module, false, frame);
                    if (alias != null) {
                        b.attribute("alias", alias);
                    }
                    addImport(new ImportDirective(module, false, List.of(), alias, false, 0, item.range()));
                }
            }
            case IMPORT_FROM_STATEMENT -> {
                var moduleNode = item.childByField("module_name");
                var spelled = moduleNode == null ? "" : moduleNode.content().strip();
                int level = 0;
                while (level < spelled.length() && spelled.charAt(level) == '.') {
                    level++;
                }
                var module = spelled.substring(level);
                var names = new ArrayList<ImportDirective.ImportedName>();
                for (var nameNode : item.childrenByField("name")) {
                    ImportDirective.ImportedName imported;
                    if (ALIASED_IMPORT.equals(nameNode.type())) {
                        var n = nameNode.childByField("name");
                        var a = nameNode.childByField("alias");
                        imported = new ImportDirective.ImportedName(
                                n == null ? "" : n.content(), a == null ? "" : a.content());
                    } else {
                        imported = new ImportDirective.ImportedName(nameNode.content(), "");
                    }
                    names.add(imported);
                    addReference(imported.name(), ReferenceKind.IMPORT, nameNode.range(), frame, spelled);
                }
                boolean wildcard = item.hasChildOfType(WILDCARD_IMPORT);
                emitImportNode(item, spelled, false, frame);
                addImport(new ImportDirective(module, false, names, null, wildcard, level, item.range()));
            }
            default -> emitImportNode(item, "__future__", false, frame);
        }
    }

    // ---------------------------------------------------------------------------------------------------------------
    // References

    @Override
    protected String calleeName(CstNode callee) {
        return switch (callee.type()) {
            case IDENTIFIER -> callee.content();
            case ATTRIBUTE -> attributeChain(callee);
            default -> "";
        };
    }

    /** "a.b.c" for an attribute chain over plain identifiers; "" when any link is an expression. */
    private static String attributeChain(CstNode node) {
        var object = node.childByField("object");
        var attribute = node.childByField("attribute");
        if (object == null || attribute == null) {
            return "";
        }
        var prefix = switch (object.type()) {
            case IDENTIFIER -> object.content();
            case ATTRIBUTE -> attributeChain(object);
            default -> "";
        };
        return prefix.isEmpty() ? "" : prefix + "." + attribute.content();
    }
}
