package ai.scopeview.analyzer.ast;

import static ai.scopeview.analyzer.ast.JsTreeSitterNodeTypes.*;

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

/**
 * AST construction shared by JavaScript and TypeScript. The TypeScript grammar is a superset, so a single builder
 * handles both; the TypeScript table only adds interfaces, type aliases, enums and namespaces.
 */
public class JsTsAstBuilder extends AstBuilder {

    private static final Map<String, NodeType> JS_NODE_TYPES = Map.of(
            FUNCTION_DECLARATION, NodeType.FUNCTION,
            GENERATOR_FUNCTION_DECLARATION, NodeType.FUNCTION,
            CLASS_DECLARATION, NodeType.CLASS,
            METHOD_DEFINITION, NodeType.METHOD,
            FIELD_DEFINITION, NodeType.PROPERTY,
            LEXICAL_DECLARATION, NodeType.VARIABLE,
            VARIABLE_DECLARATION, NodeType.VARIABLE,
            IMPORT_STATEMENT, NodeType.INCLUDE);

    private static final Set<String> JS_TRANSPARENT_TYPES = Set.of(
            STATEMENT_BLOCK,
            "if_statement",
            "else_clause",
            "for_statement",
            "for_in_statement",
            "while_statement",
            "do_statement",
            "try_statement",
            "catch_clause",
            "finally_clause",
            "switch_statement",
            "switch_body",
            "switch_case",
            "switch_default",
            "labeled_statement");

    static final ComplianceRules JAVASCRIPT_RULES = new ComplianceRules(
            Language.JAVASCRIPT,
            JS_NODE_TYPES,
            JS_TRANSPARENT_TYPES,
            Set.of(COMMENT),
            NodeType.COMMENT,
            DocstringStyle.PRECEDING_COMMENT,
            "name",
            "parameters",
            "body",
            "return_type",
            Set.of(CALL_EXPRESSION),
            "function",
            Set.of(),
            Set.of(),
            Set.of("async", "static", "get", "set", "readonly", "abstract", "declare"));

    static final ComplianceRules TYPESCRIPT_RULES;

    static {
        var types = new HashMap<>(JS_NODE_TYPES);
        types.put(FUNCTION_SIGNATURE, NodeType.FUNCTION);
        types.put(ABSTRACT_CLASS_DECLARATION, NodeType.CLASS);
        types.put(INTERFACE_DECLARATION, NodeType.INTERFACE);
        types.put(TYPE_ALIAS_DECLARATION, NodeType.TYPEDEF);
        types.put(ENUM_DECLARATION, NodeType.ENUM);
        types.put(INTERNAL_MODULE, NodeType.NAMESPACE);
        types.put(MODULE, NodeType.NAMESPACE);
        types.put(PUBLIC_FIELD_DEFINITION, NodeType.PROPERTY);
        types.put(PROPERTY_SIGNATURE, NodeType.PROPERTY);
        types.put(METHOD_SIGNATURE, NodeType.METHOD);
        types.put(ABSTRACT_METHOD_SIGNATURE, NodeType.METHOD);
        var transparent = new HashSet<>(JS_TRANSPARENT_TYPES);
        transparent.add(AMBIENT_DECLARATION);
        TYPESCRIPT_RULES = new ComplianceRules(
                Language.TYPESCRIPT,
                types,
                transparent,
                JAVASCRIPT_RULES.commentTypes(),
                NodeType.COMMENT,
                DocstringStyle.PRECEDING_COMMENT,
                "name",
                "parameters",
                "body",
                "return_type",
                JAVASCRIPT_RULES.callTypes(),
                "function",
                Set.of(TYPE_IDENTIFIER),
                Set.of(),
                JAVASCRIPT_RULES.modifierTokens());
    }

    private static final Set<String> FUNCTION_VALUES = Set.of(ARROW_FUNCTION, FUNCTION_EXPRESSION, FUNCTION);

    public JsTsAstBuilder(Language language) {
        super(language == Language.TYPESCRIPT ? TYPESCRIPT_RULES : JAVASCRIPT_RULES);
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Functions and methods

    @Override
    protected boolean visitFunction(CstNode item, NodeType type, Frame frame, String doc) {
        var nameNode = item.childByField("name");
        var name = nameNode == null ? "" : stripQuotes(nameNode.content());
        declareCallable(item, item, type, name, frame, doc);
        return true;
    }

    /**
     * Declares a function-like node. {@code outer} supplies range and raw text, {@code fn} the parameters, return type
     * and body (they differ for {@code const f = () => ...}).
     */
    private AstNode.Builder declareCallable(
            CstNode outer, CstNode fn, NodeType type, String name, Frame frame, String doc) {
        var body = fn.childByField("body");
        var returnTypeNode = fn.childByField("return_type");
        var b = declare(type, name, outer, frame)
                .docstring(doc)
                .signature(signatureBefore(fn, body))
                .returnType(typeText(returnTypeNode))
                .parameters(parameters(fn))
                .attribute("definition", Boolean.toString(body != null));
        applyModifiers(fn, b);
        var inner = enter(b, frame);
        var params = fn.childByField("parameters");
        if (params != null) {
            for (var param : params.namedChildren()) {
                collectReferences(param.childByField("type"), inner);
                collectReferences(param.childByField("value"), inner);
                collectReferences(param.childByField("right"), inner);
            }
        }
        collectReferences(returnTypeNode, inner);
        if (body != null) {
            if (STATEMENT_BLOCK.equals(body.type())) {
                walkScope(body, inner);
            } else {
                // expression-bodied arrow function
                collectReferences(body, inner);
            }
        }
        return b;
    }

    private void applyModifiers(CstNode node, AstNode.Builder b) {
        for (var child : node.children()) {
            if (child.isTrivia()) {
                continue;
            }
            var text = child.content().strip();
            if (!child.named() && rules.modifierTokens().contains(text)) {
                b.attribute(text, "true");
            } else if (ACCESSIBILITY_MODIFIER.equals(child.type())) {
                b.attribute("access", text);
            } else if ("*".equals(text) && !child.named()) {
                b.attribute("generator", "true");
            }
        }
    }

    private static String typeText(@Nullable CstNode annotation) {
        if (annotation == null) {
            return "";
        }
        var text = collapse(annotation.content());
        return text.startsWith(":") ? text.substring(1).strip() : text;
    }

    private List<Parameter> parameters(CstNode fn) {
        var single = fn.childByField("parameter");
        if (single != null) {
            return List.of(Parameter.named(single.content()));
        }
        var params = fn.childByField("parameters");
        if (params == null) {
            return List.of();
        }
        var result = new ArrayList<Parameter>();
        for (var param : params.namedChildren()) {
            switch (param.type()) {
                case IDENTIFIER, REST_PATTERN, "object_pattern", "array_pattern" -> result.add(
                        Parameter.named(collapse(param.content())));
                case ASSIGNMENT_PATTERN -> {
                    var left = param.childByField("left");
                    var right = param.childByField("right");
                    result.add(Parameter.of(
                            left == null ? "" : collapse(left.content()),
                            "",
                            right == null ? "" : collapse(right.content())));
                }
                case REQUIRED_PARAMETER, OPTIONAL_PARAMETER -> {
                    var pattern = param.childByField("pattern");
                    var value = param.childByField("value");
                    var name = pattern == null ? "" : collapse(pattern.content());
                    if (OPTIONAL_PARAMETER.equals(param.type())) {
                        name = name + "?";
                    }
                    result.add(Parameter.of(
                            name, typeText(param.childByField("type")), value == null ? "" : collapse(value.content())));
                }
                default -> {
                    // comments, decorators
                }
            }
        }
        return result;
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Classes and interfaces

    @Override
    protected boolean visitClass(CstNode item, NodeType type, Frame frame, String doc) {
        var nameNode = item.childByField("name");
        declareClass(item, item, type, nameNode == null ? "" : nameNode.content(), frame, doc);
        return true;
    }

    private AstNode.Builder declareClass(
            CstNode outer, CstNode cls, NodeType type, String name, Frame frame, String doc) {
        var body = cls.childByField("body");
        var b = declare(type, name, outer, frame).docstring(doc).signature(signatureBefore(cls, body));
        applyModifiers(cls, b);
        var bases = new ArrayList<String>();
        for (var child : cls.namedChildren()) {
            if (CLASS_HERITAGE.equals(child.type()) || EXTENDS_TYPE_CLAUSE.equals(child.type())) {
                collectBases(child, bases, frame);
            }
        }
        if (!bases.isEmpty()) {
            b.attribute("bases", String.join(",", bases));
        }
        if (body != null) {
            walkScope(body, enter(b, frame));
        }
        return b;
    }

    private void collectBases(CstNode clause, List<String> bases, Frame frame) {
        for (var child : clause.namedChildren()) {
            switch (child.type()) {
                case IDENTIFIER, TYPE_IDENTIFIER, MEMBER_EXPRESSION, NESTED_TYPE_IDENTIFIER -> {
                    var baseName = collapse(child.content());
                    bases.add(baseName);
                    addReference(baseName, ReferenceKind.INHERITANCE, child, frame);
                }
                case GENERIC_TYPE -> {
                    var name = child.childByField("name");
                    if (name != null) {
                        bases.add(collapse(name.content()));
                        addReference(collapse(name.content()), ReferenceKind.INHERITANCE, name, frame);
                    }
                }
                case "type_arguments", "arguments" -> {
                    // generic arguments are type uses, not bases
                    collectReferences(child, frame);
                }
                default -> collectBases(child, bases, frame);
            }
        }
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Variables and fields

    @Override
    protected boolean visitVariable(CstNode item, NodeType type, Frame frame, String doc) {
        if (LEXICAL_DECLARATION.equals(item.type()) || VARIABLE_DECLARATION.equals(item.type())) {
            return visitDeclarators(item, frame, doc);
        }
        // class fields and interface property signatures
        var nameNode = item.childByField("name");
        if (nameNode == null) {
            nameNode = item.childByField("property");
        }
        if (nameNode == null) {
            collectReferences(item, frame);
            return false;
        }
        var value = item.childByField("value");
        var typeNode = item.childByField("type");
        var b = declare(NodeType.PROPERTY, stripQuotes(nameNode.content()), item, frame)
                .docstring(doc)
                .signature(signatureBefore(item, null));
        if (typeNode != null) {
            b.attribute("type", typeText(typeNode));
        }
        applyModifiers(item, b);
        collectReferences(typeNode, frame);
        collectReferences(value, frame);
        return true;
    }

    private boolean visitDeclarators(CstNode item, Frame frame, String doc) {
        var kind = "";
        for (var child : item.children()) {
            if (!child.isTrivia()) {
                kind = child.content().strip();
                break;
            }
        }
        boolean consumed = false;
        var declarators = new ArrayList<CstNode>();
        for (var child : item.namedChildren()) {
            if (VARIABLE_DECLARATOR.equals(child.type())) {
                declarators.add(child);
            }
        }
        for (var declarator : declarators) {
            var nameNode = declarator.childByField("name");
            var value = declarator.childByField("value");
            if (nameNode == null) {
                continue;
            }
            var outer = declarators.size() == 1 ? item : declarator;
            var entryDoc = consumed ? "" : doc;
            if (IDENTIFIER.equals(nameNode.type()) && value != null && FUNCTION_VALUES.contains(value.type())) {
                var b = declareCallable(outer, value, NodeType.FUNCTION, nameNode.content(), frame, entryDoc);
                b.attribute("kind", kind);
                if (ARROW_FUNCTION.equals(value.type())) {
                    b.attribute("arrow", "true");
                }
                consumed = true;
                continue;
            }
            if (IDENTIFIER.equals(nameNode.type()) && value != null && CLASS.equals(value.type())) {
                declareClass(outer, value, NodeType.CLASS, nameNode.content(), frame, entryDoc);
                consumed = true;
                continue;
            }
            if (value != null && isRequireCall(value)) {
                var target = requireTarget(value);
                var names = IDENTIFIER.equals(nameNode.type())
                        ? List.of(new ImportDirective.ImportedName("default", nameNode.content()))
                        : List.<ImportDirective.ImportedName>of();
                addImport(new ImportDirective(target, false, names, null, false, 0, item.range()));
            }
            for (var name : boundNames(nameNode)) {
                var b = declare(NodeType.VARIABLE, name, outer, frame)
                        .docstring(entryDoc)
                        .signature(collapse(kind + " " + declarator.content()))
                        .attribute("kind", kind);
                var typeNode = declarator.childByField("type");
                if (typeNode != null) {
                    b.attribute("type", typeText(typeNode));
                }
                entryDoc = "";
                consumed = consumed || !doc.isEmpty();
            }
            collectReferences(declarator.childByField("type"), frame);
            collectReferences(value, frame);
        }
        return consumed;
    }

    private static List<String> boundNames(CstNode pattern) {
        if (IDENTIFIER.equals(pattern.type())) {
            return List.of(pattern.content());
        }
        var names = new ArrayList<String>();
        pattern.visit(n -> {
            if (n != pattern
                    && (IDENTIFIER.equals(n.type()) || "shorthand_property_identifier_pattern".equals(n.type()))) {
                names.add(n.content());
            }
        });
        return names;
    }

    private static boolean isRequireCall(CstNode value) {
        if (!CALL_EXPRESSION.equals(value.type())) {
            return false;
        }
        var fn = value.childByField("function");
        return fn != null && "require".equals(fn.content());
    }

    private static String requireTarget(CstNode call) {
        var args = call.childByField("arguments");
        if (args == null) {
            return "";
        }
        for (var arg : args.namedChildren()) {
            if (STRING.equals(arg.type())) {
                return stripQuotes(arg.content());
            }
        }
        return "";
    }

    // ---------------------------------------------------------------------------------------------------------------
    // TypeScript declarations

    @Override
    protected boolean visitTypedef(CstNode item, Frame frame, String doc) {
        var nameNode = item.childByField("name");
        if (nameNode == null) {
            return false;
        }
        var value = item.childByField("value");
        declare(NodeType.TYPEDEF, nameNode.content(), item, frame)
                .docstring(doc)
                .signature(signatureBefore(item, null))
                .attribute("type", value == null ? "" : collapse(value.content()));
        collectReferences(value, frame);
        return true;
    }

    @Override
    protected boolean visitEnum(CstNode item, Frame frame, String doc) {
        var nameNode = item.childByField("name");
        if (nameNode == null) {
            return false;
        }
        var body = item.childByField("body");
        var b = declare(NodeType.ENUM, nameNode.content(), item, frame)
                .docstring(doc)
                .signature(signatureBefore(item, body));
        if (body != null) {
            var inner = enter(b, frame);
            for (var member : body.namedChildren()) {
                var memberName = ENUM_ASSIGNMENT.equals(member.type()) ? member.childByField("name") : member;
                if (memberName == null || COMMENT.equals(member.type())) {
                    continue;
                }
                declare(NodeType.PROPERTY, stripQuotes(memberName.content()), member, inner)
                        .signature(collapse(member.content()))
                        .attribute("enumerator", "true");
                collectReferences(member.childByField("value"), inner);
            }
        }
        return true;
    }

    @Override
    protected boolean visitNamespace(CstNode item, NodeType type, Frame frame, String doc) {
        var nameNode = item.childByField("name");
        var body = item.childByField("body");
        var b = declare(NodeType.NAMESPACE, nameNode == null ? "" : stripQuotes(nameNode.content()), item, frame)
                .docstring(doc)
                .signature(signatureBefore(item, body));
        if (body != null) {
            walkScope(body, enter(b, frame));
        }
        return true;
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Modules

    @Override
    protected void visitImport(CstNode item, Frame frame) {
        var sourceNode = item.childByField("source");
        String target;
        String moduleAlias = null;
        var names = new ArrayList<ImportDirective.ImportedName>();
        if (sourceNode != null) {
            target = stripQuotes(sourceNode.content());
        } else {
            // import x = require("y")
            var require = item.firstChildOfType("import_require_clause");
            var source = require == null ? null : require.childByField("source");
            if (source == null) {
                return;
            }
            target = stripQuotes(source.content());
            var alias = require.firstChildOfType(IDENTIFIER);
            moduleAlias = alias == null ? null : alias.content();
        }
        var clause = item.firstChildOfType(IMPORT_CLAUSE);
        if (clause != null) {
            for (var part : clause.namedChildren()) {
                switch (part.type()) {
                    case IDENTIFIER -> {
                        names.add(new ImportDirective.ImportedName("default", part.content()));
                        addReference("default", ReferenceKind.IMPORT, part.range(), frame, target);
                    }
                    case NAMESPACE_IMPORT -> {
                        var alias = part.firstChildOfType(IDENTIFIER);
                        moduleAlias = alias == null ? null : alias.content();
                    }
                    case NAMED_IMPORTS -> {
                        for (var spec : part.namedChildren()) {
                            if (!IMPORT_SPECIFIER.equals(spec.type())) {
                                continue;
                            }
                            var n = spec.childByField("name");
                            var a = spec.childByField("alias");
                            if (n == null) {
                                continue;
                            }
                            var imported = new ImportDirective.ImportedName(
                                    stripQuotes(n.content()), a == null ? "" : a.content());
                            names.add(imported);
                            addReference(imported.name(), ReferenceKind.IMPORT, spec.range(), frame, target);
                        }
                    }
                    default -> {
                        // comments
                    }
                }
            }
        }
        emitImportNode(item, target, false, frame);
        addImport(new ImportDirective(target, false, names, moduleAlias, false, 0, item.range()));
    }

    @Override
    protected boolean visitUnmapped(CstNode item, Frame frame, String doc) {
        switch (item.type()) {
            case EXPORT_STATEMENT -> {
                return visitExport(item, frame, doc);
            }
            case EXPRESSION_STATEMENT -> {
                var inner = item.namedChildren();
                if (inner.size() == 1 && rules.semanticType(inner.get(0).type()) == NodeType.NAMESPACE) {
                    return visitItem(inner.get(0), frame, doc);
                }
                return super.visitUnmapped(item, frame, doc);
            }
            default -> {
                return super.visitUnmapped(item, frame, doc);
            }
        }
    }

    private boolean visitExport(CstNode item, Frame frame, String doc) {
        boolean isDefault = item.children().stream().anyMatch(c -> !c.named() && "default".equals(c.content()));
        var source = item.childByField("source");
        if (source != null) {
            // export { a as b } from "./x"
            var target = stripQuotes(source.content());
            var names = new ArrayList<ImportDirective.ImportedName>();
            var clause = item.firstChildOfType("export_clause");
            if (clause != null) {
                for (var spec : clause.namedChildren()) {
                    var n = spec.childByField("name");
                    var a = spec.childByField("alias");
                    if (n != null) {
                        names.add(new ImportDirective.ImportedName(n.content(), a == null ? "" : a.content()));
                    }
                }
            }
            emitImportNode(item, target, false, frame).attribute("reexport", "true");
            addImport(new ImportDirective(target, false, names, null, clause == null, 0, item.range()));
            return false;
        }
        int before = frame.owner.children().size();
        boolean consumed = false;
        var declaration = item.childByField("declaration");
        var value = item.childByField("value");
        if (declaration != null) {
            consumed = visitItem(declaration, frame, doc);
        } else if (value != null && FUNCTION_VALUES.contains(value.type())) {
            var nameNode = value.childByField("name");
            declareCallable(item, value, NodeType.FUNCTION, nameNode == null ? "default" : nameNode.content(), frame, doc);
            consumed = true;
        } else if (value != null && CLASS.equals(value.type())) {
            var nameNode = value.childByField("name");
            declareClass(item, value, NodeType.CLASS, nameNode == null ? "default" : nameNode.content(), frame, doc);
            consumed = true;
        } else {
            collectReferences(item, frame);
        }
        var children = frame.owner.children();
        for (int i = before; i < children.size(); i++) {
            children.get(i).attribute("exported", "true").range(item.range()).rawContent(item.content());
            if (isDefault) {
                children.get(i).attribute("default", "true");
            }
        }
        return consumed;
    }

    // ---------------------------------------------------------------------------------------------------------------
    // References

    @Override
    protected String calleeName(CstNode callee) {
        return switch (callee.type()) {
            case IDENTIFIER -> callee.content();
            case MEMBER_EXPRESSION -> memberChain(callee);
            default -> "";
        };
    }

    /** "a.b.c" for a member chain made only of identifiers, this and property names; "" otherwise. */
    private static String memberChain(CstNode member) {
        var object = member.childByField("object");
        var property = member.childByField("property");
        if (object == null || property == null || !PROPERTY_IDENTIFIER.equals(property.type())) {
            return "";
        }
        String prefix = switch (object.type()) {
            case IDENTIFIER, "this", "super" -> object.content();
            case MEMBER_EXPRESSION -> memberChain(object);
            default -> "";
        };
        return prefix.isEmpty() ? "" : prefix + "." + property.content();
    }

    @Override
    protected boolean referenceHook(CstNode node, Frame frame) {
        if (NEW_EXPRESSION.equals(node.type())) {
            var constructor = node.childByField("constructor");
            if (constructor != null) {
                addReference(calleeName(constructor), ReferenceKind.CALL, constructor, frame);
            }
            collectReferences(node.childByField("arguments"), frame);
            return true;
        }
        if (GENERIC_TYPE.equals(node.type())) {
            var name = node.childByField("name");
            if (name != null) {
                addReference(collapse(name.content()), ReferenceKind.TYPE, name, frame);
            }
            for (var child : node.namedChildren()) {
                if (child != name) {
                    collectReferences(child, frame);
                }
            }
            return true;
        }
        if (NESTED_TYPE_IDENTIFIER.equals(node.type())) {
            addReference(collapse(node.content()), ReferenceKind.TYPE, node, frame);
            return true;
        }
        return false;
    }
}
