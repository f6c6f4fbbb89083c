package ai.scopeview.analyzer.ast;

import static ai.scopeview.analyzer.ast.CTreeSitterNodeTypes.*;

import ai.scopeview.analyzer.AstNode;
import ai.scopeview.analyzer.CstNode;
import ai.scopeview.analyzer.ImportDirective;
import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.NodeType;
import ai.scopeview.analyzer.Parameter;
import ai.scopeview.analyzer.ReferenceKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/** AST construction for C. The C++ builder extends this one, since the C++ grammar is a superset. */
public class CAstBuilder extends AstBuilder {

    static final Map<String, NodeType> C_NODE_TYPES = Map.of(
            FUNCTION_DEFINITION, NodeType.FUNCTION,
            DECLARATION, NodeType.VARIABLE,
            FIELD_DECLARATION, NodeType.PROPERTY,
            TYPE_DEFINITION, NodeType.TYPEDEF,
            STRUCT_SPECIFIER, NodeType.STRUCT,
            UNION_SPECIFIER, NodeType.UNION,
            ENUM_SPECIFIER, NodeType.ENUM,
            PREPROC_DEF, NodeType.MACRO,
            PREPROC_FUNCTION_DEF, NodeType.MACRO,
            PREPROC_INCLUDE, NodeType.INCLUDE);

    static final Set<String> C_TRANSPARENT_TYPES = Set.of(
            PREPROC_IF,
            PREPROC_IFDEF,
            PREPROC_ELSE,
            PREPROC_ELIF,
            PREPROC_ELIFDEF,
            COMPOUND_STATEMENT,
            "if_statement",
            "else_clause",
            "for_statement",
            "while_statement",
            "do_statement",
            "switch_statement",
            "case_statement",
            "labeled_statement");

    static final ComplianceRules RULES = new ComplianceRules(
            Language.C,
            C_NODE_TYPES,
            C_TRANSPARENT_TYPES,
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
            Set.of("static", "extern", "inline"));

    /** Declarator wrappers that are unwrapped on the way to the declared name. */
    private static final Set<String> DECLARATOR_WRAPPERS = Set.of(
            POINTER_DECLARATOR,
            ARRAY_DECLARATOR,
            PARENTHESIZED_DECLARATOR,
            INIT_DECLARATOR,
            FUNCTION_DECLARATOR,
            "attributed_declarator",
            "reference_declarator");

    public CAstBuilder() {
        this(RULES);
    }

    protected CAstBuilder(ComplianceRules rules) {
        super(rules);
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Functions

    @Override
    protected boolean visitFunction(CstNode item, NodeType type, Frame frame, String doc) {
        var declarator = item.childByField("declarator");
        var fd = functionDeclarator(declarator);
        if (fd == null) {
            collectReferences(item, frame);
            return false;
        }
        var body = item.childByField("body");
        var b = declareFunction(item, fd, frame, body != null);
        b.docstring(doc)
                .signature(signatureBefore(item, body))
                .returnType(returnType(item, declarator));
        var inner = enter(b, frame);
        recordTypeReference(item.childByField("type"), frame);
        recordParameterTypes(fd.childByField("parameters"), inner);
        if (body != null) {
            walkScope(body, inner);
        }
        return true;
    }

    /** Creates the FUNCTION/METHOD node for a definition or prototype with function declarator {@code fd}. */
    protected AstNode.Builder declareFunction(CstNode item, CstNode fd, Frame frame, boolean definition) {
        var name = declaratorName(fd);
        var type = frame.ownerType.isClassLike() ? NodeType.METHOD : NodeType.FUNCTION;
        var b = declare(type, name, item, frame)
                .parameters(parameters(fd.childByField("parameters")))
                .attribute("definition", Boolean.toString(definition));
        applyStorageClass(item, b);
        return b;
    }

    /** The function declarator under {@code declarator}, or null when it declares something else. */
    protected static @Nullable CstNode functionDeclarator(@Nullable CstNode declarator) {
        var current = declarator;
        while (current != null) {
            switch (current.type()) {
                case FUNCTION_DECLARATOR -> {
                    var inner = current.childByField("declarator");
                    // int (*fp)(int) declares a pointer, not a function
                    return inner != null && PARENTHESIZED_DECLARATOR.equals(inner.type()) ? null : current;
                }
                case POINTER_DECLARATOR, "reference_declarator", "attributed_declarator" -> current = inner(current);
                default -> {
                    return null;
                }
            }
        }
        return null;
    }

    private static @Nullable CstNode inner(CstNode declarator) {
        var next = declarator.childByField("declarator");
        if (next != null) {
            return next;
        }
        var named = declarator.namedChildren();
        return named.isEmpty() ? null : named.get(named.size() - 1);
    }

    /** Name declared by a declarator chain. */
    protected String declaratorName(@Nullable CstNode declarator) {
        var current = declarator;
        while (current != null) {
            if (isNameNode(current)) {
                return nameText(current);
            }
            if (!DECLARATOR_WRAPPERS.contains(current.type())) {
                return "";
            }
            current = inner(current);
        }
        return "";
    }

    protected boolean isNameNode(CstNode node) {
        return switch (node.type()) {
            case IDENTIFIER, FIELD_IDENTIFIER, TYPE_IDENTIFIER -> true;
            default -> false;
        };
    }

    protected String nameText(CstNode nameNode) {
        return collapse(nameNode.content());
    }

    /** Declared type: leading qualifiers, the type specifier, and one '*' or '&' per wrapping declarator. */
    protected String returnType(CstNode item, @Nullable CstNode declarator) {
        var parts = new ArrayList<String>();
        for (var child : item.children()) {
            if (TYPE_QUALIFIER.equals(child.type())) {
                parts.add(child.content());
            }
            if (child.field().equals("type")) {
                parts.add(collapse(child.content()));
                break;
            }
        }
        return String.join(" ", parts) + pointerSuffix(declarator);
    }

    private String pointerSuffix(@Nullable CstNode declarator) {
        var suffix = new StringBuilder();
        var current = declarator;
        while (current != null && DECLARATOR_WRAPPERS.contains(current.type())) {
            if (FUNCTION_DECLARATOR.equals(current.type())) {
                break;
            }
            if (POINTER_DECLARATOR.equals(current.type())) {
                suffix.append('*');
            } else if ("reference_declarator".equals(current.type())) {
                suffix.append(current.content().strip().startsWith("&&") ? "&&" : "&");
            }
            current = inner(current);
        }
        return suffix.toString();
    }

    protected List<Parameter> parameters(@Nullable CstNode parameterList) {
        if (parameterList == null) {
            return List.of();
        }
        var result = new ArrayList<Parameter>();
        for (var param : parameterList.namedChildren()) {
            switch (param.type()) {
                case PARAMETER_DECLARATION, "optional_parameter_declaration" -> {
                    var declarator = param.childByField("declarator");
                    var typeNode = param.childByField("type");
                    if (declarator == null) {
                        // f(void) has no parameters
                        if (typeNode != null && "void".equals(typeNode.content().strip())) {
                            continue;
                        }
                        result.add(Parameter.of("", collapse(param.content()), ""));
                        continue;
                    }
                    var name = declaratorName(declarator);
                    var defaultNode = param.childByField("default_value");
                    result.add(Parameter.of(name, parameterType(param, name, defaultNode), defaultText(defaultNode)));
                }
                case VARIADIC_PARAMETER, "variadic_parameter_declaration" -> result.add(Parameter.of(
                        "...", collapse(param.content()), ""));
                case IDENTIFIER -> result.add(Parameter.named(param.content()));
                default -> {
                    // comments and preprocessor noise inside parameter lists
                }
            }
        }
        return result;
    }

    private static String parameterType(CstNode param, String name, @Nullable CstNode defaultNode) {
        var text = param.content();
        if (defaultNode != null) {
            int eq = text.lastIndexOf('=');
            if (eq > 0) {
                text = text.substring(0, eq);
            }
        }
        if (!name.isEmpty()) {
            int idx = text.lastIndexOf(name);
            if (idx >= 0) {
                text = text.substring(0, idx) + text.substring(idx + name.length());
            }
        }
        return collapse(text).replace(" *", "*").replace(" &", "&");
    }

    private static String defaultText(@Nullable CstNode defaultNode) {
        return defaultNode == null ? "" : collapse(defaultNode.content());
    }

    private void recordParameterTypes(@Nullable CstNode parameterList, Frame inner) {
        if (parameterList == null) {
            return;
        }
        for (var param : parameterList.namedChildren()) {
            recordTypeReference(param.childByField("type"), inner);
            collectReferences(param.childByField("default_value"), inner);
        }
    }

    protected void applyStorageClass(CstNode item, AstNode.Builder b) {
        for (var child : item.children()) {
            if (STORAGE_CLASS_SPECIFIER.equals(child.type())) {
                var keyword = child.content().strip();
                if (rules.modifierTokens().contains(keyword)) {
                    b.attribute(keyword, "true");
                }
            }
        }
    }

    /** Records a TYPE reference for a type specifier, visiting inline struct/union/enum definitions. */
    protected void recordTypeReference(@Nullable CstNode typeNode, Frame frame) {
        if (typeNode == null) {
            return;
        }
        switch (typeNode.type()) {
            case STRUCT_SPECIFIER, UNION_SPECIFIER, ENUM_SPECIFIER -> {
                var name = typeNode.childByField("name");
                if (name != null) {
                    addReference(collapse(name.content()), ReferenceKind.TYPE, name, frame);
                }
            }
            default -> collectReferences(typeNode, frame);
        }
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Variables, fields and prototypes

    @Override
    protected boolean visitVariable(CstNode item, NodeType type, Frame frame, String doc) {
        var typeNode = item.childByField("type");
        boolean consumed = false;
        if (typeNode != null && typeNode.childByField("body") != null && rules.semanticType(typeNode.type()) != null) {
            consumed = visitItem(typeNode, frame, doc);
        } else {
            recordTypeReference(typeNode, frame);
        }
        var declarators = item.childrenByField("declarator");
        for (var declarator : declarators) {
            var fd = functionDeclarator(declarator);
            AstNode.Builder b;
            if (fd != null) {
                b = declareFunction(item, fd, frame, false)
                        .signature(signatureBefore(item, null))
                        .returnType(returnType(item, declarator));
                recordParameterTypes(fd.childByField("parameters"), enter(b, frame));
            } else {
                var name = declaratorName(declarator);
                if (name.isEmpty()) {
                    collectReferences(declarator, frame);
                    continue;
                }
                var varType = frame.ownerType.isClassLike() ? NodeType.PROPERTY : type;
                b = declare(varType, name, item, frame)
                        .signature(variableSignature(item, declarator))
                        .attribute("type", returnType(item, declarator));
                applyStorageClass(item, b);
                if (INIT_DECLARATOR.equals(declarator.type())) {
                    collectReferences(declarator.childByField("value"), frame);
                } else {
                    collectReferences(declarator.childByField("default_value"), frame);
                }
            }
            if (!consumed && !doc.isEmpty()) {
                b.docstring(doc);
                consumed = true;
            }
        }
        return consumed;
    }

    private static String variableSignature(CstNode item, CstNode declarator) {
        var sb = new StringBuilder();
        for (var child : item.children()) {
            if (child.field().equals("declarator")) {
                break;
            }
            sb.append(child.content());
        }
        var namepart = INIT_DECLARATOR.equals(declarator.type())
                ? declarator.childByField("declarator")
                : declarator;
        sb.append(' ').append(namepart == null ? "" : namepart.content());
        return collapse(sb.toString());
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Records, enums, typedefs

    @Override
    protected boolean visitClass(CstNode item, NodeType type, Frame frame, String doc) {
        var body = item.childByField("body");
        if (body == null) {
            recordTypeReference(item, frame);
            return false;
        }
        var nameNode = item.childByField("name");
        var name = nameNode == null ? "" : nameText(nameNode);
        declareRecord(item, type, name, frame, doc);
        return true;
    }

    /** Declares a struct/union/class with a body and walks its members. */
    protected AstNode.Builder declareRecord(CstNode item, NodeType type, String name, Frame frame, String doc) {
        var body = item.childByField("body");
        var b = declare(type, name, item, frame).docstring(doc).signature(signatureBefore(item, body));
        if (body != null) {
            walkScope(body, enter(b, frame));
        }
        return b;
    }

    @Override
    protected boolean visitEnum(CstNode item, Frame frame, String doc) {
        var body = item.childByField("body");
        if (body == null) {
            recordTypeReference(item, frame);
            return false;
        }
        var nameNode = item.childByField("name");
        declareEnum(item, nameNode == null ? "" : nameText(nameNode), frame, doc);
        return true;
    }

    protected AstNode.Builder declareEnum(CstNode item, String name, Frame frame, String doc) {
        var body = item.childByField("body");
        var b = declare(NodeType.ENUM, name, item, frame).docstring(doc).signature(signatureBefore(item, body));
        if (body != null) {
            var inner = enter(b, frame);
            for (var enumerator : body.namedChildren()) {
                if (!ENUMERATOR.equals(enumerator.type())) {
                    continue;
                }
                var enumName = enumerator.childByField("name");
                if (enumName != null) {
                    declare(NodeType.PROPERTY, enumName.content(), enumerator, inner)
                            .signature(collapse(enumerator.content()))
                            .attribute("enumerator", "true");
                    collectReferences(enumerator.childByField("value"), inner);
                }
            }
        }
        return b;
    }

    @Override
    protected boolean visitTypedef(CstNode item, Frame frame, String doc) {
        var typeNode = item.childByField("type");
        var declarators = item.childrenByField("declarator");
        if (declarators.isEmpty()) {
            collectReferences(item, frame);
            return false;
        }
        var aliasName = declaratorName(declarators.get(0));
        boolean hasBody = typeNode != null && typeNode.childByField("body") != null;
        if (hasBody && typeNode.childByField("name") == null) {
            // typedef struct { ... } Name; the struct takes the alias name
            var recordType = rules.semanticType(typeNode.type());
            var b = recordType == NodeType.ENUM
                    ? declareEnum(typeNode, aliasName, frame, doc)
                    : declareRecord(typeNode, recordType == null ? NodeType.STRUCT : recordType, aliasName, frame, doc);
            b.range(item.range()).rawContent(item.content()).attribute("typedef", "true");
            for (int i = 1; i < declarators.size(); i++) {
                declareAlias(item, declarators.get(i), typeNode, frame, "");
            }
            return true;
        }
        boolean consumed = false;
        if (hasBody) {
            consumed = visitItem(typeNode, frame, doc);
        } else {
            recordTypeReference(typeNode, frame);
        }
        for (var declarator : declarators) {
            declareAlias(item, declarator, typeNode, frame, consumed ? "" : doc);
            consumed = true;
        }
        return true;
    }

    private void declareAlias(CstNode item, CstNode declarator, @Nullable CstNode typeNode, Frame frame, String doc) {
        var aliased = "";
        if (typeNode != null) {
            var typeName = typeNode.childByField("name");
            aliased = typeNode.childByField("body") != null && typeName != null
                    ? typeNode.type().replace("_specifier", "") + " " + typeName.content()
                    : collapse(typeNode.content());
        }
        declare(NodeType.TYPEDEF, declaratorName(declarator), item, frame)
                .docstring(doc)
                .signature(signatureBefore(item, null))
                .attribute("type", aliased + pointerSuffix(declarator));
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Preprocessor

    @Override
    protected boolean visitMacro(CstNode item, Frame frame, String doc) {
        var nameNode = item.childByField("name");
        if (nameNode == null) {
            return false;
        }
        var value = item.childByField("value");
        var b = declare(NodeType.MACRO, nameNode.content(), item, frame)
                .docstring(doc)
                .signature(signatureBefore(item, value));
        var params = item.childByField("parameters");
        if (params != null) {
            for (var p : params.namedChildren()) {
                b.addParameter(Parameter.named(p.content()));
            }
            if (params.content().contains("...")) {
                b.addParameter(Parameter.named("..."));
            }
        }
        return true;
    }

    @Override
    protected void visitImport(CstNode item, Frame frame) {
        var pathNode = item.childByField("path");
        if (pathNode == null) {
            return;
        }
        boolean system = SYSTEM_LIB_STRING.equals(pathNode.type());
        var target = stripQuotes(pathNode.content());
        emitImportNode(item, target, system, frame);
        addImport(ImportDirective.include(target, system, item.range()));
    }
}
