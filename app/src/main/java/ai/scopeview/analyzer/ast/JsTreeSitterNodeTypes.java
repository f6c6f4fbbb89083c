package ai.scopeview.analyzer.ast;

/** tree-sitter-javascript node types, plus the TypeScript-only ones that the TypeScript grammar adds. */
public class JsTreeSitterNodeTypes {

    public static final String PROGRAM = "program";
    public static final String COMMENT = "comment";

    // Modules
    public static final String IMPORT_STATEMENT = "import_statement";
    public static final String IMPORT_CLAUSE = "import_clause";
    public static final String NAMED_IMPORTS = "named_imports";
    public static final String IMPORT_SPECIFIER = "import_specifier";
    public static final String NAMESPACE_IMPORT = "namespace_import";
    public static final String EXPORT_STATEMENT = "export_statement";

    // Functions
    public static final String FUNCTION_DECLARATION = "function_declaration";
    public static final String GENERATOR_FUNCTION_DECLARATION = "generator_function_declaration";
    public static final String FUNCTION_EXPRESSION = "function_expression";
    public static final String FUNCTION = "function";
    public static final String ARROW_FUNCTION = "arrow_function";
    public static final String METHOD_DEFINITION = "method_definition";
    public static final String FORMAL_PARAMETERS = "formal_parameters";
    public static final String ASSIGNMENT_PATTERN = "assignment_pattern";
    public static final String REST_PATTERN = "rest_pattern";

    // Classes
    public static final String CLASS_DECLARATION = "class_declaration";
    public static final String CLASS = "class";
    public static final String CLASS_HERITAGE = "class_heritage";
    public static final String CLASS_BODY = "class_body";
    public static final String FIELD_DEFINITION = "field_definition";

    // Variables
    public static final String LEXICAL_DECLARATION = "lexical_declaration";
    public static final String VARIABLE_DECLARATION = "variable_declaration";
    public static final String VARIABLE_DECLARATOR = "variable_declarator";

    // Expressions
    public static final String CALL_EXPRESSION = "call_expression";
    public static final String NEW_EXPRESSION = "new_expression";
    public static final String MEMBER_EXPRESSION = "member_expression";
    public static final String IDENTIFIER = "identifier";
    public static final String PROPERTY_IDENTIFIER = "property_identifier";
    public static final String STRING = "string";
    public static final String STRING_FRAGMENT = "string_fragment";
    public static final String STATEMENT_BLOCK = "statement_block";
    public static final String EXPRESSION_STATEMENT = "expression_statement";

    // TypeScript
    public static final String FUNCTION_SIGNATURE = "function_signature";
    public static final String ABSTRACT_CLASS_DECLARATION = "abstract_class_declaration";
    public static final String INTERFACE_DECLARATION = "interface_declaration";
    public static final String EXTENDS_TYPE_CLAUSE = "extends_type_clause";
    public static final String EXTENDS_CLAUSE = "extends_clause";
    public static final String IMPLEMENTS_CLAUSE = "implements_clause";
    public static final String TYPE_ALIAS_DECLARATION = "type_alias_declaration";
    public static final String ENUM_DECLARATION = "enum_declaration";
    public static final String ENUM_BODY = "enum_body";
    public static final String ENUM_ASSIGNMENT = "enum_assignment";
    public static final String INTERNAL_MODULE = "internal_module";
    public static final String MODULE = "module";
    public static final String AMBIENT_DECLARATION = "ambient_declaration";
    public static final String PUBLIC_FIELD_DEFINITION = "public_field_definition";
    public static final String METHOD_SIGNATURE = "method_signature";
    public static final String ABSTRACT_METHOD_SIGNATURE = "abstract_method_signature";
    public static final String PROPERTY_SIGNATURE = "property_signature";
    public static final String ACCESSIBILITY_MODIFIER = "accessibility_modifier";
    public static final String REQUIRED_PARAMETER = "required_parameter";
    public static final String OPTIONAL_PARAMETER = "optional_parameter";
    public static final String TYPE_ANNOTATION = "type_annotation";
    public static final String TYPE_IDENTIFIER = "type_identifier";
    public static final String GENERIC_TYPE = "generic_type";
    public static final String NESTED_TYPE_IDENTIFIER = "nested_type_identifier";

    private JsTreeSitterNodeTypes() {}
}
