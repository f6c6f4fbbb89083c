package ai.scopeview.analyzer.ast;

/** tree-sitter-c node types. C++ reuses all of them. */
public class CTreeSitterNodeTypes {

    // Top level
    public static final String TRANSLATION_UNIT = "translation_unit";
    public static final String COMMENT = "comment";

    // Preprocessor
    public static final String PREPROC_INCLUDE = "preproc_include";
    public static final String PREPROC_DEF = "preproc_def";
    public static final String PREPROC_FUNCTION_DEF = "preproc_function_def";
    public static final String PREPROC_PARAMS = "preproc_params";
    public static final String PREPROC_IF = "preproc_if";
    public static final String PREPROC_IFDEF = "preproc_ifdef";
    public static final String PREPROC_ELSE = "preproc_else";
    public static final String PREPROC_ELIF = "preproc_elif";
    public static final String PREPROC_ELIFDEF = "preproc_elifdef";
    public static final String SYSTEM_LIB_STRING = "system_lib_string";
    public static final String STRING_LITERAL = "string_literal";

    // Declarations
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String DECLARATION = "declaration";
    public static final String TYPE_DEFINITION = "type_definition";
    public static final String STRUCT_SPECIFIER = "struct_specifier";
    public static final String UNION_SPECIFIER = "union_specifier";
    public static final String ENUM_SPECIFIER = "enum_specifier";
    public static final String FIELD_DECLARATION = "field_declaration";
    public static final String FIELD_DECLARATION_LIST = "field_declaration_list";
    public static final String ENUMERATOR_LIST = "enumerator_list";
    public static final String ENUMERATOR = "enumerator";
    public static final String STORAGE_CLASS_SPECIFIER = "storage_class_specifier";
    public static final String TYPE_QUALIFIER = "type_qualifier";

    // Declarators
    public static final String FUNCTION_DECLARATOR = "function_declarator";
    public static final String POINTER_DECLARATOR = "pointer_declarator";
    public static final String ARRAY_DECLARATOR = "array_declarator";
    public static final String PARENTHESIZED_DECLARATOR = "parenthesized_declarator";
    public static final String INIT_DECLARATOR = "init_declarator";
    public static final String PARAMETER_LIST = "parameter_list";
    public static final String PARAMETER_DECLARATION = "parameter_declaration";
    public static final String VARIADIC_PARAMETER = "variadic_parameter";

    // Identifiers and types
    public static final String IDENTIFIER = "identifier";
    public static final String FIELD_IDENTIFIER = "field_identifier";
    public static final String TYPE_IDENTIFIER = "type_identifier";
    public static final String PRIMITIVE_TYPE = "primitive_type";

    // Statements and expressions
    public static final String COMPOUND_STATEMENT = "compound_statement";
    public static final String CALL_EXPRESSION = "call_expression";
    public static final String FIELD_EXPRESSION = "field_expression";

    private CTreeSitterNodeTypes() {}
}
