package ai.scopeview.analyzer.ast;

/** tree-sitter-cpp node types beyond the C grammar. */
public class CppTreeSitterNodeTypes {

    // Scopes
    public static final String NAMESPACE_DEFINITION = "namespace_definition";
    public static final String NESTED_NAMESPACE_SPECIFIER = "nested_namespace_specifier";
    public static final String DECLARATION_LIST = "declaration_list";
    public static final String LINKAGE_SPECIFICATION = "linkage_specification";

    // Class-like
    public static final String CLASS_SPECIFIER = "class_specifier";
    public static final String BASE_CLASS_CLAUSE = "base_class_clause";
    public static final String ACCESS_SPECIFIER = "access_specifier";
    public static final String FRIEND_DECLARATION = "friend_declaration";

    // Templates and aliases
    public static final String TEMPLATE_DECLARATION = "template_declaration";
    public static final String TEMPLATE_PARAMETER_LIST = "template_parameter_list";
    public static final String TEMPLATE_TYPE = "template_type";
    public static final String TEMPLATE_FUNCTION = "template_function";
    public static final String USING_DECLARATION = "using_declaration";
    public static final String ALIAS_DECLARATION = "alias_declaration";

    // Names
    public static final String QUALIFIED_IDENTIFIER = "qualified_identifier";
    public static final String NAMESPACE_IDENTIFIER = "namespace_identifier";
    public static final String DESTRUCTOR_NAME = "destructor_name";
    public static final String OPERATOR_NAME = "operator_name";
    public static final String REFERENCE_DECLARATOR = "reference_declarator";
    public static final String OPTIONAL_PARAMETER_DECLARATION = "optional_parameter_declaration";

    private CppTreeSitterNodeTypes() {}
}
