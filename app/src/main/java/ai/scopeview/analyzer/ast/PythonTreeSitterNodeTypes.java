package ai.scopeview.analyzer.ast;

/** tree-sitter-python node types. */
public class PythonTreeSitterNodeTypes {

    public static final String MODULE = "module";
    public static final String COMMENT = "comment";

    // Definitions
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String CLASS_DEFINITION = "class_definition";
    public static final String DECORATED_DEFINITION = "decorated_definition";
    public static final String DECORATOR = "decorator";
    public static final String BLOCK = "block";

    // Imports
    public static final String IMPORT_STATEMENT = "import_statement";
    public static final String IMPORT_FROM_STATEMENT = "import_from_statement";
    public static final String FUTURE_IMPORT_STATEMENT = "future_import_statement";
    public static final String ALIASED_IMPORT = "aliased_import";
    public static final String DOTTED_NAME = "dotted_name";
    public static final String RELATIVE_IMPORT = "relative_import";
    public static final String IMPORT_PREFIX = "import_prefix";
    public static final String WILDCARD_IMPORT = "wildcard_import";

    // Statements and expressions
    public static final String EXPRESSION_STATEMENT = "expression_statement";
    public static final String ASSIGNMENT = "assignment";
    public static final String AUGMENTED_ASSIGNMENT = "augmented_assignment";
    public static final String STRING = "string";
    public static final String STRING_CONTENT = "string_content";
    public static final String CALL = "call";
    public static final String ATTRIBUTE = "attribute";
    public static final String IDENTIFIER = "identifier";
    public static final String KEYWORD_ARGUMENT = "keyword_argument";

    // Parameters
    public static final String TYPED_PARAMETER = "typed_parameter";
    public static final String DEFAULT_PARAMETER = "default_parameter";
    public static final String TYPED_DEFAULT_PARAMETER = "typed_default_parameter";
    public static final String LIST_SPLAT_PATTERN = "list_splat_pattern";
    public static final String DICTIONARY_SPLAT_PATTERN = "dictionary_splat_pattern";

    private PythonTreeSitterNodeTypes() {}
}
