package ai.scopeview.analyzer;

/**
 * Canonical semantic node types. The set is closed: every per-language rule maps grammar constructs onto one of these,
 * and code that switches over it is expected to be exhaustive.
 */
public enum NodeType {
    ROOT,
    FUNCTION,
    METHOD,
    CLASS,
    STRUCT,
    UNION,
    ENUM,
    INTERFACE,
    NAMESPACE,
    MODULE,
    VARIABLE,
    PROPERTY,
    TYPEDEF,
    MACRO,
    USING,
    LAMBDA,
    INCLUDE,
    IMPORT,
    COMMENT,
    DOCSTRING,
    UNKNOWN;

    /** Types that introduce a new lexical scope for their children. */
    public boolean opensScope() {
        return switch (this) {
            case ROOT, FUNCTION, METHOD, LAMBDA, CLASS, STRUCT, UNION, ENUM, INTERFACE, NAMESPACE, MODULE -> true;
            case VARIABLE, PROPERTY, TYPEDEF, MACRO, USING, INCLUDE, IMPORT, COMMENT, DOCSTRING, UNKNOWN -> false;
        };
    }

    public boolean isFunctionLike() {
        return this == FUNCTION || this == METHOD || this == LAMBDA;
    }

    public boolean isClassLike() {
        return switch (this) {
            case CLASS, STRUCT, UNION, ENUM, INTERFACE -> true;
            default -> false;
        };
    }

    /** True when the node has a meaningful "signature only" rendering. */
    public boolean hasSummaryForm() {
        return switch (this) {
            case ROOT, FUNCTION, METHOD, LAMBDA, CLASS, STRUCT, UNION, ENUM, INTERFACE, NAMESPACE, MODULE -> true;
            case VARIABLE, PROPERTY, TYPEDEF, MACRO, USING, INCLUDE, IMPORT, COMMENT, DOCSTRING, UNKNOWN -> false;
        };
    }
}
