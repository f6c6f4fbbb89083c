package ai.scopeview.analyzer.ast;

/** Where a language keeps the documentation of a declaration. */
public enum DocstringStyle {
    /** The first statement of the body is a string literal (Python). */
    FIRST_STRING_STATEMENT,
    /** A {@code /** ... *&#47;} block or a run of {@code //} comments directly above the declaration. */
    PRECEDING_COMMENT
}
