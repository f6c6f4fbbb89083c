package ai.scopeview.analyzer;

/** What a reference site uses the referenced name for. */
public enum ReferenceKind {
    CALL,
    TYPE,
    INHERITANCE,
    IMPORT,
    USE
}
