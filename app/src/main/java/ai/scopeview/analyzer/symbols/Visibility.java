package ai.scopeview.analyzer.symbols;

/** How far a symbol can be seen from its declaration. */
public enum Visibility {
    /** Declared inside a function body or parameter list. */
    LOCAL,
    /** Confined to the declaring file: C/C++ {@code static}, anonymous namespaces. */
    FILE,
    /** Visible to files that import the declaring module (Python, JavaScript, TypeScript). */
    MODULE,
    /** Linked across translation units (C, C++). */
    GLOBAL;

    public boolean crossesFiles() {
        return this == MODULE || this == GLOBAL;
    }
}
