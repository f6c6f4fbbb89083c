package ai.scopeview.analyzer.resolve;

public enum ResolutionStatus {
    RESOLVED,
    NOT_FOUND,
    /** Declarations in more than one file matched; the first in stable order was chosen. */
    AMBIGUOUS
}
