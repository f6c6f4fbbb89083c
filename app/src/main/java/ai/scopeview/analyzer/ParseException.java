package ai.scopeview.analyzer;

import java.util.List;

/** Thrown when a file cannot be turned into a parse result at all. Carries whatever diagnostics were collected. */
public class ParseException extends RuntimeException {
    private final List<Diagnostic> diagnostics;

    public ParseException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public ParseException(String message, List<Diagnostic> diagnostics, Throwable cause) {
        super(message, cause);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
