package ai.scopeview.analyzer;

import java.util.Objects;

/**
 * A non-fatal finding attached to a parse result, symbol table, project or compression plan. Diagnostics are collected
 * rather than thrown so that one bad file or node never aborts a larger operation.
 */
public record Diagnostic(Severity severity, Code code, String message, SourceRange range, String path) {
    public enum Severity {
        INFO,
        WARNING,
        ERROR
    }

    public enum Code {
        SYNTAX_ERROR,
        MISSING_NODE,
        GRAMMAR_UNAVAILABLE,
        SCHEMA_VIOLATION,
        REDECLARATION,
        BUDGET_INFEASIBLE,
        TOO_MANY_FILES,
        INVALID_PATH,
        IO_ERROR,
        RESOLUTION_FAILED
    }

    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(code, "code");
        message = Objects.requireNonNullElse(message, "");
        range = Objects.requireNonNullElse(range, SourceRange.UNKNOWN);
        path = Objects.requireNonNullElse(path, "");
    }

    public static Diagnostic error(Code code, String message, SourceRange range, String path) {
        return new Diagnostic(Severity.ERROR, code, message, range, path);
    }

    public static Diagnostic warning(Code code, String message, SourceRange range, String path) {
        return new Diagnostic(Severity.WARNING, code, message, range, path);
    }

    public static Diagnostic warning(Code code, String message) {
        return new Diagnostic(Severity.WARNING, code, message, SourceRange.UNKNOWN, "");
    }

    @Override
    public String toString() {
        var where = path.isEmpty() ? "" : path + ":";
        return "%s %s%s %s: %s".formatted(severity, where, range, code, message);
    }
}
