package ai.scopeview.analyzer;

/**
 * A zero-based line/column span. Columns count UTF-8 bytes, matching what the grammar engine reports. The all-zero
 * range is the "unknown" sentinel.
 */
public record SourceRange(int startLine, int startColumn, int endLine, int endColumn) {
    public static final SourceRange UNKNOWN = new SourceRange(0, 0, 0, 0);

    public SourceRange {
        if (startLine < 0 || startColumn < 0 || endLine < 0 || endColumn < 0) {
            throw new IllegalArgumentException("SourceRange components must be non-negative: %d:%d-%d:%d"
                    .formatted(startLine, startColumn, endLine, endColumn));
        }
    }

    /** Builds a range, clamping negative components to zero. Used when normalizing foreign data. */
    public static SourceRange clamped(int startLine, int startColumn, int endLine, int endColumn) {
        return new SourceRange(
                Math.max(0, startLine), Math.max(0, startColumn), Math.max(0, endLine), Math.max(0, endColumn));
    }

    public boolean isUnknown() {
        return equals(UNKNOWN);
    }

    public boolean containsLine(int line) {
        return line >= startLine && line <= endLine;
    }

    /** Number of lines between {@code line} and this range; zero when the line falls inside it. */
    public int lineDistance(int line) {
        if (line < startLine) {
            return startLine - line;
        }
        if (line > endLine) {
            return line - endLine;
        }
        return 0;
    }

    @Override
    public String toString() {
        return "%d:%d-%d:%d".formatted(startLine, startColumn, endLine, endColumn);
    }
}
