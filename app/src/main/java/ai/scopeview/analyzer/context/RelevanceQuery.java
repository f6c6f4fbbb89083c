package ai.scopeview.analyzer.context;

import java.util.Map;
import java.util.Set;

/**
 * What the user is looking at when a context is requested.
 *
 * @param cursorFile project-relative path of the file holding the cursor, empty when there is none
 * @param cursorLine zero-based cursor line, negative when unknown
 * @param text free-text query matched against names, signatures and docstrings
 * @param focus qualified or simple names the user explicitly focused on
 * @param recency per-file recency in [0, 1], 1 being the file touched last
 */
public record RelevanceQuery(
        String cursorFile, int cursorLine, String text, Set<String> focus, Map<String, Double> recency) {
    public static final RelevanceQuery NONE = new RelevanceQuery("", -1, "", Set.of(), Map.of());

    public RelevanceQuery {
        cursorFile = cursorFile == null ? "" : cursorFile;
        text = text == null ? "" : text;
        focus = focus == null ? Set.of() : Set.copyOf(focus);
        recency = recency == null ? Map.of() : Map.copyOf(recency);
    }

    public static RelevanceQuery atCursor(String file, int line) {
        return new RelevanceQuery(file, line, "", Set.of(), Map.of());
    }

    public RelevanceQuery withText(String text) {
        return new RelevanceQuery(cursorFile, cursorLine, text, focus, recency);
    }

    public RelevanceQuery withFocus(Set<String> focus) {
        return new RelevanceQuery(cursorFile, cursorLine, text, focus, recency);
    }

    public RelevanceQuery withRecency(Map<String, Double> recency) {
        return new RelevanceQuery(cursorFile, cursorLine, text, focus, recency);
    }

    public boolean hasCursor() {
        return !cursorFile.isEmpty() && cursorLine >= 0;
    }
}
