package ai.scopeview.analyzer.context;

import ai.scopeview.analyzer.Language;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Compressed view of several files sharing one token budget.
 *
 * @param files per-file plans and their rendered text, most relevant file first
 * @param skipped files that did not fit at all
 */
public record ContextWindow(int tokenLimit, List<FileContext> files, List<String> skipped) {
    public record FileContext(String path, Language language, CompressionPlan plan, String text) {
        public int cost() {
            return plan.totalCost();
        }
    }

    public ContextWindow {
        files = List.copyOf(files);
        skipped = List.copyOf(skipped);
    }

    public int totalCost() {
        return files.stream().mapToInt(FileContext::cost).sum();
    }

    /** All files concatenated, each preceded by a comment naming its path. */
    public String render() {
        return files.stream()
                .map(f -> "%s %s\n%s".formatted(
                        f.language() == Language.PYTHON ? "#" : "//", f.path(), f.text()))
                .collect(Collectors.joining("\n\n"));
    }
}
