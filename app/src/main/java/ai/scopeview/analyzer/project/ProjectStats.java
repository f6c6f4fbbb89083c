package ai.scopeview.analyzer.project;

import ai.scopeview.analyzer.Language;
import java.util.Map;

/** Counts describing one project snapshot. */
public record ProjectStats(
        int files,
        int parsedFiles,
        int failedFiles,
        int partialFiles,
        int astNodes,
        int qualifiedNames,
        int dependencyEdges,
        int references,
        int resolvedReferences,
        int staleFiles,
        int diagnostics,
        Map<Language, Integer> filesByLanguage) {

    public ProjectStats {
        filesByLanguage = Map.copyOf(filesByLanguage);
    }

    @Override
    public String toString() {
        return "%d files (%d parsed, %d failed, %d partial), %d AST nodes, %d names, %d edges, %d/%d references resolved"
                .formatted(
                        files,
                        parsedFiles,
                        failedFiles,
                        partialFiles,
                        astNodes,
                        qualifiedNames,
                        dependencyEdges,
                        resolvedReferences,
                        references);
    }
}
