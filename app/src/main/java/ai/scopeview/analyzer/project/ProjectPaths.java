package ai.scopeview.analyzer.project;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.util.ArrayDeque;
import java.util.Optional;

/**
 * Project-relative paths as used for keys throughout a project: forward slashes, no "." or ".." segments, never
 * absolute.
 */
public final class ProjectPaths {
    private static final Splitter SLASH = Splitter.on('/').omitEmptyStrings();
    private static final Joiner JOINER = Joiner.on('/');

    private ProjectPaths() {}

    /** Normalized form of {@code path}, or empty when it is absolute or climbs above the project root. */
    public static Optional<String> normalize(String path) {
        var unified = path.replace('\\', '/');
        if (unified.isEmpty() || unified.startsWith("/") || (unified.length() > 1 && unified.charAt(1) == ':')) {
            return Optional.empty();
        }
        var segments = new ArrayDeque<String>();
        for (var segment : SLASH.split(unified)) {
            if (segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (segments.isEmpty()) {
                    return Optional.empty();
                }
                segments.removeLast();
                continue;
            }
            segments.addLast(segment);
        }
        return segments.isEmpty() ? Optional.empty() : Optional.of(JOINER.join(segments));
    }

    /** Directory part of a normalized path; "" for files at the root. */
    public static String parent(String path) {
        int idx = path.lastIndexOf('/');
        return idx < 0 ? "" : path.substring(0, idx);
    }

    /** {@code base/relative}, normalized. */
    public static Optional<String> resolve(String base, String relative) {
        return normalize(base.isEmpty() ? relative : base + "/" + relative);
    }
}
