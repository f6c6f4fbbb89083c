package ai.scopeview.analyzer.project;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Settings of a {@link ProjectContext}. Can be read from a {@code scopeview.properties} file; unparseable values are
 * logged and replaced by their default.
 *
 * @param maxFiles files beyond this count are refused with a TOO_MANY_FILES diagnostic
 * @param parseThreads size of the pool used by parseAll and resolveAll
 * @param includePaths extra directories, relative to the project root, searched for C and C++ includes
 * @param summaryCost token cost charged for a node kept as a summary
 */
public record ProjectConfig(int maxFiles, int parseThreads, List<String> includePaths, int summaryCost) {
    private static final Logger log = LogManager.getLogger(ProjectConfig.class);

    public static final String FILE_NAME = "scopeview.properties";

    public static final String PROP_MAX_FILES = "project.maxFiles";
    public static final String PROP_PARSE_THREADS = "project.parseThreads";
    public static final String PROP_INCLUDE_PATHS = "project.includePaths";
    public static final String PROP_SUMMARY_COST = "context.summaryCost";

    public static final int DEFAULT_MAX_FILES = 10_000;
    public static final int DEFAULT_SUMMARY_COST = 8;

    public ProjectConfig {
        if (maxFiles <= 0) {
            throw new IllegalArgumentException("maxFiles must be positive: " + maxFiles);
        }
        if (parseThreads <= 0) {
            throw new IllegalArgumentException("parseThreads must be positive: " + parseThreads);
        }
        if (summaryCost < 0) {
            throw new IllegalArgumentException("summaryCost must not be negative: " + summaryCost);
        }
        includePaths = List.copyOf(includePaths);
    }

    public static ProjectConfig defaults() {
        return new ProjectConfig(DEFAULT_MAX_FILES, defaultThreads(), List.of(), DEFAULT_SUMMARY_COST);
    }

    public ProjectConfig withMaxFiles(int maxFiles) {
        return new ProjectConfig(maxFiles, parseThreads, includePaths, summaryCost);
    }

    public ProjectConfig withParseThreads(int parseThreads) {
        return new ProjectConfig(maxFiles, parseThreads, includePaths, summaryCost);
    }

    public ProjectConfig withIncludePaths(List<String> includePaths) {
        return new ProjectConfig(maxFiles, parseThreads, includePaths, summaryCost);
    }

    public static ProjectConfig fromProperties(Properties props) {
        var defaults = defaults();
        var includes = props.getProperty(PROP_INCLUDE_PATHS);
        return new ProjectConfig(
                positiveInt(props, PROP_MAX_FILES, defaults.maxFiles()),
                positiveInt(props, PROP_PARSE_THREADS, defaults.parseThreads()),
                includes == null
                        ? List.of()
                        : Splitter.on(',').trimResults().omitEmptyStrings().splitToList(includes),
                nonNegativeInt(props, PROP_SUMMARY_COST, defaults.summaryCost()));
    }

    /** Reads {@code scopeview.properties} under {@code root}; defaults when the file is absent or unreadable. */
    public static ProjectConfig load(Path root) {
        var file = root.resolve(FILE_NAME);
        if (!Files.exists(file)) {
            return defaults();
        }
        var props = new Properties();
        try (var reader = Files.newBufferedReader(file)) {
            props.load(reader);
        } catch (IOException e) {
            log.warn("Error loading project configuration from {}: {}", file, e.getMessage());
            return defaults();
        }
        return fromProperties(props);
    }

    static int positiveInt(Properties props, String key, int fallback) {
        int value = intProperty(props, key, fallback);
        if (value <= 0) {
            log.warn("Ignoring non-positive {}={}, using {}", key, value, fallback);
            return fallback;
        }
        return value;
    }

    static int nonNegativeInt(Properties props, String key, int fallback) {
        int value = intProperty(props, key, fallback);
        if (value < 0) {
            log.warn("Ignoring negative {}={}, using {}", key, value, fallback);
            return fallback;
        }
        return value;
    }

    private static int intProperty(Properties props, String key, int fallback) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for {}: '{}', using {}", key, raw, fallback);
            return fallback;
        }
    }

    private static int defaultThreads() {
        return Math.max(1, Math.min(8, Runtime.getRuntime().availableProcessors()));
    }
}
