package ai.scopeview.analyzer.context;

import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Budget and ranking weights for building a context window.
 *
 * @param maxTokens token budget handed to the compressor
 * @param recencyWeight weight of how recently the file was touched
 * @param proximityWeight weight of closeness to the cursor
 * @param similarityWeight weight of term overlap with the query text
 * @param referenceWeight weight of how often the node's symbol is referenced
 * @param focusWeight weight of explicit user focus
 * @param preserveStructure favour containers (classes, namespaces) so kept members stay navigable
 * @param prioritizeFunctions favour functions and methods over other declarations
 * @param summaryCost tokens charged for a node kept as a summary
 */
public record ContextOptions(
        int maxTokens,
        double recencyWeight,
        double proximityWeight,
        double similarityWeight,
        double referenceWeight,
        double focusWeight,
        boolean preserveStructure,
        boolean prioritizeFunctions,
        int summaryCost) {
    private static final Logger log = LogManager.getLogger(ContextOptions.class);

    public static final String PROP_MAX_TOKENS = "context.maxTokens";
    public static final String PROP_RECENCY_WEIGHT = "context.recencyWeight";
    public static final String PROP_PROXIMITY_WEIGHT = "context.proximityWeight";
    public static final String PROP_SIMILARITY_WEIGHT = "context.similarityWeight";
    public static final String PROP_REFERENCE_WEIGHT = "context.referenceWeight";
    public static final String PROP_FOCUS_WEIGHT = "context.focusWeight";
    public static final String PROP_PRESERVE_STRUCTURE = "context.preserveStructure";
    public static final String PROP_PRIORITIZE_FUNCTIONS = "context.prioritizeFunctions";
    public static final String PROP_SUMMARY_COST = "context.summaryCost";

    public static final ContextOptions DEFAULTS =
            new ContextOptions(2048, 0.5, 0.3, 0.7, 0.2, 1.0, true, true, TokenBudgeter.DEFAULT_SUMMARY_COST);

    public ContextOptions {
        if (maxTokens < 0) {
            throw new IllegalArgumentException("maxTokens must not be negative: " + maxTokens);
        }
        if (summaryCost < 0) {
            throw new IllegalArgumentException("summaryCost must not be negative: " + summaryCost);
        }
        for (double w : new double[] {recencyWeight, proximityWeight, similarityWeight, referenceWeight, focusWeight}) {
            if (w < 0 || Double.isNaN(w)) {
                throw new IllegalArgumentException("weights must be non-negative numbers: " + w);
            }
        }
    }

    public ContextOptions withMaxTokens(int maxTokens) {
        return new ContextOptions(
                maxTokens,
                recencyWeight,
                proximityWeight,
                similarityWeight,
                referenceWeight,
                focusWeight,
                preserveStructure,
                prioritizeFunctions,
                summaryCost);
    }

    public static ContextOptions fromProperties(Properties props) {
        var d = DEFAULTS;
        return new ContextOptions(
                intValue(props, PROP_MAX_TOKENS, d.maxTokens()),
                weight(props, PROP_RECENCY_WEIGHT, d.recencyWeight()),
                weight(props, PROP_PROXIMITY_WEIGHT, d.proximityWeight()),
                weight(props, PROP_SIMILARITY_WEIGHT, d.similarityWeight()),
                weight(props, PROP_REFERENCE_WEIGHT, d.referenceWeight()),
                weight(props, PROP_FOCUS_WEIGHT, d.focusWeight()),
                bool(props, PROP_PRESERVE_STRUCTURE, d.preserveStructure()),
                bool(props, PROP_PRIORITIZE_FUNCTIONS, d.prioritizeFunctions()),
                intValue(props, PROP_SUMMARY_COST, d.summaryCost()));
    }

    private static int intValue(Properties props, String key, int fallback) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 0) {
                log.warn("Ignoring negative {}={}, using {}", key, value, fallback);
                return fallback;
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for {}: '{}', using {}", key, raw, fallback);
            return fallback;
        }
    }

    private static double weight(Properties props, String key, double fallback) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            if (value < 0 || Double.isNaN(value) || Double.isInfinite(value)) {
                log.warn("Ignoring out-of-range {}={}, using {}", key, raw, fallback);
                return fallback;
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("Invalid number for {}: '{}', using {}", key, raw, fallback);
            return fallback;
        }
    }

    private static boolean bool(Properties props, String key, boolean fallback) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        var trimmed = raw.trim();
        if (trimmed.equalsIgnoreCase("true")) {
            return true;
        }
        if (trimmed.equalsIgnoreCase("false")) {
            return false;
        }
        log.warn("Invalid boolean for {}: '{}', using {}", key, raw, fallback);
        return fallback;
    }
}
