package ai.scopeview.analyzer.context;

import ai.scopeview.analyzer.AstNode;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Importance function for the compressor, combining the {@link ContextOptions} weights over cursor proximity, query
 * term overlap, reference counts, user focus and file recency.
 */
public final class RelevanceScorer implements ToDoubleFunction<AstNode> {
    static final double FUNCTION_BONUS = 0.1;
    static final double STRUCTURE_BONUS = 0.05;

    private static final Splitter TERMS = Splitter.on(CharMatcher.javaLetterOrDigit().negate())
            .omitEmptyStrings();

    private final ContextOptions options;
    private final RelevanceQuery query;
    private final Map<String, Integer> referenceCounts;
    private final Set<String> queryTerms;

    /** @param referenceCounts resolved references per qualified name */
    public RelevanceScorer(ContextOptions options, RelevanceQuery query, Map<String, Integer> referenceCounts) {
        this.options = options;
        this.query = query;
        this.referenceCounts = Map.copyOf(referenceCounts);
        this.queryTerms = terms(query.text());
    }

    public RelevanceScorer(ContextOptions options, RelevanceQuery query) {
        this(options, query, Map.of());
    }

    @Override
    public double applyAsDouble(AstNode node) {
        double score = options.proximityWeight() * proximity(node)
                + options.similarityWeight() * similarity(node)
                + options.referenceWeight() * references(node)
                + options.focusWeight() * focus(node)
                + options.recencyWeight() * recency(node);
        if (options.prioritizeFunctions() && node.type().isFunctionLike()) {
            score += FUNCTION_BONUS;
        }
        if (options.preserveStructure() && node.type().hasSummaryForm() && !node.type().isFunctionLike()) {
            score += STRUCTURE_BONUS;
        }
        return score;
    }

    /** 1 when the cursor is inside the node, decaying with line distance; 0 in other files. */
    double proximity(AstNode node) {
        if (!query.hasCursor() || !query.cursorFile().equals(node.path())) {
            return 0.0;
        }
        return 1.0 / (1 + node.range().lineDistance(query.cursorLine()));
    }

    /** Share of query terms found in the node's name, qualified name, signature or docstring. */
    double similarity(AstNode node) {
        if (queryTerms.isEmpty()) {
            return 0.0;
        }
        var nodeTerms = new HashSet<String>();
        nodeTerms.addAll(terms(node.name()));
        nodeTerms.addAll(terms(node.qualifiedName()));
        nodeTerms.addAll(terms(node.signature()));
        nodeTerms.addAll(terms(node.docstring()));
        long hits = queryTerms.stream().filter(nodeTerms::contains).count();
        return (double) hits / queryTerms.size();
    }

    double references(AstNode node) {
        if (node.qualifiedName().isEmpty()) {
            return 0.0;
        }
        int n = referenceCounts.getOrDefault(node.qualifiedName(), 0);
        return n / (1.0 + n);
    }

    double focus(AstNode node) {
        var focus = query.focus();
        if (focus.isEmpty()) {
            return 0.0;
        }
        return (!node.qualifiedName().isEmpty() && focus.contains(node.qualifiedName()))
                        || (!node.name().isEmpty() && focus.contains(node.name()))
                ? 1.0
                : 0.0;
    }

    double recency(AstNode node) {
        double r = query.recency().getOrDefault(node.path(), 0.0);
        return Math.max(0.0, Math.min(1.0, r));
    }

    static Set<String> terms(String text) {
        var result = new HashSet<String>();
        for (var term : TERMS.split(text)) {
            if (term.length() >= 2) {
                result.add(term.toLowerCase(Locale.ROOT));
            }
        }
        return result;
    }
}
