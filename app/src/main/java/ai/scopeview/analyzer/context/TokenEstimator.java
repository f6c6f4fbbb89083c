package ai.scopeview.analyzer.context;

/** Counts the tokens a piece of text costs in a model's context window. Implementations must be thread safe. */
@FunctionalInterface
public interface TokenEstimator {
    int estimate(String text);
}
