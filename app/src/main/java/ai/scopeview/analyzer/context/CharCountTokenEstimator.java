package ai.scopeview.analyzer.context;

/** Rough estimate of one token per {@code charsPerToken} characters, rounded up. */
public final class CharCountTokenEstimator implements TokenEstimator {
    private final int charsPerToken;

    public CharCountTokenEstimator() {
        this(4);
    }

    public CharCountTokenEstimator(int charsPerToken) {
        if (charsPerToken <= 0) {
            throw new IllegalArgumentException("charsPerToken must be positive: " + charsPerToken);
        }
        this.charsPerToken = charsPerToken;
    }

    @Override
    public int estimate(String text) {
        return (text.length() + charsPerToken - 1) / charsPerToken;
    }
}
