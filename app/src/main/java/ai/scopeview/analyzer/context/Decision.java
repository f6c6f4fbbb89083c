package ai.scopeview.analyzer.context;

/** How a node appears in a compressed view. */
public enum Decision {
    /** Full text, with children rendered according to their own decisions. */
    FULL,
    /** Signature only. */
    SUMMARY,
    /** Dropped and replaced by a placeholder. */
    ELIDED;

    public boolean isKept() {
        return this != ELIDED;
    }

    /** FULL keeps more than SUMMARY, which keeps more than ELIDED. */
    public boolean atLeast(Decision other) {
        return ordinal() <= other.ordinal();
    }
}
