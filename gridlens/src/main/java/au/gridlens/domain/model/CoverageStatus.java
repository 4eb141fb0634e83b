package au.gridlens.domain.model;

/**
 * Data completeness relative to the expected sample count.
 */
public enum CoverageStatus {
    COMPLETE,
    PARTIAL,
    MISSING;

    /**
     * Share of expected samples at or above which a day counts as complete.
     */
    public static final double COMPLETE_THRESHOLD = 0.999;

    public static CoverageStatus classify(long actual, long expected) {
        if (expected <= 0) {
            throw new IllegalArgumentException("Expected count must be positive: " + expected);
        }
        if (actual <= 0) {
            return MISSING;
        }
        double ratio = (double) actual / expected;
        return ratio >= COMPLETE_THRESHOLD ? COMPLETE : PARTIAL;
    }
}
