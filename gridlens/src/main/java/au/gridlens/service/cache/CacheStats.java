package au.gridlens.service.cache;

/**
 * Point-in-time counters of an {@link AggregationCache}.
 */
public record CacheStats(
        int entries,
        int inFlight,
        long hits,
        long misses,
        long joins,
        long failures,
        long invalidations,
        long evictions) {

    public double hitRatio() {
        long lookups = hits + misses + joins;
        return lookups == 0 ? 0.0 : (double) (hits + joins) / lookups;
    }
}
