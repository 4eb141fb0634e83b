package au.gridlens.domain.query;

/**
 * A value served by the aggregation cache and how it was obtained.
 */
public record CacheResult<V>(V value, CacheStatus status) {
}
