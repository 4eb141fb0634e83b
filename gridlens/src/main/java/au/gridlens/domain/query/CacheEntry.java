package au.gridlens.domain.query;

import au.gridlens.domain.model.CoverageStatus;

import java.time.Duration;
import java.time.Instant;

/**
 * Materialized pipeline result. Never mutated; invalidation removes the entry.
 */
public record CacheEntry<V>(
        QueryKey queryKey,
        V result,
        Instant createdAt,
        Duration ttl,
        CoverageStatus coverage) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(createdAt.plus(ttl));
    }
}
