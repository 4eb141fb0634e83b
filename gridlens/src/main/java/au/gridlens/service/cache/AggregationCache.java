package au.gridlens.service.cache;

import au.gridlens.domain.model.CoverageStatus;
import au.gridlens.domain.query.CacheEntry;
import au.gridlens.domain.query.CacheResult;
import au.gridlens.domain.query.CacheStatus;
import au.gridlens.domain.query.QueryKey;
import au.gridlens.infrastructure.metrics.PipelineMetrics;
import au.gridlens.service.store.MergeEvent;
import au.gridlens.service.store.MergeListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Aggregation Cache - Memoizes pipeline results per query key.
 *
 * Single flight: the first caller for a key computes, concurrent callers for the same key
 * wait for that result. Unrelated keys compute in parallel. Entries expire after the TTL
 * and are removed when new data lands in their range; an entry is never modified in place.
 *
 * Constructed and closed explicitly by its owner; registered as a Raw Store merge listener
 * so appended records invalidate overlapping results.
 */
public final class AggregationCache<V> implements MergeListener, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AggregationCache.class);

    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;
    private final PipelineMetrics metrics;
    private final Function<V, CoverageStatus> coverageOf;

    private final ConcurrentHashMap<QueryKey, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<QueryKey, InFlight<V>> inFlight = new ConcurrentHashMap<>();
    private final Object storeLock = new Object();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong joins = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong invalidations = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private volatile boolean closed = false;

    public AggregationCache(Duration ttl, int maxEntries, Clock clock, PipelineMetrics metrics,
                            Function<V, CoverageStatus> coverageOf) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive: " + ttl);
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("Cache max entries must be positive: " + maxEntries);
        }
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
        this.metrics = metrics;
        this.coverageOf = coverageOf;
    }

    /**
     * Return the cached value for {@code key}, or compute it once across all concurrent callers.
     *
     * @throws CacheComputationException if the computation failed (for the computing caller and every waiter)
     *                                    or a waiting caller was interrupted
     */
    public CacheResult<V> getOrCompute(QueryKey key, Callable<V> compute) {
        if (closed) {
            throw new IllegalStateException("Aggregation cache is closed");
        }

        V cached = lookup(key);
        if (cached != null) {
            return hit(cached);
        }

        InFlight<V> mine = new InFlight<>();
        InFlight<V> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            joins.incrementAndGet();
            metrics.recordCacheLookup(CacheStatus.IN_FLIGHT_JOINED);
            log.debug("[CACHE] Joining in-flight computation for {}", key.label());
            return new CacheResult<>(await(key, existing.future), CacheStatus.IN_FLIGHT_JOINED);
        }

        try {
            // A computation may have finished between the lookup and registering ours
            cached = lookup(key);
            if (cached != null) {
                mine.future.complete(cached);
                return hit(cached);
            }

            misses.incrementAndGet();
            metrics.recordCacheLookup(CacheStatus.MISS);
            long started = System.nanoTime();
            V value;
            try {
                value = compute.call();
            } catch (Exception e) {
                failures.incrementAndGet();
                metrics.recordComputation(Duration.ofNanos(System.nanoTime() - started), false);
                CacheComputationException failure = e instanceof CacheComputationException cce
                        ? cce
                        : new CacheComputationException(key, "Computation failed: " + e.getMessage(), e);
                log.error("[CACHE] Computation failed for {}: {}", key.label(), e.getMessage());
                mine.future.completeExceptionally(failure);
                throw failure;
            }
            metrics.recordComputation(Duration.ofNanos(System.nanoTime() - started), true);
            store(key, value, mine);
            mine.future.complete(value);
            return new CacheResult<>(value, CacheStatus.MISS);
        } finally {
            inFlight.remove(key, mine);
            if (!mine.future.isDone()) {
                // Error thrown by the computation; release waiters
                mine.future.completeExceptionally(new CacheComputationException(key, "Computation aborted", null));
            }
        }
    }

    private CacheResult<V> hit(V value) {
        hits.incrementAndGet();
        metrics.recordCacheLookup(CacheStatus.HIT);
        return new CacheResult<>(value, CacheStatus.HIT);
    }

    private V lookup(QueryKey key) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            log.debug("[CACHE] Expired {}", key.label());
            return null;
        }
        return entry.result();
    }

    private void store(QueryKey key, V value, InFlight<V> computation) {
        synchronized (storeLock) {
            if (computation.invalidated || closed) {
                log.debug("[CACHE] Not storing {}: invalidated while computing", key.label());
                return;
            }
            entries.put(key, new CacheEntry<>(key, value, clock.instant(), ttl, coverageOf.apply(value)));
            while (entries.size() > maxEntries) {
                evictOldest();
            }
        }
    }

    private void evictOldest() {
        entries.values().stream()
                .min(Comparator.comparing(CacheEntry::createdAt))
                .ifPresent(oldest -> {
                    if (entries.remove(oldest.queryKey(), oldest)) {
                        evictions.incrementAndGet();
                    }
                });
    }

    private V await(QueryKey key, CompletableFuture<V> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheComputationException(key, "Interrupted while waiting for in-flight computation", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CacheComputationException cce) {
                throw cce;
            }
            throw new CacheComputationException(key, "Computation failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    /**
     * Remove every entry whose key overlaps the entities and [from, to).
     *
     * Overlapping computations still running deliver their result to waiters but are not stored.
     *
     * @return number of entries removed
     */
    public int invalidate(Set<String> entityIds, Instant from, Instant to) {
        int removed = 0;
        synchronized (storeLock) {
            for (Map.Entry<QueryKey, InFlight<V>> running : inFlight.entrySet()) {
                if (running.getKey().overlaps(entityIds, from, to)) {
                    running.getValue().invalidated = true;
                }
            }
            Iterator<Map.Entry<QueryKey, CacheEntry<V>>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                if (it.next().getKey().overlaps(entityIds, from, to)) {
                    it.remove();
                    removed++;
                }
            }
        }
        if (removed > 0) {
            invalidations.addAndGet(removed);
            log.info("[CACHE] Invalidated {} entries for {} [{} - {})", removed, entityIds, from, to);
        }
        return removed;
    }

    @Override
    public void onMerge(MergeEvent event) {
        invalidate(Set.of(event.entityId()), event.from(), event.to());
    }

    public Optional<CacheEntry<V>> peek(QueryKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    public CacheStats stats() {
        return new CacheStats(entries.size(), inFlight.size(), hits.get(), misses.get(), joins.get(),
                failures.get(), invalidations.get(), evictions.get());
    }

    @Override
    public void close() {
        closed = true;
        synchronized (storeLock) {
            entries.clear();
        }
        log.info("[CACHE] Closed ({} hits, {} misses, {} joins)", hits.get(), misses.get(), joins.get());
    }

    private static final class InFlight<V> {
        final CompletableFuture<V> future = new CompletableFuture<>();
        volatile boolean invalidated = false;
    }
}
