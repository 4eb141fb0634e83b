package au.gridlens.infrastructure.metrics;

import au.gridlens.domain.model.CoverageStatus;
import au.gridlens.domain.model.DataDomain;
import au.gridlens.domain.query.CacheStatus;

import java.time.Duration;

/**
 * Pipeline metrics for monitoring and alerting.
 *
 * Implementations must be thread-safe: backfill workers and query threads record concurrently.
 */
public interface PipelineMetrics {

    /**
     * Discards everything. For tests and tools that run without a registry.
     */
    PipelineMetrics NOOP = new PipelineMetrics() {
        @Override
        public void recordCacheLookup(CacheStatus status) {
        }

        @Override
        public void recordComputation(Duration latency, boolean success) {
        }

        @Override
        public void recordFetchAttempt(String sourceId, FetchOutcome outcome) {
        }

        @Override
        public void recordUnresolvedDay(String target) {
        }

        @Override
        public void recordRecordsMerged(DataDomain domain, int count) {
        }

        @Override
        public void recordIntegrityStatus(String target, CoverageStatus status) {
        }
    };

    void recordCacheLookup(CacheStatus status);

    /**
     * Record one pipeline computation (unify, smooth, annualise) run on a cache miss.
     */
    void recordComputation(Duration latency, boolean success);

    void recordFetchAttempt(String sourceId, FetchOutcome outcome);

    void recordUnresolvedDay(String target);

    void recordRecordsMerged(DataDomain domain, int count);

    /**
     * Latest audit status of an entity or source (1 = complete, 0.5 = partial, 0 = missing).
     */
    void recordIntegrityStatus(String target, CoverageStatus status);

    enum FetchOutcome {
        SUCCESS,
        TRANSIENT_FAILURE,
        PERMANENT_FAILURE,
        TIMEOUT;

        public String label() {
            return name().toLowerCase();
        }
    }
}
