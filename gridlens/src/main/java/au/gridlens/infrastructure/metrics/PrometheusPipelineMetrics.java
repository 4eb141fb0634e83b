package au.gridlens.infrastructure.metrics;

import au.gridlens.domain.model.CoverageStatus;
import au.gridlens.domain.model.DataDomain;
import au.gridlens.domain.query.CacheStatus;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of PipelineMetrics.
 *
 * Key Metrics:
 * - gridlens_cache_lookups_total{status} - HIT / MISS / IN_FLIGHT_JOINED
 * - gridlens_computation_seconds{outcome} - Pipeline computation latency
 * - gridlens_archive_fetch_attempts_total{source, outcome} - Archive fetch attempts
 * - gridlens_unresolved_days_total{target} - Days a backfill could not fill
 * - gridlens_records_merged_total{domain} - Net-new records appended
 * - gridlens_integrity_status{target} - Latest audit status
 */
public class PrometheusPipelineMetrics implements PipelineMetrics {

    private final CollectorRegistry registry;

    private final Counter cacheLookups;
    private final Histogram computationLatency;
    private final Counter fetchAttempts;
    private final Counter unresolvedDays;
    private final Counter recordsMerged;
    private final Gauge integrityStatus;

    public PrometheusPipelineMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusPipelineMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.cacheLookups = Counter.build()
            .name("gridlens_cache_lookups_total")
            .help("Aggregation cache lookups by status")
            .labelNames("status")
            .register(registry);

        this.computationLatency = Histogram.build()
            .name("gridlens_computation_seconds")
            .help("Pipeline computation latency in seconds")
            .labelNames("outcome")
            .buckets(0.005, 0.01, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0)
            .register(registry);

        this.fetchAttempts = Counter.build()
            .name("gridlens_archive_fetch_attempts_total")
            .help("Archive fetch attempts by outcome")
            .labelNames("source", "outcome")
            .register(registry);

        this.unresolvedDays = Counter.build()
            .name("gridlens_unresolved_days_total")
            .help("Days a backfill left unresolved")
            .labelNames("target")
            .register(registry);

        this.recordsMerged = Counter.build()
            .name("gridlens_records_merged_total")
            .help("Net-new records appended to the raw store")
            .labelNames("domain")
            .register(registry);

        this.integrityStatus = Gauge.build()
            .name("gridlens_integrity_status")
            .help("Latest audit status (1=complete, 0.5=partial, 0=missing)")
            .labelNames("target")
            .register(registry);
    }

    @Override
    public void recordCacheLookup(CacheStatus status) {
        cacheLookups.labels(status.name()).inc();
    }

    @Override
    public void recordComputation(Duration latency, boolean success) {
        computationLatency.labels(success ? "success" : "failure").observe(latency.toNanos() / 1e9);
    }

    @Override
    public void recordFetchAttempt(String sourceId, FetchOutcome outcome) {
        fetchAttempts.labels(sourceId, outcome.label()).inc();
    }

    @Override
    public void recordUnresolvedDay(String target) {
        unresolvedDays.labels(target).inc();
    }

    @Override
    public void recordRecordsMerged(DataDomain domain, int count) {
        if (count > 0) {
            recordsMerged.labels(domain.token()).inc(count);
        }
    }

    @Override
    public void recordIntegrityStatus(String target, CoverageStatus status) {
        double value = switch (status) {
            case COMPLETE -> 1.0;
            case PARTIAL -> 0.5;
            case MISSING -> 0.0;
        };
        integrityStatus.labels(target).set(value);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
