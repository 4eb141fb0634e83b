package au.gridlens.service.backfill;

import au.gridlens.application.port.output.ArchiveClient;
import au.gridlens.application.port.output.ArchiveFetchException;
import au.gridlens.domain.common.ValidationException;
import au.gridlens.domain.model.*;
import au.gridlens.infrastructure.metrics.PipelineMetrics;
import au.gridlens.infrastructure.metrics.PipelineMetrics.FetchOutcome;
import au.gridlens.service.audit.IntegrityAuditor;
import au.gridlens.service.catalog.EntityCatalog;
import au.gridlens.service.store.MergeResult;
import au.gridlens.service.store.RawStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Backfill Reconciler - Fills incomplete market days from the archive.
 *
 * Each day of the range is a unit of work on a bounded pool: audit, skip if complete,
 * otherwise fetch (with timeout and retries), merge net-new records, audit again.
 * Re-running over the same range writes nothing new. Nothing is fabricated: a day the
 * archive only partly covers is merged as-is and reported partial.
 */
public final class BackfillReconciler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BackfillReconciler.class);

    private final IntegrityAuditor auditor;
    private final RawStore rawStore;
    private final EntityCatalog catalog;
    private final ArchiveClient archiveClient;
    private final RetryPolicy retryPolicy;
    private final Duration fetchTimeout;
    private final PipelineMetrics metrics;
    private final Sleeper sleeper;
    private final ExecutorService workers;
    private final ExecutorService fetchExecutor;

    public BackfillReconciler(
            IntegrityAuditor auditor,
            RawStore rawStore,
            EntityCatalog catalog,
            ArchiveClient archiveClient,
            RetryPolicy retryPolicy,
            Duration fetchTimeout,
            int concurrency,
            PipelineMetrics metrics) {
        this(auditor, rawStore, catalog, archiveClient, retryPolicy, fetchTimeout, concurrency, metrics,
                d -> Thread.sleep(d.toMillis()));
    }

    public BackfillReconciler(
            IntegrityAuditor auditor,
            RawStore rawStore,
            EntityCatalog catalog,
            ArchiveClient archiveClient,
            RetryPolicy retryPolicy,
            Duration fetchTimeout,
            int concurrency,
            PipelineMetrics metrics,
            Sleeper sleeper) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("Concurrency must be positive: " + concurrency);
        }
        if (fetchTimeout.isNegative() || fetchTimeout.isZero()) {
            throw new IllegalArgumentException("Fetch timeout must be positive: " + fetchTimeout);
        }
        this.auditor = auditor;
        this.rawStore = rawStore;
        this.catalog = catalog;
        this.archiveClient = archiveClient;
        this.retryPolicy = retryPolicy;
        this.fetchTimeout = fetchTimeout;
        this.metrics = metrics;
        this.sleeper = sleeper;
        this.workers = Executors.newFixedThreadPool(concurrency, namedDaemon("backfill-worker-"));
        // A call that ignores cancellation keeps its thread, so stuck fetches never exceed concurrency
        this.fetchExecutor = Executors.newFixedThreadPool(concurrency, namedDaemon("archive-fetch-"));
    }

    /**
     * Reconcile an entity or source over [from, toInclusive].
     *
     * For an entity target only that entity's records from the source file are merged.
     */
    public ReconcileResult reconcile(String entityOrSourceId, LocalDate from, LocalDate toInclusive) {
        if (toInclusive.isBefore(from)) {
            throw new ValidationException("toInclusive",
                    String.format("Reconcile range end %s is before start %s", toInclusive, from));
        }
        Target target = resolve(entityOrSourceId);
        log.info("[BACKFILL] Reconciling {} ({} via {}) {}..{}",
                entityOrSourceId, target.kind, target.source.sourceId(), from, toInclusive);

        Map<LocalDate, Future<DayOutcome>> pending = new TreeMap<>();
        for (LocalDate day = from; !day.isAfter(toInclusive); day = day.plusDays(1)) {
            LocalDate unit = day;
            pending.put(unit, workers.submit(() -> reconcileDay(target, unit)));
        }

        List<LocalDate> filled = new ArrayList<>();
        List<LocalDate> partial = new ArrayList<>();
        Map<LocalDate, String> unresolved = new TreeMap<>();
        List<LocalDate> skipped = new ArrayList<>();
        int written = 0;

        for (Map.Entry<LocalDate, Future<DayOutcome>> entry : pending.entrySet()) {
            LocalDate day = entry.getKey();
            DayOutcome outcome = await(day, entry.getValue());
            written += outcome.written;
            switch (outcome.kind) {
                case FILLED -> filled.add(day);
                case PARTIAL -> partial.add(day);
                case SKIPPED -> skipped.add(day);
                case UNRESOLVED -> {
                    unresolved.put(day, outcome.reason);
                    metrics.recordUnresolvedDay(entityOrSourceId);
                }
            }
        }

        ReconcileResult result = new ReconcileResult(entityOrSourceId, filled, partial, unresolved, skipped, written);
        if (unresolved.isEmpty()) {
            log.info("[BACKFILL] {}", result.summary());
        } else {
            log.warn("[BACKFILL] {} unresolved={}", result.summary(), unresolved);
        }
        return result;
    }

    private DayOutcome await(LocalDate day, Future<DayOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return DayOutcome.unresolved("interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.error("[BACKFILL] Day {} failed: {}", day, cause.getMessage(), cause);
            return DayOutcome.unresolved(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
    }

    private DayOutcome reconcileDay(Target target, LocalDate day) {
        IntegrityReport before = auditor.audit(target.id, day);
        if (before.isComplete()) {
            log.debug("[BACKFILL] {} {} already complete, skipping", target.id, day);
            return DayOutcome.skipped();
        }
        if (target.kind == AuditTargetKind.ENTITY && rawStore.isQuarantined(target.id)) {
            return DayOutcome.unresolved("entity quarantined pending operator resolution");
        }

        List<IntervalRecord> fetched;
        try {
            fetched = fetchWithRetry(target.source.sourceId(), day);
        } catch (ArchiveFetchException e) {
            log.warn("[BACKFILL] {} {} unresolved: {}", target.id, day, e.getMessage());
            return DayOutcome.unresolved(e.getMessage());
        }

        List<IntervalRecord> records = target.kind == AuditTargetKind.ENTITY
                ? fetched.stream().filter(r -> r.entityId().equals(target.id)).toList()
                : fetched;

        MergeResult merge = rawStore.merge(target.source.domain(), records);
        metrics.recordRecordsMerged(target.source.domain(), merge.written());
        if (merge.hasViolations()) {
            String reason = "integrity violation: " + merge.violations().get(0).getMessage();
            return new DayOutcome(Kind.UNRESOLVED, merge.written(), reason);
        }

        IntegrityReport after = auditor.audit(target.id, day);
        metrics.recordIntegrityStatus(target.id, after.status());
        return switch (after.status()) {
            case COMPLETE -> new DayOutcome(Kind.FILLED, merge.written(), null);
            case PARTIAL -> {
                log.info("[BACKFILL] {} {} still partial after merge: {}/{}",
                        target.id, day, after.actualCount(), after.expectedCount());
                yield new DayOutcome(Kind.PARTIAL, merge.written(), null);
            }
            case MISSING -> new DayOutcome(Kind.UNRESOLVED, merge.written(), "archive has no records for this day");
        };
    }

    /**
     * Fetch one (source, day), retrying transient failures and timeouts with backoff.
     *
     * @throws ArchiveFetchException on a permanent failure or once attempts are exhausted
     */
    List<IntervalRecord> fetchWithRetry(String sourceId, LocalDate day) throws ArchiveFetchException {
        RetryPolicy policy = retryPolicy.fresh();
        while (true) {
            String failure;
            Future<List<IntervalRecord>> future = fetchExecutor.submit(() -> archiveClient.fetch(sourceId, day));
            try {
                List<IntervalRecord> records = future.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
                metrics.recordFetchAttempt(sourceId, FetchOutcome.SUCCESS);
                return records == null ? List.of() : records;
            } catch (TimeoutException e) {
                future.cancel(true);
                metrics.recordFetchAttempt(sourceId, FetchOutcome.TIMEOUT);
                failure = "timed out after " + fetchTimeout.toMillis() + "ms";
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw ArchiveFetchException.permanent(sourceId, day, "interrupted");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof ArchiveFetchException fetchFailure && fetchFailure.isTransient()) {
                    metrics.recordFetchAttempt(sourceId, FetchOutcome.TRANSIENT_FAILURE);
                    failure = fetchFailure.getMessage();
                } else if (cause instanceof ArchiveFetchException permanentFailure) {
                    metrics.recordFetchAttempt(sourceId, FetchOutcome.PERMANENT_FAILURE);
                    throw permanentFailure;
                } else {
                    metrics.recordFetchAttempt(sourceId, FetchOutcome.PERMANENT_FAILURE);
                    throw new ArchiveFetchException(sourceId, day, false,
                            "archive client error: " + cause.getMessage(), cause);
                }
            }

            Duration backoff = policy.recordFailure();
            if (!policy.shouldRetry()) {
                throw new ArchiveFetchException(sourceId, day, true,
                        String.format("gave up after %d attempts, last failure: %s", policy.getAttemptCount(), failure));
            }
            log.warn("[BACKFILL] Fetch {} {} attempt {}/{} failed ({}), retrying in {}ms",
                    sourceId, day, policy.getAttemptCount(), policy.getMaxAttempts(), failure, backoff.toMillis());
            try {
                sleeper.sleep(backoff);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw ArchiveFetchException.permanent(sourceId, day, "interrupted during backoff");
            }
        }
    }

    private Target resolve(String id) {
        if (catalog.isSource(id)) {
            return new Target(id, AuditTargetKind.SOURCE, catalog.requireSource(id));
        }
        EntityDescriptor entity = catalog.findEntity(id)
                .orElseThrow(() -> new ValidationException("id", "Unknown entity or source: " + id));
        return new Target(id, AuditTargetKind.ENTITY, catalog.sourceFor(entity));
    }

    @Override
    public void close() {
        workers.shutdownNow();
        fetchExecutor.shutdownNow();
        log.info("[BACKFILL] Worker pools shut down");
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Waits between retry attempts. Replaced in tests to avoid real delays.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private record Target(String id, AuditTargetKind kind, SourceDescriptor source) {
    }

    private enum Kind {
        FILLED, PARTIAL, UNRESOLVED, SKIPPED
    }

    private record DayOutcome(Kind kind, int written, String reason) {
        static DayOutcome skipped() {
            return new DayOutcome(Kind.SKIPPED, 0, null);
        }

        static DayOutcome unresolved(String reason) {
            return new DayOutcome(Kind.UNRESOLVED, 0, reason);
        }
    }
}
