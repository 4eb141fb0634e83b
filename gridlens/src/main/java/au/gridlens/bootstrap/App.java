package au.gridlens.bootstrap;

import au.gridlens.application.port.output.RawRecordRepository;
import au.gridlens.config.GridLensConfig;
import au.gridlens.infrastructure.archive.FileArchiveClient;
import au.gridlens.infrastructure.catalog.JsonCatalogLoader;
import au.gridlens.infrastructure.metrics.PrometheusMetricsHandler;
import au.gridlens.infrastructure.metrics.PrometheusPipelineMetrics;
import au.gridlens.infrastructure.persistence.DuckDbDataSources;
import au.gridlens.infrastructure.persistence.DuckDbRawRecordRepository;
import au.gridlens.infrastructure.persistence.InMemoryRawRecordRepository;
import au.gridlens.service.annualise.AnnualisationCalculator;
import au.gridlens.service.audit.IntegrityAuditor;
import au.gridlens.service.audit.IntegrityReportExporter;
import au.gridlens.service.audit.IntegrityReportScheduler;
import au.gridlens.service.backfill.BackfillReconciler;
import au.gridlens.service.backfill.RetryPolicy;
import au.gridlens.service.cache.AggregationCache;
import au.gridlens.service.catalog.EntityCatalog;
import au.gridlens.service.clock.MarketClock;
import au.gridlens.service.ingest.CadenceDetector;
import au.gridlens.service.ingest.IngestionService;
import au.gridlens.service.query.*;
import au.gridlens.service.resample.ResolutionUnifier;
import au.gridlens.service.smoothing.SmoothingEngine;
import au.gridlens.service.store.RawStore;
import au.gridlens.transport.http.TelemetryHandlers;
import com.zaxxer.hikari.HikariDataSource;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Core Java entry point (no framework): reads config, wires the pipeline by hand,
 * starts the HTTP API.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        GridLensConfig config = GridLensConfig.fromEnv();
        StartupConfigValidator.validate(config);

        Clock clock = Clock.systemUTC();
        MarketClock marketClock = new MarketClock(config.marketOffset());
        EntityCatalog catalog = new JsonCatalogLoader().load(config.catalogFile());
        PrometheusPipelineMetrics metrics = new PrometheusPipelineMetrics();

        // ═══════════════════════════════════════════════════════════════
        // Raw Store
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = null;
        RawRecordRepository repository;
        if (config.hasDiskStore()) {
            dataSource = DuckDbDataSources.create(config.duckDbPath());
            repository = new DuckDbRawRecordRepository(dataSource);
            log.info("✓ Raw Store on DuckDB: {}", config.duckDbPath());
        } else {
            repository = new InMemoryRawRecordRepository();
            log.info("✓ Raw Store in memory");
        }
        RawStore rawStore = new RawStore(repository);
        log.info("✓ {}", rawStore.getStats());

        // ═══════════════════════════════════════════════════════════════
        // Query pipeline
        // ═══════════════════════════════════════════════════════════════
        // Resident source subscribes first so invalidated keys recompute from current samples
        SeriesSource seriesSource = SeriesSourceFactory.create(config.storageMode(), rawStore);
        AggregationCache<PipelineResult> cache = new AggregationCache<>(
                config.cacheTtl(), config.cacheMaxEntries(), clock, metrics, PipelineResult::coverage);
        rawStore.addListener(cache);
        TelemetryQueryService queryService = new TelemetryQueryService(
                catalog,
                seriesSource,
                new ResolutionUnifier(marketClock),
                new SmoothingEngine(),
                new AnnualisationCalculator(),
                cache,
                new ResolutionAdvisor(clock));
        log.info("✓ Query service ready ({} strategy, cache ttl {}s)", seriesSource.mode(), config.cacheTtl().toSeconds());

        // ═══════════════════════════════════════════════════════════════
        // Integrity and backfill
        // ═══════════════════════════════════════════════════════════════
        IntegrityAuditor auditor = new IntegrityAuditor(rawStore, catalog, marketClock);
        RetryPolicy retryPolicy = RetryPolicy.builder()
                .initialDelay(config.fetchInitialBackoff())
                .maxDelay(config.fetchInitialBackoff().multipliedBy(32))
                .multiplier(2.0)
                .maxAttempts(config.fetchMaxAttempts())
                .build();
        BackfillReconciler reconciler = new BackfillReconciler(
                auditor,
                rawStore,
                catalog,
                new FileArchiveClient(Path.of(config.archiveDir()), catalog),
                retryPolicy,
                config.fetchTimeout(),
                config.archiveConcurrency(),
                metrics);
        IngestionService ingestionService = new IngestionService(rawStore, catalog, new CadenceDetector(), metrics);

        IntegrityReportExporter exporter = new IntegrityReportExporter();
        Path reportDir = Path.of(config.archiveDir()).resolveSibling("integrity-reports");
        IntegrityReportScheduler integrityScheduler = new IntegrityReportScheduler(
                auditor, marketClock, clock, config.integrityExportTime(),
                reports -> {
                    if (reports.isEmpty()) {
                        return;
                    }
                    Path file = reportDir.resolve("integrity-" + reports.get(0).day() + ".json");
                    try {
                        exporter.write(reports, file);
                    } catch (IOException e) {
                        throw new IllegalStateException("Cannot write integrity report " + file, e);
                    }
                },
                metrics);
        integrityScheduler.start();

        // ═══════════════════════════════════════════════════════════════
        // HTTP API
        // ═══════════════════════════════════════════════════════════════
        TelemetryHandlers api = new TelemetryHandlers(
                queryService, auditor, exporter, reconciler, ingestionService, catalog, rawStore, marketClock);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        RoutingHandler routes = routes(api, metricsHandler);
        Undertow server = Undertow.builder()
                .addHttpListener(config.port(), "0.0.0.0")
                .setHandler(routes)
                .build();
        server.start();
        log.info("GridLens started on http://localhost:{}/", config.port());

        HikariDataSource pool = dataSource;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            integrityScheduler.close();
            reconciler.close();
            cache.close();
            if (pool != null) {
                pool.close();
            }
        }, "shutdown"));
    }

    static RoutingHandler routes(TelemetryHandlers api, PrometheusMetricsHandler metricsHandler) {
        return Handlers.routing()
                .get("/metrics", metricsHandler)
                .get("/api/health", api::health)
                .get("/api/query", api::query)
                .get("/api/integrity", api::integrity)
                .get("/api/cache/stats", api::cacheStats)
                .post("/api/backfill", api::backfill)
                .post("/api/ingest/{sourceId}", api::ingest)
                .post("/api/quarantine/{entityId}/release", api::releaseQuarantine)
                .setFallbackHandler(exchange -> {
                    exchange.setStatusCode(404);
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                    exchange.getResponseSender().send(
                        "GridLens\n\n" +
                        "GET  /api/query?entities=&start=&end=&cadence=&method=&param=&days=&scale=\n" +
                        "GET  /api/integrity?id=&from=&to=\n" +
                        "GET  /api/cache/stats, /api/health, /metrics\n" +
                        "POST /api/backfill?id=&from=&to=, /api/ingest/{sourceId}, /api/quarantine/{entityId}/release\n"
                    );
                });
    }
}
