package au.gridlens.transport.http;

import au.gridlens.domain.common.ValidationException;
import au.gridlens.domain.model.Cadence;
import au.gridlens.domain.model.IntegrityReport;
import au.gridlens.domain.model.IntervalRecord;
import au.gridlens.domain.model.SeriesPoint;
import au.gridlens.domain.model.SourceDescriptor;
import au.gridlens.domain.query.QueryRequest;
import au.gridlens.domain.query.QueryResponse;
import au.gridlens.domain.query.SmoothingMethod;
import au.gridlens.service.audit.IntegrityAuditor;
import au.gridlens.service.audit.IntegrityReportExporter;
import au.gridlens.service.backfill.BackfillReconciler;
import au.gridlens.service.backfill.ReconcileResult;
import au.gridlens.service.cache.CacheComputationException;
import au.gridlens.service.cache.CacheStats;
import au.gridlens.service.catalog.EntityCatalog;
import au.gridlens.service.clock.MarketClock;
import au.gridlens.service.ingest.IngestionService;
import au.gridlens.service.query.TelemetryQueryService;
import au.gridlens.service.store.MergeResult;
import au.gridlens.service.store.RawStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * HTTP handlers for the telemetry API.
 *
 * - GET  /api/health - liveness and store summary
 * - GET  /api/query - smoothed annual energy (entities, start, end, cadence, method, param, days, scale)
 * - GET  /api/integrity - integrity reports for an entity or source (id, from, to)
 * - GET  /api/cache/stats - aggregation cache counters
 * - POST /api/backfill - reconcile an entity or source over a day range (id, from, to)
 * - POST /api/quarantine/{entityId}/release - reopen a quarantined entity's write path
 * - POST /api/ingest/{sourceId} - merge a collected batch: [{"entityId", "timestamp", "value"}]
 *
 * Handlers that touch storage run on a worker thread, never on the IO thread.
 */
public final class TelemetryHandlers {
    private static final Logger log = LoggerFactory.getLogger(TelemetryHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final TelemetryQueryService queryService;
    private final IntegrityAuditor auditor;
    private final IntegrityReportExporter exporter;
    private final BackfillReconciler reconciler;
    private final IngestionService ingestionService;
    private final EntityCatalog catalog;
    private final RawStore rawStore;
    private final MarketClock marketClock;

    public TelemetryHandlers(TelemetryQueryService queryService, IntegrityAuditor auditor,
                             IntegrityReportExporter exporter, BackfillReconciler reconciler,
                             IngestionService ingestionService, EntityCatalog catalog,
                             RawStore rawStore, MarketClock marketClock) {
        this.queryService = queryService;
        this.auditor = auditor;
        this.exporter = exporter;
        this.reconciler = reconciler;
        this.ingestionService = ingestionService;
        this.catalog = catalog;
        this.rawStore = rawStore;
        this.marketClock = marketClock;
    }

    public void health(HttpServerExchange exchange) {
        if (dispatched(exchange, this::health)) {
            return;
        }
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", "ok");
        health.put("ts", Instant.now().toString());
        health.put("storageMode", queryService.getSeriesSource().mode().name());
        health.put("store", rawStore.getStats());
        health.put("quarantined", rawStore.getQuarantined().size());
        sendJson(exchange, health.toString());
    }

    /**
     * GET /api/query?entities=BAYSW1,ERARING&start=2024-03-01&end=2024-03-08&cadence=30m&method=EWM&param=30&days=365&scale=1e6
     *
     * start/end accept an ISO instant or a market day; cadence is optional.
     */
    public void query(HttpServerExchange exchange) {
        if (dispatched(exchange, this::query)) {
            return;
        }
        try {
            String cadenceParam = param(exchange, "cadence", null);
            QueryRequest request = new QueryRequest(
                    Arrays.stream(required(exchange, "entities").split(",")).map(String::trim).toList(),
                    instant(exchange, "start"),
                    instant(exchange, "end"),
                    cadenceParam == null ? null : Cadence.parse(cadenceParam),
                    SmoothingMethod.parse(param(exchange, "method", "EWM")),
                    number(exchange, "param", 30),
                    integer(exchange, "days", 365),
                    number(exchange, "scale", 1_000_000));

            QueryResponse response = queryService.query(request);

            ObjectNode json = MAPPER.createObjectNode();
            ArrayNode entities = json.putArray("entities");
            response.key().entities().forEach(entities::add);
            json.put("start", response.key().start().toString());
            json.put("end", response.key().end().toString());
            json.put("cadence", response.key().targetCadence().getLabel());
            json.put("smoothing", response.key().smoothing().describe());
            json.put("referenceYearDays", response.key().annualisation().referenceYearDays());
            json.put("unitScale", response.key().annualisation().unitScale());
            json.put("coverageStatus", response.coverageStatus().name());
            json.put("cacheStatus", response.cacheStatus().name());
            ArrayNode points = json.putArray("points");
            for (SeriesPoint point : response.points()) {
                ObjectNode p = points.addObject();
                p.put("timestamp", point.timestamp().toString());
                if (point.isMissing()) {
                    p.putNull("value");
                } else {
                    p.put("value", point.value());
                }
            }
            sendJson(exchange, json.toString());
        } catch (ValidationException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, e.getField(), e.getMessage());
        } catch (DateTimeParseException | NumberFormatException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, null, e.getMessage());
        } catch (CacheComputationException e) {
            log.error("Query failed: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, null, e.getMessage());
        }
    }

    /**
     * GET /api/integrity?id=BAYSW1&from=2024-03-01&to=2024-03-07
     */
    public void integrity(HttpServerExchange exchange) {
        if (dispatched(exchange, this::integrity)) {
            return;
        }
        try {
            String id = required(exchange, "id");
            LocalDate from = LocalDate.parse(required(exchange, "from"));
            LocalDate to = LocalDate.parse(param(exchange, "to", from.toString()));
            List<IntegrityReport> reports = auditor.auditRange(id, from, to);
            sendJson(exchange, exporter.toJson(reports));
        } catch (ValidationException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, e.getField(), e.getMessage());
        } catch (DateTimeParseException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, null, e.getMessage());
        }
    }

    public void cacheStats(HttpServerExchange exchange) {
        CacheStats stats = queryService.getCache().stats();
        ObjectNode json = MAPPER.createObjectNode();
        json.put("entries", stats.entries());
        json.put("inFlight", stats.inFlight());
        json.put("hits", stats.hits());
        json.put("misses", stats.misses());
        json.put("joins", stats.joins());
        json.put("failures", stats.failures());
        json.put("invalidations", stats.invalidations());
        json.put("evictions", stats.evictions());
        json.put("hitRatio", stats.hitRatio());
        sendJson(exchange, json.toString());
    }

    /**
     * POST /api/backfill?id=DISPATCH_SCADA&from=2024-03-01&to=2024-03-07
     */
    public void backfill(HttpServerExchange exchange) {
        if (dispatched(exchange, this::backfill)) {
            return;
        }
        try {
            String id = required(exchange, "id");
            LocalDate from = LocalDate.parse(required(exchange, "from"));
            LocalDate to = LocalDate.parse(param(exchange, "to", from.toString()));
            ReconcileResult result = reconciler.reconcile(id, from, to);

            ObjectNode json = MAPPER.createObjectNode();
            json.put("target", result.target());
            putDays(json.putArray("filledDays"), result.filledDays());
            putDays(json.putArray("partialDays"), result.partialDays());
            putDays(json.putArray("skippedDays"), result.skippedDays());
            ObjectNode unresolved = json.putObject("unresolvedDays");
            result.unresolvedDays().forEach((day, reason) -> unresolved.put(day.toString(), reason));
            json.put("recordsWritten", result.recordsWritten());
            sendJson(exchange, json.toString());
        } catch (ValidationException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, e.getField(), e.getMessage());
        } catch (DateTimeParseException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, null, e.getMessage());
        }
    }

    /**
     * POST /api/quarantine/{entityId}/release
     */
    public void releaseQuarantine(HttpServerExchange exchange) {
        try {
            String entityId = required(exchange, "entityId");
            boolean released = rawStore.releaseQuarantine(entityId);
            ObjectNode json = MAPPER.createObjectNode();
            json.put("entityId", entityId);
            json.put("released", released);
            sendJson(exchange, json.toString());
        } catch (ValidationException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, e.getField(), e.getMessage());
        }
    }

    /**
     * POST /api/ingest/{sourceId}
     */
    public void ingest(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> ex.dispatch(() -> {
            try {
                String sourceId = required(ex, "sourceId");
                SourceDescriptor source = catalog.requireSource(sourceId);
                List<IntervalRecord> records = new ArrayList<>();
                for (JsonNode node : MAPPER.readTree(body)) {
                    records.add(new IntervalRecord(
                            node.path("entityId").asText(),
                            Instant.parse(node.path("timestamp").asText()),
                            node.path("value").asDouble(Double.NaN),
                            source.cadence()));
                }
                MergeResult result = ingestionService.ingest(sourceId, records);

                ObjectNode json = MAPPER.createObjectNode();
                json.put("sourceId", sourceId);
                json.put("written", result.written());
                json.put("duplicates", result.duplicates());
                ArrayNode violations = json.putArray("violations");
                result.violations().forEach(v -> violations.add(v.getMessage()));
                sendJson(ex, json.toString());
            } catch (ValidationException e) {
                sendError(ex, StatusCodes.BAD_REQUEST, e.getField(), e.getMessage());
            } catch (JsonProcessingException | DateTimeParseException e) {
                sendError(ex, StatusCodes.BAD_REQUEST, null, e.getMessage());
            }
        }), StandardCharsets.UTF_8);
    }

    private static void putDays(ArrayNode array, List<LocalDate> days) {
        days.forEach(day -> array.add(day.toString()));
    }

    private static boolean dispatched(HttpServerExchange exchange, HttpHandler handler) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(handler);
            return true;
        }
        return false;
    }

    private Instant instant(HttpServerExchange exchange, String name) {
        String value = required(exchange, name);
        if (value.length() == 10) {
            return marketClock.dayStart(LocalDate.parse(value));
        }
        return Instant.parse(value);
    }

    private static double number(HttpServerExchange exchange, String name, double defaultValue) {
        String value = param(exchange, name, null);
        return value == null ? defaultValue : Double.parseDouble(value);
    }

    private static int integer(HttpServerExchange exchange, String name, int defaultValue) {
        String value = param(exchange, name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(name, name + " must be a whole number, got " + value);
        }
    }

    private static String required(HttpServerExchange exchange, String name) {
        String value = param(exchange, name, null);
        if (value == null || value.isBlank()) {
            throw new ValidationException(name, "Missing query parameter: " + name);
        }
        return value;
    }

    private static String param(HttpServerExchange exchange, String name, String defaultValue) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? defaultValue : values.peekFirst();
    }

    private static void sendJson(HttpServerExchange exchange, String json) {
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private static void sendError(HttpServerExchange exchange, int statusCode, String field, String message) {
        ObjectNode json = MAPPER.createObjectNode();
        json.put("error", message);
        if (field != null) {
            json.put("field", field);
        }
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(json.toString(), StandardCharsets.UTF_8);
    }
}
