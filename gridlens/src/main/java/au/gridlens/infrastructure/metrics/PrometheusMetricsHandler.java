package au.gridlens.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * HTTP handler for the Prometheus /metrics endpoint (text format 0.0.4).
 *
 * Scrapers may restrict the output with repeated {@code name[]} parameters,
 * e.g. {@code /metrics?name[]=gridlens_cache_lookups_total}.
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Set<String> names = requestedNames(exchange);
        StringWriter writer = new StringWriter();
        try {
            TextFormat.write004(writer, names.isEmpty()
                    ? registry.metricFamilySamples()
                    : registry.filteredMetricFamilySamples(names));
        } catch (IOException e) {
            log.error("[METRICS] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
            return;
        }
        exchange.setStatusCode(200);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
        exchange.getResponseSender().send(writer.toString());
        log.debug("[METRICS] Served {} chars{}", writer.getBuffer().length(), names.isEmpty() ? "" : " for " + names);
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get("name[]");
        return values == null ? Set.of() : new HashSet<>(values);
    }
}
