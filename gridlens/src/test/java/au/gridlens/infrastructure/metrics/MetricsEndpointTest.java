package au.gridlens.infrastructure.metrics;

import au.gridlens.domain.model.CoverageStatus;
import au.gridlens.domain.model.DataDomain;
import au.gridlens.domain.query.CacheStatus;
import au.gridlens.infrastructure.metrics.PipelineMetrics.FetchOutcome;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for Prometheus /metrics endpoint.
 *
 * Tests:
 * - Endpoint accessibility
 * - Prometheus text format
 * - Metrics registration
 * - Metrics recording and export
 */
public class MetricsEndpointTest {

    private static final int TEST_PORT = 19191;
    private Undertow server;
    private PrometheusPipelineMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        // Fresh registry per test so counters start at zero
        CollectorRegistry registry = new CollectorRegistry();
        metrics = new PrometheusPipelineMetrics(registry);

        PrometheusMetricsHandler metricsHandler =
            new PrometheusMetricsHandler(metrics.getRegistry());

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(
                Handlers.path()
                    .addPrefixPath("/metrics", metricsHandler)
            )
            .build();

        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> scrape() throws Exception {
        return scrape("");
    }

    private HttpResponse<String> scrape(String query) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics" + query))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testMetricsEndpointAccessible() throws Exception {
        HttpResponse<String> response = scrape();

        assertEquals(200, response.statusCode(), "Metrics endpoint should return HTTP 200");
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        assertTrue(contentType.contains("text/plain"),
            "Content-Type should be text/plain for Prometheus format");
        assertFalse(response.body().isEmpty(), "Response body should not be empty");
    }

    @Test
    public void testMetricsContainExpectedMetrics() throws Exception {
        String body = scrape().body();

        assertTrue(body.contains("gridlens_cache_lookups_total"));
        assertTrue(body.contains("gridlens_computation_seconds"));
        assertTrue(body.contains("gridlens_archive_fetch_attempts_total"));
        assertTrue(body.contains("gridlens_unresolved_days_total"));
        assertTrue(body.contains("gridlens_records_merged_total"));
        assertTrue(body.contains("gridlens_integrity_status"));
        assertTrue(body.contains("# HELP"), "Metrics should contain HELP declarations");
        assertTrue(body.contains("# TYPE"), "Metrics should contain TYPE declarations");
    }

    @Test
    public void testMetricsRecordingAndExport() throws Exception {
        metrics.recordCacheLookup(CacheStatus.HIT);
        metrics.recordCacheLookup(CacheStatus.IN_FLIGHT_JOINED);
        metrics.recordComputation(Duration.ofMillis(120), true);
        metrics.recordFetchAttempt("DISPATCH_SCADA", FetchOutcome.TIMEOUT);
        metrics.recordUnresolvedDay("BAYSW1");
        metrics.recordRecordsMerged(DataDomain.GENERATION, 288);
        metrics.recordIntegrityStatus("BAYSW1", CoverageStatus.PARTIAL);

        String body = scrape().body();

        assertTrue(body.contains("status=\"hit\"") || body.contains("status=\"HIT\""), "Should show cache hits");
        assertTrue(body.contains("gridlens_computation_seconds_count"), "Should show latency observations");
        assertTrue(body.contains("source=\"DISPATCH_SCADA\"") && body.contains("outcome=\"timeout\""),
            "Should show fetch timeout");
        assertTrue(body.contains("gridlens_unresolved_days_total{target=\"BAYSW1\",} 1.0"));
        assertTrue(body.contains("gridlens_records_merged_total") && body.contains("288.0"));
        assertTrue(body.contains("gridlens_integrity_status{target=\"BAYSW1\",} 0.5"));
    }

    @Test
    public void testZeroMergeIsNotCounted() throws Exception {
        metrics.recordRecordsMerged(DataDomain.PRICE, 0);

        String body = scrape().body();

        assertFalse(body.contains("domain=\"price\"") || body.contains("domain=\"PRICE\""));
    }

    @Test
    public void testNameFilterRestrictsOutput() throws Exception {
        metrics.recordUnresolvedDay("BAYSW1");
        metrics.recordCacheLookup(CacheStatus.MISS);

        String body = scrape("?name%5B%5D=gridlens_unresolved_days_total").body();

        assertTrue(body.contains("gridlens_unresolved_days_total"));
        assertFalse(body.contains("gridlens_cache_lookups_total"));
    }
}
