package in.epicast.infrastructure.metrics;

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
 * Integration test for the Prometheus /metrics endpoint.
 *
 * Tests:
 * - Endpoint accessibility and text format
 * - Metric registration
 * - Recording and export of query, row and validation metrics
 */
public class MetricsEndpointTest {

    private static final int TEST_PORT = 19091;
    private Undertow server;
    private PrometheusQueryMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        // Fresh registry per test so counters start at zero
        CollectorRegistry registry = new CollectorRegistry();
        metrics = new PrometheusQueryMetrics(registry);

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.path()
                .addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry())))
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
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics"))
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
        assertTrue(response.body().contains("# HELP"), "Metrics should contain HELP declarations");
        assertTrue(response.body().contains("# TYPE"), "Metrics should contain TYPE declarations");
    }

    @Test
    public void testMetricsRecordingAndExport() throws Exception {
        metrics.recordQuery("query", true, Duration.ofMillis(150));
        metrics.recordQuery("query", true, Duration.ofMillis(20));
        metrics.recordQuery("trend", false, Duration.ofMillis(5));
        metrics.recordRows("replayed", 42);
        metrics.recordRows("passthrough", 0);
        metrics.recordValidationFailure("query");

        String body = scrape().body();

        assertTrue(body.contains("epicast_queries_total{endpoint=\"query\",status=\"success\",} 2.0"),
            "Should count successful queries");
        assertTrue(body.contains("epicast_queries_total{endpoint=\"trend\",status=\"failure\",} 1.0"),
            "Should count failed queries");
        assertTrue(body.contains("epicast_query_latency_seconds_count{endpoint=\"query\",} 2.0"),
            "Should record latency observations");
        assertTrue(body.contains("epicast_rows_emitted_total{kind=\"replayed\",} 42.0"),
            "Should count emitted rows");
        assertFalse(body.contains("kind=\"passthrough\""), "Zero row counts are not recorded");
        assertTrue(body.contains("epicast_validation_failures_total{endpoint=\"query\",} 1.0"),
            "Should count validation failures");
    }

    @Test
    public void testHandlerRendersWithoutServer() throws Exception {
        metrics.recordValidationFailure("trend");

        String text = new PrometheusMetricsHandler(metrics.getRegistry()).render();

        assertTrue(text.contains("epicast_validation_failures_total{endpoint=\"trend\",} 1.0"));
    }
}
