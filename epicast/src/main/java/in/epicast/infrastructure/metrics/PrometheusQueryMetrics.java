package in.epicast.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of QueryMetrics.
 *
 * Key Metrics:
 * - epicast_queries_total{endpoint, status} - Storage executions by outcome
 * - epicast_query_latency_seconds{endpoint} - Storage execution latency
 * - epicast_rows_emitted_total{kind} - Rows handed to callers
 * - epicast_validation_failures_total{endpoint} - Requests rejected before querying
 *
 * Usage:
 * <pre>
 * PrometheusQueryMetrics metrics = new PrometheusQueryMetrics();
 * SignalQueryService service = new SignalQueryService(registry, store, config, metrics);
 *
 * // Expose at /metrics endpoint
 * Handlers.path().addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusQueryMetrics implements QueryMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusQueryMetrics.class);

    private final CollectorRegistry registry;

    private final Counter queryCounter;
    private final Histogram queryLatency;
    private final Counter rowCounter;
    private final Counter validationFailureCounter;

    public PrometheusQueryMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusQueryMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.queryCounter = Counter.build()
            .name("epicast_queries_total")
            .help("Total number of storage query executions")
            .labelNames("endpoint", "status")
            .register(registry);

        this.queryLatency = Histogram.build()
            .name("epicast_query_latency_seconds")
            .help("Storage query execution latency in seconds")
            .labelNames("endpoint")
            .buckets(0.005, 0.01, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0)
            .register(registry);

        this.rowCounter = Counter.build()
            .name("epicast_rows_emitted_total")
            .help("Total number of rows emitted to callers")
            .labelNames("kind")
            .register(registry);

        this.validationFailureCounter = Counter.build()
            .name("epicast_validation_failures_total")
            .help("Total number of requests rejected by parameter validation")
            .labelNames("endpoint")
            .register(registry);

        log.info("PrometheusQueryMetrics initialized");
    }

    @Override
    public void recordQuery(String endpoint, boolean success, Duration latency) {
        queryCounter.labels(endpoint, success ? "success" : "failure").inc();
        queryLatency.labels(endpoint).observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordRows(String kind, long count) {
        if (count > 0) {
            rowCounter.labels(kind).inc(count);
        }
    }

    @Override
    public void recordValidationFailure(String endpoint) {
        validationFailureCounter.labels(endpoint).inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
