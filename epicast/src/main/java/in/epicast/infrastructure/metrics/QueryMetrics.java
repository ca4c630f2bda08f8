package in.epicast.infrastructure.metrics;

import java.time.Duration;

/**
 * Query pipeline metrics for monitoring.
 *
 * Key metrics:
 * - Query executions by endpoint and outcome
 * - Storage execution latency
 * - Emitted rows by kind (pass-through / replayed)
 */
public interface QueryMetrics {

    String PASSTHROUGH = "passthrough";
    String REPLAYED = "replayed";

    /**
     * Record one storage execution.
     *
     * @param endpoint Endpoint name (query, trend)
     * @param success Whether the backend accepted the query
     * @param latency Time until the first row was available or the failure surfaced
     */
    void recordQuery(String endpoint, boolean success, Duration latency);

    /**
     * Record rows handed to the caller.
     *
     * @param kind {@link #PASSTHROUGH} or {@link #REPLAYED}
     * @param count Number of rows
     */
    void recordRows(String kind, long count);

    /**
     * Record a request rejected before any query ran.
     */
    void recordValidationFailure(String endpoint);

    QueryMetrics NOOP = new QueryMetrics() {
        @Override
        public void recordQuery(String endpoint, boolean success, Duration latency) {
        }

        @Override
        public void recordRows(String kind, long count) {
        }

        @Override
        public void recordValidationFailure(String endpoint) {
        }
    };
}
