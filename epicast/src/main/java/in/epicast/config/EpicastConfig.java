package in.epicast.config;

import in.epicast.util.Env;

/**
 * Resolved runtime configuration, read once at startup.
 */
public record EpicastConfig(
    String dbUrl,
    String dbUser,
    String dbPass,
    int dbPoolSize,
    String factTable,
    String sourcesCsv,
    String signalsCsv,
    boolean compatibilityMode,
    double trendThresholdPct,
    int smootherWindow,
    int metricsPort
) {
    public static final String DEFAULT_TABLE = "covidcast";
    public static final double DEFAULT_TREND_THRESHOLD_PCT = 10.0;
    public static final int DEFAULT_SMOOTHER_WINDOW = 7;

    public EpicastConfig {
        if (smootherWindow < 1) {
            throw new IllegalArgumentException("SMOOTHER_WINDOW must be >= 1, got " + smootherWindow);
        }
        if (trendThresholdPct < 0) {
            throw new IllegalArgumentException("TREND_THRESHOLD_PCT must be >= 0, got " + trendThresholdPct);
        }
    }

    /**
     * Read configuration from environment variables / system properties.
     * Blank metadata paths mean "use the bundled classpath resources".
     */
    public static EpicastConfig fromEnv() {
        return new EpicastConfig(
            Env.get("DB_URL", "jdbc:postgresql://localhost:5432/epidata"),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", "postgres"),
            Env.getInt("DB_POOL_SIZE", 10),
            Env.get("EPICAST_TABLE", DEFAULT_TABLE),
            Env.get("EPICAST_SOURCES_CSV", null),
            Env.get("EPICAST_SIGNALS_CSV", null),
            Env.getBool("EPICAST_COMPATIBILITY_MODE", false),
            Env.getDouble("TREND_THRESHOLD_PCT", DEFAULT_TREND_THRESHOLD_PCT),
            Env.getInt("SMOOTHER_WINDOW", DEFAULT_SMOOTHER_WINDOW),
            Env.getInt("METRICS_PORT", 9091)
        );
    }
}
