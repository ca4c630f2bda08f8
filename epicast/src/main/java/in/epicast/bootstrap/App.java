package in.epicast.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.epicast.config.EpicastConfig;
import in.epicast.infrastructure.metrics.PrometheusMetricsHandler;
import in.epicast.infrastructure.metrics.PrometheusQueryMetrics;
import in.epicast.infrastructure.persistence.JdbcFactStore;
import in.epicast.repository.FactStore;
import in.epicast.service.SignalQueryService;
import in.epicast.service.metadata.MetadataLoader;
import in.epicast.service.metadata.SignalRegistry;
import in.epicast.transport.cli.QueryCommand;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Epicast - versioned signal read path.
 *
 * Wires:
 * - Signal metadata registry (loaded once, read-only afterwards)
 * - HikariCP pool over the PostgreSQL fact table
 * - Query / trend service
 * - Prometheus /metrics listener
 *
 * With arguments, runs a single query or trend command and exits.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Epicast Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        EpicastConfig config = EpicastConfig.fromEnv();

        // ═══════════════════════════════════════════════════════════════
        // Signal metadata
        // ═══════════════════════════════════════════════════════════════
        SignalRegistry registry = MetadataLoader.load(config.sourcesCsv(), config.signalsCsv());
        StartupConfigValidator.validate(config, registry);

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource(config);
        FactStore store = new JdbcFactStore(dataSource);

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusQueryMetrics metrics = new PrometheusQueryMetrics();
        log.info("✓ Prometheus metrics initialized");

        SignalQueryService service = new SignalQueryService(registry, store, config, metrics);
        log.info("✓ Signal query service ready");

        if (args.length > 0) {
            try {
                Writer out = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
                long rows = new QueryCommand(service).run(args, out);
                log.info("✓ {} rows written", rows);
            } finally {
                dataSource.close();
            }
            return;
        }

        Undertow metricsServer = Undertow.builder()
            .addHttpListener(config.metricsPort(), "0.0.0.0")
            .setHandler(Handlers.path()
                .addExactPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry())))
            .build();
        metricsServer.start();
        log.info("✓ Metrics endpoint on http://localhost:{}/metrics", config.metricsPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            metricsServer.stop();
            dataSource.close();
            log.info("✓ Shutdown complete");
        }, "epicast-shutdown"));
    }

    private static HikariDataSource createDataSource(EpicastConfig cfg) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(cfg.dbUrl());
        config.setUsername(cfg.dbUser());
        config.setPassword(cfg.dbPass());
        config.setMaximumPoolSize(cfg.dbPoolSize());
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setReadOnly(true);
        config.setPoolName("epicast-hikari");

        log.info("DB: url={}, user={}, pool={}", cfg.dbUrl(), cfg.dbUser(), cfg.dbPoolSize());
        return new HikariDataSource(config);
    }
}
