package in.epicast.bootstrap;

import in.epicast.config.EpicastConfig;
import in.epicast.service.metadata.SignalRegistry;
import in.epicast.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Startup configuration validator.
 *
 * Runs once after metadata is loaded and before the service is wired.
 * Throws IllegalStateException if the process must not start.
 *
 * Metadata defects (dangling basenames, cycles, missing sources) are tolerated
 * and only logged, unless EPICAST_STRICT_METADATA=true.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /** Plain identifier, optionally schema-qualified. */
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private StartupConfigValidator() {}

    public static void validate(EpicastConfig config, SignalRegistry registry) {
        validate(config, registry, Env.getBool("EPICAST_STRICT_METADATA", false));
    }

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(EpicastConfig config, SignalRegistry registry, boolean strictMetadata) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        if (!TABLE_NAME.matcher(config.factTable()).matches()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: EPICAST_TABLE must be a plain table name, got '" + config.factTable() + "'");
        }
        log.info("✓ Fact table: {}", config.factTable());

        if (registry.sources().isEmpty()) {
            throw new IllegalStateException("❌ INVALID CONFIG: no data sources defined in metadata");
        }
        log.info("✓ Metadata: {} sources, {} signals", registry.sources().size(), registry.signals().size());

        if (!registry.warnings().isEmpty()) {
            log.warn("⚠️ {} metadata defects tolerated, first: {}",
                registry.warnings().size(), registry.warnings().get(0));
            if (strictMetadata) {
                throw new IllegalStateException(
                    "❌ INVALID CONFIG: " + registry.warnings().size()
                        + " metadata defects with EPICAST_STRICT_METADATA=true");
            }
        }

        log.info("Compatibility mode: {}, smoother window: {}, trend threshold: {}%",
            config.compatibilityMode(), config.smootherWindow(), config.trendThresholdPct());
        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }
}
