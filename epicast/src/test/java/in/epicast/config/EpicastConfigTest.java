package in.epicast.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EpicastConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("SMOOTHER_WINDOW");
        System.clearProperty("EPICAST_COMPATIBILITY_MODE");
        System.clearProperty("TREND_THRESHOLD_PCT");
    }

    @Test
    void testSystemPropertiesOverrideDefaults() {
        System.setProperty("SMOOTHER_WINDOW", "5");
        System.setProperty("EPICAST_COMPATIBILITY_MODE", "true");
        System.setProperty("TREND_THRESHOLD_PCT", "12.5");

        EpicastConfig config = EpicastConfig.fromEnv();

        assertEquals(5, config.smootherWindow());
        assertTrue(config.compatibilityMode());
        assertEquals(12.5, config.trendThresholdPct());
        assertEquals(EpicastConfig.DEFAULT_TABLE, config.factTable());
    }

    @Test
    void testMalformedNumberFallsBackToDefault() {
        System.setProperty("SMOOTHER_WINDOW", "seven");

        assertEquals(EpicastConfig.DEFAULT_SMOOTHER_WINDOW, EpicastConfig.fromEnv().smootherWindow());
    }

    @Test
    void testInvalidValuesRejected() {
        assertThrows(IllegalArgumentException.class, () ->
            new EpicastConfig("u", "u", "p", 1, "covidcast", null, null, false, 10.0, 0, 9091));
        assertThrows(IllegalArgumentException.class, () ->
            new EpicastConfig("u", "u", "p", 1, "covidcast", null, null, false, -1.0, 7, 9091));
    }
}
