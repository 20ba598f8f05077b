package in.digitflow.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EngineConfig: defaults and -D overrides.
 */
class EngineConfigTest {

    private static final List<String> KEYS = List.of(
        "RISK_TRADES_PER_MINUTE", "RISK_DRAWDOWN_GUARD", "EXEC_PLACEMENT_DELAY_MS",
        "DIGITFLOW_MARKETS", "SMART_DELAY_MS", "DERIV_APP_ID", "RISK_MAX_OPEN_GLOBAL");

    @AfterEach
    void tearDown() {
        KEYS.forEach(System::clearProperty);
    }

    @Test
    void testDefaults() {
        EngineConfig config = EngineConfig.fromEnv();

        assertEquals(30, config.risk().tradesPerMinute());
        assertTrue(config.risk().drawdownGuardEnabled());
        assertEquals(Duration.ofMillis(1500), config.scheduler().smartDelay());
        assertEquals(List.of("R_100"), config.scheduler().defaultMarkets());
        assertTrue(config.venue().url().contains("app_id=" + VenueConfig.DEFAULT_APP_ID));
    }

    @Test
    void testSystemPropertyOverrides() {
        System.setProperty("RISK_TRADES_PER_MINUTE", "12");
        System.setProperty("RISK_DRAWDOWN_GUARD", "false");
        System.setProperty("EXEC_PLACEMENT_DELAY_MS", "250");
        System.setProperty("DIGITFLOW_MARKETS", "R_50, R_75,,");
        System.setProperty("SMART_DELAY_MS", "800");
        System.setProperty("DERIV_APP_ID", "4242");

        EngineConfig config = EngineConfig.fromEnv();

        assertEquals(12, config.risk().tradesPerMinute());
        assertFalse(config.risk().drawdownGuardEnabled());
        assertEquals(Duration.ofMillis(250), config.execution().placementDelay());
        assertEquals(List.of("R_50", "R_75"), config.scheduler().defaultMarkets());
        assertEquals(Duration.ofMillis(800), config.scheduler().smartDelay());
        assertTrue(config.venue().url().endsWith("app_id=4242"));
    }

    @Test
    void testUnparseableValueKeepsDefault() {
        System.setProperty("RISK_MAX_OPEN_GLOBAL", "lots");

        assertEquals(RiskConfig.defaults().maxOpenGlobal(), EngineConfig.fromEnv().risk().maxOpenGlobal());
    }
}
