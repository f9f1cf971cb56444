package in.trendbook.service.strategy;

import in.trendbook.infrastructure.metrics.EngineMetrics;
import org.junit.jupiter.api.Test;

import static in.trendbook.service.strategy.StrategyFixtures.config;
import static org.junit.jupiter.api.Assertions.*;

class StrategyRegistryTest {

    private final StrategyRegistry registry = StrategyRegistry.withDefaults(EngineMetrics.noop());

    @Test
    void testDefaultStrategiesRegistered() {
        assertTrue(registry.names().contains("supertrend"));
        assertTrue(registry.names().contains("market-making"));
    }

    @Test
    void testCreateIsCaseInsensitive() {
        TradingStrategy strategy = registry.create(config(" SuperTrend ", 1, 0.0005, null));

        assertInstanceOf(SupertrendStrategy.class, strategy);
        assertInstanceOf(MarketMakingStrategy.class, registry.create(config("market-making", 1, 0.0005, null)));
    }

    @Test
    void testUnknownStrategyRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> registry.create(config("grid", 1, 0.0005, null)));
        assertTrue(e.getMessage().contains("grid"));
    }

    @Test
    void testDuplicateRegistrationRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> registry.register("supertrend", MarketMakingStrategy::new));
    }
}
