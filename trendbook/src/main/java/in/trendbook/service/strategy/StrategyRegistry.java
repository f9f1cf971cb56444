package in.trendbook.service.strategy;

import in.trendbook.config.StrategyConfig;
import in.trendbook.infrastructure.metrics.EngineMetrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Maps configuration names to strategy constructors. Populated once at startup.
 */
public final class StrategyRegistry {

    private final Map<String, Function<StrategyConfig, TradingStrategy>> factories = new LinkedHashMap<>();

    public static StrategyRegistry withDefaults(EngineMetrics metrics) {
        StrategyRegistry registry = new StrategyRegistry();
        registry.register(SupertrendStrategy.NAME, config -> new SupertrendStrategy(config, metrics));
        registry.register(MarketMakingStrategy.NAME, MarketMakingStrategy::new);
        return registry;
    }

    public void register(String name, Function<StrategyConfig, TradingStrategy> factory) {
        if (factories.putIfAbsent(key(name), factory) != null) {
            throw new IllegalArgumentException("Strategy already registered: " + name);
        }
    }

    /**
     * @throws IllegalArgumentException if no strategy is registered under {@code config.strategy()}
     */
    public TradingStrategy create(StrategyConfig config) {
        Function<StrategyConfig, TradingStrategy> factory = factories.get(key(config.strategy()));
        if (factory == null) {
            throw new IllegalArgumentException("Unknown strategy '" + config.strategy()
                + "', available: " + factories.keySet());
        }
        return factory.apply(config);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    private static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase();
    }
}
