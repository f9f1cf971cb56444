package in.trendbook.bootstrap;

import in.trendbook.config.EngineConfig;
import in.trendbook.config.StrategyConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Startup configuration validator.
 *
 * Runs before anything is wired. Collects every problem and throws one
 * IllegalStateException listing them all, so the process refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    private StartupConfigValidator() {}

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(EngineConfig engine, StrategyConfig strategy, Set<String> strategyNames) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        List<String> problems = new ArrayList<>();

        if (engine.symbol() == null || engine.symbol().isBlank()) {
            problems.add("TRENDBOOK_SYMBOL must be set");
        }
        if (!engine.dryRun()) {
            problems.add("TRENDBOOK_DRY_RUN=false requires a live execution adapter; only the paper gateway is bundled");
        }
        if (engine.metricsPort() < 0 || engine.metricsPort() > 65535) {
            problems.add("TRENDBOOK_METRICS_PORT out of range: " + engine.metricsPort());
        }
        if (engine.leverage() == null || engine.leverage().signum() <= 0) {
            problems.add("TRENDBOOK_LEVERAGE must be positive: " + engine.leverage());
        }
        if (engine.retryMaxAttempts() < 1) {
            problems.add("TRENDBOOK_RETRY_MAX_ATTEMPTS must be at least 1: " + engine.retryMaxAttempts());
        }
        if (engine.retryMultiplier() <= 1.0) {
            problems.add("TRENDBOOK_RETRY_MULTIPLIER must be greater than 1.0: " + engine.retryMultiplier());
        }
        if (engine.retryInitialDelay().isZero() || engine.retryInitialDelay().isNegative()
            || engine.retryInitialDelay().compareTo(engine.retryMaxDelay()) > 0) {
            problems.add("retry delays invalid: initial " + engine.retryInitialDelay() + ", max " + engine.retryMaxDelay());
        }
        if (engine.candlePollInterval().isZero() || engine.candlePollInterval().isNegative()) {
            problems.add("TRENDBOOK_CANDLE_POLL_SECONDS must be positive");
        }
        if (engine.decisionInterval().isZero() || engine.decisionInterval().isNegative()) {
            problems.add("TRENDBOOK_DECISION_INTERVAL_MS must be positive");
        }

        if (!strategy.isValid()) {
            problems.add("strategy configuration invalid: " + strategy);
        } else {
            if (!strategyNames.contains(strategy.strategy().trim().toLowerCase())) {
                problems.add("unknown strategy '" + strategy.strategy() + "', available: " + strategyNames);
            }
            if (engine.candleCapacity() < strategy.atrPeriod() + 1) {
                problems.add("TRENDBOOK_CANDLE_CAPACITY " + engine.candleCapacity()
                    + " cannot hold atrPeriod + 1 = " + (strategy.atrPeriod() + 1) + " candles");
            }
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException("❌ INVALID CONFIG - system refuses to start:\n  - "
                + String.join("\n  - ", problems));
        }

        log.info("✓ Symbol {} / store {} / strategy {}", engine.symbol(), engine.storeType(), strategy.strategy());
        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }
}
