package in.trendbook.config;

import in.trendbook.infrastructure.execution.RetryPolicy;
import in.trendbook.service.book.StoreType;
import in.trendbook.util.Env;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Process-level settings, read from the environment.
 */
public record EngineConfig(
    String symbol,
    StoreType storeType,
    int candleCapacity,
    Duration candlePollInterval,
    Duration decisionInterval,
    int metricsPort,            // 0 disables the monitoring server
    int retryMaxAttempts,
    Duration retryInitialDelay,
    Duration retryMaxDelay,
    double retryMultiplier,
    BigDecimal leverage,
    boolean dryRun,             // route orders to the paper gateway
    BigDecimal paperBalance,
    String strategyConfigPath,
    String klineFile            // kline REST response kept current by an external collector
) {
    public static EngineConfig fromEnv() {
        return new EngineConfig(
            Env.get("TRENDBOOK_SYMBOL", "BTCUSDT"),
            StoreType.fromString(Env.get("TRENDBOOK_STORE", "SKIPLIST")),
            Env.getInt("TRENDBOOK_CANDLE_CAPACITY", 500),
            Duration.ofSeconds(Env.getLong("TRENDBOOK_CANDLE_POLL_SECONDS", 30)),
            Duration.ofMillis(Env.getLong("TRENDBOOK_DECISION_INTERVAL_MS", 1000)),
            Env.getInt("TRENDBOOK_METRICS_PORT", 9091),
            Env.getInt("TRENDBOOK_RETRY_MAX_ATTEMPTS", 3),
            Duration.ofMillis(Env.getLong("TRENDBOOK_RETRY_INITIAL_DELAY_MS", 200)),
            Duration.ofMillis(Env.getLong("TRENDBOOK_RETRY_MAX_DELAY_MS", 5000)),
            Env.getDouble("TRENDBOOK_RETRY_MULTIPLIER", 2.0),
            Env.getDecimal("TRENDBOOK_LEVERAGE", BigDecimal.ONE),
            Env.getBool("TRENDBOOK_DRY_RUN", true),
            Env.getDecimal("TRENDBOOK_PAPER_BALANCE", new BigDecimal("10000")),
            Env.get("TRENDBOOK_STRATEGY_CONFIG", "config/strategy.json"),
            Env.get("TRENDBOOK_KLINE_FILE", "data/kline.json")
        );
    }

    public RetryPolicy orderRetryPolicy() {
        return RetryPolicy.builder()
            .initialDelay(retryInitialDelay)
            .maxDelay(retryMaxDelay)
            .multiplier(retryMultiplier)
            .maxAttempts(retryMaxAttempts)
            .build();
    }
}
