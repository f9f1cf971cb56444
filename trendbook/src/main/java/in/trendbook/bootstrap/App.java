package in.trendbook.bootstrap;

import in.trendbook.application.service.BootstrapException;
import in.trendbook.application.service.TradingSession;
import in.trendbook.config.EngineConfig;
import in.trendbook.config.StrategyConfig;
import in.trendbook.config.StrategyConfigLoader;
import in.trendbook.infrastructure.bybit.FileKlineSource;
import in.trendbook.infrastructure.bybit.KlineParser;
import in.trendbook.infrastructure.bybit.StreamMessageRouter;
import in.trendbook.infrastructure.execution.PaperOrderGateway;
import in.trendbook.infrastructure.execution.RetryingOrderGateway;
import in.trendbook.infrastructure.http.MonitoringServer;
import in.trendbook.infrastructure.metrics.PrometheusEngineMetrics;
import in.trendbook.service.account.AccountStateTracker;
import in.trendbook.service.book.OrderBookEngine;
import in.trendbook.service.execution.OrderCommandExecutor;
import in.trendbook.service.indicator.CandleWindow;
import in.trendbook.service.strategy.StrategyRegistry;
import in.trendbook.service.strategy.TradingStrategy;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Entry point (NO Spring).
 *
 * Wires one trading session for one instrument in dry-run mode. Stream messages arrive one
 * JSON document per line on stdin and are routed by topic into
 * {@link TradingSession#onOrderbookMessage(String)} and {@link TradingSession#onAccountMessage(String)}.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== trendbook starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        EngineConfig config = EngineConfig.fromEnv();
        StrategyConfig strategyConfig = StrategyConfigLoader.load(Path.of(config.strategyConfigPath()));

        // ═══════════════════════════════════════════════════════════════
        // Metrics
        // ═══════════════════════════════════════════════════════════════
        CollectorRegistry registry = new CollectorRegistry();
        PrometheusEngineMetrics metrics = new PrometheusEngineMetrics(registry);
        StrategyRegistry strategies = StrategyRegistry.withDefaults(metrics);

        try {
            StartupConfigValidator.validate(config, strategyConfig, strategies.names());
        } catch (IllegalStateException e) {
            log.error(e.getMessage());
            System.exit(1);
            return;
        }

        // ═══════════════════════════════════════════════════════════════
        // Core
        // ═══════════════════════════════════════════════════════════════
        OrderBookEngine book = new OrderBookEngine(config.symbol(), config.storeType(), metrics, Clock.systemUTC());
        AccountStateTracker account = new AccountStateTracker(config.symbol());
        TradingStrategy strategy = strategies.create(strategyConfig);

        PaperOrderGateway paper = new PaperOrderGateway(config.symbol(), config.paperBalance(),
            book::bestBidAsk, account::onOrder, account::onPosition);
        OrderCommandExecutor executor = new OrderCommandExecutor(
            new RetryingOrderGateway(paper, config.orderRetryPolicy(), metrics), account, metrics);

        TradingSession session = TradingSession.builder()
            .symbol(config.symbol())
            .leverage(config.leverage())
            .candlePollInterval(config.candlePollInterval())
            .decisionInterval(config.decisionInterval())
            .book(book)
            .candles(new CandleWindow(config.candleCapacity()))
            .account(account)
            .strategy(strategy)
            .candleSource(new FileKlineSource(Path.of(config.klineFile()), new KlineParser()))
            .accountSource(paper)
            .executor(executor)
            .metrics(metrics)
            .onTopOfBook(paper::match)
            .build();

        // ═══════════════════════════════════════════════════════════════
        // Monitoring
        // ═══════════════════════════════════════════════════════════════
        MonitoringServer monitoring = null;
        if (config.metricsPort() > 0) {
            monitoring = new MonitoringServer("0.0.0.0", config.metricsPort(), registry, book);
            monitoring.start();
        }

        try {
            session.bootstrap();
        } catch (BootstrapException e) {
            log.error("❌ {} - refusing to trade", e.getMessage(), e);
            if (monitoring != null) monitoring.stop();
            System.exit(1);
            return;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        MonitoringServer server = monitoring;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");
            session.stop();
            if (server != null) server.stop();
            stopped.countDown();
        }, "trendbook-shutdown"));

        session.start();
        startStdinFeed(new StreamMessageRouter(session::onOrderbookMessage, session::onAccountMessage));
        log.info("✅ trendbook running: {} / {} (dry run), waiting for market data", config.symbol(), strategy.name());

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void startStdinFeed(StreamMessageRouter router) {
        Thread feed = new Thread(() -> {
            BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            try {
                long routed = router.pump(reader);
                log.info("Market-data input closed after {} messages", routed);
            } catch (IOException e) {
                log.error("Market-data input failed: {}", e.getMessage(), e);
            }
        }, "trendbook-feed");
        feed.setDaemon(true);
        feed.start();
    }

    private App() {}
}
