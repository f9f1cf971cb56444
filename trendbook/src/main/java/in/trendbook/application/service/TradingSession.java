package in.trendbook.application.service;

import in.trendbook.application.port.output.AccountSource;
import in.trendbook.application.port.output.CandleSource;
import in.trendbook.domain.account.OrderRecord;
import in.trendbook.domain.account.PositionUpdate;
import in.trendbook.domain.book.BookUpdateResult;
import in.trendbook.domain.book.TopOfBook;
import in.trendbook.domain.data.Candle;
import in.trendbook.domain.order.CommandResult;
import in.trendbook.domain.order.OrderCommand;
import in.trendbook.infrastructure.bybit.AccountEventParser;
import in.trendbook.infrastructure.bybit.AccountEvents;
import in.trendbook.infrastructure.bybit.MalformedMessageException;
import in.trendbook.infrastructure.bybit.OrderbookMessage;
import in.trendbook.infrastructure.bybit.OrderbookMessageParser;
import in.trendbook.infrastructure.execution.RetryPolicy;
import in.trendbook.infrastructure.metrics.EngineMetrics;
import in.trendbook.service.account.AccountStateTracker;
import in.trendbook.service.book.OrderBookEngine;
import in.trendbook.service.execution.OrderCommandExecutor;
import in.trendbook.service.indicator.CandleWindow;
import in.trendbook.service.strategy.TradingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs one strategy against one instrument.
 *
 * Scheduling model:
 * - One daemon scheduler thread runs the candle poller, the decision loop and every
 *   account-event handler, so account state has a single writer and the strategy reads it
 *   only between those units of work
 * - Market-data messages are applied on the caller's (transport) thread; the book
 *   serializes access with its own lock
 * - A shared stop flag is checked at the start of every unit of work
 *
 * Lifecycle:
 * <pre>
 * session.bootstrap();   // leverage, wallet, position, open orders; fatal on exhaustion
 * session.start();       // schedule poller + decision loop
 * ...
 * session.stop();        // cancel entry orders, drain scheduler
 * </pre>
 */
public final class TradingSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TradingSession.class);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final String symbol;
    private final BigDecimal leverage;
    private final Duration candlePollInterval;
    private final Duration decisionInterval;
    private final OrderBookEngine book;
    private final CandleWindow candles;
    private final AccountStateTracker account;
    private final TradingStrategy strategy;
    private final CandleSource candleSource;
    private final AccountSource accountSource;
    private final OrderCommandExecutor executor;
    private final RetryPolicy bootstrapRetry;
    private final EngineMetrics metrics;
    private final OrderbookMessageParser bookParser;
    private final AccountEventParser accountParser;
    private final List<Consumer<TopOfBook>> topOfBookListeners;

    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    private TradingSession(Builder b) {
        this.symbol = Objects.requireNonNull(b.symbol, "symbol");
        this.leverage = b.leverage;
        this.candlePollInterval = b.candlePollInterval;
        this.decisionInterval = b.decisionInterval;
        this.book = Objects.requireNonNull(b.book, "book");
        this.candles = Objects.requireNonNull(b.candles, "candles");
        this.account = Objects.requireNonNull(b.account, "account");
        this.strategy = Objects.requireNonNull(b.strategy, "strategy");
        this.candleSource = Objects.requireNonNull(b.candleSource, "candleSource");
        this.accountSource = Objects.requireNonNull(b.accountSource, "accountSource");
        this.executor = Objects.requireNonNull(b.executor, "executor");
        this.bootstrapRetry = b.bootstrapRetry;
        this.metrics = b.metrics;
        this.bookParser = b.bookParser;
        this.accountParser = b.accountParser;
        this.topOfBookListeners = List.copyOf(b.topOfBookListeners);
        this.scheduler = b.scheduler != null ? b.scheduler : Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "trendbook-" + symbol);
            t.setDaemon(true);
            return t;
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Set leverage and seed account state. Each step is retried independently.
     *
     * @throws BootstrapException if a step still fails after the last retry
     */
    public void bootstrap() {
        log.info("[{}] Bootstrapping session (strategy={})", symbol, strategy.name());

        runStep("setLeverage", () -> {
            accountSource.setLeverage(symbol, leverage);
            return null;
        });
        BigDecimal wallet = runStep("fetchWalletBalance", accountSource::fetchWalletBalance);
        PositionUpdate position = runStep("fetchPosition", () -> accountSource.fetchPosition(symbol));
        List<OrderRecord> openOrders = runStep("fetchOpenOrders", () -> accountSource.fetchOpenOrders(symbol));

        account.seed(wallet, position, openOrders);
        strategy.initialize(account.snapshot());
        log.info("[{}] ✅ Bootstrap complete", symbol);
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Session already started");
        }
        scheduler.scheduleWithFixedDelay(() -> guard("candle poll", this::pollCandles),
            0, candlePollInterval.toMillis(), TimeUnit.MILLISECONDS);
        scheduler.scheduleWithFixedDelay(() -> guard("decision cycle", this::runDecisionCycle),
            decisionInterval.toMillis(), decisionInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[{}] Session started: candles every {}s, decisions every {}ms", symbol,
            candlePollInterval.toSeconds(), decisionInterval.toMillis());
    }

    /**
     * Request stop, cancel outstanding entry orders and wait for the scheduler to drain.
     * In-flight calls are allowed to finish; nothing is interrupted.
     */
    public void stop() {
        if (!stopRequested.compareAndSet(false, true)) {
            return;
        }
        log.info("[{}] Stopping session", symbol);
        try {
            if (started.get()) {
                scheduler.submit(this::cancelEntryOrders).get(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            } else {
                cancelEntryOrders();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted while cancelling entry orders", symbol);
        } catch (Exception e) {
            log.error("[{}] Failed to cancel entry orders on shutdown: {}", symbol, e.getMessage(), e);
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[{}] Scheduler did not terminate within {}s", symbol, SHUTDOWN_TIMEOUT.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[{}] Session stopped", symbol);
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isStopped() {
        return stopRequested.get();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // INBOUND FEEDS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Apply one orderbook stream message. Called by the market-data transport, in stream order.
     */
    public BookUpdateResult onOrderbookMessage(String json) {
        OrderbookMessage message;
        try {
            message = bookParser.parse(json);
        } catch (MalformedMessageException e) {
            log.warn("[{}] {}", symbol, e.getMessage());
            metrics.recordMalformedMessage("orderbook");
            return BookUpdateResult.REJECTED_MALFORMED;
        }
        return message.type() == OrderbookMessage.Type.SNAPSHOT
            ? book.applySnapshot(message.toSnapshot())
            : book.applyDelta(message.toDelta());
    }

    /**
     * Queue one private-stream message for the scheduler thread.
     */
    public void onAccountMessage(String json) {
        if (stopRequested.get()) {
            return;
        }
        try {
            scheduler.execute(() -> guard("account event", () -> applyAccountMessage(json)));
        } catch (RejectedExecutionException e) {
            // stop() shut the scheduler down after the flag check
            log.debug("[{}] Dropping account message received during shutdown", symbol);
        }
    }

    /**
     * Decode and apply a private-stream message on the current thread.
     *
     * @return false if the message was malformed
     */
    boolean applyAccountMessage(String json) {
        AccountEvents events;
        try {
            events = accountParser.parse(json);
        } catch (MalformedMessageException e) {
            log.warn("[{}] {}", symbol, e.getMessage());
            metrics.recordMalformedMessage("account");
            return false;
        }
        events.positions().forEach(account::onPosition);
        events.orders().forEach(account::onOrder);
        events.wallets().forEach(account::onWallet);
        return true;
    }

    /**
     * True when the book needs a fresh snapshot (before the first one, or after a sequence gap).
     */
    public boolean resyncRequired() {
        return book.resyncRequired();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // PERIODIC WORK
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Fetch candles, merge them into the window and hand the window to the strategy.
     */
    public void pollCandles() {
        if (stopRequested.get()) {
            return;
        }
        List<Candle> fetched = candleSource.fetchCandles(symbol, strategy.klineInterval(), strategy.klineLimit());
        int changed = candles.mergeAll(fetched);
        log.debug("[{}] Fetched {} candles, {} changed, window {}", symbol, fetched.size(), changed, candles.size());
        strategy.onCandleUpdate(candles.snapshot());
    }

    /**
     * One decision: read top of book, ask the strategy, execute its commands.
     */
    public List<CommandResult> runDecisionCycle() {
        if (stopRequested.get()) {
            return List.of();
        }
        TopOfBook top = book.bestBidAsk();
        for (Consumer<TopOfBook> listener : topOfBookListeners) {
            listener.accept(top);
        }
        strategy.onBookUpdate(top);
        List<OrderCommand> commands = strategy.decide(account.snapshot());
        metrics.recordDecisionCycle(strategy.name());
        if (commands.isEmpty()) {
            return List.of();
        }
        return executor.execute(commands);
    }

    private void cancelEntryOrders() {
        List<OrderCommand> commands = strategy.shutdown(account.snapshot());
        List<CommandResult> results = executor.execute(commands);
        long failed = results.stream().filter(r -> !r.success()).count();
        if (failed > 0) {
            log.warn("[{}] {} shutdown command(s) failed", symbol, failed);
        }
    }

    private <T> T runStep(String step, Supplier<T> action) {
        try {
            return bootstrapRetry.execute(step, action, (attempt, cause) -> metrics.recordRetry(step, attempt));
        } catch (RuntimeException e) {
            log.error("[{}] ❌ Bootstrap step {} failed: {}", symbol, step, e.getMessage());
            throw new BootstrapException(step, e.getMessage(), e);
        }
    }

    /**
     * Keep a periodic task alive across unexpected failures.
     */
    private void guard(String task, Runnable work) {
        try {
            work.run();
        } catch (RuntimeException e) {
            log.error("[{}] {} failed: {}", symbol, task, e.getMessage(), e);
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // BUILDER
    // ═══════════════════════════════════════════════════════════════════════

    public static class Builder {
        private String symbol;
        private BigDecimal leverage = BigDecimal.ONE;
        private Duration candlePollInterval = Duration.ofSeconds(30);
        private Duration decisionInterval = Duration.ofSeconds(1);
        private OrderBookEngine book;
        private CandleWindow candles;
        private AccountStateTracker account;
        private TradingStrategy strategy;
        private CandleSource candleSource;
        private AccountSource accountSource;
        private OrderCommandExecutor executor;
        private RetryPolicy bootstrapRetry = RetryPolicy.forBootstrap();
        private EngineMetrics metrics = EngineMetrics.noop();
        private OrderbookMessageParser bookParser = new OrderbookMessageParser();
        private AccountEventParser accountParser = new AccountEventParser();
        private final List<Consumer<TopOfBook>> topOfBookListeners = new ArrayList<>();
        private ScheduledExecutorService scheduler;

        public Builder symbol(String symbol) { this.symbol = symbol; return this; }
        public Builder leverage(BigDecimal leverage) { this.leverage = leverage; return this; }
        public Builder candlePollInterval(Duration interval) { this.candlePollInterval = positive(interval); return this; }
        public Builder decisionInterval(Duration interval) { this.decisionInterval = positive(interval); return this; }
        public Builder book(OrderBookEngine book) { this.book = book; return this; }
        public Builder candles(CandleWindow candles) { this.candles = candles; return this; }
        public Builder account(AccountStateTracker account) { this.account = account; return this; }
        public Builder strategy(TradingStrategy strategy) { this.strategy = strategy; return this; }
        public Builder candleSource(CandleSource source) { this.candleSource = source; return this; }
        public Builder accountSource(AccountSource source) { this.accountSource = source; return this; }
        public Builder executor(OrderCommandExecutor executor) { this.executor = executor; return this; }
        public Builder bootstrapRetry(RetryPolicy policy) { this.bootstrapRetry = policy; return this; }
        public Builder metrics(EngineMetrics metrics) { this.metrics = metrics; return this; }
        public Builder bookParser(OrderbookMessageParser parser) { this.bookParser = parser; return this; }
        public Builder accountParser(AccountEventParser parser) { this.accountParser = parser; return this; }

        /**
         * Single-threaded scheduler for all session work. Defaults to a daemon thread named after the symbol.
         */
        public Builder scheduler(ScheduledExecutorService scheduler) { this.scheduler = scheduler; return this; }

        /**
         * Called with the fresh top of book at the start of every decision cycle.
         */
        public Builder onTopOfBook(Consumer<TopOfBook> listener) {
            this.topOfBookListeners.add(listener);
            return this;
        }

        public TradingSession build() {
            return new TradingSession(this);
        }

        private static Duration positive(Duration d) {
            if (d == null || d.isNegative() || d.isZero()) {
                throw new IllegalArgumentException("interval must be positive: " + d);
            }
            return d;
        }
    }
}
