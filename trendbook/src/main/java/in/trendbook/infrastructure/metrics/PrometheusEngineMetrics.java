package in.trendbook.infrastructure.metrics;

import in.trendbook.domain.book.BookSide;
import in.trendbook.domain.book.BookUpdateResult;
import in.trendbook.domain.order.OrderCommand;
import in.trendbook.domain.signal.TradingSignal;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of EngineMetrics.
 *
 * Key Metrics:
 * - trendbook_book_updates_total{type, result} - Snapshot/delta outcomes
 * - trendbook_book_update_seconds{type} - Time spent applying updates
 * - trendbook_book_entries_skipped_total{side} - Entries dropped by validation
 * - trendbook_book_sequence_gaps_total - Deltas that skipped sequence ids
 * - trendbook_malformed_messages_total{source} - Unparseable inbound messages
 * - trendbook_order_commands_total{type, result} - Command outcomes
 * - trendbook_order_retries_total{operation} - Retry attempts
 * - trendbook_decision_cycles_total{strategy} - Decision cycles run
 * - trendbook_signal{strategy} - Last acted signal (1 long, -1 short, 0 none)
 *
 * Usage:
 * <pre>
 * PrometheusEngineMetrics metrics = new PrometheusEngineMetrics(new CollectorRegistry());
 * OrderBookEngine engine = new OrderBookEngine(StoreType.SKIPLIST, metrics, Clock.systemUTC());
 *
 * // Expose at /metrics
 * new MonitoringServer(port, metrics.getRegistry(), engine).start();
 * </pre>
 */
public final class PrometheusEngineMetrics implements EngineMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusEngineMetrics.class);

    private final CollectorRegistry registry;

    // Book metrics
    private final Counter bookUpdates;
    private final Histogram bookUpdateLatency;
    private final Counter skippedEntries;
    private final Counter sequenceGaps;
    private final Counter malformedMessages;

    // Execution metrics
    private final Counter orderCommands;
    private final Counter retries;

    // Strategy metrics
    private final Counter decisionCycles;
    private final Gauge signal;

    public PrometheusEngineMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusEngineMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.bookUpdates = Counter.build()
            .name("trendbook_book_updates_total")
            .help("Total order book snapshot/delta applications by outcome")
            .labelNames("type", "result")
            .register(registry);

        this.bookUpdateLatency = Histogram.build()
            .name("trendbook_book_update_seconds")
            .help("Time spent applying order book updates in seconds")
            .labelNames("type")
            .buckets(0.00001, 0.00005, 0.0001, 0.0005, 0.001, 0.005, 0.01)
            .register(registry);

        this.skippedEntries = Counter.build()
            .name("trendbook_book_entries_skipped_total")
            .help("Market-data entries skipped by per-entry validation")
            .labelNames("side")
            .register(registry);

        this.sequenceGaps = Counter.build()
            .name("trendbook_book_sequence_gaps_total")
            .help("Deltas received with a sequence id beyond last applied + 1")
            .register(registry);

        this.malformedMessages = Counter.build()
            .name("trendbook_malformed_messages_total")
            .help("Inbound messages rejected as structurally malformed")
            .labelNames("source")
            .register(registry);

        this.orderCommands = Counter.build()
            .name("trendbook_order_commands_total")
            .help("Order commands executed by outcome")
            .labelNames("type", "result")
            .register(registry);

        this.retries = Counter.build()
            .name("trendbook_order_retries_total")
            .help("Retry attempts at the execution boundary")
            .labelNames("operation")
            .register(registry);

        this.decisionCycles = Counter.build()
            .name("trendbook_decision_cycles_total")
            .help("Decision cycles run")
            .labelNames("strategy")
            .register(registry);

        this.signal = Gauge.build()
            .name("trendbook_signal")
            .help("Last acted signal (1 long, -1 short, 0 none)")
            .labelNames("strategy")
            .register(registry);

        log.info("[PrometheusEngineMetrics] Initialized");
    }

    @Override
    public void recordBookUpdate(String updateType, BookUpdateResult result, Duration latency) {
        bookUpdates.labels(updateType, result.name().toLowerCase()).inc();
        bookUpdateLatency.labels(updateType).observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordSkippedEntry(BookSide side) {
        skippedEntries.labels(side.name().toLowerCase()).inc();
    }

    @Override
    public void recordSequenceGap(long expected, long received) {
        sequenceGaps.inc();
    }

    @Override
    public void recordMalformedMessage(String source) {
        malformedMessages.labels(source).inc();
    }

    @Override
    public void recordCommand(OrderCommand.CommandType type, boolean success) {
        orderCommands.labels(type.name().toLowerCase(), success ? "success" : "failure").inc();
    }

    @Override
    public void recordRetry(String operation, int attempt) {
        retries.labels(operation).inc();
    }

    @Override
    public void recordDecisionCycle(String strategy) {
        decisionCycles.labels(strategy).inc();
    }

    @Override
    public void recordSignal(String strategy, TradingSignal value) {
        signal.labels(strategy).set(value.gaugeValue());
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
