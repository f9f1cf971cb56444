package in.trendbook.infrastructure.metrics;

import in.trendbook.domain.book.BookSide;
import in.trendbook.domain.book.BookUpdateResult;
import in.trendbook.domain.order.OrderCommand;
import in.trendbook.domain.signal.TradingSignal;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PrometheusEngineMetricsTest {

    private CollectorRegistry registry;
    private PrometheusEngineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        metrics = new PrometheusEngineMetrics(registry);
    }

    private double sample(String name, String[] labels, String[] values) {
        Double value = registry.getSampleValue(name, labels, values);
        return value == null ? 0.0 : value;
    }

    @Test
    void testBookUpdateCountersAndLatency() {
        metrics.recordBookUpdate("delta", BookUpdateResult.APPLIED, Duration.ofNanos(20_000));
        metrics.recordBookUpdate("delta", BookUpdateResult.APPLIED, Duration.ofNanos(30_000));
        metrics.recordBookUpdate("delta", BookUpdateResult.DISCARDED_STALE, Duration.ZERO);

        String[] labels = {"type", "result"};
        assertEquals(2.0, sample("trendbook_book_updates_total", labels, new String[] {"delta", "applied"}));
        assertEquals(1.0, sample("trendbook_book_updates_total", labels, new String[] {"delta", "discarded_stale"}));
        assertEquals(3.0, sample("trendbook_book_update_seconds_count", new String[] {"type"}, new String[] {"delta"}));
        assertEquals(0.00005, sample("trendbook_book_update_seconds_sum", new String[] {"type"}, new String[] {"delta"}), 1e-9);
    }

    @Test
    void testMarketDataQualityCounters() {
        metrics.recordSkippedEntry(BookSide.BID);
        metrics.recordSkippedEntry(BookSide.BID);
        metrics.recordSequenceGap(5, 9);
        metrics.recordMalformedMessage("orderbook");

        assertEquals(2.0, sample("trendbook_book_entries_skipped_total", new String[] {"side"}, new String[] {"bid"}));
        assertEquals(1.0, registry.getSampleValue("trendbook_book_sequence_gaps_total"));
        assertEquals(1.0, sample("trendbook_malformed_messages_total", new String[] {"source"}, new String[] {"orderbook"}));
    }

    @Test
    void testExecutionAndStrategyMetrics() {
        metrics.recordCommand(OrderCommand.CommandType.PLACE, true);
        metrics.recordCommand(OrderCommand.CommandType.PLACE, false);
        metrics.recordRetry("placeOrder", 1);
        metrics.recordDecisionCycle("supertrend");
        metrics.recordSignal("supertrend", TradingSignal.SHORT);

        String[] labels = {"type", "result"};
        assertEquals(1.0, sample("trendbook_order_commands_total", labels, new String[] {"place", "success"}));
        assertEquals(1.0, sample("trendbook_order_commands_total", labels, new String[] {"place", "failure"}));
        assertEquals(1.0, sample("trendbook_order_retries_total", new String[] {"operation"}, new String[] {"placeOrder"}));
        assertEquals(1.0, sample("trendbook_decision_cycles_total", new String[] {"strategy"}, new String[] {"supertrend"}));
        assertEquals(-1.0, sample("trendbook_signal", new String[] {"strategy"}, new String[] {"supertrend"}));
    }

    @Test
    void testNoopMetricsAcceptEverything() {
        EngineMetrics noop = EngineMetrics.noop();

        assertDoesNotThrow(() -> {
            noop.recordBookUpdate("snapshot", BookUpdateResult.APPLIED, Duration.ZERO);
            noop.recordSignal("supertrend", TradingSignal.LONG);
        });
        assertSame(noop, EngineMetrics.noop());
    }
}
