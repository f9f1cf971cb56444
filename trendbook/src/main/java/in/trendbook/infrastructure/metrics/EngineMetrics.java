package in.trendbook.infrastructure.metrics;

import in.trendbook.domain.book.BookSide;
import in.trendbook.domain.book.BookUpdateResult;
import in.trendbook.domain.order.OrderCommand;
import in.trendbook.domain.signal.TradingSignal;

import java.time.Duration;

/**
 * Engine metrics for monitoring and alerting.
 *
 * All methods default to no-ops so core components can run without a registry.
 *
 * Key metrics:
 * - Book update outcomes and latency
 * - Skipped market-data entries and sequence gaps
 * - Order command outcomes and retries
 * - Decision cycles and current signal
 */
public interface EngineMetrics {

    /**
     * Record a snapshot or delta application.
     *
     * @param updateType "snapshot" or "delta"
     * @param result     outcome
     * @param latency    time spent inside the book lock
     */
    default void recordBookUpdate(String updateType, BookUpdateResult result, Duration latency) {}

    /**
     * Record a single market-data entry skipped by validation.
     */
    default void recordSkippedEntry(BookSide side) {}

    /**
     * Record a delta whose sequence id skipped past last+1.
     */
    default void recordSequenceGap(long expected, long received) {}

    /**
     * Record an inbound message that could not be parsed.
     *
     * @param source "orderbook", "account", "kline"
     */
    default void recordMalformedMessage(String source) {}

    default void recordCommand(OrderCommand.CommandType type, boolean success) {}

    /**
     * Record a retry attempt at the execution boundary.
     *
     * @param operation placeOrder / cancelOrder / cancelAllOrders / bootstrap step
     * @param attempt   1-based attempt number that failed
     */
    default void recordRetry(String operation, int attempt) {}

    default void recordDecisionCycle(String strategy) {}

    default void recordSignal(String strategy, TradingSignal signal) {}

    static EngineMetrics noop() {
        return NoOp.INSTANCE;
    }

    final class NoOp implements EngineMetrics {
        private static final NoOp INSTANCE = new NoOp();

        private NoOp() {}
    }
}
