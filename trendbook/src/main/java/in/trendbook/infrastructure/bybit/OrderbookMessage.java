package in.trendbook.infrastructure.bybit;

import in.trendbook.domain.book.BookDelta;
import in.trendbook.domain.book.BookEntry;
import in.trendbook.domain.book.BookSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Parsed orderbook stream message. Sides are null when absent from the payload.
 */
public record OrderbookMessage(
    Type type,
    String symbol,
    List<BookEntry> bids,
    List<BookEntry> asks,
    Long sequenceId,
    Instant timestamp
) {
    public enum Type {
        SNAPSHOT,
        DELTA
    }

    public BookSnapshot toSnapshot() {
        return new BookSnapshot(bids, asks, sequenceId);
    }

    public BookDelta toDelta() {
        return new BookDelta(bids, asks, sequenceId);
    }
}
