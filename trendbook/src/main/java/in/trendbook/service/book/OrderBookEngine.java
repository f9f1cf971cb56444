package in.trendbook.service.book;

import in.trendbook.domain.book.BookDelta;
import in.trendbook.domain.book.BookDepth;
import in.trendbook.domain.book.BookEntry;
import in.trendbook.domain.book.BookIntegrityReport;
import in.trendbook.domain.book.BookSide;
import in.trendbook.domain.book.BookSnapshot;
import in.trendbook.domain.book.BookUpdateResult;
import in.trendbook.domain.book.MarketImpact;
import in.trendbook.domain.book.PriceLevel;
import in.trendbook.domain.book.TopOfBook;
import in.trendbook.domain.order.OrderSide;
import in.trendbook.infrastructure.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Order book for one instrument: one {@link PriceLevelStore} per side, fed by snapshots and deltas.
 *
 * Concurrency:
 * - Every operation, read or write, takes the same exclusive lock
 * - A reader never observes a side mid-reset or mid-delta
 * - Heap depth queries (pop + reinsert) are safe because they run under the lock
 *
 * Sequencing:
 * - A snapshot always resets both sides and sets the last applied sequence id
 * - A delta with id <= last applied is discarded (idempotent replay)
 * - A delta with id > last + 1 is applied but flags {@link #resyncRequired()}
 *
 * Usage:
 * <pre>
 * OrderBookEngine book = new OrderBookEngine("BTCUSDT", StoreType.SKIPLIST);
 * book.applySnapshot(snapshot);
 * book.applyDelta(delta);
 * TopOfBook top = book.bestBidAsk();
 * </pre>
 */
public final class OrderBookEngine {
    private static final Logger log = LoggerFactory.getLogger(OrderBookEngine.class);
    private static final MathContext MC = new MathContext(18, RoundingMode.HALF_UP);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int IMPACT_LEVELS = 100;

    private final String symbol;
    private final PriceLevelStore bids;
    private final PriceLevelStore asks;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private Long lastAppliedSequenceId;
    private boolean resyncRequired = true;   // until the first snapshot
    private long updateCount;

    public OrderBookEngine(String symbol, StoreType storeType) {
        this(symbol, storeType, EngineMetrics.noop(), Clock.systemUTC());
    }

    public OrderBookEngine(String symbol, StoreType storeType, EngineMetrics metrics, Clock clock) {
        this(symbol,
            PriceLevelStores.create(storeType, BookSide.BID),
            PriceLevelStores.create(storeType, BookSide.ASK),
            metrics, clock);
    }

    public OrderBookEngine(String symbol, PriceLevelStore bids, PriceLevelStore asks,
                           EngineMetrics metrics, Clock clock) {
        if (bids.side() != BookSide.BID || asks.side() != BookSide.ASK) {
            throw new IllegalArgumentException("stores must be (BID, ASK), got ("
                + bids.side() + ", " + asks.side() + ")");
        }
        this.symbol = symbol;
        this.bids = bids;
        this.asks = asks;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // UPDATES
    // ═══════════════════════════════════════════════════════════════════════

    public BookUpdateResult applySnapshot(List<BookEntry> bidEntries, List<BookEntry> askEntries, Long sequenceId) {
        return applySnapshot(new BookSnapshot(bidEntries, askEntries, sequenceId));
    }

    /**
     * Replace the whole book. Malformed snapshots are rejected with prior state intact.
     */
    public BookUpdateResult applySnapshot(BookSnapshot snapshot) {
        if (snapshot == null || !snapshot.isWellFormed()) {
            log.warn("[{}] Rejected malformed snapshot: {}", symbol, snapshot);
            metrics.recordBookUpdate("snapshot", BookUpdateResult.REJECTED_MALFORMED, Duration.ZERO);
            return BookUpdateResult.REJECTED_MALFORMED;
        }

        long elapsed;
        lock.lock();
        long start = System.nanoTime();
        try {
            Instant now = clock.instant();
            bids.clear();
            asks.clear();
            int inserted = insertSnapshotSide(bids, snapshot.bids(), now)
                + insertSnapshotSide(asks, snapshot.asks(), now);

            lastAppliedSequenceId = snapshot.sequenceId();
            resyncRequired = false;
            updateCount++;

            log.info("[{}] Snapshot applied: seq={}, levels={} ({} bids / {} asks)",
                symbol, snapshot.sequenceId(), inserted, bids.size(), asks.size());
        } finally {
            elapsed = System.nanoTime() - start;
            lock.unlock();
        }
        metrics.recordBookUpdate("snapshot", BookUpdateResult.APPLIED, Duration.ofNanos(elapsed));
        return BookUpdateResult.APPLIED;
    }

    public BookUpdateResult applyDelta(List<BookEntry> bidEntries, List<BookEntry> askEntries, Long sequenceId) {
        return applyDelta(new BookDelta(bidEntries, askEntries, sequenceId));
    }

    /**
     * Apply an incremental update. Quantity zero deletes the level, positive upserts it.
     */
    public BookUpdateResult applyDelta(BookDelta delta) {
        if (delta == null || !delta.isWellFormed()) {
            log.warn("[{}] Rejected malformed delta: {}", symbol, delta);
            metrics.recordBookUpdate("delta", BookUpdateResult.REJECTED_MALFORMED, Duration.ZERO);
            return BookUpdateResult.REJECTED_MALFORMED;
        }

        BookUpdateResult result;
        long elapsed;
        lock.lock();
        long start = System.nanoTime();
        try {
            long seq = delta.sequenceId();
            if (lastAppliedSequenceId != null && seq <= lastAppliedSequenceId) {
                log.debug("[{}] Discarding stale delta seq={} (last applied {})", symbol, seq, lastAppliedSequenceId);
                result = BookUpdateResult.DISCARDED_STALE;
            } else {
                if (lastAppliedSequenceId != null && seq > lastAppliedSequenceId + 1) {
                    log.warn("[{}] Sequence gap: expected {}, received {} - resync required",
                        symbol, lastAppliedSequenceId + 1, seq);
                    metrics.recordSequenceGap(lastAppliedSequenceId + 1, seq);
                    resyncRequired = true;
                }

                Instant now = clock.instant();
                applyDeltaSide(bids, delta.bids(), now);
                applyDeltaSide(asks, delta.asks(), now);

                lastAppliedSequenceId = seq;
                updateCount++;
                result = BookUpdateResult.APPLIED;
            }
        } finally {
            elapsed = System.nanoTime() - start;
            lock.unlock();
        }
        metrics.recordBookUpdate("delta", result, Duration.ofNanos(elapsed));
        return result;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // QUERIES
    // ═══════════════════════════════════════════════════════════════════════

    public TopOfBook bestBidAsk() {
        lock.lock();
        try {
            return new TopOfBook(bids.peekTop(), asks.peekTop());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Top {@code levels} per side, best first.
     */
    public BookDepth depth(int levels) {
        if (levels < 0) {
            throw new IllegalArgumentException("levels cannot be negative: " + levels);
        }
        lock.lock();
        try {
            return new BookDepth(bids.topN(levels), asks.topN(levels));
        } finally {
            lock.unlock();
        }
    }

    /**
     * (bidQty - askQty) / (bidQty + askQty) over the top {@code levels}; zero when both sides are empty.
     */
    public BigDecimal imbalance(int levels) {
        BookDepth d = depth(levels);
        BigDecimal bidQty = totalQuantity(d.bids());
        BigDecimal askQty = totalQuantity(d.asks());
        BigDecimal total = bidQty.add(askQty);
        if (total.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return bidQty.subtract(askQty).divide(total, MC);
    }

    /**
     * Volume-weighted mid over the top {@code levels}. Empty unless both sides have liquidity.
     */
    public Optional<BigDecimal> microprice(int levels) {
        BookDepth d = depth(Math.max(1, levels));
        if (d.bids().isEmpty() || d.asks().isEmpty()) {
            return Optional.empty();
        }
        BigDecimal bestBid = d.bids().get(0).price();
        BigDecimal bestAsk = d.asks().get(0).price();
        BigDecimal bidQty = totalQuantity(d.bids());
        BigDecimal askQty = totalQuantity(d.asks());
        BigDecimal weighted = bestBid.multiply(askQty).add(bestAsk.multiply(bidQty));
        return Optional.of(weighted.divide(bidQty.add(askQty), MC));
    }

    /**
     * Estimate the fill of a market order of {@code size} against the opposite side, walking at
     * most {@value #IMPACT_LEVELS} levels best-first. Empty when the opposite side has no liquidity.
     * {@code executedQuantity} is below {@code size} when the walked depth cannot absorb the order.
     */
    public Optional<MarketImpact> marketImpact(BigDecimal size, OrderSide side) {
        if (size == null || size.signum() <= 0) {
            throw new IllegalArgumentException("size must be positive: " + size);
        }
        if (side == null) {
            throw new IllegalArgumentException("side cannot be null");
        }
        List<PriceLevel> levels;
        lock.lock();
        try {
            levels = side == OrderSide.BUY ? asks.topN(IMPACT_LEVELS) : bids.topN(IMPACT_LEVELS);
        } finally {
            lock.unlock();
        }
        if (levels.isEmpty()) {
            return Optional.empty();
        }

        BigDecimal remaining = size;
        BigDecimal executed = BigDecimal.ZERO;
        BigDecimal totalCost = BigDecimal.ZERO;
        BigDecimal worst = levels.get(0).price();
        for (PriceLevel level : levels) {
            if (remaining.signum() <= 0) {
                break;
            }
            BigDecimal fill = remaining.min(level.quantity());
            totalCost = totalCost.add(fill.multiply(level.price()));
            executed = executed.add(fill);
            remaining = remaining.subtract(fill);
            worst = level.price();
        }

        BigDecimal best = levels.get(0).price();
        BigDecimal average = totalCost.divide(executed, MC);
        BigDecimal slippagePct = average.subtract(best).abs()
            .divide(best, MC)
            .multiply(HUNDRED);
        return Optional.of(new MarketImpact(average, best, worst, slippagePct, executed, totalCost));
    }

    /**
     * Check ordering of both sides and flag a crossed book. Crossing is reported, not corrected.
     */
    public BookIntegrityReport validateIntegrity() {
        List<String> problems = new ArrayList<>();
        boolean crossed;
        lock.lock();
        try {
            checkOrdering(bids, problems);
            checkOrdering(asks, problems);
            PriceLevel bestBid = bids.peekTop();
            PriceLevel bestAsk = asks.peekTop();
            crossed = bestBid != null && bestAsk != null && bestBid.price().compareTo(bestAsk.price()) >= 0;
            if (crossed) {
                problems.add("crossed book: best bid " + bestBid.price().toPlainString()
                    + " >= best ask " + bestAsk.price().toPlainString());
            }
        } finally {
            lock.unlock();
        }
        if (!problems.isEmpty()) {
            log.warn("[{}] Integrity check failed: {}", symbol, problems);
        }
        return new BookIntegrityReport(crossed, problems);
    }

    public OptionalLong lastAppliedSequenceId() {
        lock.lock();
        try {
            return lastAppliedSequenceId == null ? OptionalLong.empty() : OptionalLong.of(lastAppliedSequenceId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * True before the first snapshot and after a sequence gap, until the next snapshot.
     */
    public boolean resyncRequired() {
        lock.lock();
        try {
            return resyncRequired;
        } finally {
            lock.unlock();
        }
    }

    public int levelCount(BookSide side) {
        lock.lock();
        try {
            return side == BookSide.BID ? bids.size() : asks.size();
        } finally {
            lock.unlock();
        }
    }

    public long updateCount() {
        lock.lock();
        try {
            return updateCount;
        } finally {
            lock.unlock();
        }
    }

    public String symbol() {
        return symbol;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // INTERNALS (caller holds the lock)
    // ═══════════════════════════════════════════════════════════════════════

    private int insertSnapshotSide(PriceLevelStore store, List<BookEntry> entries, Instant now) {
        int inserted = 0;
        for (BookEntry entry : entries) {
            ParsedEntry parsed = parse(entry, store.side());
            if (parsed == null || parsed.quantity().signum() == 0) {
                continue;
            }
            store.upsert(PriceLevel.of(parsed.price(), parsed.quantity(), now));
            inserted++;
        }
        return inserted;
    }

    private void applyDeltaSide(PriceLevelStore store, List<BookEntry> entries, Instant now) {
        if (entries == null) {
            return;
        }
        for (BookEntry entry : entries) {
            ParsedEntry parsed = parse(entry, store.side());
            if (parsed == null) {
                continue;
            }
            if (parsed.quantity().signum() == 0) {
                store.remove(parsed.price());
            } else {
                store.upsert(PriceLevel.of(parsed.price(), parsed.quantity(), now));
            }
        }
    }

    /**
     * @return parsed entry, or null (logged and counted) if the entry is invalid
     */
    private ParsedEntry parse(BookEntry entry, BookSide side) {
        if (entry == null || entry.price() == null || entry.quantity() == null) {
            return skip(side, entry, "missing price or quantity");
        }
        BigDecimal price;
        BigDecimal quantity;
        try {
            price = new BigDecimal(entry.price().trim());
            quantity = new BigDecimal(entry.quantity().trim());
        } catch (NumberFormatException e) {
            return skip(side, entry, "not numeric");
        }
        if (price.signum() <= 0) {
            return skip(side, entry, "non-positive price");
        }
        if (quantity.signum() < 0) {
            return skip(side, entry, "negative quantity");
        }
        if (!PriceLevel.isWithinBounds(price) || !PriceLevel.isWithinBounds(quantity)) {
            return skip(side, entry, "out of range");
        }
        return new ParsedEntry(price, quantity);
    }

    private ParsedEntry skip(BookSide side, BookEntry entry, String reason) {
        log.warn("[{}] Skipping {} entry {}: {}", symbol, side, entry, reason);
        metrics.recordSkippedEntry(side);
        return null;
    }

    private static void checkOrdering(PriceLevelStore store, List<String> problems) {
        List<PriceLevel> levels = store.sortedLevels();
        for (int i = 1; i < levels.size(); i++) {
            if (store.side().compareBestFirst(levels.get(i - 1).price(), levels.get(i).price()) >= 0) {
                problems.add(store.side() + " side out of order at index " + i);
                return;
            }
        }
    }

    private static BigDecimal totalQuantity(List<PriceLevel> levels) {
        BigDecimal total = BigDecimal.ZERO;
        for (PriceLevel level : levels) {
            total = total.add(level.quantity());
        }
        return total;
    }

    private record ParsedEntry(BigDecimal price, BigDecimal quantity) {}
}
