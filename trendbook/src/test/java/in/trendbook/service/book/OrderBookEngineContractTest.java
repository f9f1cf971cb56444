package in.trendbook.service.book;

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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Behaviour shared by every price level store. Subclasses pick the store type.
 */
abstract class OrderBookEngineContractTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    protected EngineMetrics metrics;
    protected OrderBookEngine book;

    protected abstract StoreType storeType();

    @BeforeEach
    void setUp() {
        metrics = mock(EngineMetrics.class);
        book = new OrderBookEngine("BTCUSDT", storeType(), metrics, CLOCK);
    }

    private static List<BookEntry> entries(String... pairs) {
        List<BookEntry> result = new ArrayList<>();
        for (int i = 0; i < pairs.length; i += 2) {
            result.add(BookEntry.of(pairs[i], pairs[i + 1]));
        }
        return result;
    }

    private static BigDecimal dec(String value) {
        return new BigDecimal(value);
    }

    @Test
    @DisplayName("Snapshot, level delete, then replay of an old sequence id")
    void testSnapshotDeleteAndReplay() {
        assertEquals(BookUpdateResult.APPLIED, book.applySnapshot(entries("100", "1"), entries("101", "1"), 1L));

        TopOfBook top = book.bestBidAsk();
        assertEquals(0, dec("100").compareTo(top.bidPrice()));
        assertEquals(0, dec("101").compareTo(top.askPrice()));

        assertEquals(BookUpdateResult.APPLIED, book.applyDelta(entries("100", "0"), null, 2L));
        assertNull(book.bestBidAsk().bestBid());
        assertEquals(0, dec("101").compareTo(book.bestBidAsk().askPrice()));

        assertEquals(BookUpdateResult.DISCARDED_STALE, book.applyDelta(entries("100", "1"), null, 1L));
        assertNull(book.bestBidAsk().bestBid());
        assertEquals(2L, book.lastAppliedSequenceId().getAsLong());
    }

    @Test
    void testReplayedDeltaIsIdempotent() {
        book.applySnapshot(entries("100", "1", "99", "2"), entries("101", "1"), 10L);
        book.applyDelta(entries("100", "5"), entries("102", "3"), 11L);
        BookDepth before = book.depth(10);

        assertEquals(BookUpdateResult.DISCARDED_STALE, book.applyDelta(entries("100", "0"), entries("102", "0"), 11L));
        assertEquals(BookUpdateResult.DISCARDED_STALE, book.applyDelta(entries("98", "1"), null, 10L));

        assertEquals(before, book.depth(10));
        assertEquals(2, book.updateCount());
    }

    @Test
    void testSnapshotDiscardsPriorLevels() {
        book.applySnapshot(entries("100", "1", "99", "1"), entries("101", "1", "102", "1"), 1L);
        book.applySnapshot(entries("50", "1"), entries("60", "2"), 5L);

        BookDepth depth = book.depth(10);
        assertEquals(1, depth.bids().size());
        assertEquals(1, depth.asks().size());
        assertEquals(0, dec("50").compareTo(depth.bids().get(0).price()));
        assertEquals(0, dec("60").compareTo(depth.asks().get(0).price()));
        assertEquals(5L, book.lastAppliedSequenceId().getAsLong());
    }

    @Test
    void testSnapshotMayMoveSequenceBackwards() {
        book.applySnapshot(entries("100", "1"), entries("101", "1"), 100L);
        book.applySnapshot(entries("100", "1"), entries("101", "1"), 3L);

        assertEquals(3L, book.lastAppliedSequenceId().getAsLong());
        assertEquals(BookUpdateResult.APPLIED, book.applyDelta(entries("100", "2"), null, 4L));
    }

    @Test
    void testSnapshotSkipsZeroQuantityLevels() {
        book.applySnapshot(entries("100", "0", "99", "1"), entries("101", "0"), 1L);

        assertEquals(1, book.levelCount(BookSide.BID));
        assertEquals(0, book.levelCount(BookSide.ASK));
        verify(metrics, never()).recordSkippedEntry(any());
    }

    @Test
    void testDepthIsBestFirstOnBothSides() {
        book.applySnapshot(
            entries("99", "1", "101", "1", "100", "1"),
            entries("104", "1", "102", "1", "103", "1"),
            1L);

        BookDepth depth = book.depth(2);
        assertEquals(List.of(dec("101"), dec("100")), prices(depth.bids()));
        assertEquals(List.of(dec("102"), dec("103")), prices(depth.asks()));
        assertEquals(3, book.depth(50).bids().size());
        assertThrows(IllegalArgumentException.class, () -> book.depth(-1));
    }

    @Test
    void testEquivalentPriceStringsShareOneLevel() {
        book.applySnapshot(entries("100.50", "1"), entries("101", "1"), 1L);
        book.applyDelta(entries("100.5", "3"), null, 2L);

        assertEquals(1, book.levelCount(BookSide.BID));
        assertEquals(0, dec("3").compareTo(book.bestBidAsk().bestBid().quantity()));

        book.applyDelta(entries("100.500", "0"), null, 3L);
        assertEquals(0, book.levelCount(BookSide.BID));
    }

    @Test
    void testMalformedMessagesLeaveBookUntouched() {
        book.applySnapshot(entries("100", "1"), entries("101", "1"), 1L);

        assertEquals(BookUpdateResult.REJECTED_MALFORMED, book.applySnapshot(null, entries("101", "1"), 2L));
        assertEquals(BookUpdateResult.REJECTED_MALFORMED, book.applySnapshot(new BookSnapshot(List.of(), List.of(), null)));
        assertEquals(BookUpdateResult.REJECTED_MALFORMED, book.applyDelta(null, null, 2L));
        assertEquals(BookUpdateResult.REJECTED_MALFORMED, book.applyDelta(entries("100", "0"), null, null));

        assertEquals(0, dec("100").compareTo(book.bestBidAsk().bidPrice()));
        assertEquals(1L, book.lastAppliedSequenceId().getAsLong());
        verify(metrics, times(2)).recordBookUpdate(eq("snapshot"), eq(BookUpdateResult.REJECTED_MALFORMED), any());
        verify(metrics, times(2)).recordBookUpdate(eq("delta"), eq(BookUpdateResult.REJECTED_MALFORMED), any());
    }

    @Test
    void testInvalidEntriesAreSkippedIndividually() {
        book.applySnapshot(entries("100", "1"), entries("101", "1"), 1L);

        List<BookEntry> bids = new ArrayList<>(entries("abc", "1", "-5", "1", "99", "-2", "98", "4"));
        bids.add(new BookEntry(null, "1"));
        BookUpdateResult result = book.applyDelta(bids, entries("0", "1", "102", "2"), 2L);

        assertEquals(BookUpdateResult.APPLIED, result);
        assertEquals(List.of(dec("100"), dec("98")), prices(book.depth(10).bids()));
        assertEquals(List.of(dec("101"), dec("102")), prices(book.depth(10).asks()));
        verify(metrics, times(4)).recordSkippedEntry(BookSide.BID);
        verify(metrics, times(1)).recordSkippedEntry(BookSide.ASK);
    }

    @Test
    void testResyncRequiredUntilFirstSnapshot() {
        assertTrue(book.resyncRequired());
        assertTrue(book.lastAppliedSequenceId().isEmpty());
        assertFalse(book.bestBidAsk().isTwoSided());

        book.applySnapshot(entries("100", "1"), entries("101", "1"), 1L);

        assertFalse(book.resyncRequired());
    }

    @Test
    void testSequenceGapAppliesDeltaAndFlagsResync() {
        book.applySnapshot(entries("100", "1"), entries("101", "1"), 1L);

        assertEquals(BookUpdateResult.APPLIED, book.applyDelta(entries("100.5", "1"), null, 5L));

        assertTrue(book.resyncRequired());
        assertEquals(0, dec("100.5").compareTo(book.bestBidAsk().bidPrice()));
        verify(metrics).recordSequenceGap(2L, 5L);

        book.applySnapshot(entries("100", "1"), entries("101", "1"), 6L);
        assertFalse(book.resyncRequired());
    }

    @Test
    void testContiguousDeltasDoNotFlagGap() {
        book.applySnapshot(entries("100", "1"), entries("101", "1"), 1L);
        book.applyDelta(entries("100", "2"), null, 2L);
        book.applyDelta(null, entries("101", "3"), 3L);

        assertFalse(book.resyncRequired());
        verify(metrics, never()).recordSequenceGap(anyLong(), anyLong());
    }

    @Test
    void testImbalanceAndMicroprice() {
        book.applySnapshot(entries("100", "3", "99", "1"), entries("101", "1", "102", "1"), 1L);

        // bid 4 vs ask 2 over two levels
        assertEquals(0, dec("0.333333333333333333").compareTo(book.imbalance(2)));
        // top level only: 100*1 + 101*3 over 4
        assertEquals(0, dec("100.75").compareTo(book.microprice(1).orElseThrow()));
    }

    @Test
    void testImbalanceAndMicropriceOnEmptyBook() {
        assertEquals(0, BigDecimal.ZERO.compareTo(book.imbalance(5)));
        assertTrue(book.microprice(5).isEmpty());

        book.applySnapshot(entries("100", "1"), List.of(), 1L);
        assertEquals(0, BigDecimal.ONE.compareTo(book.imbalance(5)));
        assertTrue(book.microprice(5).isEmpty());
    }

    @Test
    void testCrossedBookIsReportedNotCorrected() {
        book.applySnapshot(entries("100", "1"), entries("101", "1"), 1L);
        assertTrue(book.validateIntegrity().isValid());

        book.applyDelta(entries("102", "1"), null, 2L);
        BookIntegrityReport report = book.validateIntegrity();

        assertTrue(report.crossed());
        assertFalse(report.isValid());
        assertTrue(book.bestBidAsk().isCrossed());
        assertEquals(2, book.levelCount(BookSide.BID));
    }

    @Test
    void testRejectsStoresOnWrongSides() {
        assertThrows(IllegalArgumentException.class, () -> new OrderBookEngine("X",
            PriceLevelStores.create(storeType(), BookSide.ASK),
            PriceLevelStores.create(storeType(), BookSide.BID),
            EngineMetrics.noop(), CLOCK));
    }

    @Test
    @DisplayName("Readers never observe a half-applied snapshot")
    void testConcurrentReadersSeeWholeSnapshots() throws Exception {
        int levels = 50;
        List<BookEntry> bids = new ArrayList<>();
        List<BookEntry> asks = new ArrayList<>();
        for (int i = 0; i < levels; i++) {
            bids.add(BookEntry.of(String.valueOf(1000 - i), "1"));
            asks.add(BookEntry.of(String.valueOf(1001 + i), "1"));
        }
        book.applySnapshot(bids, asks, 0L);

        ExecutorService pool = Executors.newFixedThreadPool(3);
        AtomicBoolean running = new AtomicBoolean(true);
        CountDownLatch started = new CountDownLatch(2);
        try {
            List<Future<Integer>> readers = new ArrayList<>();
            for (int r = 0; r < 2; r++) {
                readers.add(pool.submit(() -> {
                    started.countDown();
                    int observations = 0;
                    while (running.get()) {
                        BookDepth depth = book.depth(levels);
                        assertEquals(levels, depth.bids().size());
                        assertEquals(levels, depth.asks().size());
                        assertNotNull(book.bestBidAsk().bestBid());
                        observations++;
                    }
                    return observations;
                }));
            }
            Future<?> writer = pool.submit(() -> {
                try {
                    started.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (long seq = 1; seq <= 500; seq++) {
                    book.applySnapshot(bids, asks, seq);
                }
            });

            writer.get(30, TimeUnit.SECONDS);
            running.set(false);
            for (Future<Integer> reader : readers) {
                assertTrue(reader.get(30, TimeUnit.SECONDS) > 0);
            }
        } finally {
            running.set(false);
            pool.shutdownNow();
        }
        assertEquals(500L, book.lastAppliedSequenceId().getAsLong());
    }

    @Test
    @DisplayName("Entries with extreme exponents are skipped without stalling the book")
    void testOversizedExponentsAreSkipped() {
        BookUpdateResult result = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> book.applySnapshot(
            entries("100", "1", "1E+200000000", "1", "1E-200000000", "1"),
            entries("101", "1", "102", "1E+200000000"),
            1L));

        assertEquals(BookUpdateResult.APPLIED, result);
        assertEquals(List.of(dec("100")), prices(book.depth(10).bids()));
        assertEquals(List.of(dec("101")), prices(book.depth(10).asks()));

        assertTimeoutPreemptively(Duration.ofSeconds(5),
            () -> book.applyDelta(entries("1E+200000000", "0"), null, 2L));
        assertEquals(1, book.levelCount(BookSide.BID));

        verify(metrics, times(3)).recordSkippedEntry(BookSide.BID);
        verify(metrics, times(1)).recordSkippedEntry(BookSide.ASK);
    }

    @Test
    @DisplayName("A snapshot that fails mid-apply is not counted as applied")
    void testFailedSnapshotIsNotRecordedAsApplied() {
        PriceLevelStore failingBids = mock(PriceLevelStore.class);
        when(failingBids.side()).thenReturn(BookSide.BID);
        doThrow(new IllegalStateException("store corrupted")).when(failingBids).clear();
        OrderBookEngine failing = new OrderBookEngine("BTCUSDT", failingBids,
            PriceLevelStores.create(storeType(), BookSide.ASK), metrics, CLOCK);

        assertThrows(IllegalStateException.class,
            () -> failing.applySnapshot(entries("100", "1"), entries("101", "1"), 1L));

        verify(metrics, never()).recordBookUpdate(eq("snapshot"), eq(BookUpdateResult.APPLIED), any());
        assertTrue(failing.lastAppliedSequenceId().isEmpty());
    }

    @Test
    @DisplayName("Market buy walks the asks best-first across levels")
    void testMarketImpactAcrossLevels() {
        book.applySnapshot(entries("100", "1", "99", "1"), entries("101", "1", "102", "2", "103", "5"), 1L);

        MarketImpact buy = book.marketImpact(dec("2.5"), OrderSide.BUY).orElseThrow();

        assertEquals(0, dec("101.6").compareTo(buy.averagePrice()));
        assertEquals(0, dec("101").compareTo(buy.bestPrice()));
        assertEquals(0, dec("102").compareTo(buy.worstPrice()));
        assertEquals(0, dec("2.5").compareTo(buy.executedQuantity()));
        assertEquals(0, dec("254").compareTo(buy.totalCost()));
        assertEquals(0, dec("0.5941").compareTo(buy.slippagePct().setScale(4, RoundingMode.HALF_UP)));
    }

    @Test
    void testMarketImpactLargerThanDepthFillsWhatIsThere() {
        book.applySnapshot(entries("100", "1", "99", "1"), entries("101", "1"), 1L);

        MarketImpact sell = book.marketImpact(dec("5"), OrderSide.SELL).orElseThrow();

        assertEquals(0, dec("2").compareTo(sell.executedQuantity()));
        assertEquals(0, dec("99.5").compareTo(sell.averagePrice()));
        assertEquals(0, dec("100").compareTo(sell.bestPrice()));
        assertEquals(0, dec("99").compareTo(sell.worstPrice()));
        assertEquals(0, dec("0.5").compareTo(sell.slippagePct()));
    }

    @Test
    void testMarketImpactWithoutLiquidity() {
        assertEquals(Optional.empty(), book.marketImpact(dec("1"), OrderSide.BUY));

        book.applySnapshot(entries("100", "1"), List.of(), 1L);

        assertEquals(Optional.empty(), book.marketImpact(dec("1"), OrderSide.BUY));
        assertTrue(book.marketImpact(dec("1"), OrderSide.SELL).isPresent());
        assertThrows(IllegalArgumentException.class, () -> book.marketImpact(BigDecimal.ZERO, OrderSide.BUY));
    }

    private static List<BigDecimal> prices(List<PriceLevel> levels) {
        List<BigDecimal> result = new ArrayList<>();
        for (PriceLevel level : levels) {
            result.add(level.price());
        }
        return result;
    }
}
