package in.trendbook.service.book;

import in.trendbook.domain.book.BookSide;
import in.trendbook.domain.book.PriceLevel;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HeapPriceLevelStoreTest {

    private static final Instant TS = Instant.parse("2024-01-01T00:00:00Z");

    private static PriceLevel level(String price, String qty) {
        return PriceLevel.of(price, qty, TS);
    }

    @Test
    void testBidHeapIsMaxHeap() {
        HeapPriceLevelStore bids = new HeapPriceLevelStore(BookSide.BID);
        bids.upsert(level("100", "1"));
        bids.upsert(level("105", "1"));
        bids.upsert(level("95", "1"));

        assertEquals(new BigDecimal("105"), bids.peekTop().price());
    }

    @Test
    void testAskHeapIsMinHeap() {
        HeapPriceLevelStore asks = new HeapPriceLevelStore(BookSide.ASK);
        asks.upsert(level("100", "1"));
        asks.upsert(level("105", "1"));
        asks.upsert(level("95", "1"));

        assertEquals(new BigDecimal("95"), asks.peekTop().price());
    }

    @Test
    void testTopNRestoresHeap() {
        HeapPriceLevelStore asks = new HeapPriceLevelStore(BookSide.ASK);
        for (int i = 20; i >= 1; i--) {
            asks.upsert(level(String.valueOf(i), String.valueOf(i)));
        }

        List<PriceLevel> top = asks.topN(5);

        assertEquals(5, top.size());
        assertEquals(new BigDecimal("1"), top.get(0).price());
        assertEquals(new BigDecimal("5"), top.get(4).price());
        assertEquals(20, asks.size(), "depth query must leave every level in place");
        assertEquals(new BigDecimal("1"), asks.peekTop().price());
        assertEquals(top, asks.topN(5));
    }

    @Test
    void testTopNLargerThanSize() {
        HeapPriceLevelStore bids = new HeapPriceLevelStore(BookSide.BID);
        bids.upsert(level("1", "1"));
        bids.upsert(level("2", "1"));

        assertEquals(2, bids.topN(10).size());
        assertEquals(List.of(), bids.topN(0));
    }

    @Test
    void testRemoveArbitraryLevel() {
        HeapPriceLevelStore bids = new HeapPriceLevelStore(BookSide.BID);
        for (int i = 1; i <= 10; i++) {
            bids.upsert(level(String.valueOf(i), "1"));
        }

        assertTrue(bids.remove(new BigDecimal("4")));
        assertTrue(bids.remove(new BigDecimal("10")));
        assertFalse(bids.remove(new BigDecimal("4")));

        assertEquals(8, bids.size());
        assertEquals(new BigDecimal("9"), bids.peekTop().price());
        assertNull(bids.get(new BigDecimal("4")));
        List<PriceLevel> sorted = bids.sortedLevels();
        for (int i = 1; i < sorted.size(); i++) {
            assertTrue(sorted.get(i - 1).price().compareTo(sorted.get(i).price()) > 0);
        }
    }

    @Test
    void testUpsertExistingOverwritesValue() {
        HeapPriceLevelStore asks = new HeapPriceLevelStore(BookSide.ASK);
        asks.upsert(level("100", "1"));
        asks.upsert(level("101", "1"));
        asks.upsert(level("1E+2", "7"));

        assertEquals(2, asks.size());
        assertEquals(new BigDecimal("7"), asks.peekTop().quantity());
    }

    @Test
    void testRemoveLastRemainingLevel() {
        HeapPriceLevelStore asks = new HeapPriceLevelStore(BookSide.ASK);
        asks.upsert(level("100", "1"));

        assertTrue(asks.remove(new BigDecimal("100.0")));
        assertTrue(asks.isEmpty());
        assertNull(asks.peekTop());
    }
}
