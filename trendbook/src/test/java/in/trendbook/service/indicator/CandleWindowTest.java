package in.trendbook.service.indicator;

import in.trendbook.domain.data.Candle;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CandleWindowTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static Candle candle(int minute, double close) {
        return Candle.of(T0.plusSeconds(60L * minute), close, close + 1, close - 1, close, 10);
    }

    @Test
    void testAppendsNewerCandles() {
        CandleWindow window = new CandleWindow(10);

        assertTrue(window.merge(candle(0, 100)));
        assertTrue(window.merge(candle(1, 101)));

        assertEquals(2, window.size());
        assertEquals(T0.plusSeconds(60), window.snapshot().get(1).openTime());
    }

    @Test
    void testReplacesFormingBar() {
        CandleWindow window = new CandleWindow(10);
        window.merge(candle(0, 100));
        window.merge(candle(1, 101));

        assertTrue(window.merge(candle(1, 105)));

        assertEquals(2, window.size());
        assertEquals(0, window.snapshot().get(1).close().compareTo(BigDecimal.valueOf(105.0)));
    }

    @Test
    void testIgnoresOlderCandles() {
        CandleWindow window = new CandleWindow(10);
        window.merge(candle(5, 100));

        assertFalse(window.merge(candle(2, 90)));
        assertEquals(1, window.size());
    }

    @Test
    void testEvictsOldestAtCapacity() {
        CandleWindow window = new CandleWindow(3);
        for (int i = 0; i < 5; i++) {
            window.merge(candle(i, 100 + i));
        }

        List<Candle> candles = window.snapshot();
        assertEquals(3, candles.size());
        assertEquals(T0.plusSeconds(120), candles.get(0).openTime());
        assertEquals(T0.plusSeconds(240), candles.get(2).openTime());
    }

    @Test
    void testMergeAllSortsBatch() {
        CandleWindow window = new CandleWindow(10);

        int changed = window.mergeAll(List.of(candle(2, 102), candle(0, 100), candle(1, 101)));

        assertEquals(3, changed);
        assertEquals(T0, window.snapshot().get(0).openTime());

        // refetch overlaps: last bar replaced, older ones ignored
        assertEquals(1, window.mergeAll(List.of(candle(1, 101), candle(2, 103))));
    }

    @Test
    void testSnapshotIsImmutableCopy() {
        CandleWindow window = new CandleWindow(10);
        window.merge(candle(0, 100));
        List<Candle> snapshot = window.snapshot();

        window.merge(candle(1, 101));
        window.clear();

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(candle(2, 1)));
        assertEquals(0, window.size());
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new CandleWindow(0));
        assertEquals(CandleWindow.DEFAULT_CAPACITY, new CandleWindow().capacity());
    }
}
