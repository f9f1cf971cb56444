package in.trendbook.service.indicator;

import in.trendbook.domain.data.Candle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, time-ordered candle history.
 *
 * - Same openTime as the newest candle: replaced in place (bar still forming)
 * - Newer openTime: appended, oldest evicted at capacity
 * - Older openTime: ignored
 */
public final class CandleWindow {
    private static final Logger log = LoggerFactory.getLogger(CandleWindow.class);

    public static final int DEFAULT_CAPACITY = 500;

    private final int capacity;
    private final Deque<Candle> candles = new ArrayDeque<>();

    public CandleWindow() {
        this(DEFAULT_CAPACITY);
    }

    public CandleWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * @return true if the window changed
     */
    public synchronized boolean merge(Candle candle) {
        Candle newest = candles.peekLast();
        if (newest == null || candle.openTime().isAfter(newest.openTime())) {
            candles.addLast(candle);
            if (candles.size() > capacity) {
                candles.removeFirst();
            }
            return true;
        }
        if (candle.openTime().equals(newest.openTime())) {
            candles.removeLast();
            candles.addLast(candle);
            return true;
        }
        log.debug("Ignoring out-of-order candle {} (newest {})", candle.openTime(), newest.openTime());
        return false;
    }

    /**
     * Merge a batch in openTime order.
     *
     * @return number of candles that changed the window
     */
    public synchronized int mergeAll(Collection<Candle> batch) {
        List<Candle> sorted = new ArrayList<>(batch);
        sorted.sort(Comparator.comparing(Candle::openTime));
        int changed = 0;
        for (Candle candle : sorted) {
            if (merge(candle)) changed++;
        }
        return changed;
    }

    public synchronized List<Candle> snapshot() {
        return List.copyOf(candles);
    }

    public synchronized int size() {
        return candles.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void clear() {
        candles.clear();
    }
}
