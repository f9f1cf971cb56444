package in.trendbook.service.book;

import in.trendbook.domain.book.BookSide;
import in.trendbook.domain.book.PriceLevel;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Binary-heap price level store with a price-to-index map.
 *
 * Max-heap for bids, min-heap for asks. The index map makes arbitrary update
 * and removal O(log n). There is no native sorted view: {@link #topN(int)} pops
 * the top {@code depth} elements and reinserts them, so callers must hold the
 * same exclusive region as writers while it runs.
 */
public final class HeapPriceLevelStore implements PriceLevelStore {

    private final BookSide side;
    private final List<PriceLevel> heap = new ArrayList<>();
    private final Map<BigDecimal, Integer> positions = new HashMap<>();

    public HeapPriceLevelStore(BookSide side) {
        if (side == null) {
            throw new IllegalArgumentException("side cannot be null");
        }
        this.side = side;
    }

    @Override
    public BookSide side() {
        return side;
    }

    @Override
    public void upsert(PriceLevel level) {
        Integer index = positions.get(level.price());
        if (index != null) {
            heap.set(index, level);
            siftDown(siftUp(index));
            return;
        }
        heap.add(level);
        int last = heap.size() - 1;
        positions.put(level.price(), last);
        siftUp(last);
    }

    @Override
    public boolean remove(BigDecimal price) {
        BigDecimal key = PriceLevel.normalize(price);
        Integer index = positions.get(key);
        if (index == null) {
            return false;
        }
        int last = heap.size() - 1;
        if (index != last) {
            swap(index, last);
        }
        heap.remove(last);
        positions.remove(key);
        if (index < heap.size()) {
            siftDown(siftUp(index));
        }
        return true;
    }

    @Override
    public PriceLevel get(BigDecimal price) {
        Integer index = positions.get(PriceLevel.normalize(price));
        return index == null ? null : heap.get(index);
    }

    @Override
    public PriceLevel peekTop() {
        return heap.isEmpty() ? null : heap.get(0);
    }

    @Override
    public List<PriceLevel> topN(int depth) {
        if (depth <= 0 || heap.isEmpty()) {
            return List.of();
        }
        int limit = Math.min(depth, heap.size());
        List<PriceLevel> popped = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            popped.add(popTop());
        }
        for (PriceLevel level : popped) {
            upsert(level);
        }
        return popped;
    }

    @Override
    public List<PriceLevel> sortedLevels() {
        return topN(heap.size());
    }

    @Override
    public int size() {
        return heap.size();
    }

    @Override
    public void clear() {
        heap.clear();
        positions.clear();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // HEAP OPERATIONS
    // ═══════════════════════════════════════════════════════════════════════

    private PriceLevel popTop() {
        PriceLevel top = heap.get(0);
        remove(top.price());
        return top;
    }

    /**
     * @return final index of the element that started at {@code index}
     */
    private int siftUp(int index) {
        while (index > 0) {
            int parent = (index - 1) / 2;
            if (!higherPriority(index, parent)) {
                break;
            }
            swap(index, parent);
            index = parent;
        }
        return index;
    }

    private void siftDown(int index) {
        int n = heap.size();
        while (true) {
            int left = 2 * index + 1;
            int right = left + 1;
            int best = index;
            if (left < n && higherPriority(left, best)) best = left;
            if (right < n && higherPriority(right, best)) best = right;
            if (best == index) {
                return;
            }
            swap(index, best);
            index = best;
        }
    }

    private boolean higherPriority(int i, int j) {
        return side.compareBestFirst(heap.get(i).price(), heap.get(j).price()) < 0;
    }

    private void swap(int i, int j) {
        PriceLevel a = heap.get(i);
        PriceLevel b = heap.get(j);
        heap.set(i, b);
        heap.set(j, a);
        positions.put(b.price(), i);
        positions.put(a.price(), j);
    }
}
