package in.trendbook.service.book;

import in.trendbook.domain.book.BookSide;
import in.trendbook.domain.book.PriceLevel;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Skip-list price level store.
 *
 * Features:
 * - Nodes live in an arena addressed by int index; forward links are index arrays
 * - Freed slots are recycled through a free list
 * - Keys are kept ascending; bid-side "top" walks from the tail
 * - Level 0 is doubly linked so best-first traversal is O(depth) on both sides
 *
 * Expected O(log n) insert/delete/lookup.
 */
public final class SkipListPriceLevelStore implements PriceLevelStore {
    public static final int DEFAULT_MAX_LEVEL = 16;
    public static final double DEFAULT_PROMOTION_PROBABILITY = 0.5;

    private static final int NIL = -1;
    private static final int HEAD = 0;
    private static final int INITIAL_CAPACITY = 64;

    private final BookSide side;
    private final int maxLevel;
    private final double promotionProbability;
    private final Random random;

    // Node arena. Slot 0 is the head sentinel.
    private BigDecimal[] keys;
    private PriceLevel[] values;
    private int[][] forward;
    private int[] backward;     // level-0 predecessor, HEAD for the first node

    private int nextUnused;
    private int[] freeSlots;
    private int freeCount;

    private int topLevel;       // highest level currently linked, 0-based
    private int tail;           // last node on level 0, NIL when empty
    private int size;

    public SkipListPriceLevelStore(BookSide side) {
        this(side, DEFAULT_MAX_LEVEL, DEFAULT_PROMOTION_PROBABILITY, new Random());
    }

    public SkipListPriceLevelStore(BookSide side, int maxLevel, double promotionProbability, Random random) {
        if (side == null) {
            throw new IllegalArgumentException("side cannot be null");
        }
        if (maxLevel < 1) {
            throw new IllegalArgumentException("maxLevel must be at least 1: " + maxLevel);
        }
        if (promotionProbability <= 0.0 || promotionProbability >= 1.0) {
            throw new IllegalArgumentException("promotionProbability must be in (0, 1): " + promotionProbability);
        }
        this.side = side;
        this.maxLevel = maxLevel;
        this.promotionProbability = promotionProbability;
        this.random = random;
        resetArena(INITIAL_CAPACITY);
    }

    @Override
    public BookSide side() {
        return side;
    }

    @Override
    public void upsert(PriceLevel level) {
        BigDecimal key = level.price();
        int[] update = new int[maxLevel];
        int x = findPredecessors(key, update);

        int candidate = forward[x][0];
        if (candidate != NIL && keys[candidate].compareTo(key) == 0) {
            values[candidate] = level;
            return;
        }

        int nodeLevel = randomLevel();
        if (nodeLevel > topLevel) {
            for (int i = topLevel + 1; i <= nodeLevel; i++) {
                update[i] = HEAD;
            }
            topLevel = nodeLevel;
        }

        int node = allocate(key, level, nodeLevel);
        for (int i = 0; i <= nodeLevel; i++) {
            forward[node][i] = forward[update[i]][i];
            forward[update[i]][i] = node;
        }

        int successor = forward[node][0];
        backward[node] = update[0];
        if (successor == NIL) {
            tail = node;
        } else {
            backward[successor] = node;
        }
        size++;
    }

    @Override
    public boolean remove(BigDecimal price) {
        BigDecimal key = PriceLevel.normalize(price);
        int[] update = new int[maxLevel];
        int x = findPredecessors(key, update);

        int target = forward[x][0];
        if (target == NIL || keys[target].compareTo(key) != 0) {
            return false;
        }

        for (int i = 0; i <= topLevel; i++) {
            if (forward[update[i]][i] != target) {
                break;
            }
            forward[update[i]][i] = forward[target][i];
        }

        int successor = forward[target][0];
        if (successor == NIL) {
            tail = update[0] == HEAD ? NIL : update[0];
        } else {
            backward[successor] = update[0];
        }

        release(target);
        while (topLevel > 0 && forward[HEAD][topLevel] == NIL) {
            topLevel--;
        }
        size--;
        return true;
    }

    @Override
    public PriceLevel get(BigDecimal price) {
        BigDecimal key = PriceLevel.normalize(price);
        int x = HEAD;
        for (int i = topLevel; i >= 0; i--) {
            int next;
            while ((next = forward[x][i]) != NIL && keys[next].compareTo(key) < 0) {
                x = next;
            }
        }
        int candidate = forward[x][0];
        return candidate != NIL && keys[candidate].compareTo(key) == 0 ? values[candidate] : null;
    }

    @Override
    public PriceLevel peekTop() {
        return peekTop(side.descending());
    }

    /**
     * First element of {@link #sortedItems(boolean)} without materializing the list.
     */
    public PriceLevel peekTop(boolean reverse) {
        if (size == 0) return null;
        return reverse ? values[tail] : values[forward[HEAD][0]];
    }

    @Override
    public List<PriceLevel> topN(int depth) {
        if (depth <= 0 || size == 0) {
            return List.of();
        }
        int limit = Math.min(depth, size);
        List<PriceLevel> result = new ArrayList<>(limit);
        if (side.descending()) {
            for (int x = tail; x != HEAD && result.size() < limit; x = backward[x]) {
                result.add(values[x]);
            }
        } else {
            for (int x = forward[HEAD][0]; x != NIL && result.size() < limit; x = forward[x][0]) {
                result.add(values[x]);
            }
        }
        return result;
    }

    @Override
    public List<PriceLevel> sortedLevels() {
        return sortedItems(side.descending());
    }

    /**
     * Level-0 traversal in ascending price order, reversed when {@code reverse} is set.
     */
    public List<PriceLevel> sortedItems(boolean reverse) {
        List<PriceLevel> items = new ArrayList<>(size);
        for (int x = forward[HEAD][0]; x != NIL; x = forward[x][0]) {
            items.add(values[x]);
        }
        if (reverse) {
            Collections.reverse(items);
        }
        return items;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public void clear() {
        resetArena(Math.min(keys.length, Math.max(INITIAL_CAPACITY, size * 2)));
    }

    /**
     * Current number of linked levels. Exposed for tests.
     */
    int levelCount() {
        return topLevel + 1;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // INTERNALS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Descend from the top level recording the last node before {@code key} on each level.
     *
     * @return the level-0 predecessor
     */
    private int findPredecessors(BigDecimal key, int[] update) {
        int x = HEAD;
        for (int i = topLevel; i >= 0; i--) {
            int next;
            while ((next = forward[x][i]) != NIL && keys[next].compareTo(key) < 0) {
                x = next;
            }
            update[i] = x;
        }
        return x;
    }

    private int randomLevel() {
        int level = 0;
        while (level < maxLevel - 1 && random.nextDouble() < promotionProbability) {
            level++;
        }
        return level;
    }

    private int allocate(BigDecimal key, PriceLevel value, int nodeLevel) {
        int slot;
        if (freeCount > 0) {
            slot = freeSlots[--freeCount];
        } else {
            if (nextUnused == keys.length) {
                grow();
            }
            slot = nextUnused++;
        }
        keys[slot] = key;
        values[slot] = value;
        int[] links = new int[nodeLevel + 1];
        Arrays.fill(links, NIL);
        forward[slot] = links;
        return slot;
    }

    private void release(int slot) {
        keys[slot] = null;
        values[slot] = null;
        forward[slot] = null;
        backward[slot] = NIL;
        if (freeCount == freeSlots.length) {
            freeSlots = Arrays.copyOf(freeSlots, freeSlots.length * 2);
        }
        freeSlots[freeCount++] = slot;
    }

    private void grow() {
        int newCapacity = keys.length * 2;
        keys = Arrays.copyOf(keys, newCapacity);
        values = Arrays.copyOf(values, newCapacity);
        forward = Arrays.copyOf(forward, newCapacity);
        backward = Arrays.copyOf(backward, newCapacity);
    }

    private void resetArena(int capacity) {
        keys = new BigDecimal[capacity];
        values = new PriceLevel[capacity];
        forward = new int[capacity][];
        backward = new int[capacity];
        forward[HEAD] = new int[maxLevel];
        Arrays.fill(forward[HEAD], NIL);
        nextUnused = 1;
        freeSlots = new int[16];
        freeCount = 0;
        topLevel = 0;
        tail = NIL;
        size = 0;
    }
}
