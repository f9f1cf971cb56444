package in.trendbook.service.book;

import in.trendbook.domain.book.BookSide;
import in.trendbook.domain.book.PriceLevel;

import java.math.BigDecimal;
import java.util.List;

/**
 * Ordered map from price to aggregated level data for one side of the book.
 *
 * "Top" is side-relative: highest price for bids, lowest for asks.
 * Implementations are NOT thread-safe; {@link OrderBookEngine} serializes all access.
 */
public interface PriceLevelStore {

    BookSide side();

    /**
     * Insert a level, replacing any level already stored at the same price.
     */
    void upsert(PriceLevel level);

    /**
     * Remove the level at {@code price}.
     *
     * @return true if a level was removed
     */
    boolean remove(BigDecimal price);

    /**
     * Level at exactly {@code price}, or null.
     */
    PriceLevel get(BigDecimal price);

    /**
     * Best level, or null if the side is empty.
     */
    PriceLevel peekTop();

    /**
     * Up to {@code depth} levels, best first.
     */
    List<PriceLevel> topN(int depth);

    /**
     * All levels, best first.
     */
    List<PriceLevel> sortedLevels();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    void clear();
}
