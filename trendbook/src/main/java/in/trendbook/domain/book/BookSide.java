package in.trendbook.domain.book;

import java.math.BigDecimal;

/**
 * Side of the order book.
 *
 * Bid "best" is the highest price, ask "best" is the lowest.
 */
public enum BookSide {
    BID,
    ASK;

    /**
     * True when the side is best-first in descending price order.
     */
    public boolean descending() {
        return this == BID;
    }

    /**
     * Compare two prices in best-first order for this side.
     * Negative means {@code a} is better than {@code b}.
     */
    public int compareBestFirst(BigDecimal a, BigDecimal b) {
        return descending() ? b.compareTo(a) : a.compareTo(b);
    }
}
