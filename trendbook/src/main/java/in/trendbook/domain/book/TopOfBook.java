package in.trendbook.domain.book;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Best bid and best ask. Either side is null when that side of the book is empty.
 */
public record TopOfBook(PriceLevel bestBid, PriceLevel bestAsk) {
    private static final MathContext MC = new MathContext(18, RoundingMode.HALF_UP);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    public static TopOfBook empty() {
        return new TopOfBook(null, null);
    }

    public boolean hasBid() {
        return bestBid != null;
    }

    public boolean hasAsk() {
        return bestAsk != null;
    }

    public boolean isTwoSided() {
        return bestBid != null && bestAsk != null;
    }

    public BigDecimal bidPrice() {
        return bestBid == null ? null : bestBid.price();
    }

    public BigDecimal askPrice() {
        return bestAsk == null ? null : bestAsk.price();
    }

    /**
     * Mid price, or null unless both sides are present.
     */
    public BigDecimal mid() {
        if (!isTwoSided()) return null;
        return bestBid.price().add(bestAsk.price()).divide(TWO, MC);
    }

    /**
     * Ask minus bid, or null unless both sides are present.
     */
    public BigDecimal spread() {
        if (!isTwoSided()) return null;
        return bestAsk.price().subtract(bestBid.price());
    }

    public boolean isCrossed() {
        return isTwoSided() && bestBid.price().compareTo(bestAsk.price()) >= 0;
    }
}
