package in.trendbook.domain.book;

import java.math.BigDecimal;

/**
 * Estimated fill of a market order walked through the opposite side of the book.
 */
public record MarketImpact(
    BigDecimal averagePrice,
    BigDecimal bestPrice,
    BigDecimal worstPrice,
    BigDecimal slippagePct,     // |average - best| / best * 100
    BigDecimal executedQuantity,
    BigDecimal totalCost
) {
    public MarketImpact {
        if (averagePrice == null || bestPrice == null || worstPrice == null
            || slippagePct == null || executedQuantity == null || totalCost == null) {
            throw new IllegalArgumentException("market impact fields cannot be null");
        }
        if (executedQuantity.signum() <= 0) {
            throw new IllegalArgumentException("executedQuantity must be positive: " + executedQuantity);
        }
    }
}
