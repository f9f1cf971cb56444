package in.trendbook.domain.book;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Aggregated resting quantity at one price.
 *
 * Price is normalized (trailing zeros stripped) so that "100", "100.0" and "1E+2"
 * address the same level. A quantity of zero is a deletion signal on the wire and
 * is never stored.
 *
 * Prices and quantities are limited to {@value #MAX_DIGITS} integer digits and
 * {@value #MAX_DIGITS} fraction digits, which keeps key normalization and comparison cheap.
 */
public record PriceLevel(
    BigDecimal price,
    BigDecimal quantity,
    Instant lastUpdateTimestamp,
    int orderCount
) {
    public static final int MAX_DIGITS = 30;

    public PriceLevel {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("price must be positive: " + price);
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("quantity must be positive: " + quantity);
        }
        if (!isWithinBounds(price) || !isWithinBounds(quantity)) {
            throw new IllegalArgumentException("price or quantity out of range: " + price + " x " + quantity);
        }
        if (lastUpdateTimestamp == null) {
            throw new IllegalArgumentException("lastUpdateTimestamp cannot be null");
        }
        if (orderCount < 0) {
            throw new IllegalArgumentException("orderCount cannot be negative: " + orderCount);
        }
        price = normalize(price);
    }

    public static PriceLevel of(BigDecimal price, BigDecimal quantity, Instant ts) {
        return new PriceLevel(price, quantity, ts, 1);
    }

    public static PriceLevel of(String price, String quantity, Instant ts) {
        return of(new BigDecimal(price), new BigDecimal(quantity), ts);
    }

    /**
     * True if {@code value} has at most {@value #MAX_DIGITS} integer digits and at most
     * {@value #MAX_DIGITS} significant fraction digits. Checked without expanding the value.
     */
    public static boolean isWithinBounds(BigDecimal value) {
        if (value == null) {
            return false;
        }
        // integer digits; negative for pure fractions
        if ((long) value.precision() - value.scale() > MAX_DIGITS) {
            return false;
        }
        if (value.precision() > 4 * MAX_DIGITS) {
            return false;
        }
        return value.stripTrailingZeros().scale() <= MAX_DIGITS;
    }

    /**
     * Canonical key form of a price. Negative scales are only expanded within
     * {@value #MAX_DIGITS} digits; beyond that the stripped form is kept as is.
     */
    public static BigDecimal normalize(BigDecimal price) {
        BigDecimal stripped = price.stripTrailingZeros();
        return stripped.scale() < 0 && stripped.scale() >= -MAX_DIGITS ? stripped.setScale(0) : stripped;
    }
}
