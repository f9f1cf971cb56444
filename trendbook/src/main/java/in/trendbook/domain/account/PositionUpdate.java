package in.trendbook.domain.account;

import java.math.BigDecimal;

/**
 * Position event. {@code size} is signed: positive long, negative short.
 */
public record PositionUpdate(String symbol, BigDecimal size, BigDecimal avgPrice) {
    public PositionUpdate {
        if (size == null) size = BigDecimal.ZERO;
        if (avgPrice == null) avgPrice = BigDecimal.ZERO;
    }
}
