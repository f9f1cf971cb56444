package in.trendbook.domain.account;

import java.math.BigDecimal;

/**
 * Direction of the open position.
 */
public enum PositionSide {
    LONG,
    SHORT,
    FLAT;

    public static PositionSide fromSignedSize(BigDecimal size) {
        if (size == null || size.signum() == 0) return FLAT;
        return size.signum() > 0 ? LONG : SHORT;
    }
}
