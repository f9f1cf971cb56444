package in.trendbook.domain.data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * OHLCV bar keyed by its open time.
 */
public record Candle(
    Instant openTime,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume,
    BigDecimal turnover
) {
    public Candle {
        if (openTime == null) {
            throw new IllegalArgumentException("openTime cannot be null");
        }
        if (open == null || high == null || low == null || close == null) {
            throw new IllegalArgumentException("OHLC values cannot be null");
        }
        if (high.compareTo(low) < 0) {
            throw new IllegalArgumentException("high " + high + " is below low " + low);
        }
        if (volume == null) volume = BigDecimal.ZERO;
        if (turnover == null) turnover = BigDecimal.ZERO;
    }

    /**
     * Create candle from raw values.
     */
    public static Candle of(Instant openTime, double o, double h, double l, double c, double v) {
        return new Candle(
            openTime,
            BigDecimal.valueOf(o),
            BigDecimal.valueOf(h),
            BigDecimal.valueOf(l),
            BigDecimal.valueOf(c),
            BigDecimal.valueOf(v),
            BigDecimal.ZERO
        );
    }

    /**
     * (high + low) / 2
     */
    public double hl2() {
        return (high.doubleValue() + low.doubleValue()) / 2.0;
    }
}
