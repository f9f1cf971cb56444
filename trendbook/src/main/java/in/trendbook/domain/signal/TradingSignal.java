package in.trendbook.domain.signal;

import in.trendbook.domain.account.PositionSide;

/**
 * Last acted direction of a trend-following strategy.
 */
public enum TradingSignal {
    NONE(0),
    LONG(1),
    SHORT(-1);

    private final int gaugeValue;

    TradingSignal(int gaugeValue) {
        this.gaugeValue = gaugeValue;
    }

    public int gaugeValue() {
        return gaugeValue;
    }

    public static TradingSignal fromDirection(TrendDirection direction) {
        return direction == TrendDirection.UP ? LONG : SHORT;
    }

    public static TradingSignal fromPositionSide(PositionSide side) {
        return switch (side) {
            case LONG -> LONG;
            case SHORT -> SHORT;
            case FLAT -> NONE;
        };
    }
}
