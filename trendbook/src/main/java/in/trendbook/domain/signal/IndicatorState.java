package in.trendbook.domain.signal;

/**
 * Latest scalar output of the indicator engine.
 *
 * @param atr             Wilder-smoothed average true range of the newest bar
 * @param supertrendLine  trailing band value of the newest bar
 * @param direction       trend direction of the newest bar
 */
public record IndicatorState(double atr, double supertrendLine, TrendDirection direction) {
    public IndicatorState {
        if (direction == null) {
            throw new IllegalArgumentException("direction cannot be null");
        }
    }
}
