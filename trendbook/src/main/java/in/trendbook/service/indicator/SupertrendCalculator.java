package in.trendbook.service.indicator;

import in.trendbook.domain.signal.TrendDirection;

/**
 * Supertrend trailing-band indicator.
 *
 * First usable bar (index {@code period}):
 * <pre>
 * hl2   = (high + low) / 2
 * upper = hl2 + multiplier * ATR
 * lower = hl2 - multiplier * ATR
 * dir   = close > upper ? UP : close < lower ? DOWN : (close >= hl2 ? UP : DOWN)
 * line  = dir == UP ? lower : upper
 * </pre>
 *
 * Subsequent bars ratchet the band that is trailing the established trend:
 * while UP the lower band can only rise ({@code max(basicLower, prevLine)}), while DOWN the
 * upper band can only fall ({@code min(basicUpper, prevLine)}). The trend flips when close
 * crosses the trailing band; the line then restarts from the opposite basic band.
 */
public final class SupertrendCalculator {

    private SupertrendCalculator() {}

    public static SupertrendSeries compute(double[] highs, double[] lows, double[] closes,
                                           int period, double multiplier) {
        if (multiplier <= 0) {
            throw new IllegalArgumentException("multiplier must be positive: " + multiplier);
        }
        double[] atr = AtrCalculator.compute(highs, lows, closes, period);
        if (atr.length == 0) {
            return SupertrendSeries.empty();
        }

        int length = atr.length;
        double[] line = new double[length];
        TrendDirection[] direction = new TrendDirection[length];

        for (int k = 0; k < length; k++) {
            int i = period + k;
            double hl2 = (highs[i] + lows[i]) / 2.0;
            double basicUpper = hl2 + multiplier * atr[k];
            double basicLower = hl2 - multiplier * atr[k];
            double close = closes[i];

            if (k == 0) {
                TrendDirection dir;
                if (close > basicUpper) {
                    dir = TrendDirection.UP;
                } else if (close < basicLower) {
                    dir = TrendDirection.DOWN;
                } else {
                    dir = close >= hl2 ? TrendDirection.UP : TrendDirection.DOWN;
                }
                direction[0] = dir;
                line[0] = dir == TrendDirection.UP ? basicLower : basicUpper;
                continue;
            }

            double prevLine = line[k - 1];
            if (direction[k - 1] == TrendDirection.UP) {
                double finalLower = Math.max(basicLower, prevLine);
                if (close < finalLower) {
                    direction[k] = TrendDirection.DOWN;
                    line[k] = basicUpper;
                } else {
                    direction[k] = TrendDirection.UP;
                    line[k] = finalLower;
                }
            } else {
                double finalUpper = Math.min(basicUpper, prevLine);
                if (close > finalUpper) {
                    direction[k] = TrendDirection.UP;
                    line[k] = basicLower;
                } else {
                    direction[k] = TrendDirection.DOWN;
                    line[k] = finalUpper;
                }
            }
        }
        return new SupertrendSeries(atr, line, direction);
    }
}
