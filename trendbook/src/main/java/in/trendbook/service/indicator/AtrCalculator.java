package in.trendbook.service.indicator;

/**
 * Average True Range with Wilder smoothing.
 *
 * TR[i] = max(high[i] - low[i], |high[i] - close[i-1]|, |low[i] - close[i-1]|), i = 1..n-1
 * ATR   = mean of the first {@code period} true ranges, then
 *         ATR[i] = (ATR[i-1] * (period - 1) + TR[i]) / period
 *
 * Output index k corresponds to input bar {@code period + k}.
 */
public final class AtrCalculator {

    private AtrCalculator() {}

    /**
     * @return ATR series of length {@code n - period}, or an empty array if fewer than period + 1 bars
     */
    public static double[] compute(double[] highs, double[] lows, double[] closes, int period) {
        if (period < 1) {
            throw new IllegalArgumentException("period must be at least 1: " + period);
        }
        int n = requireSameLength(highs, lows, closes);
        if (n < period + 1) {
            return new double[0];
        }

        double[] atr = new double[n - period];

        double sum = 0.0;
        for (int i = 1; i <= period; i++) {
            sum += trueRange(highs, lows, closes, i);
        }
        atr[0] = sum / period;

        for (int i = period + 1; i < n; i++) {
            int k = i - period;
            atr[k] = (atr[k - 1] * (period - 1) + trueRange(highs, lows, closes, i)) / period;
        }
        return atr;
    }

    static double trueRange(double[] highs, double[] lows, double[] closes, int i) {
        double prevClose = closes[i - 1];
        return Math.max(highs[i] - lows[i],
            Math.max(Math.abs(highs[i] - prevClose), Math.abs(lows[i] - prevClose)));
    }

    static int requireSameLength(double[] highs, double[] lows, double[] closes) {
        if (highs == null || lows == null || closes == null) {
            throw new IllegalArgumentException("price arrays cannot be null");
        }
        if (highs.length != lows.length || lows.length != closes.length) {
            throw new IllegalArgumentException("price arrays differ in length: "
                + highs.length + "/" + lows.length + "/" + closes.length);
        }
        return closes.length;
    }
}
