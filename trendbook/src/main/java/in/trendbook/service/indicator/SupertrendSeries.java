package in.trendbook.service.indicator;

import in.trendbook.domain.signal.TrendDirection;

/**
 * Supertrend output aligned to input bars starting at index {@code period}.
 */
public record SupertrendSeries(double[] atr, double[] line, TrendDirection[] direction) {

    public static SupertrendSeries empty() {
        return new SupertrendSeries(new double[0], new double[0], new TrendDirection[0]);
    }

    public int length() {
        return line.length;
    }

    public boolean isEmpty() {
        return line.length == 0;
    }

    public TrendDirection lastDirection() {
        return isEmpty() ? null : direction[direction.length - 1];
    }

    public double lastLine() {
        if (isEmpty()) {
            throw new IllegalStateException("empty series");
        }
        return line[line.length - 1];
    }

    public double lastAtr() {
        if (isEmpty()) {
            throw new IllegalStateException("empty series");
        }
        return atr[atr.length - 1];
    }
}
