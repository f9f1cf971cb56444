package in.trendbook.service.indicator;

import in.trendbook.domain.data.Candle;
import in.trendbook.domain.signal.IndicatorState;

import java.util.List;
import java.util.Optional;

/**
 * Recomputes ATR and Supertrend over the full candle window on every call.
 */
public final class IndicatorEngine {

    private final int atrPeriod;
    private final double multiplier;

    public IndicatorEngine(int atrPeriod, double multiplier) {
        if (atrPeriod < 1) {
            throw new IllegalArgumentException("atrPeriod must be at least 1: " + atrPeriod);
        }
        if (multiplier <= 0) {
            throw new IllegalArgumentException("multiplier must be positive: " + multiplier);
        }
        this.atrPeriod = atrPeriod;
        this.multiplier = multiplier;
    }

    /**
     * @return latest state, or empty if the window holds fewer than atrPeriod + 1 candles
     */
    public Optional<IndicatorState> compute(List<Candle> candles) {
        SupertrendSeries series = series(candles);
        if (series.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new IndicatorState(series.lastAtr(), series.lastLine(), series.lastDirection()));
    }

    public SupertrendSeries series(List<Candle> candles) {
        int n = candles.size();
        double[] highs = new double[n];
        double[] lows = new double[n];
        double[] closes = new double[n];
        for (int i = 0; i < n; i++) {
            Candle c = candles.get(i);
            highs[i] = c.high().doubleValue();
            lows[i] = c.low().doubleValue();
            closes[i] = c.close().doubleValue();
        }
        return SupertrendCalculator.compute(highs, lows, closes, atrPeriod, multiplier);
    }

    /**
     * Minimum number of candles needed for a non-empty result.
     */
    public int minimumBars() {
        return atrPeriod + 1;
    }

    public int atrPeriod() {
        return atrPeriod;
    }

    public double multiplier() {
        return multiplier;
    }
}
