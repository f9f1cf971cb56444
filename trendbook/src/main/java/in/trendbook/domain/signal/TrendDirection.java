package in.trendbook.domain.signal;

/**
 * Supertrend direction.
 */
public enum TrendDirection {
    UP,
    DOWN
}
