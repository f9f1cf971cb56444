package in.trendbook.domain.book;

/**
 * Outcome of applying a snapshot or delta.
 */
public enum BookUpdateResult {
    APPLIED,
    DISCARDED_STALE,     // sequence id <= last applied
    REJECTED_MALFORMED   // structural problem, prior state retained
}
