package in.trendbook.domain.book;

import java.util.List;

/**
 * Full book image. Both sides and the sequence id are mandatory;
 * a snapshot missing any of them is structurally malformed.
 */
public record BookSnapshot(
    List<BookEntry> bids,
    List<BookEntry> asks,
    Long sequenceId
) {
    public boolean isWellFormed() {
        return bids != null && asks != null && sequenceId != null;
    }
}
