package in.trendbook.domain.book;

import java.util.List;

/**
 * Incremental book update. Either side may be absent, but not both.
 * An entry with quantity zero deletes that price level.
 */
public record BookDelta(
    List<BookEntry> bids,
    List<BookEntry> asks,
    Long sequenceId
) {
    public boolean isWellFormed() {
        return (bids != null || asks != null) && sequenceId != null;
    }
}
