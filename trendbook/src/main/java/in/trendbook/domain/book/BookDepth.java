package in.trendbook.domain.book;

import java.util.List;

/**
 * Top-N levels per side, best first.
 */
public record BookDepth(List<PriceLevel> bids, List<PriceLevel> asks) {
    public BookDepth {
        bids = List.copyOf(bids);
        asks = List.copyOf(asks);
    }
}
