package in.trendbook.service.book;

import in.trendbook.domain.book.BookSide;

/**
 * Factory for {@link PriceLevelStore} implementations.
 */
public final class PriceLevelStores {

    private PriceLevelStores() {}

    public static PriceLevelStore create(StoreType type, BookSide side) {
        return switch (type) {
            case SKIPLIST -> new SkipListPriceLevelStore(side);
            case HEAP -> new HeapPriceLevelStore(side);
        };
    }
}
