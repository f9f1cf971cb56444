package in.trendbook.service.book;

/**
 * Available {@link PriceLevelStore} implementations.
 */
public enum StoreType {
    SKIPLIST,
    HEAP;

    public static StoreType fromString(String value) {
        if (value == null || value.isBlank()) {
            return SKIPLIST;
        }
        return switch (value.trim().toUpperCase().replace("-", "").replace("_", "")) {
            case "SKIPLIST", "SKIP" -> SKIPLIST;
            case "HEAP" -> HEAP;
            default -> throw new IllegalArgumentException("Unknown store type: " + value);
        };
    }
}
