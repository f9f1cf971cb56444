package in.trendbook.domain.order;

/**
 * Order type.
 */
public enum OrderType {
    LIMIT,
    MARKET;

    public String wireName() {
        return this == LIMIT ? "Limit" : "Market";
    }

    public static OrderType fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("orderType cannot be null");
        }
        return switch (value.trim().toUpperCase()) {
            case "LIMIT" -> LIMIT;
            case "MARKET" -> MARKET;
            default -> throw new IllegalArgumentException("Unknown order type: " + value);
        };
    }
}
