package in.trendbook.domain.order;

/**
 * Order side.
 */
public enum OrderSide {
    BUY,
    SELL;

    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /**
     * Exchange wire name ("Buy" / "Sell").
     */
    public String wireName() {
        return this == BUY ? "Buy" : "Sell";
    }

    public static OrderSide fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("side cannot be null");
        }
        return switch (value.trim().toUpperCase()) {
            case "BUY" -> BUY;
            case "SELL" -> SELL;
            default -> throw new IllegalArgumentException("Unknown side: " + value);
        };
    }
}
