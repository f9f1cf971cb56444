package in.trendbook.domain.order;

/**
 * Exchange order status as reported on the execution feed.
 */
public enum OrderStatus {
    NEW("New"),
    PARTIALLY_FILLED("PartiallyFilled"),
    UNTRIGGERED("Untriggered"),     // conditional order waiting for its trigger
    CREATED("Created"),             // accepted, not yet on the book
    FILLED("Filled"),
    CANCELLED("Cancelled"),
    REJECTED("Rejected");

    private final String wireName;

    OrderStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * True while the order can still rest on the book or fill.
     */
    public boolean isActive() {
        return this == NEW || this == PARTIALLY_FILLED || this == UNTRIGGERED || this == CREATED;
    }

    public static OrderStatus fromWire(String value) {
        for (OrderStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        // Bybit reports some cancels as "PartiallyFilledCanceled" / "Deactivated"
        if (value != null && (value.startsWith("PartiallyFilledCancel") || value.equals("Deactivated"))) {
            return CANCELLED;
        }
        throw new IllegalArgumentException("Unknown order status: " + value);
    }
}
