package in.trendbook.domain.order;

import java.math.BigDecimal;

/**
 * Order-management intent emitted by a strategy.
 *
 * <pre>
 * PLACE       side, quantity, type, price (LIMIT only), clientOrderId
 * CANCEL      orderId
 * CANCEL_ALL  no arguments
 * </pre>
 *
 * Commands are executed in list order by the execution collaborator.
 */
public record OrderCommand(
    CommandType type,
    OrderSide side,
    BigDecimal quantity,
    BigDecimal price,
    OrderType orderType,
    String clientOrderId,
    String orderId,
    boolean reduceOnly
) {
    public enum CommandType {
        PLACE,
        CANCEL,
        CANCEL_ALL
    }

    public OrderCommand {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (type == CommandType.PLACE) {
            if (side == null || orderType == null) {
                throw new IllegalArgumentException("PLACE requires side and orderType");
            }
            if (quantity == null || quantity.signum() <= 0) {
                throw new IllegalArgumentException("PLACE quantity must be positive: " + quantity);
            }
            if (orderType == OrderType.LIMIT && (price == null || price.signum() <= 0)) {
                throw new IllegalArgumentException("LIMIT order requires a positive price: " + price);
            }
        }
        if (type == CommandType.CANCEL && (orderId == null || orderId.isBlank())) {
            throw new IllegalArgumentException("CANCEL requires orderId");
        }
    }

    public static OrderCommand limit(OrderSide side, BigDecimal qty, BigDecimal price, String clientOrderId) {
        return new OrderCommand(CommandType.PLACE, side, qty, price, OrderType.LIMIT, clientOrderId, null, false);
    }

    public static OrderCommand market(OrderSide side, BigDecimal qty, String clientOrderId, boolean reduceOnly) {
        return new OrderCommand(CommandType.PLACE, side, qty, null, OrderType.MARKET, clientOrderId, null, reduceOnly);
    }

    public static OrderCommand cancel(String orderId) {
        return new OrderCommand(CommandType.CANCEL, null, null, null, null, null, orderId, false);
    }

    public static OrderCommand cancelAll() {
        return new OrderCommand(CommandType.CANCEL_ALL, null, null, null, null, null, null, false);
    }

    public boolean isPlace() {
        return type == CommandType.PLACE;
    }

    @Override
    public String toString() {
        return switch (type) {
            case PLACE -> "PLACE " + orderType + " " + side + " " + quantity.toPlainString()
                + (price != null ? " @ " + price.toPlainString() : "")
                + (reduceOnly ? " reduceOnly" : "")
                + " [" + clientOrderId + "]";
            case CANCEL -> "CANCEL " + orderId;
            case CANCEL_ALL -> "CANCEL_ALL";
        };
    }
}
