package in.trendbook.domain.account;

import in.trendbook.domain.order.OrderSide;
import in.trendbook.domain.order.OrderStatus;
import in.trendbook.domain.order.OrderType;

import java.math.BigDecimal;

/**
 * Order as reported on the execution feed. Also used as the order event itself.
 */
public record OrderRecord(
    String orderId,
    OrderSide side,
    BigDecimal price,
    BigDecimal quantity,
    OrderType orderType,
    OrderStatus status
) {
    public OrderRecord {
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalArgumentException("orderId cannot be null or blank");
        }
        if (side == null || orderType == null || status == null) {
            throw new IllegalArgumentException("side, orderType and status are required");
        }
        if (quantity == null || quantity.signum() < 0) {
            throw new IllegalArgumentException("quantity cannot be negative: " + quantity);
        }
    }

    /**
     * Resting limit order that can still fill, i.e. an entry order.
     */
    public boolean isActiveEntry() {
        return orderType == OrderType.LIMIT && status.isActive() && price != null;
    }

    public OrderRecord withStatus(OrderStatus newStatus) {
        return new OrderRecord(orderId, side, price, quantity, orderType, newStatus);
    }
}
