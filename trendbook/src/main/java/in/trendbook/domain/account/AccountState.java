package in.trendbook.domain.account;

import in.trendbook.domain.order.OrderSide;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the account handed to a strategy once per decision cycle.
 */
public record AccountState(
    BigDecimal walletBalance,
    BigDecimal positionSize,
    PositionSide positionSide,
    Map<String, OrderRecord> activeOrders
) {
    public AccountState {
        if (walletBalance == null) walletBalance = BigDecimal.ZERO;
        if (positionSize == null) positionSize = BigDecimal.ZERO;
        if (positionSide == null) positionSide = PositionSide.fromSignedSize(positionSize);
        activeOrders = activeOrders == null ? Map.of() : Map.copyOf(activeOrders);
    }

    public static AccountState empty() {
        return new AccountState(BigDecimal.ZERO, BigDecimal.ZERO, PositionSide.FLAT, Map.of());
    }

    public BigDecimal absPosition() {
        return positionSize.abs();
    }

    /**
     * Active resting limit orders on the given side, in orderId order.
     */
    public List<OrderRecord> entryOrders(OrderSide side) {
        return activeOrders.values().stream()
            .filter(o -> o.side() == side && o.isActiveEntry())
            .sorted(Comparator.comparing(OrderRecord::orderId))
            .toList();
    }

    /**
     * Sum of quantities of active entry orders on the given side.
     */
    public BigDecimal outstandingEntryQuantity(OrderSide side) {
        return entryOrders(side).stream()
            .map(OrderRecord::quantity)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
