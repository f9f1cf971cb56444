package in.trendbook.application.port.output;

import in.trendbook.domain.order.OrderSide;
import in.trendbook.domain.order.OrderType;

import java.math.BigDecimal;

/**
 * Outbound command interface to the execution venue.
 *
 * Implementations deduplicate on client order id, so a retried placement with the same
 * id does not create a second order. Transport failures surface as
 * {@link OrderGatewayException}; a venue-side rejection is a normal return value.
 */
public interface OrderGateway {

    /**
     * Place an order.
     *
     * @param side          BUY or SELL
     * @param quantity      positive quantity
     * @param price         limit price, null for MARKET
     * @param type          LIMIT or MARKET
     * @param clientOrderId caller-supplied id used for deduplication, may be null
     * @param reduceOnly    only reduce an existing position
     * @return exchange order id, or null if the venue rejected the order
     * @throws OrderGatewayException on transport failure
     */
    String placeOrder(OrderSide side, BigDecimal quantity, BigDecimal price, OrderType type,
                      String clientOrderId, boolean reduceOnly);

    /**
     * @return true if the venue accepted the cancel
     * @throws OrderGatewayException on transport failure
     */
    boolean cancelOrder(String orderId);

    /**
     * Cancel every open order for the configured instrument.
     *
     * @return number of orders cancelled
     * @throws OrderGatewayException on transport failure
     */
    int cancelAllOrders();
}
