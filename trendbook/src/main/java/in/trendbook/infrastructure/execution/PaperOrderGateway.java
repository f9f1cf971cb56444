package in.trendbook.infrastructure.execution;

import in.trendbook.application.port.output.AccountSource;
import in.trendbook.application.port.output.OrderGateway;
import in.trendbook.domain.account.OrderRecord;
import in.trendbook.domain.account.PositionUpdate;
import in.trendbook.domain.book.TopOfBook;
import in.trendbook.domain.order.OrderSide;
import in.trendbook.domain.order.OrderStatus;
import in.trendbook.domain.order.OrderType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Simulated execution venue for dry runs.
 *
 * - Market orders fill immediately at the opposite touch
 * - Limit orders rest until {@link #match(TopOfBook)} sees the touch reach them
 * - Reduce-only orders are clamped to the open position and rejected if they would add to it
 * - Duplicate client order ids return the original order id
 *
 * Execution events are pushed synchronously to the supplied consumers, the same way
 * a live execution feed would deliver them.
 */
public final class PaperOrderGateway implements OrderGateway, AccountSource {
    private static final Logger log = LoggerFactory.getLogger(PaperOrderGateway.class);
    private static final MathContext MC = new MathContext(18, RoundingMode.HALF_UP);

    private final String symbol;
    private final Supplier<TopOfBook> topOfBook;
    private final Consumer<OrderRecord> orderEvents;
    private final Consumer<PositionUpdate> positionEvents;

    private final Map<String, OrderRecord> resting = new LinkedHashMap<>();
    private final Map<String, String> orderIdByClientId = new HashMap<>();
    private final BigDecimal walletBalance;
    private BigDecimal position = BigDecimal.ZERO;
    private BigDecimal avgPrice = BigDecimal.ZERO;
    private long nextId = 1;

    public PaperOrderGateway(String symbol, BigDecimal walletBalance, Supplier<TopOfBook> topOfBook,
                             Consumer<OrderRecord> orderEvents, Consumer<PositionUpdate> positionEvents) {
        this.symbol = symbol;
        this.walletBalance = walletBalance;
        this.topOfBook = topOfBook;
        this.orderEvents = orderEvents;
        this.positionEvents = positionEvents;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ORDER GATEWAY
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public synchronized String placeOrder(OrderSide side, BigDecimal quantity, BigDecimal price, OrderType type,
                                          String clientOrderId, boolean reduceOnly) {
        if (clientOrderId != null && orderIdByClientId.containsKey(clientOrderId)) {
            log.debug("[PAPER] Duplicate client order id {}, returning existing order", clientOrderId);
            return orderIdByClientId.get(clientOrderId);
        }

        BigDecimal qty = quantity;
        if (reduceOnly) {
            boolean reduces = (side == OrderSide.SELL && position.signum() > 0)
                || (side == OrderSide.BUY && position.signum() < 0);
            if (!reduces) {
                log.warn("[PAPER] Rejected reduce-only {} {}: position {}", side, quantity, position);
                return null;
            }
            qty = quantity.min(position.abs());
        }

        String orderId = "paper-" + nextId++;
        if (clientOrderId != null) {
            orderIdByClientId.put(clientOrderId, orderId);
        }

        if (type == OrderType.MARKET) {
            TopOfBook top = topOfBook.get();
            BigDecimal fillPrice = side == OrderSide.BUY ? top.askPrice() : top.bidPrice();
            if (fillPrice == null) {
                log.warn("[PAPER] Rejected market {} {}: no liquidity", side, qty);
                orderEvents.accept(new OrderRecord(orderId, side, null, qty, type, OrderStatus.REJECTED));
                return null;
            }
            fill(new OrderRecord(orderId, side, fillPrice, qty, type, OrderStatus.NEW), fillPrice);
            return orderId;
        }

        OrderRecord order = new OrderRecord(orderId, side, price, qty, type, OrderStatus.NEW);
        resting.put(orderId, order);
        orderEvents.accept(order);
        log.info("[PAPER] Resting {} {} @ {} ({})", side, qty.toPlainString(), price.toPlainString(), orderId);
        return orderId;
    }

    @Override
    public synchronized boolean cancelOrder(String orderId) {
        OrderRecord order = resting.remove(orderId);
        if (order == null) {
            return false;
        }
        orderEvents.accept(order.withStatus(OrderStatus.CANCELLED));
        return true;
    }

    @Override
    public synchronized int cancelAllOrders() {
        List<OrderRecord> cancelled = new ArrayList<>(resting.values());
        resting.clear();
        for (OrderRecord order : cancelled) {
            orderEvents.accept(order.withStatus(OrderStatus.CANCELLED));
        }
        return cancelled.size();
    }

    /**
     * Fill every resting limit order the current touch has reached.
     *
     * @return number of orders filled
     */
    public synchronized int match(TopOfBook top) {
        List<OrderRecord> filled = new ArrayList<>();
        for (OrderRecord order : resting.values()) {
            boolean crossed = order.side() == OrderSide.BUY
                ? top.hasAsk() && top.askPrice().compareTo(order.price()) <= 0
                : top.hasBid() && top.bidPrice().compareTo(order.price()) >= 0;
            if (crossed) {
                filled.add(order);
            }
        }
        for (OrderRecord order : filled) {
            resting.remove(order.orderId());
            fill(order, order.price());
        }
        return filled.size();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ACCOUNT SOURCE
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public void setLeverage(String symbol, BigDecimal leverage) {
        log.info("[PAPER] Leverage for {} set to {}", symbol, leverage);
    }

    @Override
    public BigDecimal fetchWalletBalance() {
        return walletBalance;
    }

    @Override
    public synchronized PositionUpdate fetchPosition(String symbol) {
        return new PositionUpdate(symbol, position, avgPrice);
    }

    @Override
    public synchronized List<OrderRecord> fetchOpenOrders(String symbol) {
        return List.copyOf(resting.values());
    }

    public synchronized BigDecimal position() {
        return position;
    }

    private void fill(OrderRecord order, BigDecimal fillPrice) {
        BigDecimal signedQty = order.side() == OrderSide.BUY ? order.quantity() : order.quantity().negate();
        BigDecimal newPosition = position.add(signedQty);

        if (newPosition.signum() == 0) {
            avgPrice = BigDecimal.ZERO;
        } else if (position.signum() == 0 || position.signum() != newPosition.signum()) {
            avgPrice = fillPrice;
        } else if (position.signum() == signedQty.signum()) {
            avgPrice = avgPrice.multiply(position.abs()).add(fillPrice.multiply(order.quantity()))
                .divide(newPosition.abs(), MC);
        }
        position = newPosition;

        log.info("[PAPER] ✅ Filled {} {} {} @ {} -> position {}", order.orderType(), order.side(),
            order.quantity().toPlainString(), fillPrice.toPlainString(), position.toPlainString());
        orderEvents.accept(new OrderRecord(order.orderId(), order.side(), fillPrice, order.quantity(),
            order.orderType(), OrderStatus.FILLED));
        positionEvents.accept(new PositionUpdate(symbol, position, avgPrice));
    }
}
