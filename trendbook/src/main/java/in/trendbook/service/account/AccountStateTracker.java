package in.trendbook.service.account;

import in.trendbook.domain.account.AccountState;
import in.trendbook.domain.account.OrderRecord;
import in.trendbook.domain.account.PositionSide;
import in.trendbook.domain.account.PositionUpdate;
import in.trendbook.domain.account.WalletUpdate;
import in.trendbook.domain.order.OrderCommand;
import in.trendbook.domain.order.OrderStatus;
import in.trendbook.domain.order.OrderType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the mutable account state for one instrument.
 *
 * Single writer: execution-event handlers and the command executor, all on the session
 * scheduler thread. Strategies only ever see {@link #snapshot()}.
 *
 * Locally issued commands are reflected immediately (placed limit orders added, cancels
 * removed) so the next decision cycle does not re-issue them before the venue's own
 * execution event arrives. Later events for the same order id overwrite the local view.
 */
public final class AccountStateTracker {
    private static final Logger log = LoggerFactory.getLogger(AccountStateTracker.class);

    private final String symbol;
    private final Map<String, OrderRecord> activeOrders = new LinkedHashMap<>();
    private BigDecimal walletBalance = BigDecimal.ZERO;
    private BigDecimal positionSize = BigDecimal.ZERO;
    private BigDecimal avgEntryPrice = BigDecimal.ZERO;

    public AccountStateTracker(String symbol) {
        this.symbol = symbol;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // EXECUTION FEED
    // ═══════════════════════════════════════════════════════════════════════

    public void onPosition(PositionUpdate update) {
        if (update.symbol() != null && !update.symbol().equalsIgnoreCase(symbol)) {
            log.debug("[{}] Ignoring position update for {}", symbol, update.symbol());
            return;
        }
        BigDecimal previous = positionSize;
        positionSize = update.size();
        avgEntryPrice = update.avgPrice();
        if (previous.compareTo(positionSize) != 0) {
            log.info("[{}] Position {} -> {} (avg {})", symbol,
                previous.toPlainString(), positionSize.toPlainString(), avgEntryPrice.toPlainString());
        }
    }

    public void onOrder(OrderRecord order) {
        if (order.status().isActive()) {
            activeOrders.put(order.orderId(), order);
        } else if (activeOrders.remove(order.orderId()) != null) {
            log.info("[{}] Order {} {} ({} {} @ {})", symbol, order.orderId(), order.status(),
                order.side(), order.quantity().toPlainString(),
                order.price() == null ? "MKT" : order.price().toPlainString());
        }
    }

    public void onWallet(WalletUpdate update) {
        walletBalance = update.totalEquity();
        log.debug("[{}] Wallet {} equity {}", symbol, update.accountType(), walletBalance.toPlainString());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // LOCAL COMMAND ACKNOWLEDGEMENTS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Record a limit order the venue accepted. Market orders are reflected through position events only.
     */
    public void recordPlaced(OrderCommand command, String orderId) {
        if (!command.isPlace() || command.orderType() != OrderType.LIMIT) {
            return;
        }
        activeOrders.putIfAbsent(orderId, new OrderRecord(orderId, command.side(), command.price(),
            command.quantity(), command.orderType(), OrderStatus.CREATED));
    }

    public void recordCancelled(String orderId) {
        activeOrders.remove(orderId);
    }

    public void recordAllCancelled() {
        if (!activeOrders.isEmpty()) {
            log.info("[{}] Clearing {} active orders after cancel-all", symbol, activeOrders.size());
        }
        activeOrders.clear();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // BOOTSTRAP + VIEW
    // ═══════════════════════════════════════════════════════════════════════

    public void seed(BigDecimal wallet, PositionUpdate position, List<OrderRecord> openOrders) {
        walletBalance = wallet == null ? BigDecimal.ZERO : wallet;
        if (position != null) {
            positionSize = position.size();
            avgEntryPrice = position.avgPrice();
        }
        activeOrders.clear();
        for (OrderRecord order : openOrders) {
            onOrder(order);
        }
        log.info("[{}] Account seeded: wallet={}, position={}, activeOrders={}", symbol,
            walletBalance.toPlainString(), positionSize.toPlainString(), activeOrders.size());
    }

    public AccountState snapshot() {
        return new AccountState(walletBalance, positionSize, PositionSide.fromSignedSize(positionSize),
            new LinkedHashMap<>(activeOrders));
    }

    public BigDecimal avgEntryPrice() {
        return avgEntryPrice;
    }

    public String symbol() {
        return symbol;
    }
}
