package in.trendbook.service.strategy;

import in.trendbook.config.StrategyConfig;
import in.trendbook.domain.account.AccountState;
import in.trendbook.domain.account.OrderRecord;
import in.trendbook.domain.book.PriceLevel;
import in.trendbook.domain.book.TopOfBook;
import in.trendbook.domain.order.OrderCommand;
import in.trendbook.domain.order.OrderSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Order-maintenance rules shared by all strategies.
 *
 * - Entry capacity: exposure below max position and outstanding entry quantity below
 *   orderSize * maxOpenEntryOrdersPerSide
 * - Reprice: at most one cancel + replacement per side per cycle
 * - Safety valve: |position| above max + buffer is cut back to max with a reduce-only market order
 * - Client order ids are unique per process so retried placements deduplicate at the venue
 */
abstract class BaseTradingStrategy implements TradingStrategy {
    private static final Logger log = LoggerFactory.getLogger(BaseTradingStrategy.class);
    private static final MathContext MC = new MathContext(18, RoundingMode.HALF_UP);

    protected final StrategyConfig config;
    protected TopOfBook top = TopOfBook.empty();

    private final String idPrefix;
    private final AtomicLong clientOrderSeq = new AtomicLong();

    protected BaseTradingStrategy(StrategyConfig config, String idPrefix) {
        if (config == null || !config.isValid()) {
            throw new IllegalArgumentException("Invalid strategy configuration: " + config);
        }
        this.config = config;
        this.idPrefix = idPrefix;
    }

    @Override
    public String klineInterval() {
        return config.klineInterval();
    }

    @Override
    public int klineLimit() {
        return config.klineLimit();
    }

    @Override
    public void onBookUpdate(TopOfBook top) {
        this.top = top == null ? TopOfBook.empty() : top;
    }

    @Override
    public List<OrderCommand> shutdown(AccountState account) {
        log.info("[{}] Shutdown: cancelling {} active orders", name(), account.activeOrders().size());
        return List.of(OrderCommand.cancelAll());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // SHARED RULES
    // ═══════════════════════════════════════════════════════════════════════

    protected boolean hasEntryCapacity(BigDecimal exposure, BigDecimal outstandingEntryQty) {
        return exposure.compareTo(config.maxPositionSize()) < 0
            && outstandingEntryQty.compareTo(config.maxOutstandingEntryQuantity()) < 0;
    }

    /**
     * Keep one side's entry orders at {@code target}: place one if none rest, otherwise
     * reprice at most one order that drifted beyond the threshold.
     *
     * @param exposure position exposure in the direction this side adds to
     */
    protected void maintainEntries(OrderSide side, BigDecimal target, BigDecimal exposure,
                                   AccountState account, List<OrderCommand> commands) {
        if (target == null) {
            log.debug("[{}] No {} target price, skipping entries", name(), side);
            return;
        }
        List<OrderRecord> entries = account.entryOrders(side);
        BigDecimal outstanding = account.outstandingEntryQuantity(side);

        if (entries.isEmpty()) {
            if (hasEntryCapacity(exposure, outstanding)) {
                commands.add(entryOrder(side, target));
            }
            return;
        }

        for (OrderRecord order : entries) {
            if (deviation(order.price(), target).doubleValue() > config.repriceThresholdPct()) {
                log.info("[{}] Repricing {} {} {} -> {}", name(), order.orderId(), side,
                    order.price().toPlainString(), target.toPlainString());
                commands.add(OrderCommand.cancel(order.orderId()));
                if (hasEntryCapacity(exposure, outstanding.subtract(order.quantity()))) {
                    commands.add(entryOrder(side, target));
                }
                return;
            }
        }
    }

    /**
     * Reduce-only market order for the excess over max position once |position| exceeds max + buffer.
     */
    protected void applySafetyValve(AccountState account, List<OrderCommand> commands) {
        BigDecimal abs = account.absPosition();
        BigDecimal limit = config.maxPositionSize().add(config.positionBuffer());
        if (abs.compareTo(limit) <= 0) {
            return;
        }
        BigDecimal excess = abs.subtract(config.maxPositionSize());
        OrderSide side = account.positionSize().signum() > 0 ? OrderSide.SELL : OrderSide.BUY;
        log.warn("[{}] ⚠️ Position {} exceeds limit {}, reducing by {}", name(),
            account.positionSize().toPlainString(), limit.toPlainString(), excess.toPlainString());
        commands.add(OrderCommand.market(side, excess, nextClientOrderId("risk", side), true));
    }

    protected OrderCommand entryOrder(OrderSide side, BigDecimal price) {
        return OrderCommand.limit(side, config.orderSize(), price, nextClientOrderId("entry", side));
    }

    protected String nextClientOrderId(String purpose, OrderSide side) {
        return idPrefix + "-" + purpose + "-" + side.name().toLowerCase() + "-" + clientOrderSeq.incrementAndGet();
    }

    /**
     * |price - target| / target
     */
    static BigDecimal deviation(BigDecimal price, BigDecimal target) {
        return price.subtract(target).abs().divide(target, MC);
    }

    /**
     * Snap a quote to the configured tick: bids round down, asks round up.
     * Without a tick size the quote is left unrounded.
     */
    protected BigDecimal roundToTick(BigDecimal price, OrderSide side) {
        BigDecimal tick = config.tickSize();
        if (tick == null) {
            return PriceLevel.normalize(price);
        }
        RoundingMode mode = side == OrderSide.BUY ? RoundingMode.FLOOR : RoundingMode.CEILING;
        return PriceLevel.normalize(price.divide(tick, 0, mode).multiply(tick));
    }

    /**
     * Smallest representable price increment at {@code price}.
     */
    protected BigDecimal increment(BigDecimal price) {
        return config.tickSize() != null ? config.tickSize() : price.ulp();
    }
}
