package in.trendbook.service.strategy;

import in.trendbook.config.StrategyConfig;
import in.trendbook.domain.account.AccountState;
import in.trendbook.domain.data.Candle;
import in.trendbook.domain.order.OrderCommand;
import in.trendbook.domain.order.OrderSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Two-sided quoting around the best bid and ask.
 *
 * Target bid = bestBid * (1 - spread), target ask = bestAsk * (1 + spread). A crossed pair
 * halves the spread up to {@value #MAX_SPREAD_HALVINGS} times, then the ask is nudged one
 * increment above the bid. Each side keeps one entry resting with the shared reprice rule.
 * Holds no state between cycles beyond the order set itself.
 */
public final class MarketMakingStrategy extends BaseTradingStrategy {
    private static final Logger log = LoggerFactory.getLogger(MarketMakingStrategy.class);

    public static final String NAME = "market-making";
    static final int MAX_SPREAD_HALVINGS = 4;

    public MarketMakingStrategy(StrategyConfig config) {
        super(config, "mm");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void initialize(AccountState account) {
        log.info("[{}] Initialized: spread={}, orderSize={}, maxPosition={}", NAME,
            config.spreadPct(), config.orderSize(), config.maxPositionSize());
    }

    @Override
    public void onCandleUpdate(List<Candle> candles) {
        // quotes depend on the book only
    }

    @Override
    public List<OrderCommand> decide(AccountState account) {
        List<OrderCommand> commands = new ArrayList<>();
        if (top.isTwoSided()) {
            Quotes quotes = quotes(top.bidPrice(), top.askPrice());
            BigDecimal position = account.positionSize();
            maintainEntries(OrderSide.BUY, quotes.bid(), position, account, commands);
            maintainEntries(OrderSide.SELL, quotes.ask(), position.negate(), account, commands);
        }
        applySafetyValve(account, commands);
        return commands;
    }

    /**
     * Quote pair for the given best prices; the returned bid is always below the ask.
     */
    Quotes quotes(BigDecimal bestBid, BigDecimal bestAsk) {
        double spread = config.spreadPct();
        BigDecimal bid = null;
        BigDecimal ask = null;
        for (int attempt = 0; attempt <= MAX_SPREAD_HALVINGS; attempt++) {
            bid = roundToTick(bestBid.multiply(BigDecimal.ONE.subtract(BigDecimal.valueOf(spread))), OrderSide.BUY);
            ask = roundToTick(bestAsk.multiply(BigDecimal.ONE.add(BigDecimal.valueOf(spread))), OrderSide.SELL);
            if (bid.compareTo(ask) < 0) {
                return new Quotes(bid, ask);
            }
            spread /= 2;
        }
        BigDecimal nudged = bid.add(increment(bid));
        log.warn("[{}] Quotes still crossed (bid {} / ask {}), nudging ask to {}", NAME,
            bid.toPlainString(), ask.toPlainString(), nudged.toPlainString());
        return new Quotes(bid, nudged);
    }

    record Quotes(BigDecimal bid, BigDecimal ask) {}
}
