package in.trendbook.service.strategy;

import in.trendbook.config.StrategyConfig;
import in.trendbook.domain.account.AccountState;
import in.trendbook.domain.account.PositionSide;
import in.trendbook.domain.data.Candle;
import in.trendbook.domain.order.OrderCommand;
import in.trendbook.domain.order.OrderSide;
import in.trendbook.domain.signal.IndicatorState;
import in.trendbook.domain.signal.TradingSignal;
import in.trendbook.infrastructure.metrics.EngineMetrics;
import in.trendbook.service.indicator.IndicatorEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Trend-following strategy driven by Supertrend direction.
 *
 * State machine over the last acted signal (NONE, LONG, SHORT):
 * <pre>
 * flip (signal != lastSignal):
 *   cancel-all
 *   flatten an opposite position with a reduce-only market order
 *   place one limit entry at best bid (LONG) / best ask (SHORT) if capacity allows
 *   lastSignal = signal
 * no flip:
 *   keep one entry resting at the current best, repricing at most one order per cycle
 * every cycle:
 *   position safety valve (skipped on the cycle that flattens)
 * </pre>
 *
 * Cancel and replace are issued back to back; the executor applies the cancel to the local
 * account view as soon as the venue acknowledges it, so no settle delay is needed.
 */
public final class SupertrendStrategy extends BaseTradingStrategy {
    private static final Logger log = LoggerFactory.getLogger(SupertrendStrategy.class);

    public static final String NAME = "supertrend";

    private final IndicatorEngine indicators;
    private final EngineMetrics metrics;

    private IndicatorState indicator;
    private TradingSignal lastSignal = TradingSignal.NONE;

    public SupertrendStrategy(StrategyConfig config, EngineMetrics metrics) {
        super(config, "st");
        this.indicators = new IndicatorEngine(config.atrPeriod(), config.multiplier());
        this.metrics = metrics;
    }

    @Override
    public String name() {
        return NAME;
    }

    /**
     * Seed the last acted signal from the position already held, so a restart does not
     * re-flatten a position that agrees with the trend.
     */
    @Override
    public void initialize(AccountState account) {
        lastSignal = TradingSignal.fromPositionSide(account.positionSide());
        metrics.recordSignal(NAME, lastSignal);
        log.info("[{}] Initialized: lastSignal={}, atrPeriod={}, multiplier={}",
            NAME, lastSignal, config.atrPeriod(), config.multiplier());
    }

    @Override
    public void onCandleUpdate(List<Candle> candles) {
        indicator = indicators.compute(candles).orElse(null);
        if (indicator == null) {
            log.debug("[{}] {} candles, need {} for indicator", NAME, candles.size(), indicators.minimumBars());
        }
    }

    @Override
    public List<OrderCommand> decide(AccountState account) {
        List<OrderCommand> commands = new ArrayList<>();
        if (indicator == null) {
            return commands;
        }

        TradingSignal signal = TradingSignal.fromDirection(indicator.direction());
        OrderSide entrySide = signal == TradingSignal.LONG ? OrderSide.BUY : OrderSide.SELL;
        BigDecimal target = entrySide == OrderSide.BUY ? top.bidPrice() : top.askPrice();

        if (signal != lastSignal) {
            log.info("[{}] 🔄 Signal flip {} -> {} (line={}, atr={})", NAME, lastSignal, signal,
                indicator.supertrendLine(), indicator.atr());
            commands.add(OrderCommand.cancelAll());

            BigDecimal exposure = account.absPosition();
            boolean flattened = false;
            if (isOpposite(account.positionSide(), signal) && exposure.signum() > 0) {
                commands.add(OrderCommand.market(entrySide, exposure, nextClientOrderId("close", entrySide), true));
                exposure = BigDecimal.ZERO;
                flattened = true;
            }

            // cancel-all above leaves no outstanding entries
            if (target != null && hasEntryCapacity(exposure, BigDecimal.ZERO)) {
                commands.add(entryOrder(entrySide, target));
            }

            lastSignal = signal;
            metrics.recordSignal(NAME, signal);
            if (!flattened) {
                applySafetyValve(account, commands);
            }
            return commands;
        }

        maintainEntries(entrySide, target, account.absPosition(), account, commands);
        applySafetyValve(account, commands);
        return commands;
    }

    public TradingSignal lastSignal() {
        return lastSignal;
    }

    public IndicatorState indicator() {
        return indicator;
    }

    private static boolean isOpposite(PositionSide side, TradingSignal signal) {
        return (side == PositionSide.SHORT && signal == TradingSignal.LONG)
            || (side == PositionSide.LONG && signal == TradingSignal.SHORT);
    }
}
