package in.trendbook.service.strategy;

import in.trendbook.domain.account.AccountState;
import in.trendbook.domain.book.TopOfBook;
import in.trendbook.domain.data.Candle;
import in.trendbook.domain.order.OrderCommand;

import java.util.List;

/**
 * Decision engine contract.
 *
 * Lifecycle: {@link #initialize} once, then any interleaving of {@link #onCandleUpdate} and
 * {@link #onBookUpdate}, with {@link #decide} once per decision cycle; {@link #shutdown} last.
 * All calls arrive on the session scheduler thread.
 */
public interface TradingStrategy {

    /**
     * Registry name, also used as a metrics label.
     */
    String name();

    /**
     * Candle interval this strategy needs (exchange interval code).
     */
    String klineInterval();

    /**
     * Number of candles to fetch per poll.
     */
    int klineLimit();

    void initialize(AccountState account);

    /**
     * Full, time-ascending candle window after the latest merge.
     */
    void onCandleUpdate(List<Candle> candles);

    void onBookUpdate(TopOfBook top);

    /**
     * Turn the latest indicator, book and account view into order commands, executed in list order.
     */
    List<OrderCommand> decide(AccountState account);

    /**
     * Commands that cancel all outstanding entry orders.
     */
    List<OrderCommand> shutdown(AccountState account);
}
