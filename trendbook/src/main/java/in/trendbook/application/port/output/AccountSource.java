package in.trendbook.application.port.output;

import in.trendbook.domain.account.OrderRecord;
import in.trendbook.domain.account.PositionUpdate;

import java.math.BigDecimal;
import java.util.List;

/**
 * Account queries used once at startup to seed the account state.
 * Any method may throw a RuntimeException on transport failure.
 */
public interface AccountSource {

    void setLeverage(String symbol, BigDecimal leverage);

    BigDecimal fetchWalletBalance();

    PositionUpdate fetchPosition(String symbol);

    List<OrderRecord> fetchOpenOrders(String symbol);
}
