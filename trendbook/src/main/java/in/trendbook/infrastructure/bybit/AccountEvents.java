package in.trendbook.infrastructure.bybit;

import in.trendbook.domain.account.OrderRecord;
import in.trendbook.domain.account.PositionUpdate;
import in.trendbook.domain.account.WalletUpdate;

import java.util.List;

/**
 * Events decoded from one private-stream message. Usually only one list is non-empty.
 */
public record AccountEvents(
    List<PositionUpdate> positions,
    List<OrderRecord> orders,
    List<WalletUpdate> wallets
) {
    public AccountEvents {
        positions = List.copyOf(positions);
        orders = List.copyOf(orders);
        wallets = List.copyOf(wallets);
    }

    public static AccountEvents empty() {
        return new AccountEvents(List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return positions.isEmpty() && orders.isEmpty() && wallets.isEmpty();
    }
}
