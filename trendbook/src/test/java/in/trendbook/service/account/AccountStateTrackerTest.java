package in.trendbook.service.account;

import in.trendbook.domain.account.AccountState;
import in.trendbook.domain.account.OrderRecord;
import in.trendbook.domain.account.PositionSide;
import in.trendbook.domain.account.PositionUpdate;
import in.trendbook.domain.account.WalletUpdate;
import in.trendbook.domain.order.OrderCommand;
import in.trendbook.domain.order.OrderSide;
import in.trendbook.domain.order.OrderStatus;
import in.trendbook.domain.order.OrderType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AccountStateTrackerTest {

    private final AccountStateTracker tracker = new AccountStateTracker("BTCUSDT");

    private static OrderRecord order(String id, OrderStatus status) {
        return new OrderRecord(id, OrderSide.BUY, new BigDecimal("100"), new BigDecimal("0.01"),
            OrderType.LIMIT, status);
    }

    @Test
    void testPositionUpdatesSignedSize() {
        tracker.onPosition(new PositionUpdate("BTCUSDT", new BigDecimal("-0.02"), new BigDecimal("101")));

        AccountState state = tracker.snapshot();
        assertEquals(PositionSide.SHORT, state.positionSide());
        assertEquals(0, new BigDecimal("0.02").compareTo(state.absPosition()));
        assertEquals(0, new BigDecimal("101").compareTo(tracker.avgEntryPrice()));
    }

    @Test
    void testPositionForOtherSymbolIgnored() {
        tracker.onPosition(new PositionUpdate("ETHUSDT", BigDecimal.ONE, BigDecimal.TEN));

        assertEquals(PositionSide.FLAT, tracker.snapshot().positionSide());
    }

    @Test
    void testOrderLifecycle() {
        tracker.onOrder(order("o-1", OrderStatus.NEW));
        tracker.onOrder(order("o-1", OrderStatus.PARTIALLY_FILLED));
        assertEquals(OrderStatus.PARTIALLY_FILLED, tracker.snapshot().activeOrders().get("o-1").status());

        tracker.onOrder(order("o-1", OrderStatus.FILLED));
        assertTrue(tracker.snapshot().activeOrders().isEmpty());
    }

    @Test
    void testWalletUpdate() {
        tracker.onWallet(new WalletUpdate("UNIFIED", new BigDecimal("1234.5")));

        assertEquals(0, new BigDecimal("1234.5").compareTo(tracker.snapshot().walletBalance()));
    }

    @Test
    void testLocalAcknowledgements() {
        OrderCommand limit = OrderCommand.limit(OrderSide.SELL, new BigDecimal("0.01"), new BigDecimal("105"), "c-1");
        tracker.recordPlaced(limit, "o-9");
        tracker.recordPlaced(OrderCommand.market(OrderSide.BUY, BigDecimal.ONE, "c-2", false), "o-10");

        AccountState state = tracker.snapshot();
        assertEquals(1, state.activeOrders().size());
        assertEquals(OrderStatus.CREATED, state.activeOrders().get("o-9").status());
        assertEquals(1, state.entryOrders(OrderSide.SELL).size());

        tracker.recordCancelled("o-9");
        assertTrue(tracker.snapshot().activeOrders().isEmpty());
    }

    @Test
    void testFeedEventWinsOverLocalAcknowledgement() {
        tracker.onOrder(order("o-1", OrderStatus.NEW));
        tracker.recordPlaced(OrderCommand.limit(OrderSide.BUY, new BigDecimal("5"), new BigDecimal("1"), "c-1"), "o-1");

        assertEquals(OrderStatus.NEW, tracker.snapshot().activeOrders().get("o-1").status());
    }

    @Test
    void testCancelAllClearsOrders() {
        tracker.onOrder(order("o-1", OrderStatus.NEW));
        tracker.onOrder(order("o-2", OrderStatus.NEW));

        tracker.recordAllCancelled();

        assertTrue(tracker.snapshot().activeOrders().isEmpty());
    }

    @Test
    void testSeedReplacesState() {
        tracker.onOrder(order("stale", OrderStatus.NEW));

        tracker.seed(new BigDecimal("500"),
            new PositionUpdate("BTCUSDT", new BigDecimal("0.03"), new BigDecimal("99")),
            List.of(order("o-1", OrderStatus.NEW), order("o-2", OrderStatus.CANCELLED)));

        AccountState state = tracker.snapshot();
        assertEquals(0, new BigDecimal("500").compareTo(state.walletBalance()));
        assertEquals(PositionSide.LONG, state.positionSide());
        assertEquals(List.of("o-1"), List.copyOf(state.activeOrders().keySet()));
        assertEquals(0, new BigDecimal("0.01").compareTo(state.outstandingEntryQuantity(OrderSide.BUY)));
    }

    @Test
    void testSnapshotIsDetached() {
        AccountState before = tracker.snapshot();
        tracker.onOrder(order("o-1", OrderStatus.NEW));

        assertTrue(before.activeOrders().isEmpty());
        assertThrows(UnsupportedOperationException.class,
            () -> tracker.snapshot().activeOrders().clear());
    }
}
