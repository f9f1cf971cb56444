package in.trendbook.service.execution;

import in.trendbook.application.port.output.OrderGateway;
import in.trendbook.application.port.output.OrderGatewayException;
import in.trendbook.domain.account.OrderRecord;
import in.trendbook.domain.order.CommandResult;
import in.trendbook.domain.order.OrderCommand;
import in.trendbook.domain.order.OrderCommand.CommandType;
import in.trendbook.domain.order.OrderSide;
import in.trendbook.domain.order.OrderStatus;
import in.trendbook.domain.order.OrderType;
import in.trendbook.infrastructure.metrics.EngineMetrics;
import in.trendbook.service.account.AccountStateTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrderCommandExecutorTest {

    @Mock
    private OrderGateway gateway;

    @Mock
    private EngineMetrics metrics;

    private AccountStateTracker tracker;
    private OrderCommandExecutor executor;

    private final OrderCommand buy = OrderCommand.limit(OrderSide.BUY, new BigDecimal("0.01"),
        new BigDecimal("100"), "st-entry-buy-1");

    @BeforeEach
    void setUp() {
        tracker = new AccountStateTracker("BTCUSDT");
        executor = new OrderCommandExecutor(gateway, tracker, metrics);
    }

    @Test
    void testExecutesInListOrder() {
        tracker.onOrder(new OrderRecord("old-1", OrderSide.SELL, new BigDecimal("101"), new BigDecimal("0.01"),
            OrderType.LIMIT, OrderStatus.NEW));
        when(gateway.cancelAllOrders()).thenReturn(1);
        when(gateway.placeOrder(OrderSide.BUY, new BigDecimal("0.01"), new BigDecimal("100"),
            OrderType.LIMIT, "st-entry-buy-1", false)).thenReturn("o-7");

        List<CommandResult> results = executor.execute(List.of(OrderCommand.cancelAll(), buy));

        InOrder inOrder = inOrder(gateway);
        inOrder.verify(gateway).cancelAllOrders();
        inOrder.verify(gateway).placeOrder(any(), any(), any(), any(), anyString(), anyBoolean());

        assertTrue(results.get(0).success());
        assertEquals(1, results.get(0).affected());
        assertEquals("o-7", results.get(1).orderId());
        assertEquals(List.of("o-7"), List.copyOf(tracker.snapshot().activeOrders().keySet()));
        verify(metrics).recordCommand(CommandType.CANCEL_ALL, true);
        verify(metrics).recordCommand(CommandType.PLACE, true);
    }

    @Test
    void testRejectedPlacementIsFailedResult() {
        when(gateway.placeOrder(any(), any(), any(), any(), anyString(), anyBoolean())).thenReturn(null);

        CommandResult result = executor.execute(List.of(buy)).get(0);

        assertFalse(result.success());
        assertEquals("rejected by venue", result.error());
        assertTrue(tracker.snapshot().activeOrders().isEmpty());
        verify(metrics).recordCommand(CommandType.PLACE, false);
    }

    @Test
    void testFailureDoesNotAbortRemainingCommands() {
        when(gateway.cancelOrder("o-1")).thenThrow(new OrderGatewayException("cancelOrder", "o-1", "timeout"));
        when(gateway.placeOrder(any(), any(), any(), any(), anyString(), anyBoolean())).thenReturn("o-2");

        List<CommandResult> results = executor.execute(List.of(OrderCommand.cancel("o-1"), buy));

        assertEquals(2, results.size());
        assertFalse(results.get(0).success());
        assertTrue(results.get(0).error().contains("timeout"));
        assertTrue(results.get(1).success());
        verify(metrics).recordCommand(CommandType.CANCEL, false);
    }

    @Test
    void testUnacknowledgedCancelKeepsOrder() {
        tracker.onOrder(new OrderRecord("o-1", OrderSide.BUY, new BigDecimal("99"), new BigDecimal("0.01"),
            OrderType.LIMIT, OrderStatus.NEW));
        when(gateway.cancelOrder("o-1")).thenReturn(false);

        CommandResult result = executor.execute(List.of(OrderCommand.cancel("o-1"))).get(0);

        assertFalse(result.success());
        assertTrue(tracker.snapshot().activeOrders().containsKey("o-1"));
    }

    @Test
    void testAcknowledgedCancelRemovesOrder() {
        tracker.onOrder(new OrderRecord("o-1", OrderSide.BUY, new BigDecimal("99"), new BigDecimal("0.01"),
            OrderType.LIMIT, OrderStatus.NEW));
        when(gateway.cancelOrder("o-1")).thenReturn(true);

        CommandResult result = executor.execute(List.of(OrderCommand.cancel("o-1"))).get(0);

        assertTrue(result.success());
        assertEquals(1, result.affected());
        assertTrue(tracker.snapshot().activeOrders().isEmpty());
        verify(gateway, never()).cancelAllOrders();
        verify(metrics).recordCommand(eq(CommandType.CANCEL), eq(true));
    }

    @Test
    void testEmptyCommandListDoesNothing() {
        assertTrue(executor.execute(List.of()).isEmpty());
        verifyNoInteractions(gateway, metrics);
    }
}
