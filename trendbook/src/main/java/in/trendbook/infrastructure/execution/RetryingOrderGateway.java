package in.trendbook.infrastructure.execution;

import in.trendbook.application.port.output.OrderGateway;
import in.trendbook.domain.order.OrderSide;
import in.trendbook.domain.order.OrderType;
import in.trendbook.infrastructure.metrics.EngineMetrics;

import java.math.BigDecimal;

/**
 * Decorator adding bounded retry to every gateway call.
 *
 * A retried placement reuses the same client order id, so the venue deduplicates it.
 * Exhaustion propagates as {@link RetryExhaustedException}.
 */
public final class RetryingOrderGateway implements OrderGateway {

    private final OrderGateway delegate;
    private final RetryPolicy policy;
    private final EngineMetrics metrics;

    public RetryingOrderGateway(OrderGateway delegate, RetryPolicy policy, EngineMetrics metrics) {
        this.delegate = delegate;
        this.policy = policy;
        this.metrics = metrics;
    }

    @Override
    public String placeOrder(OrderSide side, BigDecimal quantity, BigDecimal price, OrderType type,
                             String clientOrderId, boolean reduceOnly) {
        return policy.execute("placeOrder",
            () -> delegate.placeOrder(side, quantity, price, type, clientOrderId, reduceOnly),
            (attempt, cause) -> metrics.recordRetry("placeOrder", attempt));
    }

    @Override
    public boolean cancelOrder(String orderId) {
        return policy.execute("cancelOrder",
            () -> delegate.cancelOrder(orderId),
            (attempt, cause) -> metrics.recordRetry("cancelOrder", attempt));
    }

    @Override
    public int cancelAllOrders() {
        return policy.execute("cancelAllOrders",
            delegate::cancelAllOrders,
            (attempt, cause) -> metrics.recordRetry("cancelAllOrders", attempt));
    }
}
