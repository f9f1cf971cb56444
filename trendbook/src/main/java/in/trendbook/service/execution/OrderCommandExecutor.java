package in.trendbook.service.execution;

import in.trendbook.application.port.output.OrderGateway;
import in.trendbook.domain.order.CommandResult;
import in.trendbook.domain.order.OrderCommand;
import in.trendbook.infrastructure.metrics.EngineMetrics;
import in.trendbook.service.account.AccountStateTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Executes strategy commands in order against the gateway.
 *
 * A failed command is logged and reported as a failed {@link CommandResult}; it never
 * aborts the remaining commands or the decision loop. Acknowledged commands are applied
 * to the local account view straight away.
 */
public final class OrderCommandExecutor {
    private static final Logger log = LoggerFactory.getLogger(OrderCommandExecutor.class);

    private final OrderGateway gateway;
    private final AccountStateTracker account;
    private final EngineMetrics metrics;

    public OrderCommandExecutor(OrderGateway gateway, AccountStateTracker account, EngineMetrics metrics) {
        this.gateway = gateway;
        this.account = account;
        this.metrics = metrics;
    }

    public List<CommandResult> execute(List<OrderCommand> commands) {
        List<CommandResult> results = new ArrayList<>(commands.size());
        for (OrderCommand command : commands) {
            CommandResult result = executeOne(command);
            metrics.recordCommand(command.type(), result.success());
            results.add(result);
        }
        return results;
    }

    private CommandResult executeOne(OrderCommand command) {
        try {
            switch (command.type()) {
                case PLACE -> {
                    String orderId = gateway.placeOrder(command.side(), command.quantity(), command.price(),
                        command.orderType(), command.clientOrderId(), command.reduceOnly());
                    if (orderId == null) {
                        log.warn("❌ Venue rejected {}", command);
                        return CommandResult.failed(command, "rejected by venue");
                    }
                    account.recordPlaced(command, orderId);
                    log.info("✅ {} -> {}", command, orderId);
                    return CommandResult.placed(command, orderId);
                }
                case CANCEL -> {
                    boolean cancelled = gateway.cancelOrder(command.orderId());
                    if (!cancelled) {
                        log.warn("Cancel not acknowledged for {}", command.orderId());
                        return CommandResult.failed(command, "cancel not acknowledged");
                    }
                    account.recordCancelled(command.orderId());
                    log.info("✅ {}", command);
                    return CommandResult.cancelled(command, 1);
                }
                case CANCEL_ALL -> {
                    int count = gateway.cancelAllOrders();
                    account.recordAllCancelled();
                    log.info("✅ CANCEL_ALL cancelled {} orders", count);
                    return CommandResult.cancelled(command, count);
                }
                default -> throw new IllegalStateException("Unhandled command type: " + command.type());
            }
        } catch (RuntimeException e) {
            log.error("❌ Command failed {}: {}", command, e.getMessage());
            return CommandResult.failed(command, e.getMessage());
        }
    }
}
