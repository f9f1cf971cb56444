package in.trendbook.domain.order;

/**
 * Outcome of executing one {@link OrderCommand}.
 *
 * @param command   the command that was executed
 * @param success   whether the collaborator acknowledged it
 * @param orderId   exchange order id for PLACE, null otherwise
 * @param affected  orders cancelled (CANCEL / CANCEL_ALL)
 * @param error     failure reason, null on success
 */
public record CommandResult(
    OrderCommand command,
    boolean success,
    String orderId,
    int affected,
    String error
) {
    public static CommandResult placed(OrderCommand command, String orderId) {
        return new CommandResult(command, true, orderId, 0, null);
    }

    public static CommandResult cancelled(OrderCommand command, int affected) {
        return new CommandResult(command, true, null, affected, null);
    }

    public static CommandResult failed(OrderCommand command, String error) {
        return new CommandResult(command, false, null, 0, error);
    }
}
