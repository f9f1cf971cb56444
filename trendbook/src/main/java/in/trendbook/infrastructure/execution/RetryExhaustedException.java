package in.trendbook.infrastructure.execution;

/**
 * Every attempt of a retried operation failed.
 */
public class RetryExhaustedException extends RuntimeException {

    private final String operation;
    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastFailure) {
        super(String.format("[%s] failed after %d attempt(s): %s", operation, attempts,
            lastFailure == null ? "unknown" : lastFailure.getMessage()), lastFailure);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }
}
