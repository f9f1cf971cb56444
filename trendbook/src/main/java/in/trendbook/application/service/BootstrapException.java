package in.trendbook.application.service;

/**
 * Startup account fetch failed after all retries. The session must not start trading.
 */
public class BootstrapException extends RuntimeException {

    private final String step;

    public BootstrapException(String step, String message, Throwable cause) {
        super(String.format("Bootstrap step '%s' failed: %s", step, message), cause);
        this.step = step;
    }

    public String getStep() {
        return step;
    }
}
