package in.trendbook.infrastructure.bybit;

/**
 * Inbound message could not be parsed into a domain event.
 */
public class MalformedMessageException extends RuntimeException {

    private final String source;

    public MalformedMessageException(String source, String message) {
        super("[" + source + "] " + message);
        this.source = source;
    }

    public MalformedMessageException(String source, String message, Throwable cause) {
        super("[" + source + "] " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
