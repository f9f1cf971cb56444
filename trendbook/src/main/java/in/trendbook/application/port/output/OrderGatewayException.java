package in.trendbook.application.port.output;

/**
 * Exception thrown when a call to the execution venue fails in transport.
 */
public class OrderGatewayException extends RuntimeException {

    private final String operation;
    private final String reference;     // client order id or order id, may be null

    public OrderGatewayException(String operation, String reference, String message) {
        super(String.format("[%s:%s] %s", operation, reference, message));
        this.operation = operation;
        this.reference = reference;
    }

    public OrderGatewayException(String operation, String reference, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", operation, reference, message), cause);
        this.operation = operation;
        this.reference = reference;
    }

    public String getOperation() {
        return operation;
    }

    public String getReference() {
        return reference;
    }
}
