package clipqueue.coordinator.exceptions;

/**
 * Transport or protocol failure talking to the processing backend.
 */
public class BackendException extends RuntimeException {
    private final int statusCode;

    public BackendException(String message) {
        this(message, -1);
    }

    public BackendException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status of the failed exchange, or -1 when no response was received. */
    public int statusCode() {
        return statusCode;
    }
}
