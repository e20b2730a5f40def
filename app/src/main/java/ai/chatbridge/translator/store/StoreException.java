package ai.chatbridge.translator.store;

/**
 * Raised when persisted bot data cannot be read, parsed or written.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
