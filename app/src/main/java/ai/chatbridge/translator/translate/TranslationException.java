package ai.chatbridge.translator.translate;

/**
 * Runtime exception used to propagate translation pipeline failures.
 */
public class TranslationException extends RuntimeException {

    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
