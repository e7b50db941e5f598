package pmxt.apigen;

/**
 * A generation run cannot produce correct artifacts. Nothing has been written when this is thrown.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
