package gcra.core.model;

/**
 * Thrown when a {@link Quota} is built from a burst or period it cannot honour.
 * A configuration bug: never retry.
 */
public class InvalidQuotaException extends IllegalArgumentException {

    public InvalidQuotaException(String message) {
        super(message);
    }

    public InvalidQuotaException(String message, Throwable cause) {
        super(message, cause);
    }
}
