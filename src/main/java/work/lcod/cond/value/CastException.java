package work.lcod.cond.value;

/**
 * Raised by {@link ValueOps} when a value cannot be converted or compared.
 */
public final class CastException extends Exception {
    public CastException(String message) {
        super(message);
    }

    public CastException(String message, Throwable cause) {
        super(message, cause);
    }
}
