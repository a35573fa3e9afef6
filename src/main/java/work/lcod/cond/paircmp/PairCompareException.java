package work.lcod.cond.paircmp;

/**
 * Raised when a legacy pair comparison cannot be carried out, as opposed to a plain mismatch.
 */
public final class PairCompareException extends Exception {
    public PairCompareException(String message) {
        super(message);
    }

    public PairCompareException(String message, Throwable cause) {
        super(message, cause);
    }
}
