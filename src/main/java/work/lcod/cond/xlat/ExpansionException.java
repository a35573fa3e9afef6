package work.lcod.cond.xlat;

/**
 * Expansion of a template failed (bad format, unknown reference, failed sub-process).
 */
public final class ExpansionException extends Exception {
    public ExpansionException(String message) {
        super(message);
    }

    public ExpansionException(String message, Throwable cause) {
        super(message, cause);
    }
}
