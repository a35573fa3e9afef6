package work.lcod.cond.regex;

/**
 * Pattern compilation or execution failure. A plain "no match" is never reported through this exception.
 */
public final class RegexException extends Exception {
    private final int offset;

    public RegexException(String message) {
        this(message, -1, null);
    }

    public RegexException(String message, int offset, Throwable cause) {
        super(message, cause);
        this.offset = offset;
    }

    /**
     * Offset into the pattern where compilation failed, or -1.
     */
    public int offset() {
        return offset;
    }
}
