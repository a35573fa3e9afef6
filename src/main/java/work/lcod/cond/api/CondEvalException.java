package work.lcod.cond.api;

import java.util.Objects;

/**
 * Aborts an evaluation. Carries the failure category and a human-readable message.
 */
public final class CondEvalException extends RuntimeException {
    private final ErrorKind kind;

    public CondEvalException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public CondEvalException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static CondEvalException structural(String message) {
        return new CondEvalException(ErrorKind.STRUCTURAL_VIOLATION, message);
    }

    public ErrorKind kind() {
        return kind;
    }
}
