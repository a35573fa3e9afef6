package work.lcod.cond.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Verdict of one evaluation, with the failure details when the verdict is {@link Verdict#ERROR}.
 */
public record MatchResult(Verdict verdict, ErrorKind errorKind, String message, int steps) {
    public MatchResult {
        Objects.requireNonNull(verdict, "verdict");
        if (verdict == Verdict.ERROR && errorKind == null) {
            throw new IllegalArgumentException("Failed results need an error kind");
        }
    }

    public static MatchResult match(int steps) {
        return new MatchResult(Verdict.TRUE, null, null, steps);
    }

    public static MatchResult noMatch(int steps) {
        return new MatchResult(Verdict.FALSE, null, null, steps);
    }

    public static MatchResult of(boolean matched, int steps) {
        return matched ? match(steps) : noMatch(steps);
    }

    public static MatchResult failure(ErrorKind kind, String message, int steps) {
        return new MatchResult(Verdict.ERROR, kind, message, steps);
    }

    /**
     * Reserved for callers that report a missing attribute; the evaluator never produces it.
     */
    public static MatchResult notFound() {
        return new MatchResult(Verdict.NOT_FOUND, null, null, 0);
    }

    public boolean matched() {
        return verdict == Verdict.TRUE;
    }

    public boolean failed() {
        return verdict == Verdict.ERROR;
    }

    /**
     * Integer encoding: 1 match, 0 no match, -1 failure, -2 not found.
     */
    public int code() {
        return verdict.code();
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("verdict", verdict.name().toLowerCase());
        serializable.put("code", verdict.code());
        if (errorKind != null) {
            serializable.put("errorKind", errorKind.name());
        }
        if (message != null) {
            serializable.put("error", message);
        }
        serializable.put("steps", steps);
        return serializable;
    }

    public enum Verdict {
        TRUE(1, 0),
        FALSE(0, 1),
        ERROR(-1, 2),
        NOT_FOUND(-2, 1);

        private final int code;
        private final int exitCode;

        Verdict(int code, int exitCode) {
            this.code = code;
            this.exitCode = exitCode;
        }

        public int code() {
            return code;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
