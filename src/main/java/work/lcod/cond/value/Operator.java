package work.lcod.cond.value;

import java.util.Map;

/**
 * Comparison operators allowed in a condition map.
 */
public enum Operator {
    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    REG_EQ("=~");

    private static final Map<String, Operator> BY_TOKEN = Map.of(
        "==", EQ,
        "!=", NE,
        "<", LT,
        "<=", LE,
        ">", GT,
        ">=", GE,
        "=~", REG_EQ
    );

    private final String token;

    Operator(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public boolean isOrdering() {
        return this == LT || this == LE || this == GT || this == GE;
    }

    public static Operator fromToken(String token) {
        var op = token == null ? null : BY_TOKEN.get(token.trim());
        if (op == null) {
            throw new IllegalArgumentException("Unsupported operator: " + token);
        }
        return op;
    }

    /**
     * Applies this operator to the sign of a three-way comparison.
     */
    public boolean test(int cmp) {
        return switch (this) {
            case EQ -> cmp == 0;
            case NE -> cmp != 0;
            case LT -> cmp < 0;
            case LE -> cmp <= 0;
            case GT -> cmp > 0;
            case GE -> cmp >= 0;
            case REG_EQ -> throw new IllegalStateException("=~ has no three-way form");
        };
    }

    @Override
    public String toString() {
        return token;
    }
}
