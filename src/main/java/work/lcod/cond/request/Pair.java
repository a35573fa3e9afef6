package work.lcod.cond.request;

import java.util.Objects;
import work.lcod.cond.dict.AttributeDef;
import work.lcod.cond.value.Operator;
import work.lcod.cond.value.TypedValue;

/**
 * Attribute instance: definition, value of the attribute's type and, for check pairs, the operator to apply.
 */
public record Pair(AttributeDef def, TypedValue value, Operator op) {
    public Pair {
        Objects.requireNonNull(def, "def");
        Objects.requireNonNull(value, "value");
        if (value.type() != def.type()) {
            throw new IllegalArgumentException(
                "Value of type " + value.type() + " does not fit attribute " + def.name() + " (" + def.type() + ")");
        }
    }

    public static Pair of(AttributeDef def, TypedValue value) {
        return new Pair(def, value, null);
    }

    public Operator opOrDefault() {
        return op == null ? Operator.EQ : op;
    }

    @Override
    public String toString() {
        return def.name() + " " + opOrDefault().token() + " " + value.print();
    }
}
