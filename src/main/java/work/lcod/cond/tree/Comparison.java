package work.lcod.cond.tree;

import java.util.Objects;
import work.lcod.cond.value.Operator;

/**
 * One comparison: left template, operator, right template.
 */
public record Comparison(Template lhs, Operator op, Template rhs) {
    public Comparison {
        Objects.requireNonNull(lhs, "lhs");
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(rhs, "rhs");
    }

    @Override
    public String toString() {
        return lhs + " " + op.token() + " " + rhs;
    }
}
