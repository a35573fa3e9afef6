package work.lcod.cond.runtime;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import work.lcod.cond.api.CondEvalException;
import work.lcod.cond.tree.Comparison;
import work.lcod.cond.tree.ConditionNode;
import work.lcod.cond.tree.ConditionPrinter;
import work.lcod.cond.tree.Fixup;
import work.lcod.cond.tree.NodeKind;
import work.lcod.cond.tree.Template;
import work.lcod.cond.value.DataType;
import work.lcod.cond.value.Operator;
import work.lcod.cond.value.TypedValue;

/**
 * Evaluates a condition tree without recursion. Nested chains are entered through their {@code CHILD} node and
 * left through the parent links; {@code &&} and {@code ||} short-circuit by climbing to the parent early.
 */
public final class ConditionWalker {
    private static final Logger LOG = Logger.getLogger(ConditionWalker.class.getName());

    private final EvalContext ctx;
    private final TemplateRealizer realizer = new TemplateRealizer();
    private final ConditionComparator comparator = new ConditionComparator();
    private final TypeNormalizer normalizer = new TypeNormalizer(comparator);
    private int depth;
    private int steps;

    public ConditionWalker(EvalContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    /**
     * Number of nodes visited so far.
     */
    public int steps() {
        return steps;
    }

    /**
     * @throws CondEvalException on the first failure; nothing after the failing node is evaluated
     */
    public boolean walk(ConditionNode root) {
        Objects.requireNonNull(root, "root");
        var current = root;
        boolean result;
        while (true) {
            steps++;
            if (current.kind() == NodeKind.CHILD) {
                if (current.child() == null) {
                    throw CondEvalException.structural("Group without a child chain");
                }
                depth++;
                current = current.child();
                continue;
            }
            result = evaluate(current) ^ current.negate();
            trace(current, result);

            var successor = successor(current, result);
            while (successor == null) {
                current = current.parent();
                if (current == null) {
                    return result;
                }
                depth--;
                if (depth < 0) {
                    throw CondEvalException.structural("Condition tree depth went negative");
                }
                result ^= current.negate();
                trace(current, result);
                successor = successor(current, result);
            }
            current = successor;
        }
    }

    private static ConditionNode successor(ConditionNode node, boolean result) {
        var next = node.next();
        if (next == null) {
            return null;
        }
        return switch (next.kind()) {
            case AND -> result ? follower(next) : null;
            case OR -> result ? null : follower(next);
            case CHILD, TEMPLATE, MAP, TRUE, FALSE, RCODE -> next;
        };
    }

    private static ConditionNode follower(ConditionNode marker) {
        if (marker.next() == null) {
            throw CondEvalException.structural("Dangling " + marker.kind().label() + " at the end of a chain");
        }
        return marker.next();
    }

    private boolean evaluate(ConditionNode node) {
        return switch (node.kind()) {
            case TEMPLATE -> evaluateTemplate(node.template());
            case RCODE -> node.rcode() == ctx.priorResult();
            case MAP -> evaluateMap(node);
            case TRUE -> true;
            case FALSE -> false;
            case CHILD, AND, OR -> throw CondEvalException.structural(
                "Node " + node.kind().label() + " cannot be evaluated on its own");
        };
    }

    private boolean evaluateTemplate(Template template) {
        return switch (template.kind()) {
            case ATTRIBUTE, LIST -> !ctx.request().cursor(template).isEmpty();
            case EXEC, XLAT -> {
                ctx.beginComparison();
                try {
                    yield !ctx.expand(template).isEmpty();
                } finally {
                    ctx.endComparison();
                }
            }
            case REGEX, REGEX_XLAT, DATA, UNRESOLVED -> throw CondEvalException.structural(
                "Template " + template + " cannot be used as a bare condition");
        };
    }

    private boolean evaluateMap(ConditionNode node) {
        var map = node.map();
        ctx.beginComparison();
        try {
            var left = realizer.realize(ctx, map.lhs(), map.rhs());
            var right = realizer.realize(ctx, map.rhs(), map.lhs());
            if (!left.isDeferred() && !right.isDeferred()) {
                return compareRealized(node, left.value(), right.value());
            }
            return iterate(node);
        } finally {
            ctx.endComparison();
        }
    }

    private boolean compareRealized(ConditionNode node, TypedValue lhs, TypedValue rhs) {
        var map = node.map();
        var target = realizedType(map, lhs, rhs);
        if (target != null) {
            lhs = ctx.cast(lhs, target, null);
            rhs = ctx.cast(rhs, target, null);
        }
        return comparator.compare(ctx, node, lhs, rhs);
    }

    /**
     * Type both realized operands are brought to, or null when they can be compared as they are.
     */
    static DataType realizedType(Comparison map, TypedValue lhs, TypedValue rhs) {
        if (map.op() == Operator.REG_EQ) {
            return DataType.STRING;
        }
        if (!map.lhs().hasCast() && !map.rhs().hasCast()
            && TypeNormalizer.isNumericString(lhs) && TypeNormalizer.isNumericString(rhs)) {
            return DataType.INT64;
        }
        if (lhs.type() == rhs.type()) {
            return null;
        }
        if (map.lhs().hasCast()) {
            return map.lhs().cast();
        }
        return map.rhs().hasCast() ? map.rhs().cast() : lhs.type();
    }

    private boolean iterate(ConditionNode node) {
        var map = node.map();
        var lhs = map.lhs();
        return switch (lhs.kind()) {
            case ATTRIBUTE, LIST -> {
                if (node.fixup() == Fixup.PAIR_COMPARE && map.op() != Operator.REG_EQ) {
                    yield normalizer.normalizeAndCompare(ctx, node, null);
                }
                for (var pair : ctx.request().cursor(lhs)) {
                    ctx.pushScope();
                    try {
                        if (normalizer.normalizeAndCompare(ctx, node, pair.value())) {
                            yield true;
                        }
                    } finally {
                        ctx.popScope();
                    }
                }
                yield false;
            }
            case DATA -> normalizer.normalizeAndCompare(ctx, node, lhs.data());
            case EXEC, XLAT -> normalizer.normalizeAndCompare(ctx, node,
                ctx.own(TypedValue.owned(DataType.STRING, ctx.expand(lhs))));
            case REGEX, REGEX_XLAT, UNRESOLVED -> throw CondEvalException.structural(
                "Unsupported left operand in " + map);
        };
    }

    private void trace(ConditionNode node, boolean result) {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("  ".repeat(depth) + "[" + node.kind().label() + "] " + ConditionPrinter.printNode(node) + " -> " + result);
        }
    }
}
