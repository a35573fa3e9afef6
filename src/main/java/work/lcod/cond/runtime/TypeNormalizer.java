package work.lcod.cond.runtime;

import java.math.BigInteger;
import java.util.logging.Logger;
import work.lcod.cond.api.CondEvalException;
import work.lcod.cond.dict.AttributeDef;
import work.lcod.cond.tree.Comparison;
import work.lcod.cond.tree.ConditionNode;
import work.lcod.cond.tree.Fixup;
import work.lcod.cond.value.DataType;
import work.lcod.cond.value.Operator;
import work.lcod.cond.value.TypedValue;

/**
 * Picks the comparison type of a map, coerces both operands to it and hands them to the comparator.
 */
final class TypeNormalizer {
    private static final Logger LOG = Logger.getLogger(TypeNormalizer.class.getName());

    private final ConditionComparator comparator;

    TypeNormalizer(ConditionComparator comparator) {
        this.comparator = comparator;
    }

    /**
     * Compares one candidate left value against the right side of the map.
     *
     * @param lhs left value, or null for pair comparisons where the legacy comparator looks at the request itself
     */
    boolean normalizeAndCompare(EvalContext ctx, ConditionNode node, TypedValue lhs) {
        var map = node.map();
        var castType = selectCastType(map, node.fixup());
        var context = castContext(map);
        LOG.finer(() -> "normalise " + map + " as " + (castType == null ? "<none>" : castType.label()));
        var rhs = map.rhs();
        return switch (rhs.kind()) {
            case ATTRIBUTE -> {
                for (var pair : ctx.request().cursor(rhs)) {
                    ctx.pushScope();
                    try {
                        if (compareOnce(ctx, node, castType, context, lhs, pair.value())) {
                            yield true;
                        }
                    } finally {
                        ctx.popScope();
                    }
                }
                yield false;
            }
            case DATA -> compareOnce(ctx, node, castType, context, lhs, rhs.data());
            case EXEC, XLAT, REGEX_XLAT -> {
                var expanded = ctx.own(TypedValue.owned(DataType.STRING, ctx.expand(rhs)));
                yield compareOnce(ctx, node, castType, context, lhs, expanded);
            }
            case REGEX -> comparator.compare(ctx, node, coerce(ctx, castType, context, lhs), null);
            case LIST, UNRESOLVED -> throw CondEvalException.structural("Unsupported right operand in " + map);
        };
    }

    private boolean compareOnce(
        EvalContext ctx,
        ConditionNode node,
        DataType castType,
        AttributeDef context,
        TypedValue lhs,
        TypedValue rhs
    ) {
        var type = castType;
        if (type == null && lhs != null && isNumericString(lhs) && isNumericString(rhs)) {
            type = DataType.INT64;
            LOG.finer("operands are numeric strings, comparing as int64");
        }
        var left = coerce(ctx, type, context, lhs);
        var right = coerce(ctx, type, context, rhs);
        return comparator.compare(ctx, node, left, right);
    }

    private static TypedValue coerce(EvalContext ctx, DataType type, AttributeDef context, TypedValue value) {
        if (type == null || value == null) {
            return value;
        }
        return ctx.cast(value, type, context);
    }

    /**
     * First applicable of: regex match, pair comparison, left cast, left attribute, right attribute, left literal,
     * right literal. Null when nothing forces a type.
     */
    static DataType selectCastType(Comparison map, Fixup fixup) {
        if (map.op() == Operator.REG_EQ) {
            return DataType.STRING;
        }
        if (fixup == Fixup.PAIR_COMPARE) {
            if (!map.lhs().isAttribute()) {
                throw CondEvalException.structural("Pair comparison without an attribute on the left: " + map);
            }
            return map.lhs().attribute().type();
        }
        if (map.lhs().hasCast()) {
            return map.lhs().cast();
        }
        if (map.lhs().isAttribute()) {
            return map.lhs().attribute().type();
        }
        if (map.rhs().isAttribute()) {
            return map.rhs().attribute().type();
        }
        if (map.lhs().isData()) {
            return map.lhs().data().type();
        }
        if (map.rhs().isData()) {
            return map.rhs().data().type();
        }
        return null;
    }

    static boolean isNumericString(TypedValue value) {
        return value.type() == DataType.STRING && allDigits(value.stringValue()) && fitsInt64(value.stringValue());
    }

    /**
     * True when a string accepted by {@link #allDigits} parses as a signed 64-bit integer.
     */
    static boolean fitsInt64(String text) {
        return new BigInteger(text).bitLength() < Long.SIZE;
    }

    /**
     * True for an optional leading {@code -} followed by one or more decimal digits.
     */
    static boolean allDigits(String text) {
        int start = text.startsWith("-") ? 1 : 0;
        if (start == text.length()) {
            return false;
        }
        for (int i = start; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch < '0' || ch > '9') {
                return false;
            }
        }
        return true;
    }

    private static AttributeDef castContext(Comparison map) {
        if (map.lhs().isAttribute()) {
            return map.lhs().attribute();
        }
        return map.rhs().isAttribute() ? map.rhs().attribute() : null;
    }
}
