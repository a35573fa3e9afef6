package work.lcod.cond.runtime;

import java.util.ArrayList;
import java.util.logging.Logger;
import work.lcod.cond.api.CondEvalException;
import work.lcod.cond.api.ErrorKind;
import work.lcod.cond.paircmp.PairCompareException;
import work.lcod.cond.regex.CompiledRegex;
import work.lcod.cond.regex.RegexException;
import work.lcod.cond.regex.RegexMatch;
import work.lcod.cond.request.ListKind;
import work.lcod.cond.request.Pair;
import work.lcod.cond.request.PairList;
import work.lcod.cond.tree.ConditionNode;
import work.lcod.cond.tree.Fixup;
import work.lcod.cond.tree.TemplateKind;
import work.lcod.cond.value.CastException;
import work.lcod.cond.value.DataType;
import work.lcod.cond.value.Operator;
import work.lcod.cond.value.TypedValue;

/**
 * Applies a map's operator to normalized operands: regex match, legacy pair comparison or typed comparison.
 */
final class ConditionComparator {
    private static final Logger LOG = Logger.getLogger(ConditionComparator.class.getName());

    /**
     * @param rhs right operand, or null when the right template is a precompiled regex
     */
    boolean compare(EvalContext ctx, ConditionNode node, TypedValue lhs, TypedValue rhs) {
        var map = node.map();
        boolean result;
        if (map.op() == Operator.REG_EQ) {
            result = regex(ctx, node, lhs, rhs);
        } else if (node.fixup() == Fixup.PAIR_COMPARE) {
            result = pairCompare(ctx, node, rhs);
        } else {
            if (lhs == null || rhs == null) {
                throw CondEvalException.structural("Missing operand for " + map);
            }
            try {
                result = ctx.configuration().valueOps().applyOperator(map.op(), lhs, rhs);
            } catch (CastException ex) {
                throw new CondEvalException(ErrorKind.UNDEFINED_OPERATOR,
                    "Cannot apply " + map.op().token() + " to " + lhs.type() + " and " + rhs.type() + ": " + ex.getMessage(), ex);
            }
        }
        LOG.finer(() -> "cmp " + lhs + " " + map.op().token() + " " + (rhs == null ? map.rhs() : rhs) + " -> " + result);
        return result;
    }

    private boolean regex(EvalContext ctx, ConditionNode node, TypedValue lhs, TypedValue rhs) {
        var map = node.map();
        var engine = ctx.configuration().regexEngine();
        CompiledRegex pattern;
        if (map.rhs().kind() == TemplateKind.REGEX) {
            pattern = map.rhs().regex();
        } else {
            if (rhs == null || rhs.type() != DataType.STRING) {
                throw CondEvalException.structural("Regex pattern for " + map + " is not a string");
            }
            try {
                pattern = engine.compile(rhs.stringValue(), map.rhs().regexFlags());
            } catch (RegexException ex) {
                throw new CondEvalException(ErrorKind.REGEX_COMPILE_FAILURE, ex.getMessage()
                    + (ex.offset() >= 0 ? " (at offset " + ex.offset() + ")" : ""), ex);
            }
        }
        if (lhs == null || lhs.type() != DataType.STRING) {
            throw new CondEvalException(ErrorKind.REGEX_EXEC_FAILURE,
                "Regex subject must be a string, got " + (lhs == null ? "nothing" : lhs.type()));
        }
        int slots = engine.subcaptureCount(pattern);
        if (slots == 0) {
            slots = ctx.configuration().maxRegexCaptures() + 1;
        }
        RegexMatch match;
        try {
            match = engine.exec(pattern, lhs.stringValue());
        } catch (RegexException ex) {
            throw new CondEvalException(ErrorKind.REGEX_EXEC_FAILURE, ex.getMessage(), ex);
        }
        var captures = ctx.request().captures();
        if (match == null) {
            captures.clear();
            return false;
        }
        var published = new ArrayList<String>(slots);
        for (int i = 0; i < slots; i++) {
            published.add(match.group(i));
        }
        captures.publish(published);
        LOG.finer(() -> "regex captures " + published);
        return true;
    }

    private boolean pairCompare(EvalContext ctx, ConditionNode node, TypedValue rhs) {
        var map = node.map();
        var def = map.lhs().attribute();
        if (rhs == null) {
            throw CondEvalException.structural("Pair comparison " + map + " has no value to compare");
        }
        var value = ctx.own(ctx.cast(rhs, def.type(), def).copy());
        var check = PairList.singleton(new Pair(def, value, map.op()));
        var request = ctx.request();
        int rcode;
        try {
            rcode = ctx.configuration().pairComparator().compare(request, request.list(ListKind.REQUEST), check);
        } catch (PairCompareException ex) {
            throw new CondEvalException(ErrorKind.LEGACY_COMPARATOR_FAILURE,
                "Pair comparison on " + def.name() + " failed: " + ex.getMessage(), ex);
        }
        return rcode == 0;
    }
}
