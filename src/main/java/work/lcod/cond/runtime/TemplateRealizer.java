package work.lcod.cond.runtime;

import java.util.logging.Logger;
import work.lcod.cond.api.CondEvalException;
import work.lcod.cond.dict.AttributeDef;
import work.lcod.cond.tree.Template;
import work.lcod.cond.tree.TemplateKind;
import work.lcod.cond.value.DataType;
import work.lcod.cond.value.TypedValue;

/**
 * Turns a template into a concrete value, or reports that it must be iterated over.
 */
final class TemplateRealizer {
    private static final Logger LOG = Logger.getLogger(TemplateRealizer.class.getName());

    Realized realize(EvalContext ctx, Template template, Template sibling) {
        return switch (template.kind()) {
            case ATTRIBUTE, LIST, REGEX -> Realized.DEFERRED;
            case DATA -> {
                var literal = template.data();
                if (template.hasCast() && template.cast() != literal.type()) {
                    throw CondEvalException.structural(
                        "Literal " + template + " still carries an unapplied cast to " + template.cast());
                }
                yield new Realized(literal, false);
            }
            case EXEC, XLAT, REGEX_XLAT -> expandAndCast(ctx, template, sibling);
            case UNRESOLVED -> throw CondEvalException.structural("Unresolved template reached evaluation: " + template);
        };
    }

    private Realized expandAndCast(EvalContext ctx, Template template, Template sibling) {
        var expanded = ctx.own(TypedValue.owned(DataType.STRING, ctx.expand(template)));
        AttributeDef context = sibling != null && sibling.isAttribute() ? sibling.attribute() : null;
        var target = targetType(template, sibling);
        LOG.finer(() -> "realize " + template + " as " + target);
        return new Realized(ctx.cast(expanded, target, context), true);
    }

    /**
     * Own cast, then the sibling's cast, the sibling attribute's type, the sibling literal's type, else string.
     * Dynamic patterns are always strings.
     */
    static DataType targetType(Template template, Template sibling) {
        if (template.kind() == TemplateKind.REGEX_XLAT) {
            return DataType.STRING;
        }
        if (template.hasCast()) {
            return template.cast();
        }
        if (sibling == null) {
            return DataType.STRING;
        }
        if (sibling.hasCast()) {
            return sibling.cast();
        }
        if (sibling.isAttribute()) {
            return sibling.attribute().type();
        }
        if (sibling.isData()) {
            return sibling.data().type();
        }
        return DataType.STRING;
    }
}
