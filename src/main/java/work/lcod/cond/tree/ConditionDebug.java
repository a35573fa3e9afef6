package work.lcod.cond.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Structured dump of a condition chain, one attribute per line.
 */
public final class ConditionDebug {
    private static final Logger LOG = Logger.getLogger(ConditionDebug.class.getName());

    private ConditionDebug() {}

    public static List<String> dump(ConditionNode head) {
        var lines = new ArrayList<String>();
        dump(lines, head);
        return lines;
    }

    public static void log(ConditionNode head) {
        for (var line : dump(head)) {
            LOG.info(line);
        }
    }

    private static void dump(List<String> lines, ConditionNode head) {
        for (var node = head; node != null; node = node.next()) {
            lines.add("cond " + node.kind().label());
            lines.add("\tnegate : " + node.negate());
            lines.add("\tfixup  : " + node.fixup().label());
            switch (node.kind()) {
                case MAP -> {
                    lines.add("lhs (");
                    template(lines, node.map().lhs());
                    lines.add(")");
                    lines.add("\top     : " + node.map().op().token());
                    lines.add("rhs (");
                    template(lines, node.map().rhs());
                    lines.add(")");
                }
                case RCODE -> lines.add("\trcode  : " + node.rcode().label());
                case TEMPLATE -> template(lines, node.template());
                case CHILD -> {
                    lines.add("child (");
                    dump(lines, node.child());
                    lines.add(")");
                }
                case TRUE, FALSE, AND, OR -> {
                }
            }
        }
    }

    private static void template(List<String> lines, Template template) {
        lines.add("\ttmpl   : " + template);
        lines.add("\ttype   : " + template.kind().label());
        if (template.hasCast()) {
            lines.add("\tcast   : " + template.cast().label());
        }
        switch (template.kind()) {
            case ATTRIBUTE -> {
                lines.add("\tlist   : " + template.list().label());
                lines.add("\tattr   : " + template.attribute().name() + " (" + template.attribute().type().label()
                    + (template.attribute().virtual() ? ", virtual" : "") + ")");
            }
            case LIST -> lines.add("\tlist   : " + template.list().label());
            case DATA -> lines.add("\tvalue  : " + template.data());
            case REGEX, REGEX_XLAT -> lines.add("\tflags  : " + template.regexFlags());
            case EXEC, XLAT, UNRESOLVED -> {
            }
        }
    }
}
