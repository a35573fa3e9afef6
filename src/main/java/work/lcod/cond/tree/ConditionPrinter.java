package work.lcod.cond.tree;

/**
 * Renders a condition chain on one line, e.g. {@code &User-Name == "bob" && !(&Service-Type == 2)}.
 */
public final class ConditionPrinter {
    private ConditionPrinter() {}

    public static String print(ConditionNode head) {
        var out = new StringBuilder();
        append(out, head);
        return out.toString();
    }

    /**
     * Renders {@code node} alone, without the entries that follow it in its chain.
     */
    public static String printNode(ConditionNode node) {
        var out = new StringBuilder();
        appendNode(out, node);
        return out.toString();
    }

    private static void append(StringBuilder out, ConditionNode head) {
        for (var node = head; node != null; node = node.next()) {
            appendNode(out, node);
        }
    }

    private static void appendNode(StringBuilder out, ConditionNode node) {
        switch (node.kind()) {
            case AND -> out.append(" && ");
            case OR -> out.append(" || ");
            case CHILD -> {
                out.append(node.negate() ? "!(" : "(");
                append(out, node.child());
                out.append(')');
            }
            case MAP -> {
                if (node.negate()) {
                    out.append("!(").append(node.map()).append(')');
                } else {
                    out.append(node.map());
                }
            }
            case TEMPLATE -> out.append(node.negate() ? "!" : "").append(node.template());
            case RCODE -> out.append(node.negate() ? "!" : "").append(node.rcode().label());
            case TRUE, FALSE -> out.append(node.negate() ? "!" : "").append(node.kind().label());
        }
    }
}
