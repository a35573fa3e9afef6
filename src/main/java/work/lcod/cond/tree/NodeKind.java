package work.lcod.cond.tree;

/**
 * Condition node variants. {@link #AND} and {@link #OR} are chain markers placed between real nodes.
 */
public enum NodeKind {
    CHILD("child"),
    TEMPLATE("tmpl"),
    MAP("map"),
    TRUE("true"),
    FALSE("false"),
    RCODE("rcode"),
    AND("&&"),
    OR("||");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isMarker() {
        return this == AND || this == OR;
    }
}
