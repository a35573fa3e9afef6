package work.lcod.cond.tree;

/**
 * Resolver annotation recorded on a node when the condition was built.
 */
public enum Fixup {
    NONE("none"),
    ATTR("attr"),
    TYPE("type"),
    PAIR_COMPARE("paircompare");

    private final String label;

    Fixup(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
