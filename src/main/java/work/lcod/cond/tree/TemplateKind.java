package work.lcod.cond.tree;

/**
 * Value sources a {@link Template} can refer to.
 */
public enum TemplateKind {
    ATTRIBUTE("attr"),
    LIST("list"),
    EXEC("exec"),
    XLAT("xlat"),
    REGEX("regex"),
    REGEX_XLAT("regex-xlat"),
    DATA("data"),
    UNRESOLVED("unresolved");

    private final String label;

    TemplateKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
