package work.lcod.cond.tree;

import java.util.Objects;
import work.lcod.cond.api.ResultCode;

/**
 * One entry of a condition chain. Nodes are created and linked by {@link Conditions}; once linked they are
 * never modified again and can be shared by concurrent evaluations.
 */
public final class ConditionNode {
    private final NodeKind kind;
    private final Template template;
    private final Comparison map;
    private final ResultCode rcode;
    private final Fixup fixup;
    private boolean negate;
    private boolean linked;
    private boolean adopted;
    private ConditionNode parent;
    private ConditionNode next;
    private ConditionNode child;

    ConditionNode(NodeKind kind, Template template, Comparison map, ResultCode rcode, Fixup fixup) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.template = template;
        this.map = map;
        this.rcode = rcode;
        this.fixup = fixup == null ? Fixup.NONE : fixup;
    }

    public NodeKind kind() {
        return kind;
    }

    public boolean negate() {
        return negate;
    }

    public Fixup fixup() {
        return fixup;
    }

    /**
     * Enclosing {@link NodeKind#CHILD} node, or null for the top-level chain.
     */
    public ConditionNode parent() {
        return parent;
    }

    public ConditionNode next() {
        return next;
    }

    public ConditionNode child() {
        return child;
    }

    public Template template() {
        return template;
    }

    public Comparison map() {
        return map;
    }

    public ResultCode rcode() {
        return rcode;
    }

    boolean linked() {
        return linked;
    }

    void markLinked() {
        linked = true;
    }

    boolean adopted() {
        return adopted;
    }

    void markAdopted() {
        adopted = true;
    }

    void toggleNegate() {
        negate = !negate;
    }

    void setParent(ConditionNode parent) {
        this.parent = parent;
    }

    void setNext(ConditionNode next) {
        this.next = next;
    }

    void setChild(ConditionNode child) {
        this.child = child;
    }

    @Override
    public String toString() {
        return ConditionPrinter.print(this);
    }
}
