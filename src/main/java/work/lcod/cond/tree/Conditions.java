package work.lcod.cond.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import work.lcod.cond.api.ResultCode;
import work.lcod.cond.value.Operator;

/**
 * Static factories building condition trees.
 *
 * <pre>{@code
 * var root = Conditions.all(
 *     Conditions.map(Template.attribute(userName), Operator.EQ, Template.data(TypedValue.ofString("bob"))),
 *     Conditions.not(Conditions.group(Conditions.any(a, b))));
 * }</pre>
 */
public final class Conditions {
    private Conditions() {}

    public static ConditionNode map(Template lhs, Operator op, Template rhs) {
        return map(lhs, op, rhs, Fixup.NONE);
    }

    public static ConditionNode map(Template lhs, Operator op, Template rhs, Fixup fixup) {
        var comparison = new Comparison(lhs, op, rhs);
        if (fixup == Fixup.PAIR_COMPARE && !lhs.isAttribute()) {
            throw new IllegalArgumentException("Pair comparison requires an attribute on the left: " + comparison);
        }
        return new ConditionNode(NodeKind.MAP, null, comparison, null, fixup);
    }

    /**
     * Comparison answered by the legacy pair comparator for the virtual attribute on the left.
     */
    public static ConditionNode pairCompare(Template lhs, Operator op, Template rhs) {
        return map(lhs, op, rhs, Fixup.PAIR_COMPARE);
    }

    public static ConditionNode template(Template template) {
        Objects.requireNonNull(template, "template");
        return new ConditionNode(NodeKind.TEMPLATE, template, null, null, Fixup.NONE);
    }

    public static ConditionNode rcode(ResultCode code) {
        Objects.requireNonNull(code, "code");
        return new ConditionNode(NodeKind.RCODE, null, null, code, Fixup.NONE);
    }

    public static ConditionNode alwaysTrue() {
        return new ConditionNode(NodeKind.TRUE, null, null, null, Fixup.NONE);
    }

    public static ConditionNode alwaysFalse() {
        return new ConditionNode(NodeKind.FALSE, null, null, null, Fixup.NONE);
    }

    public static ConditionNode and() {
        return new ConditionNode(NodeKind.AND, null, null, null, Fixup.NONE);
    }

    public static ConditionNode or() {
        return new ConditionNode(NodeKind.OR, null, null, null, Fixup.NONE);
    }

    /**
     * Flips the negation of a node that has not been linked yet and returns it.
     */
    public static ConditionNode not(ConditionNode node) {
        Objects.requireNonNull(node, "node");
        if (node.kind().isMarker()) {
            throw new IllegalArgumentException("Cannot negate a " + node.kind().label() + " marker");
        }
        if (node.linked()) {
            throw new IllegalArgumentException("Condition node is already part of a chain; negate it before linking");
        }
        node.toggleNegate();
        return node;
    }

    /**
     * Wraps a chain in a parenthesised child node. A single argument that already heads a chain built by
     * {@link #chain}, {@link #all} or {@link #any} is adopted as is.
     */
    public static ConditionNode group(ConditionNode... nodes) {
        requireEntries(nodes);
        ConditionNode head;
        if (nodes.length == 1 && nodes[0].linked() && !nodes[0].adopted() && nodes[0].parent() == null) {
            head = nodes[0];
        } else {
            head = chain(nodes);
        }
        var group = new ConditionNode(NodeKind.CHILD, null, null, null, Fixup.NONE);
        group.setChild(head);
        for (var node = head; node != null; node = node.next()) {
            node.setParent(group);
        }
        head.markAdopted();
        return group;
    }

    /**
     * Links nodes into one chain and returns its head. Markers may not open or close a chain and may not follow
     * each other.
     */
    public static ConditionNode chain(ConditionNode... nodes) {
        return chain(Arrays.asList(requireEntries(nodes)));
    }

    public static ConditionNode chain(List<ConditionNode> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            throw new IllegalArgumentException("Condition chain is empty");
        }
        Set<ConditionNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        ConditionNode previous = null;
        for (var node : nodes) {
            Objects.requireNonNull(node, "chain entry");
            if (node.linked() || !seen.add(node)) {
                throw new IllegalArgumentException("Condition node is already part of a chain: " + node.kind().label());
            }
            if (node.kind().isMarker() && (previous == null || previous.kind().isMarker())) {
                throw new IllegalArgumentException("Misplaced " + node.kind().label() + " in condition chain");
            }
            previous = node;
        }
        if (previous.kind().isMarker()) {
            throw new IllegalArgumentException("Condition chain ends with " + previous.kind().label());
        }
        for (int i = 0; i < nodes.size(); i++) {
            var node = nodes.get(i);
            node.setNext(i + 1 < nodes.size() ? nodes.get(i + 1) : null);
            node.markLinked();
        }
        return nodes.get(0);
    }

    /**
     * Chain joining every entry with {@code &&}.
     */
    public static ConditionNode all(ConditionNode... nodes) {
        return chain(interleave(requireEntries(nodes), NodeKind.AND));
    }

    /**
     * Chain joining every entry with {@code ||}.
     */
    public static ConditionNode any(ConditionNode... nodes) {
        return chain(interleave(requireEntries(nodes), NodeKind.OR));
    }

    /**
     * Number of non-marker nodes reachable from {@code root}, nested children included.
     */
    public static int size(ConditionNode root) {
        int count = 0;
        var pending = new ArrayDeque<ConditionNode>();
        if (root != null) {
            pending.push(root);
        }
        while (!pending.isEmpty()) {
            for (var node = pending.pop(); node != null; node = node.next()) {
                if (!node.kind().isMarker()) {
                    count++;
                }
                if (node.child() != null) {
                    pending.push(node.child());
                }
            }
        }
        return count;
    }

    private static List<ConditionNode> interleave(ConditionNode[] nodes, NodeKind marker) {
        var entries = new ArrayList<ConditionNode>(nodes.length * 2);
        for (int i = 0; i < nodes.length; i++) {
            if (i > 0) {
                entries.add(marker == NodeKind.AND ? and() : or());
            }
            entries.add(nodes[i]);
        }
        return entries;
    }

    private static ConditionNode[] requireEntries(ConditionNode[] nodes) {
        if (nodes == null || nodes.length == 0) {
            throw new IllegalArgumentException("Condition chain is empty");
        }
        return nodes;
    }
}
