package work.lcod.cond.request;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import work.lcod.cond.tree.Template;
import work.lcod.cond.tree.TemplateKind;

/**
 * In-flight request: attribute lists and regex capture slots. A request is evaluated by one thread at a time.
 */
public final class Request {
    private final String id;
    private final Map<ListKind, PairList> lists = new EnumMap<>(ListKind.class);
    private final RegexCaptures captures = new RegexCaptures();

    public Request() {
        this(UUID.randomUUID().toString());
    }

    public Request(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public String id() {
        return id;
    }

    public PairList list(ListKind kind) {
        return lists.computeIfAbsent(Objects.requireNonNull(kind, "kind"), k -> new PairList());
    }

    public PairList request() {
        return list(ListKind.REQUEST);
    }

    public RegexCaptures captures() {
        return captures;
    }

    /**
     * Cursor over the instances selected by an attribute or list template.
     */
    public AttributeCursor cursor(Template template) {
        if (template.kind() != TemplateKind.ATTRIBUTE && template.kind() != TemplateKind.LIST) {
            throw new IllegalArgumentException("Template " + template + " does not reference attributes");
        }
        var pairs = lists.get(template.list());
        if (pairs == null) {
            return new AttributeCursor(List.of());
        }
        if (template.kind() == TemplateKind.LIST) {
            return new AttributeCursor(pairs.asList());
        }
        return new AttributeCursor(select(pairs.find(template.attribute()), template.index()));
    }

    private static List<Pair> select(List<Pair> instances, int index) {
        if (index == Template.NUM_ANY || instances.isEmpty()) {
            return instances;
        }
        if (index == Template.NUM_LAST) {
            return List.of(instances.get(instances.size() - 1));
        }
        return index < instances.size() ? List.of(instances.get(index)) : List.of();
    }

    @Override
    public String toString() {
        return "Request[" + id + "]";
    }
}
