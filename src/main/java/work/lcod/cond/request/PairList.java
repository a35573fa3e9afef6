package work.lcod.cond.request;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import work.lcod.cond.dict.AttributeDef;
import work.lcod.cond.value.TypedValue;

/**
 * Ordered list of attribute instances. Several instances of one attribute may be present.
 */
public final class PairList implements Iterable<Pair> {
    private final List<Pair> pairs = new ArrayList<>();
    private final boolean readOnly;

    public PairList() {
        this(false);
    }

    private PairList(boolean readOnly) {
        this.readOnly = readOnly;
    }

    /**
     * Read-only list holding exactly {@code pair}.
     */
    public static PairList singleton(Pair pair) {
        var list = new PairList(true);
        list.pairs.add(Objects.requireNonNull(pair, "pair"));
        return list;
    }

    public PairList add(Pair pair) {
        if (readOnly) {
            throw new UnsupportedOperationException("Pair list is read-only");
        }
        pairs.add(Objects.requireNonNull(pair, "pair"));
        return this;
    }

    public PairList add(AttributeDef def, TypedValue value) {
        return add(Pair.of(def, value));
    }

    /**
     * Instances of {@code def}, in list order.
     */
    public List<Pair> find(AttributeDef def) {
        var matches = new ArrayList<Pair>();
        for (var pair : pairs) {
            if (pair.def().name().equalsIgnoreCase(def.name())) {
                matches.add(pair);
            }
        }
        return matches;
    }

    public List<Pair> asList() {
        return Collections.unmodifiableList(pairs);
    }

    public Stream<Pair> stream() {
        return pairs.stream();
    }

    public int size() {
        return pairs.size();
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }

    @Override
    public Iterator<Pair> iterator() {
        return asList().iterator();
    }

    @Override
    public String toString() {
        return pairs.toString();
    }
}
