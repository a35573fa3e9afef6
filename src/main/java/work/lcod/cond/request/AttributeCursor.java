package work.lcod.cond.request;

import java.util.Iterator;
import java.util.List;

/**
 * Read-only cursor over the attribute instances selected by a template.
 */
public final class AttributeCursor implements Iterable<Pair> {
    private final List<Pair> matches;
    private int position;

    AttributeCursor(List<Pair> matches) {
        this.matches = List.copyOf(matches);
    }

    /**
     * Rewinds the cursor and returns the first instance, or null when nothing matched.
     */
    public Pair first() {
        position = 0;
        return next();
    }

    /**
     * Returns the following instance, or null once the cursor is exhausted.
     */
    public Pair next() {
        if (position >= matches.size()) {
            return null;
        }
        return matches.get(position++);
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }

    public int count() {
        return matches.size();
    }

    @Override
    public Iterator<Pair> iterator() {
        return matches.iterator();
    }
}
