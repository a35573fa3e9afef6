package work.lcod.cond.request;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Substrings captured by the most recent regex comparison of a request. Slot 0 is the whole match.
 */
public final class RegexCaptures {
    private List<String> slots = List.of();

    /**
     * Replaces every slot with {@code captured}; null entries stand for groups that did not participate.
     */
    public void publish(List<String> captured) {
        slots = Collections.unmodifiableList(new ArrayList<>(captured));
    }

    public void clear() {
        slots = List.of();
    }

    /**
     * Captured text of slot {@code index}, or null when the slot is empty.
     */
    public String get(int index) {
        return index >= 0 && index < slots.size() ? slots.get(index) : null;
    }

    public int size() {
        return slots.size();
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }

    public List<String> asList() {
        return slots;
    }

    @Override
    public String toString() {
        return slots.toString();
    }
}
