package work.lcod.cond.regex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Groups captured by a successful match. Slot 0 holds the whole match; groups that did not participate are
 * null.
 */
public record RegexMatch(List<String> groups) {
    public RegexMatch {
        groups = Collections.unmodifiableList(new ArrayList<>(groups));
    }

    public String group(int index) {
        return index >= 0 && index < groups.size() ? groups.get(index) : null;
    }
}
