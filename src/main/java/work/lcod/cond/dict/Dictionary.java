package work.lcod.cond.dict;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Attribute definitions by name. Lookups ignore case.
 */
public final class Dictionary {
    private final Map<String, AttributeDef> attributes = new ConcurrentHashMap<>();

    public Dictionary register(AttributeDef def) {
        var key = key(def.name());
        var previous = attributes.putIfAbsent(key, def);
        if (previous != null && !previous.equals(def)) {
            throw new IllegalArgumentException("Attribute already defined: " + def.name());
        }
        return this;
    }

    public Optional<AttributeDef> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(attributes.get(key(name)));
    }

    public AttributeDef require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown attribute: " + name));
    }

    public Collection<AttributeDef> attributes() {
        return Collections.unmodifiableCollection(attributes.values());
    }

    public int size() {
        return attributes.size();
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
