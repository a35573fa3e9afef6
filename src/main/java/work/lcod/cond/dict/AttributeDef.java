package work.lcod.cond.dict;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import work.lcod.cond.value.DataType;

/**
 * Dictionary entry: attribute name, declared type, virtual flag and enumerated value names.
 *
 * <p>Virtual attributes never appear on a request; comparisons against them are answered by the legacy
 * pair comparator.
 */
public record AttributeDef(String name, DataType type, boolean virtual, Map<String, Long> values) {
    public AttributeDef {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Attribute name is empty");
        }
        values = values == null || values.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static AttributeDef of(String name, DataType type) {
        return new AttributeDef(name, type, false, Map.of());
    }

    public static AttributeDef virtual(String name, DataType type) {
        return new AttributeDef(name, type, true, Map.of());
    }

    public AttributeDef withValues(Map<String, Long> enumerated) {
        return new AttributeDef(name, type, virtual, enumerated);
    }

    public OptionalLong valueOf(String valueName) {
        if (valueName == null) {
            return OptionalLong.empty();
        }
        var direct = values.get(valueName);
        if (direct != null) {
            return OptionalLong.of(direct);
        }
        for (var entry : values.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(valueName)) {
                return OptionalLong.of(entry.getValue());
            }
        }
        return OptionalLong.empty();
    }

    @Override
    public String toString() {
        return name;
    }
}
