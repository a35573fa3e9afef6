package work.lcod.cond.xlat;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named {@link XlatFunction}s available to {@link XlatEngine}.
 */
public final class XlatRegistry {
    private final Map<String, XlatFunction> functions = new ConcurrentHashMap<>();

    public static XlatRegistry withDefaults() {
        var registry = new XlatRegistry();
        registry.register("length", (request, arg) -> Integer.toString(arg.length()));
        registry.register("tolower", (request, arg) -> arg.toLowerCase(Locale.ROOT));
        registry.register("toupper", (request, arg) -> arg.toUpperCase(Locale.ROOT));
        registry.register("trim", (request, arg) -> arg.strip());
        return registry;
    }

    public XlatRegistry register(String name, XlatFunction function) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Function name is empty");
        }
        functions.put(name, Objects.requireNonNull(function, "function"));
        return this;
    }

    public Optional<XlatFunction> find(String name) {
        return Optional.ofNullable(functions.get(name));
    }
}
