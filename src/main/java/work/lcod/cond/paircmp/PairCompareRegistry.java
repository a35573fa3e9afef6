package work.lcod.cond.paircmp;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiPredicate;
import java.util.logging.Logger;
import work.lcod.cond.dict.AttributeDef;
import work.lcod.cond.dict.Dictionary;
import work.lcod.cond.request.ListKind;
import work.lcod.cond.request.Pair;
import work.lcod.cond.request.PairList;
import work.lcod.cond.request.Request;
import work.lcod.cond.value.CastException;
import work.lcod.cond.value.Operator;
import work.lcod.cond.value.ValueOps;

/**
 * {@link PairComparator} dispatching to callbacks registered per virtual attribute. Check pairs without a
 * callback are compared against the request instances of the same attribute.
 */
public final class PairCompareRegistry implements PairComparator {
    private static final Logger LOG = Logger.getLogger(PairCompareRegistry.class.getName());

    private final Map<String, VirtualComparator> comparators = new ConcurrentHashMap<>();
    private final ValueOps valueOps;

    public PairCompareRegistry(ValueOps valueOps) {
        this.valueOps = Objects.requireNonNull(valueOps, "valueOps");
    }

    /**
     * Registry with the {@code Prefix} and {@code Suffix} comparators, for those the dictionary defines.
     */
    public static PairCompareRegistry withDefaults(Dictionary dictionary, ValueOps valueOps) {
        var registry = new PairCompareRegistry(valueOps);
        var userName = dictionary.find("User-Name").orElse(null);
        dictionary.find("Prefix").ifPresent(def ->
            registry.register(def, userNameComparator(userName, "Prefix", String::startsWith)));
        dictionary.find("Suffix").ifPresent(def ->
            registry.register(def, userNameComparator(userName, "Suffix", String::endsWith)));
        return registry;
    }

    public PairCompareRegistry register(AttributeDef def, VirtualComparator comparator) {
        comparators.put(key(def.name()), Objects.requireNonNull(comparator, "comparator"));
        return this;
    }

    public Optional<VirtualComparator> find(AttributeDef def) {
        return Optional.ofNullable(comparators.get(key(def.name())));
    }

    @Override
    public int compare(Request request, PairList requestPairs, PairList check) throws PairCompareException {
        for (var pair : check) {
            var comparator = comparators.get(key(pair.def().name()));
            int rcode = comparator != null ? comparator.compare(request, pair) : compareInstances(requestPairs, pair);
            LOG.finer(() -> "paircmp " + pair + " -> " + rcode);
            if (rcode != 0) {
                return 1;
            }
        }
        return 0;
    }

    private int compareInstances(PairList requestPairs, Pair check) throws PairCompareException {
        for (var instance : requestPairs.find(check.def())) {
            try {
                if (valueOps.applyOperator(check.opOrDefault(), instance.value(), check.value())) {
                    return 0;
                }
            } catch (CastException ex) {
                throw new PairCompareException("Cannot compare " + check.def().name() + ": " + ex.getMessage(), ex);
            }
        }
        return 1;
    }

    private static VirtualComparator userNameComparator(AttributeDef userName, String label, BiPredicate<String, String> test) {
        return (request, check) -> {
            var op = check.opOrDefault();
            if (op != Operator.EQ && op != Operator.NE) {
                throw new PairCompareException(label + " does not support operator " + op.token());
            }
            boolean matched = false;
            if (userName != null) {
                var expected = check.value().print();
                for (var instance : request.list(ListKind.REQUEST).find(userName)) {
                    if (test.test(instance.value().print(), expected)) {
                        matched = true;
                        break;
                    }
                }
            }
            return matched == (op == Operator.EQ) ? 0 : 1;
        };
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
