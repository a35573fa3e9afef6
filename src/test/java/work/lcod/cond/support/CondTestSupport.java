package work.lcod.cond.support;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;
import work.lcod.cond.api.ConditionEvaluator;
import work.lcod.cond.api.EvalConfiguration;
import work.lcod.cond.api.MatchResult;
import work.lcod.cond.api.ResultCode;
import work.lcod.cond.dict.AttributeDef;
import work.lcod.cond.dict.Dictionary;
import work.lcod.cond.paircmp.PairCompareRegistry;
import work.lcod.cond.request.Request;
import work.lcod.cond.tree.ConditionNode;
import work.lcod.cond.tree.Template;
import work.lcod.cond.value.DataType;
import work.lcod.cond.value.StandardValueOps;
import work.lcod.cond.value.TypedValue;
import work.lcod.cond.xlat.DefaultExpander;
import work.lcod.cond.xlat.ExpansionException;
import work.lcod.cond.xlat.Expander;

/**
 * Shared dictionary, templates and an instrumented expander for the evaluator suites.
 */
public final class CondTestSupport {
    public static final AttributeDef USER_NAME = AttributeDef.of("User-Name", DataType.STRING);
    public static final AttributeDef SERVICE_TYPE = AttributeDef.of("Service-Type", DataType.UINT32)
        .withValues(Map.of("Login-User", 1L, "Framed-User", 2L));
    public static final AttributeDef SESSION_TIMEOUT = AttributeDef.of("Session-Timeout", DataType.UINT32);
    public static final AttributeDef FRAMED_IP = AttributeDef.of("Framed-IP-Address", DataType.IPV4_ADDR);
    public static final AttributeDef CLASS = AttributeDef.of("Class", DataType.OCTETS);
    public static final AttributeDef REPLY_MESSAGE = AttributeDef.of("Reply-Message", DataType.STRING);
    public static final AttributeDef PREFIX = AttributeDef.virtual("Prefix", DataType.STRING);
    public static final AttributeDef SUFFIX = AttributeDef.virtual("Suffix", DataType.STRING);

    private CondTestSupport() {}

    public static Dictionary dictionary() {
        return new Dictionary()
            .register(USER_NAME)
            .register(SERVICE_TYPE)
            .register(SESSION_TIMEOUT)
            .register(FRAMED_IP)
            .register(CLASS)
            .register(REPLY_MESSAGE)
            .register(PREFIX)
            .register(SUFFIX);
    }

    /**
     * Path of a file under {@code src/test/resources/fixtures}.
     */
    public static Path fixture(String name) {
        var url = CondTestSupport.class.getResource("/fixtures/" + name);
        if (url == null) {
            throw new IllegalArgumentException("Missing fixture: " + name);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException ex) {
            throw new IllegalStateException(ex);
        }
    }

    public static CountingExpander countingExpander() {
        return new CountingExpander(new DefaultExpander(dictionary()));
    }

    public static EvalConfiguration configuration(Expander expander) {
        var valueOps = new StandardValueOps();
        return EvalConfiguration.builder()
            .expander(expander)
            .valueOps(valueOps)
            .pairComparator(PairCompareRegistry.withDefaults(dictionary(), valueOps))
            .build();
    }

    public static MatchResult evaluate(EvalConfiguration configuration, Request request, ConditionNode root) {
        return new ConditionEvaluator(configuration).evaluate(request, root, ResultCode.NOOP);
    }

    public static Template attr(AttributeDef def) {
        return Template.attribute(def);
    }

    public static Template string(String value) {
        return Template.data(TypedValue.ofString(value));
    }

    public static Template uint32(long value) {
        return Template.data(TypedValue.ofLong(DataType.UINT32, value));
    }

    public static Request request(Object... attributeValuePairs) {
        var request = new Request("test");
        for (int i = 0; i < attributeValuePairs.length; i += 2) {
            var def = (AttributeDef) attributeValuePairs[i];
            request.request().add(def, TypedValue.of(def.type(), attributeValuePairs[i + 1]));
        }
        return request;
    }

    /**
     * Expander counting invocations per template source.
     */
    public static final class CountingExpander implements Expander {
        private final Expander delegate;
        private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

        public CountingExpander(Expander delegate) {
            this.delegate = delegate;
        }

        @Override
        public String expand(Request request, Template template, UnaryOperator<String> escape) throws ExpansionException {
            calls.computeIfAbsent(template.source(), key -> new AtomicInteger()).incrementAndGet();
            return delegate.expand(request, template, escape);
        }

        public int count(String source) {
            var counter = calls.get(source);
            return counter == null ? 0 : counter.get();
        }

        public int total() {
            return calls.values().stream().mapToInt(AtomicInteger::get).sum();
        }
    }
}
