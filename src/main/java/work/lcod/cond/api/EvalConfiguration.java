package work.lcod.cond.api;

import java.util.Objects;
import work.lcod.cond.dict.Dictionary;
import work.lcod.cond.paircmp.PairComparator;
import work.lcod.cond.paircmp.PairCompareRegistry;
import work.lcod.cond.regex.JdkRegexEngine;
import work.lcod.cond.regex.RegexEngine;
import work.lcod.cond.value.StandardValueOps;
import work.lcod.cond.value.ValueOps;
import work.lcod.cond.xlat.DefaultExpander;
import work.lcod.cond.xlat.Expander;

/**
 * Immutable evaluator configuration: collaborators plus evaluation switches.
 *
 * @param maxRegexCaptures capture slots published, besides slot 0, for patterns that do not report their groups
 * @param strict whether structural violations escape as {@link IllegalStateException} instead of an error verdict
 * @param debug whether trees are dumped at INFO before evaluation
 */
public record EvalConfiguration(
    Expander expander,
    RegexEngine regexEngine,
    PairComparator pairComparator,
    ValueOps valueOps,
    int maxRegexCaptures,
    boolean strict,
    boolean debug
) {
    public static final int DEFAULT_MAX_REGEX_CAPTURES = 32;

    public EvalConfiguration {
        Objects.requireNonNull(expander, "expander");
        Objects.requireNonNull(regexEngine, "regexEngine");
        Objects.requireNonNull(pairComparator, "pairComparator");
        Objects.requireNonNull(valueOps, "valueOps");
        if (maxRegexCaptures < 0) {
            throw new IllegalArgumentException("maxRegexCaptures must not be negative");
        }
    }

    /**
     * Default collaborators for {@code dictionary}: expansion engine with exec support, JDK regex, the built-in
     * pair comparators and the standard value operations.
     */
    public static EvalConfiguration defaults(Dictionary dictionary) {
        var valueOps = new StandardValueOps();
        return builder()
            .expander(new DefaultExpander(dictionary))
            .valueOps(valueOps)
            .pairComparator(PairCompareRegistry.withDefaults(dictionary, valueOps))
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Expander expander;
        private RegexEngine regexEngine = new JdkRegexEngine();
        private PairComparator pairComparator;
        private ValueOps valueOps = new StandardValueOps();
        private int maxRegexCaptures = DEFAULT_MAX_REGEX_CAPTURES;
        private boolean strict = true;
        private boolean debug;

        public Builder expander(Expander expander) {
            this.expander = expander;
            return this;
        }

        public Builder regexEngine(RegexEngine regexEngine) {
            this.regexEngine = regexEngine;
            return this;
        }

        public Builder pairComparator(PairComparator pairComparator) {
            this.pairComparator = pairComparator;
            return this;
        }

        public Builder valueOps(ValueOps valueOps) {
            this.valueOps = valueOps;
            return this;
        }

        public Builder maxRegexCaptures(int maxRegexCaptures) {
            this.maxRegexCaptures = maxRegexCaptures;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public EvalConfiguration build() {
            return new EvalConfiguration(
                expander,
                regexEngine,
                pairComparator == null ? new PairCompareRegistry(valueOps) : pairComparator,
                valueOps,
                maxRegexCaptures,
                strict,
                debug
            );
        }
    }
}
