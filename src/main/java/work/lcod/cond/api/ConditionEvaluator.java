package work.lcod.cond.api;

import java.util.Objects;
import java.util.logging.Logger;
import work.lcod.cond.request.Request;
import work.lcod.cond.runtime.ConditionWalker;
import work.lcod.cond.runtime.EvalContext;
import work.lcod.cond.tree.ConditionDebug;
import work.lcod.cond.tree.ConditionNode;
import work.lcod.cond.tree.ConditionPrinter;

/**
 * Entry point: evaluates a condition tree against a request.
 *
 * <p>An evaluator is stateless and may be shared; condition trees may be evaluated concurrently as long as each
 * call gets its own {@link Request}.
 */
public final class ConditionEvaluator {
    private static final Logger LOG = Logger.getLogger(ConditionEvaluator.class.getName());

    private final EvalConfiguration configuration;

    public ConditionEvaluator(EvalConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    public EvalConfiguration configuration() {
        return configuration;
    }

    /**
     * @param priorResult result code of the module that ran before the condition
     * @throws IllegalStateException for structural violations when the configuration is strict
     */
    public MatchResult evaluate(Request request, ConditionNode root, ResultCode priorResult) {
        Objects.requireNonNull(root, "root");
        if (configuration.debug()) {
            LOG.info(() -> "evaluating " + ConditionPrinter.print(root) + " for " + request);
            ConditionDebug.log(root);
        }
        var context = new EvalContext(request, priorResult, configuration);
        var walker = new ConditionWalker(context);
        try {
            var result = MatchResult.of(walker.walk(root), walker.steps());
            LOG.fine(() -> request + ": " + result.verdict() + " after " + result.steps() + " steps");
            return result;
        } catch (CondEvalException ex) {
            if (ex.kind() == ErrorKind.STRUCTURAL_VIOLATION && configuration.strict()) {
                throw new IllegalStateException(ex.getMessage(), ex);
            }
            LOG.fine(() -> request + ": evaluation failed (" + ex.kind() + "): " + ex.getMessage());
            return MatchResult.failure(ex.kind(), ex.getMessage(), walker.steps());
        } finally {
            context.close();
        }
    }
}
