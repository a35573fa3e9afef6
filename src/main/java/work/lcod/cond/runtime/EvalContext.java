package work.lcod.cond.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;
import work.lcod.cond.api.CondEvalException;
import work.lcod.cond.api.ErrorKind;
import work.lcod.cond.api.EvalConfiguration;
import work.lcod.cond.api.ResultCode;
import work.lcod.cond.dict.AttributeDef;
import work.lcod.cond.request.Request;
import work.lcod.cond.tree.Template;
import work.lcod.cond.tree.TemplateKind;
import work.lcod.cond.value.CastException;
import work.lcod.cond.value.DataType;
import work.lcod.cond.value.TypedValue;
import work.lcod.cond.xlat.ExpansionException;
import work.lcod.cond.xlat.RegexEscape;

/**
 * Per-evaluation state: the request, the prior result code, owned values awaiting release and expansions
 * already made for the comparison in progress. Confined to the evaluating thread.
 */
public final class EvalContext {
    private static final Logger LOG = Logger.getLogger(EvalContext.class.getName());

    private final Request request;
    private final ResultCode priorResult;
    private final EvalConfiguration configuration;
    private final Deque<List<TypedValue>> scopeStack = new ArrayDeque<>();
    private final Map<Template, String> expansions = new IdentityHashMap<>();

    public EvalContext(Request request, ResultCode priorResult, EvalConfiguration configuration) {
        this.request = Objects.requireNonNull(request, "request");
        this.priorResult = Objects.requireNonNull(priorResult, "priorResult");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    public Request request() {
        return request;
    }

    public ResultCode priorResult() {
        return priorResult;
    }

    public EvalConfiguration configuration() {
        return configuration;
    }

    /**
     * Expands an {@code EXEC}, {@code XLAT} or {@code REGEX_XLAT} template. Within one comparison a template is
     * expanded at most once; {@code REGEX_XLAT} values are regex-escaped.
     */
    public String expand(Template template) {
        var cached = expansions.get(template);
        if (cached != null) {
            return cached;
        }
        UnaryOperator<String> escape = template.kind() == TemplateKind.REGEX_XLAT ? RegexEscape::escape : null;
        String expanded;
        try {
            expanded = configuration.expander().expand(request, template, escape);
        } catch (ExpansionException ex) {
            throw new CondEvalException(ErrorKind.EXPANSION_FAILURE,
                "Failed expanding " + template + ": " + ex.getMessage(), ex);
        }
        if (expanded == null) {
            throw new CondEvalException(ErrorKind.EXPANSION_FAILURE, "Expansion of " + template + " produced no value");
        }
        expansions.put(template, expanded);
        return expanded;
    }

    /**
     * Converts {@code value} to {@code target}; the converted value is released when the current scope ends.
     */
    public TypedValue cast(TypedValue value, DataType target, AttributeDef context) {
        if (value.type() == target) {
            return value;
        }
        TypedValue converted;
        try {
            converted = configuration.valueOps().cast(value, target, context);
        } catch (CastException ex) {
            throw new CondEvalException(ErrorKind.CAST_FAILURE,
                "Failed casting " + value.type() + " value to " + target + ": " + ex.getMessage(), ex);
        }
        LOG.finer(() -> "cast " + value + " -> " + converted);
        return own(converted);
    }

    /**
     * Registers an owned value for release at the end of the current scope and returns it.
     */
    public TypedValue own(TypedValue value) {
        if (value.owned()) {
            defer(value);
        }
        return value;
    }

    void beginComparison() {
        pushScope();
    }

    void endComparison() {
        popScope();
        expansions.clear();
    }

    void pushScope() {
        scopeStack.push(new ArrayList<>());
    }

    void popScope() {
        var owned = scopeStack.poll();
        if (owned == null) {
            return;
        }
        for (int i = owned.size() - 1; i >= 0; i--) {
            owned.get(i).release();
        }
    }

    /**
     * Releases every value still registered.
     */
    public void close() {
        while (!scopeStack.isEmpty()) {
            popScope();
        }
        expansions.clear();
    }

    void defer(TypedValue value) {
        if (scopeStack.isEmpty()) {
            scopeStack.push(new ArrayList<>());
        }
        scopeStack.peek().add(value);
    }
}
