package work.lcod.cond.xlat;

import java.time.Duration;
import java.util.function.UnaryOperator;
import work.lcod.cond.dict.Dictionary;
import work.lcod.cond.request.Request;
import work.lcod.cond.tree.Template;

/**
 * {@link Expander} sending format strings to an {@link XlatEngine} and commands to an {@link ExecRunner}.
 */
public final class DefaultExpander implements Expander {
    public static final Duration DEFAULT_EXEC_TIMEOUT = Duration.ofSeconds(10);

    private final XlatEngine engine;
    private final ExecRunner exec;

    public DefaultExpander(Dictionary dictionary) {
        this(new XlatEngine(dictionary, XlatRegistry.withDefaults()), DEFAULT_EXEC_TIMEOUT);
    }

    public DefaultExpander(XlatEngine engine, Duration execTimeout) {
        this.engine = engine;
        this.exec = new ExecRunner(engine, execTimeout);
    }

    public XlatEngine engine() {
        return engine;
    }

    @Override
    public String expand(Request request, Template template, UnaryOperator<String> escape) throws ExpansionException {
        return switch (template.kind()) {
            case XLAT, REGEX_XLAT -> engine.expand(request, template.source(), escape);
            case EXEC -> exec.run(request, template.source());
            case ATTRIBUTE, LIST, REGEX, DATA, UNRESOLVED ->
                throw new ExpansionException("Template " + template + " cannot be expanded");
        };
    }
}
