package work.lcod.cond.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.logging.Logger;
import picocli.CommandLine;
import work.lcod.cond.api.ConditionEvaluator;
import work.lcod.cond.api.EvalConfiguration;
import work.lcod.cond.api.LogLevel;
import work.lcod.cond.api.ResultCode;
import work.lcod.cond.loader.ConditionLoader;
import work.lcod.cond.loader.DictionaryLoader;
import work.lcod.cond.loader.RequestLoader;
import work.lcod.cond.paircmp.PairCompareRegistry;
import work.lcod.cond.regex.JdkRegexEngine;
import work.lcod.cond.request.Request;
import work.lcod.cond.shared.DurationParser;
import work.lcod.cond.value.StandardValueOps;
import work.lcod.cond.xlat.DefaultExpander;
import work.lcod.cond.xlat.XlatEngine;
import work.lcod.cond.xlat.XlatRegistry;

@CommandLine.Command(
    name = "cond-eval",
    description = "Evaluate a policy condition against a request.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true,
    exitCodeOnExecutionException = 2
)
final class CondEvalCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-d", "--dictionary"},
        required = true,
        description = "TOML attribute dictionary."
    )
    private Path dictionaryPath;

    @CommandLine.Option(
        names = {"-c", "--condition"},
        required = true,
        description = "YAML or JSON condition document."
    )
    private Path conditionPath;

    @CommandLine.Option(
        names = {"-r", "--request"},
        paramLabel = "PATH|-",
        description = "JSON request file, inline JSON object, or '-' to read from stdin (default: {}).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String requestSource;

    @CommandLine.Option(
        names = "--rcode",
        description = "Result code of the previous module (reject|fail|ok|handled|invalid|disallow|notfound|noop|updated).",
        defaultValue = "noop"
    )
    private String rcode;

    @CommandLine.Option(
        names = "--exec-timeout",
        description = "Timeout for exec templates (e.g. 500ms, 10s, 2m).",
        defaultValue = "10s"
    )
    private String execTimeoutRaw;

    @CommandLine.Option(
        names = "--debug",
        description = "Dump the condition tree before evaluating it."
    )
    private boolean debug;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() {
        applyLogLevel(resolveLogLevel());
        var execTimeout = DurationParser.parse(execTimeoutRaw).orElse(DefaultExpander.DEFAULT_EXEC_TIMEOUT);
        if (execTimeout.isZero()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--exec-timeout must be positive");
        }
        var priorResult = ResultCode.from(rcode);

        var dictionary = DictionaryLoader.load(dictionaryPath);
        var valueOps = new StandardValueOps();
        var regexEngine = new JdkRegexEngine();
        var condition = new ConditionLoader(dictionary, regexEngine, valueOps).load(conditionPath);
        var request = loadRequest(new RequestLoader(dictionary, valueOps));

        var configuration = EvalConfiguration.builder()
            .expander(new DefaultExpander(new XlatEngine(dictionary, XlatRegistry.withDefaults()), execTimeout))
            .regexEngine(regexEngine)
            .valueOps(valueOps)
            .pairComparator(PairCompareRegistry.withDefaults(dictionary, valueOps))
            .debug(debug)
            .build();
        var result = new ConditionEvaluator(configuration).evaluate(request, condition, priorResult);

        Map<String, Object> output = new LinkedHashMap<>(result.toSerializableMap());
        output.put("captures", request.captures().asList());
        try {
            spec.commandLine().getOut().println(JSON_WRITER.writeValueAsString(output));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize result: " + ex.getOriginalMessage(), ex);
        }
        spec.commandLine().getOut().flush();
        return result.verdict().exitCode();
    }

    private Request loadRequest(RequestLoader loader) {
        if (requestSource == null || requestSource.isBlank()) {
            return new Request();
        }
        if ("-".equals(requestSource)) {
            return loader.load(System.in, "<stdin>");
        }
        var trimmed = requestSource.trim();
        if (trimmed.startsWith("{")) {
            return loader.parse(trimmed, "<inline>");
        }
        return loader.load(Paths.get(requestSource).toAbsolutePath().normalize());
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("LCOD_LOG_LEVEL");
        }
        if (debug && (candidate == null || candidate.isBlank())) {
            candidate = "info";
        }
        return LogLevel.from(candidate);
    }

    private static void applyLogLevel(LogLevel level) {
        var root = Logger.getLogger("");
        root.setLevel(level.toJulLevel());
        for (var handler : root.getHandlers()) {
            handler.setLevel(level.toJulLevel());
        }
    }
}
