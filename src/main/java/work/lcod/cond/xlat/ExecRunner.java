package work.lcod.cond.xlat;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;
import work.lcod.cond.request.Request;

/**
 * Runs the command line of an {@code EXEC} template without a shell and returns its standard output.
 *
 * <p>Arguments are split on whitespace, double quotes group words, and each argument is expanded before the
 * process starts. A non-zero exit status or an elapsed timeout fails the expansion.
 */
public final class ExecRunner {
    private static final Logger LOG = Logger.getLogger(ExecRunner.class.getName());

    private final XlatEngine engine;
    private final Duration timeout;

    public ExecRunner(XlatEngine engine, Duration timeout) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Exec timeout must be positive: " + timeout);
        }
    }

    public Duration timeout() {
        return timeout;
    }

    public String run(Request request, String commandLine) throws ExpansionException {
        var argv = new ArrayList<String>();
        for (var word : split(commandLine)) {
            argv.add(engine.expand(request, word, null));
        }
        if (argv.isEmpty()) {
            throw new ExpansionException("Exec command is empty");
        }
        var program = argv.get(0);
        LOG.fine(() -> "exec " + argv);
        Process process;
        try {
            process = new ProcessBuilder(argv)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
            process.getOutputStream().close();
        } catch (IOException ex) {
            throw new ExpansionException("Failed to start " + program + ": " + ex.getMessage(), ex);
        }
        var stdout = CompletableFuture.supplyAsync(() -> {
            try {
                return process.getInputStream().readAllBytes();
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
        });
        byte[] output;
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ExpansionException(program + " timed out after " + timeout.toMillis() + "ms");
            }
            output = stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ExpansionException("Interrupted while running " + program, ex);
        } catch (ExecutionException | TimeoutException ex) {
            throw new ExpansionException("Failed to read output of " + program, ex);
        }
        int status = process.exitValue();
        if (status != 0) {
            throw new ExpansionException(program + " exited with status " + status);
        }
        return stripTrailingNewline(new String(output, StandardCharsets.UTF_8));
    }

    static List<String> split(String commandLine) throws ExpansionException {
        var words = new ArrayList<String>();
        var current = new StringBuilder();
        boolean quoted = false;
        boolean inWord = false;
        for (int i = 0; i < commandLine.length(); i++) {
            char ch = commandLine.charAt(i);
            if (quoted) {
                if (ch == '\\' && i + 1 < commandLine.length() && commandLine.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else if (ch == '"') {
                    quoted = false;
                } else {
                    current.append(ch);
                }
            } else if (ch == '"') {
                quoted = true;
                inWord = true;
            } else if (Character.isWhitespace(ch)) {
                if (inWord) {
                    words.add(current.toString());
                    current.setLength(0);
                    inWord = false;
                }
            } else {
                current.append(ch);
                inWord = true;
            }
        }
        if (quoted) {
            throw new ExpansionException("Unterminated quote in exec command: " + commandLine);
        }
        if (inWord) {
            words.add(current.toString());
        }
        return words;
    }

    private static String stripTrailingNewline(String text) {
        if (text.endsWith("\r\n")) {
            return text.substring(0, text.length() - 2);
        }
        if (text.endsWith("\n")) {
            return text.substring(0, text.length() - 1);
        }
        return text;
    }
}
