package work.lcod.cond.cli;

import java.io.IOException;
import java.util.logging.LogManager;
import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        configureLogging();
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new CondEvalCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (var in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException ex) {
            System.err.println("Cannot read logging.properties: " + ex.getMessage());
        }
    }
}
