package work.lcod.cond.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.cond.support.CondTestSupport.fixture;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CondEvalCommandTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void printsMatchAndExitsZero() throws Exception {
        int exit = run(
            "-d", fixture("dictionary.toml").toString(),
            "-c", fixture("framed-user.yaml").toString(),
            "-r", fixture("admin.json").toString());

        assertEquals(0, exit);
        var result = output();
        assertEquals("true", result.get("verdict").asText());
        assertEquals(1, result.get("code").asInt());
        assertEquals("Admin", result.get("captures").get(1).asText());
    }

    @Test
    void noMatchExitsOne() throws Exception {
        int exit = run(
            "-d", fixture("dictionary.toml").toString(),
            "-c", fixture("framed-user.yaml").toString(),
            "-r", "{\"request\": {\"User-Name\": \"bob\"}}");

        assertEquals(1, exit);
        assertEquals("false", output().get("verdict").asText());
        assertTrue(output().get("captures").isEmpty());
    }

    @Test
    void evaluationFailureExitsTwo(@TempDir Path tmp) throws Exception {
        var condition = tmp.resolve("cast.yaml");
        Files.writeString(condition, "condition:\n  - map: { lhs: '&Session-Timeout', op: '==', rhs: { xlat: '%{User-Name}' } }\n");

        int exit = run(
            "-d", fixture("dictionary.toml").toString(),
            "-c", condition.toString(),
            "-r", "{\"request\": {\"User-Name\": \"bob\"}}");

        assertEquals(2, exit);
        var result = output();
        assertEquals("error", result.get("verdict").asText());
        assertEquals("CAST_FAILURE", result.get("errorKind").asText());
    }

    @Test
    void priorResultCodeIsPassedThrough(@TempDir Path tmp) throws Exception {
        var condition = tmp.resolve("rcode.yaml");
        Files.writeString(condition, "condition:\n  - rcode: ok\n");

        assertEquals(0, run("-d", fixture("dictionary.toml").toString(), "-c", condition.toString(), "--rcode", "ok"));
        assertEquals(1, run("-d", fixture("dictionary.toml").toString(), "-c", condition.toString()));
    }

    @Test
    void loadErrorsArePrintedShort() {
        int exit = run("-d", "/no/such/dictionary.toml", "-c", fixture("framed-user.yaml").toString());

        assertEquals(2, exit);
        assertTrue(err.toString().contains("Failed to read dictionary"), err.toString());
    }

    @Test
    void rejectsZeroExecTimeout() {
        int exit = run(
            "-d", fixture("dictionary.toml").toString(),
            "-c", fixture("framed-user.yaml").toString(),
            "--exec-timeout", "0s");

        assertEquals(2, exit);
        assertTrue(err.toString().contains("--exec-timeout must be positive"));
    }

    @Test
    void printsVersion() {
        assertEquals(0, run("--version"));
        assertTrue(out.toString().startsWith("cond-eval (java) "));
    }

    private int run(String... args) {
        out.getBuffer().setLength(0);
        err.getBuffer().setLength(0);
        var commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private JsonNode output() throws Exception {
        return MAPPER.readTree(out.toString());
    }
}
