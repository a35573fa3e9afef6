package work.lcod.cond.xlat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.cond.support.CondTestSupport.USER_NAME;
import static work.lcod.cond.support.CondTestSupport.dictionary;
import static work.lcod.cond.support.CondTestSupport.request;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import work.lcod.cond.tree.Template;

class ExecRunnerTest {
    private final XlatEngine engine = new XlatEngine(dictionary(), XlatRegistry.withDefaults());

    @Test
    void splitsOnWhitespaceAndQuotes() throws Exception {
        assertEquals(List.of("echo", "a b", "c"), ExecRunner.split("echo \"a b\"   c"));
        assertEquals(List.of("say", "\"hi\""), ExecRunner.split("say \"\\\"hi\\\"\""));
        assertEquals(List.of("x", ""), ExecRunner.split("x \"\""));
        assertEquals(List.of(), ExecRunner.split("   "));
        assertThrows(ExpansionException.class, () -> ExecRunner.split("echo \"open"));
    }

    @Test
    void rejectsNonPositiveTimeouts() {
        assertThrows(IllegalArgumentException.class, () -> new ExecRunner(engine, Duration.ZERO));
    }

    @Test
    void emptyCommandFails() {
        var runner = new ExecRunner(engine, Duration.ofSeconds(1));
        assertThrows(ExpansionException.class, () -> runner.run(request(), "  "));
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void returnsStandardOutputWithoutTrailingNewline() throws Exception {
        var runner = new ExecRunner(engine, Duration.ofSeconds(10));

        assertEquals("hello bob", runner.run(request(USER_NAME, "bob"), "echo hello %{User-Name}"));
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void expandsThroughTheDefaultExpander() throws Exception {
        var expander = new DefaultExpander(dictionary());

        assertEquals("bob", expander.expand(request(USER_NAME, "bob"), Template.exec("echo %{User-Name}"), null));
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void nonZeroExitFails() {
        var runner = new ExecRunner(engine, Duration.ofSeconds(10));

        var thrown = assertThrows(ExpansionException.class, () -> runner.run(request(), "false"));
        assertEquals("false exited with status 1", thrown.getMessage());
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void slowCommandTimesOut() {
        var runner = new ExecRunner(engine, Duration.ofMillis(200));

        var thrown = assertThrows(ExpansionException.class, () -> runner.run(request(), "sleep 5"));
        assertEquals("sleep timed out after 200ms", thrown.getMessage());
    }

    @Test
    void missingProgramFailsToStart() {
        var runner = new ExecRunner(engine, Duration.ofSeconds(1));

        var thrown = assertThrows(ExpansionException.class, () -> runner.run(request(), "/no/such/program-xyz"));
        assertTrue(thrown.getMessage().startsWith("Failed to start /no/such/program-xyz"));
    }
}
