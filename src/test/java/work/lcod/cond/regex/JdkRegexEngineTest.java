package work.lcod.cond.regex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class JdkRegexEngineTest {
    private final JdkRegexEngine engine = new JdkRegexEngine();

    @Test
    void searchesRatherThanAnchoring() throws Exception {
        var regex = engine.compile("b(o)b", Set.of());

        var match = engine.exec(regex, "xx bob yy");

        assertNotNull(match);
        assertEquals("bob", match.group(0));
        assertEquals("o", match.group(1));
        assertNull(match.group(2));
        assertNull(engine.exec(regex, "alice"));
    }

    @Test
    void reportsSubcaptureSlots() throws Exception {
        assertEquals(0, engine.subcaptureCount(engine.compile("plain", Set.of())));
        assertEquals(3, engine.subcaptureCount(engine.compile("(a)(b)?", Set.of())));
    }

    @Test
    void nonParticipatingGroupsAreNull() throws Exception {
        var match = engine.exec(engine.compile("(a)|(b)", Set.of()), "b");

        assertNull(match.group(1));
        assertEquals("b", match.group(2));
    }

    @Test
    void appliesFlags() throws Exception {
        var regex = engine.compile("^BOB$", RegexFlag.parse("im"));

        assertNotNull(engine.exec(regex, "alice\nbob"));
        assertEquals("/^BOB$/im", regex.toString());
        assertEquals(EnumSet.of(RegexFlag.IGNORE_CASE, RegexFlag.MULTILINE), regex.flags());
    }

    @Test
    void compileErrorsCarryTheOffset() {
        var thrown = assertThrows(RegexException.class, () -> engine.compile("ab(c", Set.of()));

        assertTrue(thrown.offset() >= 0);
        assertTrue(thrown.getMessage().startsWith("Invalid regex /ab(c/"));
    }

    @Test
    void parsesFlagLetters() {
        assertEquals("isx", RegexFlag.letters(RegexFlag.parse("xsi")));
        assertTrue(RegexFlag.parse(null).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> RegexFlag.parse("q"));
    }
}
