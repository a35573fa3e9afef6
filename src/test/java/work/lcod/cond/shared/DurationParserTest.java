package work.lcod.cond.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DurationParserTest {
    @Test
    void parsesUnits() {
        assertEquals(Optional.of(Duration.ofMillis(250)), DurationParser.parse("250ms"));
        assertEquals(Optional.of(Duration.ofSeconds(10)), DurationParser.parse("10s"));
        assertEquals(Optional.of(Duration.ofMinutes(2)), DurationParser.parse("2 M"));
        assertEquals(Optional.of(Duration.ofHours(1)), DurationParser.parse(" 1h "));
    }

    @Test
    void readsBareNumbersAsMilliseconds() {
        Optional<Duration> duration = DurationParser.parse("1500");
        assertTrue(duration.isPresent());
        assertEquals(Duration.ofMillis(1500), duration.get());
    }

    @Test
    void blankInputIsEmpty() {
        assertTrue(DurationParser.parse("  ").isEmpty());
        assertTrue(DurationParser.parse(null).isEmpty());
    }

    @Test
    void rejectsGarbage() {
        var thrown = assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("soon"));
        assertEquals("Invalid duration: soon", thrown.getMessage());
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("-5s"));
    }
}
