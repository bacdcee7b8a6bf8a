package work.sdl2.canvas.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DurationParserTest {
    @Test
    void parsesSeconds() {
        Optional<Duration> duration = DurationParser.parseSeconds("30s");
        assertTrue(duration.isPresent());
        assertEquals(Duration.ofSeconds(30), duration.get());
    }

    @Test
    void parsesMinutesAndHours() {
        assertEquals(Duration.ofMinutes(2), DurationParser.parseSeconds("2m").orElseThrow());
        assertEquals(Duration.ofHours(1), DurationParser.parseSeconds("1H").orElseThrow());
    }

    @Test
    void parsesMilliseconds() {
        assertEquals(Duration.ofMillis(500), DurationParser.parseSeconds("500ms").orElseThrow());
    }

    @Test
    void bareNumbersUseTheCallerUnit() {
        assertEquals(Duration.ofSeconds(5), DurationParser.parseSeconds("5").orElseThrow());
        assertEquals(Duration.ofMillis(1500), DurationParser.parse("1500", ChronoUnit.MILLIS).orElseThrow());
    }

    @Test
    void blankIsAbsent() {
        assertTrue(DurationParser.parseSeconds(null).isEmpty());
        assertTrue(DurationParser.parseSeconds("  ").isEmpty());
    }

    @Test
    void rejectsGarbageAndNegativeValues() {
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parseSeconds("soon"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parseSeconds("-1s"));
    }
}
