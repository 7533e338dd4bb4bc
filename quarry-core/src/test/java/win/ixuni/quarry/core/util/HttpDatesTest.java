package win.ixuni.quarry.core.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class HttpDatesTest {

    @Test
    void formatsImfFixdate() {
        assertEquals("Sun, 06 Nov 1994 08:49:37 GMT", HttpDates.format(Instant.parse("1994-11-06T08:49:37Z")));
    }

    @Test
    void parsesAllThreeHttpDateForms() {
        Instant expected = Instant.parse("1994-11-06T08:49:37Z");
        assertEquals(expected, HttpDates.parse("Sun, 06 Nov 1994 08:49:37 GMT"));
        assertEquals(expected, HttpDates.parse("Sunday, 06-Nov-94 08:49:37 GMT"));
        assertEquals(expected, HttpDates.parse("Sun Nov  6 08:49:37 1994"));
        assertEquals(Instant.parse("1994-11-16T08:49:37Z"), HttpDates.parse("Wed Nov 16 08:49:37 1994"));
    }

    @Test
    void invalidDatesParseToNull() {
        assertNull(HttpDates.parse(null));
        assertNull(HttpDates.parse("yesterday"));
        assertNull(HttpDates.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void truncateDropsFraction() {
        assertEquals(Instant.parse("2024-01-01T00:00:01Z"), HttpDates.truncate(Instant.parse("2024-01-01T00:00:01.999Z")));
    }
}
