package win.ixuni.quarry.core.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ETagsTest {

    private static final String HELLO_MD5 = "5eb63bbbe01eeed093cb22bb8f5acdc3";

    @Test
    void md5HexOfHelloWorld() {
        assertEquals(HELLO_MD5, ETags.md5Hex("hello world".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void quoteIsIdempotent() {
        assertEquals("\"abc\"", ETags.quote("abc"));
        assertEquals("\"abc\"", ETags.quote("\"abc\""));
        assertEquals("abc", ETags.unquote(" \"abc\" "));
    }

    @Test
    void strongComparisonRejectsWeakTags() {
        assertTrue(ETags.matchesStrong("\"" + HELLO_MD5 + "\"", HELLO_MD5));
        assertTrue(ETags.matchesStrong("\"other\", \"" + HELLO_MD5 + "\"", HELLO_MD5));
        assertTrue(ETags.matchesStrong("*", HELLO_MD5));
        assertFalse(ETags.matchesStrong("W/\"" + HELLO_MD5 + "\"", HELLO_MD5));
        assertFalse(ETags.matchesStrong("\"stale\"", HELLO_MD5));
    }

    @Test
    void weakComparisonIgnoresPrefix() {
        assertTrue(ETags.matchesWeak("W/\"" + HELLO_MD5 + "\"", HELLO_MD5));
        assertTrue(ETags.matchesWeak(HELLO_MD5, HELLO_MD5));
        assertTrue(ETags.matchesWeak("*", HELLO_MD5));
        assertFalse(ETags.matchesWeak("\"a\", \"b\"", HELLO_MD5));
    }
}
