package win.ixuni.quarry.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import win.ixuni.quarry.core.model.ByteRange;
import win.ixuni.quarry.core.util.RangeHeaderParser.Kind;
import win.ixuni.quarry.core.util.RangeHeaderParser.Result;

import static org.junit.jupiter.api.Assertions.*;

class RangeHeaderParserTest {

    private static final long SIZE = 11;

    @Test
    @DisplayName("bytes=0-4 → 前 5 字节")
    void closedRange() {
        Result result = RangeHeaderParser.parse("bytes=0-4", SIZE);
        assertEquals(Kind.SATISFIABLE, result.kind());
        assertEquals(new ByteRange(0, 4), result.range());
    }

    @Test
    void openEndedRange() {
        Result result = RangeHeaderParser.parse("bytes=6-", SIZE);
        assertEquals(new ByteRange(6, 10), result.range());
    }

    @Test
    @DisplayName("Suffix range returns the last min(N, L) bytes")
    void suffixRange() {
        assertEquals(new ByteRange(6, 10), RangeHeaderParser.parse("bytes=-5", SIZE).range());
        assertEquals(new ByteRange(0, 10), RangeHeaderParser.parse("bytes=-500", SIZE).range());
    }

    @Test
    void endPastObjectIsClamped() {
        assertEquals(new ByteRange(3, 10), RangeHeaderParser.parse("bytes=3-999", SIZE).range());
    }

    @Test
    @DisplayName("start >= length 不可满足")
    void startBeyondEndIsUnsatisfiable() {
        assertEquals(Kind.UNSATISFIABLE, RangeHeaderParser.parse("bytes=11-", SIZE).kind());
        assertEquals(Kind.UNSATISFIABLE, RangeHeaderParser.parse("bytes=20-30", SIZE).kind());
    }

    @Test
    void zeroSuffixAndEmptyObjectAreUnsatisfiable() {
        assertEquals(Kind.UNSATISFIABLE, RangeHeaderParser.parse("bytes=-0", SIZE).kind());
        assertEquals(Kind.UNSATISFIABLE, RangeHeaderParser.parse("bytes=0-0", 0).kind());
        assertEquals(Kind.UNSATISFIABLE, RangeHeaderParser.parse("bytes=-5", 0).kind());
    }

    @ParameterizedTest
    @ValueSource(strings = {"items=0-4", "bytes=0-1,3-4", "bytes=5-2", "bytes=-", "bytes=a-b", "0-4",
            "bytes=99999999999999999999-"})
    @DisplayName("Malformed ranges are ignored")
    void malformedRangesAreIgnored(String header) {
        assertEquals(Kind.NONE, RangeHeaderParser.parse(header, SIZE).kind());
    }

    @Test
    void absentHeader() {
        assertEquals(Kind.NONE, RangeHeaderParser.parse(null, SIZE).kind());
        assertEquals(Kind.NONE, RangeHeaderParser.parse("  ", SIZE).kind());
    }
}
