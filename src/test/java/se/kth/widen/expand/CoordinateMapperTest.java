package se.kth.widen.expand;

import static org.junit.jupiter.api.Assertions.*;
import static se.kth.widen.Util.lines;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import se.kth.widen.conflict.ConflictRegion;
import se.kth.widen.conflict.ConflictRegionParser;
import se.kth.widen.conflict.Side;
import se.kth.widen.syntax.ByteRange;

class CoordinateMapperTest {
    // line 0 is bytes 0..1, separator at 2, line 1 is bytes 3..5, separator at 6, line 2 is byte 7
    private static final String TEXT = lines("ab", "cde", "f");
    private static final List<String> LINES = Arrays.asList("ab", "cde", "f");

    @Test
    void originalLineToResolvedLine_shouldAccountForLineCountsOfEarlierRegions() {
        String text =
                lines(
                        "head",
                        "<<<<<<< HEAD",
                        "ours",
                        "=======",
                        "theirs 1",
                        "theirs 2",
                        ">>>>>>> other",
                        "middle",
                        "<<<<<<< HEAD",
                        "=======",
                        "only theirs",
                        ">>>>>>> other",
                        "tail");
        List<ConflictRegion> regions = ConflictRegionParser.parse(text);
        ConflictRegion first = regions.get(0);
        ConflictRegion second = regions.get(1);

        assertEquals(1, CoordinateMapper.originalLineToResolvedLine(first, regions, Side.OURS));
        assertEquals(1, CoordinateMapper.originalLineToResolvedLine(first, regions, Side.THEIRS));
        assertEquals(3, CoordinateMapper.originalLineToResolvedLine(second, regions, Side.OURS));
        assertEquals(4, CoordinateMapper.originalLineToResolvedLine(second, regions, Side.THEIRS));
    }

    @Test
    void originalLineToResolvedLine_shouldCountBlankSideLine() {
        String text = lines("<<<<<<<", "", "=======", ">>>>>>>", "<<<<<<<", "x", "=======", ">>>>>>>");
        List<ConflictRegion> regions = ConflictRegionParser.parse(text);

        assertEquals(
                1, CoordinateMapper.originalLineToResolvedLine(regions.get(1), regions, Side.OURS));
        assertEquals(
                0,
                CoordinateMapper.originalLineToResolvedLine(regions.get(1), regions, Side.THEIRS));
    }

    @ParameterizedTest
    @CsvSource({
        // startLine, lineCount, expected start, expected end
        "0, 1, 0, 2",
        "1, 1, 3, 6",
        "0, 3, 0, 8",
        "1, 2, 3, 8",
        "2, 5, 7, 8",
        "1, 0, 3, 3",
    })
    void lineSpanToByteRange_shouldExcludeTrailingSeparator(
            int startLine, int lineCount, int start, int end) {
        Optional<ByteRange> range = CoordinateMapper.lineSpanToByteRange(LINES, startLine, lineCount);

        assertEquals(Optional.of(ByteRange.of(start, end)), range);
    }

    @Test
    void lineSpanToByteRange_shouldBeEmpty_whenStartLineIsOutOfBounds() {
        assertFalse(CoordinateMapper.lineSpanToByteRange(LINES, 3, 1).isPresent());
        assertFalse(CoordinateMapper.lineSpanToByteRange(LINES, -1, 1).isPresent());
    }

    @Test
    void lineSpanToByteRange_shouldCountUtf8Bytes() {
        List<String> lines = Arrays.asList("é", "x");

        assertEquals(
                Optional.of(ByteRange.of(3, 4)), CoordinateMapper.lineSpanToByteRange(lines, 1, 1));
    }

    @Test
    void byteRangeToLineSpan_shouldMapRangeWithinOneLine() {
        assertEquals(new LineSpan(1, 1), CoordinateMapper.byteRangeToLineSpan(ByteRange.of(3, 6), TEXT));
        assertEquals(new LineSpan(1, 1), CoordinateMapper.byteRangeToLineSpan(ByteRange.of(4, 5), TEXT));
    }

    @Test
    void byteRangeToLineSpan_shouldMapWholeText() {
        assertEquals(new LineSpan(0, 2), CoordinateMapper.byteRangeToLineSpan(ByteRange.of(0, 8), TEXT));
    }

    @Test
    void byteRangeToLineSpan_shouldAttributeStartOnSeparator_toLineItEnds() {
        assertEquals(new LineSpan(0, 1), CoordinateMapper.byteRangeToLineSpan(ByteRange.of(2, 6), TEXT));
    }

    @Test
    void byteRangeToLineSpan_shouldAttributeEndOnNextLineStart_toPreviousLine() {
        assertEquals(new LineSpan(1, 1), CoordinateMapper.byteRangeToLineSpan(ByteRange.of(3, 7), TEXT));
    }

    @Test
    void byteRangeToLineSpan_shouldReportStartAfterEnd_forEmptyRangeAtLineStart() {
        // the end matches on the previous line before the start line is reached
        assertEquals(new LineSpan(0, 1), CoordinateMapper.byteRangeToLineSpan(ByteRange.of(7, 7), TEXT));
        assertEquals(new LineSpan(0, 0), CoordinateMapper.byteRangeToLineSpan(ByteRange.of(3, 3), TEXT));
    }

    @Test
    void byteRangeToLineSpan_shouldDefaultToFirstLine_whenEndIsPastText() {
        assertEquals(new LineSpan(1, 0), CoordinateMapper.byteRangeToLineSpan(ByteRange.of(4, 100), TEXT));
    }

    @Test
    void byteRangeToLineSpan_shouldCountUtf8Bytes() {
        assertEquals(
                new LineSpan(1, 1), CoordinateMapper.byteRangeToLineSpan(ByteRange.of(3, 4), "é\nx"));
    }
}
