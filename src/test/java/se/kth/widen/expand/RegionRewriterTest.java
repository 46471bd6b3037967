package se.kth.widen.expand;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import se.kth.widen.conflict.ConflictRegion;
import se.kth.widen.conflict.ConflictRegionParser;
import se.kth.widen.util.Pair;

class RegionRewriterTest {
    private static final List<String> DOCUMENT =
            Arrays.asList(
                    "a", "b", "<<<<<<< HEAD", "ours", "=======", "theirs", ">>>>>>> other", "c",
                    "d");

    private static ConflictRegion onlyRegion(List<String> lines) {
        return ConflictRegionParser.parse(String.join("\n", lines)).get(0);
    }

    @Test
    void expand_shouldCopySurroundingLinesIntoBothSides() {
        Pair<List<String>, Integer> result =
                RegionRewriter.expand(DOCUMENT, onlyRegion(DOCUMENT), 1, 1, 0);

        assertEquals(
                Arrays.asList(
                        "a",
                        "<<<<<<< HEAD",
                        "b",
                        "ours",
                        "c",
                        "=======",
                        "b",
                        "theirs",
                        "c",
                        ">>>>>>> other",
                        "d"),
                result.first);
        assertEquals(2, (int) result.second);
    }

    @Test
    void expand_shouldClampToDocumentBounds() {
        Pair<List<String>, Integer> result =
                RegionRewriter.expand(DOCUMENT, onlyRegion(DOCUMENT), 10, 10, 0);

        assertEquals(
                Arrays.asList(
                        "<<<<<<< HEAD",
                        "a",
                        "b",
                        "ours",
                        "c",
                        "d",
                        "=======",
                        "a",
                        "b",
                        "theirs",
                        "c",
                        "d",
                        ">>>>>>> other"),
                result.first);
        assertEquals(4, (int) result.second);
    }

    @Test
    void expand_shouldOnlyWidenBefore_whenExpandAfterIsZero() {
        Pair<List<String>, Integer> result =
                RegionRewriter.expand(DOCUMENT, onlyRegion(DOCUMENT), 2, 0, 0);

        assertEquals(
                Arrays.asList(
                        "<<<<<<< HEAD", "a", "b", "ours", "=======", "a", "b", "theirs",
                        ">>>>>>> other", "c", "d"),
                result.first);
        assertEquals(2, (int) result.second);
    }

    @Test
    void expand_shouldApplyRunningOffset() {
        ConflictRegion region = onlyRegion(DOCUMENT);
        List<String> shifted =
                Arrays.asList(
                        "x", "y", "a", "b", "<<<<<<< HEAD", "ours", "=======", "theirs",
                        ">>>>>>> other", "c", "d");

        Pair<List<String>, Integer> result = RegionRewriter.expand(shifted, region, 0, 1, 2);

        assertEquals(
                Arrays.asList(
                        "x", "y", "a", "b", "<<<<<<< HEAD", "ours", "c", "=======", "theirs", "c",
                        ">>>>>>> other", "d"),
                result.first);
        assertEquals(1, (int) result.second);
    }

    @Test
    void expand_shouldLeaveDocumentUnchanged_whenMarkersAreNotAtAdjustedPosition() {
        Pair<List<String>, Integer> result =
                RegionRewriter.expand(DOCUMENT, onlyRegion(DOCUMENT), 1, 1, 1);

        assertEquals(DOCUMENT, result.first);
        assertEquals(0, (int) result.second);
    }

    @Test
    void expand_shouldLeaveDocumentUnchanged_whenAdjustedPositionIsOutOfRange() {
        Pair<List<String>, Integer> result =
                RegionRewriter.expand(DOCUMENT, onlyRegion(DOCUMENT), 1, 1, 5);

        assertEquals(DOCUMENT, result.first);
        assertEquals(0, (int) result.second);
    }

    @Test
    void expand_shouldLeaveDocumentUnchanged_whenWideningWouldSwallowAnotherConflict() {
        List<String> document =
                Arrays.asList(
                        "<<<<<<<", "1", "=======", "2", ">>>>>>>", "common", "<<<<<<<", "3",
                        "=======", "4", ">>>>>>>");
        ConflictRegion second = ConflictRegionParser.parse(String.join("\n", document)).get(1);

        Pair<List<String>, Integer> result = RegionRewriter.expand(document, second, 2, 0, 0);

        assertEquals(document, result.first);
        assertEquals(0, (int) result.second);
    }

    @Test
    void expand_shouldNotModifyInput() {
        List<String> before = Arrays.asList(DOCUMENT.toArray(new String[0]));

        RegionRewriter.expand(DOCUMENT, onlyRegion(DOCUMENT), 1, 1, 0);

        assertEquals(before, DOCUMENT);
    }
}
