package se.kth.widen.expand;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import se.kth.widen.conflict.ConflictMarkers;
import se.kth.widen.conflict.ConflictRegion;
import se.kth.widen.util.LazyLogger;
import se.kth.widen.util.Pair;

/**
 * Widens a conflict region by moving common lines from around it into both of its sides.
 *
 * <p>The lines taken in are identical for both sides, as they sat outside the markers. Resolving
 * the widened region to either side therefore yields the same text as before.
 */
public class RegionRewriter {
    private static final LazyLogger LOGGER = new LazyLogger(RegionRewriter.class);

    private RegionRewriter() {}

    /**
     * Widen a conflict region of a document.
     *
     * @param documentLines The current lines of the document. Not modified.
     * @param conflict The conflict, with line indices of the document before any rewrite.
     * @param expandBefore Amount of lines to take in before the start marker.
     * @param expandAfter Amount of lines to take in after the end marker.
     * @param runningOffset Net amount of lines added by earlier rewrites of the same document.
     * @return The new document lines and the net amount of lines this rewrite added. If the
     *     conflict cannot be found at its adjusted position, or widening would swallow the marker of
     *     another conflict, the document is returned unchanged with a delta of 0.
     */
    public static Pair<List<String>, Integer> expand(
            List<String> documentLines,
            ConflictRegion conflict,
            int expandBefore,
            int expandAfter,
            int runningOffset) {
        int start = conflict.getStartLine() + runningOffset;
        int mid = conflict.getMidLine() + runningOffset;
        int end = conflict.getEndLine() + runningOffset;

        if (!markersAt(documentLines, start, mid, end)) {
            LOGGER.warn(() -> "Conflict " + conflict + " not found at offset " + runningOffset);
            return unchanged(documentLines);
        }

        int newStart = Math.max(0, start - Math.max(0, expandBefore));
        int newEnd = Math.min(documentLines.size() - 1, end + Math.max(0, expandAfter));

        List<String> prependLines = documentLines.subList(newStart, start);
        List<String> appendLines = documentLines.subList(end + 1, newEnd + 1);
        if (prependLines.stream().anyMatch(ConflictMarkers::isMarker)
                || appendLines.stream().anyMatch(ConflictMarkers::isMarker)) {
            LOGGER.warn(() -> "Widening " + conflict + " would overlap another conflict");
            return unchanged(documentLines);
        }

        List<String> block = new ArrayList<>();
        block.add(documentLines.get(start));
        block.addAll(prependLines);
        block.addAll(documentLines.subList(start + 1, mid));
        block.addAll(appendLines);
        block.add(documentLines.get(mid));
        block.addAll(prependLines);
        block.addAll(documentLines.subList(mid + 1, end));
        block.addAll(appendLines);
        block.add(documentLines.get(end));

        List<String> result = new ArrayList<>(documentLines.size() + block.size());
        result.addAll(documentLines.subList(0, newStart));
        result.addAll(block);
        result.addAll(documentLines.subList(newEnd + 1, documentLines.size()));

        int delta = block.size() - (newEnd - newStart + 1);
        LOGGER.debug(
                () ->
                        "Widened "
                                + conflict
                                + " by "
                                + (start - newStart)
                                + " lines before and "
                                + (newEnd - end)
                                + " lines after");
        return Pair.of(result, delta);
    }

    private static boolean markersAt(List<String> lines, int start, int mid, int end) {
        return start >= 0
                && end < lines.size()
                && lines.get(start).startsWith(ConflictMarkers.START_PREFIX)
                && lines.get(mid).startsWith(ConflictMarkers.MID_PREFIX)
                && lines.get(end).startsWith(ConflictMarkers.END_PREFIX);
    }

    private static Pair<List<String>, Integer> unchanged(List<String> documentLines) {
        return Pair.of(Collections.unmodifiableList(new ArrayList<>(documentLines)), 0);
    }
}
