package se.kth.widen.conflict;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Resolves every conflict of a text to one side. The result is only used to probe whether that
 * side parses.
 */
public class VersionResolver {

    private VersionResolver() {}

    /**
     * @param text The text the regions were parsed from.
     * @param regions The regions of the text, in document order.
     * @param side The side to keep.
     * @return The text with all markers removed and only the chosen side of each region kept.
     */
    public static String resolve(String text, List<ConflictRegion> regions, Side side) {
        String[] lines = ConflictMarkers.splitLines(text);
        List<String> result = new ArrayList<>(lines.length);

        Iterator<ConflictRegion> it = regions.iterator();
        ConflictRegion next = it.hasNext() ? it.next() : null;
        boolean inConflict = false;
        boolean inTheirsHalf = false;

        for (int i = 0; i < lines.length; i++) {
            if (next != null && i == next.getStartLine()) {
                inConflict = true;
                inTheirsHalf = false;
            } else if (inConflict && i == next.getMidLine()) {
                inTheirsHalf = true;
            } else if (inConflict && i == next.getEndLine()) {
                inConflict = false;
                inTheirsHalf = false;
                next = it.hasNext() ? it.next() : null;
            } else if (!inConflict || inTheirsHalf == (side == Side.THEIRS)) {
                result.add(lines[i]);
            }
        }

        return String.join("\n", result);
    }
}
