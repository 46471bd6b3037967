package se.kth.widen.conflict;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Finds well-formed conflict regions in raw text. */
public class ConflictRegionParser {

    private ConflictRegionParser() {}

    /**
     * Parse the conflict regions of a text. A start marker without a following mid marker and end
     * marker is treated as plain text.
     *
     * @param text Text that may contain conflict markers.
     * @return The regions in document order. Regions never overlap.
     */
    public static List<ConflictRegion> parse(String text) {
        String[] lines = ConflictMarkers.splitLines(text);
        List<ConflictRegion> regions = new ArrayList<>();

        int i = 0;
        while (i < lines.length) {
            if (!lines[i].startsWith(ConflictMarkers.START_PREFIX)) {
                i++;
                continue;
            }

            int startLine = i;
            int midLine = indexOfPrefix(lines, ConflictMarkers.MID_PREFIX, startLine + 1);
            int endLine =
                    midLine == -1
                            ? -1
                            : indexOfPrefix(lines, ConflictMarkers.END_PREFIX, midLine + 1);
            if (endLine == -1) {
                i++;
                continue;
            }

            regions.add(
                    new ConflictRegion(
                            startLine,
                            midLine,
                            endLine,
                            join(lines, startLine + 1, midLine),
                            join(lines, midLine + 1, endLine)));
            i = endLine + 1;
        }

        return regions;
    }

    /** @return The amount of well-formed conflict regions in the text. */
    public static int countConflicts(String text) {
        return parse(text).size();
    }

    private static int indexOfPrefix(String[] lines, String prefix, int from) {
        for (int j = from; j < lines.length; j++) {
            if (lines[j].startsWith(prefix)) {
                return j;
            }
        }
        return -1;
    }

    private static String join(String[] lines, int from, int to) {
        return String.join("\n", Arrays.asList(lines).subList(from, to));
    }
}
