package se.kth.widen.conflict;

/** Conflict marker prefixes and the default marker lines written by the line-based merge. */
public final class ConflictMarkers {
    public static final String START_PREFIX = "<<<<<<<";
    public static final String MID_PREFIX = "=======";
    public static final String END_PREFIX = ">>>>>>>";

    public static final String START_CONFLICT = START_PREFIX + " LEFT";
    public static final String MID_CONFLICT = MID_PREFIX;
    public static final String END_CONFLICT = END_PREFIX + " RIGHT";

    private ConflictMarkers() {}

    /** @return true if the line starts with any of the three marker prefixes. */
    public static boolean isMarker(String line) {
        return line.startsWith(START_PREFIX)
                || line.startsWith(MID_PREFIX)
                || line.startsWith(END_PREFIX);
    }

    /**
     * Split text into lines on {@code \n}. Trailing empty lines are kept, so joining the result
     * with {@code \n} gives back the input.
     */
    public static String[] splitLines(String text) {
        return text.split("\n", -1);
    }
}
