package se.kth.widen.conflict;

import java.util.Objects;

/**
 * A parsed conflict region. Line indices are 0-based and refer to the text the region was parsed
 * from.
 */
public class ConflictRegion {
    private final int startLine;
    private final int midLine;
    private final int endLine;
    private final String oursContent;
    private final String theirsContent;

    /**
     * @param startLine Line of the {@code <<<<<<<} marker.
     * @param midLine Line of the {@code =======} marker.
     * @param endLine Line of the {@code >>>>>>>} marker.
     * @param oursContent The lines between the start and mid markers, joined with newlines.
     * @param theirsContent The lines between the mid and end markers, joined with newlines.
     */
    public ConflictRegion(
            int startLine, int midLine, int endLine, String oursContent, String theirsContent) {
        if (!(startLine < midLine && midLine < endLine)) {
            throw new IllegalArgumentException(
                    "marker lines out of order: " + startLine + ", " + midLine + ", " + endLine);
        }
        this.startLine = startLine;
        this.midLine = midLine;
        this.endLine = endLine;
        this.oursContent = oursContent;
        this.theirsContent = theirsContent;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getMidLine() {
        return midLine;
    }

    public int getEndLine() {
        return endLine;
    }

    public String getOursContent() {
        return oursContent;
    }

    public String getTheirsContent() {
        return theirsContent;
    }

    public String getContent(Side side) {
        return side == Side.OURS ? oursContent : theirsContent;
    }

    /**
     * The amount of lines on one side. This is counted from the marker positions, so a side
     * holding a single blank line has one line even though its content is the empty string.
     */
    public int lineCount(Side side) {
        return side == Side.OURS ? midLine - startLine - 1 : endLine - midLine - 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConflictRegion that = (ConflictRegion) o;
        return startLine == that.startLine
                && midLine == that.midLine
                && endLine == that.endLine
                && oursContent.equals(that.oursContent)
                && theirsContent.equals(that.theirsContent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startLine, midLine, endLine, oursContent, theirsContent);
    }

    @Override
    public String toString() {
        return "ConflictRegion(" + startLine + "," + midLine + "," + endLine + ")";
    }
}
