package se.kth.widen.expand;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import se.kth.widen.conflict.ConflictMarkers;
import se.kth.widen.conflict.ConflictRegion;
import se.kth.widen.conflict.Side;
import se.kth.widen.syntax.ByteRange;

/**
 * Translates between line indices of the conflicted text, line indices of a resolved text and byte
 * offsets. Byte offsets count UTF-8 bytes, with one byte for each line separator.
 */
public class CoordinateMapper {

    private CoordinateMapper() {}

    /**
     * Compute the line at which the content of a conflict starts in the text resolved to one side.
     * Every earlier region contributes the line count of its chosen side instead of its marker
     * bounded span.
     *
     * @param conflict The target conflict.
     * @param regions All regions of the text, in document order.
     * @param side The side the text was resolved to.
     * @return A 0-based line index in the resolved text.
     */
    public static int originalLineToResolvedLine(
            ConflictRegion conflict, List<ConflictRegion> regions, Side side) {
        int resolvedLine = 0;
        int originalCursor = 0;

        for (ConflictRegion region : regions) {
            if (region.getStartLine() >= conflict.getStartLine()) {
                break;
            }
            resolvedLine += region.getStartLine() - originalCursor;
            resolvedLine += region.lineCount(side);
            originalCursor = region.getEndLine() + 1;
        }

        return resolvedLine + conflict.getStartLine() - originalCursor;
    }

    /**
     * Convert a span of lines to a byte range. The range ends before the line separator of the last
     * included line. A line count reaching past the last line is clamped.
     *
     * @return The byte range, or an empty optional if {@code startLine} is out of bounds.
     */
    public static Optional<ByteRange> lineSpanToByteRange(
            List<String> lines, int startLine, int lineCount) {
        if (startLine < 0 || startLine >= lines.size()) {
            return Optional.empty();
        }

        int startByte = 0;
        for (int i = 0; i < startLine; i++) {
            startByte += utf8Length(lines.get(i)) + 1;
        }

        int endByte = startByte;
        int endLine = Math.min(startLine + lineCount, lines.size());
        for (int i = startLine; i < endLine; i++) {
            endByte += utf8Length(lines.get(i)) + 1;
        }

        if (endByte > 0) {
            endByte -= 1;
        }
        return Optional.of(new ByteRange(startByte, Math.max(startByte, endByte)));
    }

    /**
     * Convert a byte range to the span of lines it touches. A position equal to the offset of a
     * line separator belongs to the line the separator ends, and the end of the range may also
     * equal the offset just past that separator. Positions that match no line map to line 0.
     *
     * @param range A byte range in the text.
     * @param text The text.
     * @return The lines containing the start and the end of the range.
     */
    public static LineSpan byteRangeToLineSpan(ByteRange range, String text) {
        String[] lines = ConflictMarkers.splitLines(text);
        int currentByte = 0;
        int startLine = 0;
        int endLine = 0;

        for (int i = 0; i < lines.length; i++) {
            int lineEndByte = currentByte + utf8Length(lines[i]);

            if (currentByte <= range.getStart() && range.getStart() <= lineEndByte) {
                startLine = i;
            }
            if (currentByte <= range.getEnd() && range.getEnd() <= lineEndByte + 1) {
                endLine = i;
                break;
            }

            currentByte = lineEndByte + 1;
        }

        return new LineSpan(startLine, endLine);
    }

    static int utf8Length(String line) {
        return line.getBytes(StandardCharsets.UTF_8).length;
    }
}
