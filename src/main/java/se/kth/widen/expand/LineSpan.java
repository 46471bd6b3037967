package se.kth.widen.expand;

import java.util.Objects;

/** A span of lines, both ends inclusive. */
public class LineSpan {
    private final int startLine;
    private final int endLine;

    public LineSpan(int startLine, int endLine) {
        this.startLine = startLine;
        this.endLine = endLine;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getEndLine() {
        return endLine;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LineSpan lineSpan = (LineSpan) o;
        return startLine == lineSpan.startLine && endLine == lineSpan.endLine;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startLine, endLine);
    }

    @Override
    public String toString() {
        return "LineSpan(" + startLine + ".." + endLine + ")";
    }
}
