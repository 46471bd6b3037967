package se.kth.widen.syntax;

import java.util.Objects;

/** A half-open range {@code [start, end)} of UTF-8 byte offsets. */
public class ByteRange {
    private final int start;
    private final int end;

    public ByteRange(int start, int end) {
        if (start > end) {
            throw new IllegalArgumentException("start " + start + " is after end " + end);
        }
        this.start = start;
        this.end = end;
    }

    public static ByteRange of(int start, int end) {
        return new ByteRange(start, end);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /** @return true if the other range lies within this one, bounds included. */
    public boolean contains(ByteRange other) {
        return start <= other.start && other.end <= end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ByteRange byteRange = (ByteRange) o;
        return start == byteRange.start && end == byteRange.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
