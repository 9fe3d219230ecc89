package io.lintsignal.syntax;

/**
 * A half-open range of offsets in source text, from start (inclusive) to end (exclusive).
 *
 * @param start Offset of the first character in the range
 * @param end   Offset one past the last character in the range
 */
public record TextRange(int start, int end) {

    /**
     * Compact constructor with validation.
     */
    public TextRange {
        if (start < 0) {
            throw new IllegalArgumentException("start cannot be negative: " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException("end " + end + " is before start " + start);
        }
    }

    /**
     * Creates a range covering {@code [start, end)}.
     */
    public static TextRange of(int start, int end) {
        return new TextRange(start, end);
    }

    /**
     * Creates an empty range positioned at the given offset.
     */
    public static TextRange at(int offset) {
        return new TextRange(offset, offset);
    }

    /**
     * The empty range at offset zero.
     */
    public static TextRange empty() {
        return new TextRange(0, 0);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * Returns true if the offset lies inside this range. The end offset is excluded.
     */
    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    /**
     * Returns true if the other range lies entirely inside this one.
     */
    public boolean contains(TextRange other) {
        return other.start >= start && other.end <= end;
    }

    /**
     * Returns the smallest range covering both this range and the other one.
     */
    public TextRange cover(TextRange other) {
        return new TextRange(Math.min(start, other.start), Math.max(end, other.end));
    }

    /**
     * Extracts the text covered by this range.
     */
    public String extract(String source) {
        return source.substring(start, end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
