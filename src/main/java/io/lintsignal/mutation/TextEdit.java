package io.lintsignal.mutation;

import io.lintsignal.syntax.TextRange;

/**
 * A single textual edit: replace the text in {@code range} with {@code replacement}.
 * This is the display form of a {@link BatchMutation}.
 *
 * @param range       Range of the original text being replaced
 * @param replacement Text replacing the range
 */
public record TextEdit(TextRange range, String replacement) {

    private static final TextEdit EMPTY = new TextEdit(TextRange.empty(), "");

    public TextEdit {
        if (range == null) {
            throw new IllegalArgumentException("range cannot be null");
        }
        if (replacement == null) {
            replacement = "";
        }
    }

    /**
     * The no-op edit: empty range at offset zero, empty replacement.
     */
    public static TextEdit empty() {
        return EMPTY;
    }

    public boolean isNoOp() {
        return range.isEmpty() && replacement.isEmpty();
    }

    /**
     * Applies this edit to the source text it was computed against.
     */
    public String applyTo(String source) {
        if (range.end() > source.length()) {
            throw new IllegalArgumentException("Edit range " + range + " exceeds source length " + source.length());
        }
        return source.substring(0, range.start()) + replacement + source.substring(range.end());
    }
}
