package io.lintsignal.markup;

/**
 * Thrown when markup source cannot be parsed.
 */
public class MarkupSyntaxException extends Exception {

    private final int offset;

    public MarkupSyntaxException(String message, int offset) {
        super(message + " at offset " + offset);
        this.offset = offset;
    }

    /**
     * Offset in the source where parsing failed.
     */
    public int offset() {
        return offset;
    }
}
