package io.lintsignal.syntax;

/**
 * An element of a lossless syntax tree: either an interior {@link SyntaxNode} or a leaf {@link SyntaxToken}.
 * <p>
 * Elements are immutable and carry their absolute offset in the source they were built from.
 * Concatenating {@link #fullText()} of all children of a node reproduces the node's text exactly,
 * trivia included.
 */
public sealed interface SyntaxElement permits SyntaxNode, SyntaxToken {

    SyntaxKind kind();

    /**
     * Absolute offset of the first character of this element, leading trivia included.
     */
    int offset();

    /**
     * Length of the full text, trivia included.
     */
    int textLength();

    /**
     * The source text of this element, trivia included.
     */
    String fullText();

    /**
     * The source text of this element without the leading trivia of its first token
     * and the trailing trivia of its last token.
     */
    String trimmedText();

    /**
     * Range covered by this element, trivia included.
     */
    default TextRange textRange() {
        return TextRange.of(offset(), offset() + textLength());
    }

    /**
     * Range covered by this element, outer trivia excluded.
     */
    TextRange textTrimmedRange();

    /**
     * Returns a copy of this element positioned at the given offset. Children are re-positioned too.
     */
    SyntaxElement withOffset(int offset);
}
