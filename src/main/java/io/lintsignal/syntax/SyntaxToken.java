package io.lintsignal.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Leaf of the syntax tree: a piece of significant text plus the trivia around it.
 *
 * @param kind           Token kind
 * @param offset         Absolute offset of the token, leading trivia included
 * @param leadingTrivia  Whitespace and comments before the token text
 * @param text           The significant token text
 * @param trailingTrivia Whitespace and comments after the token text, up to the end of the line
 */
public record SyntaxToken(
        SyntaxKind kind,
        int offset,
        List<Trivia> leadingTrivia,
        String text,
        List<Trivia> trailingTrivia
) implements SyntaxElement {

    public SyntaxToken {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        leadingTrivia = leadingTrivia != null ? List.copyOf(leadingTrivia) : List.of();
        trailingTrivia = trailingTrivia != null ? List.copyOf(trailingTrivia) : List.of();
    }

    /**
     * Creates a token without trivia at offset zero. Offsets are assigned when the token is placed in a tree.
     */
    public static SyntaxToken of(SyntaxKind kind, String text) {
        return new SyntaxToken(kind, 0, List.of(), text, List.of());
    }

    public int leadingTriviaLength() {
        return triviaLength(leadingTrivia);
    }

    public int trailingTriviaLength() {
        return triviaLength(trailingTrivia);
    }

    @Override
    public int textLength() {
        return leadingTriviaLength() + text.length() + trailingTriviaLength();
    }

    @Override
    public String fullText() {
        StringBuilder sb = new StringBuilder(textLength());
        leadingTrivia.forEach(t -> sb.append(t.text()));
        sb.append(text);
        trailingTrivia.forEach(t -> sb.append(t.text()));
        return sb.toString();
    }

    @Override
    public String trimmedText() {
        return text;
    }

    @Override
    public TextRange textTrimmedRange() {
        int start = offset + leadingTriviaLength();
        return TextRange.of(start, start + text.length());
    }

    @Override
    public SyntaxToken withOffset(int offset) {
        return new SyntaxToken(kind, offset, leadingTrivia, text, trailingTrivia);
    }

    public SyntaxToken withLeadingTrivia(List<Trivia> trivia) {
        return new SyntaxToken(kind, offset, trivia, text, trailingTrivia);
    }

    public SyntaxToken withTrailingTrivia(List<Trivia> trivia) {
        return new SyntaxToken(kind, offset, leadingTrivia, text, trivia);
    }

    /**
     * Returns a copy with the given trivia appended after the existing leading trivia,
     * i.e. directly in front of the token text.
     */
    public SyntaxToken appendLeadingTrivia(List<Trivia> trivia) {
        List<Trivia> merged = new ArrayList<>(leadingTrivia);
        merged.addAll(trivia);
        return withLeadingTrivia(merged);
    }

    public boolean hasLeadingComment() {
        return leadingTrivia.stream().anyMatch(Trivia::isComment);
    }

    private static int triviaLength(List<Trivia> trivia) {
        int length = 0;
        for (Trivia t : trivia) {
            length += t.length();
        }
        return length;
    }

    @Override
    public String toString() {
        return kind.name() + "@" + textTrimmedRange() + " \"" + text + "\"";
    }
}
