package io.lintsignal.syntax;

/**
 * Non-semantic text attached to a token: whitespace, line breaks and comments.
 *
 * @param kind What sort of trivia this is
 * @param text The exact source text
 */
public record Trivia(Kind kind, String text) {

    public enum Kind {
        WHITESPACE,
        NEWLINE,
        COMMENT
    }

    public Trivia {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("trivia text cannot be null or empty");
        }
    }

    public static Trivia whitespace(String text) {
        return new Trivia(Kind.WHITESPACE, text);
    }

    public static Trivia newline(String text) {
        return new Trivia(Kind.NEWLINE, text);
    }

    public static Trivia comment(String text) {
        return new Trivia(Kind.COMMENT, text);
    }

    public boolean isComment() {
        return kind == Kind.COMMENT;
    }

    public int length() {
        return text.length();
    }
}
