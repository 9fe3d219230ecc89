package io.lintsignal.suppression;

import io.lintsignal.syntax.SyntaxNode;
import io.lintsignal.syntax.SyntaxToken;
import io.lintsignal.syntax.Trivia;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Reads and writes suppression comments of the form {@code // lint-ignore <category>: <reason>}.
 * <p>
 * A comment suppresses findings anchored on the line that follows it: it sits in the leading trivia of
 * the first token of that line. Comments without a reason are ignored.
 */
public final class SuppressionComments {

    public static final String MARKER = "lint-ignore";
    public static final String PLACEHOLDER_REASON = "<explanation>";

    private SuppressionComments() {
    }

    /**
     * Formats a line comment suppressing the given category.
     */
    public static String lineComment(String category, String reason) {
        return "// " + MARKER + " " + category + ": " + reason;
    }

    /**
     * Parses one comment trivia. Line and block comments are both accepted.
     */
    public static Optional<SuppressionComment> parse(Trivia trivia) {
        if (!trivia.isComment()) {
            return Optional.empty();
        }
        String text = trivia.text();
        String body;
        if (text.startsWith("//")) {
            body = text.substring(2);
        } else if (text.startsWith("/*") && text.endsWith("*/") && text.length() >= 4) {
            body = text.substring(2, text.length() - 2);
        } else {
            return Optional.empty();
        }
        body = body.trim();
        if (!body.startsWith(MARKER + " ")) {
            return Optional.empty();
        }
        String rest = body.substring(MARKER.length()).trim();
        int colon = rest.indexOf(':');
        if (colon <= 0) {
            return Optional.empty();
        }
        String category = rest.substring(0, colon).trim();
        String reason = rest.substring(colon + 1).trim();
        if (category.isEmpty() || reason.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new SuppressionComment(category, reason));
    }

    /**
     * All suppression comments in the leading trivia of a token.
     */
    public static List<SuppressionComment> of(SyntaxToken token) {
        return token.leadingTrivia().stream()
                .map(SuppressionComments::parse)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
    }

    /**
     * The first token that starts on the line containing {@code offset}, at or before {@code offset}.
     * Suppression comments are read from, and written into, the leading trivia of this token.
     */
    public static Optional<SyntaxToken> lineStartToken(SyntaxNode root, int offset) {
        String text = root.fullText();
        int relative = Math.min(Math.max(offset - root.offset(), 0), text.length());
        int lineStart = relative;
        while (lineStart > 0 && text.charAt(lineStart - 1) != '\n' && text.charAt(lineStart - 1) != '\r') {
            lineStart--;
        }
        int from = root.offset() + lineStart;
        return root.descendantTokens()
                .filter(token -> {
                    int start = token.textTrimmedRange().start();
                    return start >= from && start <= offset;
                })
                .findFirst();
    }

    /**
     * Returns true if the line holding {@code offset} is preceded by a comment suppressing the given rule category.
     */
    public static boolean isSuppressed(SyntaxNode root, int offset, String ruleCategory) {
        return lineStartToken(root, offset)
                .map(token -> of(token).stream().anyMatch(comment -> comment.suppresses(ruleCategory)))
                .orElse(false);
    }
}
