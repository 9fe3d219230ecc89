package io.lintsignal.markup;

import io.lintsignal.mutation.BatchMutation;
import io.lintsignal.suppression.SuppressionAction;
import io.lintsignal.suppression.SuppressionComments;
import io.lintsignal.suppression.SuppressionEdit;
import io.lintsignal.syntax.SyntaxNode;
import io.lintsignal.syntax.SyntaxToken;
import io.lintsignal.syntax.TextRange;
import io.lintsignal.syntax.Trivia;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Suppresses a finding in markup by putting a {@code // lint-ignore <category>: <explanation>} line
 * above the line the finding starts on, in front of that line's first token and indented like it.
 */
public final class MarkupSuppressionAction implements SuppressionAction {

    @Override
    public Optional<SuppressionEdit> produce(SyntaxNode root, TextRange anchorRange, String ruleCategory) {
        Optional<SyntaxToken> anchor = SuppressionComments.lineStartToken(root, anchorRange.start());
        if (anchor.isEmpty()) {
            return Optional.empty();
        }
        SyntaxToken token = anchor.get();

        String text = root.fullText();
        int tokenStart = token.textTrimmedRange().start() - root.offset();
        int lineStart = text.lastIndexOf('\n', tokenStart - 1) + 1;
        String linePrefix = text.substring(lineStart, tokenStart);
        String indent = leadingWhitespace(linePrefix);

        List<Trivia> inserted = new ArrayList<>();
        if (!linePrefix.isBlank()) {
            // the tail of a multi-line token or comment precedes the token on its line
            inserted.add(Trivia.newline("\n"));
            addIndent(inserted, indent);
        }
        inserted.add(Trivia.comment(SuppressionComments.lineComment(ruleCategory, SuppressionComments.PLACEHOLDER_REASON)));
        inserted.add(Trivia.newline("\n"));
        addIndent(inserted, indent);

        BatchMutation mutation = BatchMutation.begin(root)
                .replaceToken(token, token.appendLeadingTrivia(inserted));
        return Optional.of(new SuppressionEdit(mutation, "Suppress rule " + ruleCategory));
    }

    private static void addIndent(List<Trivia> trivia, String indent) {
        if (!indent.isEmpty()) {
            trivia.add(Trivia.whitespace(indent));
        }
    }

    private static String leadingWhitespace(String line) {
        int end = 0;
        while (end < line.length() && (line.charAt(end) == ' ' || line.charAt(end) == '\t')) {
            end++;
        }
        return line.substring(0, end);
    }
}
