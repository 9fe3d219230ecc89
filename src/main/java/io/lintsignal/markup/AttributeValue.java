package io.lintsignal.markup;

import io.lintsignal.syntax.SyntaxNode;
import io.lintsignal.syntax.SyntaxToken;

import java.util.List;
import java.util.Optional;

/**
 * Value of an attribute: a quoted string or a braced expression.
 */
public sealed interface AttributeValue permits AttributeValue.Text, AttributeValue.Expression {

    SyntaxNode node();

    /**
     * The value when it is known without evaluation: string contents, a number, or {@code true}/{@code false}.
     */
    Optional<String> staticValue();

    /**
     * The value as text when it looks like a number: a string's contents, a number literal,
     * or a number with a leading sign. Whether the text parses as a number is up to the caller.
     */
    Optional<String> numberLikeValue();

    static Optional<AttributeValue> cast(SyntaxNode node) {
        if (node.kind() == MarkupKind.STRING_VALUE) {
            return Optional.of(new Text(node));
        }
        if (node.kind() == MarkupKind.EXPRESSION_VALUE) {
            return Optional.of(new Expression(node));
        }
        return Optional.empty();
    }

    /**
     * {@code "value"} or {@code 'value'}.
     */
    record Text(SyntaxNode node) implements AttributeValue {

        public String innerText() {
            return node.childToken(MarkupKind.STRING).map(token -> unquote(token.text())).orElse("");
        }

        @Override
        public Optional<String> staticValue() {
            return Optional.of(innerText());
        }

        @Override
        public Optional<String> numberLikeValue() {
            return Optional.of(innerText());
        }
    }

    /**
     * {@code {expression}}.
     */
    record Expression(SyntaxNode node) implements AttributeValue {

        public List<SyntaxToken> tokens() {
            return node.childNode(MarkupKind.EXPRESSION)
                    .map(SyntaxNode::childTokens)
                    .orElse(List.of());
        }

        @Override
        public Optional<String> staticValue() {
            List<SyntaxToken> tokens = tokens();
            if (tokens.size() != 1) {
                return Optional.empty();
            }
            SyntaxToken token = tokens.get(0);
            if (token.kind() == MarkupKind.STRING) {
                return Optional.of(unquote(token.text()));
            }
            if (token.kind() == MarkupKind.NUMBER) {
                return Optional.of(token.text());
            }
            if (token.kind() == MarkupKind.IDENT && (token.text().equals("true") || token.text().equals("false"))) {
                return Optional.of(token.text());
            }
            return Optional.empty();
        }

        @Override
        public Optional<String> numberLikeValue() {
            List<SyntaxToken> tokens = tokens();
            if (tokens.size() == 1) {
                SyntaxToken token = tokens.get(0);
                if (token.kind() == MarkupKind.STRING) {
                    return Optional.of(unquote(token.text()));
                }
                if (token.kind() == MarkupKind.NUMBER) {
                    return Optional.of(token.text());
                }
                return Optional.empty();
            }
            if (tokens.size() == 2
                    && (tokens.get(0).kind() == MarkupKind.PLUS || tokens.get(0).kind() == MarkupKind.MINUS)
                    && tokens.get(1).kind() == MarkupKind.NUMBER) {
                return Optional.of(tokens.get(0).text() + tokens.get(1).text());
            }
            return Optional.empty();
        }
    }

    private static String unquote(String quoted) {
        return quoted.length() >= 2 ? quoted.substring(1, quoted.length() - 1) : quoted;
    }
}
