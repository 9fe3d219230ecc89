package io.lintsignal.markup;

import io.lintsignal.syntax.SyntaxElement;
import io.lintsignal.syntax.SyntaxNode;
import io.lintsignal.syntax.SyntaxToken;
import io.lintsignal.syntax.TreeBuilder;
import io.lintsignal.syntax.Trivia;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.lintsignal.markup.MarkupKind.*;

/**
 * Hand-written parser for the markup language.
 * <p>
 * Grammar:
 * <pre>
 * root       = element* EOF
 * element    = '&lt;' NAME attribute* ( '/&gt;' | '&gt;' element* '&lt;/' NAME '&gt;' )
 * attribute  = NAME ( '=' ( STRING | '{' expression '}' ) )?
 * expression = ( NUMBER | IDENT | STRING | '+' | '-' | PUNCT )+
 * </pre>
 * Whitespace, line breaks and {@code //} or {@code /* *}{@code /} comments are trivia. A token owns the
 * spaces that follow it on the same line as trailing trivia; everything else before a token, comments
 * included, is its leading trivia. Text content between elements is not supported.
 */
public final class MarkupParser {

    private final String source;
    private final TreeBuilder builder = new TreeBuilder();
    private int pos;

    private MarkupParser(String source) {
        this.source = source;
        this.pos = 0;
    }

    /**
     * Parses markup source into a lossless tree whose text equals the source.
     *
     * @throws MarkupSyntaxException if the source is malformed
     */
    public static SyntaxNode parse(String source) throws MarkupSyntaxException {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        return new MarkupParser(source).parseRoot();
    }

    private SyntaxNode parseRoot() throws MarkupSyntaxException {
        builder.startNode(ROOT);
        builder.startNode(ELEMENT_LIST);
        while (true) {
            int next = skipTrivia(pos);
            if (next >= source.length()) {
                break;
            }
            if (source.charAt(next) != '<') {
                throw error("Expected '<'", next);
            }
            parseElement();
        }
        builder.finishNode();
        builder.element(new SyntaxToken(EOF, 0, leadingTrivia(), "", List.of()));
        builder.finishNode();
        return builder.build();
    }

    private void parseElement() throws MarkupSyntaxException {
        int start = skipTrivia(pos);
        List<SyntaxElement> opening = new ArrayList<>();
        opening.add(token(L_ANGLE, 1));
        SyntaxToken name = name();
        opening.add(name);
        opening.add(parseAttributes());

        char c = peek();
        if (c == '/') {
            opening.add(token(SLASH, 1));
            opening.add(expect('>', R_ANGLE));
            builder.startNode(SELF_CLOSING_ELEMENT);
            opening.forEach(builder::element);
            builder.finishNode();
            return;
        }
        if (c != '>') {
            throw error("Expected '>' or '/>'", skipTrivia(pos));
        }
        opening.add(token(R_ANGLE, 1));

        builder.startNode(ELEMENT);
        builder.element(new SyntaxNode(OPENING_ELEMENT, 0, opening));
        builder.startNode(ELEMENT_LIST);
        while (true) {
            int next = skipTrivia(pos);
            if (next >= source.length()) {
                throw error("Unclosed element <" + name.text() + ">", start);
            }
            if (source.charAt(next) != '<') {
                throw error("Text content is not supported", next);
            }
            if (next + 1 < source.length() && source.charAt(next + 1) == '/') {
                break;
            }
            parseElement();
        }
        builder.finishNode();

        List<SyntaxElement> closing = new ArrayList<>();
        closing.add(token(L_ANGLE, 1));
        closing.add(token(SLASH, 1));
        int closingStart = skipTrivia(pos);
        SyntaxToken closingName = name();
        if (!closingName.text().equals(name.text())) {
            throw error("Expected </" + name.text() + "> but found </" + closingName.text() + ">", closingStart);
        }
        closing.add(closingName);
        closing.add(expect('>', R_ANGLE));
        builder.element(new SyntaxNode(CLOSING_ELEMENT, 0, closing));
        builder.finishNode();
    }

    private SyntaxNode parseAttributes() throws MarkupSyntaxException {
        List<SyntaxElement> attributes = new ArrayList<>();
        while (isNameStart(peek())) {
            attributes.add(parseAttribute());
        }
        return new SyntaxNode(ATTRIBUTE_LIST, 0, attributes);
    }

    private SyntaxNode parseAttribute() throws MarkupSyntaxException {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(name());
        if (peek() == '=') {
            children.add(token(EQ, 1));
            char c = peek();
            if (c == '"' || c == '\'') {
                children.add(new SyntaxNode(STRING_VALUE, 0, List.of(string())));
            } else if (c == '{') {
                children.add(parseExpressionValue());
            } else {
                throw error("Expected a string or an expression after '='", skipTrivia(pos));
            }
        }
        return new SyntaxNode(ATTRIBUTE, 0, children);
    }

    private SyntaxNode parseExpressionValue() throws MarkupSyntaxException {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(token(L_CURLY, 1));
        List<SyntaxElement> expression = new ArrayList<>();
        while (true) {
            int next = skipTrivia(pos);
            if (next >= source.length()) {
                throw error("Unterminated expression", next);
            }
            char c = source.charAt(next);
            if (c == '}') {
                break;
            }
            if (c == '{') {
                throw error("Nested braces are not supported", next);
            }
            expression.add(expressionToken(next, c));
        }
        if (expression.isEmpty()) {
            throw error("Empty expression", skipTrivia(pos));
        }
        children.add(new SyntaxNode(EXPRESSION, 0, expression));
        children.add(token(R_CURLY, 1));
        return new SyntaxNode(EXPRESSION_VALUE, 0, children);
    }

    private SyntaxToken expressionToken(int start, char c) throws MarkupSyntaxException {
        if (Character.isDigit(c)) {
            int end = scanDigits(start);
            if (end + 1 < source.length() && source.charAt(end) == '.' && Character.isDigit(source.charAt(end + 1))) {
                end = scanDigits(end + 1);
            }
            return token(NUMBER, end - start);
        }
        if (isIdentStart(c)) {
            int end = start + 1;
            while (end < source.length() && isIdentPart(source.charAt(end))) {
                end++;
            }
            return token(IDENT, end - start);
        }
        if (c == '"' || c == '\'') {
            return string();
        }
        if (c == '+') {
            return token(PLUS, 1);
        }
        if (c == '-') {
            return token(MINUS, 1);
        }
        return token(PUNCT, 1);
    }

    private int scanDigits(int from) {
        int end = from;
        while (end < source.length() && Character.isDigit(source.charAt(end))) {
            end++;
        }
        return end;
    }

    private SyntaxToken name() throws MarkupSyntaxException {
        int start = skipTrivia(pos);
        int end = start;
        if (end < source.length() && isNameStart(source.charAt(end))) {
            end++;
            while (end < source.length() && isNamePart(source.charAt(end))) {
                end++;
            }
        }
        if (end == start) {
            throw error("Expected a name", start);
        }
        return token(NAME, end - start);
    }

    private SyntaxToken string() throws MarkupSyntaxException {
        int start = skipTrivia(pos);
        char quote = source.charAt(start);
        int close = source.indexOf(quote, start + 1);
        if (close < 0) {
            throw error("Unterminated string", start);
        }
        return token(STRING, close - start + 1);
    }

    private SyntaxToken expect(char expected, MarkupKind kind) throws MarkupSyntaxException {
        if (peek() != expected) {
            throw error("Expected '" + expected + "'", skipTrivia(pos));
        }
        return token(kind, 1);
    }

    /**
     * Consumes leading trivia, {@code length} characters of token text and trailing trivia.
     */
    private SyntaxToken token(MarkupKind kind, int length) throws MarkupSyntaxException {
        List<Trivia> leading = leadingTrivia();
        String text = source.substring(pos, pos + length);
        pos += length;
        List<Trivia> trailing = trailingTrivia();
        return new SyntaxToken(kind, 0, leading, text, trailing);
    }

    private char peek() throws MarkupSyntaxException {
        int next = skipTrivia(pos);
        return next < source.length() ? source.charAt(next) : '\0';
    }

    private int skipTrivia(int from) throws MarkupSyntaxException {
        int index = from;
        Optional<Trivia> trivia = scanTrivia(index);
        while (trivia.isPresent()) {
            index += trivia.get().length();
            trivia = scanTrivia(index);
        }
        return index;
    }

    private List<Trivia> leadingTrivia() throws MarkupSyntaxException {
        List<Trivia> trivia = new ArrayList<>();
        Optional<Trivia> next = scanTrivia(pos);
        while (next.isPresent()) {
            trivia.add(next.get());
            pos += next.get().length();
            next = scanTrivia(pos);
        }
        return trivia;
    }

    private List<Trivia> trailingTrivia() {
        int end = pos;
        while (end < source.length() && isInlineSpace(source.charAt(end))) {
            end++;
        }
        if (end == pos) {
            return List.of();
        }
        Trivia whitespace = Trivia.whitespace(source.substring(pos, end));
        pos = end;
        return List.of(whitespace);
    }

    private Optional<Trivia> scanTrivia(int at) throws MarkupSyntaxException {
        if (at >= source.length()) {
            return Optional.empty();
        }
        char c = source.charAt(at);
        if (isInlineSpace(c)) {
            int end = at;
            while (end < source.length() && isInlineSpace(source.charAt(end))) {
                end++;
            }
            return Optional.of(Trivia.whitespace(source.substring(at, end)));
        }
        if (c == '\r' && at + 1 < source.length() && source.charAt(at + 1) == '\n') {
            return Optional.of(Trivia.newline("\r\n"));
        }
        if (c == '\n' || c == '\r') {
            return Optional.of(Trivia.newline(String.valueOf(c)));
        }
        if (c == '/' && at + 1 < source.length()) {
            char second = source.charAt(at + 1);
            if (second == '/') {
                int end = at + 2;
                while (end < source.length() && source.charAt(end) != '\n' && source.charAt(end) != '\r') {
                    end++;
                }
                return Optional.of(Trivia.comment(source.substring(at, end)));
            }
            if (second == '*') {
                int close = source.indexOf("*/", at + 2);
                if (close < 0) {
                    throw error("Unterminated comment", at);
                }
                return Optional.of(Trivia.comment(source.substring(at, close + 2)));
            }
        }
        return Optional.empty();
    }

    private static boolean isInlineSpace(char c) {
        return c == ' ' || c == '\t';
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isNamePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '-' || c == '.' || c == ':';
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static MarkupSyntaxException error(String message, int offset) {
        return new MarkupSyntaxException(message, offset);
    }
}
