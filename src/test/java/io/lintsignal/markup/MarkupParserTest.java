package io.lintsignal.markup;

import io.lintsignal.syntax.SyntaxNode;
import io.lintsignal.syntax.SyntaxToken;
import io.lintsignal.syntax.Trivia;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MarkupParserTest {

    private static MarkupElement firstElement(SyntaxNode root) {
        return root.descendants()
                .flatMap(node -> MarkupElement.cast(node).stream())
                .findFirst()
                .orElseThrow();
    }

    @Test
    void parse_isLossless() throws Exception {
        String source = "// header\n<div class=\"a\" tabIndex={-1}>\n  <img src='x.png' /> /* inline */\n</div>\n";

        assertThat(MarkupParser.parse(source).fullText()).isEqualTo(source);
    }

    @Test
    void parse_selfClosingElement() throws Exception {
        MarkupElement element = firstElement(MarkupParser.parse("<input type=\"text\" disabled />"));

        assertThat(element.isSelfClosing()).isTrue();
        assertThat(element.name()).isEqualTo("input");
        assertThat(element.attributes()).extracting(MarkupAttribute::name).containsExactly("type", "disabled");
        assertThat(element.findAttribute("disabled").orElseThrow().value()).isEmpty();
    }

    @Test
    void parse_nestedElements() throws Exception {
        MarkupElement list = firstElement(MarkupParser.parse("<ul><li /><li><a href=\"#\"></a></li></ul>"));

        assertThat(list.isSelfClosing()).isFalse();
        assertThat(list.children()).extracting(MarkupElement::name).containsExactly("li", "li");
        assertThat(list.children().get(1).children()).extracting(MarkupElement::name).containsExactly("a");
    }

    @Test
    void parse_attributesOwnTheSpaceThatFollowsThem() throws Exception {
        MarkupElement element = firstElement(MarkupParser.parse("<div id=\"a\" role=\"b\" />"));

        assertThat(element.findAttribute("id").orElseThrow().node().fullText()).isEqualTo("id=\"a\" ");
    }

    @Test
    void parse_commentsBecomeLeadingTrivia() throws Exception {
        SyntaxNode root = MarkupParser.parse("<div>\n  // note\n  <b />\n</div>");
        MarkupElement bold = firstElement(root).children().get(0);

        SyntaxToken first = bold.node().firstToken().orElseThrow();
        assertThat(first.leadingTrivia()).extracting(Trivia::kind).containsExactly(
                Trivia.Kind.NEWLINE, Trivia.Kind.WHITESPACE, Trivia.Kind.COMMENT,
                Trivia.Kind.NEWLINE, Trivia.Kind.WHITESPACE);
        assertThat(first.hasLeadingComment()).isTrue();
    }

    @Test
    void staticValue_readsStringsNumbersAndBooleans() throws Exception {
        MarkupElement element = firstElement(MarkupParser.parse(
                "<div a=\"x\" b={'y'} c={3} d={true} e={value} f={-1} />"));

        assertThat(element.staticAttributes()).containsExactly(
                Map.entry("a", "x"),
                Map.entry("b", "y"),
                Map.entry("c", "3"),
                Map.entry("d", "true"));
    }

    @Test
    void numberLikeValue_acceptsSignedNumbers() throws Exception {
        MarkupElement element = firstElement(MarkupParser.parse("<div a={-1} b={+ 2} c={x - 1} d=\"0\" />"));

        assertThat(element.findAttribute("a").flatMap(MarkupAttribute::value).flatMap(AttributeValue::numberLikeValue))
                .hasValue("-1");
        assertThat(element.findAttribute("b").flatMap(MarkupAttribute::value).flatMap(AttributeValue::numberLikeValue))
                .hasValue("+2");
        assertThat(element.findAttribute("c").flatMap(MarkupAttribute::value).flatMap(AttributeValue::numberLikeValue))
                .isEmpty();
        assertThat(element.findAttribute("d").flatMap(MarkupAttribute::value).flatMap(AttributeValue::numberLikeValue))
                .hasValue("0");
    }

    @Test
    void isHtmlElement_onlyForLowerCaseSimpleNames() throws Exception {
        SyntaxNode root = MarkupParser.parse("<div /><Button /><ui.panel /><svg:rect />");

        List<Boolean> html = root.descendants()
                .flatMap(node -> MarkupElement.cast(node).stream())
                .map(MarkupElement::isHtmlElement)
                .toList();
        assertThat(html).containsExactly(true, false, false, false);
    }

    @Test
    void parse_rejectsMismatchedClosingTag() {
        assertThatThrownBy(() -> MarkupParser.parse("<div></span>"))
                .isInstanceOf(MarkupSyntaxException.class)
                .hasMessageContaining("</div>")
                .satisfies(e -> assertThat(((MarkupSyntaxException) e).offset()).isEqualTo(7));
    }

    @Test
    void parse_rejectsTextContent() {
        assertThatThrownBy(() -> MarkupParser.parse("<p>hello</p>"))
                .isInstanceOf(MarkupSyntaxException.class)
                .hasMessageContaining("Text content");
    }

    @Test
    void parse_rejectsUnclosedElement() {
        assertThatThrownBy(() -> MarkupParser.parse("<div><b />"))
                .isInstanceOf(MarkupSyntaxException.class)
                .hasMessageContaining("Unclosed element <div>");
    }

    @Test
    void parse_rejectsUnterminatedString() {
        assertThatThrownBy(() -> MarkupParser.parse("<div id=\"a />"))
                .isInstanceOf(MarkupSyntaxException.class)
                .hasMessageContaining("Unterminated string");
    }

    @Test
    void parse_emptySourceGivesEmptyRoot() throws Exception {
        SyntaxNode root = MarkupParser.parse("");

        assertThat(root.kind()).isEqualTo(MarkupKind.ROOT);
        assertThat(root.textLength()).isZero();
    }
}
