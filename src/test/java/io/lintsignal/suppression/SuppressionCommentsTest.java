package io.lintsignal.suppression;

import io.lintsignal.markup.MarkupParser;
import io.lintsignal.syntax.SyntaxNode;
import io.lintsignal.syntax.SyntaxToken;
import io.lintsignal.syntax.Trivia;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SuppressionCommentsTest {

    @Test
    void parse_readsLineComment() {
        assertThat(SuppressionComments.parse(Trivia.comment("// lint-ignore lint/a11y/noAutofocus: intended")))
                .hasValue(new SuppressionComment("lint/a11y/noAutofocus", "intended"));
    }

    @Test
    void parse_readsBlockComment() {
        assertThat(SuppressionComments.parse(Trivia.comment("/* lint-ignore lint/a11y: legacy page */")))
                .hasValue(new SuppressionComment("lint/a11y", "legacy page"));
    }

    @Test
    void parse_requiresReason() {
        assertThat(SuppressionComments.parse(Trivia.comment("// lint-ignore lint/a11y/noAutofocus:"))).isEmpty();
        assertThat(SuppressionComments.parse(Trivia.comment("// lint-ignore lint/a11y/noAutofocus"))).isEmpty();
    }

    @Test
    void parse_ignoresOtherComments() {
        assertThat(SuppressionComments.parse(Trivia.comment("// just a note: nothing to see"))).isEmpty();
        assertThat(SuppressionComments.parse(Trivia.comment("// lint-ignored lint/a11y: no"))).isEmpty();
        assertThat(SuppressionComments.parse(Trivia.whitespace("  "))).isEmpty();
    }

    @Test
    void suppresses_matchesExactCategoryOrGroupPrefix() {
        SuppressionComment group = new SuppressionComment("lint/a11y", "reason");

        assertThat(group.suppresses("lint/a11y/noAutofocus")).isTrue();
        assertThat(group.suppresses("lint/a11yExtra/rule")).isFalse();
        assertThat(new SuppressionComment("lint/a11y/noAutofocus", "r").suppresses("lint/a11y/noAutofocus")).isTrue();
    }

    @Test
    void lineComment_roundTripsThroughParse() {
        String comment = SuppressionComments.lineComment("lint/test/rename", SuppressionComments.PLACEHOLDER_REASON);

        assertThat(comment).isEqualTo("// lint-ignore lint/test/rename: <explanation>");
        assertThat(SuppressionComments.parse(Trivia.comment(comment)))
                .map(SuppressionComment::category)
                .hasValue("lint/test/rename");
    }

    @Test
    void lineStartToken_findsFirstTokenOnAnchorLine() throws Exception {
        String source = "<div>\n  <img alt=\"x\" />\n</div>";
        SyntaxNode root = MarkupParser.parse(source);

        Optional<SyntaxToken> token = SuppressionComments.lineStartToken(root, source.indexOf("alt"));

        assertThat(token).map(t -> t.textTrimmedRange().start()).hasValue(source.indexOf("<img"));
    }

    @Test
    void isSuppressed_readsCommentAboveAnchorLine() throws Exception {
        String source = "<div>\n  // lint-ignore lint/a11y: decorative\n  <img alt=\"x\" />\n  <img />\n</div>";
        SyntaxNode root = MarkupParser.parse(source);

        assertThat(SuppressionComments.isSuppressed(root, source.indexOf("alt"), "lint/a11y/useAltText")).isTrue();
        assertThat(SuppressionComments.isSuppressed(root, source.lastIndexOf("<img"), "lint/a11y/useAltText")).isFalse();
        assertThat(SuppressionComments.isSuppressed(root, source.indexOf("<div"), "lint/a11y/useAltText")).isFalse();
    }
}
