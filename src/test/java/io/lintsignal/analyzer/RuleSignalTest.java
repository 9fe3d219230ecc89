package io.lintsignal.analyzer;

import io.lintsignal.config.AnalyzerConfig;
import io.lintsignal.config.AnalyzerOptions;
import io.lintsignal.config.RuleLevel;
import io.lintsignal.config.RuleSettings;
import io.lintsignal.diagnostic.Severity;
import io.lintsignal.markup.MarkupElement;
import io.lintsignal.markup.MarkupParser;
import io.lintsignal.markup.MarkupSuppressionAction;
import io.lintsignal.mutation.TextEdit;
import io.lintsignal.rule.FixKind;
import io.lintsignal.rule.RuleKey;
import io.lintsignal.rule.ServiceBag;
import io.lintsignal.suppression.SuppressionAction;
import io.lintsignal.syntax.SyntaxNode;
import io.lintsignal.syntax.TextRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class RuleSignalTest {

    private static final String SOURCE = "<div>\n  <target id=\"x\" />\n</div>\n";
    private static final RuleKey KEY = RuleKey.of("test", "rename");

    private SyntaxNode root;
    private MarkupElement element;
    private StubRule rule;

    @BeforeEach
    void setUp() throws Exception {
        root = MarkupParser.parse(SOURCE);
        element = root.descendants()
                .flatMap(node -> MarkupElement.cast(node).stream())
                .filter(e -> e.name().equals("target"))
                .findFirst()
                .orElseThrow();
        rule = StubRule.named("test", "rename");
    }

    private RuleSignal<MarkupElement, String, StubRule.Options> signal(AnalyzerConfig config) {
        return signal(config, new MarkupSuppressionAction(), ServiceBag.empty());
    }

    private RuleSignal<MarkupElement, String, StubRule.Options> signal(AnalyzerConfig config,
                                                                       SuppressionAction suppressionAction,
                                                                       ServiceBag services) {
        AnalyzerOptions options = new AnalyzerOptions(Path.of("index.jsx"), config);
        return new RuleSignal<>(rule, root, element, "target", services, suppressionAction, options);
    }

    private static AnalyzerConfig withFix(FixKind fix) {
        return AnalyzerConfig.builder().rule(KEY, RuleSettings.empty().withFix(fix)).build();
    }

    @Test
    void actions_unconfigured_yieldsFixThenSuppression() {
        List<AnalyzerAction> actions = signal(AnalyzerConfig.empty()).actions().drain();

        assertThat(actions).hasSize(2);
        assertThat(actions.get(0).category()).isEqualTo(ActionCategory.QUICK_FIX);
        assertThat(actions.get(0).applicability()).isEqualTo(Applicability.MAYBE_INCORRECT);
        assertThat(actions.get(1).category()).isEqualTo(ActionCategory.SUPPRESSION);
        assertThat(actions.get(1).applicability()).isEqualTo(Applicability.ALWAYS);
    }

    @Test
    void actions_fixKindNone_yieldsNothing() {
        AnalyzerActionIterator actions = signal(withFix(FixKind.NONE)).actions();

        assertThat(actions.remaining()).isZero();
        assertThat(actions.hasNext()).isFalse();
    }

    @Test
    void actions_fixKindSafe_forcesAlwaysApplicability() {
        List<AnalyzerAction> actions = signal(withFix(FixKind.SAFE)).actions().drain();

        assertThat(actions).extracting(AnalyzerAction::applicability)
                .containsExactly(Applicability.ALWAYS, Applicability.ALWAYS);
        assertThat(actions.get(0).category()).isEqualTo(ActionCategory.QUICK_FIX);
    }

    @Test
    void actions_fixKindUnsafe_forcesMaybeIncorrectButNotOnSuppression() {
        rule.declaring(Applicability.ALWAYS);

        List<AnalyzerAction> actions = signal(withFix(FixKind.UNSAFE)).actions().drain();

        assertThat(actions).extracting(AnalyzerAction::applicability)
                .containsExactly(Applicability.MAYBE_INCORRECT, Applicability.ALWAYS);
    }

    @Test
    void actions_onlyRange_yieldsSuppressionOnly() {
        rule.withoutAction();

        List<AnalyzerAction> actions = signal(AnalyzerConfig.empty()).actions().drain();

        assertThat(actions).singleElement()
                .satisfies(action -> assertThat(action.isSuppression()).isTrue());
    }

    @Test
    void actions_neitherFixNorRange_yieldsNothing() {
        rule.withoutAction().withoutRange();

        assertThat(signal(AnalyzerConfig.empty()).actions().drain()).isEmpty();
    }

    @Test
    void actions_suppressionNotOffered_yieldsFixOnly() {
        List<AnalyzerAction> actions = signal(AnalyzerConfig.empty(), SuppressionAction.none(), ServiceBag.empty())
                .actions().drain();

        assertThat(actions).singleElement()
                .satisfies(action -> assertThat(action.category()).isEqualTo(ActionCategory.QUICK_FIX));
    }

    @Test
    void actions_tagBothActionsWithRuleKey() {
        List<AnalyzerAction> actions = signal(AnalyzerConfig.empty()).actions().drain();

        assertThat(actions).extracting(AnalyzerAction::ruleKey).containsOnly(Optional.of(KEY));
    }

    @Test
    void actions_suppressionInsertsIgnoreComment() {
        AnalyzerAction suppression = signal(AnalyzerConfig.empty()).actions().drain().get(1);

        assertThat(suppression.message()).isEqualTo("Suppress rule lint/test/rename");
        assertThat(suppression.mutation().commit().fullText()).isEqualTo(
                "<div>\n  // lint-ignore lint/test/rename: <explanation>\n  <target id=\"x\" />\n</div>\n");
    }

    @Test
    void actions_useConfiguredOptions() {
        AnalyzerConfig config = AnalyzerConfig.builder()
                .rule(KEY, RuleSettings.empty().withOptions(Map.of("replacement", "section")))
                .build();

        AnalyzerAction fix = signal(config).actions().next();

        assertThat(fix.message()).isEqualTo("Rename to section");
        assertThat(fix.mutation().commit().fullText()).contains("<section id=\"x\" />");
    }

    @Test
    void accessors_areIdempotent() {
        RuleSignal<MarkupElement, String, StubRule.Options> signal = signal(AnalyzerConfig.empty());
        rule.withTransform();

        assertThat(signal.diagnostic()).isEqualTo(signal.diagnostic());
        assertThat(signal.actions().drain()).isEqualTo(signal.actions().drain());
        assertThat(signal.transformations().drain()).isEqualTo(signal.transformations().drain());
    }

    @Test
    void diagnostic_wrapsRuleDiagnostic() {
        AnalyzerDiagnostic diagnostic = signal(AnalyzerConfig.empty()).diagnostic().orElseThrow();

        assertThat(diagnostic.message()).isEqualTo("Found <target>");
        assertThat(diagnostic.category()).hasValue("lint/test/rename");
        assertThat(diagnostic.range()).hasValue(TextRange.of(8, 25));
        assertThat(diagnostic.severity()).isEqualTo(Severity.ERROR);
    }

    @Test
    void diagnostic_usesConfiguredLevelAsSeverity() {
        AnalyzerConfig config = AnalyzerConfig.builder()
                .rule(KEY, RuleSettings.empty().withLevel(RuleLevel.WARN))
                .build();

        assertThat(signal(config).diagnostic()).map(AnalyzerDiagnostic::severity).hasValue(Severity.WARNING);
    }

    @Test
    void missingService_yieldsNoResults() {
        rule.requiring(RuleSignalTest.class).withTransform();
        RuleSignal<MarkupElement, String, StubRule.Options> signal = signal(AnalyzerConfig.empty());

        assertThat(signal.diagnostic()).isEmpty();
        assertThat(signal.actions().remaining()).isZero();
        assertThat(signal.transformations().remaining()).isZero();
    }

    @Test
    void requiredService_present_runsHooks() {
        rule.requiring(RuleSignalTest.class);
        ServiceBag services = ServiceBag.of(RuleSignalTest.class, this);

        assertThat(signal(AnalyzerConfig.empty(), new MarkupSuppressionAction(), services).diagnostic()).isPresent();
    }

    @Test
    void transformations_emptyWithoutTransformHook() {
        assertThat(signal(AnalyzerConfig.empty()).transformations().drain()).isEmpty();
    }

    @Test
    void transformations_wrapRuleTransform() {
        rule.withTransform();

        List<AnalyzerTransformation> transformations = signal(AnalyzerConfig.empty()).transformations().drain();

        assertThat(transformations).singleElement()
                .satisfies(t -> assertThat(t.mutation().commit().fullText()).contains("<span id=\"x\" />"));
    }

    @Test
    void intoCodeSuggestionAdvices_reducesMutationToOneEdit() {
        List<CodeSuggestionAdvice> advices = signal(AnalyzerConfig.empty()).actions()
                .intoCodeSuggestionAdvices()
                .drain();

        assertThat(advices).hasSize(2);
        assertThat(advices.get(0).applicability()).isEqualTo(Applicability.MAYBE_INCORRECT);
        assertThat(advices.get(0).suggestion()).isEqualTo(new TextEdit(TextRange.of(9, 16), "span "));
    }

    @Test
    void intoCodeActions_carryRuleKeyAndCategory() {
        List<CodeSuggestionItem> items = signal(AnalyzerConfig.empty()).actions().intoCodeActions().drain();

        assertThat(items).extracting(CodeSuggestionItem::category)
                .containsExactly(ActionCategory.QUICK_FIX, ActionCategory.SUPPRESSION);
        assertThat(items.get(0).ruleKey()).hasValue(KEY);
        assertThat(items.get(0).suggestion().replacement()).isEqualTo("span ");
        assertThat(items.get(0).suggestion().labels()).isEmpty();
    }

    @Test
    void optionsThatDoNotFit_yieldNoResults() {
        rule.withTransform();
        AnalyzerConfig config = AnalyzerConfig.builder()
                .rule(KEY, RuleSettings.empty().withOptions(Map.of("bogus", 1)))
                .build();
        RuleSignal<MarkupElement, String, StubRule.Options> signal = signal(config);

        assertThat(signal.diagnostic()).isEmpty();
        assertThat(signal.actions().remaining()).isZero();
        assertThat(signal.transformations().remaining()).isZero();
    }

    @Test
    void actions_mutationCannotBeAlteredByCaller() {
        AnalyzerAction fix = signal(AnalyzerConfig.empty()).actions().next();
        int changes = fix.mutation().changes().size();

        fix.mutation().removeNode(element.node());

        assertThat(fix.mutation().changes()).hasSize(changes);
        assertThat(fix.mutation().commit().fullText()).contains("<span id=\"x\" />");
    }
}
