package io.lintsignal.config;

import io.lintsignal.analyzer.RuleRegistry;
import io.lintsignal.analyzer.StubRule;
import io.lintsignal.rule.FixKind;
import io.lintsignal.rule.RuleKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalyzerConfigTest {

    private static final RuleKey RENAME = RuleKey.of("test", "rename");

    @TempDir
    Path tempDir;

    private static AnalyzerConfig parse(String yaml) throws ConfigurationException {
        InputStream in = new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8));
        return AnalyzerConfig.load(in, "inline");
    }

    private static InputStream resource(String name) {
        return AnalyzerConfigTest.class.getResourceAsStream("/config/" + name);
    }

    @Test
    void loadDefault_loadsSuccessfully() {
        AnalyzerConfig config = AnalyzerConfig.loadDefault();

        assertThat(config.preferredQuote()).isEqualTo(QuoteStyle.DOUBLE);
        assertThat(config.ruleSettings(RuleKey.of("a11y", "noAriaHiddenOnFocusable")))
                .flatMap(RuleSettings::level)
                .hasValue(RuleLevel.ERROR);
    }

    @Test
    void load_readsAllSections() throws Exception {
        AnalyzerConfig config = AnalyzerConfig.load(resource("full.yaml"), "full.yaml");

        assertThat(config.globals()).containsExactly("React", "process");
        assertThat(config.preferredQuote()).isEqualTo(QuoteStyle.SINGLE);
        assertThat(config.jsxRuntime()).isEqualTo(JsxRuntime.REACT_CLASSIC);
        assertThat(config.ruleSettings(RuleKey.of("a11y", "noAriaHiddenOnFocusable")).orElseThrow())
                .isEqualTo(RuleSettings.empty().withLevel(RuleLevel.WARN).withFix(FixKind.SAFE));
        assertThat(config.ruleSettings(RENAME).orElseThrow().options()).containsEntry("replacement", "section");
        assertThat(config.ruleSettings(RENAME).orElseThrow().fix()).hasValue(FixKind.NONE);
    }

    @Test
    void load_readsBareOffAsLevel() throws Exception {
        AnalyzerConfig config = AnalyzerConfig.load(resource("full.yaml"), "full.yaml");

        assertThat(config.ruleSettings(RuleKey.of("test", "quiet")).flatMap(RuleSettings::level))
                .hasValue(RuleLevel.OFF);
    }

    @Test
    void load_fromFile() throws Exception {
        Path file = tempDir.resolve("lint-signal.yaml");
        Files.writeString(file, "preferredQuote: single\n");

        assertThat(AnalyzerConfig.load(file).preferredQuote()).isEqualTo(QuoteStyle.SINGLE);
    }

    @Test
    void load_missingFileThrowsIOException() {
        assertThatThrownBy(() -> AnalyzerConfig.load(tempDir.resolve("missing.yaml")))
                .isInstanceOf(IOException.class);
    }

    @Test
    void load_emptyDocumentGivesDefaults() throws Exception {
        AnalyzerConfig config = parse("");

        assertThat(config.globals()).isEmpty();
        assertThat(config.jsxRuntime()).isEqualTo(JsxRuntime.TRANSPARENT);
        assertThat(config.rules()).isEmpty();
    }

    @Test
    void load_rejectsUnknownTopLevelKey() {
        assertThatThrownBy(() -> AnalyzerConfig.load(resource("unknown-key.yaml"), "unknown-key.yaml"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("formatter");
    }

    @Test
    void load_rejectsMalformedRuleKey() {
        assertThatThrownBy(() -> parse("rules:\n  noGroup:\n    level: warn\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("noGroup");
    }

    @Test
    void load_rejectsUnknownEnumValues() {
        assertThatThrownBy(() -> parse("preferredQuote: backtick\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("backtick");
        assertThatThrownBy(() -> parse("rules:\n  test/rename:\n    fix: sometimes\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("sometimes");
        assertThatThrownBy(() -> parse("rules:\n  test/rename:\n    level: loud\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("loud");
    }

    @Test
    void load_rejectsUnknownRuleSettingKey() {
        assertThatThrownBy(() -> parse("rules:\n  test/rename:\n    severity: warn\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("severity");
    }

    @Test
    void load_rejectsInvalidYaml() {
        assertThatThrownBy(() -> parse("rules: [unclosed\n"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void validate_acceptsKnownRulesWithFittingOptions() throws Exception {
        AnalyzerConfig config = parse("rules:\n  test/rename:\n    options:\n      replacement: section\n");

        config.validate(RuleRegistry.of(StubRule.named("test", "rename")));
    }

    @Test
    void validate_rejectsUnknownRule() throws Exception {
        AnalyzerConfig config = parse("rules:\n  test/missing: warn\n");

        assertThatThrownBy(() -> config.validate(RuleRegistry.of(StubRule.named("test", "rename"))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("test/missing");
    }

    @Test
    void validate_rejectsOptionsOfWrongShape() throws Exception {
        AnalyzerConfig config = parse("rules:\n  test/rename:\n    options:\n      replacment: section\n");

        assertThatThrownBy(() -> config.validate(RuleRegistry.of(StubRule.named("test", "rename"))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("test/rename");
    }

    @Test
    void ruleOptions_convertsBlobToRuleOptionsType() throws Exception {
        AnalyzerConfig config = AnalyzerConfig.builder()
                .rule(RENAME, RuleSettings.empty().withOptions(Map.of("replacement", "section")))
                .build();
        AnalyzerOptions options = new AnalyzerOptions(Path.of("a.jsx"), config);

        assertThat(options.ruleOptions(StubRule.named("test", "rename")))
                .hasValue(new StubRule.Options("section"));
        assertThat(options.ruleFixKind(RENAME)).isEmpty();
    }

    @Test
    void ruleOptions_emptyWhenNotConfigured() throws Exception {
        assertThat(AnalyzerOptions.defaults().ruleOptions(StubRule.named("test", "rename"))).isEmpty();
    }

    @Test
    void ruleOptions_convertsOnceAndReusesResult() throws Exception {
        AnalyzerConfig config = AnalyzerConfig.builder()
                .rule(RENAME, RuleSettings.empty().withOptions(Map.of("replacement", "section")))
                .build();
        AnalyzerOptions options = new AnalyzerOptions(Path.of("a.jsx"), config);
        StubRule rule = StubRule.named("test", "rename");

        StubRule.Options first = options.ruleOptions(rule).orElseThrow();

        assertThat(options.ruleOptions(rule)).containsSame(first);
    }

    @Test
    void ruleOptions_rejectsUnknownField() throws Exception {
        AnalyzerConfig config = parse("rules:\n  test/rename:\n    options: {bogus: 1}\n");
        AnalyzerOptions options = new AnalyzerOptions(Path.of("a.jsx"), config);
        StubRule rule = StubRule.named("test", "rename");

        assertThatThrownBy(() -> options.ruleOptions(rule))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("bogus");
        assertThatThrownBy(() -> options.ruleOptions(rule))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void load_withRegistry_rejectsOptionsThatDoNotFit() {
        InputStream in = new ByteArrayInputStream(
                "rules:\n  test/rename:\n    options: {bogus: 1}\n".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> AnalyzerConfig.load(in, "inline", RuleRegistry.of(StubRule.named("test", "rename"))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("test/rename")
                .hasMessageContaining("bogus");
    }

    @Test
    void load_withRegistry_acceptsMatchingOptions() throws Exception {
        Path file = tempDir.resolve("lint-signal.yaml");
        Files.writeString(file, "rules:\n  test/rename:\n    options:\n      replacement: section\n");

        AnalyzerConfig config = AnalyzerConfig.load(file, RuleRegistry.of(StubRule.named("test", "rename")));

        assertThat(config.ruleSettings(RENAME)).map(RuleSettings::options)
                .hasValue(Map.of("replacement", "section"));
    }
}
