package io.lintsignal.config;

import io.lintsignal.rule.FixKind;
import io.lintsignal.rule.Rule;
import io.lintsignal.rule.RuleKey;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Options of one analysis run: the file being analyzed and the configuration that applies to it.
 */
public final class AnalyzerOptions {

    private final Path filePath;
    private final AnalyzerConfig config;
    private final Map<OptionsKey, Converted> converted = new ConcurrentHashMap<>();

    private record OptionsKey(RuleKey rule, Class<?> type) {}

    /**
     * Outcome of converting one options blob: exactly one of the two is set.
     */
    private record Converted(Object value, ConfigurationException failure) {}

    public AnalyzerOptions(Path filePath, AnalyzerConfig config) {
        if (filePath == null) {
            throw new IllegalArgumentException("filePath cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.filePath = filePath;
        this.config = config;
    }

    /**
     * Options for an unnamed file with an empty configuration.
     */
    public static AnalyzerOptions defaults() {
        return new AnalyzerOptions(Path.of(""), AnalyzerConfig.empty());
    }

    public Path filePath() {
        return filePath;
    }

    public AnalyzerConfig config() {
        return config;
    }

    public List<String> globals() {
        return config.globals();
    }

    public QuoteStyle preferredQuote() {
        return config.preferredQuote();
    }

    public JsxRuntime jsxRuntime() {
        return config.jsxRuntime();
    }

    /**
     * Typed options configured for the rule, or empty when the configuration sets none.
     * The blob is converted on first use and the outcome is kept for later calls.
     *
     * @throws ConfigurationException if the configured options do not fit the rule's options type;
     *                                {@link AnalyzerConfig#validate} reports this at load time
     */
    public <O> Optional<O> ruleOptions(Rule<?, ?, O> rule) throws ConfigurationException {
        RuleKey key = rule.metadata().ruleKey();
        Optional<RuleSettings> settings = config.ruleSettings(key).filter(RuleSettings::hasOptions);
        if (settings.isEmpty()) {
            return Optional.empty();
        }
        Converted result = converted.computeIfAbsent(new OptionsKey(key, rule.optionsType()),
                k -> convert(key, settings.get(), rule.optionsType()));
        if (result.failure() != null) {
            throw result.failure();
        }
        return Optional.of(rule.optionsType().cast(result.value()));
    }

    private static Converted convert(RuleKey key, RuleSettings settings, Class<?> type) {
        try {
            return new Converted(RuleOptionsConverter.convert(key, settings.options(), type), null);
        } catch (ConfigurationException e) {
            return new Converted(null, e);
        }
    }

    /**
     * Fix kind configured for the rule, overriding what the rule declares.
     */
    public Optional<FixKind> ruleFixKind(RuleKey key) {
        return config.ruleSettings(key).flatMap(RuleSettings::fix);
    }

    public Optional<RuleLevel> ruleLevel(RuleKey key) {
        return config.ruleSettings(key).flatMap(RuleSettings::level);
    }
}
