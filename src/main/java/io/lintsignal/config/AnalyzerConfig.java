package io.lintsignal.config;

import io.lintsignal.analyzer.RuleRegistry;
import io.lintsignal.rule.FixKind;
import io.lintsignal.rule.Rule;
import io.lintsignal.rule.RuleKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Analyzer configuration loaded from a YAML file.
 * <p>
 * Example:
 * <pre>
 * globals: [React, process]
 * preferredQuote: double
 * jsxRuntime: transparent
 * rules:
 *   a11y/noAriaHiddenOnFocusable:
 *     level: error
 *     fix: safe
 *     options: {}
 *   a11y/noAutofocus: off
 * </pre>
 */
public final class AnalyzerConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerConfig.class);

    private static final String DEFAULT_CONFIG = "/lint-signal.yaml";
    private static final Set<String> TOP_LEVEL_KEYS = Set.of("globals", "preferredQuote", "jsxRuntime", "rules");
    private static final Set<String> RULE_KEYS = Set.of("level", "fix", "options");

    private final List<String> globals;
    private final QuoteStyle preferredQuote;
    private final JsxRuntime jsxRuntime;
    private final Map<RuleKey, RuleSettings> rules;

    private AnalyzerConfig(List<String> globals,
                           QuoteStyle preferredQuote,
                           JsxRuntime jsxRuntime,
                           Map<RuleKey, RuleSettings> rules) {
        this.globals = List.copyOf(globals);
        this.preferredQuote = preferredQuote;
        this.jsxRuntime = jsxRuntime;
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    /**
     * Configuration with nothing set: no globals, double quotes, transparent runtime, rule defaults.
     */
    public static AnalyzerConfig empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads the default configuration from the classpath.
     */
    public static AnalyzerConfig loadDefault() {
        try (InputStream in = AnalyzerConfig.class.getResourceAsStream(DEFAULT_CONFIG)) {
            if (in == null) {
                throw new IllegalStateException("Default configuration not found: " + DEFAULT_CONFIG);
            }
            return load(in, DEFAULT_CONFIG);
        } catch (IOException | ConfigurationException e) {
            throw new IllegalStateException("Failed to load default configuration", e);
        }
    }

    /**
     * Loads configuration from a YAML file.
     */
    public static AnalyzerConfig load(Path path) throws IOException, ConfigurationException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        }
    }

    /**
     * Loads configuration from a YAML file and checks it against the registered rules.
     *
     * @see #validate(RuleRegistry)
     */
    public static AnalyzerConfig load(Path path, RuleRegistry registry) throws IOException, ConfigurationException {
        AnalyzerConfig config = load(path);
        config.validate(registry);
        return config;
    }

    /**
     * Loads configuration from a YAML stream and checks it against the registered rules.
     *
     * @see #validate(RuleRegistry)
     */
    public static AnalyzerConfig load(InputStream in, String source, RuleRegistry registry)
            throws ConfigurationException {
        AnalyzerConfig config = load(in, source);
        config.validate(registry);
        return config;
    }

    /**
     * Loads configuration from a YAML stream.
     *
     * @param in     The YAML content
     * @param source Name of the source, used in error messages
     */
    public static AnalyzerConfig load(InputStream in, String source) throws ConfigurationException {
        Object data;
        try {
            data = new Yaml().load(in);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
        if (data == null) {
            log.debug("Configuration {} is empty, using defaults", source);
            return empty();
        }
        if (!(data instanceof Map<?, ?> map)) {
            throw new ConfigurationException(source + ": expected a mapping at the top level");
        }

        for (Object key : map.keySet()) {
            if (!TOP_LEVEL_KEYS.contains(String.valueOf(key))) {
                throw new ConfigurationException(source + ": unknown key '" + key + "'");
            }
        }

        Builder builder = builder();
        builder.globals(toStringList(map.get("globals"), "globals"));

        Object quote = map.get("preferredQuote");
        if (quote != null) {
            builder.preferredQuote(QuoteStyle.parse(scalar(quote))
                    .orElseThrow(() -> invalidValue("preferredQuote", quote)));
        }
        Object runtime = map.get("jsxRuntime");
        if (runtime != null) {
            builder.jsxRuntime(JsxRuntime.parse(scalar(runtime))
                    .orElseThrow(() -> invalidValue("jsxRuntime", runtime)));
        }

        Object rules = map.get("rules");
        if (rules != null) {
            if (!(rules instanceof Map<?, ?> ruleMap)) {
                throw new ConfigurationException(source + ": 'rules' must be a mapping");
            }
            for (Map.Entry<?, ?> entry : ruleMap.entrySet()) {
                String name = String.valueOf(entry.getKey());
                RuleKey key = RuleKey.parse(name)
                        .orElseThrow(() -> new ConfigurationException(
                                "Malformed rule key '" + name + "', expected <group>/<rule>"));
                builder.rule(key, parseRule(name, entry.getValue()));
            }
        }

        AnalyzerConfig config = builder.build();
        log.debug("Loaded configuration from {} with {} rule setting(s)", source, config.rules.size());
        return config;
    }

    private static RuleSettings parseRule(String name, Object value) throws ConfigurationException {
        if (value == null) {
            return RuleSettings.empty();
        }
        if (!(value instanceof Map<?, ?> settings)) {
            // shorthand: "group/rule: warn"
            return RuleSettings.empty().withLevel(parseLevel(name, value));
        }
        for (Object key : settings.keySet()) {
            if (!RULE_KEYS.contains(String.valueOf(key))) {
                throw new ConfigurationException("Rule '" + name + "': unknown key '" + key + "'");
            }
        }

        RuleSettings result = RuleSettings.empty();
        Object level = settings.get("level");
        if (level != null) {
            result = result.withLevel(parseLevel(name, level));
        }
        Object fix = settings.get("fix");
        if (fix != null) {
            result = result.withFix(FixKind.parse(scalar(fix))
                    .orElseThrow(() -> invalidValue(name + ".fix", fix)));
        }
        Object options = settings.get("options");
        if (options != null) {
            if (!(options instanceof Map<?, ?> optionMap)) {
                throw new ConfigurationException("Rule '" + name + "': 'options' must be a mapping");
            }
            Map<String, Object> blob = new LinkedHashMap<>();
            optionMap.forEach((k, v) -> blob.put(String.valueOf(k), v));
            result = result.withOptions(blob);
        }
        return result;
    }

    private static RuleLevel parseLevel(String name, Object value) throws ConfigurationException {
        return RuleLevel.parse(scalar(value)).orElseThrow(() -> invalidValue(name + ".level", value));
    }

    /**
     * YAML 1.1 reads a bare {@code off} as a boolean, so booleans are mapped back to their spelling.
     */
    private static String scalar(Object value) {
        if (value instanceof Boolean b) {
            return b ? "on" : "off";
        }
        return String.valueOf(value);
    }

    private static List<String> toStringList(Object value, String key) throws ConfigurationException {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("'" + key + "' must be a list");
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            if (item != null && !String.valueOf(item).isBlank()) {
                result.add(String.valueOf(item).trim());
            }
        }
        return result;
    }

    private static ConfigurationException invalidValue(String key, Object value) {
        return new ConfigurationException("Invalid value '" + scalar(value) + "' for '" + key + "'");
    }

    /**
     * Checks the rule settings against the rules that exist: every configured rule must be registered
     * and its options must convert into the rule's options type.
     *
     * @throws ConfigurationException on the first problem found
     */
    public void validate(RuleRegistry registry) throws ConfigurationException {
        for (Map.Entry<RuleKey, RuleSettings> entry : rules.entrySet()) {
            RuleKey key = entry.getKey();
            Rule<?, ?, ?> rule = registry.byKey(key)
                    .orElseThrow(() -> new ConfigurationException("Unknown rule '" + key + "'"));
            if (entry.getValue().hasOptions()) {
                RuleOptionsConverter.convert(key, entry.getValue().options(), rule.optionsType());
            }
        }
    }

    public List<String> globals() {
        return globals;
    }

    public QuoteStyle preferredQuote() {
        return preferredQuote;
    }

    public JsxRuntime jsxRuntime() {
        return jsxRuntime;
    }

    public Map<RuleKey, RuleSettings> rules() {
        return rules;
    }

    public Optional<RuleSettings> ruleSettings(RuleKey key) {
        return Optional.ofNullable(rules.get(key));
    }

    /**
     * Builder for {@link AnalyzerConfig}.
     */
    public static final class Builder {
        private List<String> globals = List.of();
        private QuoteStyle preferredQuote = QuoteStyle.DOUBLE;
        private JsxRuntime jsxRuntime = JsxRuntime.TRANSPARENT;
        private final Map<RuleKey, RuleSettings> rules = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder globals(List<String> globals) {
            this.globals = List.copyOf(globals);
            return this;
        }

        public Builder preferredQuote(QuoteStyle preferredQuote) {
            this.preferredQuote = preferredQuote;
            return this;
        }

        public Builder jsxRuntime(JsxRuntime jsxRuntime) {
            this.jsxRuntime = jsxRuntime;
            return this;
        }

        public Builder rule(RuleKey key, RuleSettings settings) {
            rules.put(key, settings);
            return this;
        }

        public AnalyzerConfig build() {
            return new AnalyzerConfig(globals, preferredQuote, jsxRuntime, rules);
        }
    }
}
