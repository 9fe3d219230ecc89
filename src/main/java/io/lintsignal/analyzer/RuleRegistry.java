package io.lintsignal.analyzer;

import io.lintsignal.config.AnalyzerConfig;
import io.lintsignal.config.RuleLevel;
import io.lintsignal.config.RuleSettings;
import io.lintsignal.rule.Rule;
import io.lintsignal.rule.RuleKey;
import io.lintsignal.rules.a11y.NoAriaHiddenOnFocusable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of all available rules.
 */
public class RuleRegistry {

    private final List<Rule<?, ?, ?>> rules;

    private RuleRegistry(List<Rule<?, ?, ?>> rules) {
        Set<RuleKey> seen = new HashSet<>();
        for (Rule<?, ?, ?> rule : rules) {
            if (!seen.add(rule.metadata().ruleKey())) {
                throw new IllegalArgumentException("Duplicate rule " + rule.metadata().ruleKey());
            }
        }
        this.rules = List.copyOf(rules);
    }

    /**
     * Creates a registry with all built-in rules.
     */
    public static RuleRegistry createDefault() {
        return new RuleRegistry(List.of(
                new NoAriaHiddenOnFocusable()
        ));
    }

    /**
     * Creates a registry with specific rules.
     */
    public static RuleRegistry of(Rule<?, ?, ?>... rules) {
        return new RuleRegistry(Arrays.asList(rules));
    }

    /**
     * Returns all registered rules.
     */
    public List<Rule<?, ?, ?>> allRules() {
        return rules;
    }

    /**
     * Returns a rule by key, if present.
     */
    public Optional<Rule<?, ?, ?>> byKey(RuleKey key) {
        return rules.stream()
                .filter(r -> r.metadata().ruleKey().equals(key))
                .findFirst();
    }

    /**
     * Returns the rules that run under the given configuration: rules with a configured level other than
     * {@code off}, and recommended rules the configuration gives no level.
     */
    public List<Rule<?, ?, ?>> enabledRules(AnalyzerConfig config) {
        List<Rule<?, ?, ?>> enabled = new ArrayList<>();
        for (Rule<?, ?, ?> rule : rules) {
            Optional<RuleLevel> level = config.ruleSettings(rule.metadata().ruleKey())
                    .flatMap(RuleSettings::level);
            boolean runs = level.map(RuleLevel::isEnabled).orElse(rule.metadata().recommended());
            if (runs) {
                enabled.add(rule);
            }
        }
        return enabled;
    }
}
