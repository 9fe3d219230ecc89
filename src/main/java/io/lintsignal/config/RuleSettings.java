package io.lintsignal.config;

import io.lintsignal.rule.FixKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration of one rule. Every part is optional.
 *
 * @param level   Configured level; empty means the rule's default
 * @param fix     Configured fix kind; empty means the rule's declared fix kind
 * @param options Rule specific options blob, converted into the rule's options type on use
 */
public record RuleSettings(Optional<RuleLevel> level, Optional<FixKind> fix, Map<String, Object> options) {

    public RuleSettings {
        level = level != null ? level : Optional.empty();
        fix = fix != null ? fix : Optional.empty();
        options = options != null ? Collections.unmodifiableMap(new LinkedHashMap<>(options)) : Map.of();
    }

    public static RuleSettings empty() {
        return new RuleSettings(Optional.empty(), Optional.empty(), Map.of());
    }

    public RuleSettings withLevel(RuleLevel newLevel) {
        return new RuleSettings(Optional.of(newLevel), fix, options);
    }

    public RuleSettings withFix(FixKind newFix) {
        return new RuleSettings(level, Optional.of(newFix), options);
    }

    public RuleSettings withOptions(Map<String, Object> newOptions) {
        return new RuleSettings(level, fix, newOptions);
    }

    public boolean hasOptions() {
        return !options.isEmpty();
    }
}
