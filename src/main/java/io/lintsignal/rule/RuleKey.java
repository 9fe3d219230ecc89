package io.lintsignal.rule;

import java.util.Optional;

/**
 * Identity of a rule: the group it belongs to and its name within the group.
 *
 * @param group Rule group, e.g. "a11y"
 * @param rule  Rule name, e.g. "noAriaHiddenOnFocusable"
 */
public record RuleKey(String group, String rule) {

    public RuleKey {
        if (group == null || group.isBlank()) {
            throw new IllegalArgumentException("group cannot be null or blank");
        }
        if (rule == null || rule.isBlank()) {
            throw new IllegalArgumentException("rule cannot be null or blank");
        }
    }

    public static RuleKey of(String group, String rule) {
        return new RuleKey(group, rule);
    }

    /**
     * Parses the {@code group/rule} spelling used in configuration files.
     */
    public static Optional<RuleKey> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        int slash = value.indexOf('/');
        if (slash <= 0 || slash == value.length() - 1 || value.indexOf('/', slash + 1) >= 0) {
            return Optional.empty();
        }
        String group = value.substring(0, slash).trim();
        String rule = value.substring(slash + 1).trim();
        if (group.isEmpty() || rule.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new RuleKey(group, rule));
    }

    /**
     * Diagnostic category of the rule, e.g. {@code lint/a11y/noAriaHiddenOnFocusable}.
     */
    public String category() {
        return "lint/" + group + "/" + rule;
    }

    @Override
    public String toString() {
        return group + "/" + rule;
    }
}
