package io.lintsignal.rule;

import io.lintsignal.analyzer.Applicability;

/**
 * Static description of a rule.
 *
 * @param group       Group the rule belongs to, e.g. "a11y"
 * @param name        Rule name, unique within its group
 * @param version     Version the rule was introduced in
 * @param recommended Whether the rule runs when the configuration does not mention it
 * @param fixKind     Kind of fix the rule offers
 */
public record RuleMetadata(String group, String name, String version, boolean recommended, FixKind fixKind) {

    public RuleMetadata {
        if (group == null || group.isBlank()) {
            throw new IllegalArgumentException("group cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        version = version != null ? version : "next";
        fixKind = fixKind != null ? fixKind : FixKind.NONE;
    }

    public RuleKey ruleKey() {
        return RuleKey.of(group, name);
    }

    /**
     * Diagnostic category, {@code lint/<group>/<name>}.
     */
    public String category() {
        return ruleKey().category();
    }

    /**
     * Applicability of the fix the rule declares.
     *
     * @throws IllegalStateException if the rule declares no fix
     */
    public Applicability applicability() {
        return fixKind.applicability();
    }
}
