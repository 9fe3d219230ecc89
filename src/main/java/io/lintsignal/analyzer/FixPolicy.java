package io.lintsignal.analyzer;

import io.lintsignal.rule.FixKind;

import java.util.Optional;

/**
 * Configured fix policy of one rule, resolved from its optional {@link FixKind} setting.
 * <p>
 * Resolution happens in two steps: {@link #isDisabled()} is checked before any rule hook runs,
 * {@link #applicabilityFor(Applicability)} is applied to the fix the rule produced.
 */
public enum FixPolicy {
    /**
     * Fixes are turned off for the rule.
     */
    DISABLED,

    /**
     * Fixes are reported as always safe.
     */
    FORCE_SAFE,

    /**
     * Fixes are reported as maybe incorrect.
     */
    FORCE_UNSAFE,

    /**
     * Nothing configured: the rule's own applicability is kept.
     */
    RULE_DECLARED;

    public static FixPolicy resolve(Optional<FixKind> configured) {
        if (configured.isEmpty()) {
            return RULE_DECLARED;
        }
        return switch (configured.get()) {
            case NONE -> DISABLED;
            case SAFE -> FORCE_SAFE;
            case UNSAFE -> FORCE_UNSAFE;
        };
    }

    public boolean isDisabled() {
        return this == DISABLED;
    }

    /**
     * Applicability a fix is reported with, given what the rule declared.
     *
     * @throws IllegalStateException when the policy is {@link #DISABLED}
     */
    public Applicability applicabilityFor(Applicability declared) {
        return switch (this) {
            case FORCE_SAFE -> Applicability.ALWAYS;
            case FORCE_UNSAFE -> Applicability.MAYBE_INCORRECT;
            case RULE_DECLARED -> declared;
            case DISABLED -> throw new IllegalStateException("Fixes are disabled for this rule");
        };
    }
}
