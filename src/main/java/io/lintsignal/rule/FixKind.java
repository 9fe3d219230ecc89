package io.lintsignal.rule;

import io.lintsignal.analyzer.Applicability;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of fix a rule offers, or the fix policy configured for a rule.
 */
public enum FixKind {
    NONE("none"),
    SAFE("safe"),
    UNSAFE("unsafe");

    private final String configName;

    FixKind(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    /**
     * Applicability implied by this fix kind.
     *
     * @throws IllegalStateException for {@link #NONE}, which has no applicability
     */
    public Applicability applicability() {
        return switch (this) {
            case SAFE -> Applicability.ALWAYS;
            case UNSAFE -> Applicability.MAYBE_INCORRECT;
            case NONE -> throw new IllegalStateException("Fix kind 'none' has no applicability");
        };
    }

    /**
     * Parses the configuration spelling of a fix kind (case-insensitive).
     */
    public static Optional<FixKind> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (FixKind kind : values()) {
            if (kind.configName.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
