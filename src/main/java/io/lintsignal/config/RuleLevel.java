package io.lintsignal.config;

import io.lintsignal.diagnostic.Severity;

import java.util.Locale;
import java.util.Optional;

/**
 * Configured level of a rule.
 */
public enum RuleLevel {
    OFF("off", null),
    INFO("info", Severity.INFORMATION),
    WARN("warn", Severity.WARNING),
    ERROR("error", Severity.ERROR);

    private final String configName;
    private final Severity severity;

    RuleLevel(String configName, Severity severity) {
        this.configName = configName;
        this.severity = severity;
    }

    public String configName() {
        return configName;
    }

    /**
     * Severity diagnostics of the rule are reported with, empty for {@link #OFF}.
     */
    public Optional<Severity> severity() {
        return Optional.ofNullable(severity);
    }

    public boolean isEnabled() {
        return this != OFF;
    }

    public static Optional<RuleLevel> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RuleLevel level : values()) {
            if (level.configName.equals(normalized)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
