package io.lintsignal.config;

import java.util.Locale;
import java.util.Optional;

/**
 * Quote character preferred for string literals written by fixes.
 */
public enum QuoteStyle {
    DOUBLE("double", '"'),
    SINGLE("single", '\'');

    private final String configName;
    private final char quote;

    QuoteStyle(String configName, char quote) {
        this.configName = configName;
        this.quote = quote;
    }

    public String configName() {
        return configName;
    }

    public char quote() {
        return quote;
    }

    /**
     * Wraps the text in this style's quotes.
     */
    public String quoted(String text) {
        return quote + text + quote;
    }

    public static Optional<QuoteStyle> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (QuoteStyle style : values()) {
            if (style.configName.equals(normalized)) {
                return Optional.of(style);
            }
        }
        return Optional.empty();
    }
}
