package io.lintsignal.config;

import java.util.Optional;

/**
 * How markup elements are compiled, which decides whether a framework import must be in scope.
 */
public enum JsxRuntime {
    /**
     * Elements compile to calls that need no import.
     */
    TRANSPARENT("transparent"),

    /**
     * Classic runtime: elements compile to {@code React.createElement} calls.
     */
    REACT_CLASSIC("reactClassic");

    private final String configName;

    JsxRuntime(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static Optional<JsxRuntime> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (JsxRuntime runtime : values()) {
            if (runtime.configName.equalsIgnoreCase(trimmed)) {
                return Optional.of(runtime);
            }
        }
        return Optional.empty();
    }
}
