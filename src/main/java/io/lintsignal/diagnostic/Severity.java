package io.lintsignal.diagnostic;

/**
 * Severity of a diagnostic.
 */
public enum Severity {
    HINT("hint"),
    INFORMATION("info"),
    WARNING("warning"),
    ERROR("error");

    private final String display;

    Severity(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }
}
