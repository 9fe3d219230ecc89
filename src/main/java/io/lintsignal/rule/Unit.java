package io.lintsignal.rule;

/**
 * Match state of rules that carry no data beyond the match itself.
 */
public enum Unit {
    INSTANCE
}
