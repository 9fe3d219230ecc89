package io.lintsignal.analyzer;

/**
 * Tells the analyzer whether to keep going after a signal was visited.
 */
public enum ControlFlow {
    CONTINUE,
    BREAK
}
