package io.lintsignal.diagnostic;

import io.lintsignal.syntax.TextRange;

import java.util.Optional;

/**
 * The error type every diagnostic is built from.
 * <p>
 * Rule diagnostics implement it, and so can any caller-specific error value,
 * which is what makes such values usable with {@link io.lintsignal.analyzer.DiagnosticSignal}.
 */
public interface DiagnosticError {

    String message();

    default Optional<String> category() {
        return Optional.empty();
    }

    default Optional<TextRange> range() {
        return Optional.empty();
    }

    default Severity severity() {
        return Severity.ERROR;
    }
}
