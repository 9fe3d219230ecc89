package io.lintsignal.analyzer;

import io.lintsignal.diagnostic.DiagnosticError;
import io.lintsignal.diagnostic.Severity;
import io.lintsignal.syntax.TextRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Diagnostic emitted by the analyzer: the underlying error plus an optional severity override
 * and the code suggestions a reporter may show next to it.
 *
 * @param error            The diagnostic error produced by a rule or a factory
 * @param severityOverride Severity set by configuration, if any
 * @param suggestions      Code suggestions attached to the diagnostic
 */
public record AnalyzerDiagnostic(
        DiagnosticError error,
        Optional<Severity> severityOverride,
        List<CodeSuggestionAdvice> suggestions
) {

    public AnalyzerDiagnostic {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        severityOverride = severityOverride != null ? severityOverride : Optional.empty();
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }

    public static AnalyzerDiagnostic fromError(DiagnosticError error) {
        return new AnalyzerDiagnostic(error, Optional.empty(), List.of());
    }

    public AnalyzerDiagnostic withSeverity(Severity severity) {
        return new AnalyzerDiagnostic(error, Optional.of(severity), suggestions);
    }

    public AnalyzerDiagnostic withCodeSuggestion(CodeSuggestionAdvice suggestion) {
        List<CodeSuggestionAdvice> newSuggestions = new ArrayList<>(suggestions);
        newSuggestions.add(suggestion);
        return new AnalyzerDiagnostic(error, severityOverride, newSuggestions);
    }

    public String message() {
        return error.message();
    }

    public Optional<String> category() {
        return error.category();
    }

    public Optional<TextRange> range() {
        return error.range();
    }

    public Severity severity() {
        return severityOverride.orElseGet(error::severity);
    }
}
