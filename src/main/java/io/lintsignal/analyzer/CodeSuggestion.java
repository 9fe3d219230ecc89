package io.lintsignal.analyzer;

import io.lintsignal.syntax.TextRange;

import java.util.List;

/**
 * Display-ready description of a single edit.
 *
 * @param span          Range of original text being replaced
 * @param applicability Safety of the edit
 * @param message       What the edit does
 * @param replacement   Text replacing the span
 * @param labels        Ranges annotated by the suggestion (currently always empty)
 */
public record CodeSuggestion(
        TextRange span,
        Applicability applicability,
        String message,
        String replacement,
        List<TextRange> labels
) {
    public CodeSuggestion {
        labels = labels != null ? List.copyOf(labels) : List.of();
    }
}
