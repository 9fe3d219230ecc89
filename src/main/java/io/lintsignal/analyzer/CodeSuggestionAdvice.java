package io.lintsignal.analyzer;

import io.lintsignal.mutation.TextEdit;

/**
 * Advice form of an action, meant to be attached to a diagnostic.
 *
 * @param applicability Safety of the suggested edit
 * @param message       What the edit does
 * @param suggestion    The edit itself
 */
public record CodeSuggestionAdvice(Applicability applicability, String message, TextEdit suggestion) {

    /**
     * Projects an action, reducing its mutation to one edit. An empty mutation gives {@link TextEdit#empty()}.
     */
    public static CodeSuggestionAdvice from(AnalyzerAction action) {
        TextEdit edit = action.mutation().asTextEdit().orElseGet(TextEdit::empty);
        return new CodeSuggestionAdvice(action.applicability(), action.message(), edit);
    }
}
