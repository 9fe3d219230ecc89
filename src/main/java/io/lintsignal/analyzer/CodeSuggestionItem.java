package io.lintsignal.analyzer;

import io.lintsignal.mutation.TextEdit;
import io.lintsignal.rule.RuleKey;

import java.util.List;
import java.util.Optional;

/**
 * Flat form of an action: rule identity and category next to a single display edit.
 *
 * @param ruleKey    Rule that produced the action, if any
 * @param category   Action category
 * @param suggestion The edit
 */
public record CodeSuggestionItem(Optional<RuleKey> ruleKey, ActionCategory category, CodeSuggestion suggestion) {

    /**
     * Projects an action, reducing its mutation to one edit. An empty mutation gives an empty span and text.
     */
    public static CodeSuggestionItem from(AnalyzerAction action) {
        TextEdit edit = action.mutation().asTextEdit().orElseGet(TextEdit::empty);
        return new CodeSuggestionItem(
                action.ruleKey(),
                action.category(),
                new CodeSuggestion(edit.range(), action.applicability(), action.message(), edit.replacement(), List.of())
        );
    }
}
