package io.lintsignal.analyzer;

import io.lintsignal.mutation.BatchMutation;
import io.lintsignal.rule.RuleKey;

import java.util.Optional;

/**
 * Code action returned by the analyzer: a rule's action with the rule identity
 * and the applicability resolved from configuration.
 *
 * @param ruleKey       Rule that produced the action, if it came from a rule
 * @param category      Action category
 * @param applicability Resolved applicability
 * @param message       Message describing the action
 * @param mutation      The edits the action performs
 */
public record AnalyzerAction(
        Optional<RuleKey> ruleKey,
        ActionCategory category,
        Applicability applicability,
        String message,
        BatchMutation mutation
) {

    public AnalyzerAction {
        ruleKey = ruleKey != null ? ruleKey : Optional.empty();
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        if (applicability == null) {
            throw new IllegalArgumentException("applicability cannot be null");
        }
        if (mutation == null) {
            throw new IllegalArgumentException("mutation cannot be null");
        }
        message = message != null ? message : "";
    }

    public boolean isSuppression() {
        return category.matches(ActionCategory.SUPPRESSION_NAME);
    }

    /**
     * The edits the action performs. Each call returns a fresh copy, so a caller adding changes
     * does not alter the action.
     */
    @Override
    public BatchMutation mutation() {
        return mutation.copy();
    }
}
