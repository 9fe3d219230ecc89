package io.lintsignal.rule;

import io.lintsignal.analyzer.ActionCategory;
import io.lintsignal.analyzer.Applicability;
import io.lintsignal.mutation.BatchMutation;

/**
 * Fix returned by a rule's action hook, before configuration is applied.
 *
 * @param category      Action category, usually {@link ActionCategory#QUICK_FIX}
 * @param applicability Applicability the rule declares for this fix
 * @param message       What the fix does
 * @param mutation      The edits
 */
public record RuleAction(ActionCategory category, Applicability applicability, String message, BatchMutation mutation) {

    public RuleAction {
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

    /**
     * A quick fix with the applicability the rule's metadata declares.
     */
    public static RuleAction quickFix(RuleMetadata metadata, String message, BatchMutation mutation) {
        return new RuleAction(ActionCategory.QUICK_FIX, metadata.applicability(), message, mutation);
    }
}
