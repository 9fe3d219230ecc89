package io.lintsignal.fix;

import io.lintsignal.rule.RuleKey;
import io.lintsignal.syntax.SyntaxNode;

import java.util.Set;

/**
 * Outcome of fixing one file.
 *
 * @param root           The tree after all edits were applied
 * @param actionsApplied Number of edits applied
 * @param rulesApplied   Rules whose edits were applied
 */
public record FixFileResult(SyntaxNode root, int actionsApplied, Set<RuleKey> rulesApplied) {

    public FixFileResult {
        rulesApplied = Set.copyOf(rulesApplied);
    }

    public boolean hasChanges() {
        return actionsApplied > 0;
    }

    public String text() {
        return root.fullText();
    }
}
