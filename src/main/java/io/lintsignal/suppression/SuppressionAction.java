package io.lintsignal.suppression;

import io.lintsignal.syntax.SyntaxNode;
import io.lintsignal.syntax.TextRange;

import java.util.Optional;

/**
 * Language specific strategy producing the edit that silences a finding.
 * <p>
 * Where the marker goes and how it is spelled depends on the language; when a suppression is offered
 * and how it is turned into an action does not, and is handled by the analyzer.
 */
@FunctionalInterface
public interface SuppressionAction {

    /**
     * Produces the suppression edit for a finding.
     *
     * @param root         Root of the tree the finding was reported on
     * @param anchorRange  Range the suppression should cover
     * @param ruleCategory Category of the rule to suppress, e.g. {@code lint/a11y/noAutofocus}
     * @return the edit, or empty if no marker can be placed at that range
     */
    Optional<SuppressionEdit> produce(SyntaxNode root, TextRange anchorRange, String ruleCategory);

    /**
     * A strategy that never offers a suppression.
     */
    static SuppressionAction none() {
        return (root, anchorRange, ruleCategory) -> Optional.empty();
    }
}
