package io.lintsignal.rule;

import io.lintsignal.syntax.SyntaxKind;
import io.lintsignal.syntax.SyntaxNode;

import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a rule applies to a node, and if so what the rule gets to see.
 *
 * @param <Q> query result handed to the rule
 */
@FunctionalInterface
public interface Query<Q> {

    Optional<Q> match(SyntaxNode node);

    /**
     * Matches nodes of any of the given kinds, yielding the node itself.
     */
    static Query<SyntaxNode> kinds(SyntaxKind... kinds) {
        Set<SyntaxKind> accepted = Set.of(kinds);
        return node -> accepted.contains(node.kind()) ? Optional.of(node) : Optional.empty();
    }
}
