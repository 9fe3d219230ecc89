package io.lintsignal.rule;

import io.lintsignal.diagnostic.RuleDiagnostic;
import io.lintsignal.mutation.BatchMutation;
import io.lintsignal.suppression.SuppressionAction;
import io.lintsignal.suppression.SuppressionEdit;
import io.lintsignal.syntax.TextRange;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * An analysis rule.
 * <p>
 * A rule names the nodes it looks at through its {@link #query()}, inspects each match in {@link #run},
 * and describes each resulting state through the hooks. Every hook is a pure function of the context
 * and the state; the analyzer may call it any number of times.
 *
 * @param <Q> query result the rule is evaluated against
 * @param <S> state attached to each finding, {@link Unit} when there is none
 * @param <O> options type, {@link NoOptions} when the rule takes none
 */
public interface Rule<Q, S, O> {

    RuleMetadata metadata();

    Query<Q> query();

    Class<O> optionsType();

    /**
     * Options used when the configuration provides none for this rule.
     */
    O defaultOptions();

    /**
     * Services that must be present for the rule to run. Context construction fails when one is missing.
     */
    default Set<Class<?>> requiredServices() {
        return Set.of();
    }

    /**
     * Evaluates one match. Each returned state becomes a separate finding.
     */
    List<S> run(RuleContext<Q, O> ctx);

    default Optional<RuleDiagnostic> diagnostic(RuleContext<Q, O> ctx, S state) {
        return Optional.empty();
    }

    default Optional<RuleAction> action(RuleContext<Q, O> ctx, S state) {
        return Optional.empty();
    }

    /**
     * Range a suppression for this finding should cover. Defaults to the diagnostic's span.
     */
    default Optional<TextRange> textRange(RuleContext<Q, O> ctx, S state) {
        return diagnostic(ctx, state).map(RuleDiagnostic::span);
    }

    /**
     * Produces the suppression edit for a finding anchored at {@code range}.
     * Defaults to asking the language's suppression strategy with this rule's category.
     */
    default Optional<SuppressionEdit> suppress(RuleContext<Q, O> ctx, TextRange range, SuppressionAction suppressionAction) {
        return suppressionAction.produce(ctx.root(), range, metadata().category());
    }

    /**
     * Pure rewrite for the finding, without a diagnostic.
     */
    default Optional<BatchMutation> transform(RuleContext<Q, O> ctx, S state) {
        return Optional.empty();
    }
}
