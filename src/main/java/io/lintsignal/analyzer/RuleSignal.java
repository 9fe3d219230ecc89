package io.lintsignal.analyzer;

import io.lintsignal.config.AnalyzerOptions;
import io.lintsignal.config.RuleLevel;
import io.lintsignal.rule.Rule;
import io.lintsignal.rule.RuleContext;
import io.lintsignal.rule.RuleContextException;
import io.lintsignal.rule.RuleKey;
import io.lintsignal.rule.ServiceBag;
import io.lintsignal.suppression.SuppressionAction;
import io.lintsignal.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Signal binding a rule to one of its findings.
 * <p>
 * The signal owns the query result and the rule state. The tree, services, suppression strategy and
 * options are shared with the rest of the analysis and must outlive the signal. Each accessor builds
 * its own {@link RuleContext} and calls the matching rule hook; nothing is cached between calls.
 * When the context cannot be built (a required service is missing, or the configured options do not
 * fit the rule) the accessor returns no result.
 *
 * @param <Q> query result type
 * @param <S> rule state type
 * @param <O> rule options type
 */
public final class RuleSignal<Q, S, O> implements AnalyzerSignal {

    private final Rule<Q, S, O> rule;
    private final SyntaxNode root;
    private final Q query;
    private final S state;
    private final ServiceBag services;
    private final SuppressionAction suppressionAction;
    private final AnalyzerOptions options;

    public RuleSignal(Rule<Q, S, O> rule,
                      SyntaxNode root,
                      Q query,
                      S state,
                      ServiceBag services,
                      SuppressionAction suppressionAction,
                      AnalyzerOptions options) {
        this.rule = rule;
        this.root = root;
        this.query = query;
        this.state = state;
        this.services = services;
        this.suppressionAction = suppressionAction;
        this.options = options;
    }

    public Rule<Q, S, O> rule() {
        return rule;
    }

    public RuleKey ruleKey() {
        return rule.metadata().ruleKey();
    }

    public Q query() {
        return query;
    }

    public S state() {
        return state;
    }

    @Override
    public Optional<AnalyzerDiagnostic> diagnostic() {
        Optional<RuleContext<Q, O>> ctx = context();
        if (ctx.isEmpty()) {
            return Optional.empty();
        }
        Optional<AnalyzerDiagnostic> diagnostic = rule.diagnostic(ctx.get(), state)
                .map(AnalyzerDiagnostic::fromError);
        return diagnostic.map(d -> options.ruleLevel(ruleKey())
                .flatMap(RuleLevel::severity)
                .map(d::withSeverity)
                .orElse(d));
    }

    @Override
    public AnalyzerActionIterator actions() {
        FixPolicy policy = FixPolicy.resolve(options.ruleFixKind(ruleKey()));
        if (policy.isDisabled()) {
            return AnalyzerActionIterator.empty();
        }
        Optional<RuleContext<Q, O>> ctx = context();
        if (ctx.isEmpty()) {
            return AnalyzerActionIterator.empty();
        }

        Optional<RuleKey> identity = Optional.of(ruleKey());
        List<AnalyzerAction> actions = new ArrayList<>(2);
        rule.action(ctx.get(), state).ifPresent(action -> actions.add(new AnalyzerAction(
                identity,
                action.category(),
                policy.applicabilityFor(action.applicability()),
                action.message(),
                action.mutation())));

        rule.textRange(ctx.get(), state)
                .flatMap(range -> rule.suppress(ctx.get(), range, suppressionAction))
                .ifPresent(suppression -> actions.add(new AnalyzerAction(
                        identity,
                        ActionCategory.SUPPRESSION,
                        Applicability.ALWAYS,
                        suppression.message(),
                        suppression.mutation())));

        return AnalyzerActionIterator.of(actions);
    }

    @Override
    public AnalyzerTransformationIterator transformations() {
        Optional<RuleContext<Q, O>> ctx = context();
        if (ctx.isEmpty()) {
            return AnalyzerTransformationIterator.empty();
        }
        return rule.transform(ctx.get(), state)
                .map(mutation -> AnalyzerTransformationIterator.of(List.of(new AnalyzerTransformation(mutation))))
                .orElseGet(AnalyzerTransformationIterator::empty);
    }

    private Optional<RuleContext<Q, O>> context() {
        try {
            return Optional.of(RuleContexts.create(rule, query, root, services, options));
        } catch (RuleContextException e) {
            // missing service or unusable options: nothing to report
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return "RuleSignal[" + ruleKey() + ", " + state + "]";
    }
}
