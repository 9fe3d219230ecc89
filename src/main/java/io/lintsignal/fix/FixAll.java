package io.lintsignal.fix;

import io.lintsignal.analyzer.Analyzer;
import io.lintsignal.analyzer.AnalyzerAction;
import io.lintsignal.analyzer.AnalyzerActionIterator;
import io.lintsignal.analyzer.AnalyzerTransformationIterator;
import io.lintsignal.analyzer.ControlFlow;
import io.lintsignal.analyzer.RuleRegistry;
import io.lintsignal.analyzer.RuleSignal;
import io.lintsignal.config.AnalyzerOptions;
import io.lintsignal.mutation.BatchMutation;
import io.lintsignal.rule.RuleKey;
import io.lintsignal.rule.ServiceBag;
import io.lintsignal.suppression.SuppressionAction;
import io.lintsignal.syntax.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Applies fixes to a tree until none is left.
 * <p>
 * Each round analyzes the current tree, commits the first action the mode allows and starts over on the
 * new tree, since every edit invalidates the positions of all other findings.
 */
public final class FixAll {

    private static final Logger log = LoggerFactory.getLogger(FixAll.class);

    /**
     * Upper bound on the number of rounds before the run is considered stuck.
     */
    public static final int MAX_ITERATIONS = 1000;

    private FixAll() {
    }

    private record Candidate(RuleKey rule, BatchMutation mutation) {}

    /**
     * Applies the actions allowed by {@code mode} until a fixpoint is reached.
     *
     * @throws FixLoopException if more than {@link #MAX_ITERATIONS} rounds were needed
     */
    public static FixFileResult apply(SyntaxNode root,
                                      RuleRegistry registry,
                                      AnalyzerOptions options,
                                      ServiceBag services,
                                      SuppressionAction suppressionAction,
                                      FixFileMode mode) throws FixLoopException {
        Analyzer analyzer = new Analyzer(registry, options, services, suppressionAction);
        return run(root, analyzer, signal -> firstAllowedAction(signal, mode));
    }

    /**
     * Applies pure transformations until a fixpoint is reached.
     *
     * @throws FixLoopException if more than {@link #MAX_ITERATIONS} rounds were needed
     */
    public static FixFileResult applyTransformations(SyntaxNode root,
                                                     RuleRegistry registry,
                                                     AnalyzerOptions options,
                                                     ServiceBag services,
                                                     SuppressionAction suppressionAction) throws FixLoopException {
        Analyzer analyzer = new Analyzer(registry, options, services, suppressionAction);
        return run(root, analyzer, signal -> {
            AnalyzerTransformationIterator transformations = signal.transformations();
            return transformations.hasNext()
                    ? Optional.of(transformations.next().mutation())
                    : Optional.empty();
        });
    }

    private static Optional<BatchMutation> firstAllowedAction(RuleSignal<?, ?, ?> signal, FixFileMode mode) {
        AnalyzerActionIterator actions = signal.actions();
        while (actions.hasNext()) {
            AnalyzerAction action = actions.next();
            if (mode.allows(action)) {
                return Optional.of(action.mutation());
            }
        }
        return Optional.empty();
    }

    private static FixFileResult run(SyntaxNode root,
                                     Analyzer analyzer,
                                     Function<RuleSignal<?, ?, ?>, Optional<BatchMutation>> pick) throws FixLoopException {
        SyntaxNode current = root;
        Set<RuleKey> rulesApplied = new LinkedHashSet<>();
        int applied = 0;

        while (true) {
            Candidate[] found = new Candidate[1];
            analyzer.analyze(current, signal -> {
                Optional<BatchMutation> mutation = pick.apply(signal);
                if (mutation.isEmpty() || mutation.get().isEmpty()) {
                    return ControlFlow.CONTINUE;
                }
                found[0] = new Candidate(signal.ruleKey(), mutation.get());
                return ControlFlow.BREAK;
            });

            if (found[0] == null) {
                log.debug("Fixpoint reached after {} edit(s)", applied);
                return new FixFileResult(current, applied, rulesApplied);
            }
            if (applied >= MAX_ITERATIONS) {
                throw new FixLoopException("Fixes did not converge after " + MAX_ITERATIONS
                        + " iterations, last rule: " + found[0].rule(), applied);
            }

            current = found[0].mutation().commit();
            rulesApplied.add(found[0].rule());
            applied++;
            log.debug("Applied edit from {}", found[0].rule());
        }
    }
}
