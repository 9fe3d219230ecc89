package io.lintsignal.analyzer;

import io.lintsignal.config.AnalyzerOptions;
import io.lintsignal.rule.Rule;
import io.lintsignal.rule.RuleContext;
import io.lintsignal.rule.RuleContextException;
import io.lintsignal.rule.ServiceBag;
import io.lintsignal.suppression.SuppressionAction;
import io.lintsignal.suppression.SuppressionComments;
import io.lintsignal.syntax.SyntaxNode;
import io.lintsignal.syntax.TextRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Runs the enabled rules over a syntax tree and hands every finding, wrapped in a {@link RuleSignal},
 * to a {@link SignalVisitor}.
 * <p>
 * Nodes are visited in pre-order; on each node the rules run in registry order. A finding is counted
 * as suppressed and not visited when the first token on the line of its anchor carries a matching
 * {@code lint-ignore} comment. The anchor is the rule's text range, or the matched node without one.
 */
public class Analyzer {

    private static final Logger log = LoggerFactory.getLogger(Analyzer.class);

    private final RuleRegistry registry;
    private final AnalyzerOptions options;
    private final ServiceBag services;
    private final SuppressionAction suppressionAction;

    public Analyzer(RuleRegistry registry,
                    AnalyzerOptions options,
                    ServiceBag services,
                    SuppressionAction suppressionAction) {
        this.registry = registry;
        this.options = options;
        this.services = services;
        this.suppressionAction = suppressionAction;
    }

    /**
     * Analyzes the tree, stopping early if the visitor returns {@link ControlFlow#BREAK}.
     */
    public AnalysisSummary analyze(SyntaxNode root, SignalVisitor visitor) {
        List<Rule<?, ?, ?>> rules = registry.enabledRules(options.config());
        log.debug("Analyzing {} with {} rule(s)", options.filePath(), rules.size());

        Counters counters = new Counters();
        Iterator<SyntaxNode> nodes = root.descendants().iterator();
        while (nodes.hasNext()) {
            SyntaxNode node = nodes.next();
            for (Rule<?, ?, ?> rule : rules) {
                if (evaluate(rule, root, node, visitor, counters) == ControlFlow.BREAK) {
                    return new AnalysisSummary(counters.signals, counters.suppressed, true);
                }
            }
        }
        return new AnalysisSummary(counters.signals, counters.suppressed, false);
    }

    /**
     * Analyzes the whole tree and returns every unsuppressed signal.
     */
    public List<RuleSignal<?, ?, ?>> collect(SyntaxNode root) {
        List<RuleSignal<?, ?, ?>> signals = new ArrayList<>();
        analyze(root, signal -> {
            signals.add(signal);
            return ControlFlow.CONTINUE;
        });
        return signals;
    }

    private <Q, S, O> ControlFlow evaluate(Rule<Q, S, O> rule,
                                           SyntaxNode root,
                                           SyntaxNode node,
                                           SignalVisitor visitor,
                                           Counters counters) {
        Optional<Q> match = rule.query().match(node);
        if (match.isEmpty()) {
            return ControlFlow.CONTINUE;
        }

        RuleContext<Q, O> ctx;
        try {
            ctx = RuleContexts.create(rule, match.get(), root, services, options);
        } catch (RuleContextException e) {
            log.debug("Skipping rule {} on {}: {}", rule.metadata().ruleKey(), node, e.getMessage());
            return ControlFlow.CONTINUE;
        }

        List<S> states = rule.run(ctx);
        String category = rule.metadata().category();
        int nodeStart = node.textTrimmedRange().start();
        for (S state : states) {
            int anchor = rule.textRange(ctx, state).map(TextRange::start).orElse(nodeStart);
            if (SuppressionComments.isSuppressed(root, anchor, category)) {
                counters.suppressed++;
                continue;
            }
            counters.signals++;
            RuleSignal<Q, S, O> signal = new RuleSignal<>(
                    rule, root, match.get(), state, services, suppressionAction, options);
            if (visitor.visit(signal) == ControlFlow.BREAK) {
                return ControlFlow.BREAK;
            }
        }
        return ControlFlow.CONTINUE;
    }

    private static final class Counters {
        int signals;
        int suppressed;
    }
}
