package io.lintsignal.analyzer;

import io.lintsignal.config.AnalyzerOptions;
import io.lintsignal.config.ConfigurationException;
import io.lintsignal.rule.Rule;
import io.lintsignal.rule.RuleContext;
import io.lintsignal.rule.RuleContextException;
import io.lintsignal.rule.ServiceBag;
import io.lintsignal.syntax.SyntaxNode;

/**
 * Builds the context a rule runs with from the run options. Shared by the dispatch loop and the signals.
 */
final class RuleContexts {

    private RuleContexts() {
    }

    /**
     * @throws RuleContextException if a required service is missing or the configured options do not
     *                              convert into the rule's options type
     */
    static <Q, O> RuleContext<Q, O> create(Rule<Q, ?, O> rule,
                                           Q query,
                                           SyntaxNode root,
                                           ServiceBag services,
                                           AnalyzerOptions options) throws RuleContextException {
        O ruleOptions;
        try {
            ruleOptions = options.ruleOptions(rule).orElseGet(rule::defaultOptions);
        } catch (ConfigurationException e) {
            throw new RuleContextException(e.getMessage(), e);
        }
        return RuleContext.builder(rule, query)
                .root(root)
                .services(services)
                .globals(options.globals())
                .filePath(options.filePath())
                .options(ruleOptions)
                .preferredQuote(options.preferredQuote())
                .jsxRuntime(options.jsxRuntime())
                .build();
    }
}
