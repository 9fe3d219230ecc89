package io.lintsignal.analyzer;

/**
 * Receives the signals of an analysis run, in tree order.
 */
@FunctionalInterface
public interface SignalVisitor {

    ControlFlow visit(RuleSignal<?, ?, ?> signal);
}
