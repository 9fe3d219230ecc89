package io.lintsignal.analyzer;

import io.lintsignal.diagnostic.DiagnosticError;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Signal built from a diagnostic factory, for callers that want to raise a diagnostic
 * (and optionally offer one fix) without writing a rule.
 * <p>
 * Example:
 * <pre>{@code
 * AnalyzerSignal signal = DiagnosticSignal.of(() -> new ParseError(range, "Unterminated string"))
 *         .withAction(() -> Optional.of(closeStringAction));
 * }</pre>
 */
public final class DiagnosticSignal implements AnalyzerSignal {

    private final Supplier<? extends DiagnosticError> factory;
    private final Supplier<Optional<AnalyzerAction>> actionFactory;

    private DiagnosticSignal(Supplier<? extends DiagnosticError> factory,
                             Supplier<Optional<AnalyzerAction>> actionFactory) {
        this.factory = factory;
        this.actionFactory = actionFactory;
    }

    public static DiagnosticSignal of(Supplier<? extends DiagnosticError> factory) {
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        return new DiagnosticSignal(factory, Optional::empty);
    }

    /**
     * Returns a signal with the same diagnostic factory and the given fix factory.
     * A signal carries at most one fix factory; this replaces any earlier one.
     */
    public DiagnosticSignal withAction(Supplier<Optional<AnalyzerAction>> actionFactory) {
        if (actionFactory == null) {
            throw new IllegalArgumentException("actionFactory cannot be null");
        }
        return new DiagnosticSignal(factory, actionFactory);
    }

    @Override
    public Optional<AnalyzerDiagnostic> diagnostic() {
        return Optional.of(AnalyzerDiagnostic.fromError(factory.get()));
    }

    @Override
    public AnalyzerActionIterator actions() {
        return actionFactory.get()
                .map(action -> AnalyzerActionIterator.of(List.of(action)))
                .orElseGet(AnalyzerActionIterator::empty);
    }

    @Override
    public AnalyzerTransformationIterator transformations() {
        return AnalyzerTransformationIterator.empty();
    }
}
