package io.lintsignal.analyzer;

import java.util.Optional;

/**
 * Result of one analysis event, queried lazily.
 * <p>
 * Every call computes its answer afresh and has no side effects, so calling an accessor twice yields
 * equal results. Action and transformation sequences are always finite and know their size.
 */
public interface AnalyzerSignal {

    /**
     * The diagnostic for this event, if any.
     */
    Optional<AnalyzerDiagnostic> diagnostic();

    /**
     * Fix and suppression actions, fix first.
     */
    AnalyzerActionIterator actions();

    /**
     * Pure rewrites that come without a diagnostic.
     */
    AnalyzerTransformationIterator transformations();
}
