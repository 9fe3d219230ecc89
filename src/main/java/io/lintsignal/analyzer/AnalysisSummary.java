package io.lintsignal.analyzer;

/**
 * Outcome of one analysis run.
 *
 * @param signals     Number of signals handed to the visitor
 * @param suppressed  Number of signals silenced by suppression comments
 * @param interrupted Whether the visitor stopped the run early
 */
public record AnalysisSummary(int signals, int suppressed, boolean interrupted) {
}
