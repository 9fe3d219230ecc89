package io.lintsignal.analyzer;

import io.lintsignal.mutation.BatchMutation;

/**
 * Pure rewrite produced by a rule, with no diagnostic or message attached.
 *
 * @param mutation The edits to apply
 */
public record AnalyzerTransformation(BatchMutation mutation) {

    public AnalyzerTransformation {
        if (mutation == null) {
            throw new IllegalArgumentException("mutation cannot be null");
        }
    }

    /**
     * Each call returns a fresh copy of the edits.
     */
    @Override
    public BatchMutation mutation() {
        return mutation.copy();
    }
}
