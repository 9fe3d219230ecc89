package io.lintsignal.analyzer;

/**
 * Safety classification of a code fix.
 */
public enum Applicability {
    /**
     * The fix preserves program semantics and may be applied without review.
     */
    ALWAYS,

    /**
     * The fix may change semantics and should only be applied on explicit request.
     */
    MAYBE_INCORRECT
}
