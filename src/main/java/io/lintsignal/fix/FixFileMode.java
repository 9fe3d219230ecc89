package io.lintsignal.fix;

import io.lintsignal.analyzer.AnalyzerAction;
import io.lintsignal.analyzer.Applicability;

/**
 * Which actions a fix run applies.
 */
public enum FixFileMode {
    /**
     * Only fixes that are always safe.
     */
    SAFE_FIXES,

    /**
     * Safe and unsafe fixes, but no suppressions.
     */
    SAFE_AND_UNSAFE_FIXES,

    /**
     * Only suppressions.
     */
    SUPPRESSIONS;

    public boolean allows(AnalyzerAction action) {
        return switch (this) {
            case SAFE_FIXES -> !action.isSuppression() && action.applicability() == Applicability.ALWAYS;
            case SAFE_AND_UNSAFE_FIXES -> !action.isSuppression();
            case SUPPRESSIONS -> action.isSuppression();
        };
    }
}
