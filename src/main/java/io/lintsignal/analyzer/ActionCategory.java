package io.lintsignal.analyzer;

/**
 * Category of a code action.
 * <p>
 * Categories have dotted names. A filter matches a category when it equals the category name
 * or is a dotted prefix of it, so {@code "quickfix"} matches both quick fixes and suppressions.
 */
public sealed interface ActionCategory {

    ActionCategory QUICK_FIX = new QuickFix();
    ActionCategory SUPPRESSION = new Suppression();

    String QUICK_FIX_NAME = "quickfix";
    String SUPPRESSION_NAME = "quickfix.suppressRule";

    /**
     * Dotted name of the category.
     */
    String name();

    /**
     * Returns true if the filter equals this category's name or is a dotted prefix of it.
     */
    default boolean matches(String filter) {
        String name = name();
        return name.equals(filter) || name.startsWith(filter + ".");
    }

    /**
     * Fix for the problem reported by a diagnostic.
     */
    record QuickFix() implements ActionCategory {
        @Override
        public String name() {
            return QUICK_FIX_NAME;
        }
    }

    /**
     * Inserts a marker silencing one finding at one location.
     */
    record Suppression() implements ActionCategory {
        @Override
        public String name() {
            return SUPPRESSION_NAME;
        }
    }

    /**
     * Any other action, identified by its dotted name (e.g. "refactor.extract").
     */
    record Other(String name) implements ActionCategory {
        public Other {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("category name cannot be null or blank");
            }
        }
    }
}
