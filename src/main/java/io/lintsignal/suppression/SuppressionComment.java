package io.lintsignal.suppression;

/**
 * A parsed {@code lint-ignore} comment.
 *
 * @param category Category it suppresses, a full rule category or a prefix such as {@code lint/a11y}
 * @param reason   Why the finding is suppressed
 */
public record SuppressionComment(String category, String reason) {

    /**
     * Returns true if this comment silences the rule with the given category.
     */
    public boolean suppresses(String ruleCategory) {
        return ruleCategory.equals(category) || ruleCategory.startsWith(category + "/");
    }
}
