package io.lintsignal.rule;

/**
 * Thrown when a rule context cannot be built, e.g. because a service the rule needs is not available
 * or its configured options do not fit the rule.
 * It means the rule cannot run in this environment, not that the rule is broken.
 */
public class RuleContextException extends Exception {

    public RuleContextException(String message) {
        super(message);
    }

    public RuleContextException(String message, Throwable cause) {
        super(message, cause);
    }
}
