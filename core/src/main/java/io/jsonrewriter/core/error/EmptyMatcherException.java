package io.jsonrewriter.core.error;

/** Thrown when a matcher expression is empty after trimming. */
public final class EmptyMatcherException extends RuleEvalException {

    private static final long serialVersionUID = 1L;

    public EmptyMatcherException(String message) {
        super(message, null);
    }

    public EmptyMatcherException(String message, String ruleId) {
        super(message, ruleId);
    }
}
