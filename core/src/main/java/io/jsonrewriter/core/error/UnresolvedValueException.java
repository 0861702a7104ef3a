package io.jsonrewriter.core.error;

/** Thrown when a replace rule carries no value to write. */
public final class UnresolvedValueException extends RuleEvalException {

    private static final long serialVersionUID = 1L;

    public UnresolvedValueException(String message) {
        super(message, null);
    }

    public UnresolvedValueException(String message, String ruleId) {
        super(message, ruleId);
    }
}
