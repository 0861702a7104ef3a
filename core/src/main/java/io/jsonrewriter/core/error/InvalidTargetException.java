package io.jsonrewriter.core.error;

/** Thrown when a move or rename target is malformed or cannot address a valid destination. */
public final class InvalidTargetException extends RuleEvalException {

    private static final long serialVersionUID = 1L;

    public InvalidTargetException(String message) {
        super(message, null);
    }

    public InvalidTargetException(String message, String ruleId) {
        super(message, ruleId);
    }
}
