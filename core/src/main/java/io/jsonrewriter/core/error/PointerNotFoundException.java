package io.jsonrewriter.core.error;

/** Thrown when a pointer segment does not name an own member of the node being traversed. */
public final class PointerNotFoundException extends RuleEvalException {

    private static final long serialVersionUID = 1L;

    public PointerNotFoundException(String message) {
        super(message, null);
    }

    public PointerNotFoundException(String message, String ruleId) {
        super(message, ruleId);
    }
}
