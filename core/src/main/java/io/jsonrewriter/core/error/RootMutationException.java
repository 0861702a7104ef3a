package io.jsonrewriter.core.error;

/** Thrown when an operation that needs a parent (remove, rename) targets the document root. */
public final class RootMutationException extends RuleEvalException {

    private static final long serialVersionUID = 1L;

    public RootMutationException(String message) {
        super(message, null);
    }

    public RootMutationException(String message, String ruleId) {
        super(message, ruleId);
    }
}
