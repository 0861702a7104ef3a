package io.jsonrewriter.core.error;

/**
 * Thrown when a replace value, move target or rename key query had to resolve to exactly one
 * result but resolved to {@link #actualCount()} results.
 */
public final class ValueArityException extends RuleEvalException {

    private static final long serialVersionUID = 1L;

    private final String expression;
    private final int actualCount;

    public ValueArityException(String message, String expression, int actualCount) {
        super(message, null);
        this.expression = expression;
        this.actualCount = actualCount;
    }

    public String expression() {
        return expression;
    }

    public int actualCount() {
        return actualCount;
    }

    /** {@code true} when the query produced no result at all. */
    public boolean isEmptyResult() {
        return actualCount == 0;
    }
}
