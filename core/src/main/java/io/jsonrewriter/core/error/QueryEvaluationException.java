package io.jsonrewriter.core.error;

/**
 * Thrown by {@link io.jsonrewriter.core.spi.QueryEvaluator} implementations when an expression
 * fails to parse or evaluate. The message is the query library's own description of the failure.
 */
public final class QueryEvaluationException extends RuleEvalException {

    private static final long serialVersionUID = 1L;

    public QueryEvaluationException(String message) {
        super(message, null);
    }

    public QueryEvaluationException(String message, Throwable cause) {
        super(message, cause, null);
    }
}
