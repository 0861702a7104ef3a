package io.jsonrewriter.core.error;

/**
 * Abstract parent for errors raised while a rule is evaluated, resolved or applied. The rewriter
 * catches these internally and turns them into rule-scoped diagnostic messages; they never cross
 * the {@code DocumentRewriter.rewrite()} boundary.
 */
public abstract class RuleEvalException extends RewriteException {

    private static final long serialVersionUID = 1L;

    protected RuleEvalException(String message, String ruleId) {
        super(message, ruleId, Phase.EVALUATION);
    }

    protected RuleEvalException(String message, Throwable cause, String ruleId) {
        super(message, cause, ruleId, Phase.EVALUATION);
    }
}
