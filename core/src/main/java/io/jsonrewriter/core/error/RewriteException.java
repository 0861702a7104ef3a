package io.jsonrewriter.core.error;

/**
 * Root of the json-rewriter exception tree: {@link RuleLoadException} for rule set loading,
 * {@link RuleEvalException} for failures inside a run.
 *
 * <p>
 * Low-level helpers (pointer primitives, query evaluators) do not know which rule they serve, so
 * they throw without a rule id; the component that catches the failure fills it in with
 * {@link #withRuleId(String)} before reporting it.
 */
public abstract class RewriteException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        /** Reading and validating a rule set. */
        LOAD,
        /** Matching, resolving or applying a rule during a run. */
        EVALUATION
    }

    private final Phase phase;
    private String ruleId;

    protected RewriteException(String message, String ruleId, Phase phase) {
        super(message);
        this.ruleId = ruleId;
        this.phase = phase;
    }

    protected RewriteException(String message, Throwable cause, String ruleId, Phase phase) {
        super(message, cause);
        this.ruleId = ruleId;
        this.phase = phase;
    }

    /** The rule that triggered the error, or {@code null} if not yet identified. */
    public String ruleId() {
        return ruleId;
    }

    public Phase phase() {
        return phase;
    }

    /**
     * Records the rule this failure belongs to. An id that is already set is kept.
     *
     * @return this exception
     */
    public RewriteException withRuleId(String id) {
        if (ruleId == null) {
            ruleId = id;
        }
        return this;
    }

    @Override
    public String toString() {
        String rule = ruleId != null ? ruleId : "?";
        return getClass().getSimpleName() + "[rule=" + rule + ", phase=" + phase + "]: " + getMessage();
    }
}
