package io.jsonrewriter.core.error;

/**
 * Abstract parent for load-time rule set errors. Thrown by {@code RuleSetParser} before any
 * document is touched. Carries an additional {@code source} field identifying the file or resource
 * that caused the error.
 */
public abstract class RuleLoadException extends RewriteException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected RuleLoadException(String message, String ruleId, String source) {
        super(message, ruleId, Phase.LOAD);
        this.source = source;
    }

    protected RuleLoadException(String message, Throwable cause, String ruleId, String source) {
        super(message, cause, ruleId, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
