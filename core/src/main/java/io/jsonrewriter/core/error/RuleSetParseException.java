package io.jsonrewriter.core.error;

/** Thrown when a rule set file has invalid syntax, fails schema validation or has invalid fields. */
public final class RuleSetParseException extends RuleLoadException {

    private static final long serialVersionUID = 1L;

    public RuleSetParseException(String message, String ruleId, String source) {
        super(message, ruleId, source);
    }

    public RuleSetParseException(String message, Throwable cause, String ruleId, String source) {
        super(message, cause, ruleId, source);
    }
}
