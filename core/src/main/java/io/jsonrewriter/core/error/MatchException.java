package io.jsonrewriter.core.error;

/**
 * Thrown when a matcher expression cannot be evaluated against the working document. When the
 * underlying failure looks like a dereference of a missing property, {@link #guidance()} carries a
 * hint recommending existence-guarded filter predicates; the hint is already appended to the
 * message.
 */
public final class MatchException extends RuleEvalException {

    private static final long serialVersionUID = 1L;

    private final String guidance;

    public MatchException(String message, Throwable cause, String guidance) {
        super(guidance == null ? message : message + ". " + guidance, cause, null);
        this.guidance = guidance;
    }

    /** The guidance appended to the message, or {@code null} if none applies. */
    public String guidance() {
        return guidance;
    }
}
