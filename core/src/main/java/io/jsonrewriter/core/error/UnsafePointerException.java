package io.jsonrewriter.core.error;

/**
 * Thrown when a write would target one of the reserved inheritance-chain keys ({@code __proto__},
 * {@code prototype}, {@code constructor}). Raised before anything is mutated.
 */
public final class UnsafePointerException extends RuleEvalException {

    private static final long serialVersionUID = 1L;

    private final String segment;

    public UnsafePointerException(String segment) {
        super("Unsafe pointer segment '" + segment + "' is not allowed", null);
        this.segment = segment;
    }

    /** The offending pointer segment. */
    public String segment() {
        return segment;
    }
}
