package io.jsonrewriter.core.error;

/** Thrown when an array segment is not a non-negative integer within the array's bounds. */
public final class PointerIndexOutOfBoundsException extends RuleEvalException {

    private static final long serialVersionUID = 1L;

    private final String token;

    public PointerIndexOutOfBoundsException(String message, String token) {
        super(message, null);
        this.token = token;
    }

    /** The raw (unescaped) array segment. */
    public String token() {
        return token;
    }
}
