package io.jsonrewriter.core.error;

/** Thrown when a rename would move a property onto a key its parent object already owns. */
public final class RenameCollisionException extends RuleEvalException {

    private static final long serialVersionUID = 1L;

    private final String key;

    public RenameCollisionException(String key) {
        super("Property '" + key + "' already exists on the target object", null);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
