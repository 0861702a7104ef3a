package io.jsonrewriter.core.model;

/** Rule kinds. {@link #RENAME} applies as a move patch but is reported under its own kind. */
public enum RuleKind {
    REMOVE("remove"),
    REPLACE("replace"),
    MOVE("move"),
    RENAME("rename");

    private final String id;

    RuleKind(String id) {
        this.id = id;
    }

    /** The lowercase identifier used in rule files and diagnostics. */
    public String id() {
        return id;
    }

    /**
     * Resolves a kind by identifier (case-insensitive).
     *
     * @throws IllegalArgumentException if no kind matches
     */
    public static RuleKind fromId(String id) {
        for (RuleKind kind : values()) {
            if (kind.id.equalsIgnoreCase(id)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown rule op: '" + id + "' - expected one of remove, replace, move, rename");
    }

    @Override
    public String toString() {
        return id;
    }
}
