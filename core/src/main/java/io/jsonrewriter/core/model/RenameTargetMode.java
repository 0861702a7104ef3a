package io.jsonrewriter.core.model;

/**
 * How a rename rule derives the new key: inferred from the leading character, the trimmed
 * literal, or a query scoped to the parent object.
 */
public enum RenameTargetMode {
    AUTO("auto"),
    LITERAL("literal"),
    JSONPATH("jsonpath");

    private final String id;

    RenameTargetMode(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Resolves a mode by identifier (case-insensitive). {@code null} resolves to the default.
     *
     * @throws IllegalArgumentException if no mode matches
     */
    public static RenameTargetMode fromId(String id) {
        if (id == null) {
            return AUTO;
        }
        for (RenameTargetMode mode : values()) {
            if (mode.id.equalsIgnoreCase(id)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown mode: '" + id + "' - expected one of auto, literal, jsonpath");
    }
}
