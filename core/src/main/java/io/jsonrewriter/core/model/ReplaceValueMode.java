package io.jsonrewriter.core.model;

/**
 * How a replace rule interprets its value. {@code AUTO} treats a string starting with {@code $}
 * as a query against the working document; {@code LITERAL} never does.
 */
public enum ReplaceValueMode {
    AUTO("auto"),
    LITERAL("literal");

    private final String id;

    ReplaceValueMode(String id) {
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
    public static ReplaceValueMode fromId(String id) {
        if (id == null) {
            return AUTO;
        }
        for (ReplaceValueMode mode : values()) {
            if (mode.id.equalsIgnoreCase(id)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown mode: '" + id + "' - expected one of auto, literal");
    }
}
