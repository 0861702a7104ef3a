package io.jsonrewriter.core.model;

/**
 * How a move rule interprets its target: inferred from the leading character, a literal pointer,
 * or a query that must select exactly one location.
 */
public enum MoveTargetMode {
    AUTO("auto"),
    POINTER("pointer"),
    JSONPATH("jsonpath");

    private final String id;

    MoveTargetMode(String id) {
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
    public static MoveTargetMode fromId(String id) {
        if (id == null) {
            return AUTO;
        }
        for (MoveTargetMode mode : values()) {
            if (mode.id.equalsIgnoreCase(id)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown mode: '" + id + "' - expected one of auto, pointer, jsonpath");
    }
}
