package io.jsonrewriter.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.UncheckedIOException;

/** Textual renderings of a rewritten document. */
public enum OutputEncoding {
    /** Indented JSON (two spaces). */
    JSON_PRETTY("json-pretty", "Human-friendly JSON with indentation."),
    /** Minified JSON without whitespace. */
    JSON_COMPACT("json-compact", "Minified JSON without whitespace.");

    public static final String CONTENT_TYPE = "application/json";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectMapper PRETTY_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final String id;
    private final String description;

    OutputEncoding(String id, String description) {
        this.id = id;
        this.description = description;
    }

    public String id() {
        return id;
    }

    public String description() {
        return description;
    }

    public String contentType() {
        return CONTENT_TYPE;
    }

    /** Renders a tree in this encoding. */
    public String encode(JsonNode node) {
        try {
            return (this == JSON_PRETTY ? PRETTY_MAPPER : MAPPER).writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to encode document as " + id, e);
        }
    }

    /**
     * Resolves an encoding by identifier. {@code null} resolves to {@link #JSON_PRETTY}.
     *
     * @throws IllegalArgumentException if no encoding matches
     */
    public static OutputEncoding fromId(String id) {
        if (id == null) {
            return JSON_PRETTY;
        }
        for (OutputEncoding encoding : values()) {
            if (encoding.id.equalsIgnoreCase(id)) {
                return encoding;
            }
        }
        throw new IllegalArgumentException("Unknown output encoding: '" + id + "'");
    }
}
