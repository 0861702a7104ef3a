package io.jsonrewriter.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * The minimal record of one applied mutation, shaped like a JSON Patch (RFC 6902) operation so a
 * generic remove/replace/move replayer can apply it. Paths are escaped pointer strings.
 */
public sealed interface PatchOperation {

    /** The patch {@code op} member. */
    String op();

    /** The patch {@code path} member (the destination for moves). */
    String path();

    record Remove(String path) implements PatchOperation {
        public Remove {
            Objects.requireNonNull(path, "path must not be null");
        }

        @Override
        public String op() {
            return "remove";
        }
    }

    record Replace(String path, JsonNode value) implements PatchOperation {
        public Replace {
            Objects.requireNonNull(path, "path must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String op() {
            return "replace";
        }
    }

    record Move(String from, String path) implements PatchOperation {
        public Move {
            Objects.requireNonNull(from, "from must not be null");
            Objects.requireNonNull(path, "path must not be null");
        }

        @Override
        public String op() {
            return "move";
        }
    }
}
