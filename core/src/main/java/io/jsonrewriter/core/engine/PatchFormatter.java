package io.jsonrewriter.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jsonrewriter.core.model.PatchOperation;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Renders applied operations as a JSON Patch array: {@code {op,path}} for removals,
 * {@code {op,path,value}} for replacements and {@code {op,from,path}} for moves (renames included).
 */
public final class PatchFormatter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PatchFormatter() {}

    public static ArrayNode toJson(List<PatchOperation> operations) {
        ArrayNode patch = MAPPER.createArrayNode();
        for (PatchOperation operation : operations) {
            ObjectNode entry = patch.addObject();
            entry.put("op", operation.op());
            if (operation instanceof PatchOperation.Move move) {
                entry.put("from", move.from());
            }
            entry.put("path", operation.path());
            if (operation instanceof PatchOperation.Replace replace) {
                entry.set("value", replace.value());
            }
        }
        return patch;
    }

    /** Serializes the patch, indented by two spaces when {@code pretty}. */
    public static String format(List<PatchOperation> operations, boolean pretty) {
        ArrayNode patch = toJson(operations);
        try {
            return pretty
                    ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(patch)
                    : MAPPER.writeValueAsString(patch);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize patch", e);
        }
    }
}
