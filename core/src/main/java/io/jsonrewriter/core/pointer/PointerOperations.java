package io.jsonrewriter.core.pointer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jsonrewriter.core.error.PointerIndexOutOfBoundsException;
import io.jsonrewriter.core.error.PointerNotFoundException;
import io.jsonrewriter.core.error.RootMutationException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Pointer-addressed read and write primitives over a Jackson tree.
 *
 * <p>
 * Array segments must be non-negative decimal integers within the array's current bounds;
 * insertion additionally accepts the one-past-end index and the append token {@code -}. Object
 * segments only ever see the node's own fields.
 *
 * <p>
 * Writes that can replace the whole document ({@link #replace}, {@link #insert}) return the
 * resulting root; callers must keep that value. Every write validates before it mutates, so a
 * failed call leaves the tree untouched.
 *
 * <p>
 * Stateless utility class.
 */
public final class PointerOperations {

    /** Array append token. */
    public static final String APPEND_TOKEN = "-";

    private static final Pattern ARRAY_INDEX = Pattern.compile("\\d+");

    private PointerOperations() {}

    /**
     * The container holding a pointer's target plus the target's key within it. Both are {@code
     * null} for the root pointer.
     */
    public record ParentRef(JsonNode parent, String key) {

        static final ParentRef ROOT = new ParentRef(null, null);

        public boolean isRoot() {
            return parent == null;
        }
    }

    /**
     * What a {@link #remove} took out of the tree, enough to put it back with {@link #restore}.
     *
     * @param position array index, or the field's ordinal among the object's fields
     */
    public record Removal(JsonNode parent, String key, int position, JsonNode value) {}

    /**
     * Reads the node at the pointer.
     *
     * @throws PointerNotFoundException if a segment is missing or traverses a scalar
     * @throws PointerIndexOutOfBoundsException if an array segment is invalid or out of bounds
     */
    public static JsonNode read(JsonNode root, Pointer pointer) {
        JsonNode current = root;
        for (String token : pointer.tokens()) {
            current = child(current, token);
        }
        return current;
    }

    /** Reads the node at the pointer, or empty when it does not resolve. */
    public static Optional<JsonNode> find(JsonNode root, Pointer pointer) {
        JsonNode current = root;
        for (String token : pointer.tokens()) {
            if (current == null) {
                return Optional.empty();
            }
            if (current.isArray()) {
                int index = parseIndex(token);
                current = index >= 0 && index < current.size() ? current.get(index) : null;
            } else if (current.isObject()) {
                current = current.get(token);
            } else {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(current);
    }

    public static boolean exists(JsonNode root, Pointer pointer) {
        return find(root, pointer).isPresent();
    }

    /**
     * Resolves the pointer's parent container and final key.
     *
     * @return {@link ParentRef#isRoot() a root ref} for the root pointer
     * @throws PointerNotFoundException if the parent does not resolve
     */
    public static ParentRef parentAndKey(JsonNode root, Pointer pointer) {
        if (pointer.isRoot()) {
            return ParentRef.ROOT;
        }
        JsonNode parent = read(root, pointer.parent());
        return new ParentRef(parent, pointer.lastToken().orElseThrow());
    }

    /**
     * Removes the node at the pointer.
     *
     * @throws RootMutationException for the root pointer
     */
    public static Removal remove(JsonNode root, Pointer pointer) {
        ParentRef ref = parentAndKey(root, pointer);
        if (ref.isRoot()) {
            throw new RootMutationException("Cannot remove the root document");
        }
        String key = ref.key();
        if (ref.parent().isArray()) {
            if (APPEND_TOKEN.equals(key)) {
                throw new PointerIndexOutOfBoundsException("'-' is not allowed when removing array elements", key);
            }
            ArrayNode array = (ArrayNode) ref.parent();
            int index = existingIndex(array, key);
            return new Removal(array, key, index, array.remove(index));
        }
        if (ref.parent().isObject()) {
            ObjectNode object = (ObjectNode) ref.parent();
            if (!object.has(key)) {
                throw new PointerNotFoundException("Property '" + key + "' does not exist");
            }
            int position = fieldPosition(object, key);
            return new Removal(object, key, position, object.remove(key));
        }
        throw new PointerNotFoundException("Cannot remove from non-container value");
    }

    /** Puts a removed node back where it was, including its place in the object's field order. */
    public static void restore(Removal removal) {
        if (removal.parent().isArray()) {
            ((ArrayNode) removal.parent()).insert(removal.position(), removal.value());
            return;
        }
        ObjectNode object = (ObjectNode) removal.parent();
        List<Map.Entry<String, JsonNode>> fields = new ArrayList<>();
        object.fields().forEachRemaining(fields::add);
        object.removeAll();
        int ordinal = 0;
        for (Map.Entry<String, JsonNode> field : fields) {
            if (ordinal++ == removal.position()) {
                object.set(removal.key(), removal.value());
            }
            object.set(field.getKey(), field.getValue());
        }
        if (!object.has(removal.key())) {
            object.set(removal.key(), removal.value());
        }
    }

    /**
     * Overwrites an existing location. Replacing the root returns {@code value} as the new root.
     *
     * @return the resulting root
     * @throws io.jsonrewriter.core.error.UnsafePointerException if any segment is reserved
     * @throws PointerNotFoundException if the location does not exist
     */
    public static JsonNode replace(JsonNode root, Pointer pointer, JsonNode value) {
        pointer.requireSafe();
        ParentRef ref = parentAndKey(root, pointer);
        if (ref.isRoot()) {
            return value;
        }
        String key = ref.key();
        if (ref.parent().isArray()) {
            if (APPEND_TOKEN.equals(key)) {
                throw new PointerIndexOutOfBoundsException("'-' is not allowed when replacing array elements", key);
            }
            ArrayNode array = (ArrayNode) ref.parent();
            array.set(existingIndex(array, key), value);
            return root;
        }
        if (ref.parent().isObject()) {
            ObjectNode object = (ObjectNode) ref.parent();
            if (!object.has(key)) {
                throw new PointerNotFoundException("Property '" + key + "' does not exist");
            }
            object.set(key, value);
            return root;
        }
        throw new PointerNotFoundException("Cannot replace within non-container value");
    }

    /**
     * Adds a value. Arrays shift later elements right (index {@code size} or {@code -} appends);
     * objects gain the key, overwriting a present one. Inserting at the root returns {@code value}
     * as the new root.
     *
     * @return the resulting root
     * @throws io.jsonrewriter.core.error.UnsafePointerException if any segment is reserved
     */
    public static JsonNode insert(JsonNode root, Pointer pointer, JsonNode value) {
        pointer.requireSafe();
        ParentRef ref = parentAndKey(root, pointer);
        if (ref.isRoot()) {
            return value;
        }
        String key = ref.key();
        if (ref.parent().isArray()) {
            ArrayNode array = (ArrayNode) ref.parent();
            if (APPEND_TOKEN.equals(key)) {
                array.add(value);
                return root;
            }
            int index = requireIndex(key);
            if (index > array.size()) {
                throw outOfBounds(key);
            }
            array.insert(index, value);
            return root;
        }
        if (ref.parent().isObject()) {
            ((ObjectNode) ref.parent()).set(key, value);
            return root;
        }
        throw new PointerNotFoundException("Cannot add within non-container value");
    }

    /**
     * Parses an array segment, returning {@code -1} when it is not a non-negative integer. Values
     * too large for an {@code int} map to {@link Integer#MAX_VALUE}, which no array reaches.
     */
    public static int parseIndex(String token) {
        if (!ARRAY_INDEX.matcher(token).matches()) {
            return -1;
        }
        String digits = token.replaceFirst("^0+(?=\\d)", "");
        if (digits.length() > 9) {
            return Integer.MAX_VALUE;
        }
        return Integer.parseInt(digits);
    }

    private static JsonNode child(JsonNode node, String token) {
        if (node.isArray()) {
            if (APPEND_TOKEN.equals(token)) {
                throw new PointerIndexOutOfBoundsException("Cannot resolve '-' within JSON pointer", token);
            }
            return node.get(existingIndex((ArrayNode) node, token));
        }
        if (node.isObject()) {
            JsonNode child = node.get(token);
            if (child == null) {
                throw new PointerNotFoundException("Property '" + token + "' does not exist");
            }
            return child;
        }
        throw new PointerNotFoundException("Cannot traverse pointer segment '" + token + "' on non-container value");
    }

    private static int existingIndex(ArrayNode array, String token) {
        int index = requireIndex(token);
        if (index >= array.size()) {
            throw outOfBounds(token);
        }
        return index;
    }

    private static int requireIndex(String token) {
        int index = parseIndex(token);
        if (index < 0) {
            throw new PointerIndexOutOfBoundsException(
                    "Array index '" + token + "' is not a non-negative integer", token);
        }
        return index;
    }

    private static PointerIndexOutOfBoundsException outOfBounds(String token) {
        return new PointerIndexOutOfBoundsException("Array index " + token + " is out of bounds", token);
    }

    private static int fieldPosition(ObjectNode object, String key) {
        int position = 0;
        for (Iterator<String> names = object.fieldNames(); names.hasNext(); position++) {
            if (names.next().equals(key)) {
                return position;
            }
        }
        return position;
    }
}
