package io.jsonrewriter.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.jsonrewriter.core.error.RuleEvalException;
import io.jsonrewriter.core.pointer.Pointer;
import io.jsonrewriter.core.pointer.PointerOperations;
import io.jsonrewriter.core.pointer.PointerOperations.Removal;
import java.util.Objects;

/**
 * The single mutable tree of one rewrite run. Starts as a deep copy of the caller's input and is
 * mutated in place by every applied operation; the root reference changes only when an operation
 * targets the root pointer.
 *
 * <p>
 * NOT thread-safe. A run owns its working document exclusively and passes it explicitly to each
 * component.
 */
public final class WorkingDocument {

    private JsonNode root;

    private WorkingDocument(JsonNode root) {
        this.root = root;
    }

    /** Creates a working document from a deep copy of {@code input}; the input is never touched. */
    public static WorkingDocument copyOf(JsonNode input) {
        Objects.requireNonNull(input, "input must not be null");
        return new WorkingDocument(input.deepCopy());
    }

    public JsonNode root() {
        return root;
    }

    public JsonNode read(Pointer pointer) {
        return PointerOperations.read(root, pointer);
    }

    public void remove(Pointer pointer) {
        PointerOperations.remove(root, pointer);
    }

    public void replace(Pointer pointer, JsonNode value) {
        root = PointerOperations.replace(root, pointer, value);
    }

    public void insert(Pointer pointer, JsonNode value) {
        root = PointerOperations.insert(root, pointer, value);
    }

    /**
     * Moves a deep copy of the node at {@code from} to {@code to}: read, remove, then insert. If
     * the insert fails, the removed node is restored in place before the failure propagates. A
     * reserved destination segment is rejected before anything is removed.
     */
    public void move(Pointer from, Pointer to) {
        to.requireSafe();
        JsonNode value = read(from).deepCopy();
        Removal removal = PointerOperations.remove(root, from);
        try {
            insert(to, value);
        } catch (RuleEvalException e) {
            PointerOperations.restore(removal);
            throw e;
        }
    }
}
