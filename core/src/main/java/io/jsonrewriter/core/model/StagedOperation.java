package io.jsonrewriter.core.model;

import io.jsonrewriter.core.pointer.Pointer;
import java.util.Objects;

/**
 * A resolved, not yet applied operation.
 *
 * @param matchIndex position of the originating match in the rule's deduplicated match list
 * @param pointer the matched location
 * @param kind the rule kind that produced it ({@link RuleKind#RENAME} carries a move patch)
 * @param patch the mutation to apply
 */
public record StagedOperation(int matchIndex, Pointer pointer, RuleKind kind, PatchOperation patch) {

    public StagedOperation {
        Objects.requireNonNull(pointer, "pointer must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(patch, "patch must not be null");
    }
}
