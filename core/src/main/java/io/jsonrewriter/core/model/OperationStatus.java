package io.jsonrewriter.core.model;

/** Outcome of applying one staged operation. */
public enum OperationStatus {
    APPLIED,
    SKIPPED
}
