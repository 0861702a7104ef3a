package io.jsonrewriter.core.model;

/**
 * Per-operation outcome reported in a {@link RuleDiagnostic}.
 *
 * @param pointer the matched location, escaped
 * @param message failure description for {@link OperationStatus#SKIPPED}, otherwise {@code null}
 */
public record OperationDiagnostic(
        int matchIndex, String pointer, RuleKind kind, PatchOperation patch, OperationStatus status, String message) {

    public static OperationDiagnostic applied(StagedOperation staged) {
        return new OperationDiagnostic(
                staged.matchIndex(),
                staged.pointer().toString(),
                staged.kind(),
                staged.patch(),
                OperationStatus.APPLIED,
                null);
    }

    public static OperationDiagnostic skipped(StagedOperation staged, String message) {
        return new OperationDiagnostic(
                staged.matchIndex(),
                staged.pointer().toString(),
                staged.kind(),
                staged.patch(),
                OperationStatus.SKIPPED,
                message);
    }

    public boolean isApplied() {
        return status == OperationStatus.APPLIED;
    }
}
