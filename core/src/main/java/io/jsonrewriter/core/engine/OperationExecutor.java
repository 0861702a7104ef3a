package io.jsonrewriter.core.engine;

import io.jsonrewriter.core.error.RuleEvalException;
import io.jsonrewriter.core.model.OperationDiagnostic;
import io.jsonrewriter.core.model.PatchOperation;
import io.jsonrewriter.core.model.Rule;
import io.jsonrewriter.core.model.StagedOperation;
import io.jsonrewriter.core.pointer.Pointer;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a rule's staged operations, in order, to the working document. Each operation either
 * applies fully or is skipped with a recorded reason; a failure never aborts the remaining
 * operations.
 */
public final class OperationExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(OperationExecutor.class);

    /**
     * Execution outcome for one rule.
     *
     * @param operations one diagnostic per staged operation, in application order
     * @param applied patch records of the operations that applied
     * @param errors {@code "<Kind> <pointer> failed: <reason>"} per skipped operation
     */
    public record ExecutionResult(
            List<OperationDiagnostic> operations, List<PatchOperation> applied, List<String> errors) {
        public ExecutionResult {
            operations = List.copyOf(operations);
            applied = List.copyOf(applied);
            errors = List.copyOf(errors);
        }
    }

    public ExecutionResult execute(WorkingDocument document, Rule rule, List<StagedOperation> staged) {
        List<OperationDiagnostic> operations = new ArrayList<>(staged.size());
        List<PatchOperation> applied = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (StagedOperation operation : staged) {
            try {
                apply(document, operation.patch());
                operations.add(OperationDiagnostic.applied(operation));
                applied.add(operation.patch());
            } catch (RuleEvalException e) {
                e.withRuleId(rule.id());
                operations.add(OperationDiagnostic.skipped(operation, e.getMessage()));
                errors.add(failurePrefix(operation.patch()) + " " + operation.pointer() + " failed: " + e.getMessage());
                LOG.warn(
                        "operation.skipped rule_id={} kind={} pointer={} reason={}",
                        e.ruleId(),
                        operation.kind(),
                        operation.pointer(),
                        e.getMessage());
            }
        }
        return new ExecutionResult(operations, applied, errors);
    }

    private static void apply(WorkingDocument document, PatchOperation patch) {
        if (patch instanceof PatchOperation.Remove remove) {
            document.remove(Pointer.parse(remove.path()));
        } else if (patch instanceof PatchOperation.Replace replace) {
            // The tree gets its own copy so later rules cannot alter the recorded patch.
            document.replace(Pointer.parse(replace.path()), replace.value().deepCopy());
        } else if (patch instanceof PatchOperation.Move move) {
            document.move(Pointer.parse(move.from()), Pointer.parse(move.path()));
        }
    }

    // Renames carry a move patch and are reported as moves.
    private static String failurePrefix(PatchOperation patch) {
        if (patch instanceof PatchOperation.Remove) {
            return "Remove";
        }
        if (patch instanceof PatchOperation.Replace) {
            return "Replace";
        }
        return "Move";
    }
}
