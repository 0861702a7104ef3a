package io.jsonrewriter.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.jsonrewriter.core.error.RuleEvalException;
import io.jsonrewriter.core.error.ValueArityException;
import io.jsonrewriter.core.model.PatchOperation;
import io.jsonrewriter.core.model.Rule;
import io.jsonrewriter.core.model.RuleKind;
import io.jsonrewriter.core.model.StagedOperation;
import io.jsonrewriter.core.pointer.Pointer;
import io.jsonrewriter.core.pointer.PointerOperations;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a rule's matches into staged operations. All resolution happens against the document as
 * it stands before the rule's first mutation, so staging is side-effect free.
 *
 * <p>
 * A resolution failure for one match becomes a rule-scoped error and staging continues with the
 * next match. Intentional skips set {@link StagingResult#suppressNoOpWarning()}.
 */
public final class OperationStager {

    private static final Logger LOG = LoggerFactory.getLogger(OperationStager.class);

    /**
     * Staging outcome for one rule.
     *
     * @param operations staged operations in match order (before removal reordering)
     * @param errors rule-scoped error messages, already prefixed with the rule number
     * @param suppressNoOpWarning {@code true} if at least one match was skipped on purpose
     */
    public record StagingResult(List<StagedOperation> operations, List<String> errors, boolean suppressNoOpWarning) {
        public StagingResult {
            operations = List.copyOf(operations);
            errors = List.copyOf(errors);
        }
    }

    private final TargetResolver resolver;

    public OperationStager(TargetResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    /**
     * Stages one operation per match.
     *
     * @param document the working document root, read only
     * @param rule the rule being executed
     * @param ruleNumber 1-based position of the rule, used in error messages
     * @param matches the rule's deduplicated matches
     */
    public StagingResult stage(JsonNode document, Rule rule, int ruleNumber, List<Pointer> matches) {
        List<StagedOperation> operations = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        boolean suppress = false;

        if (rule instanceof Rule.Replace replace && !replace.hasValue()) {
            if (replace.allowEmptyValue()) {
                return new StagingResult(operations, errors, true);
            }
            errors.add(errorPrefix(rule, ruleNumber) + "replacement value is required");
            return new StagingResult(operations, errors, false);
        }

        for (int matchIndex = 0; matchIndex < matches.size(); matchIndex++) {
            Pointer pointer = matches.get(matchIndex);
            try {
                Optional<PatchOperation> patch = resolve(document, rule, pointer);
                if (patch.isPresent()) {
                    operations.add(new StagedOperation(matchIndex, pointer, rule.kind(), patch.get()));
                } else {
                    suppress = true;
                }
            } catch (ValueArityException e) {
                if (rule.allowEmptyValue() && e.isEmptyResult()) {
                    suppress = true;
                } else {
                    errors.add(unresolved(rule, ruleNumber, pointer, e));
                }
            } catch (RuleEvalException e) {
                errors.add(unresolved(rule, ruleNumber, pointer, e));
            }
        }
        return new StagingResult(operations, errors, suppress);
    }

    private Optional<PatchOperation> resolve(JsonNode document, Rule rule, Pointer pointer) {
        String path = pointer.toString();
        if (rule instanceof Rule.Remove) {
            return Optional.of(new PatchOperation.Remove(path));
        }
        if (rule instanceof Rule.Replace replace) {
            return resolver.resolveReplaceValue(document, replace).map(value -> new PatchOperation.Replace(path, value));
        }
        if (rule instanceof Rule.Move move) {
            return resolver.resolveMoveTarget(document, move)
                    .map(target -> new PatchOperation.Move(path, target.toString()));
        }
        if (rule instanceof Rule.Rename rename) {
            return resolver.resolveRenameTarget(document, pointer, rename)
                    .map(target -> new PatchOperation.Move(path, target.toString()));
        }
        throw new IllegalStateException("Unsupported rule kind: " + rule.kind());
    }

    private static String unresolved(Rule rule, int ruleNumber, Pointer pointer, RuleEvalException e) {
        e.withRuleId(rule.id());
        LOG.debug("operation.unresolved rule_id={} pointer={} reason={}", e.ruleId(), pointer, e.getMessage());
        return errorPrefix(rule, ruleNumber) + e.getMessage();
    }

    private static String errorPrefix(Rule rule, int ruleNumber) {
        return "Rule " + ruleNumber + " " + rule.kind().id() + switch (rule.kind()) {
            case REPLACE -> " value error: ";
            case MOVE, RENAME -> " target error: ";
            case REMOVE -> " error: ";
        };
    }

    /**
     * Reorders removals that share a parent so array-index removals run from the highest index
     * down; otherwise each removal would shift the indices of the ones after it.
     *
     * <p>
     * Within each parent group, the slots held by integer-index removals receive those removals
     * sorted by descending index. Non-index removals and all non-remove operations keep their
     * slots. The input list is not modified.
     */
    public static List<StagedOperation> reorderRemovals(List<StagedOperation> operations) {
        Map<Pointer, List<Integer>> slotsByParent = new LinkedHashMap<>();
        for (int slot = 0; slot < operations.size(); slot++) {
            StagedOperation operation = operations.get(slot);
            if (operation.kind() == RuleKind.REMOVE && indexOf(operation) >= 0) {
                slotsByParent
                        .computeIfAbsent(operation.pointer().parent(), parent -> new ArrayList<>())
                        .add(slot);
            }
        }

        List<StagedOperation> result = new ArrayList<>(operations);
        for (List<Integer> slots : slotsByParent.values()) {
            List<StagedOperation> sorted = slots.stream()
                    .map(operations::get)
                    .sorted(Comparator.comparingInt(OperationStager::indexOf).reversed())
                    .toList();
            for (int i = 0; i < slots.size(); i++) {
                result.set(slots.get(i), sorted.get(i));
            }
        }
        return result;
    }

    private static int indexOf(StagedOperation operation) {
        return operation.pointer().lastToken().map(PointerOperations::parseIndex).orElse(-1);
    }
}
