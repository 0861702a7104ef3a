package io.jsonrewriter.core.model;

import java.util.List;

/**
 * Outcome of one rule. Produced exactly once per rule, including disabled rules and rules that
 * staged nothing.
 *
 * @param matchCount number of distinct locations the matcher selected
 * @param operations executed operations in application order
 */
public record RuleDiagnostic(
        String ruleId,
        String matcher,
        RuleKind kind,
        int matchCount,
        List<OperationDiagnostic> operations,
        List<String> errors,
        List<String> warnings) {

    public RuleDiagnostic {
        operations = List.copyOf(operations);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    /** Diagnostic for a rule that was not executed. */
    public static RuleDiagnostic disabled(Rule rule) {
        return new RuleDiagnostic(rule.id(), rule.matcher(), rule.kind(), 0, List.of(), List.of(), List.of());
    }

    public long appliedCount() {
        return operations.stream().filter(OperationDiagnostic::isApplied).count();
    }
}
