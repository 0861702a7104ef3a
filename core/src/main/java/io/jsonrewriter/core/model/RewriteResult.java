package io.jsonrewriter.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one rewrite run.
 *
 * <ul>
 * <li>{@code document}: the rewritten copy; never the caller's input instance</li>
 * <li>{@code appliedOperations}: patch records of applied operations, in application order</li>
 * <li>{@code diagnostics}: one entry per rule, in rule order</li>
 * <li>{@code errors} / {@code warnings}: the diagnostics' own lists concatenated in rule
 * order</li>
 * </ul>
 *
 * <p>
 * {@link #ok()} is {@code true} iff there are no errors; warnings never affect it.
 */
public record RewriteResult(
        JsonNode document,
        List<PatchOperation> appliedOperations,
        List<RuleDiagnostic> diagnostics,
        List<String> errors,
        List<String> warnings) {

    public RewriteResult {
        Objects.requireNonNull(document, "document must not be null");
        appliedOperations = List.copyOf(appliedOperations);
        diagnostics = List.copyOf(diagnostics);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean ok() {
        return errors.isEmpty();
    }

    /** Renders the rewritten document. */
    public String encode(OutputEncoding encoding) {
        return encoding.encode(document);
    }

    @Override
    public String toString() {
        return "RewriteResult[ok=" + ok() + ", applied=" + appliedOperations.size() + ", errors=" + errors.size()
                + ", warnings=" + warnings.size() + "]";
    }
}
