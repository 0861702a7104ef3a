package io.jsonrewriter.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.jsonrewriter.core.engine.OperationExecutor.ExecutionResult;
import io.jsonrewriter.core.engine.OperationStager.StagingResult;
import io.jsonrewriter.core.engine.jsonpath.JaywayQueryEvaluator;
import io.jsonrewriter.core.error.RuleEvalException;
import io.jsonrewriter.core.model.OperationStatus;
import io.jsonrewriter.core.model.PatchOperation;
import io.jsonrewriter.core.model.RewriteResult;
import io.jsonrewriter.core.model.Rule;
import io.jsonrewriter.core.model.RuleDiagnostic;
import io.jsonrewriter.core.model.StagedOperation;
import io.jsonrewriter.core.pointer.Pointer;
import io.jsonrewriter.core.spi.QueryEvaluator;
import io.jsonrewriter.core.spi.RewriteListener;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of a rewrite run: applies an ordered list of rules to a deep copy of the input
 * document and reports what happened.
 *
 * <p>
 * Rules run strictly in list order. Each rule sees the document as left by all earlier rules; its
 * matches and resolved values are computed before any of its own operations apply. Failures are
 * recorded per rule and never abort the run, so {@link #rewrite} always returns a result.
 *
 * <p>
 * Thread-safe: holds no per-run state. Concurrent runs on separate inputs are independent provided
 * the {@link QueryEvaluator} and {@link RewriteListener} are thread-safe.
 */
public final class DocumentRewriter {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentRewriter.class);

    /** Warning added when a rule matched nothing and nothing explains the silence. */
    public static final String NO_OP_WARNING = "No matches produced patch operations";

    private final QueryEvaluator queryEvaluator;
    private final MatcherEvaluator matcherEvaluator;
    private final OperationStager stager;
    private final OperationExecutor executor;
    private final RewriteListener listener;

    public DocumentRewriter(QueryEvaluator queryEvaluator) {
        this(queryEvaluator, RewriteListener.NOOP);
    }

    /**
     * @param queryEvaluator evaluates matchers, embedded values and query targets
     * @param listener lifecycle hooks; {@code null} means none
     */
    public DocumentRewriter(QueryEvaluator queryEvaluator, RewriteListener listener) {
        this.queryEvaluator = Objects.requireNonNull(queryEvaluator, "queryEvaluator must not be null");
        this.matcherEvaluator = new MatcherEvaluator(queryEvaluator);
        this.stager = new OperationStager(new TargetResolver(queryEvaluator));
        this.executor = new OperationExecutor();
        this.listener = listener != null ? listener : RewriteListener.NOOP;
    }

    /** Creates a rewriter backed by the Jayway JSONPath evaluator. */
    public static DocumentRewriter withDefaults() {
        return new DocumentRewriter(new JaywayQueryEvaluator());
    }

    public QueryEvaluator queryEvaluator() {
        return queryEvaluator;
    }

    /**
     * Applies {@code rules} in order to a deep copy of {@code input}. The input is never modified.
     *
     * @throws NullPointerException if an argument or a rule is {@code null}
     */
    public RewriteResult rewrite(JsonNode input, List<Rule> rules) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(rules, "rules must not be null");
        long start = System.nanoTime();
        notifyRunStarted(rules.size());

        WorkingDocument document = WorkingDocument.copyOf(input);
        List<PatchOperation> applied = new ArrayList<>();
        List<RuleDiagnostic> diagnostics = new ArrayList<>(rules.size());
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (int i = 0; i < rules.size(); i++) {
            Rule rule = Objects.requireNonNull(rules.get(i), "rule must not be null");
            RuleDiagnostic diagnostic;
            if (rule.disabled()) {
                LOG.debug("rule.disabled rule_id={}", rule.id());
                diagnostic = RuleDiagnostic.disabled(rule);
            } else {
                diagnostic = runRule(document, rule, i + 1, applied);
            }
            diagnostics.add(diagnostic);
            errors.addAll(diagnostic.errors());
            warnings.addAll(diagnostic.warnings());
            notifyRuleCompleted(i, rule, diagnostic);
        }

        long durationMs = (System.nanoTime() - start) / 1_000_000;
        RewriteResult result = new RewriteResult(document.root(), applied, diagnostics, errors, warnings);
        LOG.info(
                "rewrite.completed ok={} rules={} applied={} errors={} warnings={} duration_ms={}",
                result.ok(),
                rules.size(),
                applied.size(),
                errors.size(),
                warnings.size(),
                durationMs);
        notifyRunCompleted(result, rules.size(), durationMs);
        return result;
    }

    private RuleDiagnostic runRule(WorkingDocument document, Rule rule, int ruleNumber, List<PatchOperation> applied) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<Pointer> matches = List.of();
        boolean suppressNoOpWarning = false;

        // A blank matcher selects nothing, silently.
        if (rule.matcher().isBlank()) {
            suppressNoOpWarning = true;
        } else {
            try {
                matches = matcherEvaluator.evaluate(document.root(), rule.matcher());
            } catch (RuleEvalException e) {
                errors.add("Rule " + ruleNumber + " (" + rule.kind() + ") matcher error: " + e.getMessage());
            }
            if (matches.isEmpty() && rule.allowEmptyMatcher()) {
                suppressNoOpWarning = true;
            }
        }

        StagingResult staging = stager.stage(document.root(), rule, ruleNumber, matches);
        errors.addAll(staging.errors());
        suppressNoOpWarning |= staging.suppressNoOpWarning();
        if (!suppressNoOpWarning && staging.operations().isEmpty() && matches.isEmpty() && errors.isEmpty()) {
            warnings.add(NO_OP_WARNING);
        }

        List<StagedOperation> ordered = OperationStager.reorderRemovals(staging.operations());
        LOG.debug(
                "rule.evaluated rule_id={} kind={} match_count={} staged={}",
                rule.id(),
                rule.kind(),
                matches.size(),
                ordered.size());

        ExecutionResult execution = executor.execute(document, rule, ordered);
        applied.addAll(execution.applied());
        errors.addAll(execution.errors());
        return new RuleDiagnostic(
                rule.id(), rule.matcher(), rule.kind(), matches.size(), execution.operations(), errors, warnings);
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they never affect the run.

    private void notifyRunStarted(int ruleCount) {
        try {
            listener.onRunStarted(new RewriteListener.RunStartedEvent(ruleCount));
        } catch (Exception e) {
            LOG.warn("RewriteListener.onRunStarted failed", e);
        }
    }

    private void notifyRuleCompleted(int ruleIndex, Rule rule, RuleDiagnostic diagnostic) {
        try {
            int appliedCount = (int) diagnostic.appliedCount();
            int skippedCount = (int) diagnostic.operations().stream()
                    .filter(operation -> operation.status() == OperationStatus.SKIPPED)
                    .count();
            listener.onRuleCompleted(new RewriteListener.RuleCompletedEvent(
                    ruleIndex,
                    rule.id(),
                    rule.kind(),
                    rule.disabled(),
                    diagnostic.matchCount(),
                    appliedCount,
                    skippedCount,
                    diagnostic.errors().size(),
                    diagnostic.warnings().size()));
        } catch (Exception e) {
            LOG.warn("RewriteListener.onRuleCompleted failed", e);
        }
    }

    private void notifyRunCompleted(RewriteResult result, int ruleCount, long durationMs) {
        try {
            listener.onRunCompleted(new RewriteListener.RunCompletedEvent(
                    result.ok(),
                    ruleCount,
                    result.appliedOperations().size(),
                    result.errors().size(),
                    result.warnings().size(),
                    durationMs));
        } catch (Exception e) {
            LOG.warn("RewriteListener.onRunCompleted failed", e);
        }
    }
}
