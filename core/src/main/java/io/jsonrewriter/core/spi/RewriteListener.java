package io.jsonrewriter.core.spi;

import io.jsonrewriter.core.model.RuleKind;

/**
 * SPI for observability hooks around a rewrite run.
 *
 * <p>
 * Adapters bridge these events to metrics or tracing systems; the core has no telemetry
 * dependencies. Exceptions thrown by listeners are caught and logged by the rewriter and do NOT
 * affect the run.
 */
public interface RewriteListener {

    /** No-op listener. */
    RewriteListener NOOP = new RewriteListener() {};

    /**
     * Called once before the first rule runs.
     *
     * @param event contains the number of rules
     */
    default void onRunStarted(RunStartedEvent event) {}

    /**
     * Called after each rule, including disabled ones.
     *
     * @param event contains the rule id, kind, match count and per-rule outcome counts
     */
    default void onRuleCompleted(RuleCompletedEvent event) {}

    /**
     * Called once after the last rule.
     *
     * @param event contains ok flag, counts and duration
     */
    default void onRunCompleted(RunCompletedEvent event) {}

    // --- Event records ---

    /** Event emitted when a run starts. */
    record RunStartedEvent(int ruleCount) {}

    /** Event emitted after a rule has been evaluated and applied. */
    record RuleCompletedEvent(
            int ruleIndex,
            String ruleId,
            RuleKind kind,
            boolean disabled,
            int matchCount,
            int appliedCount,
            int skippedCount,
            int errorCount,
            int warningCount) {}

    /** Event emitted when a run completes. */
    record RunCompletedEvent(
            boolean ok, int ruleCount, int appliedCount, int errorCount, int warningCount, long durationMs) {}
}
