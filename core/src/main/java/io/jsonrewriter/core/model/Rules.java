package io.jsonrewriter.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.security.SecureRandom;

/**
 * Factories for well-formed {@link Rule} records with documented defaults: a generated id, enabled,
 * {@code auto} interpretation mode, no empty-matcher or empty-value allowance.
 *
 * <p>
 * Thread-safe: stateless apart from the shared {@link SecureRandom}.
 */
public final class Rules {

    private static final SecureRandom RANDOM = new SecureRandom();

    private Rules() {}

    /** Generates a rule id of the form {@code r-xxxxxxxx} (8 lowercase hex digits). */
    public static String generateRuleId() {
        return String.format("r-%08x", RANDOM.nextInt());
    }

    public static Rule.Remove remove(String matcher) {
        return remove(matcher, RuleOptions.defaults());
    }

    /** Creates a removal rule. {@link RuleOptions#allowEmptyValue()} is ignored for removals. */
    public static Rule.Remove remove(String matcher, RuleOptions options) {
        return new Rule.Remove(idOf(options), matcher, options.allowEmptyMatcher(), options.disabled());
    }

    public static Rule.Replace replace(String matcher, JsonNode value) {
        return replace(matcher, value, RuleOptions.defaults(), ReplaceValueMode.AUTO);
    }

    /**
     * Creates a replacement rule. In {@link ReplaceValueMode#AUTO} a textual value starting with
     * {@code $} is read from the working document at execution time.
     */
    public static Rule.Replace replace(String matcher, JsonNode value, RuleOptions options, ReplaceValueMode mode) {
        return new Rule.Replace(
                idOf(options),
                matcher,
                value,
                mode,
                options.allowEmptyMatcher(),
                options.allowEmptyValue(),
                options.disabled());
    }

    public static Rule.Move move(String matcher, String target) {
        return move(matcher, target, RuleOptions.defaults(), MoveTargetMode.AUTO);
    }

    /** Creates a move rule that relocates each matched value to a pointer or query target. */
    public static Rule.Move move(String matcher, String target, RuleOptions options, MoveTargetMode mode) {
        return new Rule.Move(
                idOf(options),
                matcher,
                target,
                mode,
                options.allowEmptyMatcher(),
                options.allowEmptyValue(),
                options.disabled());
    }

    public static Rule.Rename rename(String matcher, String target) {
        return rename(matcher, target, RuleOptions.defaults(), RenameTargetMode.AUTO);
    }

    /** Creates a rename rule that gives each matched object property a new key. */
    public static Rule.Rename rename(String matcher, String target, RuleOptions options, RenameTargetMode mode) {
        return new Rule.Rename(
                idOf(options),
                matcher,
                target,
                mode,
                options.allowEmptyMatcher(),
                options.allowEmptyValue(),
                options.disabled());
    }

    private static String idOf(RuleOptions options) {
        return options.id() != null ? options.id() : generateRuleId();
    }
}
