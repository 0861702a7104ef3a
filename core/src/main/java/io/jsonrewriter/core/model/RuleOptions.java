package io.jsonrewriter.core.model;

/**
 * Optional settings shared by every rule kind. {@code id == null} means "generate one".
 *
 * <p>
 * Defaults: generated id, enabled, no empty-matcher or empty-value allowance.
 */
public record RuleOptions(String id, boolean allowEmptyMatcher, boolean allowEmptyValue, boolean disabled) {

    private static final RuleOptions DEFAULTS = new RuleOptions(null, false, false, false);

    public static RuleOptions defaults() {
        return DEFAULTS;
    }

    public RuleOptions withId(String newId) {
        return new RuleOptions(newId, allowEmptyMatcher, allowEmptyValue, disabled);
    }

    public RuleOptions allowingEmptyMatcher() {
        return new RuleOptions(id, true, allowEmptyValue, disabled);
    }

    public RuleOptions allowingEmptyValue() {
        return new RuleOptions(id, allowEmptyMatcher, true, disabled);
    }

    public RuleOptions asDisabled() {
        return new RuleOptions(id, allowEmptyMatcher, allowEmptyValue, true);
    }
}
