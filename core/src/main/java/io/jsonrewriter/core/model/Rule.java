package io.jsonrewriter.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * A declarative rewrite rule. The four kinds form a sealed hierarchy; each variant carries only
 * the fields valid for its kind.
 *
 * <p>
 * Common fields:
 * <ul>
 * <li>{@code id}: stable identifier, used only in diagnostics (never for ordering)</li>
 * <li>{@code matcher}: query expression selecting the locations to act on; trimmed before
 * evaluation</li>
 * <li>{@code disabled}: the rule is reported but not executed</li>
 * <li>{@code allowEmptyMatcher}: no warning when the matcher selects nothing</li>
 * <li>{@code allowEmptyValue}: an empty value/target resolution becomes a silent skip instead of
 * an error</li>
 * </ul>
 *
 * <p>
 * Immutable and thread-safe. Use {@link Rules} for construction with generated ids.
 */
public sealed interface Rule {

    String id();

    String matcher();

    RuleKind kind();

    boolean disabled();

    boolean allowEmptyMatcher();

    boolean allowEmptyValue();

    // ── Variants ──

    /** Removes every matched location. Removal never has a value, so allowEmptyValue is always false. */
    record Remove(String id, String matcher, boolean allowEmptyMatcher, boolean disabled) implements Rule {
        public Remove {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(matcher, "matcher must not be null");
        }

        @Override
        public RuleKind kind() {
            return RuleKind.REMOVE;
        }

        @Override
        public boolean allowEmptyValue() {
            return false;
        }
    }

    /**
     * Overwrites every matched location with {@code value}.
     *
     * @param value the replacement; {@code null} means no value was supplied (JSON null is a
     *     {@code NullNode})
     */
    record Replace(
            String id,
            String matcher,
            JsonNode value,
            ReplaceValueMode valueMode,
            boolean allowEmptyMatcher,
            boolean allowEmptyValue,
            boolean disabled)
            implements Rule {
        public Replace {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(matcher, "matcher must not be null");
            valueMode = valueMode != null ? valueMode : ReplaceValueMode.AUTO;
        }

        @Override
        public RuleKind kind() {
            return RuleKind.REPLACE;
        }

        public boolean hasValue() {
            return value != null;
        }
    }

    /** Moves every matched value to the location named by {@code target}. */
    record Move(
            String id,
            String matcher,
            String target,
            MoveTargetMode targetMode,
            boolean allowEmptyMatcher,
            boolean allowEmptyValue,
            boolean disabled)
            implements Rule {
        public Move {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(matcher, "matcher must not be null");
            target = target != null ? target : "";
            targetMode = targetMode != null ? targetMode : MoveTargetMode.AUTO;
        }

        @Override
        public RuleKind kind() {
            return RuleKind.MOVE;
        }
    }

    /** Renames the key of every matched object property to the key derived from {@code target}. */
    record Rename(
            String id,
            String matcher,
            String target,
            RenameTargetMode targetMode,
            boolean allowEmptyMatcher,
            boolean allowEmptyValue,
            boolean disabled)
            implements Rule {
        public Rename {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(matcher, "matcher must not be null");
            target = target != null ? target : "";
            targetMode = targetMode != null ? targetMode : RenameTargetMode.AUTO;
        }

        @Override
        public RuleKind kind() {
            return RuleKind.RENAME;
        }
    }
}
