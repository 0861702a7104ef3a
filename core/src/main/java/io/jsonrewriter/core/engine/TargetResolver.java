package io.jsonrewriter.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.jsonrewriter.core.error.InvalidTargetException;
import io.jsonrewriter.core.error.QueryEvaluationException;
import io.jsonrewriter.core.error.RenameCollisionException;
import io.jsonrewriter.core.error.RootMutationException;
import io.jsonrewriter.core.error.RuleEvalException;
import io.jsonrewriter.core.error.UnresolvedValueException;
import io.jsonrewriter.core.error.ValueArityException;
import io.jsonrewriter.core.model.RenameTargetMode;
import io.jsonrewriter.core.model.ReplaceValueMode;
import io.jsonrewriter.core.model.Rule;
import io.jsonrewriter.core.pointer.PathConversions;
import io.jsonrewriter.core.pointer.Pointer;
import io.jsonrewriter.core.pointer.PointerOperations;
import io.jsonrewriter.core.pointer.PointerOperations.ParentRef;
import io.jsonrewriter.core.spi.QueryEvaluator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves, per rule kind, the concrete value to write (replace) or the destination pointer
 * (move, rename) against the current working document.
 *
 * <p>
 * Every resolver returns {@link Optional#empty()} for an intentional skip: a zero-result query
 * with {@code allowEmptyValue} set, or a rename onto the key the property already has. Every
 * other failure is thrown as a {@link RuleEvalException}; a query evaluator that fails with any
 * other runtime exception is reported as a {@link QueryEvaluationException}. Query results with
 * two or more entries are always an arity error.
 *
 * <p>
 * Thread-safe if the underlying {@link QueryEvaluator} is.
 */
public final class TargetResolver {

    /** Leading character of an embedded query. */
    public static final String QUERY_SIGIL = "$";

    /** Leading character of a query relative to the current node. */
    public static final String CURRENT_NODE_SIGIL = "@";

    private final QueryEvaluator queryEvaluator;

    public TargetResolver(QueryEvaluator queryEvaluator) {
        this.queryEvaluator = Objects.requireNonNull(queryEvaluator, "queryEvaluator must not be null");
    }

    /**
     * Resolves a replacement value. {@code literal} mode copies the value verbatim; {@code auto}
     * mode evaluates a textual value starting with {@code $} against {@code document} and requires
     * exactly one result. The returned node is always a copy.
     *
     * @throws UnresolvedValueException if the rule has no value
     * @throws ValueArityException if the embedded query does not yield exactly one value
     */
    public Optional<JsonNode> resolveReplaceValue(JsonNode document, Rule.Replace rule) {
        JsonNode value = rule.value();
        if (value == null) {
            throw new UnresolvedValueException("replacement value is required", rule.id());
        }
        if (rule.valueMode() == ReplaceValueMode.LITERAL || !isEmbeddedQuery(value)) {
            return Optional.of(value.deepCopy());
        }
        String expression = value.textValue().trim();
        List<JsonNode> values = queryValues(document, expression);
        if (values.isEmpty() && rule.allowEmptyValue()) {
            return Optional.empty();
        }
        if (values.size() != 1) {
            throw new ValueArityException(
                    String.format(
                            "Expected exactly one value for JSONPath '%s', received %d", expression, values.size()),
                    expression,
                    values.size());
        }
        return Optional.of(values.get(0).deepCopy());
    }

    /**
     * Resolves a move destination. {@code pointer} mode normalizes the target as a pointer;
     * {@code jsonpath} mode requires the query to select exactly one location; {@code auto} picks
     * by leading character ({@code /} or {@code $}). When a query selects nothing and {@code
     * allowEmptyValue} is off, a simple query is lowered syntactically to the pointer it spells.
     *
     * @throws InvalidTargetException if the target is blank or has an unrecognized leading character
     * @throws ValueArityException if a query target does not resolve to exactly one location
     * @throws io.jsonrewriter.core.error.UnsafePointerException if the destination is reserved
     */
    public Optional<Pointer> resolveMoveTarget(JsonNode document, Rule.Move rule) {
        String target = rule.target().trim();
        if (target.isEmpty()) {
            throw new InvalidTargetException("Move operations require a target pointer or JSONPath", rule.id());
        }
        return switch (rule.targetMode()) {
            case POINTER -> Optional.of(pointerTarget(target));
            case JSONPATH -> queryTarget(document, rule, target);
            case AUTO -> {
                if (target.startsWith("/")) {
                    yield Optional.of(pointerTarget(target));
                }
                if (target.startsWith(QUERY_SIGIL)) {
                    yield queryTarget(document, rule, target);
                }
                throw new InvalidTargetException(
                        "Target must start with '/' for JSONPointer or '$' for JSONPath", rule.id());
            }
        };
    }

    /**
     * Resolves the destination of a rename: the matched property's parent pointer with the new key
     * appended. The key is the trimmed target ({@code literal} mode or unprefixed target) or the
     * single string a query yields when evaluated against the parent object ({@code jsonpath} mode
     * or a target led by {@code $} or {@code @}).
     *
     * @throws RootMutationException if {@code matched} is the root
     * @throws InvalidTargetException if the parent is not an object or the key is not a non-empty
     *     string
     * @throws ValueArityException if a query key does not resolve to exactly one value
     * @throws io.jsonrewriter.core.error.UnsafePointerException if the key is reserved
     * @throws RenameCollisionException if a sibling already owns the key
     */
    public Optional<Pointer> resolveRenameTarget(JsonNode document, Pointer matched, Rule.Rename rule) {
        ParentRef ref = PointerOperations.parentAndKey(document, matched);
        if (ref.isRoot()) {
            throw new RootMutationException("Cannot rename the root document", rule.id());
        }
        if (!ref.parent().isObject()) {
            throw new InvalidTargetException("Rename operations can only target object properties", rule.id());
        }
        String target = rule.target().trim();
        if (target.isEmpty()) {
            if (rule.allowEmptyValue()) {
                return Optional.empty();
            }
            throw new InvalidTargetException("Rename operations require a target key or JSONPath", rule.id());
        }

        String nextKey;
        if (rule.targetMode() == RenameTargetMode.LITERAL) {
            nextKey = target;
        } else if (rule.targetMode() == RenameTargetMode.JSONPATH
                || target.startsWith(QUERY_SIGIL)
                || target.startsWith(CURRENT_NODE_SIGIL)) {
            Optional<String> resolved = queryKey(ref.parent(), target, rule);
            if (resolved.isEmpty()) {
                return Optional.empty();
            }
            nextKey = resolved.get();
        } else {
            nextKey = target;
        }

        Pointer.requireSafeKey(nextKey);
        if (nextKey.equals(ref.key())) {
            return Optional.empty();
        }
        if (ref.parent().has(nextKey)) {
            throw new RenameCollisionException(nextKey);
        }
        return Optional.of(matched.parent().append(nextKey).requireSafe());
    }

    private static boolean isEmbeddedQuery(JsonNode value) {
        return value.isTextual() && value.textValue().trim().startsWith(QUERY_SIGIL);
    }

    private static Pointer pointerTarget(String target) {
        return Pointer.parseNormalized(target).requireSafe();
    }

    private Optional<Pointer> queryTarget(JsonNode document, Rule.Move rule, String expression) {
        List<Pointer> pointers = queryPointers(document, expression);
        if (pointers.size() == 1) {
            return Optional.of(pointers.get(0).requireSafe());
        }
        if (pointers.isEmpty()) {
            if (rule.allowEmptyValue()) {
                return Optional.empty();
            }
            Optional<String> lowered = PathConversions.simpleJsonPathToPointer(expression);
            if (lowered.isPresent()) {
                return Optional.of(Pointer.parse(lowered.get()).requireSafe());
            }
        }
        throw new ValueArityException(
                String.format(
                        "Expected exactly one target pointer for JSONPath '%s', received %d",
                        expression,
                        pointers.size()),
                expression,
                pointers.size());
    }

    /** Evaluates a key query scoped to the parent object; {@code @} addresses that object. */
    private Optional<String> queryKey(JsonNode parent, String target, Rule.Rename rule) {
        String expression = target.startsWith(CURRENT_NODE_SIGIL) ? QUERY_SIGIL + target.substring(1) : target;
        List<JsonNode> values = queryValues(parent, expression).stream()
                .filter(value -> value != null && !value.isMissingNode())
                .toList();
        if (values.isEmpty()) {
            if (rule.allowEmptyValue()) {
                return Optional.empty();
            }
            throw new ValueArityException(
                    String.format("Expected JSONPath '%s' to resolve to exactly one string key", target), target, 0);
        }
        if (values.size() != 1) {
            throw new ValueArityException(
                    String.format(
                            "Expected JSONPath '%s' to resolve to exactly one string key but received %d",
                            target,
                            values.size()),
                    target,
                    values.size());
        }
        JsonNode key = values.get(0);
        if (!key.isTextual()) {
            throw new InvalidTargetException("Rename target must resolve to a string key", rule.id());
        }
        String trimmed = key.textValue().trim();
        if (trimmed.isEmpty()) {
            throw new InvalidTargetException("Rename target must be a non-empty string", rule.id());
        }
        return Optional.of(trimmed);
    }

    private List<JsonNode> queryValues(JsonNode scope, String expression) {
        try {
            return queryEvaluator.evaluateValues(scope, expression);
        } catch (RuleEvalException e) {
            throw e;
        } catch (RuntimeException e) {
            throw wrap(e);
        }
    }

    /** Evaluates a target query to distinct parsed pointers in first-seen order. */
    private List<Pointer> queryPointers(JsonNode document, String expression) {
        try {
            return queryEvaluator.evaluatePointers(document, expression).stream()
                    .map(Pointer::normalize)
                    .distinct()
                    .map(Pointer::parse)
                    .toList();
        } catch (RuleEvalException e) {
            throw e;
        } catch (RuntimeException e) {
            throw wrap(e);
        }
    }

    private static QueryEvaluationException wrap(RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new QueryEvaluationException(message, e);
    }
}
