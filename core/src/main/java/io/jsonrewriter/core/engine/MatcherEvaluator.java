package io.jsonrewriter.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.jsonrewriter.core.error.EmptyMatcherException;
import io.jsonrewriter.core.error.MatchException;
import io.jsonrewriter.core.pointer.Pointer;
import io.jsonrewriter.core.spi.QueryEvaluator;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Runs a rule's matcher against the current working document and turns the result into a
 * duplicate-free list of pointers, in first-seen order. A location selected twice (for example
 * through overlapping union selectors) appears once, so it is never acted on twice.
 *
 * <p>
 * Thread-safe if the underlying {@link QueryEvaluator} is.
 */
public final class MatcherEvaluator {

    static final String OPTIONAL_SEGMENT_GUIDANCE = "Ensure optional segments exist before comparing, e.g. "
            + "@.inspection && @.inspection.meta && @.inspection.meta.status == \"OK\". "
            + "JSONPath filters do not support optional chaining syntax (?.).";

    /** Failure texts that indicate a filter dereferenced a property of a missing value. */
    private static final Pattern MISSING_DEREFERENCE = Pattern.compile(
            "Cannot read propert(y|ies) of (undefined|null)|Missing property in path", Pattern.CASE_INSENSITIVE);

    private final QueryEvaluator queryEvaluator;

    public MatcherEvaluator(QueryEvaluator queryEvaluator) {
        this.queryEvaluator = Objects.requireNonNull(queryEvaluator, "queryEvaluator must not be null");
    }

    /**
     * Evaluates the trimmed expression.
     *
     * @return distinct pointers in first-seen order
     * @throws EmptyMatcherException if the expression is blank
     * @throws MatchException if the query evaluator fails
     */
    public List<Pointer> evaluate(JsonNode document, String expression) {
        String trimmed = expression == null ? "" : expression.trim();
        if (trimmed.isEmpty()) {
            throw new EmptyMatcherException("Matcher JSONPath expression is empty");
        }
        List<String> raw;
        try {
            raw = queryEvaluator.evaluatePointers(document, trimmed);
        } catch (RuntimeException e) {
            throw wrap(e);
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String pointer : raw) {
            distinct.add(Pointer.normalize(pointer));
        }
        List<Pointer> pointers = new ArrayList<>(distinct.size());
        for (String pointer : distinct) {
            pointers.add(Pointer.parse(pointer));
        }
        return pointers;
    }

    private static MatchException wrap(RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        String guidance = MISSING_DEREFERENCE.matcher(message).find() ? OPTIONAL_SEGMENT_GUIDANCE : null;
        return new MatchException(message, e, guidance);
    }
}
