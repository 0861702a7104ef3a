package io.jsonrewriter.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Pluggable query language SPI. The rewriter locates nodes only through this interface and
 * assumes nothing about the language beyond "returns pointers or values, or reports a failure".
 *
 * <p>
 * Implementations MUST be stateless, thread-safe and read-only with respect to the document.
 */
public interface QueryEvaluator {

    /**
     * Returns the query language identifier, e.g. {@code "jsonpath"}. Used in log output.
     *
     * @return a non-null, non-empty identifier (lowercase, no spaces)
     */
    String id();

    /**
     * Selects locations.
     *
     * @param document the tree to query
     * @param expression the query expression
     * @return pointer strings of the selected locations in selection order ({@code ""} for the
     *     root); may contain duplicates
     * @throws io.jsonrewriter.core.error.QueryEvaluationException if the expression is invalid or
     *     evaluation fails
     */
    List<String> evaluatePointers(JsonNode document, String expression);

    /**
     * Selects values.
     *
     * @param document the tree to query
     * @param expression the query expression
     * @return the selected nodes in selection order; callers copy before mutating
     * @throws io.jsonrewriter.core.error.QueryEvaluationException if the expression is invalid or
     *     evaluation fails
     */
    List<JsonNode> evaluateValues(JsonNode document, String expression);
}
