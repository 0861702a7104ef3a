package io.jsonrewriter.core.engine.jsonpath;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.Option;
import com.jayway.jsonpath.PathNotFoundException;
import com.jayway.jsonpath.spi.json.JacksonJsonNodeJsonProvider;
import com.jayway.jsonpath.spi.mapper.JacksonMappingProvider;
import io.jsonrewriter.core.error.QueryEvaluationException;
import io.jsonrewriter.core.pointer.Pointer;
import io.jsonrewriter.core.spi.QueryEvaluator;
import java.util.ArrayList;
import java.util.List;

/**
 * JSONPath query evaluator backed by Jayway JsonPath, evaluating directly over Jackson trees.
 *
 * <p>
 * Jayway reports locations in its normalized bracket form ({@code $['a'][0]['b']}); they are
 * converted to escaped pointers ({@code /a/0/b}). A definite path that selects nothing is an empty
 * result, not an error.
 */
public final class JaywayQueryEvaluator implements QueryEvaluator {

    /** Query language identifier. */
    public static final String ID = "jsonpath";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Configuration POINTER_CONFIG = Configuration.builder()
            .jsonProvider(new JacksonJsonNodeJsonProvider(MAPPER))
            .mappingProvider(new JacksonMappingProvider(MAPPER))
            .options(Option.AS_PATH_LIST)
            .build();

    private static final Configuration VALUE_CONFIG = Configuration.builder()
            .jsonProvider(new JacksonJsonNodeJsonProvider(MAPPER))
            .mappingProvider(new JacksonMappingProvider(MAPPER))
            .options(Option.ALWAYS_RETURN_LIST)
            .build();

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<String> evaluatePointers(JsonNode document, String expression) {
        Object raw = read(document, expression, POINTER_CONFIG);
        List<String> pointers = new ArrayList<>();
        for (Object path : asList(raw)) {
            String text = path instanceof JsonNode node ? node.asText() : String.valueOf(path);
            pointers.add(toPointer(text));
        }
        return pointers;
    }

    @Override
    public List<JsonNode> evaluateValues(JsonNode document, String expression) {
        Object raw = read(document, expression, VALUE_CONFIG);
        List<JsonNode> values = new ArrayList<>();
        for (Object value : asList(raw)) {
            values.add(value instanceof JsonNode node ? node : MAPPER.valueToTree(value));
        }
        return values;
    }

    /**
     * Converts a Jayway normalized path ({@code $['a'][0]}) to an escaped pointer ({@code /a/0}).
     *
     * <p>
     * Jayway writes property names between {@code ['} and {@code ']} without escaping them, so a
     * quoted segment ends at the first {@code ']} that is followed by {@code [} or by the end of the
     * path. Keys containing {@code ']} therefore survive; a key containing {@code '][} followed by
     * further text cannot be told apart from two segments and is split.
     *
     * @throws QueryEvaluationException if the path is not in normalized form
     */
    static String toPointer(String path) {
        if (!path.startsWith("$")) {
            throw new QueryEvaluationException("Unexpected JSONPath location format: " + path);
        }
        List<String> tokens = new ArrayList<>();
        int i = 1;
        while (i < path.length()) {
            if (path.charAt(i) != '[') {
                throw new QueryEvaluationException("Unexpected JSONPath location format: " + path);
            }
            boolean quoted = i + 1 < path.length() && path.charAt(i + 1) == '\'';
            int end = quoted ? quotedSegmentEnd(path, i + 2) : path.indexOf(']', i + 1);
            if (end < 0) {
                throw new QueryEvaluationException("Unexpected JSONPath location format: " + path);
            }
            tokens.add(path.substring(quoted ? i + 2 : i + 1, end));
            i = end + (quoted ? 2 : 1);
        }
        return new Pointer(tokens).toString();
    }

    /** Index of the closing {@code ']} of a quoted segment whose name starts at {@code from}. */
    private static int quotedSegmentEnd(String path, int from) {
        int end = path.indexOf("']", from);
        while (end >= 0) {
            int next = end + 2;
            if (next == path.length() || path.charAt(next) == '[') {
                return end;
            }
            end = path.indexOf("']", end + 1);
        }
        return -1;
    }

    private static Object read(JsonNode document, String expression, Configuration configuration) {
        try {
            return JsonPath.compile(expression).read(document, configuration);
        } catch (PathNotFoundException e) {
            return null;
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            throw new QueryEvaluationException(message, e);
        }
    }

    private static List<?> asList(Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof ArrayNode array) {
            List<JsonNode> items = new ArrayList<>(array.size());
            array.forEach(items::add);
            return items;
        }
        if (raw instanceof List<?> list) {
            return list;
        }
        return List.of(raw);
    }
}
