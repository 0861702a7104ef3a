package io.jsonrewriter.core.pointer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversions between pointers, JSONPath expressions and "analysis paths".
 *
 * <p>
 * An analysis path is the dotted form used by document inspectors, rooted at the literal {@code
 * root}: {@code root.users[0].name}, with non-identifier keys quoted as {@code root["first-name"]}.
 *
 * <p>
 * Stateless utility class.
 */
public final class PathConversions {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    /** {@code .name}, {@code ['name']} / {@code ["name"]}, {@code [0]}. */
    private static final Pattern SIMPLE_SEGMENT =
            Pattern.compile("\\.([A-Za-z_][A-Za-z0-9_]*)|\\[['\"]([^'\"\\\\]+)['\"]\\]|\\[(\\d+)\\]");

    /** {@code .name}, {@code ["na\"me"]}, {@code [0]}. */
    private static final Pattern ANALYSIS_SEGMENT =
            Pattern.compile("\\.([A-Za-z_][A-Za-z0-9_]*)|\\[\"((?:\\\\\"|[^\"])+)\"\\]|\\[(\\d+)\\]");

    private PathConversions() {}

    /**
     * Lowers a "simple" JSONPath (only property, quoted-bracket and numeric-index selectors) to a
     * pointer. Filters, wildcards, slices, unions and recursive descent are not simple.
     *
     * @return the escaped pointer string ({@code ""} for {@code $}), or empty if the expression is
     *     not simple
     */
    public static Optional<String> simpleJsonPathToPointer(String expression) {
        String trimmed = expression.trim();
        if (!trimmed.startsWith("$")) {
            return Optional.empty();
        }
        String remainder = trimmed.substring(1);
        List<String> tokens = new ArrayList<>();
        Matcher m = SIMPLE_SEGMENT.matcher(remainder);
        int lastEnd = 0;
        while (m.find()) {
            if (m.start() != lastEnd) {
                return Optional.empty();
            }
            tokens.add(firstGroup(m));
            lastEnd = m.end();
        }
        if (lastEnd != remainder.length()) {
            return Optional.empty();
        }
        return Optional.of(new Pointer(tokens).toString());
    }

    public static String analysisPathToJsonPath(String path) {
        if (path == null || path.isEmpty() || "root".equals(path)) {
            return "$";
        }
        return path.replaceFirst("^root", "\\$");
    }

    public static String analysisPathToPointer(String path) {
        if (path == null || path.isEmpty() || "root".equals(path)) {
            return "";
        }
        String tail = path.replaceFirst("^root", "");
        List<String> tokens = new ArrayList<>();
        Matcher m = ANALYSIS_SEGMENT.matcher(tail);
        while (m.find()) {
            if (m.group(2) != null) {
                tokens.add(m.group(2).replace("\\\"", "\""));
            } else {
                tokens.add(firstGroup(m));
            }
        }
        return new Pointer(tokens).toString();
    }

    public static String pointerToAnalysisPath(String pointer) {
        if (pointer == null || pointer.isEmpty() || "/".equals(pointer)) {
            return "root";
        }
        StringBuilder path = new StringBuilder("root");
        for (String token : Pointer.parse(pointer).tokens()) {
            if (DIGITS.matcher(token).matches()) {
                path.append('[').append(token).append(']');
            } else if (IDENTIFIER.matcher(token).matches()) {
                path.append('.').append(token);
            } else {
                path.append("[\"").append(token.replace("\"", "\\\"")).append("\"]");
            }
        }
        return path.toString();
    }

    private static String firstGroup(Matcher m) {
        for (int group = 1; group <= m.groupCount(); group++) {
            if (m.group(group) != null) {
                return m.group(group);
            }
        }
        throw new IllegalStateException("segment pattern matched without a capturing group");
    }
}
