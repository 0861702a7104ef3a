package io.jsonrewriter.core.pointer;

import io.jsonrewriter.core.error.UnsafePointerException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A location in a document tree, held as a list of unescaped tokens. The empty token list is the
 * document root, rendered as {@code ""}; every other pointer renders as {@code /t1/t2/...} with
 * {@code ~} and {@code /} escaped as {@code ~0} and {@code ~1}.
 *
 * <p>
 * A pointer is <em>unsafe</em> when any token is one of {@link #UNSAFE_KEYS}. Unsafe pointers
 * are never accepted as a write destination.
 *
 * <p>
 * Immutable and thread-safe.
 */
public record Pointer(List<String> tokens) {

    /** Keys that would alter an object's inheritance chain in a JavaScript host. */
    public static final Set<String> UNSAFE_KEYS = Set.of("__proto__", "prototype", "constructor");

    private static final Pointer ROOT = new Pointer(List.of());

    public Pointer {
        Objects.requireNonNull(tokens, "tokens must not be null");
        tokens = List.copyOf(tokens);
    }

    /** The root pointer. */
    public static Pointer root() {
        return ROOT;
    }

    /**
     * Parses an escaped pointer string.
     *
     * @param pointer {@code ""} for the root, otherwise a string starting with {@code /}
     * @throws IllegalArgumentException if a non-empty pointer does not start with {@code /}
     */
    public static Pointer parse(String pointer) {
        Objects.requireNonNull(pointer, "pointer must not be null");
        if (pointer.isEmpty()) {
            return ROOT;
        }
        if (!pointer.startsWith("/")) {
            throw new IllegalArgumentException("Invalid JSON pointer: " + pointer);
        }
        List<String> tokens = new ArrayList<>();
        for (String raw : pointer.substring(1).split("/", -1)) {
            tokens.add(decodeToken(raw));
        }
        return new Pointer(tokens);
    }

    /**
     * Brings a pointer-like string into leading-slash form: {@code ""} stays the root, a string
     * without a leading slash gets one.
     */
    public static String normalize(String pointer) {
        if (pointer == null || pointer.isEmpty()) {
            return "";
        }
        if (!pointer.startsWith("/")) {
            return "/" + pointer;
        }
        return pointer;
    }

    /** Parses after {@link #normalize(String) normalizing}. */
    public static Pointer parseNormalized(String pointer) {
        return parse(normalize(pointer));
    }

    /** Builds a pointer from unescaped tokens. */
    public static Pointer of(String... tokens) {
        return new Pointer(List.of(tokens));
    }

    public static String decodeToken(String token) {
        return token.replace("~1", "/").replace("~0", "~");
    }

    public static String encodeToken(String token) {
        return token.replace("~", "~0").replace("/", "~1");
    }

    /** Returns {@code true} if the key is one of {@link #UNSAFE_KEYS}. */
    public static boolean isUnsafeKey(String key) {
        return UNSAFE_KEYS.contains(key);
    }

    /**
     * Throws {@link UnsafePointerException} if the key is reserved.
     */
    public static void requireSafeKey(String key) {
        if (isUnsafeKey(key)) {
            throw new UnsafePointerException(key);
        }
    }

    public boolean isRoot() {
        return tokens.isEmpty();
    }

    public int size() {
        return tokens.size();
    }

    /** The final token, or empty for the root. */
    public Optional<String> lastToken() {
        return isRoot() ? Optional.empty() : Optional.of(tokens.get(tokens.size() - 1));
    }

    /** The pointer with the final token dropped; the root is its own parent. */
    public Pointer parent() {
        if (tokens.size() <= 1) {
            return ROOT;
        }
        return new Pointer(tokens.subList(0, tokens.size() - 1));
    }

    /** A new pointer with {@code token} appended. */
    public Pointer append(String token) {
        List<String> next = new ArrayList<>(tokens);
        next.add(token);
        return new Pointer(next);
    }

    /** The first reserved token in this pointer, if any. */
    public Optional<String> unsafeToken() {
        return tokens.stream().filter(Pointer::isUnsafeKey).findFirst();
    }

    public boolean isUnsafe() {
        return unsafeToken().isPresent();
    }

    /** Throws {@link UnsafePointerException} naming the first reserved token, if any. */
    public Pointer requireSafe() {
        unsafeToken().ifPresent(Pointer::requireSafeKey);
        return this;
    }

    /** The escaped string form. */
    @Override
    public String toString() {
        if (tokens.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (String token : tokens) {
            sb.append('/').append(encodeToken(token));
        }
        return sb.toString();
    }
}
