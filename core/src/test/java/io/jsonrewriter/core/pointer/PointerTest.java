package io.jsonrewriter.core.pointer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jsonrewriter.core.error.UnsafePointerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link Pointer}: parsing, escaping, structure and reserved segments. */
@DisplayName("Pointer")
class PointerTest {

    @Nested
    @DisplayName("parse / toString")
    class Parsing {

        @Test
        @DisplayName("empty string is the root")
        void emptyIsRoot() {
            Pointer root = Pointer.parse("");
            assertThat(root.isRoot()).isTrue();
            assertThat(root.tokens()).isEmpty();
            assertThat(root.toString()).isEmpty();
        }

        @Test
        @DisplayName("splits and decodes tokens")
        void decodesTokens() {
            Pointer pointer = Pointer.parse("/a~1b/m~0n/0");
            assertThat(pointer.tokens()).containsExactly("a/b", "m~n", "0");
        }

        @Test
        @DisplayName("decodes ~01 to ~1, not /")
        void decodeOrder() {
            assertThat(Pointer.decodeToken("~01")).isEqualTo("~1");
        }

        @Test
        @DisplayName("keeps empty tokens")
        void emptyTokens() {
            assertThat(Pointer.parse("/").tokens()).containsExactly("");
            assertThat(Pointer.parse("/a//b").tokens()).containsExactly("a", "", "b");
        }

        @Test
        @DisplayName("round-trips escaped form")
        void roundTrip() {
            assertThat(Pointer.parse("/a~1b/m~0n").toString()).isEqualTo("/a~1b/m~0n");
            assertThat(Pointer.of("x/y", "~").toString()).isEqualTo("/x~1y/~0");
        }

        @Test
        @DisplayName("rejects a pointer without leading slash")
        void rejectsMissingSlash() {
            assertThatThrownBy(() -> Pointer.parse("a/b"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Invalid JSON pointer");
        }

        @Test
        @DisplayName("normalize adds a leading slash and keeps the root")
        void normalize() {
            assertThat(Pointer.normalize("a/b")).isEqualTo("/a/b");
            assertThat(Pointer.normalize("/a")).isEqualTo("/a");
            assertThat(Pointer.normalize("")).isEmpty();
            assertThat(Pointer.normalize(null)).isEmpty();
            assertThat(Pointer.parseNormalized("a").tokens()).containsExactly("a");
        }
    }

    @Nested
    @DisplayName("structure")
    class Structure {

        @Test
        @DisplayName("parent drops the last token; root is its own parent")
        void parent() {
            assertThat(Pointer.parse("/a/b/c").parent()).isEqualTo(Pointer.parse("/a/b"));
            assertThat(Pointer.parse("/a").parent().isRoot()).isTrue();
            assertThat(Pointer.root().parent().isRoot()).isTrue();
        }

        @Test
        @DisplayName("append adds an escaped token")
        void append() {
            assertThat(Pointer.parse("/a").append("b/c").toString()).isEqualTo("/a/b~1c");
        }

        @Test
        @DisplayName("lastToken is empty for the root")
        void lastToken() {
            assertThat(Pointer.parse("/a/b").lastToken()).contains("b");
            assertThat(Pointer.root().lastToken()).isEmpty();
        }

        @Test
        @DisplayName("equal token lists are equal pointers")
        void equality() {
            assertThat(Pointer.parse("/a/0")).isEqualTo(Pointer.of("a", "0"));
        }
    }

    @Nested
    @DisplayName("reserved segments")
    class Reserved {

        @Test
        @DisplayName("detects __proto__, prototype and constructor anywhere")
        void detectsUnsafe() {
            assertThat(Pointer.parse("/a/__proto__/b").unsafeToken()).contains("__proto__");
            assertThat(Pointer.parse("/prototype").isUnsafe()).isTrue();
            assertThat(Pointer.parse("/x/constructor").isUnsafe()).isTrue();
            assertThat(Pointer.parse("/proto/ctor").isUnsafe()).isFalse();
        }

        @Test
        @DisplayName("requireSafe throws naming the segment")
        void requireSafe() {
            assertThatThrownBy(() -> Pointer.parse("/a/__proto__").requireSafe())
                    .isInstanceOf(UnsafePointerException.class)
                    .hasMessage("Unsafe pointer segment '__proto__' is not allowed");
            assertThat(Pointer.parse("/a").requireSafe()).isEqualTo(Pointer.parse("/a"));
        }

        @Test
        @DisplayName("requireSafeKey checks a single key")
        void requireSafeKey() {
            assertThatThrownBy(() -> Pointer.requireSafeKey("constructor"))
                    .isInstanceOf(UnsafePointerException.class);
        }
    }
}
