package io.jsonrewriter.core.pointer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.jsonrewriter.core.error.PointerIndexOutOfBoundsException;
import io.jsonrewriter.core.error.PointerNotFoundException;
import io.jsonrewriter.core.error.RootMutationException;
import io.jsonrewriter.core.error.UnsafePointerException;
import io.jsonrewriter.core.pointer.PointerOperations.Removal;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PointerOperations")
class PointerOperationsTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static JsonNode json(String text) throws Exception {
        return JSON.readTree(text);
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    @Nested
    @DisplayName("read / find")
    class Read {

        @Test
        @DisplayName("reads nested object and array members")
        void readsNested() throws Exception {
            JsonNode doc = json("{\"a\":{\"b\":[10,20]}}");
            assertThat(PointerOperations.read(doc, Pointer.parse("/a/b/1")).asInt()).isEqualTo(20);
            assertThat(PointerOperations.read(doc, Pointer.root())).isSameAs(doc);
        }

        @Test
        @DisplayName("missing property fails")
        void missingProperty() throws Exception {
            assertThatThrownBy(() -> PointerOperations.read(json("{}"), Pointer.parse("/x")))
                    .isInstanceOf(PointerNotFoundException.class)
                    .hasMessage("Property 'x' does not exist");
        }

        @Test
        @DisplayName("traversing a scalar fails")
        void throughScalar() throws Exception {
            assertThatThrownBy(() -> PointerOperations.read(json("{\"a\":1}"), Pointer.parse("/a/b")))
                    .isInstanceOf(PointerNotFoundException.class)
                    .hasMessageContaining("non-container");
        }

        @Test
        @DisplayName("'-' cannot be read")
        void appendTokenUnreadable() throws Exception {
            assertThatThrownBy(() -> PointerOperations.read(json("[1]"), Pointer.parse("/-")))
                    .isInstanceOf(PointerIndexOutOfBoundsException.class);
        }

        @Test
        @DisplayName("out-of-bounds and non-integer indices fail")
        void badIndices() throws Exception {
            JsonNode doc = json("[1,2]");
            assertThatThrownBy(() -> PointerOperations.read(doc, Pointer.parse("/2")))
                    .isInstanceOf(PointerIndexOutOfBoundsException.class)
                    .hasMessage("Array index 2 is out of bounds");
            assertThatThrownBy(() -> PointerOperations.read(doc, Pointer.parse("/x")))
                    .isInstanceOf(PointerIndexOutOfBoundsException.class)
                    .hasMessage("Array index 'x' is not a non-negative integer");
        }

        @Test
        @DisplayName("find and exists never throw")
        void findIsSafe() throws Exception {
            JsonNode doc = json("{\"a\":[{\"b\":1}]}");
            assertThat(PointerOperations.find(doc, Pointer.parse("/a/0/b"))).map(JsonNode::asInt).contains(1);
            assertThat(PointerOperations.find(doc, Pointer.parse("/a/5/b"))).isEmpty();
            assertThat(PointerOperations.exists(doc, Pointer.parse("/a/0/b/c"))).isFalse();
            assertThat(PointerOperations.exists(doc, Pointer.parse("/a/0"))).isTrue();
        }

        @Test
        @DisplayName("an explicit null value exists")
        void nullExists() throws Exception {
            assertThat(PointerOperations.exists(json("{\"a\":null}"), Pointer.parse("/a"))).isTrue();
        }
    }

    @Nested
    @DisplayName("remove / restore")
    class Remove {

        @Test
        @DisplayName("removes an array element and shifts the rest left")
        void removesArrayElement() throws Exception {
            JsonNode doc = json("[0,1,2]");
            PointerOperations.remove(doc, Pointer.parse("/1"));
            assertThat(doc).isEqualTo(json("[0,2]"));
        }

        @Test
        @DisplayName("removes an object property")
        void removesProperty() throws Exception {
            JsonNode doc = json("{\"a\":1,\"b\":2}");
            PointerOperations.remove(doc, Pointer.parse("/a"));
            assertThat(doc).isEqualTo(json("{\"b\":2}"));
        }

        @Test
        @DisplayName("root removal is rejected")
        void rootRejected() throws Exception {
            assertThatThrownBy(() -> PointerOperations.remove(json("{}"), Pointer.root()))
                    .isInstanceOf(RootMutationException.class)
                    .hasMessage("Cannot remove the root document");
        }

        @Test
        @DisplayName("'-' is rejected for removal")
        void appendTokenRejected() throws Exception {
            assertThatThrownBy(() -> PointerOperations.remove(json("[1]"), Pointer.parse("/-")))
                    .isInstanceOf(PointerIndexOutOfBoundsException.class);
        }

        @Test
        @DisplayName("restore puts a property back at its original position")
        void restoresFieldOrder() throws Exception {
            JsonNode doc = json("{\"a\":1,\"b\":2,\"c\":3}");
            Removal removal = PointerOperations.remove(doc, Pointer.parse("/b"));
            PointerOperations.restore(removal);
            assertThat(fieldNames(doc)).containsExactly("a", "b", "c");
        }

        @Test
        @DisplayName("restore puts an element back at its index")
        void restoresArrayIndex() throws Exception {
            JsonNode doc = json("[\"x\",\"y\",\"z\"]");
            Removal removal = PointerOperations.remove(doc, Pointer.parse("/1"));
            PointerOperations.restore(removal);
            assertThat(doc).isEqualTo(json("[\"x\",\"y\",\"z\"]"));
        }
    }

    @Nested
    @DisplayName("replace / insert")
    class Write {

        @Test
        @DisplayName("replace requires an existing location")
        void replaceExisting() throws Exception {
            JsonNode doc = json("{\"a\":1,\"arr\":[1]}");
            PointerOperations.replace(doc, Pointer.parse("/a"), IntNode.valueOf(5));
            PointerOperations.replace(doc, Pointer.parse("/arr/0"), IntNode.valueOf(7));
            assertThat(doc).isEqualTo(json("{\"a\":5,\"arr\":[7]}"));
            assertThatThrownBy(() -> PointerOperations.replace(doc, Pointer.parse("/missing"), IntNode.valueOf(1)))
                    .isInstanceOf(PointerNotFoundException.class);
            assertThatThrownBy(() -> PointerOperations.replace(doc, Pointer.parse("/arr/1"), IntNode.valueOf(1)))
                    .isInstanceOf(PointerIndexOutOfBoundsException.class);
        }

        @Test
        @DisplayName("replacing the root returns the new value")
        void replaceRoot() throws Exception {
            JsonNode result = PointerOperations.replace(json("{}"), Pointer.root(), TextNode.valueOf("x"));
            assertThat(result.asText()).isEqualTo("x");
        }

        @Test
        @DisplayName("insert shifts array elements right; '-' and size append")
        void insertArray() throws Exception {
            JsonNode doc = json("[1,3]");
            PointerOperations.insert(doc, Pointer.parse("/1"), IntNode.valueOf(2));
            PointerOperations.insert(doc, Pointer.parse("/-"), IntNode.valueOf(4));
            PointerOperations.insert(doc, Pointer.parse("/4"), IntNode.valueOf(5));
            assertThat(doc).isEqualTo(json("[1,2,3,4,5]"));
            assertThatThrownBy(() -> PointerOperations.insert(doc, Pointer.parse("/9"), IntNode.valueOf(0)))
                    .isInstanceOf(PointerIndexOutOfBoundsException.class);
        }

        @Test
        @DisplayName("insert into an object overwrites an existing key")
        void insertOverwrites() throws Exception {
            JsonNode doc = json("{\"a\":1}");
            PointerOperations.insert(doc, Pointer.parse("/a"), IntNode.valueOf(2));
            PointerOperations.insert(doc, Pointer.parse("/b"), IntNode.valueOf(3));
            assertThat(doc).isEqualTo(json("{\"a\":2,\"b\":3}"));
        }

        @Test
        @DisplayName("insert into a missing parent fails")
        void insertMissingParent() throws Exception {
            assertThatThrownBy(() -> PointerOperations.insert(json("{}"), Pointer.parse("/x/0"), IntNode.valueOf(1)))
                    .isInstanceOf(PointerNotFoundException.class)
                    .hasMessage("Property 'x' does not exist");
        }

        @Test
        @DisplayName("reserved segments are rejected before any write")
        void reservedRejected() throws Exception {
            JsonNode doc = json("{\"a\":{}}");
            assertThatThrownBy(() -> PointerOperations.insert(doc, Pointer.parse("/a/__proto__"), IntNode.valueOf(1)))
                    .isInstanceOf(UnsafePointerException.class);
            assertThatThrownBy(() -> PointerOperations.replace(doc, Pointer.parse("/constructor"), IntNode.valueOf(1)))
                    .isInstanceOf(UnsafePointerException.class);
            assertThat(doc).isEqualTo(json("{\"a\":{}}"));
        }
    }

    @Test
    @DisplayName("parseIndex accepts only non-negative integers")
    void parseIndex() {
        assertThat(PointerOperations.parseIndex("0")).isZero();
        assertThat(PointerOperations.parseIndex("012")).isEqualTo(12);
        assertThat(PointerOperations.parseIndex("-1")).isEqualTo(-1);
        assertThat(PointerOperations.parseIndex("1a")).isEqualTo(-1);
        assertThat(PointerOperations.parseIndex("99999999999")).isEqualTo(Integer.MAX_VALUE);
    }
}
