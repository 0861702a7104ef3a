package io.jsonrewriter.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonrewriter.core.engine.DocumentRewriter;
import io.jsonrewriter.core.error.RewriteException;
import io.jsonrewriter.core.error.RuleSetParseException;
import io.jsonrewriter.core.model.MoveTargetMode;
import io.jsonrewriter.core.model.RenameTargetMode;
import io.jsonrewriter.core.model.ReplaceValueMode;
import io.jsonrewriter.core.model.RewriteResult;
import io.jsonrewriter.core.model.Rule;
import io.jsonrewriter.core.model.RuleDiagnostic;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("RuleSetParser")
class RuleSetParserTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final RuleSetParser parser = new RuleSetParser();

    @TempDir
    Path tempDir;

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(RuleSetParserTest.class.getResource("/rulesets/" + name).toURI());
    }

    @Nested
    @DisplayName("valid rule sets")
    class Valid {

        @Test
        @DisplayName("rules mapping -> one record per rule, in file order")
        void rulesMapping() throws Exception {
            List<Rule> rules = parser.parse(fixture("basic.yaml"));

            assertThat(rules)
                    .extracting(Rule::id)
                    .containsExactly(
                            "drop-internal", "mask-card", "copy-total", "hoist-customer", "rename-items", "legacy");
            assertThat(rules.get(0)).isInstanceOf(Rule.Remove.class);
            assertThat(rules.get(1)).isInstanceOfSatisfying(Rule.Replace.class, replace -> {
                assertThat(replace.value().asText()).isEqualTo("****");
                assertThat(replace.valueMode()).isEqualTo(ReplaceValueMode.LITERAL);
            });
            assertThat(rules.get(3)).isInstanceOfSatisfying(Rule.Move.class, move -> {
                assertThat(move.target()).isEqualTo("/customer");
                assertThat(move.targetMode()).isEqualTo(MoveTargetMode.AUTO);
            });
            assertThat(rules.get(5).disabled()).isTrue();
        }

        @Test
        @DisplayName("bare JSON list -> generated ids and parsed flags")
        void bareList() throws Exception {
            List<Rule> rules = parser.parse(fixture("bare-list.json"));

            assertThat(rules).hasSize(2);
            assertThat(rules).allSatisfy(rule -> assertThat(rule.id()).matches("r-[0-9a-f]{8}"));
            assertThat(rules.get(0).allowEmptyMatcher()).isTrue();
            assertThat(rules.get(1)).isInstanceOfSatisfying(Rule.Rename.class, rename -> {
                assertThat(rename.target()).isEqualTo("title");
                assertThat(rename.targetMode()).isEqualTo(RenameTargetMode.LITERAL);
            });
        }

        @Test
        @DisplayName("explicit null value is kept; absent value is not")
        void nullVersusAbsentValue() {
            List<Rule> rules = parser.parse("""
                    - op: replace
                      matcher: $.a
                      value: null
                    - op: replace
                      matcher: $.b
                    """, "inline");

            assertThat(((Rule.Replace) rules.get(0)).hasValue()).isTrue();
            assertThat(((Rule.Replace) rules.get(0)).value().isNull()).isTrue();
            assertThat(((Rule.Replace) rules.get(1)).hasValue()).isFalse();
        }

        @Test
        @DisplayName("structured values are kept as JSON")
        void structuredValue() throws Exception {
            List<Rule> rules = parser.parse(
                    write("object.yaml", """
                            rules:
                              - op: replace
                                matcher: $.meta
                                value:
                                  version: 2
                                  tags: [a, b]
                            """));

            assertThat(((Rule.Replace) rules.get(0)).value())
                    .isEqualTo(JSON.readTree("{\"version\":2,\"tags\":[\"a\",\"b\"]}"));
        }

        @Test
        @DisplayName("an empty rules list is valid")
        void emptyRules() {
            assertThat(parser.parse("rules: []", "inline")).isEmpty();
        }
    }

    @Nested
    @DisplayName("invalid rule sets")
    class Invalid {

        @Test
        @DisplayName("a key belonging to another kind is rejected")
        void keyOfAnotherKind() throws Exception {
            Path file = write("bad.yaml", """
                    rules:
                      - id: r1
                        op: remove
                        matcher: $.a
                        target: /b
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(RuleSetParseException.class)
                    .hasMessageContaining("Unknown key in 'rules[1] (remove)': [target]")
                    .satisfies(e -> {
                        RuleSetParseException ex = (RuleSetParseException) e;
                        assertThat(ex.ruleId()).isEqualTo("r1");
                        assertThat(ex.source()).isEqualTo(file.toString());
                        assertThat(ex.phase()).isEqualTo(RewriteException.Phase.LOAD);
                    });
        }

        @Test
        @DisplayName("an unknown op fails schema validation")
        void unknownOp() {
            assertThatThrownBy(() -> parser.parse("[{op: add, matcher: $.a}]", "inline"))
                    .isInstanceOf(RuleSetParseException.class)
                    .hasMessageStartingWith("Rule set does not match schema");
        }

        @Test
        @DisplayName("a missing matcher fails schema validation")
        void missingMatcher() {
            assertThatThrownBy(() -> parser.parse("rules:\n  - op: remove\n", "inline"))
                    .isInstanceOf(RuleSetParseException.class)
                    .hasMessageStartingWith("Rule set does not match schema");
        }

        @Test
        @DisplayName("literal target mode is rename-only")
        void literalMoveTarget() {
            assertThatThrownBy(() -> parser.parse(
                            "[{op: move, matcher: $.a, target: b, targetMode: literal}]", "inline"))
                    .isInstanceOf(RuleSetParseException.class)
                    .hasMessageContaining("Unknown mode: 'literal'");
        }

        @Test
        @DisplayName("duplicate ids are rejected")
        void duplicateIds() {
            assertThatThrownBy(() -> parser.parse("""
                            - {id: same, op: remove, matcher: $.a}
                            - {id: same, op: remove, matcher: $.b}
                            """, "inline"))
                    .isInstanceOf(RuleSetParseException.class)
                    .hasMessage("Duplicate rule id 'same'");
        }

        @Test
        @DisplayName("malformed YAML -> parse error with cause")
        void malformedYaml() throws Exception {
            Path file = write("broken.yaml", "rules: [ { op: remove\n");

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(RuleSetParseException.class)
                    .hasMessageStartingWith("Failed to read or parse rule set")
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("an empty document is rejected")
        void emptyDocument() {
            assertThatThrownBy(() -> parser.parse("", "inline"))
                    .isInstanceOf(RuleSetParseException.class)
                    .hasMessage("Rule set is empty");
        }

        @Test
        @DisplayName("a missing file -> read error")
        void missingFile() {
            assertThatThrownBy(() -> parser.parse(tempDir.resolve("absent.yaml")))
                    .isInstanceOf(RuleSetParseException.class)
                    .hasMessageStartingWith("Failed to read or parse rule set");
        }
    }

    @Nested
    @DisplayName("end to end")
    class EndToEnd {

        @Test
        @DisplayName("parsed rules rewrite a document")
        void basicRuleSet() throws Exception {
            List<Rule> rules = parser.parse(fixture("basic.yaml"));
            RewriteResult result = DocumentRewriter.withDefaults()
                    .rewrite(
                            JSON.readTree("""
                                    {"internal": {"x": 1},
                                     "payment": {"card": "4111", "amount": 42},
                                     "summary": {"total": 0},
                                     "order": {"customer": {"name": "Ann"}, "lines": [1, 2]}}
                                    """),
                            rules);

            assertThat(result.ok()).isTrue();
            assertThat(result.warnings()).isEmpty();
            assertThat(result.appliedOperations()).hasSize(5);
            assertThat(result.document()).isEqualTo(JSON.readTree("""
                    {"payment": {"card": "****", "amount": 42},
                     "summary": {"total": 42},
                     "order": {"items": [1, 2]},
                     "customer": {"name": "Ann"}}
                    """));
            assertThat(result.diagnostics().get(5)).isEqualTo(RuleDiagnostic.disabled(rules.get(5)));
        }

        @Test
        @DisplayName("bare list with literal rename")
        void bareListRuleSet() throws Exception {
            RewriteResult result = DocumentRewriter.withDefaults()
                    .rewrite(JSON.readTree("{\"tags\":[\"a\",\"tmp\"],\"name\":\"x\"}"),
                            parser.parse(fixture("bare-list.json")));

            assertThat(result.ok()).isTrue();
            assertThat(result.document()).isEqualTo(JSON.readTree("{\"tags\":[\"a\"],\"title\":\"x\"}"));
        }
    }
}
