package com.chunkanon.infrastructure.anonymizer.parsing;

import com.chunkanon.domain.anonymize.model.OutputFormat;
import com.chunkanon.domain.anonymize.model.ReplacementParseResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class ReplacementOutputParserTest {

    private ReplacementOutputParser parser;

    @BeforeEach
    void setUp() {
        parser = new ReplacementOutputParser(new ObjectMapper());
    }

    @Test
    @DisplayName("function-call envelope")
    void function_call_envelope() {
        String raw = """
                {"name":"replace_entities","arguments":{"replacements":[
                  {"original":"John Doe","replacement":"Mark Lee"},
                  {"original":"Acme Corp","replacement":"Bolt Inc"}]}}""";

        ReplacementParseResult result = parser.parse(raw);

        assertThat(result.format()).isEqualTo(OutputFormat.FUNCTION_CALL);
        assertThat(result.replacements()).containsExactly(
                entry("John Doe", "Mark Lee"), entry("Acme Corp", "Bolt Inc"));
    }

    @Test
    @DisplayName("function-call envelope with JSON-encoded arguments string")
    void function_call_with_string_arguments() {
        String raw = "{\"name\":\"replace_entities\",\"arguments\":"
                + "\"{\\\"replacements\\\":[{\\\"original\\\":\\\"Kim\\\",\\\"replacement\\\":\\\"Lee\\\"}]}\"}";

        ReplacementParseResult result = parser.parse(raw);

        assertThat(result.format()).isEqualTo(OutputFormat.FUNCTION_CALL);
        assertThat(result.replacements()).containsExactly(entry("Kim", "Lee"));
    }

    @Test
    @DisplayName("matching envelope without arguments stops the search with no pairs")
    void envelope_without_arguments() {
        ReplacementParseResult result = parser.parse("{\"name\":\"replace_entities\"}");

        assertThat(result.matched()).isTrue();
        assertThat(result.format()).isEqualTo(OutputFormat.FUNCTION_CALL);
        assertThat(result.replacements()).isEmpty();
    }

    @Test
    @DisplayName("bare replacements object")
    void replacements_object() {
        ReplacementParseResult result = parser.parse(
                "{\"replacements\":[{\"original\":\"Berlin office\",\"replacement\":\"Hamburg office\"}]}");

        assertThat(result.format()).isEqualTo(OutputFormat.REPLACEMENTS_OBJECT);
        assertThat(result.replacements()).containsExactly(entry("Berlin office", "Hamburg office"));
    }

    @Test
    @DisplayName("other function name falls through to the replacements shape")
    void other_function_name() {
        ReplacementParseResult result = parser.parse(
                "{\"name\":\"something_else\",\"replacements\":[{\"original\":\"A\",\"replacement\":\"B\"}]}");

        assertThat(result.format()).isEqualTo(OutputFormat.REPLACEMENTS_OBJECT);
        assertThat(result.replacements()).containsExactly(entry("A", "B"));
    }

    @Test
    @DisplayName("call expression without JSON envelope")
    void call_expression() {
        ReplacementParseResult result = parser.parse(
                "replace_entities({\"replacements\":[{\"original\":\"X\",\"replacement\":\"Y\"}]})");

        assertThat(result.format()).isEqualTo(OutputFormat.CALL_EXPRESSION);
        assertThat(result.replacements()).isEqualTo(Map.of("X", "Y"));
    }

    @Test
    @DisplayName("call expression inside free text spanning lines")
    void call_expression_in_text() {
        String raw = "Sure, here you go:\nreplace_entities ( {\n  \"replacements\": [\n"
                + "    {\"original\": \"Maria\", \"replacement\": \"Elena\"}\n  ]\n} )\nDone.";

        ReplacementParseResult result = parser.parse(raw);

        assertThat(result.format()).isEqualTo(OutputFormat.CALL_EXPRESSION);
        assertThat(result.replacements()).containsExactly(entry("Maria", "Elena"));
    }

    @Test
    @DisplayName("empty and non-string fields are dropped")
    void invalid_items_dropped() {
        String raw = "{\"replacements\":["
                + "{\"original\":\"\",\"replacement\":\"x\"},"
                + "{\"original\":\"y\",\"replacement\":\"\"},"
                + "{\"original\":\"z\"},"
                + "{\"original\":5,\"replacement\":\"five\"},"
                + "\"not an object\","
                + "{\"original\":\"ok\",\"replacement\":\"fine\"}]}";

        assertThat(parser.parse(raw).replacements()).containsExactly(entry("ok", "fine"));
    }

    @Test
    @DisplayName("repeated original keeps first position, later value")
    void repeated_original() {
        String raw = "{\"replacements\":["
                + "{\"original\":\"A\",\"replacement\":\"B\"},"
                + "{\"original\":\"Q\",\"replacement\":\"R\"},"
                + "{\"original\":\"A\",\"replacement\":\"C\"}]}";

        assertThat(parser.parse(raw).replacements()).containsExactly(entry("A", "C"), entry("Q", "R"));
    }

    @Test
    @DisplayName("JSON followed by trailing text is not a JSON document")
    void trailing_text_rejected() {
        ReplacementParseResult result = parser.parse(
                "{\"replacements\":[{\"original\":\"A\",\"replacement\":\"B\"}]} and more");

        assertThat(result.format()).isEqualTo(OutputFormat.NONE);
        assertThat(result.replacements()).isEmpty();
    }

    @Test
    @DisplayName("unrecognised input yields an empty NONE result")
    void unrecognised_inputs() {
        assertThat(parser.parse(null).format()).isEqualTo(OutputFormat.NONE);
        assertThat(parser.parse("").format()).isEqualTo(OutputFormat.NONE);
        assertThat(parser.parse("   ").format()).isEqualTo(OutputFormat.NONE);
        assertThat(parser.parse("not json at all").replacements()).isEmpty();
        assertThat(parser.parse("[1, 2, 3]").format()).isEqualTo(OutputFormat.NONE);
        assertThat(parser.parse("{\"foo\": 1}").format()).isEqualTo(OutputFormat.NONE);
        assertThat(parser.parse("{\"replacements\": \"oops\"}").format()).isEqualTo(OutputFormat.NONE);
        assertThat(parser.parse("replace_entities({broken json})").format()).isEqualTo(OutputFormat.NONE);
    }
}
