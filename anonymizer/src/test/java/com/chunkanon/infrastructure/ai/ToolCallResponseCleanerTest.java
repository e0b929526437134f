package com.chunkanon.infrastructure.ai;

import com.chunkanon.domain.anonymize.model.OutputFormat;
import com.chunkanon.domain.anonymize.model.ReplacementParseResult;
import com.chunkanon.infrastructure.anonymizer.parsing.ReplacementOutputParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class ToolCallResponseCleanerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ToolCallResponseCleaner cleaner = new ToolCallResponseCleaner(objectMapper);

    @Test
    @DisplayName("content: tool_call 블록 내부만 추출")
    void tool_call_block() {
        String content = "<tool_call>\n{\"name\": \"replace_entities\", \"arguments\": {\"replacements\": []}}\n</tool_call>";

        assertThat(cleaner.fromContent(content))
                .isEqualTo("{\"name\": \"replace_entities\", \"arguments\": {\"replacements\": []}}");
    }

    @Test
    @DisplayName("content: 마지막 assistant 턴 이후만 사용")
    void after_last_assistant_turn() {
        String content = "user\n<tool_call>{\"old\":1}</tool_call>\nassistant\n<think>\n</think>\n<tool_call>{\"new\":2}</tool_call>";

        assertThat(cleaner.fromContent(content)).isEqualTo("{\"new\":2}");
    }

    @Test
    @DisplayName("content: tool_call 블록이 없으면 빈 문자열")
    void no_tool_call() {
        assertThat(cleaner.fromContent("No PII found.")).isEmpty();
        assertThat(cleaner.fromContent(null)).isEmpty();
        assertThat(cleaner.fromContent("  ")).isEmpty();
    }

    @Test
    @DisplayName("tool call: 인자를 JSON 객체로 감싸 파서가 읽을 수 있게")
    void structured_tool_call() {
        String raw = cleaner.fromToolCall("replace_entities",
                "{\"replacements\":[{\"original\":\"Oslo Dental\",\"replacement\":\"Bergen Smiles\"}]}");

        assertThat(raw).isEqualTo("{\"name\":\"replace_entities\",\"arguments\":"
                + "{\"replacements\":[{\"original\":\"Oslo Dental\",\"replacement\":\"Bergen Smiles\"}]}}");

        ReplacementParseResult parsed = new ReplacementOutputParser(objectMapper).parse(raw);
        assertThat(parsed.format()).isEqualTo(OutputFormat.FUNCTION_CALL);
        assertThat(parsed.replacements()).containsExactly(entry("Oslo Dental", "Bergen Smiles"));
    }

    @Test
    @DisplayName("tool call: JSON이 아닌 인자는 문자열로 유지")
    void unparseable_arguments() {
        assertThat(cleaner.fromToolCall("replace_entities", "{oops"))
                .isEqualTo("{\"name\":\"replace_entities\",\"arguments\":\"{oops\"}");
        assertThat(cleaner.fromToolCall("replace_entities", ""))
                .isEqualTo("{\"name\":\"replace_entities\",\"arguments\":{}}");
    }
}
