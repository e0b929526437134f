package com.chunkanon.infrastructure.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes what the serving endpoint returns into the raw text the output parser reads.
 * <p>
 * Servers with tool-call parsing enabled return a structured call; those without return the
 * model's text, where the call sits inside {@code <tool_call>...</tool_call>}.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolCallResponseCleaner {

    private static final String ASSISTANT_MARKER = "assistant\n";
    private static final Pattern TOOL_CALL_PATTERN = Pattern.compile("<tool_call>(.*?)</tool_call>", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    /**
     * Structured tool call → {"name": ..., "arguments": {...}}. Arguments that are not valid JSON
     * are kept as a string.
     */
    public String fromToolCall(String name, String argumentsJson) {
        ObjectNode call = objectMapper.createObjectNode();
        call.put("name", name);
        try {
            JsonNode arguments = objectMapper.readTree(argumentsJson == null ? "" : argumentsJson);
            if (arguments == null || arguments.isMissingNode()) {
                call.putObject("arguments");
            } else {
                call.set("arguments", arguments);
            }
        } catch (JsonProcessingException e) {
            log.debug("Tool call arguments are not JSON, keeping raw text: {}", e.getOriginalMessage());
            call.put("arguments", argumentsJson);
        }
        return call.toString();
    }

    /**
     * Text completion → the inner text of the first tool_call block after the last assistant turn,
     * or "" when there is none.
     */
    public String fromContent(String content) {
        if (content == null || content.isBlank()) {
            return "";
        }

        int marker = content.lastIndexOf(ASSISTANT_MARKER);
        String output = (marker >= 0 ? content.substring(marker + ASSISTANT_MARKER.length()) : content).strip();

        Matcher matcher = TOOL_CALL_PATTERN.matcher(output);
        if (matcher.find()) {
            return matcher.group(1).strip();
        }
        return "";
    }
}
