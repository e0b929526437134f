package com.chunkanon.infrastructure.anonymizer.parsing;

import com.chunkanon.domain.anonymize.model.OutputFormat;
import com.chunkanon.domain.anonymize.model.ReplacementParseResult;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one raw replacement-model response into an original→replacement map.
 * <p>
 * The model answers in several encodings. Each is an {@link ExtractionStrategy}, tried in a fixed
 * order; the first one that recognises the response wins, even when it carries no pairs.
 * Parsing never throws: anything unrecognised yields an empty {@link OutputFormat#NONE} result.
 * </p>
 */
@Slf4j
@Component
public class ReplacementOutputParser {

    static final String FUNCTION_NAME = "replace_entities";

    // Greedy and DOTALL: the captured object may span lines and contain nested braces.
    private static final Pattern CALL_EXPRESSION_PATTERN = Pattern.compile(
            "replace_entities\\s*\\(\\s*(\\{.*\\})\\s*\\)", Pattern.DOTALL);

    private static final int LOG_PREVIEW_LENGTH = 200;

    private final ObjectReader strictReader;
    private final List<ExtractionStrategy> strategies;

    public ReplacementOutputParser(ObjectMapper objectMapper) {
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.strategies = List.of(
                new ExtractionStrategy(OutputFormat.FUNCTION_CALL, this::extractFunctionCall),
                new ExtractionStrategy(OutputFormat.REPLACEMENTS_OBJECT, (raw, root) -> extractReplacementsObject(root)),
                new ExtractionStrategy(OutputFormat.CALL_EXPRESSION, (raw, root) -> extractCallExpression(raw))
        );
    }

    /**
     * One way of reading a response. {@code root} is the response parsed as a whole JSON document,
     * or null when it is not one.
     */
    private record ExtractionStrategy(OutputFormat format, Extractor extractor) {}

    @FunctionalInterface
    private interface Extractor {
        Optional<Map<String, String>> extract(String raw, JsonNode root);
    }

    public ReplacementParseResult parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return ReplacementParseResult.none();
        }

        JsonNode root = readJson(raw).orElse(null);

        for (ExtractionStrategy strategy : strategies) {
            Optional<Map<String, String>> extracted = strategy.extractor().extract(raw, root);
            if (extracted.isPresent()) {
                log.debug("[OutputParser] {} → {} replacements", strategy.format(), extracted.get().size());
                return new ReplacementParseResult(extracted.get(), strategy.format());
            }
        }

        log.warn("[OutputParser] Unrecognised model output: {}", preview(raw));
        return ReplacementParseResult.none();
    }

    // {"name": "replace_entities", "arguments": {"replacements": [...]}}
    private Optional<Map<String, String>> extractFunctionCall(String raw, JsonNode root) {
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        JsonNode name = root.get("name");
        if (name == null || !name.isTextual() || !FUNCTION_NAME.equals(name.asText())) {
            return Optional.empty();
        }

        JsonNode arguments = root.get("arguments");
        // OpenAI-style tool calls carry the arguments as a JSON-encoded string.
        if (arguments != null && arguments.isTextual()) {
            arguments = readJson(arguments.asText()).orElse(null);
        }
        JsonNode replacements = arguments != null && arguments.isObject() ? arguments.get("replacements") : null;
        return Optional.of(collectPairs(replacements));
    }

    // {"replacements": [...]}
    private Optional<Map<String, String>> extractReplacementsObject(JsonNode root) {
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        JsonNode replacements = root.get("replacements");
        if (replacements == null || !replacements.isArray()) {
            return Optional.empty();
        }
        return Optional.of(collectPairs(replacements));
    }

    // replace_entities({...}) somewhere in free text
    private Optional<Map<String, String>> extractCallExpression(String raw) {
        if (!raw.contains(FUNCTION_NAME)) {
            return Optional.empty();
        }
        Matcher matcher = CALL_EXPRESSION_PATTERN.matcher(raw);
        if (!matcher.find()) {
            return Optional.empty();
        }

        Optional<JsonNode> embedded = readJson(matcher.group(1));
        if (embedded.isEmpty() || !embedded.get().isObject()) {
            return Optional.empty();
        }
        return Optional.of(collectPairs(embedded.get().get("replacements")));
    }

    /**
     * Collect {original, replacement} items; both must be non-empty strings. A repeated original
     * keeps its first position and takes the later value.
     */
    private Map<String, String> collectPairs(JsonNode replacements) {
        Map<String, String> pairs = new LinkedHashMap<>();
        if (replacements == null || !replacements.isArray()) {
            return pairs;
        }

        for (JsonNode item : replacements) {
            if (!item.isObject()) continue;

            String original = textOrEmpty(item.get("original"));
            String replacement = textOrEmpty(item.get("replacement"));
            if (!original.isEmpty() && !replacement.isEmpty()) {
                pairs.put(original, replacement);
            }
        }
        return pairs;
    }

    private Optional<JsonNode> readJson(String text) {
        try {
            return Optional.ofNullable(strictReader.readTree(text));
        } catch (Exception e) {
            log.debug("[OutputParser] Not a JSON document: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static String textOrEmpty(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : "";
    }

    private static String preview(String raw) {
        return raw.length() <= LOG_PREVIEW_LENGTH ? raw : raw.substring(0, LOG_PREVIEW_LENGTH) + "...";
    }
}
