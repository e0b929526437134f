package com.chunkanon.infrastructure.ai;

import com.openai.core.JsonValue;
import com.openai.models.FunctionDefinition;
import com.openai.models.FunctionParameters;
import com.openai.models.chat.completions.ChatCompletionTool;

import java.util.List;
import java.util.Map;

/**
 * System instruction and tool schema the anonymizer model was fine-tuned on.
 */
final class AnonymizerPrompt {

    static final String TOOL_NAME = "replace_entities";

    // disables the model's reasoning block
    static final String NO_THINK_SUFFIX = "\n/no_think";

    static final String SYSTEM_PROMPT = """
            You are an anonymizer. Your task is to identify and replace personally identifiable information (PII) in the given text.
            Replace PII entities with semantically equivalent alternatives that preserve the context needed for a good response.
            If no PII is found or replacement is not needed, return an empty replacements list.

            REPLACEMENT RULES:
            • Personal names: Replace private or small-group individuals. Pick same culture + gender + era; keep surnames aligned across family members. DO NOT replace globally recognised public figures (heads of state, Nobel laureates, A-list entertainers, Fortune-500 CEOs, etc.).
            • Companies / organisations: Replace private, niche, employer & partner orgs. Invent a fictitious org in the same industry & size tier; keep legal suffix. Keep major public companies (anonymity set ≥ 1,000,000).
            • Projects / codenames / internal tools: Always replace with a neutral two-word alias of similar length.
            • Locations: Replace street addresses, buildings, villages & towns < 100k pop with a same-level synthetic location inside the same state/country. Keep big cities (≥ 1M), states, provinces, countries, iconic landmarks.
            • Dates & times: Replace birthdays, meeting invites, exact timestamps. Shift day/month by small amounts while KEEPING THE SAME YEAR to maintain temporal context. DO NOT shift public holidays or famous historic dates ("July 4 1776", "Christmas Day", "9/11/2001", etc.). Keep years, fiscal quarters, decade references unchanged.
            • Identifiers: (emails, phone #s, IDs, URLs, account #s) Always replace with format-valid dummies; keep domain class (.com big-tech, .edu, .gov).
            • Monetary values: Replace personal income, invoices, bids by × [0.8 – 1.25] to keep order-of-magnitude. Keep public list prices & market caps.
            • Quotes / text snippets: If the quote contains PII, swap only the embedded tokens; keep the rest verbatim.
            /no_think""";

    private static final String TOOL_DESCRIPTION =
            "Replace PII entities in the text with semantically equivalent alternatives that preserve context.";

    private AnonymizerPrompt() {
    }

    static String userMessage(String shardText) {
        return shardText + NO_THINK_SUFFIX;
    }

    static ChatCompletionTool replaceEntitiesTool() {
        Map<String, Object> replacementItem = Map.of(
                "type", "object",
                "properties", Map.of(
                        "original", Map.of(
                                "type", "string",
                                "description", "The original PII text to replace"),
                        "replacement", Map.of(
                                "type", "string",
                                "description", "The anonymized replacement text")),
                "required", List.of("original", "replacement"));

        Map<String, Object> replacements = Map.of(
                "type", "array",
                "description", "List of replacements to make. Each replacement has an 'original' field with the PII text "
                        + "and a 'replacement' field with the anonymized version.",
                "items", replacementItem);

        FunctionParameters parameters = FunctionParameters.builder()
                .putAdditionalProperty("type", JsonValue.from("object"))
                .putAdditionalProperty("properties", JsonValue.from(Map.of("replacements", replacements)))
                .putAdditionalProperty("required", JsonValue.from(List.of("replacements")))
                .build();

        return ChatCompletionTool.builder()
                .function(FunctionDefinition.builder()
                        .name(TOOL_NAME)
                        .description(TOOL_DESCRIPTION)
                        .parameters(parameters)
                        .build())
                .build();
    }
}
