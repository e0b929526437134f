package com.chunkanon.infrastructure.ai;

import com.chunkanon.domain.anonymize.service.EntityReplacementModel;
import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionMessage;
import com.openai.models.chat.completions.ChatCompletionMessageToolCall;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Calls the anonymizer model through an OpenAI-compatible chat completions endpoint.
 * Never throws: any client failure is logged and answered with "".
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiEntityReplacementModel implements EntityReplacementModel {

    private final OpenAIClient openAIClient;
    private final ToolCallResponseCleaner responseCleaner;

    @Value("${openai.model}")
    private String model;

    @Value("${openai.temperature:0.3}")
    private double temperature;

    @Value("${openai.top-p:0.9}")
    private double topP;

    @Value("${openai.max-tokens:250}")
    private int maxTokens;

    @Override
    public String invoke(String shardText) {
        try {
            ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                    .model(model)
                    .temperature(temperature)
                    .topP(topP)
                    .maxCompletionTokens(maxTokens)
                    .addSystemMessage(AnonymizerPrompt.SYSTEM_PROMPT)
                    .addUserMessage(AnonymizerPrompt.userMessage(shardText))
                    .addTool(AnonymizerPrompt.replaceEntitiesTool())
                    .build();

            ChatCompletion completion = openAIClient.chat().completions().create(params);

            completion.usage().ifPresent(usage ->
                    log.debug("Token usage [{}] - prompt: {}, completion: {}",
                            model, usage.promptTokens(), usage.completionTokens()));

            return completion.choices().stream()
                    .findFirst()
                    .map(choice -> toRawResponse(choice.message()))
                    .orElse("");
        } catch (Exception e) {
            log.error("Replacement model call failed [{}] for shard of {} chars", model, shardText.length(), e);
            return "";
        }
    }

    private String toRawResponse(ChatCompletionMessage message) {
        List<ChatCompletionMessageToolCall> toolCalls = message.toolCalls().orElse(List.of());
        for (ChatCompletionMessageToolCall toolCall : toolCalls) {
            ChatCompletionMessageToolCall.Function function = toolCall.function();
            if (AnonymizerPrompt.TOOL_NAME.equals(function.name())) {
                return responseCleaner.fromToolCall(function.name(), function.arguments());
            }
        }
        return message.content().map(responseCleaner::fromContent).orElse("");
    }
}
