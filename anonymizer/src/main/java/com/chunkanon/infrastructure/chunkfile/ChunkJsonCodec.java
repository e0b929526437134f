package com.chunkanon.infrastructure.chunkfile;

import com.chunkanon.domain.anonymize.model.AnonymizedChunk;
import com.chunkanon.domain.anonymize.model.ConversationChunk;
import com.chunkanon.domain.anonymize.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes one JSONL line of a chunks file.
 * <p>
 * Decoding keeps the parsed line so that encoding can write every field back in its original
 * order; only message "content" values that changed are replaced, and "replacement_lookup"
 * is appended last.
 * </p>
 */
@Component
public class ChunkJsonCodec {

    public static final String REPLACEMENT_LOOKUP_FIELD = "replacement_lookup";

    private static final String ID_FIELD = "id";
    private static final String CONVERSATION_FIELD = "conversation";
    private static final String ROLE_FIELD = "role";
    private static final String CONTENT_FIELD = "content";

    private final ObjectMapper objectMapper;
    // a line holding more than one JSON value is malformed, not truncated to its first value
    private final ObjectReader lineReader;

    public ChunkJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.lineReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * @throws MalformedChunkException when the line is not a JSON object
     */
    public ConversationChunk decode(String line) {
        JsonNode node;
        try {
            node = lineReader.readTree(line);
        } catch (JsonProcessingException e) {
            throw new MalformedChunkException(e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedChunkException("Expected a JSON object but found "
                    + (node == null ? "nothing" : node.getNodeType()));
        }

        ObjectNode source = (ObjectNode) node;
        JsonNode idNode = source.get(ID_FIELD);
        String id = idNode == null || idNode.isNull() ? null : idNode.asText();

        return new ConversationChunk(id, readConversation(source.get(CONVERSATION_FIELD)), source);
    }

    public String encode(AnonymizedChunk anonymized) {
        ConversationChunk chunk = anonymized.chunk();
        ObjectNode out = chunk.source().deepCopy();

        JsonNode conversationNode = out.get(CONVERSATION_FIELD);
        if (conversationNode instanceof ArrayNode messages) {
            List<Message> conversation = chunk.conversation();
            for (int i = 0; i < messages.size() && i < conversation.size(); i++) {
                if (messages.get(i) instanceof ObjectNode messageNode) {
                    String content = conversation.get(i).content();
                    if (!content.equals(textOf(messageNode.get(CONTENT_FIELD)))) {
                        messageNode.put(CONTENT_FIELD, content);
                    }
                }
            }
        }

        ObjectNode lookup = objectMapper.createObjectNode();
        for (Map.Entry<String, String> entry : anonymized.replacementLookup().entrySet()) {
            lookup.put(entry.getKey(), entry.getValue());
        }
        out.set(REPLACEMENT_LOOKUP_FIELD, lookup);

        try {
            return objectMapper.writeValueAsString(out);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize chunk " + chunk.id(), e);
        }
    }

    private List<Message> readConversation(JsonNode conversationNode) {
        List<Message> messages = new ArrayList<>();
        if (conversationNode == null || !conversationNode.isArray()) {
            return messages;
        }
        for (JsonNode messageNode : conversationNode) {
            if (messageNode.isObject()) {
                JsonNode role = messageNode.get(ROLE_FIELD);
                messages.add(new Message(role == null || role.isNull() ? null : role.asText(),
                        textOf(messageNode.get(CONTENT_FIELD))));
            } else {
                // kept as a placeholder so indices stay aligned with the source array
                messages.add(new Message(null, ""));
            }
        }
        return messages;
    }

    private static String textOf(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return "";
        }
        return node.asText();
    }
}
