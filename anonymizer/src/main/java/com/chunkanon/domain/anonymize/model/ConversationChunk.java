package com.chunkanon.domain.anonymize.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * One conversation record read from an X_1 chunks file.
 * <p>
 * {@code source} is the record exactly as it was read. Fields the pipeline does not produce
 * are written back from it untouched, in their original order.
 * </p>
 *
 * @param id           the record id, or null when the line carries none
 * @param conversation ordered messages; index i corresponds to element i of the source "conversation" array
 * @param source       the parsed input line
 */
public record ConversationChunk(String id, List<Message> conversation, ObjectNode source) {

    public ConversationChunk {
        conversation = List.copyOf(conversation);
    }

    public ConversationChunk withConversation(List<Message> newConversation) {
        return new ConversationChunk(id, newConversation, source);
    }

    /**
     * Id used in log lines; falls back to the record position when the line has no id.
     */
    public String displayId(long index) {
        return id != null ? id : "chunk_" + index;
    }
}
