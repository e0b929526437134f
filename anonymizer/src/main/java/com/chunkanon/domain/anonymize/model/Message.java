package com.chunkanon.domain.anonymize.model;

import java.util.regex.Pattern;

/**
 * One turn of a conversation chunk.
 *
 * @param role    speaker role, e.g. "user" or "assistant" (nullable when absent in the source line)
 * @param content message text, never null ("" when absent)
 */
public record Message(String role, String content) {

    // Unicode White_Space, so no-break spaces count as blank too
    private static final Pattern EDGE_WHITESPACE =
            Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

    public Message {
        content = content == null ? "" : content;
    }

    public boolean isBlank() {
        return strippedContent().isEmpty();
    }

    /**
     * Content without leading and trailing Unicode whitespace.
     */
    public String strippedContent() {
        return EDGE_WHITESPACE.matcher(content).replaceAll("");
    }

    public Message withContent(String newContent) {
        return new Message(role, newContent);
    }
}
