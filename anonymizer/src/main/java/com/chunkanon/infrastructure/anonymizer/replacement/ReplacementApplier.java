package com.chunkanon.infrastructure.anonymizer.replacement;

import com.chunkanon.domain.anonymize.model.ConversationChunk;
import com.chunkanon.domain.anonymize.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites message content with a consolidated replacement map.
 * <p>
 * Keys are applied longest first (stable, so equal lengths keep map order) so that
 * "John Johnson" is replaced as a unit before "John" gets a chance to split it.
 * A single-letter key only matches as a standalone word, so replacing "a" leaves "cat" intact.
 * </p>
 * <p>
 * Each key is one left-to-right pass over the content as rewritten by the keys before it.
 * A replacement value that contains a later, shorter key is therefore rewritten again.
 * </p>
 */
@Slf4j
@Component
public class ReplacementApplier {

    /**
     * Apply the map to every message of the chunk. Roles, message order and all fields
     * other than message content are left untouched.
     */
    public ConversationChunk apply(ConversationChunk chunk, Map<String, String> replacements) {
        if (replacements == null || replacements.isEmpty()) {
            return chunk;
        }

        List<Map.Entry<String, String>> ordered = orderByLength(replacements);

        List<Message> rewritten = new ArrayList<>(chunk.conversation().size());
        for (Message message : chunk.conversation()) {
            rewritten.add(message.withContent(applyOrdered(message.content(), ordered)));
        }
        return chunk.withConversation(rewritten);
    }

    public String apply(String content, Map<String, String> replacements) {
        if (replacements == null || replacements.isEmpty()) {
            return content;
        }
        return applyOrdered(content, orderByLength(replacements));
    }

    private String applyOrdered(String content, List<Map.Entry<String, String>> ordered) {
        String result = content;
        for (Map.Entry<String, String> entry : ordered) {
            String original = entry.getKey();
            String replacement = entry.getValue();
            if (original == null || original.isEmpty() || replacement == null || replacement.isEmpty()) {
                continue;
            }

            if (isSingleLetter(original)) {
                result = replaceWholeWord(result, original, replacement);
            } else {
                result = result.replace(original, replacement);
            }
        }
        return result;
    }

    private List<Map.Entry<String, String>> orderByLength(Map<String, String> replacements) {
        List<Map.Entry<String, String>> ordered = new ArrayList<>(replacements.entrySet());
        // List.sort is stable
        ordered.sort(Comparator.comparingInt((Map.Entry<String, String> e) -> codePoints(e.getKey())).reversed());
        return ordered;
    }

    private static String replaceWholeWord(String content, String word, String replacement) {
        Pattern pattern = Pattern.compile("\\b" + Pattern.quote(word) + "\\b", Pattern.UNICODE_CHARACTER_CLASS);
        return pattern.matcher(content).replaceAll(Matcher.quoteReplacement(replacement));
    }

    private static boolean isSingleLetter(String key) {
        return codePoints(key) == 1 && Character.isLetter(key.codePointAt(0));
    }

    private static int codePoints(String text) {
        return text == null ? 0 : text.codePointCount(0, text.length());
    }
}
