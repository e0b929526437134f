package com.chunkanon.infrastructure.anonymizer.sharding;

import com.chunkanon.domain.anonymize.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 대화 청크를 글자 수 예산 안의 가상 샤드로 분할. LLM 호출 없음.
 *
 * 규칙:
 *   1. 빈/공백 메시지 제거, 나머지는 strip 후 사용
 *   2. 메시지 단위 누적: 같은 샤드 안의 메시지는 " | " 로 연결 (메시지당 3자 비용)
 *   3. 예산 초과 메시지: 누적분을 먼저 내보낸 뒤 공백 단위 단어로 쪼개 " " 로 재결합,
 *      단어는 절대 자르지 않음 (예산보다 긴 단어 하나는 그대로 단독 샤드)
 *   4. 누적분 + 다음 메시지가 예산 초과 → 누적분 내보내고 새 샤드 시작
 *
 * 길이는 코드 포인트 기준.
 */
@Slf4j
@Component
public class VirtualSharder {

    public static final String MESSAGE_SEPARATOR = " | ";

    private static final int SEPARATOR_COST = MESSAGE_SEPARATOR.length();
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Split a conversation into ordered shards.
     *
     * @param conversation messages in conversation order
     * @param maxChars     character budget per shard, must be positive
     * @return non-empty shard strings, empty when no message has content
     */
    public List<String> shard(List<Message> conversation, int maxChars) {
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be positive: " + maxChars);
        }

        List<String> shards = new ArrayList<>();
        if (conversation == null || conversation.isEmpty()) {
            return shards;
        }

        List<String> pending = new ArrayList<>();
        int pendingChars = 0;

        for (Message message : conversation) {
            if (message == null || message.isBlank()) {
                continue;
            }

            String content = message.strippedContent();
            int contentChars = length(content);

            if (contentChars > maxChars) {
                flush(pending, shards);
                pendingChars = 0;
                splitByWords(content, maxChars, shards);
            } else if (pendingChars > 0 && pendingChars + contentChars + SEPARATOR_COST > maxChars) {
                flush(pending, shards);
                pending.add(content);
                pendingChars = contentChars;
            } else {
                pendingChars += contentChars + (pending.isEmpty() ? 0 : SEPARATOR_COST);
                pending.add(content);
            }
        }

        flush(pending, shards);

        log.debug("[Sharder] {} messages → {} shards (maxChars={})", conversation.size(), shards.size(), maxChars);
        return shards;
    }

    // Greedy word packing for one over-long message.
    private void splitByWords(String content, int maxChars, List<String> shards) {
        List<String> words = new ArrayList<>();
        int chars = 0;

        for (String word : WHITESPACE.split(content)) {
            if (word.isEmpty()) continue;

            int cost = length(word) + (words.isEmpty() ? 0 : 1);
            if (chars + cost > maxChars && !words.isEmpty()) {
                shards.add(String.join(" ", words));
                words.clear();
                words.add(word);
                chars = length(word);
            } else {
                words.add(word);
                chars += cost;
            }
        }

        if (!words.isEmpty()) {
            shards.add(String.join(" ", words));
        }
    }

    private void flush(List<String> pending, List<String> shards) {
        if (pending.isEmpty()) {
            return;
        }
        String shard = String.join(MESSAGE_SEPARATOR, pending);
        if (!shard.isBlank()) {
            shards.add(shard);
        }
        pending.clear();
    }

    static int length(String text) {
        return text.codePointCount(0, text.length());
    }
}
