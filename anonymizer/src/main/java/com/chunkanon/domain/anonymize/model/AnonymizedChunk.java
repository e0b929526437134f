package com.chunkanon.domain.anonymize.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A chunk after replacement, plus the lookup that produced it.
 *
 * @param chunk             the rewritten chunk
 * @param replacementLookup consolidated original→replacement map, in first-seen order (possibly empty)
 * @param shardCount        number of virtual shards sent to the model
 * @param failedShardCount  shards whose response yielded no recognisable replacement output
 */
public record AnonymizedChunk(ConversationChunk chunk,
                              Map<String, String> replacementLookup,
                              int shardCount,
                              int failedShardCount) {

    public AnonymizedChunk {
        replacementLookup = Collections.unmodifiableMap(new LinkedHashMap<>(replacementLookup));
    }

    public static AnonymizedChunk unchanged(ConversationChunk chunk) {
        return new AnonymizedChunk(chunk, Map.of(), 0, 0);
    }
}
