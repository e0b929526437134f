package com.chunkanon.infrastructure.anonymizer.consolidation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unions per-shard replacement maps with first-wins conflict resolution.
 * <p>
 * Maps must be given in shard order. Earlier shards see a mention with more surrounding
 * context, so the first value proposed for a key is kept and later proposals are dropped.
 * </p>
 */
@Slf4j
@Component
public class ReplacementConsolidator {

    public Map<String, String> consolidate(List<Map<String, String>> shardMaps) {
        Map<String, String> consolidated = new LinkedHashMap<>();
        int conflicts = 0;

        for (Map<String, String> shardMap : shardMaps) {
            if (shardMap == null) continue;

            for (Map.Entry<String, String> entry : shardMap.entrySet()) {
                String existing = consolidated.putIfAbsent(entry.getKey(), entry.getValue());
                if (existing != null && !existing.equals(entry.getValue())) {
                    conflicts++;
                    log.debug("[Consolidator] Keeping '{}' → '{}', ignoring later '{}'",
                            entry.getKey(), existing, entry.getValue());
                }
            }
        }

        if (conflicts > 0) {
            log.info("[Consolidator] {} maps → {} keys, {} conflicting proposals dropped",
                    shardMaps.size(), consolidated.size(), conflicts);
        }
        return consolidated;
    }
}
