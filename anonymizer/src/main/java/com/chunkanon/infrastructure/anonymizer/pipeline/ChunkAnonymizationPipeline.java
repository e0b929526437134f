package com.chunkanon.infrastructure.anonymizer.pipeline;

import com.chunkanon.domain.anonymize.model.AnonymizedChunk;
import com.chunkanon.domain.anonymize.model.ConversationChunk;
import com.chunkanon.domain.anonymize.model.ReplacementParseResult;
import com.chunkanon.domain.anonymize.service.EntityReplacementModel;
import com.chunkanon.infrastructure.anonymizer.consolidation.ReplacementConsolidator;
import com.chunkanon.infrastructure.anonymizer.parsing.ReplacementOutputParser;
import com.chunkanon.infrastructure.anonymizer.replacement.ReplacementApplier;
import com.chunkanon.infrastructure.anonymizer.sharding.VirtualSharder;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Anonymizes one conversation chunk:
 * <p>
 * shard → model call per shard → parse → consolidate (first wins, by shard index) → apply to the full chunk
 * </p>
 * Shards of one chunk may run concurrently; results are always joined and ordered by shard index
 * before consolidation, so the outcome does not depend on completion order.
 */
@Slf4j
@Component
public class ChunkAnonymizationPipeline {

    private final VirtualSharder sharder;
    private final EntityReplacementModel replacementModel;
    private final ReplacementOutputParser outputParser;
    private final ReplacementConsolidator consolidator;
    private final ReplacementApplier applier;
    private final int defaultMaxChars;
    private final ExecutorService shardExecutor;

    public ChunkAnonymizationPipeline(VirtualSharder sharder,
                                      EntityReplacementModel replacementModel,
                                      ReplacementOutputParser outputParser,
                                      ReplacementConsolidator consolidator,
                                      ReplacementApplier applier,
                                      @Value("${anonymizer.shard.max-chars:500}") int defaultMaxChars,
                                      @Value("${anonymizer.shard-concurrency:1}") int shardConcurrency) {
        this.sharder = sharder;
        this.replacementModel = replacementModel;
        this.outputParser = outputParser;
        this.consolidator = consolidator;
        this.applier = applier;
        this.defaultMaxChars = defaultMaxChars;
        this.shardExecutor = shardConcurrency > 1 ? Executors.newFixedThreadPool(shardConcurrency) : null;
    }

    /**
     * Result of one shard's model call.
     */
    public record ShardOutcome(int index, String shardText, ReplacementParseResult parseResult) {}

    public AnonymizedChunk anonymize(ConversationChunk chunk) {
        return anonymize(chunk, defaultMaxChars);
    }

    public AnonymizedChunk anonymize(ConversationChunk chunk, int maxChars) {
        List<String> shards = sharder.shard(chunk.conversation(), maxChars);

        if (shards.isEmpty()) {
            log.debug("[Pipeline] Chunk {} has no content, skipping model", chunk.id());
            return AnonymizedChunk.unchanged(chunk);
        }

        List<ShardOutcome> outcomes = processShards(shards);

        List<Map<String, String>> shardMaps = outcomes.stream()
                .map(outcome -> outcome.parseResult().replacements())
                .toList();
        Map<String, String> lookup = consolidator.consolidate(shardMaps);

        int failed = (int) outcomes.stream().filter(outcome -> !outcome.parseResult().matched()).count();
        if (failed > 0) {
            log.warn("[Pipeline] Chunk {}: {}/{} shards produced no usable replacement output",
                    chunk.id(), failed, shards.size());
        }

        ConversationChunk rewritten = applier.apply(chunk, lookup);

        log.info("[Pipeline] Chunk {}: shards={}, replacements={}", chunk.id(), shards.size(), lookup.size());
        return new AnonymizedChunk(rewritten, lookup, shards.size(), failed);
    }

    private List<ShardOutcome> processShards(List<String> shards) {
        if (shardExecutor == null || shards.size() == 1) {
            List<ShardOutcome> outcomes = new ArrayList<>(shards.size());
            for (int i = 0; i < shards.size(); i++) {
                outcomes.add(processShard(i, shards.get(i)));
            }
            return outcomes;
        }

        List<CompletableFuture<ShardOutcome>> futures = new ArrayList<>(shards.size());
        for (int i = 0; i < shards.size(); i++) {
            int index = i;
            futures.add(CompletableFuture.supplyAsync(() -> processShard(index, shards.get(index)), shardExecutor));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        // futures are in shard order regardless of which finished first
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private ShardOutcome processShard(int index, String shardText) {
        if (shardText.isBlank()) {
            return new ShardOutcome(index, shardText, ReplacementParseResult.none());
        }

        String raw;
        try {
            raw = replacementModel.invoke(shardText);
        } catch (RuntimeException e) {
            log.warn("[Pipeline] Model invocation failed for shard {}: {}", index, e.getMessage());
            raw = "";
        }

        return new ShardOutcome(index, shardText, outputParser.parse(raw));
    }

    @PreDestroy
    void shutdown() {
        if (shardExecutor != null) {
            shardExecutor.shutdown();
        }
    }
}
