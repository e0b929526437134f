package com.chunkanon.application.anonymize;

import com.chunkanon.domain.anonymize.model.AnonymizationReport;
import com.chunkanon.domain.anonymize.model.AnonymizedChunk;
import com.chunkanon.domain.anonymize.model.ConversationChunk;
import com.chunkanon.infrastructure.anonymizer.pipeline.ChunkAnonymizationPipeline;
import com.chunkanon.infrastructure.chunkfile.ChunkJsonCodec;
import com.chunkanon.infrastructure.chunkfile.JsonlChunkWriter;
import com.chunkanon.infrastructure.chunkfile.MalformedChunkException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Streams an X_1 chunks file through the anonymization pipeline into an X_2 file.
 * <p>
 * Every valid input line yields exactly one output line, written and flushed as soon as its
 * record is done. Malformed lines are skipped with a warning. With
 * {@code anonymizer.record-concurrency > 1} records run in parallel and the output order
 * follows completion order.
 * </p>
 */
@Slf4j
@Service
public class ChunkFileAnonymizer {

    private static final int LINE_PREVIEW_LENGTH = 100;

    private final ChunkAnonymizationPipeline pipeline;
    private final ChunkJsonCodec codec;
    private final int recordConcurrency;

    public ChunkFileAnonymizer(ChunkAnonymizationPipeline pipeline,
                               ChunkJsonCodec codec,
                               @Value("${anonymizer.record-concurrency:1}") int recordConcurrency) {
        this.pipeline = pipeline;
        this.codec = codec;
        this.recordConcurrency = Math.max(1, recordConcurrency);
    }

    public AnonymizationReport anonymize(Path inputFile, Path outputFile, int maxChars) {
        log.info("Input: {}", inputFile);
        log.info("Output: {}", outputFile);
        log.info("Using shard length: {} characters, record concurrency: {}", maxChars, recordConcurrency);

        RunStats stats = new RunStats();

        try (BufferedReader reader = new BufferedReader(
                     new InputStreamReader(Files.newInputStream(inputFile), StandardCharsets.UTF_8));
             JsonlChunkWriter writer = new JsonlChunkWriter(outputFile)) {

            if (recordConcurrency == 1) {
                processSequentially(reader, writer, maxChars, stats);
            } else {
                processConcurrently(reader, writer, maxChars, stats);
            }
        } catch (IOException e) {
            throw new AnonymizationException("Anonymization of " + inputFile + " failed: " + e.getMessage(), e);
        }

        AnonymizationReport report = stats.toReport(inputFile, outputFile);
        log.info("Anonymization complete: {} records written to {} ({} malformed lines skipped, {} total replacements)",
                report.recordsWritten(), outputFile, report.malformedLines(), report.totalReplacements());
        if (report.failedShards() > 0) {
            log.warn("{} of {} shards returned no usable replacement output", report.failedShards(), report.shardsProcessed());
        }
        return report;
    }

    private void processSequentially(BufferedReader reader, JsonlChunkWriter writer,
                                     int maxChars, RunStats stats) throws IOException {
        String line;
        long lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            ConversationChunk chunk = decode(line, lineNumber, stats);
            if (chunk != null) {
                processAndWrite(chunk, stats.recordsRead.getAndIncrement(), maxChars, writer, stats);
            }
        }
    }

    private void processConcurrently(BufferedReader reader, JsonlChunkWriter writer,
                                     int maxChars, RunStats stats) throws IOException {
        ExecutorService pool = Executors.newFixedThreadPool(recordConcurrency);
        Semaphore inFlight = new Semaphore(recordConcurrency);
        List<CompletableFuture<Void>> pending = new ArrayList<>();

        try {
            String line;
            long lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                ConversationChunk chunk = decode(line, lineNumber, stats);
                if (chunk == null) continue;

                long index = stats.recordsRead.getAndIncrement();
                inFlight.acquireUninterruptibly();
                pending.add(CompletableFuture.runAsync(() -> {
                    try {
                        processAndWrite(chunk, index, maxChars, writer, stats);
                    } finally {
                        inFlight.release();
                    }
                }, pool));

                pending.removeIf(future -> future.isDone() && !future.isCompletedExceptionally());
                if (pending.stream().anyMatch(CompletableFuture::isCompletedExceptionally)) {
                    log.warn("A record failed, no further records are submitted");
                    break;
                }
            }
        } finally {
            // records still running must finish before the caller closes the writer
            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                    .handle((ignored, failure) -> null)
                    .join();
            pool.shutdown();
        }

        rethrowFirstFailure(pending);
    }

    private static void rethrowFirstFailure(List<CompletableFuture<Void>> futures) {
        for (CompletableFuture<Void> future : futures) {
            try {
                future.join();
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException cause) {
                    throw cause;
                }
                throw e;
            }
        }
    }

    private ConversationChunk decode(String line, long lineNumber, RunStats stats) {
        if (line.isBlank()) {
            return null;
        }
        try {
            return codec.decode(line.strip());
        } catch (MalformedChunkException e) {
            stats.malformedLines.incrementAndGet();
            log.warn("Failed to parse line {}: {} (content: {})", lineNumber, e.getMessage(), preview(line));
            return null;
        }
    }

    private void processAndWrite(ConversationChunk chunk, long index, int maxChars,
                                 JsonlChunkWriter writer, RunStats stats) {
        log.debug("Processing chunk {}", chunk.displayId(index));

        AnonymizedChunk result = pipeline.anonymize(chunk, maxChars);
        try {
            writer.writeLine(codec.encode(result));
        } catch (IOException e) {
            throw new AnonymizationException("Failed to write chunk " + chunk.displayId(index), e);
        }

        stats.recordsWritten.incrementAndGet();
        if (result.shardCount() == 0) {
            stats.emptyRecords.incrementAndGet();
        }
        stats.shardsProcessed.addAndGet(result.shardCount());
        stats.failedShards.addAndGet(result.failedShardCount());
        stats.totalReplacements.addAndGet(result.replacementLookup().size());
    }

    private static String preview(String line) {
        return line.length() <= LINE_PREVIEW_LENGTH ? line : line.substring(0, LINE_PREVIEW_LENGTH) + "...";
    }

    private static final class RunStats {
        final AtomicLong recordsRead = new AtomicLong();
        final AtomicLong malformedLines = new AtomicLong();
        final AtomicLong recordsWritten = new AtomicLong();
        final AtomicLong emptyRecords = new AtomicLong();
        final AtomicLong shardsProcessed = new AtomicLong();
        final AtomicLong failedShards = new AtomicLong();
        final AtomicLong totalReplacements = new AtomicLong();

        AnonymizationReport toReport(Path inputFile, Path outputFile) {
            return new AnonymizationReport(inputFile, outputFile,
                    recordsRead.get(), malformedLines.get(), recordsWritten.get(), emptyRecords.get(),
                    shardsProcessed.get(), failedShards.get(), totalReplacements.get());
        }
    }
}
