package com.chunkanon.infrastructure.chunkfile;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Append-only JSONL output. One writer at a time; every line is flushed before the call returns,
 * so records already written survive a crash and no half record is left behind.
 */
@Slf4j
public class JsonlChunkWriter implements Closeable {

    private final Path path;
    private final BufferedWriter writer;
    private long linesWritten;

    public JsonlChunkWriter(Path path) throws IOException {
        this.path = path;
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
    }

    public synchronized void writeLine(String json) throws IOException {
        writer.write(json);
        writer.write('\n');
        writer.flush();
        linesWritten++;
    }

    public synchronized long linesWritten() {
        return linesWritten;
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
        log.debug("Closed {} after {} lines", path, linesWritten);
    }
}
