package com.chunkanon.infrastructure.chunkfile;

import com.chunkanon.application.anonymize.ChunkFileNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Finds the X_1 chunks file to anonymize: an explicit path when given, otherwise the
 * pipeline output directory is scanned for {@code X_1_*.jsonl}.
 */
@Slf4j
@Component
public class ChunkFileLocator {

    static final String CHUNK_FILE_GLOB = "X_1_*.jsonl";

    private final Path inputDirectory;

    public ChunkFileLocator(@Value("${anonymizer.input-dir:../pipeline_output}") String inputDirectory) {
        this.inputDirectory = Path.of(inputDirectory);
    }

    /**
     * @param explicitPath path given by the user (nullable)
     * @param typeFilter   case-insensitive substring of the file name used during auto-detection (nullable)
     * @throws ChunkFileNotFoundException when nothing can be resolved
     */
    public Path locate(String explicitPath, String typeFilter) {
        if (explicitPath != null && !explicitPath.isBlank()) {
            Path path = Path.of(explicitPath);
            if (!Files.isRegularFile(path)) {
                throw new ChunkFileNotFoundException("Chunks file not found: " + path);
            }
            return path;
        }

        Path detected = autoDetect(typeFilter);
        log.info("Auto-detected chunks file: {}", detected);
        return detected;
    }

    private Path autoDetect(String typeFilter) {
        List<Path> candidates = listChunkFiles();
        if (candidates.isEmpty()) {
            throw new ChunkFileNotFoundException("No X_1 chunks file found in " + inputDirectory);
        }

        if (typeFilter == null || typeFilter.isBlank()) {
            // most recent by naming convention
            return candidates.get(candidates.size() - 1);
        }

        String filter = typeFilter.toLowerCase(Locale.ROOT);
        List<Path> matching = candidates.stream()
                .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).contains(filter))
                .toList();

        if (matching.isEmpty()) {
            log.warn("No X_1 chunks files found matching type '{}'. Available: {}", typeFilter,
                    candidates.stream().map(Path::getFileName).toList());
            throw new ChunkFileNotFoundException("No X_1 chunks file matching type '" + typeFilter + "' in " + inputDirectory);
        }
        if (matching.size() > 1) {
            log.warn("Multiple files match type '{}', using first: {}", typeFilter, matching.get(0).getFileName());
        }
        return matching.get(0);
    }

    private List<Path> listChunkFiles() {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(inputDirectory)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(inputDirectory, CHUNK_FILE_GLOB)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        } catch (IOException e) {
            throw new ChunkFileNotFoundException("Cannot list " + inputDirectory + ": " + e.getMessage(), e);
        }
        files.sort(Comparator.naturalOrder());
        return files;
    }
}
