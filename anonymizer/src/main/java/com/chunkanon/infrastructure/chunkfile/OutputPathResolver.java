package com.chunkanon.infrastructure.chunkfile;

import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;

/**
 * Derives the stage-2 output file from a stage-1 chunks file:
 * {@code X_1_<source>_chunks.jsonl} or {@code X_1_<source>.jsonl} → {@code X_2_<source>_anon.jsonl},
 * in the same directory. Names that match neither pattern get source {@code unknown}.
 */
@Component
public class OutputPathResolver {

    static final String UNKNOWN_SOURCE = "unknown";

    public Path resolve(Path inputFile) {
        String fileName = inputFile.getFileName().toString();
        String outputName = "X_2_" + sourceOf(stem(fileName)) + "_anon.jsonl";

        Path parent = inputFile.getParent();
        return parent != null ? parent.resolve(outputName) : Path.of(outputName);
    }

    String sourceOf(String stem) {
        String[] parts = stem.split("_", -1);

        boolean stageOne = parts.length >= 3 && parts[0].equals("X") && parts[1].equals("1");
        if (stageOne && parts.length >= 4 && parts[parts.length - 1].equals("chunks")) {
            return String.join("_", Arrays.copyOfRange(parts, 2, parts.length - 1));
        }
        if (stageOne) {
            return String.join("_", Arrays.copyOfRange(parts, 2, parts.length));
        }
        return UNKNOWN_SOURCE;
    }

    // drops the last extension only: "a.b.jsonl" → "a.b"; a leading dot is not an extension
    private static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
