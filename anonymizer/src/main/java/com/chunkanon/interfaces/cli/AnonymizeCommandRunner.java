package com.chunkanon.interfaces.cli;

import com.chunkanon.application.anonymize.ChunkFileAnonymizer;
import com.chunkanon.domain.anonymize.model.AnonymizationReport;
import com.chunkanon.infrastructure.chunkfile.ChunkFileLocator;
import com.chunkanon.infrastructure.chunkfile.OutputPathResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Command line entry:
 * <pre>
 *   anonymizer [path/to/X_1_source_chunks.jsonl] [--type=whats] [--shard-length=500] [--output=path]
 * </pre>
 * Values not given on the command line fall back to the {@code anonymizer.*} properties.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnonymizeCommandRunner implements ApplicationRunner {

    private final ChunkFileLocator chunkFileLocator;
    private final OutputPathResolver outputPathResolver;
    private final ChunkFileAnonymizer chunkFileAnonymizer;

    @Value("${anonymizer.input:}")
    private String configuredInput;

    @Value("${anonymizer.type:}")
    private String configuredType;

    @Value("${anonymizer.output:}")
    private String configuredOutput;

    @Value("${anonymizer.shard.max-chars:500}")
    private int configuredShardLength;

    @Override
    public void run(ApplicationArguments args) {
        AnonymizeRequest request = toRequest(args);
        if (request.shardLength() <= 0) {
            throw new IllegalArgumentException("--shard-length must be positive: " + request.shardLength());
        }

        Path input = chunkFileLocator.locate(request.inputPath(), request.typeFilter());
        Path output = request.outputPath() != null
                ? Path.of(request.outputPath())
                : outputPathResolver.resolve(input);

        AnonymizationReport report = chunkFileAnonymizer.anonymize(input, output, request.shardLength());
        log.info("Processed {} chunks with {} total replacements", report.recordsRead(), report.totalReplacements());
    }

    AnonymizeRequest toRequest(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        String input = !positional.isEmpty() ? positional.get(0) : blankToNull(configuredInput);

        String type = firstOption(args, "type", configuredType);
        String output = firstOption(args, "output", configuredOutput);
        String shardLength = firstOption(args, "shard-length", null);

        int shards;
        try {
            shards = shardLength != null ? Integer.parseInt(shardLength.trim()) : configuredShardLength;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--shard-length must be an integer: " + shardLength, e);
        }
        return new AnonymizeRequest(input, type, shards, output);
    }

    private static String firstOption(ApplicationArguments args, String name, String fallback) {
        List<String> values = args.getOptionValues(name);
        if (values != null && !values.isEmpty() && !values.get(0).isBlank()) {
            return values.get(0);
        }
        return blankToNull(fallback);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
