package com.chunkanon.domain.anonymize.model;

import java.nio.file.Path;

public record AnonymizationReport(
        Path inputFile,
        Path outputFile,
        long recordsRead,
        long malformedLines,
        long recordsWritten,
        long emptyRecords,
        long shardsProcessed,
        long failedShards,
        long totalReplacements
) {}
