package com.chunkanon.interfaces.cli;

/**
 * One anonymization run as requested on the command line.
 *
 * @param inputPath   explicit chunks file (nullable → auto-detect)
 * @param typeFilter  file-name filter for auto-detection (nullable)
 * @param shardLength maximum characters per virtual shard
 * @param outputPath  explicit output file (nullable → derived from the input name)
 */
public record AnonymizeRequest(String inputPath, String typeFilter, int shardLength, String outputPath) {}
