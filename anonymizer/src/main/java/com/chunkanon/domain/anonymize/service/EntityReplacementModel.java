package com.chunkanon.domain.anonymize.service;

/**
 * The entity-replacement model, seen as an opaque text function.
 * <p>
 * Implementations must not throw: a failed or timed-out invocation returns an empty string,
 * which the pipeline treats as "no replacements from this shard". Retries, if any, belong here.
 * </p>
 */
public interface EntityReplacementModel {

    /**
     * @param shardText one virtual shard of a conversation chunk
     * @return the raw model response (a replace_entities call in one of its encodings), or "" on failure
     */
    String invoke(String shardText);
}
