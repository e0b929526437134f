package com.chunkanon.domain.anonymize.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of parsing one raw model response.
 *
 * @param replacements original→replacement pairs, in response order
 * @param format       the encoding that matched, {@link OutputFormat#NONE} when none did
 */
public record ReplacementParseResult(Map<String, String> replacements, OutputFormat format) {

    public ReplacementParseResult {
        replacements = Collections.unmodifiableMap(new LinkedHashMap<>(replacements));
    }

    public static ReplacementParseResult none() {
        return new ReplacementParseResult(Map.of(), OutputFormat.NONE);
    }

    public boolean matched() {
        return format != OutputFormat.NONE;
    }
}
