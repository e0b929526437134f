package com.chunkanon.domain.anonymize.model;

/**
 * Encodings the replacement model is known to answer in.
 */
public enum OutputFormat {

    /** {"name": "replace_entities", "arguments": {"replacements": [...]}} */
    FUNCTION_CALL,

    /** {"replacements": [...]} */
    REPLACEMENTS_OBJECT,

    /** replace_entities({"replacements": [...]}) embedded in free text */
    CALL_EXPRESSION,

    /** nothing recognisable */
    NONE
}
