package com.glyphvault.core.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One insert-only row of the audit log.
 *
 * @param sequence ledger-assigned, strictly increasing
 */
public record AuditEntry(
        @JsonProperty("sequence") long sequence,
        @JsonProperty("glyph_id") String glyphId,
        @JsonProperty("action") String action,
        @JsonProperty("actor") String actor,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("metadata") Map<String, Object> metadata
) {
    public static final String CREATED = "CREATED";
    public static final String REINGESTED = "REINGESTED";
    public static final String PUBLISHED = "PUBLISHED";
    public static final String ANCHORED = "ANCHORED";

    public AuditEntry {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }
}
