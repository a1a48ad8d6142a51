package com.glyphvault.core.ledger;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate counts over the ledger.
 *
 * @param sources         glyph count per source, sorted by source
 * @param latestTimestamp newest glyph timestamp, 0 when empty
 */
public record VaultStats(
        long totalGlyphs,
        long verifiedCount,
        Map<String, Long> sources,
        long latestTimestamp
) {
    public VaultStats {
        sources = Collections.unmodifiableMap(new TreeMap<>(sources));
    }
}
