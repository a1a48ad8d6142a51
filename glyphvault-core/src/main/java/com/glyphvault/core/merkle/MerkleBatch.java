package com.glyphvault.core.merkle;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A batch of glyph ids with its Merkle root and per-id inclusion proofs.
 */
public record MerkleBatch(String root, List<String> ids, Map<String, List<String>> proofs) {

    public MerkleBatch {
        ids = List.copyOf(ids);
        proofs = Collections.unmodifiableMap(new LinkedHashMap<>(proofs));
    }

    public Optional<List<String>> proofFor(String id) {
        return Optional.ofNullable(proofs.get(id));
    }

    public int size() {
        return ids.size();
    }
}
