package com.glyphvault.core.glyph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.glyphvault.core.hash.ContentHasher;

import java.util.Map;
import java.util.Objects;

/**
 * Content-addressed, signed provenance record for a payload.
 *
 * @param id        {@code 0x}-prefixed keccak-256 of {@code dataHash:source}
 * @param dataHash  SHA-256 of the canonical payload
 * @param source    origin of the payload
 * @param timestamp creation time in epoch seconds
 * @param signer    signing address, or {@link GlyphFactory#SERVER_SIGNER}
 * @param signature personal-message signature or server attestation
 * @param data      payload, {@code null} when only metadata is retained; held as
 *                  a deep unmodifiable copy in {@link ContentHasher#normalize} form
 * @param verified  flag cached at creation time
 */
public record Glyph(
        @JsonProperty("glyph_id") String id,
        @JsonProperty("data_hash") String dataHash,
        @JsonProperty("source") String source,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("signer") String signer,
        @JsonProperty("signature") String signature,
        @JsonProperty("data") Map<String, Object> data,
        @JsonProperty("verified") boolean verified
) {
    public Glyph {
        Objects.requireNonNull(id, "Glyph id cannot be null");
        Objects.requireNonNull(dataHash, "Data hash cannot be null");
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(signer, "Signer cannot be null");
        Objects.requireNonNull(signature, "Signature cannot be null");
        data = data != null ? ContentHasher.normalize(data) : null;
    }

    /**
     * Copy of this glyph carrying only metadata.
     */
    public Glyph withoutData() {
        return new Glyph(id, dataHash, source, timestamp, signer, signature, null, verified);
    }

    @JsonIgnore
    public boolean hasData() {
        return data != null;
    }

    @JsonIgnore
    public boolean isServerAttested() {
        return GlyphFactory.SERVER_SIGNER.equals(signer);
    }
}
