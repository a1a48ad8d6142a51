package com.glyphvault.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.glyphvault.core.glyph.SignatureAssurance;
import com.glyphvault.core.ledger.AuditEntry;

import java.util.List;

/**
 * Self-contained provenance statement for one glyph: its metadata, the
 * outcome of re-checking its signature and its full audit trail.
 */
public record GlyphProof(
        @JsonProperty("glyph_id") String glyphId,
        @JsonProperty("data_hash") String dataHash,
        @JsonProperty("source") String source,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("signer") String signer,
        @JsonProperty("signature") String signature,
        @JsonProperty("signature_valid") boolean signatureValid,
        @JsonProperty("signature_assurance") SignatureAssurance signatureAssurance,
        @JsonProperty("verified") boolean verified,
        @JsonProperty("audit_trail") List<AuditEntry> auditTrail,
        @JsonProperty("proof_generated_at") long proofGeneratedAt
) {
    public GlyphProof {
        auditTrail = List.copyOf(auditTrail);
    }
}
