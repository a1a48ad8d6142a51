package com.glyphvault.core.ledger;

import com.glyphvault.core.glyph.Glyph;

/**
 * Ledger view of a glyph: every field except the payload.
 */
public record GlyphSummary(
        String id,
        String dataHash,
        String source,
        long timestamp,
        String signer,
        String signature,
        boolean verified
) {
    public static GlyphSummary of(Glyph glyph) {
        return new GlyphSummary(glyph.id(), glyph.dataHash(), glyph.source(), glyph.timestamp(),
                glyph.signer(), glyph.signature(), glyph.verified());
    }

    public Glyph toGlyph() {
        return new Glyph(id, dataHash, source, timestamp, signer, signature, null, verified);
    }
}
