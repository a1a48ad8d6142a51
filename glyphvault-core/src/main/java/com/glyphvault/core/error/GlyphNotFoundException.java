package com.glyphvault.core.error;

/**
 * The glyph id was never recorded in this vault.
 */
public class GlyphNotFoundException extends GlyphVaultException {

    private final String glyphId;

    public GlyphNotFoundException(String glyphId) {
        super("Glyph not found: " + glyphId);
        this.glyphId = glyphId;
    }

    public String getGlyphId() {
        return glyphId;
    }
}
