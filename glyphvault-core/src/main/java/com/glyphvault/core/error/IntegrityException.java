package com.glyphvault.core.error;

/**
 * Stored state exists but cannot be trusted: decryption failed, the blob is
 * malformed, or a recomputed hash does not match. Signals tampering,
 * corruption or a wrong passphrase.
 */
public class IntegrityException extends GlyphVaultException {

    private final String glyphId;

    public IntegrityException(String glyphId, String message) {
        super(message);
        this.glyphId = glyphId;
    }

    public IntegrityException(String glyphId, String message, Throwable cause) {
        super(message, cause);
        this.glyphId = glyphId;
    }

    public String getGlyphId() {
        return glyphId;
    }
}
