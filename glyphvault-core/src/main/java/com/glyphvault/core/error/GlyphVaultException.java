package com.glyphvault.core.error;

/**
 * Base type for every failure raised by the glyph vault.
 * Expected negative outcomes (an invalid signature, a proof that does not
 * verify) are reported as results, never as exceptions.
 */
public class GlyphVaultException extends RuntimeException {

    public GlyphVaultException(String message) {
        super(message);
    }

    public GlyphVaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
