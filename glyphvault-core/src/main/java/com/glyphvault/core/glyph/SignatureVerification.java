package com.glyphvault.core.glyph;

/**
 * Outcome of checking a glyph signature.
 */
public record SignatureVerification(boolean valid, SignatureAssurance assurance) {

    static SignatureVerification invalid() {
        return new SignatureVerification(false, SignatureAssurance.INVALID);
    }

    static SignatureVerification of(boolean valid, SignatureAssurance assurance) {
        return valid ? new SignatureVerification(true, assurance) : invalid();
    }
}
