package com.glyphvault.core.glyph;

/**
 * Trust tier of a glyph signature.
 */
public enum SignatureAssurance {
    /** Recoverable secp256k1 personal-message signature. */
    CRYPTOGRAPHIC,
    /** Hash commitment by the vault server; reproducible by anyone, not unforgeable. */
    SERVER_ATTESTATION,
    /** Signature did not verify. */
    INVALID
}
