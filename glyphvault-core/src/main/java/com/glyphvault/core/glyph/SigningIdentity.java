package com.glyphvault.core.glyph;

import com.glyphvault.core.error.ConfigurationException;
import org.web3j.crypto.Credentials;
import org.web3j.utils.Numeric;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Who attests to a glyph: a local secp256k1 key or the vault server.
 * The two variants carry different assurance and are never conflated.
 */
public interface SigningIdentity {

    Pattern PRIVATE_KEY_HEX = Pattern.compile("[0-9a-fA-F]{64}");

    SignatureAssurance assurance();

    /**
     * Value recorded as a glyph's signer and as the actor of audit entries.
     */
    String signer();

    /**
     * Loads a local key from a hex private key. There is no fallback key.
     *
     * @throws ConfigurationException when the key is blank or malformed
     */
    static SigningIdentity localKey(String privateKeyHex) {
        if (privateKeyHex == null || privateKeyHex.isBlank()) {
            throw new ConfigurationException("Signing key must be supplied");
        }
        String hex = Numeric.cleanHexPrefix(privateKeyHex.trim());
        if (!PRIVATE_KEY_HEX.matcher(hex).matches() || hex.chars().allMatch(c -> c == '0')) {
            throw new ConfigurationException("Signing key is not a 32-byte hex private key");
        }
        try {
            return new LocalKey(Credentials.create(hex));
        } catch (RuntimeException e) {
            throw new ConfigurationException("Signing key is not a valid secp256k1 private key", e);
        }
    }

    static SigningIdentity serverAttestation() {
        return ServerAttestation.INSTANCE;
    }

    /**
     * Signs with a locally held key; signer is the key's address.
     */
    record LocalKey(Credentials credentials) implements SigningIdentity {
        public LocalKey {
            Objects.requireNonNull(credentials, "Credentials cannot be null");
        }

        public String address() {
            return credentials.getAddress();
        }

        @Override
        public String signer() {
            return address();
        }

        @Override
        public SignatureAssurance assurance() {
            return SignatureAssurance.CRYPTOGRAPHIC;
        }

        @Override
        public String toString() {
            return "LocalKey[" + address() + "]";
        }
    }

    /**
     * Deterministic server attestation, the lower assurance tier.
     */
    record ServerAttestation() implements SigningIdentity {
        static final ServerAttestation INSTANCE = new ServerAttestation();

        @Override
        public String signer() {
            return GlyphFactory.SERVER_SIGNER;
        }

        @Override
        public SignatureAssurance assurance() {
            return SignatureAssurance.SERVER_ATTESTATION;
        }
    }
}
