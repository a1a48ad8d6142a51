package com.glyphvault.core.glyph;

import com.glyphvault.core.hash.ContentHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Creates and verifies glyphs.
 *
 * Local keys sign the UTF-8 text of the data hash as an EIP-191 personal
 * message; the signer address is recoverable from the signature. Without a
 * local key the glyph carries a server attestation,
 * {@code sha256("server:" + dataHash)}, which anyone can recompute and is
 * reported as {@link SignatureAssurance#SERVER_ATTESTATION}.
 */
public class GlyphFactory {

    private static final Logger log = LoggerFactory.getLogger(GlyphFactory.class);

    public static final String SERVER_SIGNER = "glyphvault-server";

    private static final String SERVER_ATTESTATION_PREFIX = "server:";
    private static final int SIGNATURE_LENGTH = 65;
    private static final Pattern GLYPH_ID = Pattern.compile("0x[0-9a-f]{64}");

    private final SigningIdentity defaultIdentity;
    private final Clock clock;

    public GlyphFactory(SigningIdentity defaultIdentity) {
        this(defaultIdentity, Clock.systemUTC());
    }

    public GlyphFactory(SigningIdentity defaultIdentity, Clock clock) {
        this.defaultIdentity = Objects.requireNonNull(defaultIdentity, "Signing identity must be chosen explicitly");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public SigningIdentity defaultIdentity() {
        return defaultIdentity;
    }

    public Glyph create(Map<String, Object> data, String source) {
        return create(data, source, defaultIdentity);
    }

    /**
     * Hashes, addresses and signs a payload.
     */
    public Glyph create(Map<String, Object> data, String source, SigningIdentity identity) {
        Objects.requireNonNull(data, "Data cannot be null");
        Objects.requireNonNull(identity, "Signing identity cannot be null");
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Source cannot be null or blank");
        }

        String dataHash = ContentHasher.hash(data);
        String id = deriveId(dataHash, source);

        String signer = identity.signer();
        String signature = identity instanceof SigningIdentity.LocalKey localKey
                ? signPersonalMessage(dataHash, localKey)
                : serverAttestation(dataHash);

        log.debug("Created glyph {} from source {} signed by {}", id, source, signer);
        return new Glyph(id, dataHash, source, clock.instant().getEpochSecond(), signer, signature, data, true);
    }

    /**
     * Glyph address for a data hash and source: keccak-256 of
     * {@code dataHash + ":" + source}, {@code 0x}-prefixed lowercase hex.
     */
    public static String deriveId(String dataHash, String source) {
        Objects.requireNonNull(dataHash, "Data hash cannot be null");
        Objects.requireNonNull(source, "Source cannot be null");
        byte[] digest = Hash.sha3((dataHash + ":" + source).getBytes(StandardCharsets.UTF_8));
        return Numeric.toHexString(digest);
    }

    public static boolean isGlyphId(String candidate) {
        return candidate != null && GLYPH_ID.matcher(candidate).matches();
    }

    public boolean verify(Glyph glyph) {
        return verifySignature(glyph).valid();
    }

    /**
     * Checks the glyph's signature against its data hash. Never throws.
     */
    public SignatureVerification verifySignature(Glyph glyph) {
        if (glyph == null) {
            return SignatureVerification.invalid();
        }
        try {
            if (glyph.isServerAttested()) {
                boolean valid = serverAttestation(glyph.dataHash()).equals(glyph.signature());
                return SignatureVerification.of(valid, SignatureAssurance.SERVER_ATTESTATION);
            }
            String recovered = recoverSigner(glyph.dataHash(), glyph.signature());
            boolean valid = recovered != null && recovered.equalsIgnoreCase(glyph.signer());
            return SignatureVerification.of(valid, SignatureAssurance.CRYPTOGRAPHIC);
        } catch (RuntimeException e) {
            log.debug("Signature check failed for glyph {}: {}", glyph.id(), e.getMessage());
            return SignatureVerification.invalid();
        }
    }

    static String serverAttestation(String dataHash) {
        return ContentHasher.sha256Hex((SERVER_ATTESTATION_PREFIX + dataHash).getBytes(StandardCharsets.UTF_8));
    }

    private static String signPersonalMessage(String dataHash, SigningIdentity.LocalKey key) {
        Sign.SignatureData signed = Sign.signPrefixedMessage(
                dataHash.getBytes(StandardCharsets.UTF_8), key.credentials().getEcKeyPair());
        byte[] encoded = new byte[SIGNATURE_LENGTH];
        System.arraycopy(signed.getR(), 0, encoded, 0, 32);
        System.arraycopy(signed.getS(), 0, encoded, 32, 32);
        encoded[64] = signed.getV()[0];
        return Numeric.toHexString(encoded);
    }

    /**
     * Recovers the {@code 0x} address that produced {@code signatureHex}
     * over {@code dataHash}, or {@code null} when the signature is malformed.
     */
    private static String recoverSigner(String dataHash, String signatureHex) {
        byte[] raw;
        try {
            raw = Numeric.hexStringToByteArray(signatureHex);
        } catch (RuntimeException e) {
            return null;
        }
        if (raw.length != SIGNATURE_LENGTH) {
            return null;
        }
        byte v = raw[64];
        if (v < 27) {
            v += 27;
        }
        if (v != 27 && v != 28) {
            return null;
        }
        Sign.SignatureData signatureData = new Sign.SignatureData(
                v, Arrays.copyOfRange(raw, 0, 32), Arrays.copyOfRange(raw, 32, 64));
        try {
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(
                    dataHash.getBytes(StandardCharsets.UTF_8), signatureData);
            return Numeric.prependHexPrefix(Keys.getAddress(publicKey));
        } catch (java.security.SignatureException e) {
            return null;
        }
    }
}
