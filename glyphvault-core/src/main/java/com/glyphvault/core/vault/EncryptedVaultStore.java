package com.glyphvault.core.vault;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.glyphvault.core.error.ConfigurationException;
import com.glyphvault.core.error.GlyphVaultException;
import com.glyphvault.core.error.IntegrityException;
import com.glyphvault.core.glyph.Glyph;
import com.glyphvault.core.glyph.GlyphFactory;
import com.glyphvault.core.hash.ContentHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Glyph records encrypted at rest, one file per glyph id.
 *
 * The AES-256 key is derived once per instance from the passphrase with
 * PBKDF2-HMAC-SHA256 and a random per-vault salt kept in {@value #SALT_FILE}.
 * Blobs are AES-GCM with a fresh IV and the glyph id as associated data, so
 * a modified blob, or a blob moved under another id, fails to decrypt.
 *
 * <pre>
 * blob := "GLV1" || iv[12] || ciphertext || tag[16]
 * </pre>
 */
public class EncryptedVaultStore {

    private static final Logger log = LoggerFactory.getLogger(EncryptedVaultStore.class);

    public static final int DEFAULT_KDF_ITERATIONS = 310_000;
    public static final int MIN_KDF_ITERATIONS = 10_000;

    static final String SALT_FILE = "vault.salt";
    static final String BLOB_SUFFIX = ".glyph";

    private static final String ENCRYPTION_ALGORITHM = "AES/GCM/NoPadding";
    private static final String KDF_ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final byte[] MAGIC = "GLV1".getBytes(StandardCharsets.US_ASCII);
    private static final int GCM_TAG_LENGTH = 128;
    private static final int GCM_IV_LENGTH = 12;
    private static final int SALT_LENGTH = 16;
    private static final int KEY_SIZE = 256;

    private final Path directory;
    private final SecretKey key;
    private final ObjectMapper mapper;
    private final SecureRandom secureRandom;

    private EncryptedVaultStore(Path directory, SecretKey key) {
        this.directory = directory;
        this.key = key;
        // decimals round-trip exactly so a stored payload keeps its data hash
        this.mapper = JsonMapper.builder()
                .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .build();
        this.secureRandom = new SecureRandom();
    }

    public static EncryptedVaultStore open(Path directory, String passphrase) {
        return open(directory, passphrase, DEFAULT_KDF_ITERATIONS);
    }

    /**
     * Opens (or initializes) a store in {@code directory}.
     *
     * @throws ConfigurationException if the passphrase is missing or the
     *                                iteration count is below {@value #MIN_KDF_ITERATIONS}
     */
    public static EncryptedVaultStore open(Path directory, String passphrase, int kdfIterations) {
        Objects.requireNonNull(directory, "Storage directory cannot be null");
        if (passphrase == null || passphrase.isBlank()) {
            throw new ConfigurationException("Vault passphrase must be supplied");
        }
        if (kdfIterations < MIN_KDF_ITERATIONS) {
            throw new ConfigurationException("KDF iterations must be at least " + MIN_KDF_ITERATIONS);
        }
        try {
            Files.createDirectories(directory);
            byte[] salt = loadOrCreateSalt(directory.resolve(SALT_FILE));
            SecretKey key = deriveKey(passphrase, salt, kdfIterations);
            log.info("Opened encrypted vault store at {}", directory);
            return new EncryptedVaultStore(directory, key);
        } catch (IOException e) {
            throw new GlyphVaultException("Failed to open vault store at " + directory, e);
        }
    }

    /**
     * Encrypts and writes the full glyph record. Rewriting the same id
     * replaces the blob atomically.
     */
    public void put(Glyph glyph) {
        Objects.requireNonNull(glyph, "Glyph cannot be null");
        requireGlyphId(glyph.id());
        try {
            byte[] plaintext = mapper.writeValueAsBytes(glyph);
            byte[] iv = generateIV();
            byte[] ciphertext = encrypt(plaintext, iv, aad(glyph.id()));

            byte[] blob = new byte[MAGIC.length + iv.length + ciphertext.length];
            System.arraycopy(MAGIC, 0, blob, 0, MAGIC.length);
            System.arraycopy(iv, 0, blob, MAGIC.length, iv.length);
            System.arraycopy(ciphertext, 0, blob, MAGIC.length + iv.length, ciphertext.length);

            Path target = blobPath(glyph.id());
            Path temp = Files.createTempFile(directory, glyph.id(), ".tmp");
            try {
                Files.write(temp, blob);
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(temp);
            }
            log.debug("Stored encrypted blob for glyph {}", glyph.id());
        } catch (IOException | GeneralSecurityException e) {
            throw new GlyphVaultException("Failed to store glyph " + glyph.id(), e);
        }
    }

    /**
     * Reads and decrypts a glyph.
     *
     * @return empty when no blob exists for {@code id}
     * @throws IntegrityException if the blob cannot be decrypted or its
     *                            contents do not match their hashes
     */
    public Optional<Glyph> get(String id) {
        if (!GlyphFactory.isGlyphId(id)) {
            return Optional.empty();
        }
        Path path = blobPath(id);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        byte[] blob;
        try {
            blob = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new GlyphVaultException("Failed to read glyph " + id, e);
        }
        return Optional.of(open(id, blob));
    }

    public boolean exists(String id) {
        return GlyphFactory.isGlyphId(id) && Files.exists(blobPath(id));
    }

    /**
     * Removes a blob. Only used to discard blobs whose ledger write never
     * committed.
     */
    public boolean delete(String id) {
        requireGlyphId(id);
        try {
            return Files.deleteIfExists(blobPath(id));
        } catch (IOException e) {
            throw new GlyphVaultException("Failed to delete glyph " + id, e);
        }
    }

    /**
     * Ids of every blob currently on disk.
     */
    public List<String> storedIds() {
        try (Stream<Path> files = Files.list(directory)) {
            List<String> ids = new ArrayList<>();
            files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(BLOB_SUFFIX))
                    .map(name -> name.substring(0, name.length() - BLOB_SUFFIX.length()))
                    .filter(GlyphFactory::isGlyphId)
                    .forEach(ids::add);
            return ids;
        } catch (IOException e) {
            throw new GlyphVaultException("Failed to list vault directory " + directory, e);
        }
    }

    public Path directory() {
        return directory;
    }

    Path blobPath(String id) {
        return directory.resolve(id + BLOB_SUFFIX);
    }

    // ==================== Private Methods ====================

    private Glyph open(String id, byte[] blob) {
        if (blob.length < MAGIC.length + GCM_IV_LENGTH + GCM_TAG_LENGTH / 8
                || !Arrays.equals(MAGIC, 0, MAGIC.length, blob, 0, MAGIC.length)) {
            throw new IntegrityException(id, "Blob for glyph " + id + " is malformed");
        }
        byte[] iv = Arrays.copyOfRange(blob, MAGIC.length, MAGIC.length + GCM_IV_LENGTH);
        byte[] ciphertext = Arrays.copyOfRange(blob, MAGIC.length + GCM_IV_LENGTH, blob.length);

        byte[] plaintext;
        try {
            plaintext = decrypt(ciphertext, iv, aad(id));
        } catch (AEADBadTagException e) {
            log.warn("Authentication failed for glyph {}: wrong passphrase or tampered blob", id);
            throw new IntegrityException(id, "Glyph " + id + " failed authentication", e);
        } catch (GeneralSecurityException e) {
            throw new IntegrityException(id, "Glyph " + id + " could not be decrypted", e);
        }

        Glyph glyph;
        try {
            glyph = mapper.readValue(plaintext, Glyph.class);
        } catch (IOException | RuntimeException e) {
            throw new IntegrityException(id, "Glyph " + id + " decrypted to an unreadable record", e);
        }

        if (!id.equals(glyph.id())) {
            throw new IntegrityException(id, "Blob for " + id + " holds glyph " + glyph.id());
        }
        if (!id.equals(GlyphFactory.deriveId(glyph.dataHash(), glyph.source()))) {
            throw new IntegrityException(id, "Glyph " + id + " does not match its data hash and source");
        }
        if (glyph.hasData() && !ContentHasher.hash(glyph.data()).equals(glyph.dataHash())) {
            log.warn("Data hash mismatch for glyph {}", id);
            throw new IntegrityException(id, "Payload of glyph " + id + " does not match its data hash");
        }
        return glyph;
    }

    private static byte[] loadOrCreateSalt(Path saltFile) throws IOException {
        if (!Files.exists(saltFile)) {
            byte[] salt = new byte[SALT_LENGTH];
            new SecureRandom().nextBytes(salt);
            try {
                Files.write(saltFile, salt, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                return salt;
            } catch (FileAlreadyExistsException e) {
                log.debug("Salt file {} was created concurrently, reading it", saltFile);
            }
        }
        byte[] salt = Files.readAllBytes(saltFile);
        if (salt.length != SALT_LENGTH) {
            throw new ConfigurationException("Vault salt file " + saltFile + " is corrupt");
        }
        return salt;
    }

    private static SecretKey deriveKey(String passphrase, byte[] salt, int iterations) {
        PBEKeySpec spec = new PBEKeySpec(passphrase.toCharArray(), salt, iterations, KEY_SIZE);
        try {
            byte[] encoded = SecretKeyFactory.getInstance(KDF_ALGORITHM).generateSecret(spec).getEncoded();
            return new SecretKeySpec(encoded, "AES");
        } catch (GeneralSecurityException e) {
            throw new GlyphVaultException("Failed to derive vault key", e);
        } finally {
            spec.clearPassword();
        }
    }

    private byte[] generateIV() {
        byte[] iv = new byte[GCM_IV_LENGTH];
        secureRandom.nextBytes(iv);
        return iv;
    }

    private byte[] encrypt(byte[] data, byte[] iv, byte[] aad) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
        cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
        cipher.updateAAD(aad);
        return cipher.doFinal(data);
    }

    private byte[] decrypt(byte[] encryptedData, byte[] iv, byte[] aad) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
        cipher.updateAAD(aad);
        return cipher.doFinal(encryptedData);
    }

    private static byte[] aad(String id) {
        return id.getBytes(StandardCharsets.US_ASCII);
    }

    private static void requireGlyphId(String id) {
        if (!GlyphFactory.isGlyphId(id)) {
            throw new IllegalArgumentException("Not a glyph id: " + id);
        }
    }
}
