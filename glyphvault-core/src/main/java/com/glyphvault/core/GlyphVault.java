package com.glyphvault.core;

import com.glyphvault.core.error.GlyphNotFoundException;
import com.glyphvault.core.error.IntegrityException;
import com.glyphvault.core.gateway.ContentGateway;
import com.glyphvault.core.glyph.Glyph;
import com.glyphvault.core.glyph.GlyphFactory;
import com.glyphvault.core.glyph.SignatureVerification;
import com.glyphvault.core.glyph.SigningIdentity;
import com.glyphvault.core.ledger.AuditEntry;
import com.glyphvault.core.ledger.AuditLedger;
import com.glyphvault.core.ledger.GlyphSummary;
import com.glyphvault.core.ledger.VaultStats;
import com.glyphvault.core.vault.EncryptedVaultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One glyph vault: encrypted blob store, audit ledger and signing factory
 * behind a single API.
 *
 * Creating a glyph writes its ledger rows and then its blob inside one
 * ledger transaction, so a committed glyph always has a blob. A crash before
 * the commit can leave a blob with no ledger row; {@link #recoverOrphans()}
 * removes those. Work on the same id is serialized by a striped lock.
 */
public class GlyphVault implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GlyphVault.class);

    public static final String IPFS_SOURCE_PREFIX = "ipfs://";

    private static final int LOCK_STRIPES = 64;

    private final EncryptedVaultStore store;
    private final AuditLedger ledger;
    private final GlyphFactory factory;
    private final ContentGateway gateway;
    private final Clock clock;
    private final ReentrantLock[] locks;

    public GlyphVault(EncryptedVaultStore store, AuditLedger ledger, GlyphFactory factory) {
        this(store, ledger, factory, null, Clock.systemUTC());
    }

    /**
     * @param gateway optional; {@link #ingest} and {@link #publish} need it
     */
    public GlyphVault(EncryptedVaultStore store, AuditLedger ledger, GlyphFactory factory,
                      ContentGateway gateway, Clock clock) {
        this.store = Objects.requireNonNull(store, "Vault store cannot be null");
        this.ledger = Objects.requireNonNull(ledger, "Audit ledger cannot be null");
        this.factory = Objects.requireNonNull(factory, "Glyph factory cannot be null");
        this.gateway = gateway;
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.locks = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    // ==================== Glyph Lifecycle ====================

    public Glyph create(Map<String, Object> data, String source) {
        return create(data, source, factory.defaultIdentity());
    }

    /**
     * Creates, records and stores a glyph. Submitting content already held
     * for the same source returns the stored glyph unchanged and logs a
     * {@code REINGESTED} action.
     */
    public Glyph create(Map<String, Object> data, String source, SigningIdentity identity) {
        Glyph candidate = factory.create(data, source, identity);
        return withLock(candidate.id(), () -> ledger.inTransaction(() -> {
            if (!ledger.recordGlyph(candidate)) {
                Glyph existing = retrieve(candidate.id());
                ledger.logAction(candidate.id(), AuditEntry.REINGESTED, identity.signer(), Map.of("source", source));
                log.info("Glyph {} already stored, recorded re-ingestion", candidate.id());
                return existing;
            }
            store.put(candidate);
            log.info("Created glyph {} from {}", candidate.id(), source);
            return candidate;
        }));
    }

    /**
     * Decrypts and returns the full glyph.
     *
     * @throws GlyphNotFoundException if the ledger has no such glyph
     * @throws IntegrityException     if its blob is missing or does not check out
     */
    public Glyph retrieve(String id) {
        if (!ledger.contains(id)) {
            throw new GlyphNotFoundException(id);
        }
        Optional<Glyph> glyph = store.get(id);
        if (glyph.isEmpty()) {
            log.warn("Ledger records glyph {} but no blob exists", id);
            throw new IntegrityException(id, "Blob for recorded glyph " + id + " is missing");
        }
        return glyph.get();
    }

    /**
     * Whether the ledger records {@code id}; the blob is not read.
     */
    public boolean contains(String id) {
        return ledger.contains(id);
    }

    public SignatureVerification verifySignature(Glyph glyph) {
        return factory.verifySignature(glyph);
    }

    /**
     * Re-verifies a stored glyph and bundles the result with its audit trail.
     */
    public GlyphProof proof(String id) {
        Glyph glyph = retrieve(id);
        SignatureVerification verification = factory.verifySignature(glyph);
        if (!verification.valid()) {
            log.warn("Stored glyph {} carries an invalid signature", id);
        }
        return new GlyphProof(
                glyph.id(),
                glyph.dataHash(),
                glyph.source(),
                glyph.timestamp(),
                glyph.signer(),
                glyph.signature(),
                verification.valid(),
                verification.assurance(),
                glyph.verified() && verification.valid(),
                ledger.getAuditTrail(id),
                clock.instant().getEpochSecond());
    }

    public List<AuditEntry> auditTrail(String id) {
        if (!ledger.contains(id)) {
            throw new GlyphNotFoundException(id);
        }
        return ledger.getAuditTrail(id);
    }

    public List<GlyphSummary> list(String source, int limit) {
        return ledger.list(source, limit);
    }

    public List<GlyphSummary> list(String source, int limit, int offset) {
        return ledger.list(source, limit, offset);
    }

    public VaultStats stats() {
        return ledger.stats();
    }

    // ==================== Anchoring ====================

    /**
     * Logs an {@code ANCHORED} action for every glyph in an anchored batch.
     * Either all entries are written or none.
     *
     * @throws GlyphNotFoundException if any id was never recorded
     */
    public List<AuditEntry> recordAnchoring(List<String> ids, String merkleRoot, String txHash, String actor) {
        Objects.requireNonNull(ids, "Ids cannot be null");
        Objects.requireNonNull(merkleRoot, "Merkle root cannot be null");
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("merkle_root", merkleRoot);
        if (txHash != null) {
            metadata.put("tx_hash", txHash);
        }
        metadata.put("batch_size", ids.size());
        List<AuditEntry> entries = ledger.inTransaction(() -> {
            List<AuditEntry> written = new ArrayList<>();
            for (String id : new LinkedHashSet<>(ids)) {
                written.add(ledger.logAction(id, AuditEntry.ANCHORED, actor, metadata));
            }
            return written;
        });
        log.info("Recorded anchoring of {} glyphs under root {}", entries.size(), merkleRoot);
        return entries;
    }

    // ==================== Recovery ====================

    /**
     * Deletes blobs whose ledger write never committed.
     *
     * @return number of blobs removed
     */
    public int recoverOrphans() {
        int removed = 0;
        for (String id : store.storedIds()) {
            boolean deleted = withLock(id, () -> !ledger.contains(id) && store.delete(id));
            if (deleted) {
                log.warn("Removed orphan blob for glyph {}", id);
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Orphan recovery removed {} blobs", removed);
        }
        return removed;
    }

    // ==================== Content Gateway ====================

    /**
     * Pulls a payload from the content gateway and stores it as a glyph
     * with source {@code ipfs://<cid>}.
     */
    public Glyph ingest(String cid) {
        if (cid == null || cid.isBlank()) {
            throw new IllegalArgumentException("CID cannot be null or blank");
        }
        Map<String, Object> data = requireGateway().download(cid);
        log.debug("Downloaded payload {} from content gateway", cid);
        return create(data, IPFS_SOURCE_PREFIX + cid);
    }

    /**
     * Pushes a glyph's decrypted payload to the content gateway and logs a
     * {@code PUBLISHED} action with the returned CID.
     */
    public String publish(String id) {
        ContentGateway contentGateway = requireGateway();
        Glyph glyph = retrieve(id);
        String cid = contentGateway.upload(glyph.data());
        ledger.logAction(id, AuditEntry.PUBLISHED, factory.defaultIdentity().signer(), Map.of("cid", cid));
        log.info("Published glyph {} as {}", id, cid);
        return cid;
    }

    @Override
    public void close() {
        ledger.close();
        log.info("Closed glyph vault at {}", store.directory());
    }

    // ==================== Private Methods ====================

    private ContentGateway requireGateway() {
        if (gateway == null) {
            throw new IllegalStateException("No content gateway configured for this vault");
        }
        return gateway;
    }

    private <T> T withLock(String id, Supplier<T> work) {
        ReentrantLock lock = locks[Math.floorMod(id.hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }
}
