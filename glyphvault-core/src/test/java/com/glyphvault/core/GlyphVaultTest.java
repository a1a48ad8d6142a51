package com.glyphvault.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.glyphvault.core.error.GlyphNotFoundException;
import com.glyphvault.core.error.IntegrityException;
import com.glyphvault.core.gateway.ContentGateway;
import com.glyphvault.core.glyph.Glyph;
import com.glyphvault.core.glyph.GlyphFactory;
import com.glyphvault.core.glyph.SignatureAssurance;
import com.glyphvault.core.glyph.SigningIdentity;
import com.glyphvault.core.ledger.AuditEntry;
import com.glyphvault.core.ledger.AuditLedger;
import com.glyphvault.core.ledger.GlyphSummary;
import com.glyphvault.core.vault.EncryptedVaultStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.*;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the vault facade over store, ledger and factory.
 */
class GlyphVaultTest {

    private static final String PASSPHRASE = "vault test passphrase";
    private static final String TEST_KEY = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path storageDir;

    private EncryptedVaultStore store;
    private AuditLedger ledger;
    private InMemoryGateway gateway;
    private GlyphVault vault;

    @BeforeEach
    void setUp() {
        store = EncryptedVaultStore.open(storageDir, PASSPHRASE, EncryptedVaultStore.MIN_KDF_ITERATIONS);
        ledger = AuditLedger.inMemory("vault-" + UUID.randomUUID(), CLOCK);
        gateway = new InMemoryGateway();
        vault = new GlyphVault(store, ledger, new GlyphFactory(SigningIdentity.localKey(TEST_KEY), CLOCK),
                gateway, CLOCK);
    }

    @AfterEach
    void tearDown() {
        vault.close();
    }

    // ==================== Create and Retrieve ====================

    @Test
    void createdGlyphIsRetrievable() {
        Glyph created = vault.create(payload("A", "B"), "upload://1");

        Glyph retrieved = vault.retrieve(created.id());

        assertThat(retrieved).isEqualTo(created);
        assertThat(vault.verifySignature(retrieved).assurance()).isEqualTo(SignatureAssurance.CRYPTOGRAPHIC);
        assertThat(vault.auditTrail(created.id())).extracting(AuditEntry::action).containsExactly(AuditEntry.CREATED);
        assertThat(vault.contains(created.id())).isTrue();
        assertThat(vault.contains("0x" + "00".repeat(32))).isFalse();
    }

    @Test
    void resubmittingReturnsStoredGlyphAndLogsReingestion() {
        Glyph first = vault.create(payload("A", "B"), "upload://1");

        Glyph second = vault.create(payload("A", "B"), "upload://1");

        assertThat(second).isEqualTo(first);
        assertThat(vault.auditTrail(first.id())).extracting(AuditEntry::action)
                .containsExactly(AuditEntry.CREATED, AuditEntry.REINGESTED);
        assertThat(vault.stats().totalGlyphs()).isEqualTo(1);
    }

    @Test
    void sameContentFromAnotherSourceIsAnotherGlyph() {
        Glyph x = vault.create(payload("A", "B"), "upload://1");
        Glyph y = vault.create(payload("A", "B"), "upload://2");

        assertThat(y.id()).isNotEqualTo(x.id());
        assertThat(y.dataHash()).isEqualTo(x.dataHash());
        assertThat(vault.list(null, 10)).extracting(GlyphSummary::id).containsExactlyInAnyOrder(x.id(), y.id());
    }

    @Test
    void serverAttestedGlyphsReportLowerAssurance() {
        Glyph glyph = vault.create(payload("A", "B"), "upload://1", SigningIdentity.serverAttestation());

        assertThat(glyph.signer()).isEqualTo(GlyphFactory.SERVER_SIGNER);
        assertThat(vault.proof(glyph.id()).signatureAssurance()).isEqualTo(SignatureAssurance.SERVER_ATTESTATION);
    }

    // ==================== Failure Modes ====================

    @Test
    void unknownIdIsNotFound() {
        String unknown = "0x" + "00".repeat(32);

        assertThatThrownBy(() -> vault.retrieve(unknown)).isInstanceOf(GlyphNotFoundException.class);
        assertThatThrownBy(() -> vault.proof(unknown)).isInstanceOf(GlyphNotFoundException.class);
        assertThatThrownBy(() -> vault.auditTrail(unknown)).isInstanceOf(GlyphNotFoundException.class);
    }

    @Test
    void missingBlobIsIntegrityFailure() throws Exception {
        Glyph glyph = vault.create(payload("A", "B"), "upload://1");
        Files.delete(storageDir.resolve(glyph.id() + ".glyph"));

        assertThatThrownBy(() -> vault.retrieve(glyph.id()))
                .isInstanceOfSatisfying(IntegrityException.class, e -> assertThat(e.getGlyphId()).isEqualTo(glyph.id()));
    }

    @Test
    void tamperedBlobIsIntegrityFailure() throws Exception {
        Glyph glyph = vault.create(payload("A", "B"), "upload://1");
        Path blob = storageDir.resolve(glyph.id() + ".glyph");
        byte[] bytes = Files.readAllBytes(blob);
        bytes[bytes.length - 1] ^= 0x01;
        Files.write(blob, bytes);

        assertThatThrownBy(() -> vault.retrieve(glyph.id())).isInstanceOf(IntegrityException.class);
        assertThatThrownBy(() -> vault.create(payload("A", "B"), "upload://1")).isInstanceOf(IntegrityException.class);
        assertThat(ledger.getAuditTrail(glyph.id())).hasSize(1);
    }

    // ==================== Proof ====================

    @Test
    void proofCarriesVerificationAndTrail() throws Exception {
        Glyph glyph = vault.create(payload("A", "B"), "upload://1");

        GlyphProof proof = vault.proof(glyph.id());

        assertThat(proof.glyphId()).isEqualTo(glyph.id());
        assertThat(proof.signatureValid()).isTrue();
        assertThat(proof.verified()).isTrue();
        assertThat(proof.auditTrail()).hasSize(1);
        assertThat(proof.proofGeneratedAt()).isEqualTo(CLOCK.instant().getEpochSecond());

        JsonNode json = new ObjectMapper().valueToTree(proof);
        assertThat(json.has("glyph_id")).isTrue();
        assertThat(json.get("signature_assurance").asText()).isEqualTo("CRYPTOGRAPHIC");
        assertThat(json.get("audit_trail").get(0).get("action").asText()).isEqualTo("CREATED");
        assertThat(json.has("proof_generated_at")).isTrue();
    }

    // ==================== Concurrency and Recovery ====================

    @Test
    void concurrentCreatesOfSameContentStoreOneGlyph() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Glyph>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(() -> vault.create(payload("A", "B"), "upload://1")));
            }
            Set<String> ids = new HashSet<>();
            for (Future<Glyph> future : futures) {
                ids.add(future.get(30, TimeUnit.SECONDS).id());
            }

            String id = ids.iterator().next();
            assertThat(ids).hasSize(1);
            assertThat(vault.auditTrail(id)).extracting(AuditEntry::action)
                    .containsOnlyOnce(AuditEntry.CREATED)
                    .hasSize(8);
            assertThat(store.storedIds()).containsExactly(id);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void recoverOrphansRemovesUncommittedBlobs() {
        Glyph kept = vault.create(payload("A", "B"), "upload://1");
        Glyph orphan = new GlyphFactory(SigningIdentity.serverAttestation(), CLOCK).create(payload("C", "D"), "upload://1");

        assertThatThrownBy(() -> ledger.inTransaction(() -> {
            ledger.recordGlyph(orphan);
            store.put(orphan);
            throw new IllegalStateException("crash before commit");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(store.exists(orphan.id())).isTrue();
        assertThat(vault.recoverOrphans()).isEqualTo(1);
        assertThat(store.exists(orphan.id())).isFalse();
        assertThat(vault.retrieve(kept.id())).isEqualTo(kept);
        assertThat(vault.recoverOrphans()).isZero();
    }

    @Test
    void replayAfterCrashOverwritesOrphan() {
        Glyph orphan = new GlyphFactory(SigningIdentity.localKey(TEST_KEY), CLOCK).create(payload("C", "D"), "upload://1");
        store.put(orphan);

        Glyph replayed = vault.create(payload("C", "D"), "upload://1");

        assertThat(replayed.id()).isEqualTo(orphan.id());
        assertThat(vault.retrieve(orphan.id())).isEqualTo(replayed);
        assertThat(vault.recoverOrphans()).isZero();
    }

    // ==================== Anchoring ====================

    @Test
    void recordAnchoringLogsEveryGlyph() {
        Glyph x = vault.create(payload("A", "B"), "upload://1");
        Glyph y = vault.create(payload("A", "B"), "upload://2");

        List<AuditEntry> entries = vault.recordAnchoring(List.of(x.id(), y.id()), "0xroot", "0xtx", "anchor-service");

        assertThat(entries).hasSize(2);
        assertThat(vault.auditTrail(x.id())).last().satisfies(entry -> {
            assertThat(entry.action()).isEqualTo(AuditEntry.ANCHORED);
            assertThat(entry.metadata()).containsEntry("merkle_root", "0xroot").containsEntry("tx_hash", "0xtx");
        });
    }

    @Test
    void recordAnchoringIsAllOrNothing() {
        Glyph x = vault.create(payload("A", "B"), "upload://1");

        assertThatThrownBy(() -> vault.recordAnchoring(
                List.of(x.id(), "0x" + "00".repeat(32)), "0xroot", "0xtx", "anchor-service"))
                .isInstanceOf(GlyphNotFoundException.class);

        assertThat(vault.auditTrail(x.id())).hasSize(1);
    }

    // ==================== Content Gateway ====================

    @Test
    void ingestStoresPayloadUnderIpfsSource() {
        String cid = gateway.upload(payload("remote", "content"));

        Glyph glyph = vault.ingest(cid);

        assertThat(glyph.source()).isEqualTo("ipfs://" + cid);
        assertThat(vault.retrieve(glyph.id()).data()).isEqualTo(payload("remote", "content"));
    }

    @Test
    void publishUploadsPayloadAndLogsCid() {
        Glyph glyph = vault.create(payload("A", "B"), "upload://1");

        String cid = vault.publish(glyph.id());

        assertThat(gateway.download(cid)).isEqualTo(glyph.data());
        assertThat(vault.auditTrail(glyph.id())).last().satisfies(entry -> {
            assertThat(entry.action()).isEqualTo(AuditEntry.PUBLISHED);
            assertThat(entry.metadata()).containsEntry("cid", cid);
        });
    }

    @Test
    void gatewayOperationsNeedGateway() {
        GlyphVault withoutGateway = new GlyphVault(store, ledger,
                new GlyphFactory(SigningIdentity.serverAttestation(), CLOCK));

        assertThatThrownBy(() -> withoutGateway.ingest("bafy1")).isInstanceOf(IllegalStateException.class);
    }

    // ==================== Helpers ====================

    private static Map<String, Object> payload(String title, String body) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("title", title);
        data.put("body", body);
        return data;
    }

    static class InMemoryGateway implements ContentGateway {
        private final Map<String, Map<String, Object>> content = new ConcurrentHashMap<>();

        @Override
        public String upload(Map<String, Object> data) {
            String cid = "bafy" + content.size();
            content.put(cid, new LinkedHashMap<>(data));
            return cid;
        }

        @Override
        public Map<String, Object> download(String cid) {
            Map<String, Object> data = content.get(cid);
            if (data == null) {
                throw new IllegalArgumentException("Unknown CID " + cid);
            }
            return data;
        }
    }
}
