package com.glyphvault.app.service;

import com.glyphvault.blockchain.service.AnchorResult;
import com.glyphvault.blockchain.service.ChainAnchorClient;
import com.glyphvault.core.GlyphVault;
import com.glyphvault.core.error.GlyphNotFoundException;
import com.glyphvault.core.ledger.AuditEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Anchors batches of stored glyphs and records the outcome in each glyph's
 * audit trail.
 */
public class AnchorBatchService {

    private static final Logger log = LoggerFactory.getLogger(AnchorBatchService.class);

    public static final String ACTOR = "chain-anchor";

    private final GlyphVault vault;
    private final ChainAnchorClient chainClient;

    public AnchorBatchService(GlyphVault vault, ChainAnchorClient chainClient) {
        this.vault = Objects.requireNonNull(vault, "vault");
        this.chainClient = Objects.requireNonNull(chainClient, "chainClient");
    }

    /**
     * Anchors {@code ids} in the given order.
     *
     * A newly mined root is logged as {@code ANCHORED} for every glyph. When
     * the root was already on chain, only glyphs whose trail lacks an
     * {@code ANCHORED} entry for that root are logged, without a transaction
     * hash; this covers a transaction mined after an earlier anchor call ran
     * out of retries.
     *
     * @throws GlyphNotFoundException when any id is not in the vault, before any chain call
     * @throws IllegalArgumentException when {@code ids} is empty
     */
    public AnchorResult anchor(List<String> ids) {
        Objects.requireNonNull(ids, "ids");
        if (ids.isEmpty()) {
            throw new IllegalArgumentException("Cannot anchor an empty batch");
        }
        for (String id : ids) {
            if (!vault.contains(id)) {
                throw new GlyphNotFoundException(id);
            }
        }

        AnchorResult result = chainClient.anchor(ids);
        if (result.isNewlyAnchored()) {
            vault.recordAnchoring(ids, result.root(), result.txHash(), ACTOR);
            return result;
        }

        List<String> unrecorded = ids.stream()
                .distinct()
                .filter(id -> !hasAnchorEntry(id, result.root()))
                .toList();
        if (!unrecorded.isEmpty()) {
            log.info("Root {} was already anchored; recording {} glyphs missing from the ledger",
                    result.root(), unrecorded.size());
            vault.recordAnchoring(unrecorded, result.root(), null, ACTOR);
        }
        return result;
    }

    private boolean hasAnchorEntry(String id, String root) {
        return vault.auditTrail(id).stream()
                .anyMatch(entry -> AuditEntry.ANCHORED.equals(entry.action())
                        && root.equals(entry.metadata().get("merkle_root")));
    }
}
