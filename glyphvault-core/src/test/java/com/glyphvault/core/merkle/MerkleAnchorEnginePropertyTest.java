package com.glyphvault.core.merkle;

import com.glyphvault.core.glyph.Glyph;
import com.glyphvault.core.glyph.GlyphFactory;
import com.glyphvault.core.glyph.SigningIdentity;
import com.glyphvault.core.hash.ContentHasher;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for Merkle batching and inclusion proofs.
 */
class MerkleAnchorEnginePropertyTest {

    private static final String HEX_DIGITS = "0123456789abcdef";

    private final MerkleAnchorEngine engine = new MerkleAnchorEngine();

    // ==================== Inclusion ====================

    @Property(tries = 100)
    void everyIdHasAVerifyingProof(@ForAll("idBatches") List<String> ids) {
        // Property: for every id in the batch, its proof recomputes the batch root
        String root = engine.root(ids);

        for (String id : ids) {
            assertThat(engine.verify(root, id, engine.proof(ids, id))).isTrue();
        }
        assertThat(root).matches("0x[0-9a-f]{64}");
    }

    @Property(tries = 50)
    void buildMatchesIndividualProofs(@ForAll("idBatches") List<String> ids) {
        MerkleBatch batch = engine.build(ids);

        assertThat(batch.root()).isEqualTo(engine.root(ids));
        assertThat(batch.size()).isEqualTo(ids.size());
        for (String id : ids) {
            assertThat(batch.proofFor(id)).contains(engine.proof(ids, id));
        }
    }

    @Property(tries = 100)
    void mutatingAnyProofCharacterFailsVerification(@ForAll("idBatches") List<String> ids,
                                                    @ForAll("indices") int pick,
                                                    @ForAll("indices") int position) {
        // Property: changing one hex digit of any proof element breaks verification
        Assume.that(ids.size() >= 2);
        String target = ids.get(pick % ids.size());
        List<String> proof = new ArrayList<>(engine.proof(ids, target));
        int element = position % proof.size();
        proof.set(element, mutateHexAt(proof.get(element), 2 + position % 64));

        assertThat(engine.verify(engine.root(ids), target, proof)).isFalse();
    }

    @Property(tries = 50)
    void proofDoesNotVerifyAnotherLeaf(@ForAll("idBatches") List<String> ids) {
        Assume.that(ids.size() >= 2);
        String root = engine.root(ids);

        assertThat(engine.verify(root, ids.get(0), engine.proof(ids, ids.get(1)))).isFalse();
    }

    // ==================== Tree Shape ====================

    @Test
    void singleLeafRootIsLeafHash() {
        String id = "0x" + "11".repeat(32);

        assertThat(engine.root(List.of(id)))
                .isEqualTo("0x" + HexFormat.of().formatHex(MerkleAnchorEngine.leafHash(id)));
        assertThat(engine.proof(List.of(id), id)).isEmpty();
        assertThat(engine.verify(engine.root(List.of(id)), id, List.of())).isTrue();
    }

    @Test
    void pairIsHashedInSortedOrder() {
        String a = "0x" + "aa".repeat(32);
        String b = "0x" + "bb".repeat(32);

        assertThat(engine.root(List.of(a, b))).isEqualTo(engine.root(List.of(b, a)));
    }

    @Test
    void oddLeafIsPromotedNotDuplicated() {
        String a = "0x" + "01".repeat(32);
        String b = "0x" + "02".repeat(32);
        String c = "0x" + "03".repeat(32);

        byte[] ab = MerkleAnchorEngine.hashPair(MerkleAnchorEngine.leafHash(a), MerkleAnchorEngine.leafHash(b));
        byte[] expected = MerkleAnchorEngine.hashPair(ab, MerkleAnchorEngine.leafHash(c));

        assertThat(engine.root(List.of(a, b, c))).isEqualTo("0x" + HexFormat.of().formatHex(expected));
        assertThat(engine.proof(List.of(a, b, c), c)).containsExactly("0x" + HexFormat.of().formatHex(ab));
    }

    @Test
    void leafIsHashOfDecodedIdBytes() {
        String id = "0x" + "ab".repeat(32);

        assertThat(MerkleAnchorEngine.leafHash(id))
                .isEqualTo(ContentHasher.sha256(HexFormat.of().parseHex("ab".repeat(32))));
    }

    @Test
    void duplicateIdsProveFirstOccurrence() {
        String a = "0x" + "0a".repeat(32);
        String b = "0x" + "0b".repeat(32);
        List<String> ids = List.of(a, b, a);

        assertThat(engine.verify(engine.root(ids), a, engine.proof(ids, a))).isTrue();
        assertThat(engine.build(ids).proofs()).hasSize(2);
    }

    // ==================== Failure Modes ====================

    @Test
    void emptyBatchAndAbsentTargetAreRejected() {
        String a = "0x" + "0a".repeat(32);

        assertThatThrownBy(() -> engine.root(List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.build(List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.proof(List.of(a), "0x" + "0b".repeat(32)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void malformedVerificationInputIsFalse() {
        String a = "0x" + "0a".repeat(32);
        String root = engine.root(List.of(a));

        assertThat(engine.verify("0xzz", a, List.of())).isFalse();
        assertThat(engine.verify(root, a, List.of("0x1234"))).isFalse();
        assertThat(engine.verify(root, a, List.of("0x" + "g".repeat(64)))).isFalse();
        assertThat(engine.verify(null, a, List.of())).isFalse();
        assertThat(engine.verify(root, null, List.of())).isFalse();
        assertThat(engine.verify(root, a, null)).isFalse();
    }

    @Test
    void nonGlyphIdsAreNotLeaves() {
        String a = "0x" + "0a".repeat(32);

        assertThatThrownBy(() -> engine.root(List.of(a, "upload://1")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.build(List.of("0x" + "0A".repeat(32))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.proof(List.of(a, "0x1234"), a))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(engine.verify(engine.root(List.of(a)), "upload://1", List.of())).isFalse();
    }

    @Test
    void internalNodePreimageCannotPassAsLeaf() {
        // sha256 of the sorted pair is the parent, so its preimage hashes to that node
        String a = "0x" + "01".repeat(32);
        String b = "0x" + "02".repeat(32);
        String c = "0x" + "03".repeat(32);
        List<String> ids = List.of(a, b, c);
        byte[] leafA = MerkleAnchorEngine.leafHash(a);
        byte[] leafB = MerkleAnchorEngine.leafHash(b);
        byte[] first = Arrays.compareUnsigned(leafA, leafB) <= 0 ? leafA : leafB;
        byte[] second = first == leafA ? leafB : leafA;
        String forged = "0x" + HexFormat.of().formatHex(first) + HexFormat.of().formatHex(second);
        List<String> parentProof = List.of("0x" + HexFormat.of().formatHex(MerkleAnchorEngine.leafHash(c)));

        assertThat(ids).doesNotContain(forged);
        assertThat(engine.verify(engine.root(ids), forged, parentProof)).isFalse();
    }

    // ==================== Worked Example ====================

    @Test
    void sameContentFromTwoSourcesAnchorsAsTwoLeaves() {
        GlyphFactory factory = new GlyphFactory(SigningIdentity.serverAttestation());
        Map<String, Object> payload = Map.of("title", "A", "body", "B");

        Glyph x = factory.create(payload, "upload://1");
        Glyph y = factory.create(payload, "upload://2");
        List<String> batch = List.of(x.id(), y.id());
        String root = engine.root(batch);

        assertThat(y.id()).isNotEqualTo(x.id());
        assertThat(engine.verify(root, x.id(), engine.proof(batch, x.id()))).isTrue();
        assertThat(engine.verify(root, x.id(), engine.proof(batch, y.id()))).isFalse();
    }

    // ==================== Generators ====================

    @Provide
    Arbitrary<List<String>> idBatches() {
        return Arbitraries.strings().withChars(HEX_DIGITS.toCharArray()).ofLength(64)
                .map(hex -> "0x" + hex)
                .list().ofMinSize(1).ofMaxSize(40).uniqueElements();
    }

    @Provide
    Arbitrary<Integer> indices() {
        return Arbitraries.integers().between(0, 10_000);
    }

    private static String mutateHexAt(String hex, int index) {
        char current = hex.charAt(index);
        char replacement = HEX_DIGITS.charAt((HEX_DIGITS.indexOf(current) + 1) % HEX_DIGITS.length());
        return hex.substring(0, index) + replacement + hex.substring(index + 1);
    }
}
