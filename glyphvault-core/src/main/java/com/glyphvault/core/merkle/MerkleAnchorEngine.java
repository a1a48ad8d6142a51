package com.glyphvault.core.merkle;

import com.glyphvault.core.glyph.GlyphFactory;
import com.glyphvault.core.hash.ContentHasher;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merkle trees over ordered batches of glyph ids.
 *
 * Leaves are SHA-256 of the 32 bytes a glyph id decodes to; anything that is
 * not a glyph id is rejected as a leaf, so an internal node's 64-byte preimage
 * can never pass for one. Parents are SHA-256 of the two children
 * concatenated smaller-first in unsigned byte order, so proofs carry no
 * left/right flags. On a level with an odd node count the last node is
 * promoted to the next level unchanged; its proof has no entry for that level.
 */
public class MerkleAnchorEngine {

    private static final int HASH_LENGTH = 32;
    private static final String HEX_PREFIX = "0x";

    /**
     * Root of the tree over {@code ids}, {@code 0x}-prefixed hex.
     *
     * @throws IllegalArgumentException if {@code ids} is empty or holds a non glyph id
     */
    public String root(List<String> ids) {
        return toHex(Tree.build(ids).root());
    }

    /**
     * Sibling hashes from the leaf of {@code targetId} up to the root. For a
     * duplicated id the first occurrence is proved.
     *
     * @throws IllegalArgumentException if {@code targetId} is not in {@code ids}
     */
    public List<String> proof(List<String> ids, String targetId) {
        Tree tree = Tree.build(ids);
        int index = ids.indexOf(targetId);
        if (index < 0) {
            throw new IllegalArgumentException("Id is not part of the batch: " + targetId);
        }
        return tree.proof(index).stream().map(MerkleAnchorEngine::toHex).toList();
    }

    /**
     * Root and a proof for every distinct id in one pass.
     */
    public MerkleBatch build(List<String> ids) {
        Tree tree = Tree.build(ids);
        Map<String, List<String>> proofs = new LinkedHashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            if (!proofs.containsKey(ids.get(i))) {
                proofs.put(ids.get(i), tree.proof(i).stream().map(MerkleAnchorEngine::toHex).toList());
            }
        }
        return new MerkleBatch(toHex(tree.root()), ids, proofs);
    }

    /**
     * Recomputes the root from {@code leafId} and {@code proof}. Malformed
     * input, including a leaf that is not a glyph id, yields {@code false}.
     */
    public boolean verify(String root, String leafId, List<String> proof) {
        if (root == null || !GlyphFactory.isGlyphId(leafId) || proof == null) {
            return false;
        }
        byte[] expected = parseHash(root);
        if (expected == null) {
            return false;
        }
        byte[] current = leafHash(leafId);
        for (String element : proof) {
            byte[] sibling = parseHash(element);
            if (sibling == null) {
                return false;
            }
            current = hashPair(current, sibling);
        }
        return Arrays.equals(current, expected);
    }

    static byte[] leafHash(String id) {
        if (!GlyphFactory.isGlyphId(id)) {
            throw new IllegalArgumentException("Not a glyph id: " + id);
        }
        return ContentHasher.sha256(HexFormat.of().parseHex(id, 2, id.length()));
    }

    static byte[] hashPair(byte[] a, byte[] b) {
        byte[] combined = new byte[a.length + b.length];
        if (Arrays.compareUnsigned(a, b) <= 0) {
            System.arraycopy(a, 0, combined, 0, a.length);
            System.arraycopy(b, 0, combined, a.length, b.length);
        } else {
            System.arraycopy(b, 0, combined, 0, b.length);
            System.arraycopy(a, 0, combined, b.length, a.length);
        }
        return ContentHasher.sha256(combined);
    }

    private static byte[] parseHash(String hex) {
        String digits = hex.startsWith(HEX_PREFIX) ? hex.substring(2) : hex;
        if (digits.length() != HASH_LENGTH * 2) {
            return null;
        }
        try {
            return HexFormat.of().parseHex(digits);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String toHex(byte[] hash) {
        return HEX_PREFIX + HexFormat.of().formatHex(hash);
    }

    /**
     * All levels of one tree, leaves first.
     */
    private record Tree(List<List<byte[]>> levels) {

        static Tree build(List<String> ids) {
            Objects.requireNonNull(ids, "Ids cannot be null");
            if (ids.isEmpty()) {
                throw new IllegalArgumentException("Cannot build Merkle tree from empty list");
            }
            List<List<byte[]>> levels = new ArrayList<>();
            List<byte[]> current = new ArrayList<>(ids.size());
            for (String id : ids) {
                current.add(leafHash(Objects.requireNonNull(id, "Id cannot be null")));
            }
            levels.add(current);

            while (current.size() > 1) {
                List<byte[]> next = new ArrayList<>((current.size() + 1) / 2);
                for (int i = 0; i < current.size(); i += 2) {
                    if (i + 1 < current.size()) {
                        next.add(hashPair(current.get(i), current.get(i + 1)));
                    } else {
                        next.add(current.get(i));
                    }
                }
                levels.add(next);
                current = next;
            }
            return new Tree(Collections.unmodifiableList(levels));
        }

        byte[] root() {
            return levels.get(levels.size() - 1).get(0);
        }

        List<byte[]> proof(int leafIndex) {
            List<byte[]> siblings = new ArrayList<>();
            int index = leafIndex;
            for (int level = 0; level < levels.size() - 1; level++) {
                List<byte[]> nodes = levels.get(level);
                int sibling = index ^ 1;
                if (sibling < nodes.size()) {
                    siblings.add(nodes.get(sibling));
                }
                index = index / 2;
            }
            return siblings;
        }
    }
}
