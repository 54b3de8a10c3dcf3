package net.tearoff.v1.crypto.merkle;

import net.tearoff.v1.base.types.ByteArrays;
import net.tearoff.v1.crypto.DigestAlgorithmName;
import net.tearoff.v1.crypto.DigestService;
import net.tearoff.v1.crypto.DigestServiceUtils;
import net.tearoff.v1.crypto.SecureHash;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * A Merkle tree built over an ordered list of leaf hashes.
 * <p>
 * The leaves are padded with zero hashes (of the leaves' algorithm) up to the next power of two, with a minimum
 * of two leaves, so a tree is always rooted at a {@link Node}. Each node hash is the digest of the left child's
 * hash bytes followed by the right child's hash bytes.
 */
public abstract class MerkleTree {

    private MerkleTree() {
    }

    @NotNull
    public abstract SecureHash getHash();

    public static final class Leaf extends MerkleTree {
        private final SecureHash hash;

        public Leaf(@NotNull SecureHash hash) {
            this.hash = hash;
        }

        @Override
        @NotNull
        public SecureHash getHash() {
            return hash;
        }
    }

    public static final class Node extends MerkleTree {
        private final SecureHash hash;
        private final MerkleTree left;
        private final MerkleTree right;

        public Node(@NotNull SecureHash hash, @NotNull MerkleTree left, @NotNull MerkleTree right) {
            this.hash = hash;
            this.left = left;
            this.right = right;
        }

        @Override
        @NotNull
        public SecureHash getHash() {
            return hash;
        }

        @NotNull
        public MerkleTree getLeft() {
            return left;
        }

        @NotNull
        public MerkleTree getRight() {
            return right;
        }
    }

    /**
     * Merkle tree building using hashes, with zero hash padding to full power of 2.
     *
     * @param allLeavesHashes The ordered leaf hashes, all of the same algorithm.
     * @param nodeDigestAlgorithmName The algorithm used for internal node hashes.
     * @param digestService The service computing node hashes.
     * @throws MerkleTreeException if the list is empty or mixes hash algorithms.
     */
    @NotNull
    public static MerkleTree getMerkleTree(
            @NotNull List<SecureHash> allLeavesHashes,
            @NotNull DigestAlgorithmName nodeDigestAlgorithmName,
            @NotNull DigestService digestService
    ) {
        if (allLeavesHashes.isEmpty()) {
            throw new MerkleTreeException("Cannot calculate Merkle root on empty hash list.");
        }
        final String leafAlgorithm = allLeavesHashes.get(0).getAlgorithm();
        for (SecureHash hash : allLeavesHashes) {
            if (!leafAlgorithm.equals(hash.getAlgorithm())) {
                throw new MerkleTreeException("All leaf hashes must use the same algorithm: " + leafAlgorithm);
            }
        }
        final SecureHash zeroHash = DigestServiceUtils.getZeroHash(digestService, new DigestAlgorithmName(leafAlgorithm));

        List<MerkleTree> level = new ArrayList<>(paddedSize(allLeavesHashes.size()));
        for (SecureHash hash : allLeavesHashes) {
            level.add(new Leaf(hash));
        }
        while (level.size() < paddedSize(allLeavesHashes.size())) {
            level.add(new Leaf(zeroHash));
        }

        while (level.size() > 1) {
            final List<MerkleTree> parents = new ArrayList<>(level.size() / 2);
            for (int i = 0; i < level.size(); i += 2) {
                final MerkleTree left = level.get(i);
                final MerkleTree right = level.get(i + 1);
                parents.add(new Node(nodeHash(left.getHash(), right.getHash(), nodeDigestAlgorithmName, digestService), left, right));
            }
            level = parents;
        }
        return level.get(0);
    }

    /**
     * Hash of an internal node: the digest of {@code left} bytes followed by {@code right} bytes.
     */
    @NotNull
    static SecureHash nodeHash(
            @NotNull SecureHash left,
            @NotNull SecureHash right,
            @NotNull DigestAlgorithmName nodeDigestAlgorithmName,
            @NotNull DigestService digestService
    ) {
        return digestService.hash(ByteArrays.concatenate(left.getBytes(), right.getBytes()), nodeDigestAlgorithmName);
    }

    private static int paddedSize(int leaves) {
        int size = 2;
        while (size < leaves) {
            size *= 2;
        }
        return size;
    }
}
