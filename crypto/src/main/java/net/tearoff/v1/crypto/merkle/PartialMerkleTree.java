package net.tearoff.v1.crypto.merkle;

import net.tearoff.v1.base.annotations.TearoffSerializable;
import net.tearoff.v1.crypto.DigestAlgorithmName;
import net.tearoff.v1.crypto.DigestService;
import net.tearoff.v1.crypto.SecureHash;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Building and verification of a partial Merkle tree.
 * <p>
 * A partial tree keeps the included leaves, and for every subtree without included leaves only that subtree's
 * root hash. Together with the included hashes this is enough to recompute the root of the full tree without
 * revealing the excluded leaves.
 * <p>
 * Example, for leaves a, b, c, d where only b is included:
 * <pre>
 *              root
 *            /      \
 *        H(a,b)     [H(c,d)]
 *        /    \
 *     [a]     (b)
 * </pre>
 * The pruned subtrees {@code a} and {@code H(c,d)} keep only their hashes.
 * Included leaves are {@link IncludedLeaf}, pruned subtrees are {@link Leaf} and everything above an included
 * leaf is a {@link Node}.
 */
@TearoffSerializable
public final class PartialMerkleTree {

    /**
     * The structure of a partial tree. Hashes of {@link Node}s are not stored: they are recomputed from the
     * children during verification.
     */
    public abstract static class PartialTree {
        private PartialTree() {
        }
    }

    public static final class IncludedLeaf extends PartialTree {
        private final SecureHash hash;

        public IncludedLeaf(@NotNull SecureHash hash) {
            this.hash = hash;
        }

        @NotNull
        public SecureHash getHash() {
            return hash;
        }

        @Override
        public boolean equals(@Nullable Object o) {
            return this == o || (o instanceof IncludedLeaf && hash.equals(((IncludedLeaf) o).hash));
        }

        @Override
        public int hashCode() {
            return Objects.hash("included", hash);
        }
    }

    public static final class Leaf extends PartialTree {
        private final SecureHash hash;

        public Leaf(@NotNull SecureHash hash) {
            this.hash = hash;
        }

        @NotNull
        public SecureHash getHash() {
            return hash;
        }

        @Override
        public boolean equals(@Nullable Object o) {
            return this == o || (o instanceof Leaf && hash.equals(((Leaf) o).hash));
        }

        @Override
        public int hashCode() {
            return Objects.hash("leaf", hash);
        }
    }

    public static final class Node extends PartialTree {
        private final PartialTree left;
        private final PartialTree right;

        public Node(@NotNull PartialTree left, @NotNull PartialTree right) {
            this.left = left;
            this.right = right;
        }

        @NotNull
        public PartialTree getLeft() {
            return left;
        }

        @NotNull
        public PartialTree getRight() {
            return right;
        }

        @Override
        public boolean equals(@Nullable Object o) {
            if (this == o) return true;
            if (!(o instanceof Node)) return false;
            final Node node = (Node) o;
            return left.equals(node.left) && right.equals(node.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(left, right);
        }
    }

    private final PartialTree root;

    public PartialMerkleTree(@NotNull PartialTree root) {
        this.root = root;
    }

    @NotNull
    public PartialTree getRoot() {
        return root;
    }

    /**
     * Builds a partial tree from a full {@link MerkleTree} for the leaves in {@code includeHashes}.
     *
     * @throws MerkleTreeException if some of the hashes are not leaves of the tree, or are repeated.
     */
    @NotNull
    public static PartialMerkleTree build(@NotNull MerkleTree merkleRoot, @NotNull List<SecureHash> includeHashes) {
        final Set<SecureHash> include = new HashSet<>(includeHashes);
        final List<SecureHash> usedHashes = new ArrayList<>();
        final PartialTree tree = buildPartialTree(merkleRoot, include, usedHashes).tree;
        // Too many included hashes or different ones.
        if (includeHashes.size() != usedHashes.size()) {
            throw new MerkleTreeException("Some of the provided hashes are not in the tree.");
        }
        return new PartialMerkleTree(tree);
    }

    private static final class BuildResult {
        private final boolean containsIncluded;
        private final PartialTree tree;

        private BuildResult(boolean containsIncluded, PartialTree tree) {
            this.containsIncluded = containsIncluded;
            this.tree = tree;
        }
    }

    @NotNull
    private static BuildResult buildPartialTree(
            @NotNull MerkleTree root,
            @NotNull Set<SecureHash> includeHashes,
            @NotNull List<SecureHash> usedHashes
    ) {
        if (root instanceof MerkleTree.Leaf) {
            final SecureHash hash = root.getHash();
            if (includeHashes.contains(hash)) {
                usedHashes.add(hash);
                return new BuildResult(true, new IncludedLeaf(hash));
            }
            return new BuildResult(false, new Leaf(hash));
        }
        final MerkleTree.Node node = (MerkleTree.Node) root;
        final BuildResult left = buildPartialTree(node.getLeft(), includeHashes, usedHashes);
        final BuildResult right = buildPartialTree(node.getRight(), includeHashes, usedHashes);
        if (left.containsIncluded || right.containsIncluded) {
            return new BuildResult(true, new Node(left.tree, right.tree));
        }
        // No included leaves below this node: cut the tree here and keep only its hash.
        return new BuildResult(false, new Leaf(root.getHash()));
    }

    /**
     * Recursively recomputes the root hash of {@code node}, collecting the hashes of all included leaves into
     * {@code usedHashes} in left to right order.
     */
    @NotNull
    public static SecureHash rootAndUsedHashes(
            @NotNull PartialTree node,
            @NotNull List<SecureHash> usedHashes,
            @NotNull DigestAlgorithmName nodeDigestAlgorithmName,
            @NotNull DigestService digestService
    ) {
        if (node instanceof IncludedLeaf) {
            final SecureHash hash = ((IncludedLeaf) node).getHash();
            usedHashes.add(hash);
            return hash;
        } else if (node instanceof Leaf) {
            return ((Leaf) node).getHash();
        }
        final Node branch = (Node) node;
        final SecureHash leftHash = rootAndUsedHashes(branch.getLeft(), usedHashes, nodeDigestAlgorithmName, digestService);
        final SecureHash rightHash = rootAndUsedHashes(branch.getRight(), usedHashes, nodeDigestAlgorithmName, digestService);
        return MerkleTree.nodeHash(leftHash, rightHash, nodeDigestAlgorithmName, digestService);
    }

    /**
     * @param merkleRootHash Hash that should be checked for equality with the root calculated from this partial tree.
     * @param hashesToCheck List of included leaves hashes that should be found in this partial tree.
     * @return true if the root matches and {@code hashesToCheck} are the included leaves, each as many times as it is included.
     */
    public boolean verify(
            @NotNull SecureHash merkleRootHash,
            @NotNull List<SecureHash> hashesToCheck,
            @NotNull DigestAlgorithmName nodeDigestAlgorithmName,
            @NotNull DigestService digestService
    ) {
        final List<SecureHash> usedHashes = new ArrayList<>();
        final SecureHash verifyRoot = rootAndUsedHashes(root, usedHashes, nodeDigestAlgorithmName, digestService);
        return verifyRoot.equals(merkleRootHash) && occurrences(hashesToCheck).equals(occurrences(usedHashes));
    }

    @NotNull
    private static Map<SecureHash, Integer> occurrences(@NotNull List<SecureHash> hashes) {
        final Map<SecureHash, Integer> counts = new HashMap<>();
        for (SecureHash hash : hashes) {
            counts.merge(hash, 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Returns the position of {@code leaf} among the leaves of the full tree this partial tree was built from.
     *
     * @throws MerkleTreeException if the hash is not an included leaf of this partial tree.
     */
    public int leafIndex(@NotNull SecureHash leaf) {
        // Special handling if the tree consists of one node only.
        if (root instanceof IncludedLeaf && ((IncludedLeaf) root).getHash().equals(leaf)) {
            return 0;
        }
        final List<Boolean> flagPath = new ArrayList<>();
        if (!leafIndexHelper(leaf, root, flagPath)) {
            throw new MerkleTreeException("The supplied leaf hash: " + leaf + " wasn't found in this partial merkle tree.");
        }
        // The path is collected from the leaf upwards.
        int index = 0;
        for (int i = flagPath.size() - 1; i >= 0; --i) {
            index = index * 2 + (flagPath.get(i) ? 1 : 0);
        }
        return index;
    }

    private static boolean leafIndexHelper(@NotNull SecureHash leaf, @NotNull PartialTree node, @NotNull List<Boolean> path) {
        if (node instanceof IncludedLeaf) {
            return ((IncludedLeaf) node).getHash().equals(leaf);
        } else if (node instanceof Node) {
            final Node branch = (Node) node;
            if (leafIndexHelper(leaf, branch.getLeft(), path)) {
                path.add(false);
                return true;
            }
            if (leafIndexHelper(leaf, branch.getRight(), path)) {
                path.add(true);
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        return this == o || (o instanceof PartialMerkleTree && root.equals(((PartialMerkleTree) o).root));
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }
}
