package net.tearoff.v1.ledger.crypto;

import net.tearoff.v1.base.types.ByteArrays;
import net.tearoff.v1.base.types.OpaqueBytes;
import net.tearoff.v1.crypto.DigestAlgorithmName;
import net.tearoff.v1.crypto.DigestService;
import net.tearoff.v1.crypto.DigestServiceUtils;
import net.tearoff.v1.crypto.SecureHash;
import net.tearoff.v1.crypto.merkle.MerkleTree;
import net.tearoff.v1.ledger.transactions.PrivacySalt;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.ByteBuffer;
import java.text.MessageFormat;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static net.tearoff.v1.crypto.DigestAlgorithmName.SHA2_256;
import static net.tearoff.v1.crypto.DigestAlgorithmName.SHA2_256D;
import static net.tearoff.v1.crypto.DigestAlgorithmName.SHA2_384;
import static net.tearoff.v1.crypto.DigestAlgorithmName.SHA2_512;

/**
 * The digest algorithms a transaction commits to its components with, and the commitment operations built on them.
 * <ul>
 *     <li>{@code tree}: internal nodes of the group and top level Merkle trees, and the all-ones sentinel.</li>
 *     <li>{@code componentHash}: the salted hash of each component, which is a Merkle leaf.</li>
 *     <li>{@code componentNonce}: the nonce derived for each component from the privacy salt.</li>
 * </ul>
 * The defaults are SHA-256 for the tree and double SHA-256 for component hashes and nonces.
 */
public final class TransactionDigestAlgorithmNames {

    private static final Set<DigestAlgorithmName> SUPPORTED_ALGORITHMS = Set.of(SHA2_256, SHA2_256D, SHA2_384, SHA2_512);

    @NotNull
    private final DigestAlgorithmName treeAlgorithm;

    @NotNull
    private final DigestAlgorithmName componentHashAlgorithm;

    @NotNull
    private final DigestAlgorithmName componentNonceAlgorithm;

    public TransactionDigestAlgorithmNames() {
        this(SHA2_256, SHA2_256D, SHA2_256D);
    }

    /**
     * @throws IllegalArgumentException if one of the algorithms is not supported.
     */
    public TransactionDigestAlgorithmNames(
            @NotNull DigestAlgorithmName treeAlgorithm,
            @NotNull DigestAlgorithmName componentHashAlgorithm,
            @NotNull DigestAlgorithmName componentNonceAlgorithm
    ) {
        this.treeAlgorithm = requireSupported(treeAlgorithm);
        this.componentHashAlgorithm = requireSupported(componentHashAlgorithm);
        this.componentNonceAlgorithm = requireSupported(componentNonceAlgorithm);
    }

    @NotNull
    private static DigestAlgorithmName requireSupported(@NotNull DigestAlgorithmName algorithm) {
        if (!SUPPORTED_ALGORITHMS.contains(algorithm)) {
            throw new IllegalArgumentException(algorithm + " is not a supported transaction digest algorithm");
        }
        return algorithm;
    }

    @NotNull
    public DigestAlgorithmName getTreeAlgorithm() {
        return treeAlgorithm;
    }

    @NotNull
    public DigestAlgorithmName getComponentHashAlgorithm() {
        return componentHashAlgorithm;
    }

    @NotNull
    public DigestAlgorithmName getComponentNonceAlgorithm() {
        return componentNonceAlgorithm;
    }

    public boolean isAlgorithmSupported(@NotNull String algorithm) {
        return SUPPORTED_ALGORITHMS.contains(new DigestAlgorithmName(algorithm));
    }

    /**
     * Hashes {@code bytes} with the tree algorithm.
     */
    @NotNull
    public SecureHash hash(@NotNull byte[] bytes, @NotNull DigestService digestService) {
        return digestService.hash(bytes, treeAlgorithm);
    }

    /**
     * Builds a Merkle tree over {@code hashes}, hashing internal nodes with the tree algorithm.
     */
    @NotNull
    public MerkleTree getMerkleTree(@NotNull List<SecureHash> hashes, @NotNull DigestService digestService) {
        return MerkleTree.getMerkleTree(hashes, treeAlgorithm, digestService);
    }

    /**
     * @return The hash of {@code nonce} followed by {@code component}, with the component hash algorithm.
     */
    @NotNull
    public SecureHash componentHash(@NotNull SecureHash nonce, @NotNull OpaqueBytes component, @NotNull DigestService digestService) {
        return digestService.hash(ByteArrays.concatenate(nonce.getBytes(), component.getBytes()), componentHashAlgorithm);
    }

    /**
     * Derives the nonce of the component at {@code internalIndex} of group {@code groupIndex}: the hash of the salt
     * followed by both indexes as big-endian 32 bit integers.
     */
    @NotNull
    public SecureHash computeNonce(@NotNull PrivacySalt privacySalt, int groupIndex, int internalIndex, @NotNull DigestService digestService) {
        final byte[] salt = privacySalt.getBytes();
        final byte[] input = ByteBuffer.allocate(salt.length + 2 * Integer.BYTES)
                .put(salt)
                .putInt(groupIndex)
                .putInt(internalIndex)
                .array();
        return digestService.hash(input, componentNonceAlgorithm);
    }

    /**
     * @return The hash standing in for a group that is absent from a transaction.
     */
    @NotNull
    public SecureHash allOnesHash(@NotNull DigestService digestService) {
        return DigestServiceUtils.getAllOnesHash(digestService, treeAlgorithm);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final TransactionDigestAlgorithmNames that = (TransactionDigestAlgorithmNames) o;
        return treeAlgorithm.equals(that.treeAlgorithm)
                && componentHashAlgorithm.equals(that.componentHashAlgorithm)
                && componentNonceAlgorithm.equals(that.componentNonceAlgorithm);
    }

    @Override
    public int hashCode() {
        return Objects.hash(treeAlgorithm, componentHashAlgorithm, componentNonceAlgorithm);
    }

    @Override
    public String toString() {
        return MessageFormat.format(
                "TransactionDigestAlgorithmNames(tree={0}, componentHash={1}, componentNonce={2})",
                treeAlgorithm, componentHashAlgorithm, componentNonceAlgorithm
        );
    }
}
