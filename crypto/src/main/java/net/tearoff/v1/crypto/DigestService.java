package net.tearoff.v1.crypto;

import org.jetbrains.annotations.NotNull;

/**
 * Computes {@link SecureHash} values. Implementations must be stateless and thread safe.
 */
public interface DigestService {

    /**
     * Computes the digest of the {@code bytes}.
     *
     * @param bytes The bytes to hash.
     * @param digestAlgorithmName The digest algorithm to be used for hashing.
     * @throws IllegalArgumentException if the algorithm is not supported.
     */
    @NotNull
    SecureHash hash(@NotNull byte[] bytes, @NotNull DigestAlgorithmName digestAlgorithmName);

    /**
     * Returns the length in bytes of digests produced by the given algorithm.
     *
     * @throws IllegalArgumentException if the algorithm is not supported.
     */
    int digestLength(@NotNull DigestAlgorithmName digestAlgorithmName);
}
