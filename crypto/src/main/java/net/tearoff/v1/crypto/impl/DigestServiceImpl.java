package net.tearoff.v1.crypto.impl;

import net.tearoff.v1.crypto.DigestAlgorithmName;
import net.tearoff.v1.crypto.DigestService;
import net.tearoff.v1.crypto.SecureHash;
import org.jetbrains.annotations.NotNull;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Set;

import static net.tearoff.v1.crypto.DigestAlgorithmName.SHA2_256;
import static net.tearoff.v1.crypto.DigestAlgorithmName.SHA2_256D;
import static net.tearoff.v1.crypto.DigestAlgorithmName.SHA2_384;
import static net.tearoff.v1.crypto.DigestAlgorithmName.SHA2_512;

/**
 * {@link DigestService} backed by the JCA {@link MessageDigest} implementations.
 * <p>
 * SHA-256D is computed as SHA-256 over the SHA-256 digest. A new {@link MessageDigest} is created per call, so
 * instances may be shared between threads.
 */
public final class DigestServiceImpl implements DigestService {

    public static final Set<DigestAlgorithmName> SUPPORTED_ALGORITHMS = Set.of(SHA2_256, SHA2_256D, SHA2_384, SHA2_512);

    @Override
    @NotNull
    public SecureHash hash(@NotNull byte[] bytes, @NotNull DigestAlgorithmName digestAlgorithmName) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes must not be null");
        }
        return new SecureHash(digestAlgorithmName.getName(), digest(bytes, digestAlgorithmName));
    }

    @Override
    public int digestLength(@NotNull DigestAlgorithmName digestAlgorithmName) {
        if (SHA2_256D.equals(digestAlgorithmName)) {
            return messageDigest(SHA2_256).getDigestLength();
        }
        return messageDigest(digestAlgorithmName).getDigestLength();
    }

    @NotNull
    private static byte[] digest(@NotNull byte[] bytes, @NotNull DigestAlgorithmName digestAlgorithmName) {
        if (SHA2_256D.equals(digestAlgorithmName)) {
            return messageDigest(SHA2_256).digest(messageDigest(SHA2_256).digest(bytes));
        }
        return messageDigest(digestAlgorithmName).digest(bytes);
    }

    @NotNull
    private static MessageDigest messageDigest(@NotNull DigestAlgorithmName digestAlgorithmName) {
        if (!SUPPORTED_ALGORITHMS.contains(digestAlgorithmName)) {
            throw new IllegalArgumentException("Unsupported digest algorithm: " + digestAlgorithmName);
        }
        try {
            return MessageDigest.getInstance(digestAlgorithmName.getName());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Digest algorithm " + digestAlgorithmName + " is not available", e);
        }
    }
}
