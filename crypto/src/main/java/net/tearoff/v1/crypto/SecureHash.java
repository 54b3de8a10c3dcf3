package net.tearoff.v1.crypto;

import net.tearoff.v1.base.annotations.TearoffSerializable;
import net.tearoff.v1.base.types.ByteArrays;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * A cryptographically secure hash value, computed by a specified digest algorithm ({@link DigestAlgorithmName}).
 * A {@link SecureHash} is normally obtained from a {@link DigestService}.
 */
@TearoffSerializable
public final class SecureHash {
    /**
     * The delimiter used in the string form of a secure hash to separate the algorithm name from the hexadecimal
     * string of the hash.
     * <p>
     * Algorithm names may only match the regex [a-zA-Z_][a-zA-Z_0-9\-/]* so ':' is a safe separator.
     */
    public static final char DELIMITER = ':';

    private final String algorithm;
    private final byte[] bytes;

    public SecureHash(@NotNull String algorithm, @NotNull byte[] bytes) {
        if (algorithm == null || algorithm.isBlank()) {
            throw new IllegalArgumentException("Hash algorithm name unavailable or not specified");
        }
        if (bytes == null || bytes.length == 0) {
            throw new IllegalArgumentException("Hash bytes must not be empty");
        }
        this.algorithm = algorithm;
        this.bytes = bytes.clone();
    }

    /**
     * Parses a string of the form {@code ALGORITHM:HEX}, as produced by {@link #toString()}.
     *
     * @throws IllegalArgumentException if the string is not a valid secure hash.
     */
    @NotNull
    public static SecureHash parse(@NotNull String str) {
        final int idx = str.indexOf(DELIMITER);
        if (idx == -1) {
            throw new IllegalArgumentException("Provided string: " + str + " should be of format algorithm:hexadecimal");
        }
        final String algorithm = str.substring(0, idx);
        final String value = str.substring(idx + 1);
        return new SecureHash(algorithm, ByteArrays.parseAsHex(value));
    }

    /**
     * Hashing algorithm which was used to generate the hash.
     */
    @NotNull
    public String getAlgorithm() {
        return algorithm;
    }

    /**
     * The result bytes of the hashing operation.
     */
    @NotNull
    public byte[] getBytes() {
        return bytes.clone();
    }

    public int getSize() {
        return bytes.length;
    }

    @NotNull
    public String toHexString() {
        return ByteArrays.toHexString(bytes);
    }

    @Override
    public boolean equals(@Nullable Object other) {
        if (this == other) return true;
        if (!(other instanceof SecureHash)) return false;
        final SecureHash that = (SecureHash) other;
        return algorithm.equals(that.algorithm) && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * algorithm.hashCode() + Arrays.hashCode(bytes);
    }

    /**
     * Example: SHA-256:98AF8725385586B41FEFF205B4E05A000823F78B5F8F5C02439CE8F67A781D90
     */
    @Override
    @NotNull
    public String toString() {
        return algorithm + DELIMITER + toHexString();
    }
}
