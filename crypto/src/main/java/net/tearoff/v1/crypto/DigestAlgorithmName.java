package net.tearoff.v1.crypto;

import net.tearoff.v1.base.annotations.TearoffSerializable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The digest algorithm name, as used throughout the hashing API.
 */
@TearoffSerializable
public final class DigestAlgorithmName {
    private final String name;

    public DigestAlgorithmName(@NotNull String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Hash algorithm name unavailable or not specified");
        this.name = name;
    }

    /**
     * Instance of SHA-256
     */
    @NotNull
    public static final DigestAlgorithmName SHA2_256 = new DigestAlgorithmName("SHA-256");

    /**
     * Instance of Double SHA-256, that is SHA-256 applied to the SHA-256 digest.
     */
    @NotNull
    public static final DigestAlgorithmName SHA2_256D = new DigestAlgorithmName("SHA-256D");

    /**
     * Instance of SHA-384
     */
    @NotNull
    public static final DigestAlgorithmName SHA2_384 = new DigestAlgorithmName("SHA-384");

    /**
     * Instance of SHA-512
     */
    @NotNull
    public static final DigestAlgorithmName SHA2_512 = new DigestAlgorithmName("SHA-512");

    @NotNull
    public String getName() {
        return this.name;
    }

    @NotNull
    public String toString() {
        return this.name;
    }

    public int hashCode() {
        return this.name.toUpperCase().hashCode();
    }

    /**
     * Two names are equal when they match ignoring case.
     */
    public boolean equals(@Nullable Object other) {
        if (other == null) return false;
        if (this == other) return true;
        if (!(other instanceof DigestAlgorithmName)) return false;
        DigestAlgorithmName otherDigest = (DigestAlgorithmName) other;
        return this.name.equalsIgnoreCase(otherDigest.name);
    }
}
