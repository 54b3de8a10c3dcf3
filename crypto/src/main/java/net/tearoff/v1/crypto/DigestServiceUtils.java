package net.tearoff.v1.crypto;

import net.tearoff.v1.base.types.ByteArrays;
import org.jetbrains.annotations.NotNull;

/**
 * Constant hashes of a given algorithm. The zero hash pads Merkle trees and the all-ones hash stands for an
 * empty or absent component group.
 */
public final class DigestServiceUtils {
    private DigestServiceUtils() {
    }

    /**
     * Returns a hash of the given algorithm with all bytes set to 0x00.
     */
    @NotNull
    public static SecureHash getZeroHash(@NotNull DigestService digestService, @NotNull DigestAlgorithmName digestAlgorithmName) {
        return new SecureHash(digestAlgorithmName.getName(), ByteArrays.filled(digestService.digestLength(digestAlgorithmName), (byte) 0));
    }

    /**
     * Returns a hash of the given algorithm with all bytes set to 0xFF.
     */
    @NotNull
    public static SecureHash getAllOnesHash(@NotNull DigestService digestService, @NotNull DigestAlgorithmName digestAlgorithmName) {
        return new SecureHash(digestAlgorithmName.getName(), ByteArrays.filled(digestService.digestLength(digestAlgorithmName), (byte) 0xFF));
    }
}
