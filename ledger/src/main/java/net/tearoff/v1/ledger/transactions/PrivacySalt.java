package net.tearoff.v1.ledger.transactions;

import net.tearoff.v1.base.annotations.TearoffSerializable;
import net.tearoff.v1.base.types.OpaqueBytes;
import org.jetbrains.annotations.NotNull;

import java.security.SecureRandom;

/**
 * The random secret from which every component nonce of a transaction is derived. It keeps the hashes of hidden
 * components from being guessed.
 */
@TearoffSerializable
public final class PrivacySalt extends OpaqueBytes {

    public static final int SIZE = 32;

    private static final SecureRandom RANDOM = new SecureRandom();

    /**
     * Creates a salt from {@link #SIZE} random bytes.
     */
    public PrivacySalt() {
        this(randomBytes());
    }

    /**
     * @throws IllegalArgumentException if {@code bytes} is not {@link #SIZE} long, or is all zeros.
     */
    public PrivacySalt(@NotNull byte[] bytes) {
        super(bytes);
        if (bytes.length != SIZE) {
            throw new IllegalArgumentException("Privacy salt should be " + SIZE + " bytes, but was " + bytes.length);
        }
        if (isAllZeros(bytes)) {
            throw new IllegalArgumentException("Privacy salt should not be all zeros.");
        }
    }

    @NotNull
    private static byte[] randomBytes() {
        final byte[] bytes = new byte[SIZE];
        do {
            RANDOM.nextBytes(bytes);
        } while (isAllZeros(bytes));
        return bytes;
    }

    private static boolean isAllZeros(@NotNull byte[] bytes) {
        for (byte b : bytes) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }
}
