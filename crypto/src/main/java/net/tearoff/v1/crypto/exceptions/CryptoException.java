package net.tearoff.v1.crypto.exceptions;

import net.tearoff.v1.base.exceptions.TearoffRuntimeException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Base exception for crypto library specific failures. The library also throws common exceptions such as
 * {@link IllegalArgumentException} where they fit; this class is for the cases where the throwing site can add
 * useful context about the operation.
 */
public class CryptoException extends TearoffRuntimeException {

    public CryptoException(@NotNull String message) {
        super(message);
    }

    public CryptoException(@NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
