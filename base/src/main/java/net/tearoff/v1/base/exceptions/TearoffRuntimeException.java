package net.tearoff.v1.base.exceptions;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Base class for all exceptions raised by the library for runtime error conditions.
 * <p>
 * None of the subclasses describe transient conditions: they signal malformed input or a failed
 * cryptographic check, so retrying the same operation on the same data gives the same result.
 */
public class TearoffRuntimeException extends RuntimeException {

    /**
     * Constructor with just a message (creating a fresh exception).
     */
    public TearoffRuntimeException(@Nullable String message) {
        super(message);
    }

    /**
     * Constructor with a message and a cause, for wrapping a lower level failure with context.
     */
    public TearoffRuntimeException(@Nullable String message, @Nullable Throwable cause) {
        super(message, cause);
    }

    /**
     * Adds every element of {@code suppressed} as a suppressed exception of this one.
     */
    public void addSuppressed(@NotNull Throwable[] suppressed) {
        if (suppressed == null) {
            throw new IllegalArgumentException("suppressed must not be null");
        }
        for (Throwable suppress : suppressed) {
            addSuppressed(suppress);
        }
    }
}
