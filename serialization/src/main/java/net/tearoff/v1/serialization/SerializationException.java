package net.tearoff.v1.serialization;

import net.tearoff.v1.base.exceptions.TearoffRuntimeException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when an object cannot be serialized, or bytes cannot be deserialized into the requested type.
 */
public class SerializationException extends TearoffRuntimeException {

    public SerializationException(@NotNull String message) {
        super(message);
    }

    public SerializationException(@NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
