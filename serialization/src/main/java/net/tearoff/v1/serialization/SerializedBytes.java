package net.tearoff.v1.serialization;

import net.tearoff.v1.base.types.OpaqueBytes;
import org.jetbrains.annotations.NotNull;

/**
 * A type safe wrapper around a byte array that contains a serialised object.
 */
@SuppressWarnings("unused")
public final class SerializedBytes<T> extends OpaqueBytes {

    public SerializedBytes(@NotNull byte[] bytes) {
        super(bytes);
    }
}
