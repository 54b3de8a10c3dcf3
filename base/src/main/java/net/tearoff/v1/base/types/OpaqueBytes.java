package net.tearoff.v1.base.types;

import net.tearoff.v1.base.annotations.TearoffSerializable;
import org.jetbrains.annotations.NotNull;

/**
 * A simple class that wraps a byte array and makes the equals/hashCode/toString methods work as you actually expect.
 * Transaction components travel in this form: the library hashes and compares them, but never interprets them
 * unless it is asked for a typed view.
 */
@TearoffSerializable
public class OpaqueBytes extends ByteSequence {

    /**
     * Create {@link OpaqueBytes} from a sequence of {@code byte} values.
     */
    @NotNull
    public static OpaqueBytes of(@NotNull byte... b) {
        return new OpaqueBytes(b);
    }

    public OpaqueBytes(@NotNull byte[] bytes) {
        super(bytes.clone());
        if (bytes.length == 0) {
            throw new IllegalArgumentException("Byte Array must not be empty");
        }
    }

    /**
     * @return A copy of the wrapped bytes.
     */
    @Override
    @NotNull
    public final byte[] getBytes() {
        return copyBytes();
    }
}
