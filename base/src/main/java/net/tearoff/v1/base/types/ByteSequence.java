package net.tearoff.v1.base.types;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.ByteArrayInputStream;
import java.util.Arrays;

import static net.tearoff.v1.base.types.ByteArrays.requireNotNull;
import static net.tearoff.v1.base.types.ByteArrays.toHexString;

/**
 * Bytes held behind an immutable view. Equality, hash code and ordering consider the content only, so sequences
 * of different subclasses holding the same bytes are equal.
 */
public abstract class ByteSequence implements Comparable<ByteSequence> {
    private final byte[] content;

    /**
     * @param content Taken over as is. Callers pass an array nobody else holds.
     */
    ByteSequence(@NotNull byte[] content) {
        requireNotNull(content, "content must not be null");
        this.content = content;
    }

    public final int getSize() {
        return content.length;
    }

    /**
     * The underlying bytes. Implementations return a copy, see {@link OpaqueBytes}.
     */
    @NotNull
    public abstract byte[] getBytes();

    @NotNull
    public final ByteArrayInputStream open() {
        return new ByteArrayInputStream(content);
    }

    @NotNull
    public final byte[] copyBytes() {
        return content.clone();
    }

    /**
     * Compares unsigned bytes in order. A sequence that is a prefix of another sorts first.
     */
    @Override
    public int compareTo(@NotNull ByteSequence other) {
        return Integer.signum(Arrays.compareUnsigned(content, other.content));
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ByteSequence)) return false;
        return Arrays.equals(content, ((ByteSequence) obj).content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    @NotNull
    public String toString() {
        return '[' + toHexString(content) + ']';
    }
}
