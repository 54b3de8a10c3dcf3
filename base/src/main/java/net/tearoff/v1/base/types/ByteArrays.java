package net.tearoff.v1.base.types;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public final class ByteArrays {
    static void requireNotNull(@Nullable Object obj, @NotNull String message) {
        if (obj == null) {
            throw new IllegalArgumentException(message);
        }
    }

    private ByteArrays() {}

    /**
     * Returns a new array holding the bytes of every argument, in order.
     */
    @NotNull
    public static byte[] concatenate(@NotNull byte[]... arrays) {
        requireNotNull(arrays, "arrays may not be null");
        int length = 0;
        for (byte[] array : arrays) {
            length += array.length;
        }
        final byte[] result = new byte[length];
        int position = 0;
        for (byte[] array : arrays) {
            System.arraycopy(array, 0, result, position, array.length);
            position += array.length;
        }
        return result;
    }

    /**
     * Returns a new array of {@code size} bytes, each set to {@code value}.
     */
    @NotNull
    public static byte[] filled(int size, byte value) {
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative");
        }
        final byte[] result = new byte[size];
        java.util.Arrays.fill(result, value);
        return result;
    }

    /**
     * Converts this {@code byte[]} into a {@link String} of hexadecimal digits.
     */
    @NotNull
    public static String toHexString(@NotNull byte[] bytes) {
        requireNotNull(bytes, "bytes may not be null");
        return printHexBinary(bytes);
    }

    private static final char[] hexCode = "0123456789ABCDEF".toCharArray();

    @NotNull
    private static String printHexBinary(@NotNull byte[] data) {
        StringBuilder r = new StringBuilder(data.length * 2);
        for (byte b: data) {
            r.append(hexCode[(Byte.toUnsignedInt(b) >>> 4) & 0xF]);
            r.append(hexCode[Byte.toUnsignedInt(b) & 0xF]);
        }
        return r.toString();
    }

    /**
     * Converts this {@link String} of hexadecimal digits into a {@code byte[]}.
     * @throws IllegalArgumentException if the {@link String} contains incorrectly-encoded characters.
     */
    @NotNull
    public static byte[] parseAsHex(@NotNull String str) {
        requireNotNull(str, "str may not be null");
        int len = str.length();

        // "111" is not a valid hex encoding.
        if (len % 2 != 0) {
            throw new IllegalArgumentException("hexBinary needs to be even-length: " + str);
        }

        byte[] out = new byte[len / 2];
        for (int i = 0; i < len; i += 2) {
            int h = hexToBin(str.charAt(i));
            int l = hexToBin(str.charAt(i + 1));
            if (h == -1 || l == -1) {
                throw new IllegalArgumentException("contains illegal character for hexBinary: " + str);
            }
            out[i / 2] = (byte) (h * 16 + l);
        }
        return out;
    }

    private static int hexToBin(char ch) {
        if (ch >= '0' && ch <= '9') {
            return ch - '0';
        }
        if (ch >= 'A' && ch <= 'F') {
            return ch - 'A' + 10;
        }
        return (ch >= 'a' && ch <= 'f') ? ch - 'a' + 10 : -1;
    }
}
