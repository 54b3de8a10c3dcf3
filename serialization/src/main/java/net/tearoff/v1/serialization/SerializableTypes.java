package net.tearoff.v1.serialization;

import net.tearoff.v1.base.annotations.TearoffSerializable;
import org.jetbrains.annotations.NotNull;

import java.security.PublicKey;

/**
 * Checks whether a class may be written to or read from component bytes.
 */
public final class SerializableTypes {

    private SerializableTypes() {
    }

    /**
     * A type is serializable if it is a {@link PublicKey}, or if it, one of its superclasses or one of the
     * interfaces it implements is annotated with {@link TearoffSerializable}.
     */
    public static boolean isSerializable(@NotNull Class<?> type) {
        if (PublicKey.class.isAssignableFrom(type)) {
            return true;
        }
        for (Class<?> current = type; current != null; current = current.getSuperclass()) {
            if (current.isAnnotationPresent(TearoffSerializable.class) || hasAnnotatedInterface(current)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasAnnotatedInterface(@NotNull Class<?> type) {
        for (Class<?> iface : type.getInterfaces()) {
            if (iface.isAnnotationPresent(TearoffSerializable.class) || hasAnnotatedInterface(iface)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @throws SerializationException if {@code type} is not serializable.
     */
    public static void requireSerializable(@NotNull Class<?> type) {
        if (!isSerializable(type)) {
            throw new SerializationException("Class " + type.getName() + " is not annotated with @TearoffSerializable");
        }
    }
}
