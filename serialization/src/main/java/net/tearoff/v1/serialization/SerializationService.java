package net.tearoff.v1.serialization;

import net.tearoff.v1.base.types.ByteSequence;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Converts transaction components to and from bytes. Implementations are thread safe.
 */
public interface SerializationService {

    /**
     * The context for platform types, without attachments.
     */
    @NotNull
    SerializationContext getDefaultContext();

    /**
     * Serializes {@code obj}, which must be serializable (see {@link SerializableTypes}), or a list of such objects.
     *
     * @throws SerializationException if the object cannot be serialized.
     */
    @NotNull
    <T> SerializedBytes<T> serialize(@NotNull T obj);

    /**
     * Deserializes {@code bytes} into an instance of {@code clazz}.
     *
     * @throws MissingAttachmentsException if the type of a nested value needs an attachment the registry does not know.
     * @throws SerializationException if the bytes cannot be deserialized into {@code clazz}.
     */
    @NotNull
    <T> T deserialize(@NotNull ByteSequence bytes, @NotNull Class<T> clazz, @NotNull SerializationContext context);

    /**
     * Deserializes {@code bytes} into a list of {@code elementClass} instances.
     *
     * @throws MissingAttachmentsException if the type of a nested value needs an attachment the registry does not know.
     * @throws SerializationException if the bytes cannot be deserialized into such a list.
     */
    @NotNull
    <T> List<T> deserializeList(@NotNull ByteSequence bytes, @NotNull Class<T> elementClass, @NotNull SerializationContext context);
}
