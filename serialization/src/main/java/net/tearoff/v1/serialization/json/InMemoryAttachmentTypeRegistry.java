package net.tearoff.v1.serialization.json;

import net.tearoff.v1.crypto.SecureHash;
import net.tearoff.v1.serialization.AttachmentTypeRegistry;
import net.tearoff.v1.serialization.SerializableTypes;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * An {@link AttachmentTypeRegistry} populated by the caller.
 */
public final class InMemoryAttachmentTypeRegistry implements AttachmentTypeRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryAttachmentTypeRegistry.class);

    private final Map<SecureHash, Set<Class<?>>> types = new ConcurrentHashMap<>();

    /**
     * Records that {@code attachmentId} provides {@code attachmentTypes}, replacing any previous registration.
     *
     * @throws net.tearoff.v1.serialization.SerializationException if one of the types is not serializable.
     */
    @NotNull
    public InMemoryAttachmentTypeRegistry register(@NotNull SecureHash attachmentId, @NotNull Set<Class<?>> attachmentTypes) {
        attachmentTypes.forEach(SerializableTypes::requireSerializable);
        types.put(attachmentId, Set.copyOf(attachmentTypes));
        LOGGER.trace("Registered {} types for attachment {}", attachmentTypes.size(), attachmentId);
        return this;
    }

    @Override
    @Nullable
    public Set<Class<?>> getTypes(@NotNull SecureHash attachmentId) {
        return types.get(attachmentId);
    }
}
