package net.tearoff.v1.serialization;

import net.tearoff.v1.crypto.SecureHash;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Set;

/**
 * Knows which application types each attachment provides. The attachments-aware {@link SerializationContext}
 * consults it to resolve the concrete class of a polymorphic component such as a contract state or command.
 */
public interface AttachmentTypeRegistry {

    /**
     * @return The types provided by the attachment, or null if the attachment is unknown.
     */
    @Nullable
    Set<Class<?>> getTypes(@NotNull SecureHash attachmentId);
}
