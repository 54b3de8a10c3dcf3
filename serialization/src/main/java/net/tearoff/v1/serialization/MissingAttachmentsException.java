package net.tearoff.v1.serialization;

import net.tearoff.v1.crypto.SecureHash;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Thrown during deserialization to indicate that an attachment needed to resolve a component type is not known
 * to the {@link AttachmentTypeRegistry}.
 */
public class MissingAttachmentsException extends SerializationException {

    @NotNull
    private final List<SecureHash> ids;

    public MissingAttachmentsException(@NotNull List<SecureHash> ids) {
        super("Missing attachments: " + ids);
        this.ids = List.copyOf(ids);
    }

    /**
     * @return The ids of the attachments that could not be found.
     */
    @NotNull
    public List<SecureHash> getIds() {
        return ids;
    }
}
