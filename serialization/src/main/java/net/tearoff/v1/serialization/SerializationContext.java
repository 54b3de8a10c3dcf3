package net.tearoff.v1.serialization;

import net.tearoff.v1.crypto.SecureHash;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parameters of a deserialization call.
 * <p>
 * The default context has no attachments and can only read platform types. The attachments-aware context,
 * obtained with {@link #withAttachments(List)}, can additionally resolve application types provided by the
 * listed attachments. Instances are immutable.
 */
public final class SerializationContext {

    private final AttachmentTypeRegistry attachmentTypeRegistry;
    private final List<SecureHash> attachments;

    public SerializationContext(@NotNull AttachmentTypeRegistry attachmentTypeRegistry) {
        this(attachmentTypeRegistry, List.of());
    }

    private SerializationContext(@NotNull AttachmentTypeRegistry attachmentTypeRegistry, @NotNull List<SecureHash> attachments) {
        this.attachmentTypeRegistry = attachmentTypeRegistry;
        this.attachments = List.copyOf(attachments);
    }

    /**
     * Returns a context able to resolve the types provided by {@code attachments}.
     */
    @NotNull
    public SerializationContext withAttachments(@NotNull List<SecureHash> attachments) {
        return new SerializationContext(attachmentTypeRegistry, attachments);
    }

    @NotNull
    public List<SecureHash> getAttachments() {
        return attachments;
    }

    /**
     * Resolves the class named {@code typeName} among the types provided by this context's attachments.
     *
     * @param typeName The binary name of the class.
     * @param baseType The type the resolved class must be assignable to.
     * @throws MissingAttachmentsException if the type is not found and some attachments are unknown to the registry.
     * @throws SerializationException if the type is not found, not serializable or not a subtype of {@code baseType}.
     */
    @NotNull
    public Class<?> resolveType(@NotNull String typeName, @NotNull Class<?> baseType) {
        final List<SecureHash> missing = new ArrayList<>();
        for (SecureHash attachment : attachments) {
            final Set<Class<?>> types = attachmentTypeRegistry.getTypes(attachment);
            if (types == null) {
                missing.add(attachment);
                continue;
            }
            for (Class<?> type : types) {
                if (type.getName().equals(typeName)) {
                    if (!baseType.isAssignableFrom(type)) {
                        throw new SerializationException("Type " + typeName + " is not a " + baseType.getName());
                    }
                    SerializableTypes.requireSerializable(type);
                    return type;
                }
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingAttachmentsException(missing);
        }
        throw new SerializationException("Type " + typeName + " is not provided by any attachment of this context " + attachments);
    }
}
