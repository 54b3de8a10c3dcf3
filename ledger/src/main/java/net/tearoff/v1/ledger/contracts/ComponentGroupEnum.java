package net.tearoff.v1.ledger.contracts;

import net.tearoff.v1.crypto.SecureHash;
import net.tearoff.v1.ledger.identity.Party;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.security.PublicKey;

/**
 * The known component groups of a transaction. A group's index in a transaction is the ordinal of its constant.
 * Groups with higher indexes are unknown to this version and are carried as opaque bytes.
 */
public enum ComponentGroupEnum {

    INPUTS_GROUP(StateRef.class, false, false),
    OUTPUTS_GROUP(TransactionState.class, true, false),
    COMMANDS_GROUP(CommandData.class, true, false),
    ATTACHMENTS_GROUP(SecureHash.class, false, false),
    NOTARY_GROUP(Party.class, false, true),
    TIMEWINDOW_GROUP(TimeWindow.class, false, true),
    /**
     * Each component is the list of keys required to sign the command at the same position.
     */
    SIGNERS_GROUP(PublicKey.class, false, false),
    REFERENCES_GROUP(StateRef.class, false, false);

    private final Class<?> componentType;
    private final boolean attachmentsContextRequired;
    private final boolean singleton;

    ComponentGroupEnum(@NotNull Class<?> componentType, boolean attachmentsContextRequired, boolean singleton) {
        this.componentType = componentType;
        this.attachmentsContextRequired = attachmentsContextRequired;
        this.singleton = singleton;
    }

    /**
     * @return The type a component of this group deserializes to. For {@link #SIGNERS_GROUP} this is the element
     * type of the list each component holds.
     */
    @NotNull
    public Class<?> getComponentType() {
        return componentType;
    }

    /**
     * @return Whether the components name application types that are resolved through the transaction's attachments.
     */
    public boolean isAttachmentsContextRequired() {
        return attachmentsContextRequired;
    }

    /**
     * @return Whether a transaction may carry at most one component in this group.
     */
    public boolean isSingleton() {
        return singleton;
    }

    /**
     * @return The known group at {@code groupIndex}, or null if the index belongs to an unknown group.
     */
    @Nullable
    public static ComponentGroupEnum fromIndex(int groupIndex) {
        final ComponentGroupEnum[] values = values();
        return groupIndex >= 0 && groupIndex < values.length ? values[groupIndex] : null;
    }

    /**
     * @return A readable name for the group at {@code groupIndex}, known or not.
     */
    @NotNull
    public static String describe(int groupIndex) {
        final ComponentGroupEnum group = fromIndex(groupIndex);
        return group == null ? "group " + groupIndex : group.name();
    }
}
