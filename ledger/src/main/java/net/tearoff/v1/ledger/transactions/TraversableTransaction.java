package net.tearoff.v1.ledger.transactions;

import net.tearoff.v1.base.annotations.DoNotImplement;
import net.tearoff.v1.base.types.OpaqueBytes;
import net.tearoff.v1.crypto.DigestService;
import net.tearoff.v1.crypto.SecureHash;
import net.tearoff.v1.ledger.contracts.Command;
import net.tearoff.v1.ledger.contracts.CommandData;
import net.tearoff.v1.ledger.contracts.ComponentGroupEnum;
import net.tearoff.v1.ledger.contracts.ContractState;
import net.tearoff.v1.ledger.contracts.StateRef;
import net.tearoff.v1.ledger.contracts.TimeWindow;
import net.tearoff.v1.ledger.contracts.TransactionState;
import net.tearoff.v1.ledger.crypto.TransactionDigestAlgorithmNames;
import net.tearoff.v1.ledger.identity.Party;
import net.tearoff.v1.serialization.MissingAttachmentsException;
import net.tearoff.v1.serialization.SerializationContext;
import net.tearoff.v1.serialization.SerializationException;
import net.tearoff.v1.serialization.SerializationService;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.security.PublicKey;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.ATTACHMENTS_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.COMMANDS_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.INPUTS_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.NOTARY_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.OUTPUTS_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.REFERENCES_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.SIGNERS_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.TIMEWINDOW_GROUP;

/**
 * A transaction whose component groups can be read as typed values.
 * <p>
 * Components are deserialised on first access and the result is kept, so each component is deserialised at most
 * once per transaction (save for concurrent first reads). A group that is absent, or present with no components,
 * reads as an empty list. Outputs and commands are resolved with a serialization context listing the transaction's
 * visible attachments.
 */
@DoNotImplement
public abstract class TraversableTransaction {

    @NotNull
    private final List<ComponentGroup> componentGroups;

    @NotNull
    private final NavigableMap<Integer, ComponentGroup> groupsByIndex;

    @NotNull
    private final TransactionDigestAlgorithmNames transactionDigestAlgorithmNames;

    @NotNull
    private final DigestService digestService;

    @NotNull
    private final SerializationService serializationService;

    @NotNull
    private final DeserializedComponentCache cache;

    /**
     * @throws MalformedTransactionException if a group index is negative or appears more than once.
     */
    protected TraversableTransaction(
            @NotNull List<? extends ComponentGroup> componentGroups,
            @NotNull TransactionDigestAlgorithmNames transactionDigestAlgorithmNames,
            @NotNull DigestService digestService,
            @NotNull SerializationService serializationService
    ) {
        this.componentGroups = List.copyOf(componentGroups);
        this.groupsByIndex = indexGroups(this.componentGroups);
        this.transactionDigestAlgorithmNames = transactionDigestAlgorithmNames;
        this.digestService = digestService;
        this.serializationService = serializationService;
        this.cache = new DeserializedComponentCache(this.componentGroups);
    }

    @NotNull
    private static NavigableMap<Integer, ComponentGroup> indexGroups(@NotNull List<ComponentGroup> componentGroups) {
        final NavigableMap<Integer, ComponentGroup> byIndex = new TreeMap<>();
        for (ComponentGroup group : componentGroups) {
            if (group.getGroupIndex() < 0) {
                throw new MalformedTransactionException(
                        "Invalid Transaction. Negative component group index " + group.getGroupIndex() + " detected.",
                        group.getGroupIndex(), null, null);
            }
            if (byIndex.putIfAbsent(group.getGroupIndex(), group) != null) {
                throw new MalformedTransactionException(
                        "Invalid Transaction. Duplicated component group " + ComponentGroupEnum.describe(group.getGroupIndex()) + " detected.",
                        group.getGroupIndex(), null, null);
            }
        }
        return Collections.unmodifiableNavigableMap(byIndex);
    }

    /**
     * @return The id of the transaction: the root of the Merkle tree over its group hashes.
     */
    @NotNull
    public abstract SecureHash getId();

    @NotNull
    public List<ComponentGroup> getComponentGroups() {
        return componentGroups;
    }

    /**
     * @return The group at {@code groupIndex}, or null if the transaction has none.
     */
    @Nullable
    public ComponentGroup getComponentGroup(int groupIndex) {
        return groupsByIndex.get(groupIndex);
    }

    @NotNull
    public TransactionDigestAlgorithmNames getTransactionDigestAlgorithmNames() {
        return transactionDigestAlgorithmNames;
    }

    @NotNull
    protected DigestService getDigestService() {
        return digestService;
    }

    @NotNull
    protected SerializationService getSerializationService() {
        return serializationService;
    }

    @NotNull
    public List<StateRef> getInputs() {
        return deserializeGroup(INPUTS_GROUP);
    }

    @NotNull
    public List<TransactionState<ContractState>> getOutputs() {
        return deserializeGroup(OUTPUTS_GROUP);
    }

    /**
     * @return The command data, in the order of the commands group, without signers.
     */
    @NotNull
    public List<CommandData> getCommandData() {
        return deserializeGroup(COMMANDS_GROUP);
    }

    /**
     * @return For each entry of the signers group, the keys required to sign the command at the same position of the
     * full transaction.
     */
    @NotNull
    public List<List<PublicKey>> getSigners() {
        return deserializeGroup(SIGNERS_GROUP);
    }

    /**
     * @return The commands, each paired with its signers.
     * @throws MalformedTransactionException if the commands cannot be paired with the signers.
     */
    @NotNull
    public List<Command<?>> getCommands() {
        return pairCommandsWithSigners(getCommandData(), getSigners());
    }

    /**
     * Pairs each command data with the signers of the same command in the full transaction.
     *
     * @throws MalformedTransactionException if the pairing is not possible.
     */
    @NotNull
    protected abstract List<Command<?>> pairCommandsWithSigners(
            @NotNull List<CommandData> commandData,
            @NotNull List<List<PublicKey>> signers
    );

    @NotNull
    public List<SecureHash> getAttachments() {
        return deserializeGroup(ATTACHMENTS_GROUP);
    }

    @Nullable
    public Party getNotary() {
        final List<Party> notaries = deserializeGroup(NOTARY_GROUP);
        checkSingleton(notaries, NOTARY_GROUP, "Invalid Transaction. More than 1 notary party detected.");
        return notaries.isEmpty() ? null : notaries.get(0);
    }

    @Nullable
    public TimeWindow getTimeWindow() {
        final List<TimeWindow> timeWindows = deserializeGroup(TIMEWINDOW_GROUP);
        checkSingleton(timeWindows, TIMEWINDOW_GROUP, "Invalid Transaction. More than 1 time-window detected.");
        return timeWindows.isEmpty() ? null : timeWindows.get(0);
    }

    @NotNull
    public List<StateRef> getReferences() {
        return deserializeGroup(REFERENCES_GROUP);
    }

    /**
     * @return The groups this version does not know, in ascending index order.
     */
    @NotNull
    public List<ComponentGroup> getUnknownComponentGroups() {
        return List.copyOf(groupsByIndex.tailMap(ComponentGroupEnum.values().length, true).values());
    }

    /**
     * @return The typed components of the transaction: inputs, outputs, commands, attachments and references,
     * followed by the notary and the time-window when they are present.
     */
    @NotNull
    public List<List<Object>> getAvailableComponentGroups() {
        final List<List<Object>> result = new ArrayList<>();
        result.add(new ArrayList<>(getInputs()));
        result.add(new ArrayList<>(getOutputs()));
        result.add(new ArrayList<>(getCommands()));
        result.add(new ArrayList<>(getAttachments()));
        result.add(new ArrayList<>(getReferences()));
        final Party notary = getNotary();
        if (notary != null) {
            result.add(List.of(notary));
        }
        final TimeWindow timeWindow = getTimeWindow();
        if (timeWindow != null) {
            result.add(List.of(timeWindow));
        }
        return Collections.unmodifiableList(result);
    }

    private static void checkSingleton(@NotNull List<?> components, @NotNull ComponentGroupEnum group, @NotNull String message) {
        if (components.size() > 1) {
            throw new MalformedTransactionException(message, group.ordinal(), null, null);
        }
    }

    @NotNull
    private <T> List<T> deserializeGroup(@NotNull ComponentGroupEnum group) {
        final ComponentGroup componentGroup = getComponentGroup(group.ordinal());
        if (componentGroup == null || componentGroup.getComponents().isEmpty()) {
            return List.of();
        }
        final SerializationContext context = group.isAttachmentsContextRequired()
                ? serializationService.getDefaultContext().withAttachments(getAttachments())
                : serializationService.getDefaultContext();
        final List<OpaqueBytes> components = componentGroup.getComponents();
        final List<T> result = new ArrayList<>(components.size());
        for (int internalIndex = 0; internalIndex < components.size(); internalIndex++) {
            final int index = internalIndex;
            result.add(cache.get(group.ordinal(), index, () -> deserializeComponent(group, components.get(index), index, context)));
        }
        return Collections.unmodifiableList(result);
    }

    @SuppressWarnings("unchecked")
    @NotNull
    private <T> T deserializeComponent(
            @NotNull ComponentGroupEnum group,
            @NotNull OpaqueBytes component,
            int internalIndex,
            @NotNull SerializationContext context
    ) {
        try {
            if (group == SIGNERS_GROUP) {
                return (T) serializationService.deserializeList(component, PublicKey.class, context);
            }
            return (T) serializationService.deserialize(component, group.getComponentType(), context);
        } catch (MissingAttachmentsException e) {
            throw e;
        } catch (SerializationException e) {
            throw new MalformedTransactionException(
                    "Malformed transaction, " + group + " at index " + internalIndex + " cannot be deserialised",
                    group.ordinal(), internalIndex, e);
        }
    }
}
