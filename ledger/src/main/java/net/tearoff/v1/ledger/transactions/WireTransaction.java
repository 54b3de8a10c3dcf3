package net.tearoff.v1.ledger.transactions;

import net.tearoff.v1.base.types.OpaqueBytes;
import net.tearoff.v1.crypto.DigestService;
import net.tearoff.v1.crypto.SecureHash;
import net.tearoff.v1.crypto.merkle.MerkleTree;
import net.tearoff.v1.ledger.contracts.Command;
import net.tearoff.v1.ledger.contracts.CommandData;
import net.tearoff.v1.ledger.contracts.ComponentGroupEnum;
import net.tearoff.v1.ledger.contracts.StateRef;
import net.tearoff.v1.ledger.contracts.TimeWindow;
import net.tearoff.v1.ledger.contracts.TransactionState;
import net.tearoff.v1.ledger.crypto.TransactionDigestAlgorithmNames;
import net.tearoff.v1.ledger.identity.Party;
import net.tearoff.v1.serialization.SerializationService;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.PublicKey;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.ATTACHMENTS_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.COMMANDS_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.INPUTS_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.NOTARY_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.OUTPUTS_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.REFERENCES_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.SIGNERS_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.TIMEWINDOW_GROUP;

/**
 * A complete transaction, with every component visible.
 * <p>
 * The commitment is computed once, at construction. Component {@code i} of group {@code g} gets the nonce
 * {@code computeNonce(privacySalt, g, i)}, and its leaf hash is {@code componentHash(nonce, component)}. Each group
 * is committed by the Merkle root over its leaf hashes; an absent or empty group is committed by the all-ones hash.
 * The id is the Merkle root over the group hashes, which cover every known group and any unknown group present.
 */
public final class WireTransaction extends TraversableTransaction {
    private static final Logger LOGGER = LoggerFactory.getLogger(WireTransaction.class);

    /**
     * The largest group index a transaction may use. The group hashes hold one entry per index up to the largest
     * one present.
     */
    public static final int MAX_GROUP_INDEX = 0xFFFF;

    @NotNull
    private final PrivacySalt privacySalt;

    @NotNull
    private final List<List<SecureHash>> availableComponentNonces;

    @NotNull
    private final List<List<SecureHash>> availableComponentHashes;

    private final MerkleTree[] groupMerkleTrees;

    @NotNull
    private final List<SecureHash> groupHashes;

    @NotNull
    private final SecureHash id;

    /**
     * @throws MalformedTransactionException if a group index is negative, above {@link #MAX_GROUP_INDEX}, or appears
     * more than once.
     */
    public WireTransaction(
            @NotNull List<ComponentGroup> componentGroups,
            @NotNull PrivacySalt privacySalt,
            @NotNull TransactionDigestAlgorithmNames transactionDigestAlgorithmNames,
            @NotNull DigestService digestService,
            @NotNull SerializationService serializationService
    ) {
        super(componentGroups, transactionDigestAlgorithmNames, digestService, serializationService);
        this.privacySalt = privacySalt;

        int groupCount = ComponentGroupEnum.values().length;
        for (ComponentGroup group : getComponentGroups()) {
            if (group.getGroupIndex() > MAX_GROUP_INDEX) {
                throw new MalformedTransactionException(
                        "Invalid Transaction. Component group index " + group.getGroupIndex() + " exceeds the maximum of " + MAX_GROUP_INDEX + ".",
                        group.getGroupIndex(), null, null);
            }
            groupCount = Math.max(groupCount, group.getGroupIndex() + 1);
        }
        final SecureHash allOnesHash = transactionDigestAlgorithmNames.allOnesHash(digestService);
        final List<List<SecureHash>> nonces = new ArrayList<>(groupCount);
        final List<List<SecureHash>> hashes = new ArrayList<>(groupCount);
        final List<SecureHash> roots = new ArrayList<>(groupCount);
        this.groupMerkleTrees = new MerkleTree[groupCount];
        for (int groupIndex = 0; groupIndex < groupCount; groupIndex++) {
            final ComponentGroup group = getComponentGroup(groupIndex);
            if (group == null || group.getComponents().isEmpty()) {
                nonces.add(List.of());
                hashes.add(List.of());
                roots.add(allOnesHash);
                continue;
            }
            final List<OpaqueBytes> components = group.getComponents();
            final List<SecureHash> groupNonces = new ArrayList<>(components.size());
            final List<SecureHash> groupComponentHashes = new ArrayList<>(components.size());
            for (int internalIndex = 0; internalIndex < components.size(); internalIndex++) {
                final SecureHash nonce = transactionDigestAlgorithmNames.computeNonce(privacySalt, groupIndex, internalIndex, digestService);
                groupNonces.add(nonce);
                groupComponentHashes.add(transactionDigestAlgorithmNames.componentHash(nonce, components.get(internalIndex), digestService));
            }
            final MerkleTree groupTree = transactionDigestAlgorithmNames.getMerkleTree(groupComponentHashes, digestService);
            groupMerkleTrees[groupIndex] = groupTree;
            nonces.add(Collections.unmodifiableList(groupNonces));
            hashes.add(Collections.unmodifiableList(groupComponentHashes));
            roots.add(groupTree.getHash());
        }
        this.availableComponentNonces = Collections.unmodifiableList(nonces);
        this.availableComponentHashes = Collections.unmodifiableList(hashes);
        this.groupHashes = Collections.unmodifiableList(roots);
        this.id = transactionDigestAlgorithmNames.getMerkleTree(groupHashes, digestService).getHash();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Built transaction {} from {} component groups", id, componentGroups.size());
        }
    }

    @Override
    @NotNull
    public SecureHash getId() {
        return id;
    }

    @NotNull
    public PrivacySalt getPrivacySalt() {
        return privacySalt;
    }

    /**
     * @return The Merkle root of each group, indexed by group index, with the all-ones hash for absent groups.
     */
    @NotNull
    public List<SecureHash> getGroupHashes() {
        return groupHashes;
    }

    /**
     * @return The nonce of each component, indexed by group index then position. Absent groups have an empty list.
     */
    @NotNull
    public List<List<SecureHash>> getAvailableComponentNonces() {
        return availableComponentNonces;
    }

    /**
     * @return The leaf hash of each component, indexed by group index then position. Absent groups have an empty list.
     */
    @NotNull
    public List<List<SecureHash>> getAvailableComponentHashes() {
        return availableComponentHashes;
    }

    /**
     * @return The Merkle tree over the leaf hashes of group {@code groupIndex}, or null if the group is absent or empty.
     */
    @Nullable
    public MerkleTree getGroupMerkleTree(int groupIndex) {
        return groupIndex >= 0 && groupIndex < groupMerkleTrees.length ? groupMerkleTrees[groupIndex] : null;
    }

    /**
     * @return The top level Merkle tree, whose leaves are the group hashes and whose root is the id.
     */
    @NotNull
    public MerkleTree getMerkleTree() {
        return getTransactionDigestAlgorithmNames().getMerkleTree(groupHashes, getDigestService());
    }

    /**
     * Builds a {@link FilteredTransaction} revealing the components accepted by {@code filtering}.
     *
     * @see FilteredTransaction#buildFilteredTransaction(WireTransaction, Predicate)
     */
    @NotNull
    public FilteredTransaction buildFilteredTransaction(@NotNull Predicate<Object> filtering) {
        return FilteredTransaction.buildFilteredTransaction(this, filtering);
    }

    @Override
    @NotNull
    protected List<Command<?>> pairCommandsWithSigners(@NotNull List<CommandData> commandData, @NotNull List<List<PublicKey>> signers) {
        if (commandData.size() != signers.size()) {
            throw new MalformedTransactionException(
                    "Invalid Transaction. Sizes of CommandData (" + commandData.size() + ") and Signers (" + signers.size() + ") do not match",
                    COMMANDS_GROUP.ordinal(), null, null);
        }
        final List<Command<?>> commands = new ArrayList<>(commandData.size());
        for (int index = 0; index < commandData.size(); index++) {
            commands.add(new Command<>(commandData.get(index), signers.get(index)));
        }
        return Collections.unmodifiableList(commands);
    }

    /**
     * Serialises typed transaction values into component groups, in ascending group order. The signers group is
     * derived from the commands, one list of keys per command. Empty groups are left out.
     */
    @NotNull
    public static List<ComponentGroup> createComponentGroups(
            @NotNull List<StateRef> inputs,
            @NotNull List<? extends TransactionState<?>> outputs,
            @NotNull List<? extends Command<?>> commands,
            @NotNull List<SecureHash> attachments,
            @Nullable Party notary,
            @Nullable TimeWindow timeWindow,
            @NotNull List<StateRef> references,
            @NotNull SerializationService serializationService
    ) {
        final List<ComponentGroup> groups = new ArrayList<>();
        addGroup(groups, INPUTS_GROUP, inputs, serializationService, Function.identity());
        addGroup(groups, OUTPUTS_GROUP, outputs, serializationService, Function.identity());
        addGroup(groups, COMMANDS_GROUP, commands, serializationService, Command::getValue);
        addGroup(groups, ATTACHMENTS_GROUP, attachments, serializationService, Function.identity());
        addGroup(groups, NOTARY_GROUP, notary == null ? List.of() : List.of(notary), serializationService, Function.identity());
        addGroup(groups, TIMEWINDOW_GROUP, timeWindow == null ? List.of() : List.of(timeWindow), serializationService, Function.identity());
        addGroup(groups, SIGNERS_GROUP, commands, serializationService, Command::getSigners);
        addGroup(groups, REFERENCES_GROUP, references, serializationService, Function.identity());
        return groups;
    }

    private static <T> void addGroup(
            @NotNull List<ComponentGroup> groups,
            @NotNull ComponentGroupEnum group,
            @NotNull List<T> values,
            @NotNull SerializationService serializationService,
            @NotNull Function<T, ?> component
    ) {
        if (values.isEmpty()) {
            return;
        }
        final List<OpaqueBytes> components = new ArrayList<>(values.size());
        for (T value : values) {
            components.add(new OpaqueBytes(serializationService.serialize(component.apply(value)).getBytes()));
        }
        groups.add(new ComponentGroup(group.ordinal(), components));
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((WireTransaction) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "WireTransaction(id=" + id + ")";
    }
}
