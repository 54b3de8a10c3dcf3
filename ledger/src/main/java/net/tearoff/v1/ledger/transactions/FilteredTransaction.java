package net.tearoff.v1.ledger.transactions;

import net.tearoff.v1.base.types.OpaqueBytes;
import net.tearoff.v1.crypto.DigestService;
import net.tearoff.v1.crypto.SecureHash;
import net.tearoff.v1.crypto.merkle.MerkleTree;
import net.tearoff.v1.crypto.merkle.MerkleTreeException;
import net.tearoff.v1.crypto.merkle.PartialMerkleTree;
import net.tearoff.v1.ledger.contracts.Command;
import net.tearoff.v1.ledger.contracts.CommandData;
import net.tearoff.v1.ledger.contracts.ComponentGroupEnum;
import net.tearoff.v1.ledger.contracts.TimeWindow;
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
import java.util.function.Predicate;
import java.util.function.Supplier;

import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.ATTACHMENTS_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.COMMANDS_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.INPUTS_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.NOTARY_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.OUTPUTS_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.REFERENCES_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.SIGNERS_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.TIMEWINDOW_GROUP;

/**
 * A transaction revealing only some of its components, together with the proofs binding them to its id.
 * <p>
 * It carries the id and all group hashes of the full transaction. Each revealed group carries its components,
 * their nonces, and a partial Merkle tree whose root is the group hash. A receiver can rebuild one from those
 * parts and check it with {@link #verify()} without ever seeing the full transaction.
 */
public final class FilteredTransaction extends TraversableTransaction {
    private static final Logger LOGGER = LoggerFactory.getLogger(FilteredTransaction.class);

    @NotNull
    private final SecureHash id;

    @NotNull
    private final List<FilteredComponentGroup> filteredComponentGroups;

    @NotNull
    private final List<SecureHash> groupHashes;

    /**
     * @param id The id of the full transaction.
     * @param filteredComponentGroups The revealed groups.
     * @param groupHashes The group hashes of the full transaction, indexed by group index.
     * @throws MalformedTransactionException if a group index is negative or appears more than once.
     */
    public FilteredTransaction(
            @NotNull SecureHash id,
            @NotNull List<FilteredComponentGroup> filteredComponentGroups,
            @NotNull List<SecureHash> groupHashes,
            @NotNull TransactionDigestAlgorithmNames transactionDigestAlgorithmNames,
            @NotNull DigestService digestService,
            @NotNull SerializationService serializationService
    ) {
        super(filteredComponentGroups, transactionDigestAlgorithmNames, digestService, serializationService);
        this.id = id;
        this.filteredComponentGroups = List.copyOf(filteredComponentGroups);
        this.groupHashes = List.copyOf(groupHashes);
    }

    /**
     * Builds a filtered transaction revealing the components of {@code wtx} that {@code filtering} accepts.
     * <p>
     * The predicate is offered the typed inputs, outputs, commands (paired with their signers), attachments, notary,
     * time-window and references, then the raw bytes of each unknown group, in ascending group order. The signers
     * group is never offered: it is revealed in full as soon as one command is accepted, so that commands can be
     * paired with their signers and a signer can check it sees all of its commands.
     *
     * @throws MalformedTransactionException if a component of {@code wtx} cannot be deserialised.
     */
    @NotNull
    public static FilteredTransaction buildFilteredTransaction(@NotNull WireTransaction wtx, @NotNull Predicate<Object> filtering) {
        final FilteringAccumulator accumulator = new FilteringAccumulator(wtx, filtering);
        accumulator.offer(INPUTS_GROUP, wtx.getInputs());
        accumulator.offer(OUTPUTS_GROUP, wtx.getOutputs());
        accumulator.offer(COMMANDS_GROUP, wtx.getCommands());
        accumulator.offer(ATTACHMENTS_GROUP, wtx.getAttachments());
        final Party notary = wtx.getNotary();
        accumulator.offer(NOTARY_GROUP, notary == null ? List.of() : List.of(notary));
        final TimeWindow timeWindow = wtx.getTimeWindow();
        accumulator.offer(TIMEWINDOW_GROUP, timeWindow == null ? List.of() : List.of(timeWindow));
        accumulator.offer(REFERENCES_GROUP, wtx.getReferences());
        for (ComponentGroup unknown : wtx.getUnknownComponentGroups()) {
            accumulator.offer(unknown.getGroupIndex(), unknown.getComponents());
        }
        final FilteredTransaction ftx = new FilteredTransaction(
                wtx.getId(),
                accumulator.createFilteredComponentGroups(),
                wtx.getGroupHashes(),
                wtx.getTransactionDigestAlgorithmNames(),
                wtx.getDigestService(),
                wtx.getSerializationService()
        );
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Built filtered transaction {} revealing {} of {} component groups",
                    ftx.getId(), ftx.getFilteredComponentGroups().size(), wtx.getComponentGroups().size());
        }
        return ftx;
    }

    /**
     * Collects accepted components per group. Slots are addressed by group index.
     */
    private static final class FilteringAccumulator {

        private final WireTransaction wtx;
        private final Predicate<Object> filtering;
        private final GroupAccumulator[] groups;
        private boolean signersIncluded;

        private FilteringAccumulator(@NotNull WireTransaction wtx, @NotNull Predicate<Object> filtering) {
            this.wtx = wtx;
            this.filtering = filtering;
            this.groups = new GroupAccumulator[wtx.getGroupHashes().size()];
        }

        private void offer(@NotNull ComponentGroupEnum group, @NotNull List<?> values) {
            offer(group.ordinal(), values);
        }

        private void offer(int groupIndex, @NotNull List<?> values) {
            for (int internalIndex = 0; internalIndex < values.size(); internalIndex++) {
                if (filtering.test(values.get(internalIndex))) {
                    accept(groupIndex, internalIndex);
                    if (groupIndex == COMMANDS_GROUP.ordinal() && !signersIncluded) {
                        includeAllSigners();
                    }
                }
            }
        }

        private void includeAllSigners() {
            signersIncluded = true;
            final int signersCount = wtx.getAvailableComponentHashes().get(SIGNERS_GROUP.ordinal()).size();
            for (int internalIndex = 0; internalIndex < signersCount; internalIndex++) {
                accept(SIGNERS_GROUP.ordinal(), internalIndex);
            }
        }

        private void accept(int groupIndex, int internalIndex) {
            if (groups[groupIndex] == null) {
                groups[groupIndex] = new GroupAccumulator();
            }
            final ComponentGroup source = wtx.getComponentGroup(groupIndex);
            groups[groupIndex].add(
                    source.getComponents().get(internalIndex),
                    wtx.getAvailableComponentNonces().get(groupIndex).get(internalIndex),
                    wtx.getAvailableComponentHashes().get(groupIndex).get(internalIndex)
            );
            LOGGER.trace("Revealing {} component {}", ComponentGroupEnum.describe(groupIndex), internalIndex);
        }

        @NotNull
        private List<FilteredComponentGroup> createFilteredComponentGroups() {
            final List<FilteredComponentGroup> result = new ArrayList<>();
            for (int groupIndex = 0; groupIndex < groups.length; groupIndex++) {
                final GroupAccumulator group = groups[groupIndex];
                if (group == null) {
                    continue;
                }
                final MerkleTree groupTree = wtx.getGroupMerkleTree(groupIndex);
                result.add(new FilteredComponentGroup(
                        groupIndex,
                        group.components,
                        group.nonces,
                        PartialMerkleTree.build(groupTree, group.hashes)
                ));
            }
            return result;
        }
    }

    private static final class GroupAccumulator {
        private final List<OpaqueBytes> components = new ArrayList<>();
        private final List<SecureHash> nonces = new ArrayList<>();
        private final List<SecureHash> hashes = new ArrayList<>();

        private void add(@NotNull OpaqueBytes component, @NotNull SecureHash nonce, @NotNull SecureHash hash) {
            components.add(component);
            nonces.add(nonce);
            hashes.add(hash);
        }
    }

    @Override
    @NotNull
    public SecureHash getId() {
        return id;
    }

    @NotNull
    public List<FilteredComponentGroup> getFilteredComponentGroups() {
        return filteredComponentGroups;
    }

    @NotNull
    public List<SecureHash> getGroupHashes() {
        return groupHashes;
    }

    @Nullable
    public FilteredComponentGroup getFilteredComponentGroup(int groupIndex) {
        return (FilteredComponentGroup) getComponentGroup(groupIndex);
    }

    /**
     * Checks that the group hashes commit to the id, and that every revealed group is proven by its partial Merkle
     * tree against its group hash. A filtered transaction revealing no group passes, which allows blind signing
     * over the id alone.
     *
     * @throws FilteredTransactionVerificationException if any check fails.
     */
    public void verify() {
        verificationCheck(!groupHashes.isEmpty(), () -> "At least one component group hash is required");
        verificationCheck(topLevelRootMatchesId(), () -> "Top level Merkle tree cannot be verified against transaction's id");
        if (filteredComponentGroups.isEmpty()) {
            LOGGER.debug("Filtered transaction {} reveals no components, only its id is verified", id);
            return;
        }
        final TransactionDigestAlgorithmNames names = getTransactionDigestAlgorithmNames();
        for (FilteredComponentGroup group : filteredComponentGroups) {
            final int groupIndex = group.getGroupIndex();
            verificationCheck(groupIndex < groupHashes.size(), () -> "There is no matching component group hash for group " + groupIndex);
            final SecureHash groupMerkleRoot = groupHashes.get(groupIndex);
            final SecureHash partialRoot = PartialMerkleTree.rootAndUsedHashes(
                    group.getPartialMerkleTree().getRoot(), new ArrayList<>(), names.getTreeAlgorithm(), getDigestService());
            verificationCheck(groupMerkleRoot.equals(partialRoot),
                    () -> "Partial Merkle tree root and advertised full Merkle tree root for component group " + groupIndex + " do not match");
            verificationCheck(group.getPartialMerkleTree().verify(groupMerkleRoot, componentHashes(group), names.getTreeAlgorithm(), getDigestService()),
                    () -> "Visible components in group " + groupIndex + " cannot be verified against their partial Merkle tree");
        }
        LOGGER.debug("Verified filtered transaction {}", id);
    }

    /**
     * @return false if no component is visible, otherwise whether {@code checkingFun} accepts every visible component.
     * @see #getAvailableComponentGroups()
     */
    public boolean checkWithFun(@NotNull Predicate<Object> checkingFun) {
        boolean any = false;
        for (List<Object> group : getAvailableComponentGroups()) {
            for (Object component : group) {
                if (!checkingFun.test(component)) {
                    return false;
                }
                any = true;
            }
        }
        return any;
    }

    /**
     * @see #checkAllComponentsVisible(int)
     */
    public void checkAllComponentsVisible(@NotNull ComponentGroupEnum componentGroupEnum) {
        checkAllComponentsVisible(componentGroupEnum.ordinal());
    }

    /**
     * Checks that every component of group {@code groupIndex} in the full transaction is revealed. If the group is not
     * revealed, the check passes only if the full transaction had no such group.
     *
     * @throws ComponentVisibilityException if some components of the group are hidden.
     */
    public void checkAllComponentsVisible(int groupIndex) {
        if (groupIndex < 0) {
            throw new IllegalArgumentException("Component group index must not be negative: " + groupIndex);
        }
        final FilteredComponentGroup group = getFilteredComponentGroup(groupIndex);
        if (group == null || group.getComponents().isEmpty()) {
            visibilityCheck(groupIndex >= groupHashes.size()
                            || groupHashes.get(groupIndex).equals(getTransactionDigestAlgorithmNames().allOnesHash(getDigestService())),
                    () -> "Did not receive components for group " + groupIndex
                            + " and cannot verify they didn't exist in the original wire transaction");
        } else {
            visibilityCheck(groupIndex < groupHashes.size(), () -> "There is no matching component group hash for group " + groupIndex);
            final SecureHash groupFullRoot = getTransactionDigestAlgorithmNames().getMerkleTree(componentHashes(group), getDigestService()).getHash();
            visibilityCheck(groupHashes.get(groupIndex).equals(groupFullRoot), () -> "Some components for group " + groupIndex + " are not visible");
            visibilityCheck(topLevelRootMatchesId(),
                    () -> "Transaction is malformed. Top level Merkle tree cannot be verified against transaction's id");
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("All components of {} are visible in filtered transaction {}", ComponentGroupEnum.describe(groupIndex), id);
        }
    }

    /**
     * Checks that every command of the full transaction that {@code publicKey} must sign is revealed. The signers
     * group must be fully visible; it tells how many such commands there are. This passes if the key signs no command.
     *
     * @throws ComponentVisibilityException if some of the key's commands are hidden.
     */
    public void checkCommandVisibility(@NotNull PublicKey publicKey) {
        checkAllComponentsVisible(SIGNERS_GROUP);
        long expected = 0;
        for (List<PublicKey> signers : getSigners()) {
            if (signers.contains(publicKey)) {
                expected++;
            }
        }
        long received = 0;
        for (Command<?> command : getCommands()) {
            if (command.getSigners().contains(publicKey)) {
                received++;
            }
        }
        final long expectedCommands = expected;
        final long receivedCommands = received;
        visibilityCheck(expectedCommands == receivedCommands,
                () -> expectedCommands + " commands were expected, but received " + receivedCommands);
    }

    /**
     * Each revealed command is paired with the signers at its position in the full transaction. That position is
     * recovered from the command's leaf in the partial Merkle tree of the commands group.
     */
    @Override
    @NotNull
    protected List<Command<?>> pairCommandsWithSigners(@NotNull List<CommandData> commandData, @NotNull List<List<PublicKey>> signers) {
        if (commandData.size() > signers.size()) {
            throw new MalformedTransactionException(
                    "Invalid Transaction. Less Signers (" + signers.size() + ") than CommandData (" + commandData.size() + ") objects",
                    COMMANDS_GROUP.ordinal(), null, null);
        }
        if (commandData.isEmpty()) {
            return List.of();
        }
        final FilteredComponentGroup commandGroup = getFilteredComponentGroup(COMMANDS_GROUP.ordinal());
        final List<SecureHash> hashes = componentHashes(commandGroup);
        final List<Command<?>> commands = new ArrayList<>(commandData.size());
        for (int internalIndex = 0; internalIndex < commandData.size(); internalIndex++) {
            final int leafIndex;
            try {
                leafIndex = commandGroup.getPartialMerkleTree().leafIndex(hashes.get(internalIndex));
            } catch (MerkleTreeException e) {
                throw new MalformedTransactionException(
                        "Invalid Transaction. Command at index " + internalIndex + " is not a leaf of the commands partial Merkle tree",
                        COMMANDS_GROUP.ordinal(), internalIndex, e);
            }
            if (leafIndex >= signers.size()) {
                throw new MalformedTransactionException(
                        "Invalid Transaction. A command with no corresponding signer detected",
                        COMMANDS_GROUP.ordinal(), internalIndex, null);
            }
            commands.add(new Command<>(commandData.get(internalIndex), signers.get(leafIndex)));
        }
        return Collections.unmodifiableList(commands);
    }

    @NotNull
    private List<SecureHash> componentHashes(@NotNull FilteredComponentGroup group) {
        final List<OpaqueBytes> components = group.getComponents();
        final List<SecureHash> hashes = new ArrayList<>(components.size());
        for (int index = 0; index < components.size(); index++) {
            hashes.add(getTransactionDigestAlgorithmNames().componentHash(group.getNonces().get(index), components.get(index), getDigestService()));
        }
        return hashes;
    }

    private boolean topLevelRootMatchesId() {
        try {
            return getTransactionDigestAlgorithmNames().getMerkleTree(groupHashes, getDigestService()).getHash().equals(id);
        } catch (MerkleTreeException e) {
            LOGGER.warn("Cannot build the top level Merkle tree of filtered transaction {}: {}", id, e.getReason());
            return false;
        }
    }

    private void verificationCheck(boolean value, @NotNull Supplier<String> reason) {
        if (!value) {
            final String message = reason.get();
            LOGGER.warn("Filtered transaction {} failed verification: {}", id, message);
            throw new FilteredTransactionVerificationException(id, message);
        }
    }

    private void visibilityCheck(boolean value, @NotNull Supplier<String> reason) {
        if (!value) {
            final String message = reason.get();
            LOGGER.warn("Filtered transaction {} failed visibility check: {}", id, message);
            throw new ComponentVisibilityException(id, message);
        }
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final FilteredTransaction that = (FilteredTransaction) o;
        return id.equals(that.id)
                && filteredComponentGroups.equals(that.filteredComponentGroups)
                && groupHashes.equals(that.groupHashes);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "FilteredTransaction(id=" + id + ", groups=" + filteredComponentGroups.size() + ")";
    }
}
