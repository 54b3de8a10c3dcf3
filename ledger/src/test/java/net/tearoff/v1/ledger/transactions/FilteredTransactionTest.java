package net.tearoff.v1.ledger.transactions;

import net.tearoff.v1.base.types.OpaqueBytes;
import net.tearoff.v1.crypto.SecureHash;
import net.tearoff.v1.crypto.merkle.PartialMerkleTree;
import net.tearoff.v1.ledger.contracts.Command;
import net.tearoff.v1.ledger.contracts.StateRef;
import net.tearoff.v1.ledger.contracts.TimeWindow;
import net.tearoff.v1.ledger.contracts.TransactionState;
import net.tearoff.v1.ledger.crypto.TransactionDigestAlgorithmNames;
import net.tearoff.v1.ledger.identity.Party;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.COMMANDS_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.INPUTS_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.OUTPUTS_GROUP;
import static net.tearoff.v1.ledger.contracts.ComponentGroupEnum.SIGNERS_GROUP;
import static net.tearoff.v1.ledger.transactions.LedgerTestFixtures.CONTRACT_ATTACHMENT;
import static net.tearoff.v1.ledger.transactions.LedgerTestFixtures.KEY_A;
import static net.tearoff.v1.ledger.transactions.LedgerTestFixtures.KEY_B;
import static net.tearoff.v1.ledger.transactions.LedgerTestFixtures.NOTARY_KEY;
import static net.tearoff.v1.ledger.transactions.LedgerTestFixtures.UNKNOWN_GROUP_INDEX;
import static net.tearoff.v1.ledger.transactions.LedgerTestFixtures.commands;
import static net.tearoff.v1.ledger.transactions.LedgerTestFixtures.digestService;
import static net.tearoff.v1.ledger.transactions.LedgerTestFixtures.inputs;
import static net.tearoff.v1.ledger.transactions.LedgerTestFixtures.outputs;
import static net.tearoff.v1.ledger.transactions.LedgerTestFixtures.serializationService;
import static net.tearoff.v1.ledger.transactions.LedgerTestFixtures.standardTransaction;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FilteredTransactionTest {

    private static final Predicate<Object> NOTHING = o -> false;
    private static final Predicate<Object> EVERYTHING = o -> true;
    private static final Predicate<Object> FIRST_INPUT = o -> inputs().get(0).equals(o);
    private static final Predicate<Object> ALL_INPUTS = o -> inputs().contains(o);
    private static final Predicate<Object> ATTACHMENT = CONTRACT_ATTACHMENT::equals;
    private static final Predicate<Object> UNKNOWN_BYTES = o -> o instanceof OpaqueBytes;

    private static Predicate<Object> commandAt(int index) {
        return commands().get(index)::equals;
    }

    private WireTransaction wtx;

    @BeforeEach
    void setup() {
        wtx = standardTransaction();
    }

    private FilteredTransaction rebuild(List<FilteredComponentGroup> groups, List<SecureHash> groupHashes, SecureHash id) {
        return new FilteredTransaction(id, groups, groupHashes, new TransactionDigestAlgorithmNames(), digestService(), serializationService());
    }

    private List<FilteredComponentGroup> replaceGroup(FilteredTransaction ftx, FilteredComponentGroup replacement) {
        final List<FilteredComponentGroup> groups = new ArrayList<>();
        for (FilteredComponentGroup group : ftx.getFilteredComponentGroups()) {
            groups.add(group.getGroupIndex() == replacement.getGroupIndex() ? replacement : group);
        }
        return groups;
    }

    static Stream<Arguments> predicates() {
        return Stream.of(
                Arguments.of("everything", EVERYTHING),
                Arguments.of("nothing", NOTHING),
                Arguments.of("first input", FIRST_INPUT),
                Arguments.of("outputs and attachment", ATTACHMENT.or(o -> o instanceof TransactionState)),
                Arguments.of("one command", ATTACHMENT.or(commandAt(1))),
                Arguments.of("notary and time-window", (Predicate<Object>) o -> o instanceof Party || o instanceof TimeWindow),
                Arguments.of("unknown group", UNKNOWN_BYTES),
                Arguments.of("state refs", (Predicate<Object>) o -> o instanceof StateRef)
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("predicates")
    void filteredTransactionVerifiesAgainstTheFullTransaction(String name, Predicate<Object> predicate) {
        final FilteredTransaction ftx = wtx.buildFilteredTransaction(predicate);

        assertThatCode(ftx::verify).doesNotThrowAnyException();
        assertThat(ftx.getId()).isEqualTo(wtx.getId());
        assertThat(ftx.getGroupHashes()).isEqualTo(wtx.getGroupHashes());
        assertThat(ftx.getFilteredComponentGroups()).extracting(ComponentGroup::getGroupIndex).isSorted().doesNotHaveDuplicates();
        for (FilteredComponentGroup group : ftx.getFilteredComponentGroups()) {
            assertThat(wtx.getComponentGroup(group.getGroupIndex()).getComponents()).containsAll(group.getComponents());
            assertThat(wtx.getAvailableComponentNonces().get(group.getGroupIndex())).containsAll(group.getNonces());
        }
    }

    @Test
    void acceptingMoreRevealsMore() {
        final FilteredTransaction narrow = wtx.buildFilteredTransaction(FIRST_INPUT);
        final FilteredTransaction wide = wtx.buildFilteredTransaction(FIRST_INPUT.or(o -> o instanceof StateRef));

        for (FilteredComponentGroup group : narrow.getFilteredComponentGroups()) {
            final FilteredComponentGroup widerGroup = wide.getFilteredComponentGroup(group.getGroupIndex());
            assertThat(widerGroup).isNotNull();
            assertThat(widerGroup.getComponents()).containsAll(group.getComponents());
        }
        assertThat(wide.getInputs()).containsAll(narrow.getInputs());
    }

    @Test
    void blindFilteredTransactionRevealsNothingButVerifies() {
        final FilteredTransaction ftx = wtx.buildFilteredTransaction(NOTHING);

        assertThat(ftx.getFilteredComponentGroups()).isEmpty();
        assertThatCode(ftx::verify).doesNotThrowAnyException();
        assertThat(ftx.checkWithFun(EVERYTHING)).isFalse();
        assertThat(ftx.getInputs()).isEmpty();
        assertThatThrownBy(() -> ftx.checkAllComponentsVisible(INPUTS_GROUP))
                .isInstanceOf(ComponentVisibilityException.class)
                .hasMessageContaining("Did not receive components for group 0");
    }

    @Nested
    public class SignersVisibility {

        @Test
        void acceptingOneCommandRevealsAllSigners() {
            final FilteredTransaction ftx = wtx.buildFilteredTransaction(ATTACHMENT.or(commandAt(1)));

            assertThat(ftx.getFilteredComponentGroup(SIGNERS_GROUP.ordinal()).getComponents())
                    .isEqualTo(wtx.getComponentGroup(SIGNERS_GROUP.ordinal()).getComponents());
            assertThatCode(() -> ftx.checkAllComponentsVisible(SIGNERS_GROUP)).doesNotThrowAnyException();
            assertThat(ftx.getCommands()).containsExactly(commands().get(1));
        }

        @Test
        void revealedCommandsArePairedWithSignersAtTheirOriginalPosition() {
            final FilteredTransaction ftx = wtx.buildFilteredTransaction(ATTACHMENT.or(commandAt(2)));

            assertThat(ftx.getCommands()).hasSize(1);
            assertThat(ftx.getCommands().get(0).getSigners()).containsExactly(KEY_B);
        }

        @Test
        void signersStayHiddenWhenNoCommandIsAccepted() {
            final FilteredTransaction ftx = wtx.buildFilteredTransaction(ALL_INPUTS);

            assertThat(ftx.getFilteredComponentGroup(SIGNERS_GROUP.ordinal())).isNull();
            assertThat(ftx.getCommands()).isEmpty();
        }
    }

    @Nested
    public class AllComponentsVisibility {

        @Test
        void partiallyRevealedGroupIsDetected() {
            final FilteredTransaction ftx = wtx.buildFilteredTransaction(FIRST_INPUT);

            assertThatThrownBy(() -> ftx.checkAllComponentsVisible(INPUTS_GROUP))
                    .isInstanceOfSatisfying(ComponentVisibilityException.class, e -> {
                        assertThat(e.getId()).isEqualTo(wtx.getId());
                        assertThat(e.getReason()).isEqualTo("Some components for group 0 are not visible");
                    });
        }

        @Test
        void fullyRevealedGroupPasses() {
            final FilteredTransaction ftx = wtx.buildFilteredTransaction(ALL_INPUTS);

            assertThatCode(() -> ftx.checkAllComponentsVisible(INPUTS_GROUP)).doesNotThrowAnyException();
        }

        @Test
        void hiddenGroupThatExistedIsDetected() {
            final FilteredTransaction ftx = wtx.buildFilteredTransaction(ALL_INPUTS);

            assertThatThrownBy(() -> ftx.checkAllComponentsVisible(OUTPUTS_GROUP))
                    .isInstanceOf(ComponentVisibilityException.class)
                    .hasMessageContaining("Did not receive components for group 1 and cannot verify they didn't exist in the original wire transaction");
        }

        @Test
        void groupsAbsentFromTheFullTransactionPass() {
            final FilteredTransaction ftx = wtx.buildFilteredTransaction(ALL_INPUTS);

            assertThatCode(() -> ftx.checkAllComponentsVisible(8)).doesNotThrowAnyException();
            assertThatCode(() -> ftx.checkAllComponentsVisible(UNKNOWN_GROUP_INDEX + 5)).doesNotThrowAnyException();
        }
    }

    @Nested
    public class CommandVisibility {

        @Test
        void firstAndThirdCommandsHideOneCommandOfEachKey() {
            final FilteredTransaction ftx = wtx.buildFilteredTransaction(ATTACHMENT.or(commandAt(0)).or(commandAt(2)));

            assertThatThrownBy(() -> ftx.checkCommandVisibility(KEY_A))
                    .isInstanceOf(ComponentVisibilityException.class)
                    .hasMessageEndingWith("2 commands were expected, but received 1");
            assertThatThrownBy(() -> ftx.checkCommandVisibility(KEY_B))
                    .isInstanceOf(ComponentVisibilityException.class)
                    .hasMessageEndingWith("2 commands were expected, but received 1");
        }

        @Test
        void allCommandsOfOneKeyRevealed() {
            final FilteredTransaction ftx = wtx.buildFilteredTransaction(ATTACHMENT.or(commandAt(0)).or(commandAt(1)));

            assertThatCode(() -> ftx.checkCommandVisibility(KEY_A)).doesNotThrowAnyException();
            assertThatThrownBy(() -> ftx.checkCommandVisibility(KEY_B))
                    .isInstanceOfSatisfying(ComponentVisibilityException.class,
                            e -> assertThat(e.getReason()).isEqualTo("2 commands were expected, but received 1"));
        }

        @Test
        void keyWithoutCommandsPasses() {
            final FilteredTransaction ftx = wtx.buildFilteredTransaction(ATTACHMENT.or(commandAt(0)));

            assertThatCode(() -> ftx.checkCommandVisibility(NOTARY_KEY)).doesNotThrowAnyException();
        }

        @Test
        void hiddenSignersFailTheCheck() {
            final FilteredTransaction ftx = wtx.buildFilteredTransaction(ALL_INPUTS);

            assertThatThrownBy(() -> ftx.checkCommandVisibility(KEY_A))
                    .isInstanceOf(ComponentVisibilityException.class)
                    .hasMessageContaining("Did not receive components for group 6");
        }
    }

    @Nested
    public class TamperDetection {

        @Test
        void changedComponentBytesFailVerification() {
            final FilteredTransaction ftx = wtx.buildFilteredTransaction(ALL_INPUTS);
            final FilteredComponentGroup inputs = ftx.getFilteredComponentGroup(INPUTS_GROUP.ordinal());
            final List<OpaqueBytes> components = new ArrayList<>(inputs.getComponents());
            final byte[] changed = components.get(0).getBytes();
            changed[changed.length - 2] ^= 1;
            components.set(0, new OpaqueBytes(changed));
            final FilteredTransaction tampered = rebuild(replaceGroup(ftx, new FilteredComponentGroup(INPUTS_GROUP.ordinal(), components, inputs.getNonces(), inputs.getPartialMerkleTree())),
                    ftx.getGroupHashes(), ftx.getId());

            assertThatThrownBy(tampered::verify)
                    .isInstanceOfSatisfying(FilteredTransactionVerificationException.class,
                            e -> assertThat(e.getReason()).isEqualTo("Visible components in group 0 cannot be verified against their partial Merkle tree"));
        }

        @Test
        void partialTreeOfAnotherGroupFailsVerification() {
            final FilteredTransaction ftx = wtx.buildFilteredTransaction(ALL_INPUTS.or(o -> o instanceof TransactionState).or(ATTACHMENT));
            final FilteredComponentGroup inputs = ftx.getFilteredComponentGroup(INPUTS_GROUP.ordinal());
            final FilteredComponentGroup outputs = ftx.getFilteredComponentGroup(OUTPUTS_GROUP.ordinal());
            final FilteredTransaction tampered = rebuild(replaceGroup(ftx, new FilteredComponentGroup(INPUTS_GROUP.ordinal(), inputs.getComponents(), inputs.getNonces(), outputs.getPartialMerkleTree())),
                    ftx.getGroupHashes(), ftx.getId());

            assertThatThrownBy(tampered::verify)
                    .isInstanceOf(FilteredTransactionVerificationException.class)
                    .hasMessageEndingWith("Partial Merkle tree root and advertised full Merkle tree root for component group 0 do not match");
        }

        @Test
        void changedGroupHashFailsVerification() {
            final FilteredTransaction ftx = wtx.buildFilteredTransaction(ALL_INPUTS);
            final List<SecureHash> groupHashes = new ArrayList<>(ftx.getGroupHashes());
            groupHashes.set(OUTPUTS_GROUP.ordinal(), groupHashes.get(INPUTS_GROUP.ordinal()));
            final FilteredTransaction tampered = rebuild(ftx.getFilteredComponentGroups(), groupHashes, ftx.getId());

            assertThatThrownBy(tampered::verify)
                    .isInstanceOfSatisfying(FilteredTransactionVerificationException.class,
                            e -> assertThat(e.getReason()).isEqualTo("Top level Merkle tree cannot be verified against transaction's id"));
        }

        @Test
        void foreignIdFailsVerification() {
            final FilteredTransaction ftx = wtx.buildFilteredTransaction(ALL_INPUTS);
            final SecureHash otherId = wtx.getGroupHashes().get(INPUTS_GROUP.ordinal());
            final FilteredTransaction tampered = rebuild(ftx.getFilteredComponentGroups(), ftx.getGroupHashes(), otherId);

            assertThatThrownBy(tampered::verify)
                    .isInstanceOfSatisfying(FilteredTransactionVerificationException.class,
                            e -> assertThat(e.getId()).isEqualTo(otherId));
        }

        @Test
        void missingGroupHashesFailVerification() {
            final FilteredTransaction ftx = wtx.buildFilteredTransaction(NOTHING);
            final FilteredTransaction tampered = rebuild(List.of(), List.of(), ftx.getId());

            assertThatThrownBy(tampered::verify)
                    .isInstanceOf(FilteredTransactionVerificationException.class)
                    .hasMessageEndingWith("At least one component group hash is required");
        }
    }

    @Test
    void farGroupIndexFromASenderFailsVerification() {
        final FilteredTransaction ftx = wtx.buildFilteredTransaction(ALL_INPUTS);
        final FilteredComponentGroup inputs = ftx.getFilteredComponentGroup(INPUTS_GROUP.ordinal());
        final FilteredComponentGroup far = new FilteredComponentGroup(
                Integer.MAX_VALUE, inputs.getComponents(), inputs.getNonces(), inputs.getPartialMerkleTree());
        final FilteredTransaction received = rebuild(List.of(inputs, far), ftx.getGroupHashes(), ftx.getId());

        assertThat(received.getFilteredComponentGroup(Integer.MAX_VALUE)).isEqualTo(far);
        assertThat(received.getUnknownComponentGroups()).containsExactly(far);
        assertThatThrownBy(received::verify)
                .isInstanceOf(FilteredTransactionVerificationException.class)
                .hasMessageEndingWith("There is no matching component group hash for group " + Integer.MAX_VALUE);
    }

    @Test
    void negativeGroupIndexFromASenderIsMalformed() {
        final FilteredTransaction ftx = wtx.buildFilteredTransaction(ALL_INPUTS);
        final FilteredComponentGroup inputs = ftx.getFilteredComponentGroup(INPUTS_GROUP.ordinal());
        final FilteredComponentGroup negative = new FilteredComponentGroup(
                -1, inputs.getComponents(), inputs.getNonces(), inputs.getPartialMerkleTree());

        assertThatThrownBy(() -> rebuild(List.of(negative), ftx.getGroupHashes(), ftx.getId()))
                .isInstanceOf(MalformedTransactionException.class)
                .hasMessageContaining("Negative component group index -1");
    }

    @Test
    void keysNestedInComponentsAreReadBack() {
        final FilteredTransaction ftx = wtx.buildFilteredTransaction(EVERYTHING);

        assertThat(ftx.getNotary()).isEqualTo(LedgerTestFixtures.NOTARY);
        assertThat(ftx.getSigners()).containsExactly(List.of(KEY_A), List.of(KEY_A, KEY_B), List.of(KEY_B));
        assertThat(ftx.getOutputs()).isEqualTo(outputs());
        assertThat(ftx.getCommands()).isEqualTo(commands());
    }

    @Test
    void unknownGroupSurvivesFiltering() {
        final FilteredTransaction ftx = wtx.buildFilteredTransaction(UNKNOWN_BYTES);

        assertThat(ftx.getFilteredComponentGroups()).extracting(ComponentGroup::getGroupIndex).containsExactly(UNKNOWN_GROUP_INDEX);
        assertThat(ftx.getUnknownComponentGroups()).hasSize(1);
        assertThatCode(ftx::verify).doesNotThrowAnyException();
        assertThatCode(() -> ftx.checkAllComponentsVisible(UNKNOWN_GROUP_INDEX)).doesNotThrowAnyException();
    }

    @Test
    void receiverCanRebuildAndReadFilteredTransaction() {
        final FilteredTransaction ftx = wtx.buildFilteredTransaction(ATTACHMENT.or(o -> o instanceof TransactionState));
        final FilteredTransaction received = rebuild(ftx.getFilteredComponentGroups(), ftx.getGroupHashes(), ftx.getId());

        assertThat(received).isEqualTo(ftx);
        assertThatCode(received::verify).doesNotThrowAnyException();
        assertThat(received.getOutputs()).isEqualTo(outputs());
        assertThat(received.getInputs()).isEmpty();
        assertThat(received.getNotary()).isNull();
    }

    @Test
    void checkWithFunRequiresEveryVisibleComponentToPass() {
        final FilteredTransaction ftx = wtx.buildFilteredTransaction(ALL_INPUTS);

        assertThat(ftx.checkWithFun(o -> o instanceof StateRef)).isTrue();
        assertThat(ftx.checkWithFun(o -> o.equals(inputs().get(0)))).isFalse();
    }

    @Nested
    public class CommandPairing {

        private FilteredTransaction withFirstSignerOnly(FilteredTransaction ftx) {
            final FilteredComponentGroup signers = ftx.getFilteredComponentGroup(SIGNERS_GROUP.ordinal());
            final PartialMerkleTree firstSigner = PartialMerkleTree.build(
                    wtx.getGroupMerkleTree(SIGNERS_GROUP.ordinal()),
                    List.of(wtx.getAvailableComponentHashes().get(SIGNERS_GROUP.ordinal()).get(0)));
            return rebuild(replaceGroup(ftx, new FilteredComponentGroup(
                    SIGNERS_GROUP.ordinal(), signers.getComponents().subList(0, 1), signers.getNonces().subList(0, 1), firstSigner)),
                    ftx.getGroupHashes(), ftx.getId());
        }

        @Test
        void commandBeyondTheRevealedSignersIsMalformed() {
            final FilteredTransaction ftx = withFirstSignerOnly(wtx.buildFilteredTransaction(ATTACHMENT.or(commandAt(2))));

            assertThatThrownBy(ftx::getCommands)
                    .isInstanceOfSatisfying(MalformedTransactionException.class,
                            e -> assertThat(e.getGroupIndex()).isEqualTo(COMMANDS_GROUP.ordinal()))
                    .hasMessage("Invalid Transaction. A command with no corresponding signer detected");
        }

        @Test
        void fewerSignersThanCommandsIsMalformed() {
            final FilteredTransaction ftx = withFirstSignerOnly(wtx.buildFilteredTransaction(ATTACHMENT.or(commandAt(0)).or(commandAt(1))));

            assertThatThrownBy(ftx::getCommands)
                    .isInstanceOf(MalformedTransactionException.class)
                    .hasMessage("Invalid Transaction. Less Signers (1) than CommandData (2) objects");
        }
    }

    @Test
    void commandsCannotBeReadWithoutTheirAttachment() {
        final FilteredTransaction ftx = wtx.buildFilteredTransaction(commandAt(0));

        assertThatThrownBy(ftx::getCommands).isInstanceOf(MalformedTransactionException.class);
    }
}
