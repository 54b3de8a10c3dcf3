package net.tearoff.v1.ledger.contracts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.tearoff.v1.base.annotations.TearoffSerializable;
import net.tearoff.v1.crypto.SecureHash;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.text.MessageFormat;
import java.util.Objects;

/**
 * A reference to an output state of an earlier transaction.
 */
@TearoffSerializable
public final class StateRef {

    private static final String DELIMITER = ":";

    @NotNull
    private final SecureHash transactionId;

    private final int index;

    /**
     * @param transactionId The id of the transaction in which the referenced state was created.
     * @param index The position of the state in that transaction's outputs.
     */
    @JsonCreator
    public StateRef(@JsonProperty("transactionId") @NotNull final SecureHash transactionId, @JsonProperty("index") final int index) {
        if (index < 0) {
            throw new IllegalArgumentException("State index must not be negative: " + index);
        }
        this.transactionId = Objects.requireNonNull(transactionId, "transactionId");
        this.index = index;
    }

    @NotNull
    public SecureHash getTransactionId() {
        return transactionId;
    }

    public int getIndex() {
        return index;
    }

    /**
     * Parses a value of the form {@code ALGORITHM:HEX:index}.
     *
     * @throws IllegalArgumentException if the value cannot be parsed.
     */
    @NotNull
    public static StateRef parse(@NotNull final String value) {
        final int lastIndexOfDelimiter = value.lastIndexOf(DELIMITER);
        if (lastIndexOfDelimiter < 0) {
            throw new IllegalArgumentException(
                    MessageFormat.format("Failed to parse a StateRef from the specified value. The delimiter is missing: {0}.", value));
        }
        final int index;
        try {
            index = Integer.parseInt(value.substring(lastIndexOfDelimiter + 1));
        } catch (NumberFormatException numberFormatException) {
            throw new IllegalArgumentException(
                    MessageFormat.format("Failed to parse a StateRef from the specified value. The index is malformed: {0}.", value),
                    numberFormatException
            );
        }
        try {
            return new StateRef(SecureHash.parse(value.substring(0, lastIndexOfDelimiter)), index);
        } catch (IllegalArgumentException illegalArgumentException) {
            throw new IllegalArgumentException(
                    MessageFormat.format("Failed to parse a StateRef from the specified value. The transaction ID is malformed: {0}.", value),
                    illegalArgumentException
            );
        }
    }

    @Override
    public boolean equals(@Nullable final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final StateRef stateRef = (StateRef) o;
        return index == stateRef.index && transactionId.equals(stateRef.transactionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(transactionId, index);
    }

    @Override
    public String toString() {
        return transactionId + DELIMITER + index;
    }
}
