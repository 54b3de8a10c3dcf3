package net.tearoff.v1.ledger.contracts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.tearoff.v1.base.annotations.TearoffSerializable;
import net.tearoff.v1.ledger.identity.Party;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.text.MessageFormat;
import java.util.Objects;

/**
 * A transaction output: a contract state together with the contract governing it and the notary tracking it.
 *
 * @param <T> The type of the contract state.
 */
@TearoffSerializable
public final class TransactionState<T extends ContractState> {

    @NotNull
    private final T data;

    @NotNull
    private final String contract;

    @NotNull
    private final Party notary;

    @Nullable
    private final Integer encumbrance;

    /**
     * @param data The contract state.
     * @param contract The class name of the contract verifying the state.
     * @param notary The notary of the state.
     * @param encumbrance The index of another output that must be consumed together with this one, if any.
     */
    @JsonCreator
    public TransactionState(
            @JsonProperty("data") @NotNull final T data,
            @JsonProperty("contract") @NotNull final String contract,
            @JsonProperty("notary") @NotNull final Party notary,
            @JsonProperty("encumbrance") @Nullable final Integer encumbrance
    ) {
        this.data = Objects.requireNonNull(data, "data");
        this.contract = Objects.requireNonNull(contract, "contract");
        this.notary = Objects.requireNonNull(notary, "notary");
        this.encumbrance = encumbrance;
    }

    public TransactionState(@NotNull final T data, @NotNull final String contract, @NotNull final Party notary) {
        this(data, contract, notary, null);
    }

    @NotNull
    public T getData() {
        return data;
    }

    @NotNull
    public String getContract() {
        return contract;
    }

    @NotNull
    public Party getNotary() {
        return notary;
    }

    @Nullable
    public Integer getEncumbrance() {
        return encumbrance;
    }

    @Override
    public boolean equals(@Nullable final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final TransactionState<?> that = (TransactionState<?>) o;
        return data.equals(that.data)
                && contract.equals(that.contract)
                && notary.equals(that.notary)
                && Objects.equals(encumbrance, that.encumbrance);
    }

    @Override
    public int hashCode() {
        return Objects.hash(data, contract, notary, encumbrance);
    }

    @Override
    public String toString() {
        return MessageFormat.format(
                "TransactionState(data={0}, contract={1}, notary={2}, encumbrance={3})",
                data, contract, notary, encumbrance
        );
    }
}
