package net.tearoff.v1.ledger.transactions;

import net.tearoff.v1.base.exceptions.TearoffRuntimeException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when the component groups of a transaction are inconsistent: a component that cannot be deserialised,
 * a duplicated group, too many components in a singleton group, or commands that cannot be paired with signers.
 */
public class MalformedTransactionException extends TearoffRuntimeException {

    private final int groupIndex;

    @Nullable
    private final Integer internalIndex;

    /**
     * @param groupIndex The group the problem was found in.
     * @param internalIndex The position of the offending component in the group, or null if no single component is at fault.
     */
    public MalformedTransactionException(
            @NotNull String message,
            int groupIndex,
            @Nullable Integer internalIndex,
            @Nullable Throwable cause
    ) {
        super(message, cause);
        this.groupIndex = groupIndex;
        this.internalIndex = internalIndex;
    }

    public int getGroupIndex() {
        return groupIndex;
    }

    @Nullable
    public Integer getInternalIndex() {
        return internalIndex;
    }
}
