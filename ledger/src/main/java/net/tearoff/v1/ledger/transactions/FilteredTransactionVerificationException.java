package net.tearoff.v1.ledger.transactions;

import net.tearoff.v1.base.exceptions.TearoffRuntimeException;
import net.tearoff.v1.crypto.SecureHash;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown by {@link FilteredTransaction#verify()} when the revealed components cannot be proven to belong to the
 * transaction.
 */
public class FilteredTransactionVerificationException extends TearoffRuntimeException {

    @NotNull
    private final SecureHash id;

    @NotNull
    private final String reason;

    public FilteredTransactionVerificationException(@NotNull SecureHash id, @NotNull String reason) {
        super("Transaction with id:" + id + " cannot be verified. Reason: " + reason);
        this.id = id;
        this.reason = reason;
    }

    @NotNull
    public SecureHash getId() {
        return id;
    }

    @NotNull
    public String getReason() {
        return reason;
    }
}
