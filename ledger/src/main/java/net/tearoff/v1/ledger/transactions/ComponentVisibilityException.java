package net.tearoff.v1.ledger.transactions;

import net.tearoff.v1.base.exceptions.TearoffRuntimeException;
import net.tearoff.v1.crypto.SecureHash;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a filtered transaction hides components a caller requires to see.
 *
 * @see FilteredTransaction#checkAllComponentsVisible(net.tearoff.v1.ledger.contracts.ComponentGroupEnum)
 * @see FilteredTransaction#checkCommandVisibility(java.security.PublicKey)
 */
public class ComponentVisibilityException extends TearoffRuntimeException {

    @NotNull
    private final SecureHash id;

    @NotNull
    private final String reason;

    public ComponentVisibilityException(@NotNull SecureHash id, @NotNull String reason) {
        super("Component visibility error for transaction with id:" + id + ". Reason: " + reason);
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
