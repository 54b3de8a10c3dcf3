package net.tearoff.v1.crypto.merkle;

import net.tearoff.v1.crypto.exceptions.CryptoException;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a {@link MerkleTree} or {@link PartialMerkleTree} cannot be built or queried.
 */
public class MerkleTreeException extends CryptoException {

    @NotNull
    private final String reason;

    public MerkleTreeException(@NotNull String reason) {
        super("Partial Merkle Tree exception. Reason: " + reason);
        this.reason = reason;
    }

    @NotNull
    public String getReason() {
        return reason;
    }
}
