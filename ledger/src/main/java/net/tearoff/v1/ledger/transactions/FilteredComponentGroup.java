package net.tearoff.v1.ledger.transactions;

import net.tearoff.v1.base.types.OpaqueBytes;
import net.tearoff.v1.crypto.SecureHash;
import net.tearoff.v1.crypto.merkle.PartialMerkleTree;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.text.MessageFormat;
import java.util.List;
import java.util.Objects;

/**
 * The revealed components of one group of a filtered transaction, each with its nonce, and the partial Merkle tree
 * proving they belong to the group.
 */
public final class FilteredComponentGroup extends ComponentGroup {

    @NotNull
    private final List<SecureHash> nonces;

    @NotNull
    private final PartialMerkleTree partialMerkleTree;

    /**
     * @throws IllegalArgumentException if there is not exactly one nonce per component.
     */
    public FilteredComponentGroup(
            int groupIndex,
            @NotNull List<OpaqueBytes> components,
            @NotNull List<SecureHash> nonces,
            @NotNull PartialMerkleTree partialMerkleTree
    ) {
        super(groupIndex, components);
        if (components.size() != nonces.size()) {
            throw new IllegalArgumentException("Size of transaction components and nonces do not match");
        }
        this.nonces = List.copyOf(nonces);
        this.partialMerkleTree = Objects.requireNonNull(partialMerkleTree, "partialMerkleTree");
    }

    @NotNull
    public List<SecureHash> getNonces() {
        return nonces;
    }

    @NotNull
    public PartialMerkleTree getPartialMerkleTree() {
        return partialMerkleTree;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (!super.equals(o)) return false;
        final FilteredComponentGroup that = (FilteredComponentGroup) o;
        return nonces.equals(that.nonces) && partialMerkleTree.equals(that.partialMerkleTree);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), nonces, partialMerkleTree);
    }

    @Override
    public String toString() {
        return MessageFormat.format("FilteredComponentGroup(groupIndex={0}, components={1})", getGroupIndex(), getComponents().size());
    }
}
