package net.tearoff.v1.ledger.transactions;

import net.tearoff.v1.base.annotations.TearoffSerializable;
import net.tearoff.v1.base.types.OpaqueBytes;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.text.MessageFormat;
import java.util.List;
import java.util.Objects;

/**
 * The serialised components of one type in a transaction.
 *
 * @see net.tearoff.v1.ledger.contracts.ComponentGroupEnum
 */
@TearoffSerializable
public class ComponentGroup {

    private final int groupIndex;

    @NotNull
    private final List<OpaqueBytes> components;

    public ComponentGroup(int groupIndex, @NotNull List<OpaqueBytes> components) {
        this.groupIndex = groupIndex;
        this.components = List.copyOf(components);
    }

    public int getGroupIndex() {
        return groupIndex;
    }

    @NotNull
    public List<OpaqueBytes> getComponents() {
        return components;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final ComponentGroup that = (ComponentGroup) o;
        return groupIndex == that.groupIndex && components.equals(that.components);
    }

    @Override
    public int hashCode() {
        return Objects.hash(groupIndex, components);
    }

    @Override
    public String toString() {
        return MessageFormat.format("ComponentGroup(groupIndex={0}, components={1})", groupIndex, components.size());
    }
}
