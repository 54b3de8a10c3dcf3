package net.tearoff.v1.ledger.transactions;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Supplier;

/**
 * Write-once slots for the deserialised form of each component, addressed by group index and position.
 * Two threads may both deserialise a component, but only the first result is kept and returned to both.
 */
final class DeserializedComponentCache {

    private final Map<Integer, AtomicReferenceArray<Object>> groups;

    DeserializedComponentCache(@NotNull List<? extends ComponentGroup> componentGroups) {
        final Map<Integer, AtomicReferenceArray<Object>> slots = new HashMap<>();
        for (ComponentGroup group : componentGroups) {
            slots.put(group.getGroupIndex(), new AtomicReferenceArray<>(group.getComponents().size()));
        }
        groups = Collections.unmodifiableMap(slots);
    }

    @SuppressWarnings("unchecked")
    @NotNull
    <T> T get(int groupIndex, int internalIndex, @NotNull Supplier<T> deserializer) {
        final AtomicReferenceArray<Object> slots = groups.get(groupIndex);
        final Object cached = slots.get(internalIndex);
        if (cached != null) {
            return (T) cached;
        }
        slots.compareAndSet(internalIndex, null, deserializer.get());
        return (T) slots.get(internalIndex);
    }
}
