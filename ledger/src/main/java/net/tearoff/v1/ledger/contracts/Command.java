package net.tearoff.v1.ledger.contracts;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.security.PublicKey;
import java.text.MessageFormat;
import java.util.List;
import java.util.Objects;

/**
 * Command data paired with the keys required to sign for it. A transaction stores the data and the signers in
 * separate component groups, and pairs them again when it is read.
 *
 * @param <T> The type of the command data.
 */
public final class Command<T extends CommandData> {

    @NotNull
    private final T value;

    @NotNull
    private final List<PublicKey> signers;

    public Command(@NotNull final T value, @NotNull final List<PublicKey> signers) {
        if (signers.isEmpty()) {
            throw new IllegalArgumentException("List of signers cannot be empty");
        }
        this.value = Objects.requireNonNull(value, "value");
        this.signers = List.copyOf(signers);
    }

    public Command(@NotNull final T value, @NotNull final PublicKey key) {
        this(value, List.of(key));
    }

    @NotNull
    public T getValue() {
        return value;
    }

    @NotNull
    public List<PublicKey> getSigners() {
        return signers;
    }

    @Override
    public boolean equals(@Nullable final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Command<?> command = (Command<?>) o;
        return value.equals(command.value) && signers.equals(command.signers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, signers);
    }

    @Override
    public String toString() {
        return MessageFormat.format("Command(value={0}, signers={1})", value, signers.size());
    }
}
