package net.tearoff.v1.ledger.identity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.tearoff.v1.base.annotations.TearoffSerializable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.security.PublicKey;
import java.text.MessageFormat;
import java.util.Objects;

/**
 * A well known identity: a name and the key it signs with.
 */
@TearoffSerializable
public final class Party {

    @NotNull
    private final String name;

    @NotNull
    private final PublicKey owningKey;

    @JsonCreator
    public Party(@JsonProperty("name") @NotNull final String name, @JsonProperty("owningKey") @NotNull final PublicKey owningKey) {
        this.name = Objects.requireNonNull(name, "name");
        this.owningKey = Objects.requireNonNull(owningKey, "owningKey");
    }

    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    public PublicKey getOwningKey() {
        return owningKey;
    }

    @Override
    public boolean equals(@Nullable final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Party party = (Party) o;
        return name.equals(party.name) && owningKey.equals(party.owningKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, owningKey);
    }

    @Override
    public String toString() {
        return MessageFormat.format("Party(name={0})", name);
    }
}
