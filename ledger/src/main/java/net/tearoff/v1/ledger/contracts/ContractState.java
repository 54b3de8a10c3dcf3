package net.tearoff.v1.ledger.contracts;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.annotation.JsonTypeIdResolver;
import net.tearoff.v1.base.annotations.TearoffSerializable;
import net.tearoff.v1.serialization.AttachmentTypeIdResolver;
import org.jetbrains.annotations.NotNull;

import java.security.PublicKey;
import java.util.List;

/**
 * The application data of a transaction output. Implementations are provided by attachments, so an output can
 * only be read with a serialization context that lists the transaction's attachments.
 */
@TearoffSerializable
@JsonTypeInfo(use = JsonTypeInfo.Id.CUSTOM, property = "@type")
@JsonTypeIdResolver(AttachmentTypeIdResolver.class)
public interface ContractState {

    /**
     * @return The keys of the parties that have an interest in this state.
     */
    @NotNull
    List<PublicKey> getParticipants();
}
