package net.tearoff.v1.ledger.contracts;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.annotation.JsonTypeIdResolver;
import net.tearoff.v1.base.annotations.TearoffSerializable;
import net.tearoff.v1.serialization.AttachmentTypeIdResolver;

/**
 * Marker for the data of a command. Like {@link ContractState}, implementations come from attachments.
 */
@TearoffSerializable
@JsonTypeInfo(use = JsonTypeInfo.Id.CUSTOM, property = "@type")
@JsonTypeIdResolver(AttachmentTypeIdResolver.class)
public interface CommandData {
}
