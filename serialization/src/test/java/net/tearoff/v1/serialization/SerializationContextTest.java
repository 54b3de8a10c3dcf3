package net.tearoff.v1.serialization;

import net.tearoff.v1.base.annotations.TearoffSerializable;
import net.tearoff.v1.crypto.SecureHash;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class SerializationContextTest {

    @TearoffSerializable
    interface Animal {
    }

    static class Dog implements Animal {
    }

    @TearoffSerializable
    static class Stone {
    }

    private static final SecureHash KNOWN = SecureHash.parse("SHA-256:0000000000000000000000000000000000000000000000000000000000000001");
    private static final SecureHash UNKNOWN = SecureHash.parse("SHA-256:0000000000000000000000000000000000000000000000000000000000000002");

    private AttachmentTypeRegistry registry;

    @BeforeEach
    void setup() {
        registry = mock(AttachmentTypeRegistry.class);
        when(registry.getTypes(KNOWN)).thenReturn(Set.of(Dog.class, Stone.class));
        when(registry.getTypes(UNKNOWN)).thenReturn(null);
    }

    @Test
    void defaultContextHasNoAttachments() {
        final SerializationContext context = new SerializationContext(registry);
        assertThat(context.getAttachments()).isEmpty();
        assertThatThrownBy(() -> context.resolveType(Dog.class.getName(), Animal.class))
                .isInstanceOf(SerializationException.class)
                .isNotInstanceOf(MissingAttachmentsException.class);
    }

    @Test
    void attachmentsContextResolvesProvidedTypes() {
        final SerializationContext context = new SerializationContext(registry).withAttachments(List.of(KNOWN));
        assertThat(context.resolveType(Dog.class.getName(), Animal.class)).isEqualTo(Dog.class);
    }

    @Test
    void resolvedTypeMustBeSubtypeOfBase() {
        final SerializationContext context = new SerializationContext(registry).withAttachments(List.of(KNOWN));
        assertThatThrownBy(() -> context.resolveType(Stone.class.getName(), Animal.class))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("is not a");
    }

    @Test
    void unknownAttachmentsAreReportedWhenTypeIsNotFound() {
        final SerializationContext context = new SerializationContext(registry).withAttachments(List.of(UNKNOWN));
        assertThatThrownBy(() -> context.resolveType(Dog.class.getName(), Animal.class))
                .isInstanceOfSatisfying(MissingAttachmentsException.class,
                        e -> assertThat(e.getIds()).containsExactly(UNKNOWN));
    }

    @Test
    void knownAttachmentWinsOverUnknownOne() {
        final SerializationContext context = new SerializationContext(registry).withAttachments(List.of(UNKNOWN, KNOWN));
        assertThat(context.resolveType(Dog.class.getName(), Animal.class)).isEqualTo(Dog.class);
    }
}
