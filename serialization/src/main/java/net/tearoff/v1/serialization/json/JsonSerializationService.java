package net.tearoff.v1.serialization.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import net.tearoff.v1.base.types.ByteSequence;
import net.tearoff.v1.serialization.AttachmentTypeRegistry;
import net.tearoff.v1.serialization.SerializableTypes;
import net.tearoff.v1.serialization.SerializationContext;
import net.tearoff.v1.serialization.SerializationException;
import net.tearoff.v1.serialization.SerializationService;
import net.tearoff.v1.serialization.SerializedBytes;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * {@link SerializationService} writing components as JSON.
 * <p>
 * Output is deterministic: bean properties and map entries are sorted, dates are written as ISO-8601 strings.
 * Polymorphic application types carry their class name in an {@code @type} property and are resolved on reading
 * through the {@link SerializationContext} passed to the reader.
 */
public final class JsonSerializationService implements SerializationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonSerializationService.class);

    private final ObjectMapper mapper;
    private final SerializationContext defaultContext;

    public JsonSerializationService(@NotNull AttachmentTypeRegistry attachmentTypeRegistry) {
        this.mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .addModule(new TearoffJacksonModule())
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .build();
        this.defaultContext = new SerializationContext(attachmentTypeRegistry);
    }

    @Override
    @NotNull
    public SerializationContext getDefaultContext() {
        return defaultContext;
    }

    @Override
    @NotNull
    public <T> SerializedBytes<T> serialize(@NotNull T obj) {
        if (obj instanceof List) {
            for (Object element : (List<?>) obj) {
                SerializableTypes.requireSerializable(element.getClass());
            }
        } else {
            SerializableTypes.requireSerializable(obj.getClass());
        }
        try {
            return new SerializedBytes<>(mapper.writeValueAsBytes(obj));
        } catch (JsonProcessingException e) {
            throw rethrow("Could not serialize " + obj.getClass().getName(), e);
        }
    }

    @Override
    @NotNull
    public <T> T deserialize(@NotNull ByteSequence bytes, @NotNull Class<T> clazz, @NotNull SerializationContext context) {
        SerializableTypes.requireSerializable(clazz);
        return read(bytes, mapper.getTypeFactory().constructType(clazz), context);
    }

    @Override
    @NotNull
    public <T> List<T> deserializeList(@NotNull ByteSequence bytes, @NotNull Class<T> elementClass, @NotNull SerializationContext context) {
        SerializableTypes.requireSerializable(elementClass);
        return read(bytes, mapper.getTypeFactory().constructCollectionType(List.class, elementClass), context);
    }

    @NotNull
    private <T> T read(@NotNull ByteSequence bytes, @NotNull JavaType type, @NotNull SerializationContext context) {
        final T value;
        try (InputStream input = bytes.open()) {
            value = mapper.readerFor(type).withAttribute(SerializationContext.class, context).readValue(input);
        } catch (IOException e) {
            throw rethrow("Could not deserialize " + type, e);
        }
        if (value == null) {
            throw new SerializationException("Could not deserialize " + type + ": null value");
        }
        return value;
    }

    /**
     * Jackson wraps exceptions raised by type id resolution, so the first {@link SerializationException} in the
     * cause chain is surfaced as is.
     */
    @NotNull
    private static SerializationException rethrow(@NotNull String message, @NotNull IOException e) {
        final SerializationException cause = findCause(e);
        if (cause != null) {
            return cause;
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(message + ": " + e.getMessage(), e);
        }
        return new SerializationException(message + ": " + e.getMessage(), e);
    }

    @Nullable
    private static SerializationException findCause(@NotNull Throwable e) {
        for (Throwable current = e; current != null; current = current.getCause()) {
            if (current instanceof SerializationException) {
                return (SerializationException) current;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return null;
    }
}
