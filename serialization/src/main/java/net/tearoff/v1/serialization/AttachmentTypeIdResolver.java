package net.tearoff.v1.serialization;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DatabindContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.jsontype.impl.TypeIdResolverBase;
import org.jetbrains.annotations.NotNull;

/**
 * Jackson type id resolver for polymorphic application types.
 * <p>
 * The type id written is the class name. On reading, the id is resolved through the {@link SerializationContext}
 * passed as a reader attribute, so a type can only be instantiated if one of the context's attachments provides it.
 */
public class AttachmentTypeIdResolver extends TypeIdResolverBase {

    private JavaType baseType;

    @Override
    public void init(JavaType baseType) {
        this.baseType = baseType;
    }

    @Override
    public String idFromValue(Object value) {
        return idFromValueAndType(value, value.getClass());
    }

    @Override
    public String idFromValueAndType(Object value, Class<?> suggestedType) {
        SerializableTypes.requireSerializable(suggestedType);
        return suggestedType.getName();
    }

    @Override
    public JavaType typeFromId(@NotNull DatabindContext context, @NotNull String id) {
        final Object attribute = context.getAttribute(SerializationContext.class);
        if (!(attribute instanceof SerializationContext)) {
            throw new SerializationException("No serialization context available to resolve type " + id);
        }
        final Class<?> type = ((SerializationContext) attribute).resolveType(id, baseType.getRawClass());
        return context.constructSpecializedType(baseType, type);
    }

    @Override
    public JsonTypeInfo.Id getMechanism() {
        return JsonTypeInfo.Id.CUSTOM;
    }
}
