package net.tearoff.v1.serialization.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import net.tearoff.v1.crypto.SecureHash;

import java.io.IOException;

final class SecureHashDeserializer extends StdDeserializer<SecureHash> {

    SecureHashDeserializer() {
        super(SecureHash.class);
    }

    @Override
    public SecureHash deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        if (parser.currentToken() != JsonToken.VALUE_STRING) {
            return (SecureHash) context.handleUnexpectedToken(SecureHash.class, parser);
        }
        try {
            return SecureHash.parse(parser.getText());
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(parser, "Invalid secure hash " + parser.getText(), e);
        }
    }
}
