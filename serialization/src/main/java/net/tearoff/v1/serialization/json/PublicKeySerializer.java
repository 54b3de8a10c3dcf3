package net.tearoff.v1.serialization.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.security.PublicKey;
import java.util.Base64;

/**
 * Writes a public key as its algorithm and base64 X.509 encoding.
 */
final class PublicKeySerializer extends StdSerializer<PublicKey> {

    static final String ALGORITHM = "algorithm";
    static final String ENCODED = "encoded";

    PublicKeySerializer() {
        super(PublicKey.class);
    }

    @Override
    public void serialize(PublicKey key, JsonGenerator generator, SerializerProvider provider) throws IOException {
        generator.writeStartObject();
        generator.writeStringField(ALGORITHM, key.getAlgorithm());
        generator.writeStringField(ENCODED, Base64.getEncoder().encodeToString(key.getEncoded()));
        generator.writeEndObject();
    }
}
