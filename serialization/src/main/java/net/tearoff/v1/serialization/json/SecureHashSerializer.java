package net.tearoff.v1.serialization.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import net.tearoff.v1.crypto.SecureHash;

import java.io.IOException;

/**
 * Writes a hash in its {@code ALGORITHM:HEX} string form.
 */
final class SecureHashSerializer extends StdSerializer<SecureHash> {

    SecureHashSerializer() {
        super(SecureHash.class);
    }

    @Override
    public void serialize(SecureHash hash, JsonGenerator generator, SerializerProvider provider) throws IOException {
        generator.writeString(hash.toString());
    }
}
