package net.tearoff.v1.serialization.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

import static net.tearoff.v1.serialization.json.PublicKeySerializer.ALGORITHM;
import static net.tearoff.v1.serialization.json.PublicKeySerializer.ENCODED;

final class PublicKeyDeserializer extends StdDeserializer<PublicKey> {

    PublicKeyDeserializer() {
        super(PublicKey.class);
    }

    @Override
    public PublicKey deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        final JsonNode node = context.readTree(parser);
        if (node == null || !node.hasNonNull(ALGORITHM) || !node.hasNonNull(ENCODED)) {
            throw JsonMappingException.from(parser, "Public key must have '" + ALGORITHM + "' and '" + ENCODED + "' fields");
        }
        try {
            final byte[] encoded = Base64.getDecoder().decode(node.get(ENCODED).asText());
            return KeyFactory.getInstance(node.get(ALGORITHM).asText()).generatePublic(new X509EncodedKeySpec(encoded));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw JsonMappingException.from(parser, "Invalid public key", e);
        }
    }
}
