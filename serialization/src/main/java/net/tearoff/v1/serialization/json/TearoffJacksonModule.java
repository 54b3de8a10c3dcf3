package net.tearoff.v1.serialization.json;

import com.fasterxml.jackson.databind.module.SimpleModule;
import net.tearoff.v1.crypto.SecureHash;

import java.security.PublicKey;

/**
 * Registers the codecs for platform types that are not plain beans.
 */
final class TearoffJacksonModule extends SimpleModule {

    TearoffJacksonModule() {
        super("tearoff");
        addSerializer(PublicKey.class, new PublicKeySerializer());
        addDeserializer(PublicKey.class, new PublicKeyDeserializer());
        addSerializer(SecureHash.class, new SecureHashSerializer());
        addDeserializer(SecureHash.class, new SecureHashDeserializer());
    }
}
