package net.tearoff.v1.ledger.crypto;

import net.tearoff.v1.crypto.DigestAlgorithmName;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Properties;

/**
 * Reads the digest algorithms from a properties resource on the class path, with the keys {@code tree},
 * {@code componentHash} and {@code componentNonce}.
 */
public final class TransactionDigestAlgorithmNamesFactoryImpl implements TransactionDigestAlgorithmNamesFactory {
    private static final Logger LOGGER = LoggerFactory.getLogger(TransactionDigestAlgorithmNamesFactoryImpl.class);

    public static final String DEFAULT_RESOURCE = "net/tearoff/v1/ledger/crypto/transaction-digest-algorithms.properties";

    static final String TREE = "tree";
    static final String COMPONENT_HASH = "componentHash";
    static final String COMPONENT_NONCE = "componentNonce";

    private final String resource;

    public TransactionDigestAlgorithmNamesFactoryImpl() {
        this(DEFAULT_RESOURCE);
    }

    public TransactionDigestAlgorithmNamesFactoryImpl(@NotNull String resource) {
        this.resource = resource;
    }

    /**
     * @throws IllegalStateException if the resource cannot be found or read, or lacks one of the keys.
     * @throws IllegalArgumentException if one of the configured algorithms is not supported.
     */
    @Override
    @NotNull
    public TransactionDigestAlgorithmNames create() {
        final Properties properties = load();
        final TransactionDigestAlgorithmNames names = new TransactionDigestAlgorithmNames(
                algorithm(properties, TREE),
                algorithm(properties, COMPONENT_HASH),
                algorithm(properties, COMPONENT_NONCE)
        );
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Loaded {} from {}", names, resource);
        }
        return names;
    }

    @NotNull
    private Properties load() {
        LOGGER.trace("Requested digest algorithms at {}.", resource);
        final URL url = getClass().getClassLoader().getResource(resource);
        if (url == null) {
            final String msg = "Transaction digest algorithms at " + resource + " cannot be found.";
            LOGGER.error(msg);
            throw new IllegalStateException(msg);
        }
        final Properties properties = new Properties();
        try (InputStream input = url.openStream()) {
            properties.load(input);
        } catch (IOException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
        return properties;
    }

    @NotNull
    private DigestAlgorithmName algorithm(@NotNull Properties properties, @NotNull String key) {
        final String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            final String msg = "Transaction digest algorithms at " + resource + " do not define '" + key + "'.";
            LOGGER.error(msg);
            throw new IllegalStateException(msg);
        }
        return new DigestAlgorithmName(value.trim());
    }
}
