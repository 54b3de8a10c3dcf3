package net.tearoff.v1.ledger.crypto;

import org.jetbrains.annotations.NotNull;

/**
 * Supplies the digest algorithms new transactions are built with.
 */
public interface TransactionDigestAlgorithmNamesFactory {

    @NotNull
    TransactionDigestAlgorithmNames create();
}
