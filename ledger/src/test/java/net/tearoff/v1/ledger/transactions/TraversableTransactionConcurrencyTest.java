package net.tearoff.v1.ledger.transactions;

import net.tearoff.v1.ledger.contracts.Command;
import net.tearoff.v1.ledger.contracts.ContractState;
import net.tearoff.v1.ledger.contracts.TransactionState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

public class TraversableTransactionConcurrencyTest {

    private static final int THREADS = 8;

    @Test
    public void concurrentReadersShareDeserializedComponents() throws Exception {
        final WireTransaction wtx = LedgerTestFixtures.standardTransaction();
        final CountDownLatch start = new CountDownLatch(1);
        final ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            final List<Future<Object[]>> results = new ArrayList<>();
            for (int i = 0; i < THREADS; i++) {
                final Callable<Object[]> read = () -> {
                    start.await();
                    final List<TransactionState<ContractState>> outputs = wtx.getOutputs();
                    final List<Command<?>> commands = wtx.getCommands();
                    return new Object[]{outputs.get(0), outputs.get(1), commands.get(0).getValue()};
                };
                results.add(executor.submit(read));
            }
            start.countDown();

            final Object[] first = results.get(0).get(10, TimeUnit.SECONDS);
            for (Future<Object[]> result : results) {
                final Object[] values = result.get(10, TimeUnit.SECONDS);
                for (int i = 0; i < values.length; i++) {
                    assertThat(values[i]).isSameAs(first[i]);
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
