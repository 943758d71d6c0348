package io.opledger.server;

import io.opledger.core.BackendUnavailableException;
import io.opledger.core.LedgerEntry;
import io.opledger.storage.InMemoryLedgerStore;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** Test-only store: inserts block until {@link #open()}; can be told to fail. */
final class GatedStore extends InMemoryLedgerStore {
    private final CountDownLatch gate = new CountDownLatch(1);
    volatile boolean failInserts;

    void open() {
        gate.countDown();
    }

    @Override
    public boolean insertIfAbsent(LedgerEntry entry) {
        try {
            if (!gate.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("gate never opened");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
        if (failInserts) {
            throw new BackendUnavailableException("backend down");
        }
        return super.insertIfAbsent(entry);
    }
}
