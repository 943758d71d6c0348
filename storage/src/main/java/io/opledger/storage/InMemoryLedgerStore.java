package io.opledger.storage;

import io.opledger.core.Fingerprint;
import io.opledger.core.LedgerEntry;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store; state is lost on exit. Good for tests and for
 * deployments where the ledger is rebuilt by an external collaborator.
 */
public class InMemoryLedgerStore implements LedgerStore {
    private final Map<Fingerprint, LedgerEntry> entries = new ConcurrentHashMap<>();

    @Override
    public boolean insertIfAbsent(LedgerEntry entry) {
        Objects.requireNonNull(entry, "entry");
        return entries.putIfAbsent(entry.fingerprint(), entry) == null;
    }

    @Override
    public Optional<LedgerEntry> read(Fingerprint fingerprint) {
        return Optional.ofNullable(entries.get(fingerprint));
    }

    @Override
    public List<LedgerEntry> entries() {
        return entries.values().stream()
                .sorted(Comparator.comparingLong(LedgerEntry::sequenceNumber))
                .toList();
    }

    @Override
    public int size() {
        return entries.size();
    }
}
