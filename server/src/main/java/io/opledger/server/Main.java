// file: server/src/main/java/io/opledger/server/Main.java
package io.opledger.server;

import io.opledger.storage.FileWal;
import io.opledger.storage.InMemoryLedgerStore;
import io.opledger.storage.LedgerStore;
import io.opledger.storage.WalLedgerStore;

import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for a registry node.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Open the ledger store (WAL on disk, or memory only) and recover it.
 *  - Wire RegistryService and the HTTP layer.
 *  - Shut down in order: HTTP, writer pool, store.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = ServerConfig.fromArgs(args);

        // ------ Storage layer ------
        LedgerStore store = cfg.inMemory()
                ? new InMemoryLedgerStore()
                : new WalLedgerStore(new FileWal(Path.of(cfg.ledgerDir()), cfg.walRotateBytes()));

        // ------ Registry (ledger + audit index + coalescer) ------
        var registry = RegistryService.create(store, cfg.writerThreads(), cfg.submitTimeout());

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), registry);
        web.start();

        System.out.printf(
                "Registry listening on http://%s:%d (%s, %d entries)%n",
                "localhost", cfg.httpPort(),
                cfg.inMemory() ? "in-memory" : "ledger " + cfg.ledgerDir(),
                registry.ledgerSize()
        );

        // Shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            web.stop();
            registry.close();
            try {
                store.close();
            } catch (Exception e) {
                log.log(Level.WARNING, "failed to close ledger store", e);
            }
        }, "registry-shutdown"));
    }
}
