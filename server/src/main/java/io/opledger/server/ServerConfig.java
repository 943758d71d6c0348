// file: server/src/main/java/io/opledger/server/ServerConfig.java
package io.opledger.server;

import java.time.Duration;

/**
 * Registry node configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:        external HTTP API port
 *  - ledgerDir:       directory for ledger WAL segments
 *  - inMemory:        keep the ledger in memory only (ledgerDir is ignored)
 *  - walRotateBytes:  segment size after which the WAL rolls to a new file
 *  - submitTimeoutMs: default wait limit for submissions, 0 for none
 *  - writerThreads:   size of the ledger writer pool
 */
public record ServerConfig(
        int httpPort,
        String ledgerDir,
        boolean inMemory,
        long walRotateBytes,
        long submitTimeoutMs,
        int writerThreads
) {

    public static final long DEFAULT_ROTATE_BYTES = 64L * 1024 * 1024;
    public static final int MAX_PORT = 65_535;

    public ServerConfig {
        if (httpPort < 1 || httpPort > MAX_PORT) {
            throw new IllegalArgumentException("httpPort must be in 1.." + MAX_PORT + ", got: " + httpPort);
        }
    }

    /** Default wait limit, or null when submissions may wait indefinitely. */
    public Duration submitTimeout() {
        return submitTimeoutMs > 0 ? Duration.ofMillis(submitTimeoutMs) : null;
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port,  -p   <port>
     *   --ledger-dir, -d   <path>
     *   --in-memory
     *   --wal-rotate-bytes  <bytes>
     *   --submit-timeout-ms <ms>
     *   --writer-threads    <n>
     *   --help,       -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        // Defaults
        int httpPort = 8080;
        String ledgerDir = "./data/ledger";
        boolean inMemory = false;
        long rotateBytes = DEFAULT_ROTATE_BYTES;
        long submitTimeoutMs = 5_000;
        int writerThreads = 4;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = (int) parseBounded(args[i], args[++i], MAX_PORT);
                }

                case "--ledger-dir", "-d" -> {
                    ensureValue(args, i);
                    ledgerDir = args[++i];
                }

                case "--in-memory" -> inMemory = true;

                case "--wal-rotate-bytes" -> {
                    ensureValue(args, i);
                    rotateBytes = parseBounded(args[i], args[++i], Long.MAX_VALUE);
                }

                case "--submit-timeout-ms" -> {
                    ensureValue(args, i);
                    String raw = args[++i];
                    submitTimeoutMs = "0".equals(raw) ? 0 : parseBounded(args[i - 1], raw, Integer.MAX_VALUE);
                }

                case "--writer-threads" -> {
                    ensureValue(args, i);
                    writerThreads = (int) parseBounded(args[i], args[++i], Integer.MAX_VALUE);
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(
                httpPort,
                ledgerDir,
                inMemory,
                rotateBytes,
                submitTimeoutMs,
                writerThreads
        );
    }

    /** Parses a value in 1..max, or exits with status 1. */
    static long parseBounded(String flag, String raw, long max) {
        long v;
        try {
            v = Long.parseLong(raw);
        } catch (NumberFormatException e) {
            v = -1;
        }
        if (v <= 0 || v > max) {
            System.err.println("Invalid value for " + flag + ": " + raw);
            System.exit(1);
        }
        return v;
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --http-port,  -p       HTTP port, 1-65535 (default: 8080)
              --ledger-dir, -d       Ledger WAL directory (default: ./data/ledger)
              --in-memory            Keep the ledger in memory only
              --wal-rotate-bytes     WAL segment size in bytes (default: 67108864)
              --submit-timeout-ms    Default submission wait limit, 0 = none (default: 5000)
              --writer-threads       Ledger writer pool size (default: 4)
              --help,       -h       Show this help message
            """);
        System.exit(0);
    }
}
