package io.opledger.core;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Fixed-width (32 byte) deduplication key produced by {@link FingerprintCodec}.
 * <p>
 * Invariants:
 *  - Immutable; the bytes are copied on input and output.
 *  - Equality and hashCode are by content, so instances work as map keys.
 */
public final class Fingerprint {
    public static final int LENGTH = 32;

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;

    public Fingerprint(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("fingerprint must be " + LENGTH + " bytes, got: " + bytes.length);
        }
        this.bytes = Arrays.copyOf(bytes, LENGTH);
    }

    /** Parse the 64-character hex form produced by {@link #hex()}. */
    public static Fingerprint fromHex(String hex) {
        Objects.requireNonNull(hex, "hex");
        if (hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException("fingerprint hex must be " + (LENGTH * 2) + " chars");
        }
        return new Fingerprint(HEX.parseHex(hex));
    }

    public byte[] bytes() { return Arrays.copyOf(bytes, LENGTH); }

    public String hex() { return HEX.formatHex(bytes); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fingerprint other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() { return Arrays.hashCode(bytes); }

    @Override
    public String toString() { return "0x" + hex(); }
}
