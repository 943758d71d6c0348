package io.opledger.core;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import static org.junit.jupiter.api.Assertions.*;

class FingerprintCodecTest {

    @Test
    void same_tuple_always_gives_same_fingerprint() {
        var a = FingerprintCodec.encode("Create", "user_1", 100);
        var b = FingerprintCodec.encode(OperationKey.of("Create", "user_1", 100));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(Fingerprint.LENGTH, a.bytes().length);
    }

    @Test
    void shifted_field_boundary_does_not_collide() {
        // Plain concatenation would read "ABC1" for both.
        var left = FingerprintCodec.encode("A", "BC", 1);
        var right = FingerprintCodec.encode("AB", "C", 1);

        assertNotEquals(left, right);
    }

    @Test
    void digits_moving_between_record_and_nonce_do_not_collide() {
        // ("Update","data1",23) vs ("Update","data",123): "data123" either way when concatenated.
        var a = FingerprintCodec.encode("Update", "data1", 23);
        var b = FingerprintCodec.encode("Update", "data", 123);

        assertNotEquals(a, b);
    }

    @Test
    void each_field_changes_the_fingerprint() {
        var base = FingerprintCodec.encode("Create", "user_1", 100);

        assertNotEquals(base, FingerprintCodec.encode("Update", "user_1", 100));
        assertNotEquals(base, FingerprintCodec.encode("Create", "user_2", 100));
        assertNotEquals(base, FingerprintCodec.encode("Create", "user_1", 200));
    }

    @Test
    void pre_image_is_length_prefixed_and_hashed_with_sha256() throws Exception {
        var key = OperationKey.of("Delete", "r-9", 7L);
        byte[] pre = FingerprintCodec.preImage(key);

        ByteBuffer b = ByteBuffer.wrap(pre);
        byte[] tag = new byte[FingerprintCodec.DOMAIN_TAG.length];
        b.get(tag);
        assertArrayEquals(FingerprintCodec.DOMAIN_TAG, tag);
        assertEquals(6, b.getInt());
        byte[] kind = new byte[6];
        b.get(kind);
        assertEquals("Delete", new String(kind, StandardCharsets.UTF_8));
        assertEquals(3, b.getInt());
        b.position(b.position() + 3);
        assertEquals(7L, b.getLong());
        assertFalse(b.hasRemaining());

        byte[] expected = MessageDigest.getInstance("SHA-256").digest(pre);
        assertArrayEquals(expected, FingerprintCodec.encode(key).bytes());
    }

    @Test
    void non_ascii_fields_are_prefixed_with_utf8_byte_length() {
        // Precomposed e-acute vs e + combining accent: no normalization is applied.
        var composed = OperationKey.of("Create", "caf\u00e9", 1);
        var decomposed = OperationKey.of("Create", "cafe\u0301", 1);

        assertNotEquals(FingerprintCodec.encode(composed), FingerprintCodec.encode(decomposed));

        ByteBuffer b = ByteBuffer.wrap(FingerprintCodec.preImage(composed));
        b.position(FingerprintCodec.DOMAIN_TAG.length + 4 + "Create".length());
        assertEquals(5, b.getInt(), "4 chars, 5 UTF-8 bytes");
    }

    @Test
    void unpaired_surrogate_is_rejected_instead_of_replaced() {
        // String.getBytes would turn both into "?" and collide.
        assertThrows(EncodingException.class, () -> FingerprintCodec.encode("Create", "bad\uD800", 1));
        assertThrows(EncodingException.class, () -> FingerprintCodec.encode("\uDC00", "r", 1));
    }

    @Test
    void hex_form_round_trips() {
        var fp = FingerprintCodec.encode("Create", "user_1", 100);
        String hex = fp.hex();

        assertEquals(64, hex.length());
        assertEquals(fp, Fingerprint.fromHex(hex));
        assertEquals("0x" + hex, fp.toString());
        assertThrows(IllegalArgumentException.class, () -> Fingerprint.fromHex("abcd"));
    }
}
