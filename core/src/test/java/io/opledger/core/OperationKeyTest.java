package io.opledger.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Input validation for the operation tuple.
 */
class OperationKeyTest {

    @Test
    void accepts_any_non_blank_kind_and_zero_nonce() {
        var key = OperationKey.of("Archive", "doc-7", 0);

        assertEquals("Archive", key.operationKind());
        assertEquals("doc-7", key.recordId());
        assertEquals(0L, key.nonce());
        assertEquals("Archive:doc-7:0", key.toString());
    }

    @Test
    void blank_kind_or_empty_record_is_rejected() {
        assertThrows(EncodingException.class, () -> OperationKey.of(null, "r", 1));
        assertThrows(EncodingException.class, () -> OperationKey.of("", "r", 1));
        assertThrows(EncodingException.class, () -> OperationKey.of("   ", "r", 1));
        assertThrows(EncodingException.class, () -> OperationKey.of("Create", null, 1));
        assertThrows(EncodingException.class, () -> OperationKey.of("Create", "", 1));
    }

    @Test
    void negative_nonce_is_rejected() {
        var ex = assertThrows(EncodingException.class, () -> OperationKey.of("Create", "r", -1));
        assertTrue(ex.getMessage().contains("nonce"));
    }

    @Test
    void oversized_field_is_rejected() {
        String huge = "x".repeat(OperationKey.MAX_FIELD_BYTES + 1);

        assertThrows(EncodingException.class, () -> OperationKey.of("Create", huge, 1));
    }

    @Test
    void encoding_exception_is_an_illegal_argument() {
        // Callers that only know IllegalArgumentException still see bad input as bad input.
        assertThrows(IllegalArgumentException.class, () -> OperationKey.of("", "r", 1));
    }
}
