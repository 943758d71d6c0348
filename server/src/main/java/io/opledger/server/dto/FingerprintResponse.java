package io.opledger.server.dto;

/** JSON response for GET /registry/fingerprint. */
public class FingerprintResponse {
    public String fingerprint;
}
