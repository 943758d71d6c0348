// file: src/main/java/io/opledger/server/dto/SubmitResponse.java
package io.opledger.server.dto;

/**
 * JSON response for POST /registry/operations.
 * Accepted:
 *   { "accepted": true, "fingerprint": "9f2c...", "sequenceNumber": 7 }
 * Duplicate:
 *   { "accepted": false, "fingerprint": "9f2c...", "sequenceNumber": null }
 */
public class SubmitResponse {
    public boolean accepted;
    public String fingerprint;
    public Long sequenceNumber;
}
