// file: src/main/java/io/opledger/server/dto/HistoryResponse.java
package io.opledger.server.dto;

import java.util.List;

/**
 * JSON response for GET /registry/history/{signer}.
 * Example:
 *   {
 *     "signer": "alice",
 *     "count": 2,
 *     "events": [
 *       { "fingerprint": "9f2c...", "sequenceNumber": 1, "nonce": 100 },
 *       { "fingerprint": "07ab...", "sequenceNumber": 4, "nonce": 101 }
 *     ]
 *   }
 */
public class HistoryResponse {
    public String signer;
    public int count;
    public List<AuditEventView> events;
}
