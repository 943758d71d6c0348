// file: src/main/java/io/opledger/server/dto/SubmitRequest.java
package io.opledger.server.dto;

/**
 * JSON body for POST /registry/operations.
 * Example:
 *   {
 *     "operationKind": "Create",
 *     "recordId": "user_1",
 *     "nonce": 100,
 *     "signer": "alice"
 *   }
 */
public class SubmitRequest {
    public String operationKind;
    public String recordId;
    public Long nonce;   // boxed so a missing field is detectable
    public String signer;
}
