// file: src/main/java/io/opledger/server/dto/SignerResponse.java
package io.opledger.server.dto;

/** JSON response for GET /registry/signer when the operation is recorded. */
public class SignerResponse {
    public boolean found;
    public String signer;
    public String fingerprint;
    public long sequenceNumber;
}
