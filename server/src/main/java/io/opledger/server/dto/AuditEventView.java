package io.opledger.server.dto;

import io.opledger.core.audit.AuditEvent;

public class AuditEventView {
    public String fingerprint;
    public long sequenceNumber;
    public long nonce;

    public static AuditEventView of(AuditEvent e) {
        var v = new AuditEventView();
        v.fingerprint = e.fingerprint().hex();
        v.sequenceNumber = e.sequenceNumber();
        v.nonce = e.nonce();
        return v;
    }
}
