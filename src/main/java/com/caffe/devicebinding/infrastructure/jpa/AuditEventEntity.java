package com.caffe.devicebinding.infrastructure.jpa;

import jakarta.persistence.*;
import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "device_binding_audit_events")
public class AuditEventEntity {
    @Id
    @Column(name = "event_id")
    private UUID eventId;

    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    @Column(nullable = false, length = 64)
    private String type;

    @Column(name = "payload_json", nullable = false, length = 4000)
    private String payloadJson;

    @Column(name = "occurred_at", nullable = false)
    private OffsetDateTime occurredAt;

    public AuditEventEntity() {}

    public AuditEventEntity(UUID eventId, UUID accountId, String type, String payloadJson) {
        this.eventId = eventId;
        this.accountId = accountId;
        this.type = type;
        this.payloadJson = payloadJson;
        this.occurredAt = OffsetDateTime.now();
    }

    public UUID getEventId() { return eventId; }
    public UUID getAccountId() { return accountId; }
    public String getType() { return type; }
    public String getPayloadJson() { return payloadJson; }
    public OffsetDateTime getOccurredAt() { return occurredAt; }
}
