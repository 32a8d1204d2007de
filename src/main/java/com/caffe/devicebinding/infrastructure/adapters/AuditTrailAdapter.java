package com.caffe.devicebinding.infrastructure.adapters;

import com.caffe.devicebinding.domain.ports.AuditTrailPort;
import com.caffe.devicebinding.infrastructure.jpa.AuditEventEntity;
import com.caffe.devicebinding.infrastructure.jpa.SpringAuditEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Writes device binding audit events as JSON rows in the caller's transaction.
 */
@Component
public class AuditTrailAdapter implements AuditTrailPort {

    public static final String BINDING_CREATED = "binding.created";
    public static final String BINDING_REPLACED = "binding.replaced";
    public static final String BINDING_CLEARED = "binding.cleared";
    public static final String DEVICE_MISMATCH = "device.mismatch";
    public static final String RESET_REQUESTED = "reset.requested";
    public static final String RESET_APPROVED = "reset.approved";
    public static final String RESET_DENIED = "reset.denied";

    private static final Logger log = LoggerFactory.getLogger(AuditTrailAdapter.class);

    private final SpringAuditEventRepository events;
    private final ObjectMapper objectMapper;

    public AuditTrailAdapter(SpringAuditEventRepository events, ObjectMapper objectMapper) {
        this.events = events;
        this.objectMapper = objectMapper;
    }

    @Override
    public void record(UUID accountId, String type, Map<String, Object> payload) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("accountId", accountId.toString());
        body.put("eventType", type);
        body.put("timestamp", OffsetDateTime.now().toString());
        if (payload != null) {
            body.putAll(payload);
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + type + " audit payload", e);
        }

        AuditEventEntity saved = events.save(new AuditEventEntity(UUID.randomUUID(), accountId, type, json));
        log.info("Recorded audit event - ID: {}, Type: {}, Account: {}", saved.getEventId(), type, accountId);
    }
}
