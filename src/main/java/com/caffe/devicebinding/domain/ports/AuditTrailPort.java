package com.caffe.devicebinding.domain.ports;

import java.util.Map;
import java.util.UUID;

public interface AuditTrailPort {
    void record(UUID accountId, String type, Map<String, Object> payload);
}
