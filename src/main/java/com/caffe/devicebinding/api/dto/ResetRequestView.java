package com.caffe.devicebinding.api.dto;

import com.caffe.devicebinding.domain.binding.ResetRequest;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.OffsetDateTime;
import java.util.UUID;

@Schema(description = "Device reset request as seen by administrators")
public record ResetRequestView(
        UUID id,
        UUID accountId,
        OffsetDateTime requestedAt,
        String contactEmail,
        @Schema(description = "Whether a replacement device fingerprint was captured from the mismatched login")
        boolean candidateCaptured,
        @Schema(example = "PENDING", allowableValues = {"PENDING", "APPROVED", "DENIED"})
        String status,
        OffsetDateTime resolvedAt,
        String resolvedBy,
        String resolutionNote
) {
    public static ResetRequestView from(ResetRequest r) {
        return new ResetRequestView(r.getId(), r.getAccountId(), r.getRequestedAt(), r.getContactEmail(),
                r.hasCandidate(), r.getStatus().name(), r.getResolvedAt(), r.getResolvedBy(), r.getResolutionNote());
    }
}
