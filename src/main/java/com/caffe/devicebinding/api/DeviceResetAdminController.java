package com.caffe.devicebinding.api;

import com.caffe.devicebinding.api.dto.ResetRequestView;
import com.caffe.devicebinding.application.DeviceResetService;
import com.caffe.devicebinding.domain.binding.ResetRequestStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/admin")
@Tag(name = "Device reset administration", description = "Review, approve and deny device reset requests")
@SecurityRequirement(name = "Bearer Authentication")
@PreAuthorize("hasRole('ADMIN')")
public class DeviceResetAdminController {

    private static final Logger log = LoggerFactory.getLogger(DeviceResetAdminController.class);

    private final DeviceResetService resetService;

    public DeviceResetAdminController(DeviceResetService resetService) {
        this.resetService = resetService;
    }

    @GetMapping("/device-resets")
    @Operation(summary = "List reset requests by status", description = "Oldest first; PENDING by default")
    public List<ResetRequestView> list(
            @Parameter(description = "Request status", example = "PENDING")
            @RequestParam(defaultValue = "PENDING") ResetRequestStatus status) {
        return resetService.listByStatus(status).stream().map(ResetRequestView::from).toList();
    }

    @GetMapping("/device-resets/{id}")
    @Operation(summary = "Get a reset request")
    public ResetRequestView get(@PathVariable UUID id) {
        return ResetRequestView.from(resetService.get(id));
    }

    @GetMapping("/accounts/{accountId}/device-resets")
    @Operation(summary = "Reset history of an account", description = "Every request ever filed, newest first")
    public List<ResetRequestView> history(@PathVariable UUID accountId) {
        return resetService.historyForAccount(accountId).stream().map(ResetRequestView::from).toList();
    }

    @PostMapping("/device-resets/{id}/approve")
    @Operation(
            summary = "Approve a reset request",
            description = "Rebinds the account to the device of the mismatched login, or clears the binding so the next login binds"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Request approved"),
            @ApiResponse(responseCode = "404", description = "Unknown request"),
            @ApiResponse(responseCode = "409", description = "Request is no longer pending")
    })
    public ResponseEntity<ResetRequestView> approve(@PathVariable UUID id,
                                                    @Valid @RequestBody(required = false) ResolutionRequest body) {
        log.info("Admin approval requested for device reset {}", id);
        return ResponseEntity.ok(ResetRequestView.from(resetService.approve(id, body == null ? null : body.note())));
    }

    @PostMapping("/device-resets/{id}/deny")
    @Operation(summary = "Deny a reset request", description = "The existing binding stays in place")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Request denied"),
            @ApiResponse(responseCode = "404", description = "Unknown request"),
            @ApiResponse(responseCode = "409", description = "Request is no longer pending")
    })
    public ResponseEntity<ResetRequestView> deny(@PathVariable UUID id,
                                                 @Valid @RequestBody(required = false) ResolutionRequest body) {
        log.info("Admin denial requested for device reset {}", id);
        return ResponseEntity.ok(ResetRequestView.from(resetService.deny(id, body == null ? null : body.note())));
    }

    @Schema(description = "Optional note recorded with the resolution")
    public record ResolutionRequest(
            @Schema(example = "Verified by phone with the observer")
            @Size(max = 500) String note
    ) {}
}
