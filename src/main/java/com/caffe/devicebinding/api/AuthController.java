package com.caffe.devicebinding.api;

import com.caffe.devicebinding.api.dto.ApiErrorResponse;
import com.caffe.devicebinding.application.AccountMetadataService;
import com.caffe.devicebinding.application.DeviceLoginService;
import com.caffe.devicebinding.application.DeviceLoginService.LoginResult;
import com.caffe.devicebinding.application.DeviceResetService;
import com.caffe.devicebinding.config.JwtService;
import com.caffe.devicebinding.domain.binding.FingerprintBinding;
import com.caffe.devicebinding.domain.binding.ResetRequest;
import com.caffe.devicebinding.domain.fingerprint.FingerprintHasher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.web.bind.annotation.*;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/auth")
@Tag(name = "Authentication", description = "Observer login with device binding and device reset requests")
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final DeviceLoginService loginService;
    private final DeviceResetService resetService;
    private final AccountMetadataService metadataService;
    private final JwtService jwt;

    public AuthController(DeviceLoginService loginService, DeviceResetService resetService,
                          AccountMetadataService metadataService, JwtService jwt) {
        this.loginService = loginService;
        this.resetService = resetService;
        this.metadataService = metadataService;
        this.jwt = jwt;
    }

    @PostMapping("/login")
    @Operation(
            summary = "Authenticate an observer on a device",
            description = """
        Verifies username and password, then the device fingerprint:
        - the first successful login binds the account to the presented fingerprint
        - later logins must present the bound fingerprint (or one within the similarity threshold)

        A refused device is answered with `DEVICE_MISMATCH`; the observer can then file a
        device reset request.
        """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Authenticated on a bound or newly bound device"),
            @ApiResponse(responseCode = "401", description = "Invalid credentials",
                    content = @Content(schema = @Schema(implementation = ApiErrorResponse.class))),
            @ApiResponse(
                    responseCode = "403",
                    description = "Account is bound to another device",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    name = "Device mismatch",
                                    value = """
                        {
                            "error": "DEVICE_MISMATCH",
                            "message": "This account is bound to another device",
                            "traceId": "4f1c2d9e-0a7b-4c55-9d0e-3b8f6a2c1e77",
                            "timestamp": "2026-01-11T18:30:00Z",
                            "details": { "observerId": "OBS-1042", "resetPending": false }
                        }
                        """
                            )
                    )
            )
    })
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest req, HttpServletRequest request) {
        LoginResult result = loginService.login(req.username(), req.password(), req.deviceFingerprint(),
                getClientIpAddress(request), request.getHeader("User-Agent"));

        String token = jwt.generateToken(result.account().getUsername(), result.account().getObserverId(),
                result.account().getRoles());

        return ResponseEntity.ok(new LoginResponse(
                token,
                "Bearer",
                jwt.getTtlSeconds(),
                result.newlyBound() ? "BOUND_FIRST_DEVICE" : "VERIFIED",
                new UserInfo(result.account().getUsername(), result.account().getRoles(),
                        result.account().getObserverId())
        ));
    }

    @PostMapping("/device-reset-request")
    @Operation(
            summary = "Request a device reset",
            description = "Files a pending reset request after a device mismatch. An administrator approves or denies it."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Reset request accepted for review"),
            @ApiResponse(responseCode = "404", description = "Unknown username"),
            @ApiResponse(responseCode = "409", description = "A request is already pending, or there is no recent device mismatch")
    })
    public ResponseEntity<ResetRequestAccepted> requestDeviceReset(@Valid @RequestBody DeviceResetRequest req) {
        ResetRequest created = resetService.requestReset(req.username(), req.contactEmail());
        log.info("Device reset request {} accepted", created.getId());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new ResetRequestAccepted(created.getId(), created.getStatus().name(), created.getRequestedAt()));
    }

    @GetMapping("/whoami")
    @Operation(summary = "Current observer", description = "Token subject, roles and device binding status")
    @SecurityRequirement(name = "Bearer Authentication")
    public ResponseEntity<WhoAmIResponse> whoami(Authentication authentication) {
        Set<String> roles = authentication.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .map(a -> a.startsWith("ROLE_") ? a.substring(5) : a)
                .collect(Collectors.toSet());
        Optional<FingerprintBinding> binding = metadataService.bindingOf(authentication.getName());
        String observerId = authentication.getDetails() instanceof String s ? s : null;

        return ResponseEntity.ok(new WhoAmIResponse(
                authentication.getName(),
                roles,
                observerId,
                binding.isPresent(),
                binding.map(FingerprintBinding::getBoundAt).orElse(null)
        ));
    }

    private String getClientIpAddress(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }

        String xRealIp = request.getHeader("X-Real-IP");
        if (xRealIp != null && !xRealIp.isEmpty()) {
            return xRealIp;
        }

        return request.getRemoteAddr();
    }

    // ==========================================================================
    // DTOs
    // ==========================================================================

    @Schema(description = "Observer login request")
    public record LoginRequest(
            @Schema(description = "Observer username", example = "observer.jane")
            @NotBlank String username,

            @Schema(description = "Password", example = "secure-password")
            @NotBlank String password,

            @Schema(description = "Device fingerprint generated on the client (hex digest or fallback identifier)",
                    example = "3f9a0c5e6b1d...")
            @NotBlank
            @Pattern(regexp = FingerprintHasher.DIGEST_PATTERN,
                    message = "must be a lowercase hex digest or a fallback identifier")
            String deviceFingerprint
    ) {}

    @Schema(description = "Successful login response")
    public record LoginResponse(
            @Schema(description = "JWT access token")
            String accessToken,

            @Schema(description = "Token type", example = "Bearer")
            String tokenType,

            @Schema(description = "Token expiration time in seconds", example = "3600")
            long expiresInSeconds,

            @Schema(description = "Device check outcome", allowableValues = {"BOUND_FIRST_DEVICE", "VERIFIED"})
            String deviceStatus,

            @Schema(description = "Observer information")
            UserInfo user
    ) {}

    @Schema(description = "Observer information")
    public record UserInfo(
            @Schema(description = "Username", example = "observer.jane")
            String username,

            @Schema(description = "Roles", example = "[\"OBSERVER\"]")
            Set<String> roles,

            @Schema(description = "Observer ID", example = "OBS-1042")
            String observerId
    ) {}

    @Schema(description = "Device reset request")
    public record DeviceResetRequest(
            @Schema(description = "Observer username", example = "observer.jane")
            @NotBlank String username,

            @Schema(description = "Where to send the outcome; the registered email when omitted",
                    example = "jane@example.org")
            @Email @Size(max = 320) String contactEmail
    ) {}

    @Schema(description = "Accepted device reset request")
    public record ResetRequestAccepted(
            UUID requestId,
            @Schema(example = "PENDING") String status,
            OffsetDateTime requestedAt
    ) {}

    @Schema(description = "Current observer and device binding status")
    public record WhoAmIResponse(
            String subject,
            Set<String> roles,
            String observerId,
            @Schema(description = "Whether the account is bound to a device") boolean bound,
            OffsetDateTime boundAt
    ) {}
}
