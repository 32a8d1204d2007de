package com.caffe.devicebinding.api;

import com.caffe.devicebinding.application.DeviceFingerprintGenerator;
import com.caffe.devicebinding.domain.DeviceFingerprintVerifier;
import com.caffe.devicebinding.domain.fingerprint.FallbackDigests;
import com.caffe.devicebinding.domain.fingerprint.FingerprintHasher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/admin/fingerprint")
@Tag(name = "Fingerprint diagnostics", description = "Check fingerprint generation and matching")
@SecurityRequirement(name = "Bearer Authentication")
@PreAuthorize("hasRole('ADMIN')")
public class FingerprintDiagnosticsController {

    private static final Logger log = LoggerFactory.getLogger(FingerprintDiagnosticsController.class);

    private final DeviceFingerprintGenerator hostGenerator;
    private final FingerprintHasher hasher;
    private final DeviceFingerprintVerifier verifier;

    public FingerprintDiagnosticsController(@Qualifier("hostFingerprintGenerator") DeviceFingerprintGenerator hostGenerator,
                                            FingerprintHasher hasher, DeviceFingerprintVerifier verifier) {
        this.hostGenerator = hostGenerator;
        this.hasher = hasher;
        this.verifier = verifier;
    }

    @GetMapping("/host")
    @Operation(summary = "Fingerprint of the server JVM", description = "Runs signal collection and hashing on the server itself")
    public ResponseEntity<?> host() {
        String digest = hostGenerator.generate();
        log.info("GET /admin/fingerprint/host generated {} digest", FallbackDigests.isFallback(digest) ? "fallback" : "hashed");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("algorithm", hasher.getAlgorithm());
        body.put("digest", digest);
        body.put("fallback", FallbackDigests.isFallback(digest));
        body.put("timeoutMillis", hostGenerator.getTimeout().toMillis());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/compare")
    @Operation(summary = "Compare two fingerprints", description = "Similarity and verdict under the configured threshold")
    public ResponseEntity<?> compare(@Valid @RequestBody CompareRequest req) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("similarity", DeviceFingerprintVerifier.similarity(req.candidate(), req.bound()));
        body.put("threshold", verifier.getThreshold());
        body.put("verified", verifier.verify(req.candidate(), req.bound()));
        return ResponseEntity.ok(body);
    }

    public record CompareRequest(
            @NotNull @Size(max = 128) String candidate,
            @NotNull @Size(max = 128) String bound
    ) {}
}
