package com.caffe.devicebinding.api;

import com.caffe.devicebinding.application.AccountMetadataService;
import com.caffe.devicebinding.domain.account.AccountMetadata;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users")
@Tag(name = "Accounts", description = "Account details shown by the device mismatch alert")
@Validated
public class AccountMetadataController {

    private final AccountMetadataService metadataService;

    public AccountMetadataController(AccountMetadataService metadataService) {
        this.metadataService = metadataService;
    }

    @GetMapping("/metadata")
    @Operation(
            summary = "Look up account metadata",
            description = "Masked email, observer ID and whether a device reset is pending. Never includes a fingerprint."
    )
    public ResponseEntity<AccountMetadata> metadata(
            @Parameter(description = "Observer username", example = "observer.jane")
            @RequestParam @NotBlank String username) {
        return ResponseEntity.ok(metadataService.lookup(username));
    }
}
