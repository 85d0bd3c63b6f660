package uk.gegc.clubaccess.features.audit.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.clubaccess.features.audit.api.dto.AuditRecordDto;
import uk.gegc.clubaccess.features.audit.application.AuditRecorder;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/audit")
@RequiredArgsConstructor
@Validated
@Tag(name = "Audit Admin", description = "Read-only audit trail of admin access changes")
@SecurityRequirement(name = "Bearer Authentication")
public class AuditAdminController {

    private final AuditRecorder auditRecorder;

    @Operation(summary = "List audit records for a user", description = "Newest first. Requires the ADMIN role.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page of audit records"),
            @ApiResponse(responseCode = "400", description = "Invalid paging parameters"),
            @ApiResponse(responseCode = "401", description = "Unauthorized"),
            @ApiResponse(responseCode = "403", description = "Missing ADMIN role")
    })
    @GetMapping
    public ResponseEntity<Page<AuditRecordDto>> listForUser(
            @Parameter(description = "User the records are about", required = true)
            @RequestParam UUID targetUserId,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return ResponseEntity.ok(auditRecorder.findByTargetUser(targetUserId, PageRequest.of(page, size)));
    }
}
