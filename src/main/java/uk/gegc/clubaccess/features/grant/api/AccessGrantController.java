package uk.gegc.clubaccess.features.grant.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.clubaccess.features.grant.api.dto.GrantAccessRequest;
import uk.gegc.clubaccess.features.grant.api.dto.GrantForOrderRequest;
import uk.gegc.clubaccess.features.grant.application.AccessGrantService;
import uk.gegc.clubaccess.features.grant.application.GrantOutcome;
import uk.gegc.clubaccess.shared.security.ActorRef;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Tag(name = "Access Grants", description = "Admin grant-or-extend workflow")
@SecurityRequirement(name = "Bearer Authentication")
public class AccessGrantController {

    private final AccessGrantService accessGrantService;

    @Operation(summary = "Grant or extend access",
            description = "Writes an order and payment, then creates or extends the subscription and syncs the providers. "
                    + "RECORD_ONLY mode writes the order and payment only.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Grant recorded"),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "404", description = "Product or tariff not found"),
            @ApiResponse(responseCode = "409", description = "Concurrent grant for the same subscription")
    })
    @PostMapping("/access-grants")
    public ResponseEntity<GrantOutcome> grantAccess(@Valid @RequestBody GrantAccessRequest request,
                                                    @AuthenticationPrincipal Jwt jwt) {
        GrantOutcome outcome = accessGrantService.grantAccess(request.toCommand(), ActorRef.fromJwt(jwt));
        return ResponseEntity.status(HttpStatus.CREATED).body(outcome);
    }

    @Operation(summary = "Grant access for an existing paid order")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Access granted"),
            @ApiResponse(responseCode = "400", description = "Order is not paid or has no user"),
            @ApiResponse(responseCode = "404", description = "Order not found")
    })
    @PostMapping("/orders/{orderId}/grant-access")
    public ResponseEntity<GrantOutcome> grantAccessForOrder(
            @Parameter(description = "Order id") @PathVariable UUID orderId,
            @Valid @RequestBody(required = false) GrantForOrderRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        GrantForOrderRequest body = request != null ? request : new GrantForOrderRequest(null, null, null, null, null);
        return ResponseEntity.ok(accessGrantService.grantAccessForOrder(orderId, body.toCommand(), ActorRef.fromJwt(jwt)));
    }
}
