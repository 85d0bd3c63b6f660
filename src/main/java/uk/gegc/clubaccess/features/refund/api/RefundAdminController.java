package uk.gegc.clubaccess.features.refund.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.clubaccess.features.refund.api.dto.RefundRequest;
import uk.gegc.clubaccess.features.refund.application.RefundOutcome;
import uk.gegc.clubaccess.features.refund.application.RefundService;
import uk.gegc.clubaccess.shared.security.ActorRef;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/orders")
@RequiredArgsConstructor
@Tag(name = "Refunds Admin", description = "Order refunds with an access-impact policy")
@SecurityRequirement(name = "Bearer Authentication")
public class RefundAdminController {

    private final RefundService refundService;

    @Operation(summary = "Refund an order",
            description = "Calls the payment provider first. Nothing is written when the provider fails.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Refund booked"),
            @ApiResponse(responseCode = "400", description = "Refund not allowed for this order, amount or policy"),
            @ApiResponse(responseCode = "404", description = "Order not found"),
            @ApiResponse(responseCode = "502", description = "Payment provider rejected the refund")
    })
    @PostMapping("/{orderId}/refunds")
    public ResponseEntity<RefundOutcome> refund(
            @Parameter(description = "Order id") @PathVariable UUID orderId,
            @Valid @RequestBody RefundRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(refundService.refund(orderId, request.toCommand(), ActorRef.fromJwt(jwt)));
    }
}
