package uk.gegc.clubaccess.features.subscription.api;

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
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.clubaccess.features.subscription.api.dto.SubscriptionActionRequest;
import uk.gegc.clubaccess.features.subscription.api.dto.SubscriptionView;
import uk.gegc.clubaccess.features.subscription.application.SubscriptionActionResult;
import uk.gegc.clubaccess.features.subscription.application.SubscriptionLifecycleService;
import uk.gegc.clubaccess.shared.security.ActorRef;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/subscriptions")
@RequiredArgsConstructor
@Tag(name = "Subscription Admin", description = "Lifecycle actions on a single subscription")
@SecurityRequirement(name = "Bearer Authentication")
public class SubscriptionAdminController {

    private final SubscriptionLifecycleService lifecycleService;

    @Operation(summary = "Get a subscription")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Subscription found"),
            @ApiResponse(responseCode = "404", description = "Subscription not found")
    })
    @GetMapping("/{subscriptionId}")
    public ResponseEntity<SubscriptionView> get(@PathVariable UUID subscriptionId) {
        return ResponseEntity.ok(lifecycleService.getSubscription(subscriptionId));
    }

    @Operation(summary = "Apply a lifecycle action",
            description = "Provider failures do not fail the request; they are returned as warnings.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Action applied"),
            @ApiResponse(responseCode = "400", description = "Invalid action parameters"),
            @ApiResponse(responseCode = "404", description = "Subscription not found"),
            @ApiResponse(responseCode = "409", description = "Action not allowed in the current state")
    })
    @PostMapping("/{subscriptionId}/actions")
    public ResponseEntity<SubscriptionActionResult> apply(
            @Parameter(description = "Subscription id") @PathVariable UUID subscriptionId,
            @Valid @RequestBody SubscriptionActionRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(lifecycleService.apply(subscriptionId, request.toCommand(), ActorRef.fromJwt(jwt)));
    }
}
