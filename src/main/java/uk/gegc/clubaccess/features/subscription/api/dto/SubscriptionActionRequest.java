package uk.gegc.clubaccess.features.subscription.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.clubaccess.features.subscription.application.SubscriptionActionCommand;
import uk.gegc.clubaccess.features.subscription.domain.model.SubscriptionAction;

import java.time.LocalDate;

@Schema(name = "SubscriptionActionRequest", description = "One named action on a subscription")
public record SubscriptionActionRequest(
        @Schema(description = "cancel, resume, pause, extend, set_end_date, grant_access, revoke_access, delete or toggle_auto_renew",
                example = "extend")
        @NotNull(message = "Action is required")
        SubscriptionAction action,

        @Schema(description = "Days for extend or grant_access", example = "30")
        @Min(value = 1, message = "Days must be at least 1")
        Integer days,

        @Schema(description = "Inclusive end date for set_end_date", example = "2026-12-31")
        LocalDate newEndDate,

        @Schema(description = "Target flag for toggle_auto_renew")
        Boolean autoRenew,

        @Schema(description = "Free-text reason stored in the audit trail")
        @Size(max = 500, message = "Reason must not exceed 500 characters")
        String reason
) {

    public SubscriptionActionCommand toCommand() {
        return new SubscriptionActionCommand(action, days, newEndDate, autoRenew, reason);
    }
}
