package uk.gegc.clubaccess.features.refund.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.clubaccess.features.refund.application.RefundCommand;
import uk.gegc.clubaccess.features.refund.domain.model.AccessImpactPolicy;

import java.math.BigDecimal;

@Schema(name = "RefundRequest", description = "Refund part or all of an order")
public record RefundRequest(
        @Schema(description = "Amount in the order currency", example = "49.00")
        @NotNull(message = "Amount is required")
        @DecimalMin(value = "0.01", message = "Amount must be greater than zero")
        BigDecimal amount,

        @NotBlank(message = "Reason is required")
        @Size(max = 500, message = "Reason must not exceed 500 characters")
        String reason,

        @Schema(description = "REVOKE, REDUCE, KEEP or KEEP_SUBSCRIPTION")
        @NotNull(message = "Policy is required")
        AccessImpactPolicy policy,

        @Schema(description = "Days to remove from access, required for REDUCE")
        @Min(value = 1, message = "reduceDays must be at least 1")
        Integer reduceDays
) {

    public RefundCommand toCommand() {
        return new RefundCommand(amount, reason, policy, reduceDays);
    }
}
