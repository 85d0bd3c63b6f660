package uk.gegc.clubaccess.features.grant.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import uk.gegc.clubaccess.features.grant.application.GrantForOrderCommand;

import java.time.LocalDate;

@Schema(name = "GrantForOrderRequest", description = "Grant the access a paid order is entitled to")
public record GrantForOrderRequest(
        @Schema(description = "Window start, defaults to the order date")
        LocalDate customStart,

        @Schema(description = "Window length, defaults to the tariff's access days")
        @Min(value = 1, message = "Days must be at least 1")
        Integer customDays,

        @Schema(description = "Start the day after the current open subscription ends")
        Boolean extendFromCurrent,

        Boolean grantCommunity,

        Boolean grantEnrollment
) {

    public GrantForOrderCommand toCommand() {
        return new GrantForOrderCommand(
                customStart,
                customDays,
                Boolean.TRUE.equals(extendFromCurrent),
                grantCommunity == null || grantCommunity,
                grantEnrollment == null || grantEnrollment
        );
    }
}
