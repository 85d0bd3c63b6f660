package uk.gegc.clubaccess.features.grant.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import uk.gegc.clubaccess.features.grant.application.GrantAccessCommand;
import uk.gegc.clubaccess.features.grant.domain.model.GrantMode;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Schema(name = "GrantAccessRequest", description = "Grant or extend access to a product tariff, or record an order only")
public record GrantAccessRequest(
        @Schema(description = "User receiving access; optional in RECORD_ONLY mode")
        UUID userId,

        @NotNull(message = "Product is required")
        UUID productId,

        @NotNull(message = "Tariff is required")
        UUID tariffId,

        @Schema(description = "First day of access, defaults to today", example = "2026-01-01")
        LocalDate startDate,

        @Schema(description = "Last day of access, inclusive", example = "2026-01-30")
        LocalDate endDate,

        @Schema(description = "Window length in days when no end date is given", example = "30")
        @Min(value = 1, message = "Days must be at least 1")
        Integer days,

        @Schema(description = "Price recorded on the order, zero when absent", example = "0.00")
        @DecimalMin(value = "0.00", message = "Price must not be negative")
        BigDecimal price,

        @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency must be a 3-letter ISO code")
        String currency,

        @Size(max = 1000, message = "Comment must not exceed 1000 characters")
        String comment,

        @Schema(description = "Enrollment sub-offer identifier, preferred over the tariff's")
        @Size(max = 255)
        String offerId,

        @Schema(description = "GRANT_ACCESS (default) or RECORD_ONLY")
        GrantMode mode,

        @Schema(description = "Call the community provider, default true")
        Boolean grantCommunity,

        @Schema(description = "Call the enrollment provider, default true")
        Boolean grantEnrollment
) {

    public GrantAccessCommand toCommand() {
        return new GrantAccessCommand(
                userId,
                productId,
                tariffId,
                startDate,
                endDate,
                days,
                price,
                currency,
                comment,
                offerId,
                mode != null ? mode : GrantMode.GRANT_ACCESS,
                grantCommunity == null || grantCommunity,
                grantEnrollment == null || grantEnrollment
        );
    }
}
