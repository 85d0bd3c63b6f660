package uk.gegc.clubaccess.features.grant.application;

import uk.gegc.clubaccess.features.grant.domain.model.GrantMode;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Admin grant of one product tariff to one user.
 *
 * <p>The window is {@code startDate..endDate}, or {@code startDate} plus {@code days}. A missing start
 * means today; a missing end and day count mean the tariff's access days.
 */
public record GrantAccessCommand(
        UUID userId,
        UUID productId,
        UUID tariffId,
        LocalDate startDate,
        LocalDate endDate,
        Integer days,
        BigDecimal price,
        String currency,
        String comment,
        String offerId,
        GrantMode mode,
        boolean grantCommunity,
        boolean grantEnrollment
) {

    public boolean recordOnly() {
        return mode == GrantMode.RECORD_ONLY;
    }

    public boolean hasWindowFields() {
        return startDate != null || endDate != null || days != null;
    }
}
