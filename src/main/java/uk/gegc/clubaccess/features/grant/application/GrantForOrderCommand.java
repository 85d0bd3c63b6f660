package uk.gegc.clubaccess.features.grant.application;

import java.time.LocalDate;

/**
 * @param customStart       window start; defaults to the order's creation date
 * @param customDays        window length; defaults to the tariff's access days
 * @param extendFromCurrent start the day after the current open subscription ends
 */
public record GrantForOrderCommand(
        LocalDate customStart,
        Integer customDays,
        boolean extendFromCurrent,
        boolean grantCommunity,
        boolean grantEnrollment
) {
}
