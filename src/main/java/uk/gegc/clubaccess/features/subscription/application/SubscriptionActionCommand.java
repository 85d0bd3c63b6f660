package uk.gegc.clubaccess.features.subscription.application;

import uk.gegc.clubaccess.features.subscription.domain.model.SubscriptionAction;

import java.time.LocalDate;

/**
 * One lifecycle action with its optional parameters.
 *
 * @param days       EXTEND and GRANT_ACCESS window length
 * @param newEndDate SET_END_DATE target, inclusive
 * @param autoRenew  TOGGLE_AUTO_RENEW target
 */
public record SubscriptionActionCommand(
        SubscriptionAction action,
        Integer days,
        LocalDate newEndDate,
        Boolean autoRenew,
        String reason
) {

    public static SubscriptionActionCommand of(SubscriptionAction action) {
        return new SubscriptionActionCommand(action, null, null, null, null);
    }

    public static SubscriptionActionCommand withReason(SubscriptionAction action, String reason) {
        return new SubscriptionActionCommand(action, null, null, null, reason);
    }
}
