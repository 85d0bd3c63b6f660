package uk.gegc.clubaccess.features.subscription.application;

import uk.gegc.clubaccess.features.subscription.api.dto.SubscriptionView;
import uk.gegc.clubaccess.features.sync.domain.model.SyncResult;

import java.util.List;
import java.util.Map;

/**
 * @param subscription state after the action, or the last state before a delete
 * @param syncResults  provider outcomes of this action only
 * @param warnings     non-fatal problems, e.g. failed provider calls
 */
public record SubscriptionActionResult(
        SubscriptionView subscription,
        boolean deleted,
        Map<String, SyncResult> syncResults,
        List<String> warnings
) {
}
