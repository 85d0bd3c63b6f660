package uk.gegc.clubaccess.features.subscription.application;

import uk.gegc.clubaccess.features.subscription.api.dto.SubscriptionView;
import uk.gegc.clubaccess.shared.security.ActorRef;

import java.util.UUID;

/**
 * Executes single named actions against one existing subscription.
 *
 * <p>Each successful action writes exactly one audit record. Actions that change external access
 * call the providers after the ledger change; provider failures are returned as warnings.
 */
public interface SubscriptionLifecycleService {

    SubscriptionView getSubscription(UUID subscriptionId);

    /**
     * @throws uk.gegc.clubaccess.shared.exception.ValidationException               bad parameters, nothing changed
     * @throws uk.gegc.clubaccess.shared.exception.InvalidSubscriptionStateException action not allowed in the current state
     * @throws uk.gegc.clubaccess.shared.exception.SubscriptionConflictException     resuming would create a second open subscription
     */
    SubscriptionActionResult apply(UUID subscriptionId, SubscriptionActionCommand command, ActorRef actor);

    /**
     * Moves access-end back by {@code days} without touching the status. Used by refunds.
     */
    SubscriptionActionResult reduceAccess(UUID subscriptionId, int days, String reason, ActorRef actor);
}
