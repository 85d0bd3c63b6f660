package uk.gegc.clubaccess.features.refund.application;

import uk.gegc.clubaccess.shared.security.ActorRef;

import java.util.UUID;

/**
 * Refunds part or all of an order and applies an access policy to its subscription.
 *
 * <p>All checks run before the provider call. The provider call is the only external call whose
 * failure aborts the refund; it happens before anything is written.
 */
public interface RefundService {

    RefundOutcome refund(UUID orderId, RefundCommand command, ActorRef actor);
}
