package uk.gegc.clubaccess.features.grant.application;

import uk.gegc.clubaccess.shared.security.ActorRef;

import java.util.UUID;

/**
 * Grant-or-extend workflow for admins.
 *
 * <p>Only the ledger write can fail the call. Provider failures are recorded on the subscription
 * and returned as warnings.
 */
public interface AccessGrantService {

    GrantOutcome grantAccess(GrantAccessCommand command, ActorRef actor);

    /**
     * Grants the access an existing paid order is entitled to. No new order or payment is written.
     */
    GrantOutcome grantAccessForOrder(UUID orderId, GrantForOrderCommand command, ActorRef actor);
}
