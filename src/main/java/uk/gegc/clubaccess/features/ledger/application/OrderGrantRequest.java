package uk.gegc.clubaccess.features.ledger.application;

import uk.gegc.clubaccess.features.ledger.domain.model.AccessWindow;
import uk.gegc.clubaccess.features.ledger.domain.model.Product;
import uk.gegc.clubaccess.features.ledger.domain.model.Tariff;

import java.util.UUID;

/**
 * Subscription upsert for an order that already exists.
 */
public record OrderGrantRequest(
        UUID actorId,
        UUID orderId,
        Product product,
        Tariff tariff,
        AccessWindow window,
        boolean createCommunityRecord
) {
}
