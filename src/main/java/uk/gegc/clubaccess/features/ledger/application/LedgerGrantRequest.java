package uk.gegc.clubaccess.features.ledger.application;

import uk.gegc.clubaccess.features.ledger.domain.model.AccessWindow;
import uk.gegc.clubaccess.features.ledger.domain.model.Product;
import uk.gegc.clubaccess.features.ledger.domain.model.Tariff;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Everything the ledger needs to write the Order, Payment and (unless record-only) Subscription of one grant.
 *
 * @param window                {@code null} in record-only mode
 * @param createCommunityRecord open a pending community grant record alongside the subscription
 */
public record LedgerGrantRequest(
        UUID actorId,
        UUID userId,
        Product product,
        Tariff tariff,
        AccessWindow window,
        BigDecimal price,
        String currency,
        String comment,
        String offerId,
        boolean recordOnly,
        boolean createCommunityRecord
) {
}
