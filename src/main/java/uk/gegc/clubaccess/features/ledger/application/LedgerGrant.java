package uk.gegc.clubaccess.features.ledger.application;

import uk.gegc.clubaccess.features.ledger.domain.model.AccessGrantRecord;
import uk.gegc.clubaccess.features.ledger.domain.model.Order;
import uk.gegc.clubaccess.features.ledger.domain.model.Payment;
import uk.gegc.clubaccess.features.ledger.domain.model.Subscription;

/**
 * Result of a committed grant transaction.
 *
 * @param payment      {@code null} when the grant reused an existing order
 * @param subscription {@code null} in record-only mode
 * @param grantRecord  {@code null} when no community grant was requested
 */
public record LedgerGrant(
        Order order,
        Payment payment,
        Subscription subscription,
        boolean extended,
        AccessGrantRecord grantRecord
) {
}
