package uk.gegc.clubaccess.features.ledger.application;

import uk.gegc.clubaccess.features.ledger.domain.model.AccessGrantRecord;
import uk.gegc.clubaccess.features.ledger.domain.model.AccessGrantSource;
import uk.gegc.clubaccess.features.ledger.domain.model.Order;
import uk.gegc.clubaccess.features.ledger.domain.model.Payment;
import uk.gegc.clubaccess.features.ledger.domain.model.PaymentMethod;
import uk.gegc.clubaccess.features.ledger.domain.model.Product;
import uk.gegc.clubaccess.features.ledger.domain.model.Subscription;
import uk.gegc.clubaccess.features.ledger.domain.model.Tariff;
import uk.gegc.clubaccess.features.sync.domain.model.SyncResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Authoritative store of orders, payments and subscriptions.
 *
 * <p>Every write runs in its own transaction and either commits completely or fails with
 * {@link uk.gegc.clubaccess.shared.exception.LedgerException} (or
 * {@link uk.gegc.clubaccess.shared.exception.SubscriptionConflictException} when the
 * one-open-subscription rule would be broken).
 */
public interface EntitlementLedger {

    Product requireProduct(UUID productId);

    Tariff requireTariff(UUID tariffId);

    Order requireOrder(UUID orderId);

    Subscription requireSubscription(UUID subscriptionId);

    List<Payment> findPayments(UUID orderId);

    /**
     * The subscription holding the open key for (user, product, tariff), if it is still open.
     */
    Optional<Subscription> findOpenSubscription(UUID userId, UUID productId, UUID tariffId);

    /**
     * The subscription currently pointed at the order, otherwise the open one for the order's user, product and tariff.
     */
    Optional<Subscription> findSubscriptionForOrder(Order order);

    /**
     * Active payment method of the user: the default one first, then the newest.
     */
    Optional<PaymentMethod> findActivePaymentMethod(UUID userId);

    /**
     * Writes Order + Payment and finds-or-creates the subscription in one transaction.
     * An open subscription is extended to {@code max(current end, requested end)}.
     */
    LedgerGrant recordGrant(LedgerGrantRequest request);

    /**
     * Finds-or-creates the subscription for an existing paid order. No order or payment is written.
     */
    LedgerGrant recordGrantForOrder(OrderGrantRequest request);

    /**
     * Applies {@code mutation} to the locked subscription and saves it.
     */
    Subscription updateSubscription(UUID subscriptionId, Consumer<Subscription> mutation);

    /**
     * Removes the subscription and its installment payments. Returns the last state.
     */
    Subscription deleteSubscription(UUID subscriptionId);

    /**
     * Merges provider outcomes into the subscription's sync-results map.
     */
    Subscription recordSyncResults(UUID subscriptionId, Map<String, SyncResult> results);

    AccessGrantRecord openGrantRecord(Subscription subscription, String clubId, AccessGrantSource source, UUID orderId);

    /**
     * Moves a pending grant record to active or failed.
     */
    void completeGrantRecord(UUID grantRecordId, SyncResult result);

    List<AccessGrantRecord> findLiveGrantRecords(UUID subscriptionId);

    /**
     * Marks a grant record revoked on success, or keeps it and stores the error.
     */
    void completeRevocation(UUID grantRecordId, SyncResult result);

    /**
     * Books a refund that the payment provider already confirmed.
     *
     * @param keepOrderStatus leave the order status untouched even when fully refunded
     * @return the updated order
     */
    Order applyRefund(UUID orderId, UUID paymentId, BigDecimal amount, String refundReference, boolean keepOrderStatus);
}
