package uk.gegc.clubaccess.features.ledger.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.clubaccess.features.ledger.application.AccessProperties;
import uk.gegc.clubaccess.features.ledger.application.EntitlementLedger;
import uk.gegc.clubaccess.features.ledger.application.LedgerGrant;
import uk.gegc.clubaccess.features.ledger.application.LedgerGrantRequest;
import uk.gegc.clubaccess.features.ledger.application.OrderGrantRequest;
import uk.gegc.clubaccess.features.ledger.domain.model.*;
import uk.gegc.clubaccess.features.ledger.domain.repository.*;
import uk.gegc.clubaccess.features.sync.domain.model.SyncResult;
import uk.gegc.clubaccess.shared.exception.LedgerException;
import uk.gegc.clubaccess.shared.exception.ResourceNotFoundException;
import uk.gegc.clubaccess.shared.exception.SubscriptionConflictException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;

@Slf4j
@Service
public class EntitlementLedgerImpl implements EntitlementLedger {

    private static final EnumSet<AccessGrantStatus> LIVE_GRANT_STATUSES =
            EnumSet.of(AccessGrantStatus.PENDING, AccessGrantStatus.ACTIVE);

    private final ProductRepository productRepository;
    private final TariffRepository tariffRepository;
    private final OrderRepository orderRepository;
    private final PaymentRepository paymentRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final AccessGrantRecordRepository grantRecordRepository;
    private final PaymentMethodRepository paymentMethodRepository;
    private final InstallmentPaymentRepository installmentRepository;
    private final AccessProperties accessProperties;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public EntitlementLedgerImpl(ProductRepository productRepository,
                                 TariffRepository tariffRepository,
                                 OrderRepository orderRepository,
                                 PaymentRepository paymentRepository,
                                 SubscriptionRepository subscriptionRepository,
                                 AccessGrantRecordRepository grantRecordRepository,
                                 PaymentMethodRepository paymentMethodRepository,
                                 InstallmentPaymentRepository installmentRepository,
                                 AccessProperties accessProperties,
                                 Clock clock,
                                 PlatformTransactionManager transactionManager) {
        this.productRepository = productRepository;
        this.tariffRepository = tariffRepository;
        this.orderRepository = orderRepository;
        this.paymentRepository = paymentRepository;
        this.subscriptionRepository = subscriptionRepository;
        this.grantRecordRepository = grantRecordRepository;
        this.paymentMethodRepository = paymentMethodRepository;
        this.installmentRepository = installmentRepository;
        this.accessProperties = accessProperties;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    @Transactional(readOnly = true)
    public Product requireProduct(UUID productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> ResourceNotFoundException.of("Product", productId));
    }

    @Override
    @Transactional(readOnly = true)
    public Tariff requireTariff(UUID tariffId) {
        return tariffRepository.findById(tariffId)
                .orElseThrow(() -> ResourceNotFoundException.of("Tariff", tariffId));
    }

    @Override
    @Transactional(readOnly = true)
    public Order requireOrder(UUID orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> ResourceNotFoundException.of("Order", orderId));
    }

    @Override
    @Transactional(readOnly = true)
    public Subscription requireSubscription(UUID subscriptionId) {
        return subscriptionRepository.findById(subscriptionId)
                .orElseThrow(() -> ResourceNotFoundException.of("Subscription", subscriptionId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Payment> findPayments(UUID orderId) {
        return paymentRepository.findByOrderIdOrderByCreatedAtAsc(orderId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Subscription> findOpenSubscription(UUID userId, UUID productId, UUID tariffId) {
        Instant now = clock.instant();
        return subscriptionRepository.findByOpenKey(Subscription.openKeyOf(userId, productId, tariffId))
                .filter(s -> s.isOpen(now));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Subscription> findSubscriptionForOrder(Order order) {
        Optional<Subscription> pointed = subscriptionRepository.findFirstByOrderIdOrderByCreatedAtDesc(order.getId());
        if (pointed.isPresent() || order.getUserId() == null) {
            return pointed;
        }
        return findOpenSubscription(order.getUserId(), order.getProductId(), order.getTariffId());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PaymentMethod> findActivePaymentMethod(UUID userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return paymentMethodRepository.findFirstByUserIdAndStatusOrderByDefaultMethodDescCreatedAtDesc(
                userId, PaymentMethodStatus.ACTIVE);
    }

    @Override
    public LedgerGrant recordGrant(LedgerGrantRequest request) {
        String key = request.recordOnly()
                ? null
                : Subscription.openKeyOf(request.userId(), request.product().getId(), request.tariff().getId());
        return withOpenKeyRetry(key, () -> transactionTemplate.execute(status -> {
            Order order = createOrder(request);
            Payment payment = createPayment(order, request);
            if (request.recordOnly()) {
                log.info("Recorded order {} without access for user {}", order.getOrderNumber(), request.userId());
                return new LedgerGrant(order, payment, null, false, null);
            }
            return upsertSubscription(request.actorId(), order, request.product(), request.tariff(),
                    request.window(), request.createCommunityRecord(), payment);
        }));
    }

    @Override
    public LedgerGrant recordGrantForOrder(OrderGrantRequest request) {
        Order order = requireOrder(request.orderId());
        String key = Subscription.openKeyOf(order.getUserId(), request.product().getId(), request.tariff().getId());
        return withOpenKeyRetry(key, () -> transactionTemplate.execute(status -> {
            Order locked = orderRepository.findByIdForUpdate(request.orderId())
                    .orElseThrow(() -> ResourceNotFoundException.of("Order", request.orderId()));
            return upsertSubscription(request.actorId(), locked, request.product(), request.tariff(),
                    request.window(), request.createCommunityRecord(), null);
        }));
    }

    @Override
    public Subscription updateSubscription(UUID subscriptionId, Consumer<Subscription> mutation) {
        String key = "subscription:" + subscriptionId;
        try {
            return transactionTemplate.execute(status -> {
                Subscription subscription = lockSubscription(subscriptionId);
                mutation.accept(subscription);
                subscription.setUpdatedAt(clock.instant());
                return subscriptionRepository.saveAndFlush(subscription);
            });
        } catch (DataIntegrityViolationException e) {
            if (isOpenKeyViolation(e)) {
                throw new SubscriptionConflictException(key,
                        "Another open subscription already exists for this user, product and tariff", e);
            }
            throw new LedgerException("Failed to update subscription " + subscriptionId, e);
        } catch (DataAccessException e) {
            throw new LedgerException("Failed to update subscription " + subscriptionId, e);
        }
    }

    @Override
    public Subscription deleteSubscription(UUID subscriptionId) {
        return inLedgerTransaction("delete subscription " + subscriptionId, () -> {
            Subscription subscription = lockSubscription(subscriptionId);
            int installments = installmentRepository.deleteBySubscriptionId(subscriptionId);
            subscriptionRepository.delete(subscription);
            subscriptionRepository.flush();
            log.info("Deleted subscription {} with {} installment payment(s)", subscriptionId, installments);
            return subscription;
        });
    }

    @Override
    public Subscription recordSyncResults(UUID subscriptionId, Map<String, SyncResult> results) {
        return inLedgerTransaction("record sync results on " + subscriptionId, () -> {
            Subscription subscription = lockSubscription(subscriptionId);
            subscription.mergeSyncResults(results);
            subscription.setUpdatedAt(clock.instant());
            return subscriptionRepository.save(subscription);
        });
    }

    @Override
    public AccessGrantRecord openGrantRecord(Subscription subscription, String clubId, AccessGrantSource source, UUID orderId) {
        return inLedgerTransaction("open grant record for " + subscription.getId(),
                () -> grantRecordRepository.save(newGrantRecord(subscription, clubId, source, orderId)));
    }

    @Override
    public void completeGrantRecord(UUID grantRecordId, SyncResult result) {
        inLedgerTransaction("complete grant record " + grantRecordId, () -> {
            AccessGrantRecord record = grantRecordRepository.findById(grantRecordId)
                    .orElseThrow(() -> ResourceNotFoundException.of("Access grant record", grantRecordId));
            record.setStatus(result.success() ? AccessGrantStatus.ACTIVE : AccessGrantStatus.FAILED);
            record.setLastError(result.error());
            record.setUpdatedAt(clock.instant());
            return grantRecordRepository.save(record);
        });
    }

    @Override
    @Transactional(readOnly = true)
    public List<AccessGrantRecord> findLiveGrantRecords(UUID subscriptionId) {
        return grantRecordRepository.findBySubscriptionIdAndStatusIn(subscriptionId, LIVE_GRANT_STATUSES);
    }

    @Override
    public void completeRevocation(UUID grantRecordId, SyncResult result) {
        inLedgerTransaction("complete revocation " + grantRecordId, () -> {
            AccessGrantRecord record = grantRecordRepository.findById(grantRecordId)
                    .orElseThrow(() -> ResourceNotFoundException.of("Access grant record", grantRecordId));
            Instant now = clock.instant();
            if (result.success()) {
                record.setStatus(AccessGrantStatus.REVOKED);
                record.setEndAt(now);
                record.setLastError(null);
            } else {
                record.setLastError(result.error());
            }
            record.setUpdatedAt(now);
            return grantRecordRepository.save(record);
        });
    }

    @Override
    public Order applyRefund(UUID orderId, UUID paymentId, BigDecimal amount, String refundReference, boolean keepOrderStatus) {
        return inLedgerTransaction("apply refund to order " + orderId, () -> {
            Order order = orderRepository.findByIdForUpdate(orderId)
                    .orElseThrow(() -> ResourceNotFoundException.of("Order", orderId));
            Payment payment = paymentRepository.findByIdForUpdate(paymentId)
                    .orElseThrow(() -> ResourceNotFoundException.of("Payment", paymentId));

            if (amount.compareTo(payment.refundableBalance()) > 0) {
                throw new LedgerException("Refund of " + amount + " exceeds the refundable balance of payment " + paymentId, null);
            }

            payment.setRefundedAmount(payment.getRefundedAmount().add(amount));
            payment.setRefundReference(refundReference);
            if (payment.getRefundedAmount().compareTo(payment.getAmount()) >= 0) {
                payment.setStatus(PaymentStatus.REFUNDED);
            }
            paymentRepository.save(payment);

            order.setRefundedAmount(order.getRefundedAmount().add(amount));
            if (!keepOrderStatus && order.getRefundedAmount().compareTo(order.getFinalPrice()) >= 0) {
                order.setStatus(OrderStatus.REFUNDED);
            }
            return orderRepository.save(order);
        });
    }

    private LedgerGrant upsertSubscription(UUID actorId, Order order, Product product, Tariff tariff,
                                           AccessWindow window, boolean createCommunityRecord, Payment payment) {
        Instant now = clock.instant();
        Instant requestedStart = window.startInstant(clock.getZone());
        Instant requestedEnd = window.endInstant(clock.getZone());
        String key = Subscription.openKeyOf(order.getUserId(), product.getId(), tariff.getId());

        Optional<Subscription> holder = subscriptionRepository.findByOpenKeyForUpdate(key);
        if (holder.isPresent() && holder.get().isOpen(now)) {
            Subscription existing = holder.get();
            if (requestedEnd.isAfter(existing.getAccessEndAt())) {
                existing.setAccessEndAt(requestedEnd);
            }
            existing.setOrderId(order.getId());
            existing.setTariffId(tariff.getId());
            existing.getExtendedByOrders().add(order.getId());
            if (existing.getPaymentMethodId() == null) {
                findActivePaymentMethod(existing.getUserId()).ifPresent(method -> {
                    existing.setPaymentMethodId(method.getId());
                    existing.setAutoRenew(true);
                });
            }
            if (existing.isAutoRenew()) {
                existing.setNextChargeAt(existing.getAccessEndAt());
            }
            existing.setUpdatedAt(now);
            Subscription saved = subscriptionRepository.saveAndFlush(existing);
            AccessGrantRecord record = createCommunityRecord
                    ? grantRecordRepository.save(newGrantRecord(saved, product.getCommunityClubId(), AccessGrantSource.ADMIN_GRANT, order.getId()))
                    : null;
            log.info("Extended subscription {} to {} by order {}", saved.getId(), saved.getAccessEndAt(), order.getOrderNumber());
            return new LedgerGrant(order, payment, saved, true, record);
        }

        holder.ifPresent(stale -> {
            stale.releaseOpenKey();
            if (stale.getStatus().isLive() && stale.isExpired(now)) {
                stale.setStatus(SubscriptionStatus.EXPIRED);
            }
            stale.setUpdatedAt(now);
            subscriptionRepository.saveAndFlush(stale);
            log.debug("Released open key of lapsed subscription {}", stale.getId());
        });

        Optional<PaymentMethod> paymentMethod = findActivePaymentMethod(order.getUserId());
        boolean autoRenew = accessProperties.isDefaultAutoRenew() && paymentMethod.isPresent();

        Subscription created = new Subscription();
        created.setUserId(order.getUserId());
        created.setProductId(product.getId());
        created.setTariffId(tariff.getId());
        created.setOrderId(order.getId());
        created.setTrial(tariff.isTrial());
        created.setStatus(tariff.isTrial() ? SubscriptionStatus.TRIAL : SubscriptionStatus.ACTIVE);
        created.setAccessStartAt(requestedStart);
        created.setAccessEndAt(requestedEnd);
        created.setAutoRenew(autoRenew);
        created.setNextChargeAt(autoRenew ? requestedEnd : null);
        created.setPaymentMethodId(paymentMethod.map(PaymentMethod::getId).orElse(null));
        created.setCreatedAt(now);
        created.setUpdatedAt(now);
        created.acquireOpenKey();
        Subscription saved = subscriptionRepository.saveAndFlush(created);

        List<Subscription> superseded = subscriptionRepository
                .findByUserIdAndProductIdAndAutoRenewTrueAndIdNot(saved.getUserId(), saved.getProductId(), saved.getId());
        for (Subscription older : superseded) {
            older.setAutoRenew(false);
            older.setNextChargeAt(null);
            older.setAutoRenewChangedBy(actorId);
            older.setAutoRenewChangedAt(now);
            older.setAutoRenewChangeReason("superseded_by_order:" + order.getId());
            older.setUpdatedAt(now);
        }
        if (!superseded.isEmpty()) {
            subscriptionRepository.saveAll(superseded);
            log.info("Disabled auto-renew on {} older subscription(s) of user {}", superseded.size(), saved.getUserId());
        }

        AccessGrantRecord record = createCommunityRecord
                ? grantRecordRepository.save(newGrantRecord(saved, product.getCommunityClubId(), AccessGrantSource.ADMIN_GRANT, order.getId()))
                : null;
        log.info("Created subscription {} for user {} until {}", saved.getId(), saved.getUserId(), saved.getAccessEndAt());
        return new LedgerGrant(order, payment, saved, false, record);
    }

    private Order createOrder(LedgerGrantRequest request) {
        Instant stamped = request.window() != null
                ? request.window().startInstant(clock.getZone())
                : clock.instant();
        BigDecimal price = request.price() != null ? request.price() : BigDecimal.ZERO;

        Order order = new Order();
        order.setOrderNumber(nextOrderNumber());
        order.setUserId(request.userId());
        order.setProductId(request.product().getId());
        order.setTariffId(request.tariff().getId());
        order.setBasePrice(price);
        order.setFinalPrice(price);
        order.setPaidAmount(price);
        order.setCurrency(request.currency());
        order.setStatus(OrderStatus.PAID);
        order.setTrial(request.tariff().isTrial());
        order.setMetadata(new OrderMetadata(
                request.recordOnly() ? OrderSource.ADMIN_RECORD_ONLY : OrderSource.ADMIN_GRANT,
                request.comment(),
                request.window() != null ? request.window().start() : null,
                request.window() != null ? request.window().end() : null,
                request.offerId()));
        order.setCreatedAt(stamped);
        order.setPaidAt(stamped);
        return orderRepository.save(order);
    }

    private Payment createPayment(Order order, LedgerGrantRequest request) {
        Payment payment = new Payment();
        payment.setOrderId(order.getId());
        payment.setUserId(order.getUserId());
        payment.setAmount(order.getPaidAmount());
        payment.setCurrency(order.getCurrency());
        payment.setStatus(PaymentStatus.SUCCEEDED);
        payment.setProvider(accessProperties.getAdminPaymentProvider());
        payment.setPaidAt(order.getPaidAt());
        payment.setCreatedAt(order.getCreatedAt());
        return paymentRepository.save(payment);
    }

    private AccessGrantRecord newGrantRecord(Subscription subscription, String clubId, AccessGrantSource source, UUID orderId) {
        Instant now = clock.instant();
        AccessGrantRecord record = new AccessGrantRecord();
        record.setUserId(subscription.getUserId());
        record.setClubId(clubId);
        record.setSource(source);
        record.setSourceOrderId(orderId);
        record.setSubscriptionId(subscription.getId());
        record.setStartAt(subscription.getAccessStartAt().isAfter(now) ? subscription.getAccessStartAt() : now);
        record.setEndAt(subscription.getAccessEndAt());
        record.setStatus(AccessGrantStatus.PENDING);
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        return record;
    }

    private Subscription lockSubscription(UUID subscriptionId) {
        return subscriptionRepository.findByIdForUpdate(subscriptionId)
                .orElseThrow(() -> ResourceNotFoundException.of("Subscription", subscriptionId));
    }

    private String nextOrderNumber() {
        return "ADM-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12).toUpperCase();
    }

    private <T> T inLedgerTransaction(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataAccessException e) {
            throw new LedgerException("Failed to " + operation, e);
        }
    }

    /**
     * A concurrent grant can insert the same open key between our lookup and insert.
     * The unique constraint rejects the loser, which retries once and then extends the winner's row.
     */
    private LedgerGrant withOpenKeyRetry(String key, Supplier<LedgerGrant> work) {
        try {
            return work.get();
        } catch (DataIntegrityViolationException first) {
            if (key == null || !isOpenKeyViolation(first)) {
                throw new LedgerException("Failed to record grant", first);
            }
            log.warn("Open key {} was taken concurrently, retrying once", key);
            try {
                return work.get();
            } catch (DataIntegrityViolationException second) {
                if (!isOpenKeyViolation(second)) {
                    throw new LedgerException("Failed to record grant", second);
                }
                throw new SubscriptionConflictException(key,
                        "Concurrent grant for the same user, product and tariff; retry later", second);
            } catch (DataAccessException second) {
                throw new LedgerException("Failed to record grant", second);
            }
        } catch (DataAccessException e) {
            throw new LedgerException("Failed to record grant", e);
        }
    }

    /**
     * Only the open-key unique constraint means "someone else holds this access".
     * Drivers name it in the message, in whatever case the database uses.
     */
    static boolean isOpenKeyViolation(DataIntegrityViolationException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ConstraintViolationException cve && cve.getConstraintName() != null
                    && cve.getConstraintName().toLowerCase(Locale.ROOT).contains(Subscription.OPEN_KEY_CONSTRAINT)) {
                return true;
            }
            String message = t.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains(Subscription.OPEN_KEY_CONSTRAINT)) {
                return true;
            }
        }
        return false;
    }
}
