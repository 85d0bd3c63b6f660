package uk.gegc.clubaccess.features.grant.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import uk.gegc.clubaccess.features.audit.application.AuditRecorder;
import uk.gegc.clubaccess.features.audit.domain.model.AuditActions;
import uk.gegc.clubaccess.features.audit.domain.model.GrantAccessAuditMeta;
import uk.gegc.clubaccess.features.grant.application.AccessGrantService;
import uk.gegc.clubaccess.features.grant.application.GrantAccessCommand;
import uk.gegc.clubaccess.features.grant.application.GrantForOrderCommand;
import uk.gegc.clubaccess.features.grant.application.GrantOutcome;
import uk.gegc.clubaccess.features.ledger.application.AccessProperties;
import uk.gegc.clubaccess.features.ledger.application.EntitlementLedger;
import uk.gegc.clubaccess.features.ledger.application.LedgerGrant;
import uk.gegc.clubaccess.features.ledger.application.LedgerGrantRequest;
import uk.gegc.clubaccess.features.ledger.application.OrderGrantRequest;
import uk.gegc.clubaccess.features.ledger.domain.model.AccessGrantSource;
import uk.gegc.clubaccess.features.ledger.domain.model.AccessWindow;
import uk.gegc.clubaccess.features.ledger.domain.model.Order;
import uk.gegc.clubaccess.features.ledger.domain.model.Product;
import uk.gegc.clubaccess.features.ledger.domain.model.Subscription;
import uk.gegc.clubaccess.features.ledger.domain.model.Tariff;
import uk.gegc.clubaccess.features.notification.domain.event.AdminNotificationEvent;
import uk.gegc.clubaccess.features.sync.application.EnrollmentOrder;
import uk.gegc.clubaccess.features.sync.application.ExternalSyncCoordinator;
import uk.gegc.clubaccess.features.sync.application.GrantSyncRequest;
import uk.gegc.clubaccess.features.sync.domain.model.SyncProviders;
import uk.gegc.clubaccess.features.sync.domain.model.SyncResult;
import uk.gegc.clubaccess.shared.exception.ValidationException;
import uk.gegc.clubaccess.shared.logging.AccessStructuredLogger;
import uk.gegc.clubaccess.shared.security.ActorRef;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AccessGrantServiceImpl implements AccessGrantService {

    private final EntitlementLedger ledger;
    private final ExternalSyncCoordinator syncCoordinator;
    private final AuditRecorder auditRecorder;
    private final ApplicationEventPublisher eventPublisher;
    private final AccessProperties accessProperties;
    private final Clock clock;

    @Override
    public GrantOutcome grantAccess(GrantAccessCommand command, ActorRef actor) {
        Product product = ledger.requireProduct(command.productId());
        Tariff tariff = ledger.requireTariff(command.tariffId());
        requireTariffOfProduct(product, tariff);

        if (command.price() != null && command.price().signum() < 0) {
            throw new ValidationException("Price must not be negative");
        }

        AccessWindow window = null;
        if (command.recordOnly()) {
            if (command.hasWindowFields()) {
                throw new ValidationException("Record-only mode grants no access; remove the access window fields");
            }
        } else {
            if (command.userId() == null) {
                throw new ValidationException("A user is required to grant access");
            }
            window = resolveWindow(command, tariff);
            requireNotEnded(window);
        }

        boolean community = !command.recordOnly() && command.grantCommunity() && product.hasCommunityComponent();
        LedgerGrant grant = ledger.recordGrant(new LedgerGrantRequest(
                actor.actorId(),
                command.userId(),
                product,
                tariff,
                window,
                command.price() != null ? command.price() : BigDecimal.ZERO,
                resolveCurrency(command.currency(), tariff),
                command.comment(),
                command.offerId(),
                command.recordOnly(),
                community
        ));

        Map<String, SyncResult> syncResults = Map.of();
        Subscription subscription = grant.subscription();
        if (subscription != null) {
            SyncedGrant synced = syncGrant(grant, product, tariff, command.grantEnrollment(), command.offerId());
            subscription = synced.subscription();
            syncResults = synced.results();
        }

        GrantAccessAuditMeta meta = new GrantAccessAuditMeta(
                product.getName(),
                tariff.getName(),
                window != null ? window.start() : null,
                window != null ? window.end() : null,
                window != null ? window.days() : null,
                command.comment(),
                grant.order().getId(),
                subscription != null ? subscription.getId() : null,
                grant.extended(),
                command.recordOnly(),
                syncResults
        );
        auditRecorder.record(actor, AuditActions.GRANT_ACCESS, command.userId(), meta);

        GrantOutcome outcome = toOutcome(grant, subscription, syncResults);
        afterGrant(actor, AuditActions.GRANT_ACCESS, product, tariff, outcome, command.userId());
        return outcome;
    }

    @Override
    public GrantOutcome grantAccessForOrder(UUID orderId, GrantForOrderCommand command, ActorRef actor) {
        Order order = ledger.requireOrder(orderId);
        if (!order.getStatus().isRefundable()) {
            throw new ValidationException("Order " + order.getOrderNumber() + " is " + order.getStatus()
                    + "; only paid or partially paid orders can grant access");
        }
        if (order.getUserId() == null) {
            throw new ValidationException("Order " + order.getOrderNumber() + " has no user");
        }
        if (command.customDays() != null && command.customDays() < 1) {
            throw new ValidationException("Days must be at least 1, got " + command.customDays());
        }

        Product product = ledger.requireProduct(order.getProductId());
        Tariff tariff = ledger.requireTariff(order.getTariffId());
        ZoneId zone = clock.getZone();

        LocalDate start = command.customStart() != null
                ? command.customStart()
                : order.getCreatedAt().atZone(zone).toLocalDate();
        if (command.extendFromCurrent()) {
            Optional<Subscription> open = ledger.findOpenSubscription(order.getUserId(), product.getId(), tariff.getId());
            if (open.isPresent()) {
                start = open.get().getAccessEndAt().atZone(zone).toLocalDate().plusDays(1);
            }
        }
        int days = command.customDays() != null ? command.customDays() : tariffDays(tariff);
        AccessWindow window = AccessWindow.ofDays(start, days);
        requireNotEnded(window);

        boolean community = command.grantCommunity() && product.hasCommunityComponent();
        LedgerGrant grant = ledger.recordGrantForOrder(
                new OrderGrantRequest(actor.actorId(), orderId, product, tariff, window, community));

        SyncedGrant synced = syncGrant(grant, product, tariff, command.grantEnrollment(),
                order.getMetadata() != null ? order.getMetadata().getOfferId() : null);
        Subscription subscription = synced.subscription();
        Map<String, SyncResult> syncResults = synced.results();

        GrantAccessAuditMeta meta = new GrantAccessAuditMeta(
                product.getName(),
                tariff.getName(),
                window.start(),
                window.end(),
                window.days(),
                null,
                order.getId(),
                subscription.getId(),
                grant.extended(),
                false,
                syncResults
        );
        auditRecorder.record(actor, AuditActions.GRANT_ACCESS_FOR_ORDER, order.getUserId(), meta);

        GrantOutcome outcome = toOutcome(grant, subscription, syncResults);
        afterGrant(actor, AuditActions.GRANT_ACCESS_FOR_ORDER, product, tariff, outcome, order.getUserId());
        return outcome;
    }

    /**
     * Calls the providers for a committed grant and writes their outcomes back to the ledger.
     */
    private SyncedGrant syncGrant(LedgerGrant grant, Product product, Tariff tariff,
                                   boolean grantEnrollment, String offerId) {
        Subscription subscription = grant.subscription();
        Order order = grant.order();
        ZoneId zone = clock.getZone();

        int communityDays = AccessWindow.remainingDays(
                LocalDate.now(clock),
                subscription.getAccessStartAt().atZone(zone).toLocalDate(),
                subscription.getAccessEndAt().atZone(zone).toLocalDate());
        String clubId = grant.grantRecord() != null ? product.getCommunityClubId() : null;
        EnrollmentOrder enrollmentOrder = grantEnrollment && tariff.hasEnrollment()
                ? new EnrollmentOrder(order.getId(), order.getOrderNumber(), subscription.getUserId(),
                order.getFinalPrice(), order.getCurrency())
                : null;
        String offerIdentifier = offerId != null && !offerId.isBlank() ? offerId : tariff.getEnrollmentOfferId();

        GrantSyncRequest request = new GrantSyncRequest(
                subscription.getUserId(),
                clubId,
                communityDays,
                AccessGrantSource.ADMIN_GRANT.wireName(),
                enrollmentOrder,
                offerIdentifier,
                tariff.getEnrollmentCode());
        if (!request.hasCommunity() && !request.hasEnrollment()) {
            return new SyncedGrant(subscription, Map.of());
        }

        Map<String, SyncResult> results = syncCoordinator.syncGrant(request);
        if (grant.grantRecord() != null && results.containsKey(SyncProviders.COMMUNITY)) {
            ledger.completeGrantRecord(grant.grantRecord().getId(), results.get(SyncProviders.COMMUNITY));
        }
        return new SyncedGrant(ledger.recordSyncResults(subscription.getId(), results), results);
    }

    private GrantOutcome toOutcome(LedgerGrant grant, Subscription subscription, Map<String, SyncResult> syncResults) {
        List<String> warnings = new ArrayList<>();
        syncResults.forEach((provider, result) -> {
            if (!result.success()) {
                warnings.add(provider + "_sync_failed: " + result.error());
            }
        });
        return new GrantOutcome(
                grant.order().getId(),
                grant.order().getOrderNumber(),
                grant.payment() != null ? grant.payment().getId() : null,
                subscription != null ? subscription.getId() : null,
                grant.extended(),
                subscription != null ? subscription.getAccessStartAt() : null,
                subscription != null ? subscription.getAccessEndAt() : null,
                syncResults,
                warnings
        );
    }

    private void afterGrant(ActorRef actor, String action, Product product, Tariff tariff,
                            GrantOutcome outcome, UUID userId) {
        AccessStructuredLogger.logAccessOperation(log,
                outcome.warnings().isEmpty() ? "info" : "warn",
                "{} completed for {} / {}: extended={}, access until {}, warnings {}",
                actor, action, userId, outcome.orderId(), outcome.subscriptionId(),
                action, product.getCode(), tariff.getCode(), outcome.extended(), outcome.accessEndAt(), outcome.warnings());

        String subject = outcome.subscriptionId() == null
                ? "Order recorded: " + product.getName()
                : (outcome.extended() ? "Access extended: " : "Access granted: ") + product.getName();
        String message = "User " + userId + " / " + product.getName() + " / " + tariff.getName()
                + "\nOrder: " + outcome.orderNumber()
                + (outcome.accessEndAt() != null ? "\nAccess until: " + outcome.accessEndAt() : "")
                + (outcome.warnings().isEmpty() ? "" : "\nWarnings: " + String.join("; ", outcome.warnings()));
        eventPublisher.publishEvent(new AdminNotificationEvent(action, userId, subject, message));
    }

    private AccessWindow resolveWindow(GrantAccessCommand command, Tariff tariff) {
        LocalDate start = command.startDate() != null ? command.startDate() : LocalDate.now(clock);
        if (command.endDate() != null) {
            AccessWindow window = AccessWindow.of(start, command.endDate());
            if (command.days() != null && command.days() != window.days()) {
                throw new ValidationException("Days " + command.days() + " do not match the window "
                        + start + ".." + command.endDate() + " (" + window.days() + " days)");
            }
            return window;
        }
        int days = command.days() != null ? command.days() : tariffDays(tariff);
        return AccessWindow.ofDays(start, days);
    }

    /**
     * Rejects windows whose last day is before today.
     */
    private void requireNotEnded(AccessWindow window) {
        LocalDate today = LocalDate.now(clock);
        if (window.end().isBefore(today)) {
            throw new ValidationException("Access window " + window.start() + ".." + window.end()
                    + " ended before today (" + today + "); pass a later start or extendFromCurrent");
        }
    }

    private int tariffDays(Tariff tariff) {
        return tariff.getAccessDays() > 0 ? tariff.getAccessDays() : accessProperties.getDefaultAccessDays();
    }

    private String resolveCurrency(String requested, Tariff tariff) {
        if (requested != null && !requested.isBlank()) {
            return requested.trim().toUpperCase();
        }
        return tariff.getCurrency() != null ? tariff.getCurrency() : accessProperties.getDefaultCurrency();
    }

    private void requireTariffOfProduct(Product product, Tariff tariff) {
        if (!product.getId().equals(tariff.getProductId())) {
            throw new ValidationException("Tariff " + tariff.getCode() + " does not belong to product " + product.getCode());
        }
    }

    private record SyncedGrant(Subscription subscription, Map<String, SyncResult> results) {
    }
}
