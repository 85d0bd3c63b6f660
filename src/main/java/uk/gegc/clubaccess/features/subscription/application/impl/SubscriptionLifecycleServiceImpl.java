package uk.gegc.clubaccess.features.subscription.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.clubaccess.features.audit.application.AuditRecorder;
import uk.gegc.clubaccess.features.audit.domain.model.AuditActions;
import uk.gegc.clubaccess.features.audit.domain.model.SubscriptionActionAuditMeta;
import uk.gegc.clubaccess.features.ledger.application.AccessProperties;
import uk.gegc.clubaccess.features.ledger.application.EntitlementLedger;
import uk.gegc.clubaccess.features.ledger.domain.model.AccessGrantRecord;
import uk.gegc.clubaccess.features.ledger.domain.model.AccessGrantSource;
import uk.gegc.clubaccess.features.ledger.domain.model.AccessWindow;
import uk.gegc.clubaccess.features.ledger.domain.model.PaymentMethod;
import uk.gegc.clubaccess.features.ledger.domain.model.Product;
import uk.gegc.clubaccess.features.ledger.domain.model.Subscription;
import uk.gegc.clubaccess.features.ledger.domain.model.SubscriptionStatus;
import uk.gegc.clubaccess.features.ledger.domain.model.Tariff;
import uk.gegc.clubaccess.features.subscription.api.dto.SubscriptionView;
import uk.gegc.clubaccess.features.subscription.application.SubscriptionActionCommand;
import uk.gegc.clubaccess.features.subscription.application.SubscriptionActionResult;
import uk.gegc.clubaccess.features.subscription.application.SubscriptionLifecycleService;
import uk.gegc.clubaccess.features.subscription.domain.model.SubscriptionAction;
import uk.gegc.clubaccess.features.subscription.infra.mapping.SubscriptionMapper;
import uk.gegc.clubaccess.features.sync.application.ExternalSyncCoordinator;
import uk.gegc.clubaccess.features.sync.domain.model.SyncProviders;
import uk.gegc.clubaccess.features.sync.domain.model.SyncResult;
import uk.gegc.clubaccess.shared.exception.InvalidSubscriptionStateException;
import uk.gegc.clubaccess.shared.exception.ValidationException;
import uk.gegc.clubaccess.shared.logging.AccessStructuredLogger;
import uk.gegc.clubaccess.shared.security.ActorRef;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionLifecycleServiceImpl implements SubscriptionLifecycleService {

    static final String NO_ACTIVE_PAYMENT_METHOD = "no_active_payment_method";
    static final String DEFAULT_REVOKE_REASON = "admin_revoke";
    static final String DEFAULT_DELETE_REASON = "subscription_deleted";

    private final EntitlementLedger ledger;
    private final ExternalSyncCoordinator syncCoordinator;
    private final AuditRecorder auditRecorder;
    private final SubscriptionMapper subscriptionMapper;
    private final AccessProperties accessProperties;
    private final Clock clock;

    @Override
    public SubscriptionView getSubscription(UUID subscriptionId) {
        return subscriptionMapper.toView(ledger.requireSubscription(subscriptionId));
    }

    @Override
    public SubscriptionActionResult apply(UUID subscriptionId, SubscriptionActionCommand command, ActorRef actor) {
        validate(command);
        Subscription before = ledger.requireSubscription(subscriptionId);

        Transition transition = switch (command.action()) {
            case CANCEL -> cancel(before);
            case RESUME -> resume(before);
            case PAUSE -> pause(before);
            case EXTEND -> extend(before, command);
            case SET_END_DATE -> setEndDate(before, command);
            case GRANT_ACCESS -> grantAccess(before, command);
            case REVOKE_ACCESS -> revokeAccess(before, reasonOr(command, DEFAULT_REVOKE_REASON));
            case DELETE -> delete(before, reasonOr(command, DEFAULT_DELETE_REASON));
            case TOGGLE_AUTO_RENEW -> toggleAutoRenew(before, command, actor);
            case REDUCE_ACCESS -> throw new ValidationException("reduce_access is only available through refunds");
        };

        return finish(actor, command, before, transition);
    }

    @Override
    public SubscriptionActionResult reduceAccess(UUID subscriptionId, int days, String reason, ActorRef actor) {
        if (days < 1) {
            throw new ValidationException("Days to reduce must be at least 1, got " + days);
        }
        Subscription before = ledger.requireSubscription(subscriptionId);
        Subscription after = ledger.updateSubscription(subscriptionId, s -> {
            Instant now = clock.instant();
            s.setAccessEndAt(s.getAccessEndAt().atZone(zone()).minusDays(days).toInstant());
            if (s.isExpired(now)) {
                s.setNextChargeAt(null);
            }
            syncOpenKey(s, now);
        });
        SubscriptionActionCommand command = new SubscriptionActionCommand(
                SubscriptionAction.REDUCE_ACCESS, days, null, null, reason);
        return finish(actor, command, before, Transition.of(after));
    }

    private void validate(SubscriptionActionCommand command) {
        if (command == null || command.action() == null) {
            throw new ValidationException("Action is required");
        }
        switch (command.action()) {
            case EXTEND, GRANT_ACCESS -> {
                if (command.days() != null && command.days() < 1) {
                    throw new ValidationException("Days must be a positive integer, got " + command.days());
                }
            }
            case SET_END_DATE -> {
                if (command.newEndDate() == null) {
                    throw new ValidationException("newEndDate is required for set_end_date");
                }
            }
            case TOGGLE_AUTO_RENEW -> {
                if (command.autoRenew() == null) {
                    throw new ValidationException("autoRenew is required for toggle_auto_renew");
                }
            }
            default -> {
            }
        }
    }

    private Transition cancel(Subscription before) {
        Subscription after = ledger.updateSubscription(before.getId(), s -> {
            Instant now = clock.instant();
            if (s.isCancelled() || s.getStatus() == SubscriptionStatus.CANCELLED
                    || s.getStatus() == SubscriptionStatus.EXPIRED || s.isExpired(now)) {
                throw invalidState(s, SubscriptionAction.CANCEL, "Subscription is already cancelled or expired");
            }
            s.setCanceledAt(now);
            s.setCancelAt(s.getAccessEndAt());
            s.setNextChargeAt(null);
            s.releaseOpenKey();
        });
        return Transition.of(after);
    }

    private Transition resume(Subscription before) {
        Subscription after = ledger.updateSubscription(before.getId(), s -> {
            Instant now = clock.instant();
            boolean paused = s.getStatus() == SubscriptionStatus.PAUSED;
            if (!s.isCancelled() && !paused) {
                throw invalidState(s, SubscriptionAction.RESUME, "Subscription is neither cancelled nor paused");
            }
            if (s.isExpired(now) || s.getStatus() == SubscriptionStatus.EXPIRED) {
                throw invalidState(s, SubscriptionAction.RESUME, "Subscription access has already ended");
            }
            s.setCanceledAt(null);
            s.setCancelAt(null);
            s.setPausedAt(null);
            s.setStatus(s.isTrial() ? SubscriptionStatus.TRIAL : SubscriptionStatus.ACTIVE);
            s.setNextChargeAt(s.isAutoRenew() ? s.getAccessEndAt() : null);
            s.acquireOpenKey();
        });
        return Transition.of(after);
    }

    private Transition pause(Subscription before) {
        Subscription after = ledger.updateSubscription(before.getId(), s -> {
            Instant now = clock.instant();
            if (!s.getStatus().isLive() || s.isExpired(now)) {
                throw invalidState(s, SubscriptionAction.PAUSE, "Only running subscriptions can be paused");
            }
            s.setStatus(SubscriptionStatus.PAUSED);
            s.setPausedAt(now);
            s.setNextChargeAt(null);
            s.releaseOpenKey();
        });
        return Transition.of(after);
    }

    private Transition extend(Subscription before, SubscriptionActionCommand command) {
        int days = command.days() != null ? command.days() : accessProperties.getDefaultAccessDays();
        Subscription extended = ledger.updateSubscription(before.getId(), s -> {
            Instant now = clock.instant();
            if (s.getStatus() == SubscriptionStatus.CANCELLED || s.getStatus() == SubscriptionStatus.PAUSED) {
                throw invalidState(s, SubscriptionAction.EXTEND,
                        "Subscription is " + s.getStatus().name().toLowerCase(Locale.ROOT)
                                + "; use grant_access or resume to restore it first");
            }
            Instant base = s.isExpired(now) ? now : s.getAccessEndAt();
            s.setAccessEndAt(base.atZone(zone()).plusDays(days).toInstant());
            if (s.getStatus() == SubscriptionStatus.EXPIRED) {
                s.setStatus(s.isTrial() ? SubscriptionStatus.TRIAL : SubscriptionStatus.ACTIVE);
            }
            if (s.isAutoRenew() && s.isOpen(now)) {
                s.setNextChargeAt(s.getAccessEndAt());
            }
            syncOpenKey(s, now);
        });
        return extended.isOpen(clock.instant()) ? grantCommunityFor(extended) : Transition.of(extended);
    }

    private Transition setEndDate(Subscription before, SubscriptionActionCommand command) {
        Subscription after = ledger.updateSubscription(before.getId(), s -> {
            Instant now = clock.instant();
            s.setAccessEndAt(AccessWindow.endOfDay(command.newEndDate(), zone()));
            if (s.isAutoRenew() && s.isOpen(now)) {
                s.setNextChargeAt(s.getAccessEndAt());
            } else if (s.isExpired(now)) {
                s.setNextChargeAt(null);
            }
            syncOpenKey(s, now);
        });
        return Transition.of(after);
    }

    private Transition grantAccess(Subscription before, SubscriptionActionCommand command) {
        Tariff tariff = ledger.requireTariff(before.getTariffId());
        Subscription granted = ledger.updateSubscription(before.getId(), s -> {
            Instant now = clock.instant();
            if (command.days() != null) {
                s.setAccessStartAt(now);
                s.setAccessEndAt(now.atZone(zone()).plusDays(command.days()).toInstant());
            } else if (s.isExpired(now) || s.getStatus() == SubscriptionStatus.CANCELLED) {
                int days = tariff.getAccessDays() > 0 ? tariff.getAccessDays() : accessProperties.getDefaultAccessDays();
                s.setAccessStartAt(now);
                s.setAccessEndAt(now.atZone(zone()).plusDays(days).toInstant());
            }
            s.setStatus(s.isTrial() ? SubscriptionStatus.TRIAL : SubscriptionStatus.ACTIVE);
            s.setCanceledAt(null);
            s.setCancelAt(null);
            s.setPausedAt(null);
            s.setNextChargeAt(s.isAutoRenew() ? s.getAccessEndAt() : null);
            syncOpenKey(s, now);
        });
        return grantCommunityFor(granted);
    }

    private Transition revokeAccess(Subscription before, String reason) {
        List<AccessGrantRecord> grants = ledger.findLiveGrantRecords(before.getId());
        Subscription revoked = ledger.updateSubscription(before.getId(), s -> {
            Instant now = clock.instant();
            s.setStatus(SubscriptionStatus.CANCELLED);
            s.setAccessEndAt(now);
            if (s.getCanceledAt() == null) {
                s.setCanceledAt(now);
            }
            s.setCancelAt(now);
            s.setNextChargeAt(null);
            s.releaseOpenKey();
        });
        Map<String, SyncResult> results = revokeExternal(revoked, grants, reason);
        Subscription recorded = results.isEmpty() ? revoked : ledger.recordSyncResults(revoked.getId(), results);
        return new Transition(recorded, false, results, warningsFor(results));
    }

    private Transition delete(Subscription before, String reason) {
        List<AccessGrantRecord> grants = ledger.findLiveGrantRecords(before.getId());
        Subscription snapshot = ledger.deleteSubscription(before.getId());
        Map<String, SyncResult> results = revokeExternal(snapshot, grants, reason);
        return new Transition(snapshot, true, results, warningsFor(results));
    }

    private Transition toggleAutoRenew(Subscription before, SubscriptionActionCommand command, ActorRef actor) {
        boolean target = command.autoRenew();
        List<String> warnings = new ArrayList<>();
        Optional<PaymentMethod> paymentMethod = Optional.empty();
        if (target && before.getPaymentMethodId() == null) {
            paymentMethod = ledger.findActivePaymentMethod(before.getUserId());
            if (paymentMethod.isEmpty()) {
                warnings.add(NO_ACTIVE_PAYMENT_METHOD);
            }
        }
        Optional<PaymentMethod> attach = paymentMethod;
        Subscription after = ledger.updateSubscription(before.getId(), s -> {
            Instant now = clock.instant();
            s.setAutoRenew(target);
            s.setAutoRenewChangedBy(actor.actorId());
            s.setAutoRenewChangedAt(now);
            s.setAutoRenewChangeReason(command.reason());
            attach.ifPresent(pm -> s.setPaymentMethodId(pm.getId()));
            s.setNextChargeAt(target && s.isOpen(now) ? s.getAccessEndAt() : null);
        });
        return new Transition(after, false, Map.of(), warnings);
    }

    private Transition grantCommunityFor(Subscription subscription) {
        Product product = ledger.requireProduct(subscription.getProductId());
        if (!product.hasCommunityComponent()) {
            return Transition.of(subscription);
        }
        ZoneId zone = zone();
        int days = AccessWindow.remainingDays(
                LocalDate.now(clock),
                subscription.getAccessStartAt().atZone(zone).toLocalDate(),
                subscription.getAccessEndAt().atZone(zone).toLocalDate());
        AccessGrantRecord record = ledger.openGrantRecord(
                subscription, product.getCommunityClubId(), AccessGrantSource.ADMIN_GRANT, subscription.getOrderId());
        SyncResult result = syncCoordinator.grantCommunity(
                subscription.getUserId(), product.getCommunityClubId(), days, AccessGrantSource.ADMIN_GRANT.wireName());
        ledger.completeGrantRecord(record.getId(), result);

        Map<String, SyncResult> results = Map.of(SyncProviders.COMMUNITY, result);
        Subscription recorded = ledger.recordSyncResults(subscription.getId(), results);
        return new Transition(recorded, false, results, warningsFor(results));
    }

    /**
     * Revokes every live community grant of the subscription (or the product's club when none is
     * recorded) and cancels the enrollment when the tariff has one.
     */
    private Map<String, SyncResult> revokeExternal(Subscription subscription, List<AccessGrantRecord> grants, String reason) {
        Map<String, SyncResult> results = new LinkedHashMap<>();
        Product product = ledger.requireProduct(subscription.getProductId());
        Tariff tariff = ledger.requireTariff(subscription.getTariffId());

        Set<String> clubs = new LinkedHashSet<>();
        grants.forEach(g -> clubs.add(g.getClubId()));
        if (clubs.isEmpty() && product.hasCommunityComponent()) {
            clubs.add(product.getCommunityClubId());
        }

        SyncResult community = null;
        for (String clubId : clubs) {
            SyncResult result = syncCoordinator.revokeCommunity(subscription.getUserId(), clubId, reason);
            grants.stream()
                    .filter(g -> clubId.equals(g.getClubId()))
                    .forEach(g -> ledger.completeRevocation(g.getId(), result));
            if (community == null || (community.success() && !result.success())) {
                community = result;
            }
        }
        if (community != null) {
            results.put(SyncProviders.COMMUNITY, community);
        }

        if (tariff.hasEnrollment() && subscription.getOrderId() != null) {
            results.put(SyncProviders.ENROLLMENT, syncCoordinator.cancelEnrollment(subscription.getOrderId(), reason));
        }
        return results;
    }

    private SubscriptionActionResult finish(ActorRef actor, SubscriptionActionCommand command,
                                            Subscription before, Transition transition) {
        Subscription after = transition.subscription();
        String action = command.action().wireName();

        SubscriptionActionAuditMeta meta = new SubscriptionActionAuditMeta(
                after.getId(),
                after.getOrderId(),
                action,
                command.days(),
                command.newEndDate(),
                before.getAccessEndAt(),
                after.getAccessEndAt(),
                command.action() == SubscriptionAction.TOGGLE_AUTO_RENEW ? after.isAutoRenew() : null,
                command.reason(),
                transition.syncResults(),
                transition.deleted(),
                transition.warnings()
        );
        auditRecorder.record(actor, AuditActions.subscription(action), after.getUserId(), meta);

        AccessStructuredLogger.logAccessOperation(log,
                transition.warnings().isEmpty() ? "info" : "warn",
                "Subscription action {} applied, access end {} -> {}, warnings {}",
                actor, action, after.getUserId(), after.getOrderId(), after.getId(),
                action, before.getAccessEndAt(), after.getAccessEndAt(), transition.warnings());

        return new SubscriptionActionResult(
                subscriptionMapper.toView(after),
                transition.deleted(),
                transition.syncResults(),
                transition.warnings()
        );
    }

    private void syncOpenKey(Subscription subscription, Instant now) {
        if (subscription.isOpen(now)) {
            if (subscription.getOpenKey() == null) {
                subscription.acquireOpenKey();
            }
        } else {
            subscription.releaseOpenKey();
        }
    }

    private InvalidSubscriptionStateException invalidState(Subscription s, SubscriptionAction action, String message) {
        String status = s.getStatus().name().toLowerCase(Locale.ROOT);
        if (s.isCancelled() && s.getStatus().isLive()) {
            status = status + " (cancelled)";
        }
        return new InvalidSubscriptionStateException(s.getId(), action.wireName(), status, message);
    }

    static List<String> warningsFor(Map<String, SyncResult> results) {
        List<String> warnings = new ArrayList<>();
        results.forEach((provider, result) -> {
            if (!result.success()) {
                warnings.add(provider + "_sync_failed: " + result.error());
            }
        });
        return warnings;
    }

    private static String reasonOr(SubscriptionActionCommand command, String fallback) {
        return command.reason() != null && !command.reason().isBlank() ? command.reason() : fallback;
    }

    private ZoneId zone() {
        return clock.getZone();
    }

    private record Transition(Subscription subscription, boolean deleted,
                              Map<String, SyncResult> syncResults, List<String> warnings) {

        static Transition of(Subscription subscription) {
            return new Transition(subscription, false, Map.of(), List.of());
        }
    }
}
