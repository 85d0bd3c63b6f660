package uk.gegc.clubaccess.features.refund.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.clubaccess.features.audit.application.AuditRecorder;
import uk.gegc.clubaccess.features.audit.domain.model.AuditActions;
import uk.gegc.clubaccess.features.audit.domain.model.RefundAuditMeta;
import uk.gegc.clubaccess.features.ledger.application.EntitlementLedger;
import uk.gegc.clubaccess.features.ledger.domain.model.Order;
import uk.gegc.clubaccess.features.ledger.domain.model.Payment;
import uk.gegc.clubaccess.features.ledger.domain.model.PaymentStatus;
import uk.gegc.clubaccess.features.ledger.domain.model.Subscription;
import uk.gegc.clubaccess.features.refund.application.PaymentRefundProvider;
import uk.gegc.clubaccess.features.refund.application.ProviderRefund;
import uk.gegc.clubaccess.features.refund.application.RefundCommand;
import uk.gegc.clubaccess.features.refund.application.RefundOutcome;
import uk.gegc.clubaccess.features.refund.application.RefundService;
import uk.gegc.clubaccess.features.refund.domain.model.AccessImpactPolicy;
import uk.gegc.clubaccess.features.refund.domain.model.AccessOutcome;
import uk.gegc.clubaccess.features.subscription.application.SubscriptionActionCommand;
import uk.gegc.clubaccess.features.subscription.application.SubscriptionActionResult;
import uk.gegc.clubaccess.features.subscription.application.SubscriptionLifecycleService;
import uk.gegc.clubaccess.features.subscription.domain.model.SubscriptionAction;
import uk.gegc.clubaccess.features.sync.domain.model.SyncResult;
import uk.gegc.clubaccess.shared.exception.RefundProviderException;
import uk.gegc.clubaccess.shared.exception.ValidationException;
import uk.gegc.clubaccess.shared.logging.AccessStructuredLogger;
import uk.gegc.clubaccess.shared.security.ActorRef;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class RefundServiceImpl implements RefundService {

    private final EntitlementLedger ledger;
    private final SubscriptionLifecycleService lifecycleService;
    private final AuditRecorder auditRecorder;
    private final Map<String, PaymentRefundProvider> providers;

    public RefundServiceImpl(EntitlementLedger ledger,
                             SubscriptionLifecycleService lifecycleService,
                             AuditRecorder auditRecorder,
                             List<PaymentRefundProvider> providers) {
        this.ledger = ledger;
        this.lifecycleService = lifecycleService;
        this.auditRecorder = auditRecorder;
        this.providers = providers.stream()
                .collect(Collectors.toMap(PaymentRefundProvider::providerKey, Function.identity()));
    }

    @Override
    public RefundOutcome refund(UUID orderId, RefundCommand command, ActorRef actor) {
        validateCommand(command);
        Order order = ledger.requireOrder(orderId);
        List<Payment> payments = ledger.findPayments(orderId);
        validateAgainstOrder(order, payments, command);

        Payment target = selectPayment(payments, command.amount());
        PaymentRefundProvider provider = providers.get(target.getProvider());
        if (provider == null) {
            throw new RefundProviderException(target.getProvider(), "No refund provider for '" + target.getProvider() + "'");
        }

        ProviderRefund providerRefund;
        try {
            providerRefund = provider.refund(target, command.amount(), command.reason());
        } catch (RefundProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RefundProviderException(target.getProvider(), "Refund provider call failed: " + e.getMessage(), e);
        }

        Order refunded = ledger.applyRefund(orderId, target.getId(), command.amount(), providerRefund.refundId(),
                command.policy() == AccessImpactPolicy.KEEP_SUBSCRIPTION);

        Optional<Subscription> subscription = ledger.findSubscriptionForOrder(refunded);
        AccessOutcome accessOutcome;
        SubscriptionActionResult transition = null;
        if (subscription.isEmpty()) {
            accessOutcome = AccessOutcome.NO_SUBSCRIPTION;
        } else {
            UUID subscriptionId = subscription.get().getId();
            switch (command.policy()) {
                case REVOKE -> {
                    transition = lifecycleService.apply(subscriptionId,
                            SubscriptionActionCommand.withReason(SubscriptionAction.REVOKE_ACCESS, "refund: " + command.reason()),
                            actor);
                    accessOutcome = AccessOutcome.REVOKED;
                }
                case REDUCE -> {
                    transition = lifecycleService.reduceAccess(subscriptionId, command.reduceDays(),
                            "refund: " + command.reason(), actor);
                    accessOutcome = AccessOutcome.REDUCED;
                }
                default -> accessOutcome = AccessOutcome.UNCHANGED;
            }
        }

        Map<String, SyncResult> syncResults = transition != null ? transition.syncResults() : Map.of();
        List<String> warnings = transition != null ? transition.warnings() : List.of();
        UUID subscriptionId = subscription.map(Subscription::getId).orElse(null);

        RefundAuditMeta meta = new RefundAuditMeta(
                orderId,
                target.getId(),
                subscriptionId,
                command.amount(),
                refunded.getCurrency(),
                command.reason(),
                command.policy().name().toLowerCase(),
                command.reduceDays(),
                accessOutcome.wireName(),
                refunded.getStatus().name().toLowerCase(),
                providerRefund.refundId(),
                syncResults
        );
        auditRecorder.record(actor, AuditActions.SUBSCRIPTION_REFUND, refunded.getUserId(), meta);

        AccessStructuredLogger.logAccessOperation(log, warnings.isEmpty() ? "info" : "warn",
                "Refunded {} {} on order {} via {} ({}), access {}",
                actor, "refund", refunded.getUserId(), orderId, subscriptionId,
                command.amount(), refunded.getCurrency(), refunded.getOrderNumber(), target.getProvider(),
                providerRefund.refundId(), accessOutcome.wireName());

        return new RefundOutcome(
                orderId,
                target.getId(),
                command.amount(),
                refunded.getCurrency(),
                refunded.getStatus(),
                command.policy(),
                accessOutcome,
                subscriptionId,
                providerRefund.refundId(),
                syncResults,
                warnings
        );
    }

    private void validateCommand(RefundCommand command) {
        if (command.reason() == null || command.reason().isBlank()) {
            throw new ValidationException("Refund reason is required");
        }
        if (command.amount() == null || command.amount().signum() <= 0) {
            throw new ValidationException("Refund amount must be greater than zero");
        }
        if (command.policy() == null) {
            throw new ValidationException("Access policy is required");
        }
        if (command.policy() == AccessImpactPolicy.REDUCE && (command.reduceDays() == null || command.reduceDays() < 1)) {
            throw new ValidationException("reduceDays must be at least 1 for the REDUCE policy");
        }
    }

    private void validateAgainstOrder(Order order, List<Payment> payments, RefundCommand command) {
        if (!order.getStatus().isRefundable()) {
            throw new ValidationException("Order " + order.getOrderNumber() + " is " + order.getStatus() + " and cannot be refunded");
        }
        BigDecimal amount = command.amount();
        if (amount.compareTo(order.getFinalPrice()) > 0) {
            throw new ValidationException("Refund amount " + amount + " exceeds the order price " + order.getFinalPrice());
        }
        BigDecimal refundable = payments.stream()
                .map(Payment::refundableBalance)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (amount.compareTo(refundable) > 0) {
            throw new ValidationException("Refund amount " + amount + " exceeds the refundable balance " + refundable);
        }
        if (command.policy() == AccessImpactPolicy.REVOKE && amount.compareTo(order.getFinalPrice()) != 0) {
            throw new ValidationException("The REVOKE policy requires a full refund of " + order.getFinalPrice());
        }
        if (command.policy() == AccessImpactPolicy.KEEP && amount.compareTo(order.getFinalPrice()) >= 0) {
            throw new ValidationException("The KEEP policy is only allowed for partial refunds");
        }
    }

    /**
     * The succeeded payment with the largest remaining balance that covers the whole amount.
     */
    private Payment selectPayment(List<Payment> payments, BigDecimal amount) {
        return payments.stream()
                .filter(p -> p.getStatus() == PaymentStatus.SUCCEEDED)
                .filter(p -> p.refundableBalance().compareTo(amount) >= 0)
                .max(Comparator.comparing(Payment::refundableBalance))
                .orElseThrow(() -> new ValidationException(
                        "No single payment covers a refund of " + amount + "; refund the payments separately"));
    }
}
