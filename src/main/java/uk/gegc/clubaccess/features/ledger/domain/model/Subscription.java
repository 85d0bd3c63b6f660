package uk.gegc.clubaccess.features.ledger.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.clubaccess.features.ledger.infra.SyncResultsConverter;
import uk.gegc.clubaccess.features.sync.domain.model.SyncResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The access grant itself.
 *
 * <p>{@code openKey} is set only while the subscription is open (live status, not cancelled,
 * access-end in the future). The unique constraint on it allows a single open subscription
 * per user, product and tariff.
 */
@Entity
@Table(name = "subscriptions", uniqueConstraints = {
        @UniqueConstraint(name = Subscription.OPEN_KEY_CONSTRAINT, columnNames = "open_key")
})
@Getter
@Setter
public class Subscription {

    public static final String OPEN_KEY_CONSTRAINT = "uk_subscriptions_open_key";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "product_id", nullable = false)
    private UUID productId;

    @Column(name = "tariff_id", nullable = false)
    private UUID tariffId;

    @Column(name = "order_id")
    private UUID orderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private SubscriptionStatus status;

    @Column(name = "trial", nullable = false)
    private boolean trial;

    @Column(name = "access_start_at", nullable = false)
    private Instant accessStartAt;

    @Column(name = "access_end_at", nullable = false)
    private Instant accessEndAt;

    @Column(name = "canceled_at")
    private Instant canceledAt;

    @Column(name = "cancel_at")
    private Instant cancelAt;

    @Column(name = "paused_at")
    private Instant pausedAt;

    @Column(name = "next_charge_at")
    private Instant nextChargeAt;

    @Column(name = "auto_renew", nullable = false)
    private boolean autoRenew;

    @Column(name = "auto_renew_changed_by")
    private UUID autoRenewChangedBy;

    @Column(name = "auto_renew_changed_at")
    private Instant autoRenewChangedAt;

    @Column(name = "auto_renew_change_reason", length = 500)
    private String autoRenewChangeReason;

    @Column(name = "payment_method_id")
    private UUID paymentMethodId;

    @Column(name = "charge_attempts", nullable = false)
    private int chargeAttempts;

    @Column(name = "open_key", length = 120)
    private String openKey;

    @Convert(converter = SyncResultsConverter.class)
    @Column(name = "sync_results", columnDefinition = "TEXT")
    private Map<String, SyncResult> syncResults = new LinkedHashMap<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "subscription_extended_orders", joinColumns = @JoinColumn(name = "subscription_id"))
    @OrderColumn(name = "order_index")
    @Column(name = "order_id", nullable = false)
    private List<UUID> extendedByOrders = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public static String openKeyOf(UUID userId, UUID productId, UUID tariffId) {
        return userId + ":" + productId + ":" + tariffId;
    }

    public boolean isExpired(Instant now) {
        return !accessEndAt.isAfter(now);
    }

    public boolean isCancelled() {
        return canceledAt != null;
    }

    public boolean isOpen(Instant now) {
        return status.isLive() && canceledAt == null && !isExpired(now);
    }

    public void acquireOpenKey() {
        this.openKey = openKeyOf(userId, productId, tariffId);
    }

    public void releaseOpenKey() {
        this.openKey = null;
    }

    public void mergeSyncResults(Map<String, SyncResult> results) {
        if (results == null || results.isEmpty()) {
            return;
        }
        Map<String, SyncResult> merged = new LinkedHashMap<>(syncResults != null ? syncResults : Map.of());
        merged.putAll(results);
        this.syncResults = merged;
    }
}
