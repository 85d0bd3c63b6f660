package uk.gegc.clubaccess.features.subscription.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mapstruct.factory.Mappers;
import uk.gegc.clubaccess.BaseUnitTest;
import uk.gegc.clubaccess.features.audit.application.AuditRecorder;
import uk.gegc.clubaccess.features.audit.domain.model.AuditMeta;
import uk.gegc.clubaccess.features.audit.domain.model.SubscriptionActionAuditMeta;
import uk.gegc.clubaccess.features.ledger.application.AccessProperties;
import uk.gegc.clubaccess.features.ledger.application.EntitlementLedger;
import uk.gegc.clubaccess.features.ledger.domain.model.AccessGrantRecord;
import uk.gegc.clubaccess.features.ledger.domain.model.AccessGrantSource;
import uk.gegc.clubaccess.features.ledger.domain.model.AccessGrantStatus;
import uk.gegc.clubaccess.features.ledger.domain.model.PaymentMethod;
import uk.gegc.clubaccess.features.ledger.domain.model.Product;
import uk.gegc.clubaccess.features.ledger.domain.model.Subscription;
import uk.gegc.clubaccess.features.ledger.domain.model.SubscriptionStatus;
import uk.gegc.clubaccess.features.ledger.domain.model.Tariff;
import uk.gegc.clubaccess.features.subscription.application.SubscriptionActionCommand;
import uk.gegc.clubaccess.features.subscription.application.SubscriptionActionResult;
import uk.gegc.clubaccess.features.subscription.domain.model.SubscriptionAction;
import uk.gegc.clubaccess.features.subscription.infra.mapping.SubscriptionMapper;
import uk.gegc.clubaccess.features.sync.application.ExternalSyncCoordinator;
import uk.gegc.clubaccess.features.sync.domain.model.SyncResult;
import uk.gegc.clubaccess.shared.exception.InvalidSubscriptionStateException;
import uk.gegc.clubaccess.shared.exception.ValidationException;
import uk.gegc.clubaccess.shared.security.ActorRef;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("SubscriptionLifecycleServiceImpl unit tests")
class SubscriptionLifecycleServiceImplTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant END = Instant.parse("2026-03-31T23:59:59Z");

    @Mock private EntitlementLedger ledger;
    @Mock private ExternalSyncCoordinator syncCoordinator;
    @Mock private AuditRecorder auditRecorder;

    private SubscriptionLifecycleServiceImpl service;
    private Subscription subscription;
    private Product product;
    private Tariff tariff;
    private final UUID subscriptionId = UUID.randomUUID();
    private final UUID userId = UUID.randomUUID();
    private final ActorRef actor = ActorRef.admin(UUID.randomUUID());

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        SubscriptionMapper mapper = Mappers.getMapper(SubscriptionMapper.class);
        service = new SubscriptionLifecycleServiceImpl(ledger, syncCoordinator, auditRecorder, mapper,
                new AccessProperties(), clock);

        product = new Product();
        product.setId(UUID.randomUUID());
        product.setCode("club");
        product.setName("Club");
        product.setCommunityClubId("club-1");

        tariff = new Tariff();
        tariff.setId(UUID.randomUUID());
        tariff.setProductId(product.getId());
        tariff.setCode("monthly");
        tariff.setName("Monthly");
        tariff.setAccessDays(30);
        tariff.setCurrency("EUR");

        subscription = new Subscription();
        subscription.setId(subscriptionId);
        subscription.setUserId(userId);
        subscription.setProductId(product.getId());
        subscription.setTariffId(tariff.getId());
        subscription.setOrderId(UUID.randomUUID());
        subscription.setStatus(SubscriptionStatus.ACTIVE);
        subscription.setAccessStartAt(Instant.parse("2026-02-01T00:00:00Z"));
        subscription.setAccessEndAt(END);
        subscription.setAutoRenew(true);
        subscription.setNextChargeAt(END);
        subscription.acquireOpenKey();

        lenient().when(ledger.requireSubscription(subscriptionId)).thenReturn(subscription);
        lenient().when(ledger.requireProduct(product.getId())).thenReturn(product);
        lenient().when(ledger.requireTariff(tariff.getId())).thenReturn(tariff);
        lenient().when(ledger.updateSubscription(eq(subscriptionId), any())).thenAnswer(inv -> {
            Consumer<Subscription> mutation = inv.getArgument(1);
            mutation.accept(subscription);
            return subscription;
        });
        lenient().when(ledger.recordSyncResults(eq(subscriptionId), anyMap())).thenAnswer(inv -> {
            subscription.mergeSyncResults(inv.getArgument(1));
            return subscription;
        });
    }

    @Test
    @DisplayName("cancel: keeps access until the end, stops charging and releases the open key")
    void cancel_keepsAccessUntilEnd() {
        SubscriptionActionResult result = service.apply(subscriptionId,
                SubscriptionActionCommand.of(SubscriptionAction.CANCEL), actor);

        assertEquals(NOW, subscription.getCanceledAt());
        assertEquals(END, subscription.getCancelAt());
        assertEquals(END, subscription.getAccessEndAt());
        assertNull(subscription.getNextChargeAt());
        assertNull(subscription.getOpenKey());
        assertEquals(SubscriptionStatus.ACTIVE, result.subscription().status());
        verify(auditRecorder).record(eq(actor), eq("admin.subscription.cancel"), eq(userId), any(AuditMeta.class));
    }

    @Test
    @DisplayName("cancel: already cancelled subscription is rejected and nothing is audited")
    void cancel_alreadyCancelled_rejected() {
        subscription.setCanceledAt(NOW.minusSeconds(3600));

        InvalidSubscriptionStateException ex = assertThrows(InvalidSubscriptionStateException.class,
                () -> service.apply(subscriptionId, SubscriptionActionCommand.of(SubscriptionAction.CANCEL), actor));

        assertEquals("cancel", ex.getAction());
        verify(auditRecorder, never()).record(any(), anyString(), any(), any());
    }

    @Test
    @DisplayName("cancel: expired subscription is rejected")
    void cancel_expired_rejected() {
        subscription.setAccessEndAt(NOW.minusSeconds(1));

        assertThrows(InvalidSubscriptionStateException.class,
                () -> service.apply(subscriptionId, SubscriptionActionCommand.of(SubscriptionAction.CANCEL), actor));
    }

    @Test
    @DisplayName("resume: clears the cancellation and takes the open key back")
    void resume_afterCancel_restoresKey() {
        subscription.setCanceledAt(NOW.minusSeconds(3600));
        subscription.setCancelAt(END);
        subscription.setNextChargeAt(null);
        subscription.releaseOpenKey();

        service.apply(subscriptionId, SubscriptionActionCommand.of(SubscriptionAction.RESUME), actor);

        assertNull(subscription.getCanceledAt());
        assertNull(subscription.getCancelAt());
        assertEquals(SubscriptionStatus.ACTIVE, subscription.getStatus());
        assertEquals(END, subscription.getNextChargeAt());
        assertEquals(Subscription.openKeyOf(userId, product.getId(), tariff.getId()), subscription.getOpenKey());
    }

    @Test
    @DisplayName("resume: subscription that was never cancelled or paused is rejected")
    void resume_notCancelled_rejected() {
        assertThrows(InvalidSubscriptionStateException.class,
                () -> service.apply(subscriptionId, SubscriptionActionCommand.of(SubscriptionAction.RESUME), actor));
    }

    @Test
    @DisplayName("resume: cancelled subscription whose access already ended is rejected")
    void resume_expired_rejected() {
        subscription.setCanceledAt(NOW.minusSeconds(7200));
        subscription.setAccessEndAt(NOW.minusSeconds(60));

        assertThrows(InvalidSubscriptionStateException.class,
                () -> service.apply(subscriptionId, SubscriptionActionCommand.of(SubscriptionAction.RESUME), actor));
    }

    @Test
    @DisplayName("pause: moves to PAUSED and stops charging")
    void pause_setsPaused() {
        service.apply(subscriptionId, SubscriptionActionCommand.of(SubscriptionAction.PAUSE), actor);

        assertEquals(SubscriptionStatus.PAUSED, subscription.getStatus());
        assertEquals(NOW, subscription.getPausedAt());
        assertNull(subscription.getNextChargeAt());
        assertNull(subscription.getOpenKey());
    }

    @Test
    @DisplayName("extend: zero or negative days fail without touching the ledger")
    void extend_nonPositiveDays_rejected() {
        SubscriptionActionCommand zero = new SubscriptionActionCommand(SubscriptionAction.EXTEND, 0, null, null, null);
        SubscriptionActionCommand negative = new SubscriptionActionCommand(SubscriptionAction.EXTEND, -5, null, null, null);

        assertThrows(ValidationException.class, () -> service.apply(subscriptionId, zero, actor));
        assertThrows(ValidationException.class, () -> service.apply(subscriptionId, negative, actor));

        verify(ledger, never()).updateSubscription(any(), any());
        assertEquals(END, subscription.getAccessEndAt());
    }

    @Test
    @DisplayName("extend: adds days to the current end and grants the community for the remaining days")
    void extend_addsDaysAndSyncsCommunity() {
        AccessGrantRecord record = grantRecord("club-1");
        when(ledger.openGrantRecord(subscription, "club-1", AccessGrantSource.ADMIN_GRANT, subscription.getOrderId()))
                .thenReturn(record);
        when(syncCoordinator.grantCommunity(userId, "club-1", 61, "admin_grant")).thenReturn(SyncResult.ok());

        SubscriptionActionResult result = service.apply(subscriptionId,
                new SubscriptionActionCommand(SubscriptionAction.EXTEND, 30, null, null, null), actor);

        assertEquals(Instant.parse("2026-04-30T23:59:59Z"), subscription.getAccessEndAt());
        assertEquals(Instant.parse("2026-04-30T23:59:59Z"), subscription.getNextChargeAt());
        verify(ledger).completeGrantRecord(record.getId(), SyncResult.ok());
        assertEquals(Map.of("community", SyncResult.ok()), result.syncResults());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    @DisplayName("extend: expired subscription is extended from now and reactivated")
    void extend_expired_fromNow() {
        subscription.setStatus(SubscriptionStatus.EXPIRED);
        subscription.setAccessEndAt(Instant.parse("2026-02-15T23:59:59Z"));
        subscription.releaseOpenKey();
        product.setCommunityClubId(null);

        service.apply(subscriptionId, new SubscriptionActionCommand(SubscriptionAction.EXTEND, 10, null, null, null), actor);

        assertEquals(NOW.plusSeconds(10L * 24 * 3600), subscription.getAccessEndAt());
        assertEquals(SubscriptionStatus.ACTIVE, subscription.getStatus());
        assertThat(subscription.getOpenKey()).isNotNull();
        verify(syncCoordinator, never()).grantCommunity(any(), any(), anyInt(), any());
    }

    @Test
    @DisplayName("extend: community failure is a warning, the extension stands")
    void extend_communityFailure_isWarning() {
        when(ledger.openGrantRecord(any(), any(), any(), any())).thenReturn(grantRecord("club-1"));
        when(syncCoordinator.grantCommunity(any(), any(), anyInt(), any()))
                .thenReturn(SyncResult.failure("timed out after 10000 ms"));

        SubscriptionActionResult result = service.apply(subscriptionId,
                new SubscriptionActionCommand(SubscriptionAction.EXTEND, 5, null, null, null), actor);

        assertEquals(Instant.parse("2026-04-05T23:59:59Z"), subscription.getAccessEndAt());
        assertEquals(List.of("community_sync_failed: timed out after 10000 ms"), result.warnings());
        assertFalse(subscription.getSyncResults().get("community").success());
    }

    @Test
    @DisplayName("extend: revoked subscription is rejected and the community is not called")
    void extend_afterRevoke_rejected() {
        when(ledger.findLiveGrantRecords(subscriptionId)).thenReturn(List.of());
        when(syncCoordinator.revokeCommunity(any(), any(), any())).thenReturn(SyncResult.ok());
        service.apply(subscriptionId, SubscriptionActionCommand.of(SubscriptionAction.REVOKE_ACCESS), actor);
        Instant revokedEnd = subscription.getAccessEndAt();

        InvalidSubscriptionStateException ex = assertThrows(InvalidSubscriptionStateException.class,
                () -> service.apply(subscriptionId,
                        new SubscriptionActionCommand(SubscriptionAction.EXTEND, 10, null, null, null), actor));

        assertEquals("extend", ex.getAction());
        assertEquals(SubscriptionStatus.CANCELLED, subscription.getStatus());
        assertEquals(revokedEnd, subscription.getAccessEndAt());
        assertNull(subscription.getOpenKey());
        verify(syncCoordinator, never()).grantCommunity(any(), any(), anyInt(), any());
    }

    @Test
    @DisplayName("extend: paused subscription is rejected until it is resumed")
    void extend_paused_rejected() {
        service.apply(subscriptionId, SubscriptionActionCommand.of(SubscriptionAction.PAUSE), actor);

        assertThrows(InvalidSubscriptionStateException.class, () -> service.apply(subscriptionId,
                new SubscriptionActionCommand(SubscriptionAction.EXTEND, 10, null, null, null), actor));

        assertEquals(END, subscription.getAccessEndAt());
        assertEquals(SubscriptionStatus.PAUSED, subscription.getStatus());
        verify(syncCoordinator, never()).grantCommunity(any(), any(), anyInt(), any());
    }

    @Test
    @DisplayName("extend: subscription cancelled at period end gets the days but no community grant")
    void extend_cancelledAtPeriodEnd_noCommunityGrant() {
        service.apply(subscriptionId, SubscriptionActionCommand.of(SubscriptionAction.CANCEL), actor);

        SubscriptionActionResult result = service.apply(subscriptionId,
                new SubscriptionActionCommand(SubscriptionAction.EXTEND, 5, null, null, null), actor);

        assertEquals(Instant.parse("2026-04-05T23:59:59Z"), subscription.getAccessEndAt());
        assertNull(subscription.getOpenKey());
        assertTrue(result.syncResults().isEmpty());
        verify(ledger, never()).openGrantRecord(any(), any(), any(), any());
        verify(syncCoordinator, never()).grantCommunity(any(), any(), anyInt(), any());
    }

    @Test
    @DisplayName("set_end_date: requires a date")
    void setEndDate_requiresDate() {
        assertThrows(ValidationException.class, () -> service.apply(subscriptionId,
                SubscriptionActionCommand.of(SubscriptionAction.SET_END_DATE), actor));
    }

    @Test
    @DisplayName("set_end_date: sets the end to the last second of the date")
    void setEndDate_endOfDay() {
        service.apply(subscriptionId,
                new SubscriptionActionCommand(SubscriptionAction.SET_END_DATE, null, LocalDate.of(2026, 6, 30), null, null), actor);

        assertEquals(Instant.parse("2026-06-30T23:59:59Z"), subscription.getAccessEndAt());
    }

    @Test
    @DisplayName("grant_access: lapsed subscription without days gets the tariff's access days from now")
    void grantAccess_lapsed_usesTariffDays() {
        subscription.setStatus(SubscriptionStatus.CANCELLED);
        subscription.setCanceledAt(Instant.parse("2026-02-10T00:00:00Z"));
        subscription.setAccessEndAt(Instant.parse("2026-02-10T00:00:00Z"));
        subscription.releaseOpenKey();
        when(ledger.openGrantRecord(any(), any(), any(), any())).thenReturn(grantRecord("club-1"));
        when(syncCoordinator.grantCommunity(any(), any(), anyInt(), any())).thenReturn(SyncResult.ok());

        service.apply(subscriptionId, SubscriptionActionCommand.of(SubscriptionAction.GRANT_ACCESS), actor);

        assertEquals(NOW, subscription.getAccessStartAt());
        assertEquals(NOW.plusSeconds(30L * 24 * 3600), subscription.getAccessEndAt());
        assertEquals(SubscriptionStatus.ACTIVE, subscription.getStatus());
        assertNull(subscription.getCanceledAt());
        assertThat(subscription.getOpenKey()).isNotNull();
    }

    @Test
    @DisplayName("grant_access: running subscription without days keeps its end")
    void grantAccess_running_keepsEnd() {
        when(ledger.openGrantRecord(any(), any(), any(), any())).thenReturn(grantRecord("club-1"));
        when(syncCoordinator.grantCommunity(any(), any(), anyInt(), any())).thenReturn(SyncResult.ok());

        service.apply(subscriptionId, SubscriptionActionCommand.of(SubscriptionAction.GRANT_ACCESS), actor);

        assertEquals(END, subscription.getAccessEndAt());
    }

    @Test
    @DisplayName("revoke_access: ends access now and revokes every live community grant and the enrollment")
    void revokeAccess_endsNowAndCallsProviders() {
        tariff.setEnrollmentOfferId("offer-7");
        AccessGrantRecord record = grantRecord("club-1");
        when(ledger.findLiveGrantRecords(subscriptionId)).thenReturn(List.of(record));
        when(syncCoordinator.revokeCommunity(userId, "club-1", "chargeback")).thenReturn(SyncResult.ok());
        when(syncCoordinator.cancelEnrollment(subscription.getOrderId(), "chargeback"))
                .thenReturn(SyncResult.failure("HTTP 500"));

        SubscriptionActionResult result = service.apply(subscriptionId,
                SubscriptionActionCommand.withReason(SubscriptionAction.REVOKE_ACCESS, "chargeback"), actor);

        assertEquals(SubscriptionStatus.CANCELLED, subscription.getStatus());
        assertEquals(NOW, subscription.getAccessEndAt());
        assertNull(subscription.getOpenKey());
        assertNull(subscription.getNextChargeAt());
        verify(ledger).completeRevocation(record.getId(), SyncResult.ok());
        assertTrue(result.syncResults().get("community").success());
        assertEquals(List.of("enrollment_sync_failed: HTTP 500"), result.warnings());
    }

    @Test
    @DisplayName("revoke_access: without grant records the product's club is still revoked")
    void revokeAccess_noRecords_revokesProductClub() {
        when(ledger.findLiveGrantRecords(subscriptionId)).thenReturn(List.of());
        when(syncCoordinator.revokeCommunity(userId, "club-1", "admin_revoke")).thenReturn(SyncResult.ok());

        service.apply(subscriptionId, SubscriptionActionCommand.of(SubscriptionAction.REVOKE_ACCESS), actor);

        verify(syncCoordinator).revokeCommunity(userId, "club-1", "admin_revoke");
        verify(ledger, never()).completeRevocation(any(), any());
    }

    @Test
    @DisplayName("delete: removes the subscription, then revokes external access")
    void delete_removesAndRevokes() {
        AccessGrantRecord record = grantRecord("club-1");
        when(ledger.findLiveGrantRecords(subscriptionId)).thenReturn(List.of(record));
        when(ledger.deleteSubscription(subscriptionId)).thenReturn(subscription);
        when(syncCoordinator.revokeCommunity(userId, "club-1", "subscription_deleted")).thenReturn(SyncResult.ok());

        SubscriptionActionResult result = service.apply(subscriptionId,
                SubscriptionActionCommand.of(SubscriptionAction.DELETE), actor);

        assertTrue(result.deleted());
        assertEquals(subscriptionId, result.subscription().id());
        verify(ledger).completeRevocation(record.getId(), SyncResult.ok());
        verify(ledger, never()).recordSyncResults(any(), any());

        ArgumentCaptor<AuditMeta> meta = ArgumentCaptor.forClass(AuditMeta.class);
        verify(auditRecorder).record(eq(actor), eq("admin.subscription.delete"), eq(userId), meta.capture());
        assertTrue(((SubscriptionActionAuditMeta) meta.getValue()).deleted());
    }

    @Test
    @DisplayName("toggle_auto_renew: enabling without a payment method warns but still records the change")
    void toggleAutoRenew_noPaymentMethod_warns() {
        subscription.setAutoRenew(false);
        subscription.setNextChargeAt(null);
        when(ledger.findActivePaymentMethod(userId)).thenReturn(Optional.empty());

        SubscriptionActionResult result = service.apply(subscriptionId,
                new SubscriptionActionCommand(SubscriptionAction.TOGGLE_AUTO_RENEW, null, null, true, "customer asked"), actor);

        assertEquals(List.of("no_active_payment_method"), result.warnings());
        assertTrue(subscription.isAutoRenew());
        assertEquals(actor.actorId(), subscription.getAutoRenewChangedBy());
        assertEquals(NOW, subscription.getAutoRenewChangedAt());
        assertEquals("customer asked", subscription.getAutoRenewChangeReason());
    }

    @Test
    @DisplayName("toggle_auto_renew: enabling attaches the user's active payment method")
    void toggleAutoRenew_attachesPaymentMethod() {
        subscription.setAutoRenew(false);
        PaymentMethod method = new PaymentMethod();
        method.setId(UUID.randomUUID());
        when(ledger.findActivePaymentMethod(userId)).thenReturn(Optional.of(method));

        SubscriptionActionResult result = service.apply(subscriptionId,
                new SubscriptionActionCommand(SubscriptionAction.TOGGLE_AUTO_RENEW, null, null, true, null), actor);

        assertEquals(method.getId(), subscription.getPaymentMethodId());
        assertEquals(END, subscription.getNextChargeAt());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    @DisplayName("toggle_auto_renew: target flag is required")
    void toggleAutoRenew_requiresTarget() {
        assertThrows(ValidationException.class, () -> service.apply(subscriptionId,
                SubscriptionActionCommand.of(SubscriptionAction.TOGGLE_AUTO_RENEW), actor));
    }

    @Test
    @DisplayName("reduce_access is not accepted as a direct action")
    void reduceAccess_notDirectAction() {
        assertThrows(ValidationException.class, () -> service.apply(subscriptionId,
                SubscriptionActionCommand.of(SubscriptionAction.REDUCE_ACCESS), actor));
    }

    @Test
    @DisplayName("reduceAccess: moves the end back and leaves the status alone")
    void reduceAccess_shortensEnd() {
        SubscriptionActionResult result = service.reduceAccess(subscriptionId, 10, "refund: partial", actor);

        assertEquals(Instant.parse("2026-03-21T23:59:59Z"), subscription.getAccessEndAt());
        assertEquals(SubscriptionStatus.ACTIVE, result.subscription().status());
        verify(auditRecorder).record(eq(actor), eq("admin.subscription.reduce_access"), eq(userId), any(AuditMeta.class));
    }

    @Test
    @DisplayName("reduceAccess: past the current date releases the open key")
    void reduceAccess_pastNow_releasesKey() {
        service.reduceAccess(subscriptionId, 45, "refund", actor);

        assertTrue(subscription.getAccessEndAt().isBefore(NOW));
        assertNull(subscription.getOpenKey());
        assertNull(subscription.getNextChargeAt());
    }

    @Test
    @DisplayName("reduceAccess: days below one are rejected")
    void reduceAccess_zeroDays_rejected() {
        assertThrows(ValidationException.class, () -> service.reduceAccess(subscriptionId, 0, "refund", actor));
        verify(ledger, never()).updateSubscription(any(), any());
    }

    private AccessGrantRecord grantRecord(String clubId) {
        AccessGrantRecord record = new AccessGrantRecord();
        record.setId(UUID.randomUUID());
        record.setUserId(userId);
        record.setClubId(clubId);
        record.setSubscriptionId(subscriptionId);
        record.setStatus(AccessGrantStatus.ACTIVE);
        return record;
    }
}
