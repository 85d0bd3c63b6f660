package uk.gegc.clubaccess.features.sync.application.impl;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import uk.gegc.clubaccess.features.sync.application.CommunityProvider;
import uk.gegc.clubaccess.features.sync.application.EnrollmentOrder;
import uk.gegc.clubaccess.features.sync.application.EnrollmentProvider;
import uk.gegc.clubaccess.features.sync.application.ExternalSyncCoordinator;
import uk.gegc.clubaccess.features.sync.application.GrantSyncRequest;
import uk.gegc.clubaccess.features.sync.application.SyncProperties;
import uk.gegc.clubaccess.features.sync.domain.model.SyncProviders;
import uk.gegc.clubaccess.features.sync.domain.model.SyncResult;
import uk.gegc.clubaccess.shared.logging.AccessStructuredLogger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
@Service
public class ExternalSyncCoordinatorImpl implements ExternalSyncCoordinator {

    static final String METRIC_NAME = "clubaccess.sync.calls";

    private final CommunityProvider communityProvider;
    private final EnrollmentProvider enrollmentProvider;
    private final Executor syncExecutor;
    private final SyncProperties syncProperties;
    private final MeterRegistry meterRegistry;

    public ExternalSyncCoordinatorImpl(CommunityProvider communityProvider,
                                       EnrollmentProvider enrollmentProvider,
                                       @Qualifier("syncTaskExecutor") Executor syncExecutor,
                                       SyncProperties syncProperties,
                                       MeterRegistry meterRegistry) {
        this.communityProvider = communityProvider;
        this.enrollmentProvider = enrollmentProvider;
        this.syncExecutor = syncExecutor;
        this.syncProperties = syncProperties;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public SyncResult grantCommunity(UUID userId, String clubId, int days, String source) {
        return communityGrant(userId, clubId, days, source).join();
    }

    @Override
    public SyncResult revokeCommunity(UUID userId, String clubId, String reason) {
        return submit(SyncProviders.COMMUNITY, "revoke", userId,
                () -> communityProvider.revokeAccess(userId, clubId, reason)).join();
    }

    @Override
    public SyncResult enroll(EnrollmentOrder order, String offerIdentifier, String tariffCode) {
        return enrollment(order, offerIdentifier, tariffCode).join();
    }

    @Override
    public SyncResult cancelEnrollment(UUID orderId, String reason) {
        return submit(SyncProviders.ENROLLMENT, "cancel", null,
                () -> enrollmentProvider.cancel(orderId, reason)).join();
    }

    @Override
    public Map<String, SyncResult> syncGrant(GrantSyncRequest request) {
        CompletableFuture<SyncResult> community = request.hasCommunity()
                ? communityGrant(request.userId(), request.clubId(), request.communityDays(), request.source())
                : null;
        CompletableFuture<SyncResult> enrollment = request.hasEnrollment()
                ? enrollment(request.enrollmentOrder(), request.offerIdentifier(), request.tariffCode())
                : null;

        Map<String, SyncResult> results = new LinkedHashMap<>();
        if (community != null) {
            results.put(SyncProviders.COMMUNITY, community.join());
        }
        if (enrollment != null) {
            results.put(SyncProviders.ENROLLMENT, enrollment.join());
        }
        return results;
    }

    private CompletableFuture<SyncResult> communityGrant(UUID userId, String clubId, int days, String source) {
        return submit(SyncProviders.COMMUNITY, "grant", userId,
                () -> communityProvider.grantAccess(userId, clubId, days, source));
    }

    private CompletableFuture<SyncResult> enrollment(EnrollmentOrder order, String offerIdentifier, String tariffCode) {
        return submit(SyncProviders.ENROLLMENT, "enroll", order.userId(),
                () -> enrollmentProvider.enroll(order, offerIdentifier, tariffCode));
    }

    /**
     * Runs one provider call on the sync pool. The returned future never completes exceptionally.
     */
    private CompletableFuture<SyncResult> submit(String provider, String operation, UUID userId, Runnable call) {
        long timeoutMs = syncProperties.getTimeoutMs();
        return CompletableFuture.runAsync(call, syncExecutor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handle((ignored, error) -> {
                    SyncResult result = error == null ? SyncResult.ok() : SyncResult.failure(describe(error, timeoutMs));
                    record(provider, operation, userId, result);
                    return result;
                });
    }

    private void record(String provider, String operation, UUID userId, SyncResult result) {
        meterRegistry.counter(METRIC_NAME,
                "provider", provider,
                "operation", operation,
                "outcome", result.success() ? "success" : "failure").increment();
        if (result.success()) {
            AccessStructuredLogger.logSyncOperation(log, "debug", "Provider {} {} succeeded",
                    provider, operation, userId, provider, operation);
        } else {
            AccessStructuredLogger.logSyncOperation(log, "warn", "Provider {} {} failed: {}",
                    provider, operation, userId, provider, operation, result.error());
        }
    }

    private static String describe(Throwable error, long timeoutMs) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return "timed out after " + timeoutMs + " ms";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
