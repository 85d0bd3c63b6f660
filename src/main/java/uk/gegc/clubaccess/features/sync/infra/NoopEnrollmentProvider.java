package uk.gegc.clubaccess.features.sync.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import uk.gegc.clubaccess.features.sync.application.EnrollmentOrder;
import uk.gegc.clubaccess.features.sync.application.EnrollmentProvider;

import java.util.UUID;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "clubaccess.sync.enrollment", name = "mode", havingValue = "noop", matchIfMissing = true)
public class NoopEnrollmentProvider implements EnrollmentProvider {

    @Override
    public void enroll(EnrollmentOrder order, String offerIdentifier, String tariffCode) {
        log.info("[NOOP] Would enroll order {} (offer {}, tariff code {})", order.orderNumber(), offerIdentifier, tariffCode);
    }

    @Override
    public void cancel(UUID orderId, String reason) {
        log.info("[NOOP] Would cancel enrollment of order {}: {}", orderId, reason);
    }
}
