package uk.gegc.clubaccess.features.sync.application;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Order context sent to the enrollment provider.
 */
public record EnrollmentOrder(
        UUID orderId,
        String orderNumber,
        UUID userId,
        BigDecimal amount,
        String currency
) {
}
