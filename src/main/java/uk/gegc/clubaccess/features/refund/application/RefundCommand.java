package uk.gegc.clubaccess.features.refund.application;

import uk.gegc.clubaccess.features.refund.domain.model.AccessImpactPolicy;

import java.math.BigDecimal;

/**
 * @param reduceDays days to remove from access, required for {@link AccessImpactPolicy#REDUCE}
 */
public record RefundCommand(BigDecimal amount, String reason, AccessImpactPolicy policy, Integer reduceDays) {
}
