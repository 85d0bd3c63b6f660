package uk.gegc.clubaccess.features.notification.domain.event;

import java.util.UUID;

/**
 * Published after an admin workflow has committed and been audited.
 * Delivery is asynchronous and best effort.
 */
public record AdminNotificationEvent(String action, UUID targetUserId, String subject, String message) {
}
