package uk.gegc.clubaccess.features.notification.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import uk.gegc.clubaccess.features.notification.application.AdminNotifier;
import uk.gegc.clubaccess.features.notification.domain.event.AdminNotificationEvent;

@Component
@RequiredArgsConstructor
@Slf4j
public class AdminNotificationListener {

    private final AdminNotifier adminNotifier;

    @Async("notificationTaskExecutor")
    @EventListener
    public void handle(AdminNotificationEvent event) {
        try {
            adminNotifier.notifyAdmins(event.subject(), event.message());
        } catch (Exception e) {
            // best effort, never fails the workflow
            log.warn("Failed to notify admins about {} for user {}: {}", event.action(), event.targetUserId(), e.getMessage());
        }
    }
}
