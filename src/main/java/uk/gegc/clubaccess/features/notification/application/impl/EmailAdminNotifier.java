package uk.gegc.clubaccess.features.notification.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.clubaccess.features.notification.application.AdminNotifier;
import uk.gegc.clubaccess.features.notification.application.NotificationProperties;
import uk.gegc.clubaccess.shared.email.EmailService;

@Slf4j
@Service
@RequiredArgsConstructor
public class EmailAdminNotifier implements AdminNotifier {

    private final EmailService emailService;
    private final NotificationProperties properties;

    @Override
    public void notifyAdmins(String subject, String message) {
        if (!properties.isEnabled() || properties.getAdminEmails().isEmpty()) {
            log.debug("Admin notifications disabled, dropping '{}'", subject);
            return;
        }
        String fullSubject = properties.getSubjectPrefix() == null || properties.getSubjectPrefix().isBlank()
                ? subject
                : properties.getSubjectPrefix() + " " + subject;
        for (String recipient : properties.getAdminEmails()) {
            emailService.sendPlainTextEmail(recipient, fullSubject, message);
        }
    }
}
