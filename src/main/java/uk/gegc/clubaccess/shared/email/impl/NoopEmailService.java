package uk.gegc.clubaccess.shared.email.impl;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.clubaccess.shared.email.EmailService;

/**
 * Admin notifications end up in the log only.
 * Active when app.email.provider=noop, the default.
 */
@Slf4j
public class NoopEmailService implements EmailService {

    public NoopEmailService() {
        log.info("Admin notification mail is off (app.email.provider=noop)");
    }

    @Override
    public void sendPlainTextEmail(String to, String subject, String body) {
        log.info("Notification not mailed: to={} subject='{}' ({} chars)",
                EmailMasking.maskEmail(to), subject, body == null ? 0 : body.length());
    }
}
