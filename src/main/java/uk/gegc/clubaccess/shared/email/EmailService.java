package uk.gegc.clubaccess.shared.email;

public interface EmailService {
    void sendPlainTextEmail(String to, String subject, String body);
}
