package uk.gegc.clubaccess.features.notification.application;

public interface AdminNotifier {

    void notifyAdmins(String subject, String message);
}
