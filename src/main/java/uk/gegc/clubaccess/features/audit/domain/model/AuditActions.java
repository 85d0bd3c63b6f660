package uk.gegc.clubaccess.features.audit.domain.model;

import java.util.Locale;

public final class AuditActions {

    public static final String GRANT_ACCESS = "admin.grant_access";
    public static final String GRANT_ACCESS_FOR_ORDER = "admin.grant_access_for_order";
    public static final String SUBSCRIPTION_REFUND = "admin.subscription.refund";

    private static final String SUBSCRIPTION_PREFIX = "admin.subscription.";

    private AuditActions() {
    }

    public static String subscription(String action) {
        return SUBSCRIPTION_PREFIX + action.toLowerCase(Locale.ROOT);
    }
}
