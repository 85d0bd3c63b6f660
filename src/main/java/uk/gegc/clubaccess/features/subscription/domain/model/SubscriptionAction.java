package uk.gegc.clubaccess.features.subscription.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Named admin actions on one subscription. Accepted case-insensitively on the wire.
 */
public enum SubscriptionAction {
    CANCEL,
    RESUME,
    PAUSE,
    EXTEND,
    SET_END_DATE,
    GRANT_ACCESS,
    REVOKE_ACCESS,
    DELETE,
    TOGGLE_AUTO_RENEW,
    /**
     * Internal: shortening access as part of a refund. Not accepted from the API.
     */
    REDUCE_ACCESS;

    @JsonCreator
    public static SubscriptionAction fromValue(String value) {
        if (value == null) {
            return null;
        }
        return SubscriptionAction.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
