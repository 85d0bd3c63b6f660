package uk.gegc.clubaccess.features.refund.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AccessOutcome {
    REVOKED,
    REDUCED,
    UNCHANGED,
    NO_SUBSCRIPTION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
