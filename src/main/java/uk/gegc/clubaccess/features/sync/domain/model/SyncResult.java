package uk.gegc.clubaccess.features.sync.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one external provider call as it is stored on a subscription.
 *
 * @param success whether the provider confirmed the call
 * @param error   provider or transport error, absent on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncResult(boolean success, String error) {

    public static SyncResult ok() {
        return new SyncResult(true, null);
    }

    public static SyncResult failure(String error) {
        return new SyncResult(false, error == null || error.isBlank() ? "unknown error" : error);
    }
}
