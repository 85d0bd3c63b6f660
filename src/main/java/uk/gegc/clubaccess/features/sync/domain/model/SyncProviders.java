package uk.gegc.clubaccess.features.sync.domain.model;

/**
 * Provider names used as keys of the sync-results map.
 */
public final class SyncProviders {

    public static final String COMMUNITY = "community";
    public static final String ENROLLMENT = "enrollment";

    private SyncProviders() {
    }
}
