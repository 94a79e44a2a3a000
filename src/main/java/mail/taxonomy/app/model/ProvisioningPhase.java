package mail.taxonomy.app.model;

public enum ProvisioningPhase {
    /** Core taxonomy for the selected business type, no team or supplier folders. */
    SKELETON,
    /** Team member and supplier folders added after onboarding data is saved. */
    TEAM_INJECTION
}
