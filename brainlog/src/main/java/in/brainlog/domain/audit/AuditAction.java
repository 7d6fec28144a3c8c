package in.brainlog.domain.audit;

/**
 * Closed vocabulary of audited security actions.
 */
public enum AuditAction {
    // Authentication
    LOGIN_SUCCESS,
    LOGIN_FAILED,
    ACCOUNT_LOCKED,
    LOGOUT,

    // Account administration
    USER_REGISTERED,
    USER_APPROVED,
    USER_DEACTIVATED,
    USER_PROMOTED,
    ACCOUNT_UNLOCKED,
    SETTINGS_UPDATED
}
