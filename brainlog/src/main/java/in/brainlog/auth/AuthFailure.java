package in.brainlog.auth;

/**
 * Why an authentication attempt did not produce a principal.
 *
 * INVALID_CREDENTIALS and ACCOUNT_LOCKED are rendered identically to clients;
 * the distinction is only recorded in the audit trail.
 */
public enum AuthFailure {
    MISSING_CREDENTIALS,
    INVALID_CREDENTIALS,
    ACCOUNT_LOCKED,
    UNAVAILABLE
}
