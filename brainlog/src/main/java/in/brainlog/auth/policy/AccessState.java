package in.brainlog.auth.policy;

import in.brainlog.auth.SessionClaims;
import in.brainlog.domain.user.UserRole;

import java.util.Optional;

/**
 * Caller state derived from verified session claims.
 */
public enum AccessState {
    ANONYMOUS,
    PENDING,
    INACTIVE_USER,
    ACTIVE_USER,
    ACTIVE_ADMIN;

    /**
     * Pending wins over the active flag; a non-pending inactive account is INACTIVE_USER
     * regardless of role.
     */
    public static AccessState of(Optional<SessionClaims> claims) {
        if (claims == null || claims.isEmpty()) {
            return ANONYMOUS;
        }
        SessionClaims c = claims.get();
        if (c.role() == UserRole.PENDING) {
            return PENDING;
        }
        if (!c.active()) {
            return INACTIVE_USER;
        }
        return c.role() == UserRole.ADMIN ? ACTIVE_ADMIN : ACTIVE_USER;
    }
}
