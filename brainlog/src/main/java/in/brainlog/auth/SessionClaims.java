package in.brainlog.auth;

import in.brainlog.domain.user.UserRole;

import java.time.Duration;
import java.time.Instant;

/**
 * Verified contents of a session token. Never persisted.
 */
public record SessionClaims(
    int version,
    String userId,
    UserRole role,
    boolean active,
    String timezone,
    Instant issuedAt,
    Instant expiresAt
) {
    public static final int CURRENT_VERSION = 1;

    public SessionClaims {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (role == null) {
            throw new IllegalArgumentException("role is required");
        }
        if (issuedAt == null || expiresAt == null) {
            throw new IllegalArgumentException("issuedAt and expiresAt are required");
        }
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * True once the token is older than the refresh window.
     */
    public boolean needsRefresh(Instant now, Duration refreshWindow) {
        return !now.isBefore(issuedAt.plus(refreshWindow));
    }
}
