package in.brainlog.domain.user;

import java.time.Instant;

/**
 * User entity as stored in the user directory.
 * The authenticator only reads it and mutates the lockout fields through the directory.
 */
public record UserRecord(
    String userId,
    String username,
    String email,
    String displayName,
    String timezone,
    String passwordHash,
    UserRole role,
    boolean active,
    int failedLoginAttempts,
    Instant lockedUntil,
    Instant lastLoginAt,
    Instant createdAt
) {
    public static final String DEFAULT_TIMEZONE = "America/New_York";

    public UserRecord {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username is required");
        }
        if (role == null) {
            throw new IllegalArgumentException("role is required");
        }
        if (role == UserRole.PENDING && active) {
            throw new IllegalArgumentException("Pending account cannot be active: " + userId);
        }
        if (failedLoginAttempts < 0) {
            throw new IllegalArgumentException("failedLoginAttempts must be >= 0");
        }
        if (timezone == null || timezone.isBlank()) {
            timezone = DEFAULT_TIMEZONE;
        }
    }

    public boolean isLockedAt(Instant now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }

    public boolean isPending() {
        return role == UserRole.PENDING;
    }

    public UserRecord withStatus(UserRole newRole, boolean newActive) {
        return new UserRecord(userId, username, email, displayName, timezone, passwordHash,
            newRole, newActive, failedLoginAttempts, lockedUntil, lastLoginAt, createdAt);
    }

    public UserRecord withLockout(int attempts, Instant until) {
        return new UserRecord(userId, username, email, displayName, timezone, passwordHash,
            role, active, attempts, until, lastLoginAt, createdAt);
    }

    public UserRecord withLastLogin(Instant at) {
        return new UserRecord(userId, username, email, displayName, timezone, passwordHash,
            role, active, failedLoginAttempts, lockedUntil, at, createdAt);
    }
}
