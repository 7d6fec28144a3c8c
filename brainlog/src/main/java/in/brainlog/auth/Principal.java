package in.brainlog.auth;

import in.brainlog.domain.user.UserRecord;
import in.brainlog.domain.user.UserRole;

/**
 * Authenticated identity handed to the session codec after a successful password check.
 */
public record Principal(
    String userId,
    String username,
    String displayName,
    UserRole role,
    boolean active,
    String timezone
) {
    public Principal {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (role == null) {
            throw new IllegalArgumentException("role is required");
        }
    }

    public static Principal of(UserRecord user) {
        return new Principal(user.userId(), user.username(), user.displayName(),
            user.role(), user.active(), user.timezone());
    }
}
