package in.brainlog.domain.user;

/**
 * Account role.
 *
 * PENDING is a lifecycle state (registered, never approved), not a weaker USER.
 */
public enum UserRole {
    PENDING,
    USER,
    ADMIN;

    /**
     * Lenient parse for values read from storage or tokens.
     * Returns null for unknown values.
     */
    public static UserRole fromString(String value) {
        if (value == null) {
            return null;
        }
        try {
            return UserRole.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
