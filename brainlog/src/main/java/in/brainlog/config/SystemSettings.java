package in.brainlog.config;

/**
 * Administrator-editable system settings (single row, id 'system').
 * This row is the source of truth for the lockout threshold and duration.
 */
public record SystemSettings(
    boolean registrationEnabled,
    String siteName,
    String adminEmail,
    int maxFailedLogins,
    int lockoutDurationMinutes
) {
    public static final int MIN_FAILED_LOGINS = 1;
    public static final int MAX_FAILED_LOGINS = 20;
    public static final int MIN_LOCKOUT_MINUTES = 1;
    public static final int MAX_LOCKOUT_MINUTES = 1440;

    public static SystemSettings defaults() {
        return new SystemSettings(true, "Brain Log App", "admin@brainlogapp.com", 5, 15);
    }

    /**
     * Range checks applied before persisting an update.
     *
     * @throws IllegalArgumentException on the first violated constraint
     */
    public void validate() {
        if (siteName == null || siteName.isBlank()) {
            throw new IllegalArgumentException("Site name cannot be empty");
        }
        if (adminEmail == null || !adminEmail.matches("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$")) {
            throw new IllegalArgumentException("Invalid admin email format");
        }
        if (maxFailedLogins < MIN_FAILED_LOGINS || maxFailedLogins > MAX_FAILED_LOGINS) {
            throw new IllegalArgumentException("Max failed logins must be between "
                + MIN_FAILED_LOGINS + " and " + MAX_FAILED_LOGINS);
        }
        if (lockoutDurationMinutes < MIN_LOCKOUT_MINUTES || lockoutDurationMinutes > MAX_LOCKOUT_MINUTES) {
            throw new IllegalArgumentException("Lockout duration must be between "
                + MIN_LOCKOUT_MINUTES + " and " + MAX_LOCKOUT_MINUTES + " minutes");
        }
    }
}
