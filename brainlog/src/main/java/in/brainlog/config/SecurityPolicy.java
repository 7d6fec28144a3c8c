package in.brainlog.config;

import in.brainlog.util.Env;

import java.time.Duration;

/**
 * Immutable security parameters handed to the hasher, authenticator and session codec
 * at construction time. Nothing in the auth core reads configuration at call time.
 */
public record SecurityPolicy(
    int pbkdf2Iterations,
    int saltBytes,
    int maxFailedLogins,
    Duration lockoutDuration,
    Duration sessionMaxAge,
    Duration sessionRefreshWindow,
    boolean secureCookies
) {
    public static final int DEFAULT_ITERATIONS = 100_000;
    public static final int DEFAULT_SALT_BYTES = 32;
    public static final int MIN_SALT_BYTES = 16;
    public static final int DEFAULT_MAX_FAILED_LOGINS = 5;
    public static final Duration DEFAULT_LOCKOUT = Duration.ofMinutes(15);
    public static final Duration DEFAULT_SESSION_MAX_AGE = Duration.ofDays(30);
    public static final Duration DEFAULT_REFRESH_WINDOW = Duration.ofHours(24);

    public SecurityPolicy {
        if (pbkdf2Iterations < 1) {
            throw new IllegalArgumentException("pbkdf2Iterations must be positive");
        }
        if (saltBytes < MIN_SALT_BYTES) {
            throw new IllegalArgumentException("saltBytes must be at least " + MIN_SALT_BYTES);
        }
        if (maxFailedLogins < 1) {
            throw new IllegalArgumentException("maxFailedLogins must be positive");
        }
        if (lockoutDuration == null || lockoutDuration.isNegative() || lockoutDuration.isZero()) {
            throw new IllegalArgumentException("lockoutDuration must be positive");
        }
        if (sessionMaxAge == null || sessionMaxAge.isNegative() || sessionMaxAge.isZero()) {
            throw new IllegalArgumentException("sessionMaxAge must be positive");
        }
        if (sessionRefreshWindow == null || sessionRefreshWindow.compareTo(sessionMaxAge) > 0) {
            throw new IllegalArgumentException("sessionRefreshWindow must not exceed sessionMaxAge");
        }
    }

    public static SecurityPolicy defaults() {
        return new SecurityPolicy(DEFAULT_ITERATIONS, DEFAULT_SALT_BYTES, DEFAULT_MAX_FAILED_LOGINS,
            DEFAULT_LOCKOUT, DEFAULT_SESSION_MAX_AGE, DEFAULT_REFRESH_WINDOW, false);
    }

    /**
     * Process-level parameters from the environment. Lockout values keep their defaults
     * here; {@link #withSettings(SystemSettings)} overrides them from the settings row.
     */
    public static SecurityPolicy fromEnv() {
        return new SecurityPolicy(
            Env.getInt("PBKDF2_ITERATIONS", DEFAULT_ITERATIONS),
            DEFAULT_SALT_BYTES,
            DEFAULT_MAX_FAILED_LOGINS,
            DEFAULT_LOCKOUT,
            Env.getDays("SESSION_MAX_AGE_DAYS", DEFAULT_SESSION_MAX_AGE),
            Env.getHours("SESSION_REFRESH_HOURS", DEFAULT_REFRESH_WINDOW),
            Env.getBool("PRODUCTION_MODE", false)
        );
    }

    public SecurityPolicy withSettings(SystemSettings settings) {
        if (settings == null) {
            return this;
        }
        return new SecurityPolicy(pbkdf2Iterations, saltBytes, settings.maxFailedLogins(),
            Duration.ofMinutes(settings.lockoutDurationMinutes()), sessionMaxAge,
            sessionRefreshWindow, secureCookies);
    }

    public SecurityPolicy withIterations(int iterations) {
        return new SecurityPolicy(iterations, saltBytes, maxFailedLogins, lockoutDuration,
            sessionMaxAge, sessionRefreshWindow, secureCookies);
    }
}
