package in.brainlog.bootstrap;

import in.brainlog.auth.SessionCodec;
import in.brainlog.config.SecurityPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Startup configuration validator.
 *
 * Runs before anything listens on a port. Throws IllegalStateException if the
 * configuration is unsafe; the system refuses to start.
 *
 * Production mode is a hard gate:
 * - the session secret must not be the development default
 * - the PBKDF2 work factor must not be below the default
 * - session cookies must be marked Secure
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    public static final String DEVELOPMENT_SECRET = "brainlog-development-session-secret-change-me";

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(boolean productionMode, String sessionSecret, SecurityPolicy policy) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("Production mode: {}", productionMode);

        if (sessionSecret == null
                || sessionSecret.getBytes(StandardCharsets.UTF_8).length < SessionCodec.MIN_KEY_BYTES) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: SESSION_SECRET must be at least " + SessionCodec.MIN_KEY_BYTES + " bytes\n" +
                "System refuses to start."
            );
        }

        if (productionMode) {
            validateProductionMode(sessionSecret, policy);
        } else {
            warnNonProductionMode(sessionSecret, policy);
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void validateProductionMode(String sessionSecret, SecurityPolicy policy) {
        log.info("PRODUCTION MODE detected - enforcing strict validation");

        if (DEVELOPMENT_SECRET.equals(sessionSecret)) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: PRODUCTION MODE requires a real SESSION_SECRET\n" +
                "The development default is public. System refuses to start.\n" +
                "Either:\n" +
                "  1. Set SESSION_SECRET to a random value of at least 32 bytes\n" +
                "  2. Set PRODUCTION_MODE=false for local development"
            );
        }
        log.info("✓ Session secret configured");

        if (policy.pbkdf2Iterations() < SecurityPolicy.DEFAULT_ITERATIONS) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: PBKDF2_ITERATIONS=" + policy.pbkdf2Iterations() +
                " is below the minimum " + SecurityPolicy.DEFAULT_ITERATIONS + " for production"
            );
        }
        log.info("✓ PBKDF2 iterations: {}", policy.pbkdf2Iterations());

        if (!policy.secureCookies()) {
            throw new IllegalStateException("❌ INVALID CONFIG: PRODUCTION MODE requires Secure session cookies");
        }
        log.info("✓ Secure session cookies");
    }

    private static void warnNonProductionMode(String sessionSecret, SecurityPolicy policy) {
        log.warn("⚠️  NON-PRODUCTION MODE detected");

        if (DEVELOPMENT_SECRET.equals(sessionSecret)) {
            log.warn("⚠️  Using the development session secret - tokens are forgeable");
        }
        if (policy.pbkdf2Iterations() < SecurityPolicy.DEFAULT_ITERATIONS) {
            log.warn("⚠️  PBKDF2 iterations lowered to {}", policy.pbkdf2Iterations());
        }
        if (!policy.secureCookies()) {
            log.warn("⚠️  Session cookies sent without Secure flag");
        }
    }

    private StartupConfigValidator() {
        // Utility class - no instantiation
    }
}
