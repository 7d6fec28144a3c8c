package in.brainlog.metrics;

import java.time.Duration;

/**
 * Auth metrics sink for monitoring and alerting.
 *
 * Key metrics:
 * - Login outcomes (success / failure reason)
 * - Lockouts triggered
 * - Authorization decisions per path class
 * - Audit write failures
 * - Password verification cost
 */
public interface AuthMetrics {

    /**
     * Record a login attempt outcome.
     *
     * @param outcome "success" or the lower-cased failure kind
     */
    void recordLogin(String outcome);

    /**
     * Record an account crossing the failed-login threshold.
     */
    void recordLockout();

    /**
     * Record a perimeter decision.
     *
     * @param pathClass path class name
     * @param decision ALLOW, REDIRECT or DENY
     */
    void recordAuthorization(String pathClass, String decision);

    /**
     * Record an audit event that could not be persisted.
     */
    void recordAuditWriteFailure();

    /**
     * Record time spent deriving a key to check a password.
     */
    void recordPasswordVerify(Duration elapsed);

    /**
     * No-op sink for tests and tools that do not expose metrics.
     */
    AuthMetrics NOOP = new AuthMetrics() {
        @Override public void recordLogin(String outcome) {}
        @Override public void recordLockout() {}
        @Override public void recordAuthorization(String pathClass, String decision) {}
        @Override public void recordAuditWriteFailure() {}
        @Override public void recordPasswordVerify(Duration elapsed) {}
    };
}
