package in.brainlog.auth;

import in.brainlog.config.SecurityPolicy;
import in.brainlog.domain.audit.AuditAction;
import in.brainlog.domain.audit.AuditEvent;
import in.brainlog.domain.user.UserRecord;
import in.brainlog.metrics.AuthMetrics;
import in.brainlog.repository.UserDirectory;
import in.brainlog.repository.UserDirectoryException;
import in.brainlog.service.audit.AuditTrail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Credential check with failed-login tracking and automatic lockout.
 *
 * Only the initial directory lookup can turn into {@link AuthFailure#UNAVAILABLE}.
 * Counter updates, lockout bookkeeping and audit emission after that point are
 * attempted independently and never change the result returned to the caller.
 *
 * Deactivated accounts authenticate normally; the authorization policy denies them.
 */
public final class Authenticator {
    private static final Logger log = LoggerFactory.getLogger(Authenticator.class);

    private final UserDirectory directory;
    private final PasswordHasher hasher;
    private final AuditTrail audit;
    private final AuthMetrics metrics;
    private final int maxFailedLogins;
    private final Duration lockoutDuration;
    private final Clock clock;

    public Authenticator(UserDirectory directory, PasswordHasher hasher, AuditTrail audit,
                         AuthMetrics metrics, SecurityPolicy policy, Clock clock) {
        this.directory = directory;
        this.hasher = hasher;
        this.audit = audit;
        this.metrics = metrics;
        this.maxFailedLogins = policy.maxFailedLogins();
        this.lockoutDuration = policy.lockoutDuration();
        this.clock = clock;
    }

    public AuthResult authenticate(String username, String password, RequestMeta meta) {
        if (username == null || username.isBlank() || password == null || password.isEmpty()) {
            return fail(AuthFailure.MISSING_CREDENTIALS);
        }

        Optional<UserRecord> found;
        try {
            found = directory.findByUsername(username);
        } catch (UserDirectoryException e) {
            log.error("[AUTH] User lookup failed: {}", e.getMessage());
            return fail(AuthFailure.UNAVAILABLE);
        }

        if (found.isEmpty()) {
            // Same derivation cost as a wrong password
            hasher.verify(password, null);
            audit.record(AuditAction.LOGIN_FAILED, null, AuditEvent.RESOURCE_AUTH, meta,
                details("reason", "user_not_found", "username", username));
            log.info("[AUTH] Login failed: unknown user");
            return fail(AuthFailure.INVALID_CREDENTIALS);
        }

        UserRecord user = found.get();
        Instant now = clock.instant();

        if (user.isLockedAt(now)) {
            audit.record(AuditAction.LOGIN_FAILED, user.userId(), AuditEvent.RESOURCE_AUTH, meta,
                details("reason", "account_locked", "lockedUntil", user.lockedUntil().toString()));
            log.info("[AUTH] Login rejected for locked account {}", user.userId());
            return fail(AuthFailure.ACCOUNT_LOCKED);
        }

        long started = System.nanoTime();
        boolean valid = hasher.verify(password, user.passwordHash());
        metrics.recordPasswordVerify(Duration.ofNanos(System.nanoTime() - started));

        if (!valid) {
            return onWrongPassword(user, now, meta);
        }

        return onSuccess(user, now, meta);
    }

    private AuthResult onWrongPassword(UserRecord user, Instant now, RequestMeta meta) {
        Instant lockUntil = now.plus(lockoutDuration);

        OptionalInt newCount;
        try {
            newCount = directory.incrementFailedLogins(user.userId(), maxFailedLogins, lockUntil, now);
        } catch (UserDirectoryException e) {
            log.error("[AUTH] Failed to record failed login for {}: {}", user.userId(), e.getMessage());
            audit.record(AuditAction.LOGIN_FAILED, user.userId(), AuditEvent.RESOURCE_AUTH, meta,
                details("reason", "invalid_password"));
            return fail(AuthFailure.INVALID_CREDENTIALS);
        }

        if (newCount.isEmpty()) {
            // Another request locked the account between our read and the update
            audit.record(AuditAction.LOGIN_FAILED, user.userId(), AuditEvent.RESOURCE_AUTH, meta,
                details("reason", "account_locked"));
            return fail(AuthFailure.ACCOUNT_LOCKED);
        }

        int attempts = newCount.getAsInt();
        if (attempts >= maxFailedLogins) {
            metrics.recordLockout();
            audit.record(AuditAction.ACCOUNT_LOCKED, user.userId(), AuditEvent.RESOURCE_AUTH, meta,
                details("reason", "max_failed_attempts", "failedAttempts", attempts,
                    "lockedUntil", lockUntil.toString()));
            log.warn("[AUTH] Account {} locked until {} after {} failed attempts",
                user.userId(), lockUntil, attempts);
        } else {
            audit.record(AuditAction.LOGIN_FAILED, user.userId(), AuditEvent.RESOURCE_AUTH, meta,
                details("reason", "invalid_password", "failedAttempts", attempts));
            log.info("[AUTH] Invalid password for {} ({}/{})", user.userId(), attempts, maxFailedLogins);
        }

        return fail(AuthFailure.INVALID_CREDENTIALS);
    }

    private AuthResult onSuccess(UserRecord user, Instant now, RequestMeta meta) {
        String userId = user.userId();

        try {
            directory.resetFailedLogins(userId);
        } catch (UserDirectoryException e) {
            log.error("[AUTH] Failed to reset failed logins for {}: {}", userId, e.getMessage());
        }
        try {
            directory.clearLockout(userId);
        } catch (UserDirectoryException e) {
            log.error("[AUTH] Failed to clear lockout for {}: {}", userId, e.getMessage());
        }
        try {
            directory.updateLastLogin(userId, now);
        } catch (UserDirectoryException e) {
            log.error("[AUTH] Failed to update last login for {}: {}", userId, e.getMessage());
        }

        audit.record(AuditAction.LOGIN_SUCCESS, userId, AuditEvent.RESOURCE_AUTH, meta,
            details("username", user.username(), "role", user.role().name()));
        metrics.recordLogin("success");
        log.info("[AUTH] User logged in: {} role={} active={}", userId, user.role(), user.active());

        return AuthResult.success(Principal.of(user));
    }

    private AuthResult fail(AuthFailure failure) {
        metrics.recordLogin(failure.name().toLowerCase());
        return AuthResult.failure(failure);
    }

    private static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
