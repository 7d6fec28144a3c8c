package in.brainlog.service.admin;

import in.brainlog.auth.RequestMeta;
import in.brainlog.config.SystemSettings;
import in.brainlog.domain.audit.AuditAction;
import in.brainlog.domain.audit.AuditEvent;
import in.brainlog.domain.audit.AuditLogEntry;
import in.brainlog.domain.audit.AuditLogQuery;
import in.brainlog.domain.user.UserRecord;
import in.brainlog.domain.user.UserRole;
import in.brainlog.repository.AuditLogRepository;
import in.brainlog.repository.SystemSettingsRepository;
import in.brainlog.repository.UserDirectory;
import in.brainlog.service.audit.AuditTrail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Administrator operations on accounts, system settings and the audit log.
 *
 * Role and active-flag changes reach an already issued session only when it is
 * refreshed or expires.
 */
public final class UserAdminService {
    private static final Logger log = LoggerFactory.getLogger(UserAdminService.class);

    public static final int MIN_LOCK_MINUTES = SystemSettings.MIN_LOCKOUT_MINUTES;
    public static final int MAX_LOCK_MINUTES = SystemSettings.MAX_LOCKOUT_MINUTES;

    private final UserDirectory directory;
    private final SystemSettingsRepository settings;
    private final AuditLogRepository auditLog;
    private final AuditTrail audit;
    private final Clock clock;

    public UserAdminService(UserDirectory directory, SystemSettingsRepository settings,
                            AuditLogRepository auditLog, AuditTrail audit, Clock clock) {
        this.directory = directory;
        this.settings = settings;
        this.auditLog = auditLog;
        this.audit = audit;
        this.clock = clock;
    }

    public List<UserRecord> listUsers() {
        return directory.findAll();
    }

    /**
     * PENDING -> USER, activated.
     */
    public UserRecord approve(String actorId, String targetId, RequestMeta meta) {
        UserRecord user = require(targetId);
        if (!user.isPending()) {
            throw invalidState("User is not pending approval");
        }

        UserRecord updated = applyStatus(user, UserRole.USER, true);

        audit.record(AuditAction.USER_APPROVED, actorId, AuditEvent.RESOURCE_USER_MANAGEMENT, meta,
            targetDetails(user, "previousRole", UserRole.PENDING.name(), "newRole", UserRole.USER.name()));
        log.info("[ADMIN] {} approved user {}", actorId, targetId);
        return updated;
    }

    public UserRecord deactivate(String actorId, String targetId, RequestMeta meta) {
        if (targetId.equals(actorId)) {
            throw new AccountAdminException(AccountAdminException.Reason.SELF_ACTION,
                "Cannot deactivate your own account");
        }

        UserRecord user = require(targetId);
        if (!user.active()) {
            throw invalidState("User is already deactivated");
        }

        UserRecord updated = applyStatus(user, user.role(), false);

        audit.record(AuditAction.USER_DEACTIVATED, actorId, AuditEvent.RESOURCE_USER_MANAGEMENT, meta,
            targetDetails(user, "targetRole", user.role().name()));
        log.info("[ADMIN] {} deactivated user {}", actorId, targetId);
        return updated;
    }

    /**
     * Active USER -> ADMIN.
     */
    public UserRecord promote(String actorId, String targetId, RequestMeta meta) {
        UserRecord user = require(targetId);
        if (!user.active()) {
            throw invalidState("Cannot promote inactive user");
        }
        if (user.role() != UserRole.USER) {
            throw invalidState("Only regular users can be promoted to admin");
        }

        UserRecord updated = applyStatus(user, UserRole.ADMIN, true);

        audit.record(AuditAction.USER_PROMOTED, actorId, AuditEvent.RESOURCE_USER_MANAGEMENT, meta,
            targetDetails(user, "previousRole", UserRole.USER.name(), "newRole", UserRole.ADMIN.name()));
        log.info("[ADMIN] {} promoted user {} to admin", actorId, targetId);
        return updated;
    }

    /**
     * Clear the lock and the failed-attempt counter.
     */
    public void unlock(String actorId, String targetId, RequestMeta meta) {
        UserRecord user = require(targetId);

        directory.clearLockout(targetId);
        directory.resetFailedLogins(targetId);

        audit.record(AuditAction.ACCOUNT_UNLOCKED, actorId, AuditEvent.RESOURCE_USER_MANAGEMENT, meta,
            targetDetails(user, "previousAttempts", user.failedLoginAttempts()));
        log.info("[ADMIN] {} unlocked user {}", actorId, targetId);
    }

    /**
     * @return the instant the lock expires
     */
    public Instant lock(String actorId, String targetId, int minutes, RequestMeta meta) {
        if (minutes < MIN_LOCK_MINUTES || minutes > MAX_LOCK_MINUTES) {
            throw new IllegalArgumentException("Lock duration must be between "
                + MIN_LOCK_MINUTES + " and " + MAX_LOCK_MINUTES + " minutes");
        }
        if (targetId.equals(actorId)) {
            throw new AccountAdminException(AccountAdminException.Reason.SELF_ACTION,
                "Cannot lock your own account");
        }

        UserRecord user = require(targetId);
        Instant until = clock.instant().plusSeconds(minutes * 60L);
        directory.setLockout(targetId, until);

        audit.record(AuditAction.ACCOUNT_LOCKED, actorId, AuditEvent.RESOURCE_USER_MANAGEMENT, meta,
            targetDetails(user, "reason", "admin_lock", "lockedUntil", until.toString()));
        log.info("[ADMIN] {} locked user {} until {}", actorId, targetId, until);
        return until;
    }

    public List<AuditLogEntry> listAuditLogs(AuditLogQuery query) {
        return auditLog.find(query != null ? query : AuditLogQuery.firstPage());
    }

    public SystemSettings getSettings() {
        return settings.load().orElse(SystemSettings.defaults());
    }

    /**
     * Persist new settings. Lockout values take effect on the next restart.
     *
     * @throws IllegalArgumentException when a value is out of range
     */
    public SystemSettings updateSettings(String actorId, SystemSettings updated, RequestMeta meta) {
        updated.validate();
        SystemSettings previous = getSettings();

        settings.save(updated);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("registrationEnabled", updated.registrationEnabled());
        details.put("maxFailedLogins", updated.maxFailedLogins());
        details.put("lockoutDurationMinutes", updated.lockoutDurationMinutes());
        details.put("previousMaxFailedLogins", previous.maxFailedLogins());
        details.put("previousLockoutDurationMinutes", previous.lockoutDurationMinutes());
        audit.record(AuditAction.SETTINGS_UPDATED, actorId, AuditEvent.RESOURCE_SYSTEM, meta, details);
        log.info("[ADMIN] {} updated system settings", actorId);
        return updated;
    }

    private UserRecord require(String userId) {
        return directory.findById(userId)
            .orElseThrow(() -> new AccountAdminException(AccountAdminException.Reason.NOT_FOUND, "User not found"));
    }

    private UserRecord applyStatus(UserRecord user, UserRole role, boolean active) {
        if (!directory.updateRoleAndStatus(user.userId(), role, active)) {
            throw new AccountAdminException(AccountAdminException.Reason.NOT_FOUND, "User not found");
        }
        return user.withStatus(role, active);
    }

    private static AccountAdminException invalidState(String message) {
        return new AccountAdminException(AccountAdminException.Reason.INVALID_STATE, message);
    }

    private static Map<String, Object> targetDetails(UserRecord target, Object... extra) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("targetUserId", target.userId());
        details.put("targetUsername", target.username());
        details.put("targetDisplayName", target.displayName());
        for (int i = 0; i + 1 < extra.length; i += 2) {
            details.put((String) extra[i], extra[i + 1]);
        }
        return details;
    }
}
