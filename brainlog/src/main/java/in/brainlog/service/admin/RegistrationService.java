package in.brainlog.service.admin;

import in.brainlog.auth.PasswordHasher;
import in.brainlog.auth.RequestMeta;
import in.brainlog.config.SystemSettings;
import in.brainlog.domain.audit.AuditAction;
import in.brainlog.domain.audit.AuditEvent;
import in.brainlog.domain.user.UserRecord;
import in.brainlog.domain.user.UserRole;
import in.brainlog.repository.SystemSettingsRepository;
import in.brainlog.repository.UserDirectory;
import in.brainlog.security.InputValidator;
import in.brainlog.service.audit.AuditTrail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Self-service registration. New accounts start PENDING and inactive until an
 * administrator approves them.
 */
public final class RegistrationService {
    private static final Logger log = LoggerFactory.getLogger(RegistrationService.class);

    private final UserDirectory directory;
    private final SystemSettingsRepository settings;
    private final PasswordHasher hasher;
    private final InputValidator validator;
    private final AuditTrail audit;
    private final Clock clock;

    public RegistrationService(UserDirectory directory, SystemSettingsRepository settings,
                               PasswordHasher hasher, InputValidator validator,
                               AuditTrail audit, Clock clock) {
        this.directory = directory;
        this.settings = settings;
        this.hasher = hasher;
        this.validator = validator;
        this.audit = audit;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException on invalid input
     * @throws AccountAdminException when registration is disabled or the username/email is taken
     */
    public UserRecord register(RegistrationRequest request, RequestMeta meta) {
        if (request == null || isBlank(request.username()) || isBlank(request.email())
                || isBlank(request.password()) || isBlank(request.displayName())) {
            throw new IllegalArgumentException("Username, email, password, and display name are required");
        }

        String username = request.username().trim();
        String email = request.email().trim();
        validator.validateEmail(email);
        validator.validateUsername(username);
        validator.validatePassword(request.password());
        String displayName = validator.validateDisplayName(request.displayName());
        String timezone = validator.validateTimezone(request.timezone());

        SystemSettings current = settings.load().orElse(SystemSettings.defaults());
        if (!current.registrationEnabled()) {
            throw new AccountAdminException(AccountAdminException.Reason.REGISTRATION_DISABLED,
                "Registration is currently disabled");
        }

        if (directory.existsByUsername(username)) {
            throw new AccountAdminException(AccountAdminException.Reason.CONFLICT, "Username already exists");
        }
        if (directory.existsByEmail(email)) {
            throw new AccountAdminException(AccountAdminException.Reason.CONFLICT, "Email address already registered");
        }

        String userId = "U" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
        UserRecord user = new UserRecord(userId, username, email, displayName, timezone,
            hasher.hash(request.password()), UserRole.PENDING, false, 0, null, null, clock.instant());

        directory.create(user);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("username", username);
        details.put("displayName", displayName);
        details.put("timezone", user.timezone());
        audit.record(AuditAction.USER_REGISTERED, userId, AuditEvent.RESOURCE_USER_MANAGEMENT, meta, details);

        log.info("[REGISTRATION] User registered, pending approval: {} ({})", username, userId);
        return user;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
