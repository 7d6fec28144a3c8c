package in.brainlog.service.admin;

import in.brainlog.auth.PasswordHasher;
import in.brainlog.auth.RequestMeta;
import in.brainlog.config.SecurityPolicy;
import in.brainlog.config.SystemSettings;
import in.brainlog.domain.audit.AuditAction;
import in.brainlog.domain.audit.AuditEvent;
import in.brainlog.domain.user.UserRecord;
import in.brainlog.domain.user.UserRole;
import in.brainlog.metrics.AuthMetrics;
import in.brainlog.repository.InMemoryUserDirectory;
import in.brainlog.repository.RecordingAuditSink;
import in.brainlog.repository.SystemSettingsRepository;
import in.brainlog.security.InputValidator;
import in.brainlog.security.SecureAuditLogger;
import in.brainlog.service.audit.AuditTrail;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RegistrationServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private SystemSettingsRepository settingsRepo;

    private InMemoryUserDirectory directory;
    private RecordingAuditSink auditSink;
    private PasswordHasher hasher;
    private RegistrationService service;
    private final RequestMeta meta = new RequestMeta("10.0.0.1", "JUnit");

    @BeforeEach
    void setUp() {
        directory = new InMemoryUserDirectory();
        auditSink = new RecordingAuditSink();
        hasher = new PasswordHasher(SecurityPolicy.defaults().withIterations(1_000));
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        AuditTrail audit = new AuditTrail(auditSink, Runnable::run, new SecureAuditLogger("TEST"),
            AuthMetrics.NOOP, clock);
        service = new RegistrationService(directory, settingsRepo, hasher, new InputValidator(), audit, clock);
    }

    @Test
    void register_createsPendingInactiveUser() {
        when(settingsRepo.load()).thenReturn(Optional.of(SystemSettings.defaults()));

        UserRecord user = service.register(
            new RegistrationRequest(" alice ", "alice@example.com", "password123", "Alice", "Europe/Berlin"), meta);

        assertTrue(user.userId().matches("^U[0-9A-F]{8}$"), user.userId());
        assertEquals("alice", user.username());
        assertEquals(UserRole.PENDING, user.role());
        assertFalse(user.active());
        assertEquals("Europe/Berlin", user.timezone());
        assertEquals(NOW, user.createdAt());
        assertTrue(hasher.verify("password123", user.passwordHash()));
        assertFalse(user.passwordHash().contains("password123"));
        assertSame(user, directory.get(user.userId()));

        AuditEvent event = auditSink.last();
        assertEquals(AuditAction.USER_REGISTERED, event.action());
        assertEquals(user.userId(), event.userId());
        assertFalse(event.details().containsKey("password"));
    }

    @Test
    void register_defaultTimezone() {
        when(settingsRepo.load()).thenReturn(Optional.empty());

        UserRecord user = service.register(
            new RegistrationRequest("bob", "bob@example.com", "password123", "Bob", null), meta);

        assertEquals(UserRecord.DEFAULT_TIMEZONE, user.timezone());
    }

    @Test
    void register_missingFields() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> service.register(
            new RegistrationRequest("bob", "", "password123", "Bob", null), meta));

        assertEquals("Username, email, password, and display name are required", e.getMessage());
        verifyNoInteractions(settingsRepo);
    }

    @Test
    void register_invalidInput() {
        assertThrows(IllegalArgumentException.class, () -> service.register(
            new RegistrationRequest("bob", "not-an-email", "password123", "Bob", null), meta));
        assertThrows(IllegalArgumentException.class, () -> service.register(
            new RegistrationRequest("bob", "bob@example.com", "short", "Bob", null), meta));
        assertThrows(IllegalArgumentException.class, () -> service.register(
            new RegistrationRequest("b b", "bob@example.com", "password123", "Bob", null), meta));
        assertThrows(IllegalArgumentException.class, () -> service.register(
            new RegistrationRequest("bob", "bob@example.com", "password123", "Bob", "Nowhere/City"), meta));
        assertTrue(directory.findAll().isEmpty());
    }

    @Test
    void register_disabled() {
        when(settingsRepo.load()).thenReturn(Optional.of(
            new SystemSettings(false, "Brain Log App", "admin@brainlogapp.com", 5, 15)));

        AccountAdminException e = assertThrows(AccountAdminException.class, () -> service.register(
            new RegistrationRequest("bob", "bob@example.com", "password123", "Bob", null), meta));

        assertEquals(AccountAdminException.Reason.REGISTRATION_DISABLED, e.getReason());
        assertTrue(directory.findAll().isEmpty());
    }

    @Test
    void register_duplicateUsernameOrEmail() {
        when(settingsRepo.load()).thenReturn(Optional.of(SystemSettings.defaults()));
        service.register(new RegistrationRequest("bob", "bob@example.com", "password123", "Bob", null), meta);

        AccountAdminException byName = assertThrows(AccountAdminException.class, () -> service.register(
            new RegistrationRequest("bob", "other@example.com", "password123", "Bob", null), meta));
        AccountAdminException byEmail = assertThrows(AccountAdminException.class, () -> service.register(
            new RegistrationRequest("bobby", "bob@example.com", "password123", "Bob", null), meta));

        assertEquals(AccountAdminException.Reason.CONFLICT, byName.getReason());
        assertEquals("Username already exists", byName.getMessage());
        assertEquals(AccountAdminException.Reason.CONFLICT, byEmail.getReason());
        assertEquals("Email address already registered", byEmail.getMessage());
        assertEquals(1, directory.findAll().size());
    }

    @Test
    void registrationRequest_hidesPassword() {
        RegistrationRequest request = new RegistrationRequest("bob", "bob@example.com", "password123", "Bob", null);

        assertFalse(request.toString().contains("password123"));
    }
}
