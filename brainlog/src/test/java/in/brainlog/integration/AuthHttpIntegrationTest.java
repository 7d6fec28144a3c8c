package in.brainlog.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.brainlog.auth.Authenticator;
import in.brainlog.auth.PasswordHasher;
import in.brainlog.auth.Principal;
import in.brainlog.auth.SessionCodec;
import in.brainlog.auth.policy.AuthorizationPolicy;
import in.brainlog.auth.policy.RouteTable;
import in.brainlog.bootstrap.App;
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
import in.brainlog.service.admin.RegistrationService;
import in.brainlog.service.admin.UserAdminService;
import in.brainlog.service.audit.AuditTrail;
import in.brainlog.transport.http.AdminHandlers;
import in.brainlog.transport.http.AuthHandlers;
import in.brainlog.transport.http.PerimeterHandler;
import in.brainlog.transport.http.SessionCookies;
import io.undertow.Undertow;
import io.undertow.server.handlers.BlockingHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end flow over HTTP: perimeter, login, session check, admin routes,
 * registration and logout against in-memory stores.
 */
@DisplayName("Auth HTTP Integration Tests")
class AuthHttpIntegrationTest {

    private static final int TEST_PORT = 19180;
    private static final String BASE = "http://localhost:" + TEST_PORT;
    private static final String COOKIE = SessionCookies.COOKIE_NAME;
    private static final String SECRET = "integration-test-secret-0123456789abcdef";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Undertow server;
    private HttpClient httpClient;
    private InMemoryUserDirectory directory;
    private RecordingAuditSink auditSink;
    private SessionCodec codec;

    @BeforeEach
    void setUp() {
        SecurityPolicy policy = SecurityPolicy.defaults().withIterations(1_000);
        Clock clock = Clock.systemUTC();

        directory = new InMemoryUserDirectory();
        auditSink = new RecordingAuditSink();
        PasswordHasher hasher = new PasswordHasher(policy);

        directory.put(user("U000000AD", "admin", UserRole.ADMIN, true, hasher.hash("admin-password")));
        directory.put(user("U00000001", "alice", UserRole.USER, true, hasher.hash("alice-password")));
        directory.put(user("U00000002", "pete", UserRole.PENDING, false, hasher.hash("pete-password")));
        directory.put(user("U00000003", "ian", UserRole.USER, false, hasher.hash("ian-password")));

        SystemSettingsRepository settings = new SystemSettingsRepository() {
            private SystemSettings current = SystemSettings.defaults();

            @Override
            public Optional<SystemSettings> load() {
                return Optional.of(current);
            }

            @Override
            public void save(SystemSettings updated) {
                current = updated;
            }
        };

        AuditTrail audit = new AuditTrail(auditSink, Runnable::run, new SecureAuditLogger("TEST"),
            AuthMetrics.NOOP, clock);
        codec = SessionCodec.fromSecret(SECRET, policy, clock);
        SessionCookies cookies = new SessionCookies(false, policy.sessionMaxAge());

        AuthHandlers authHandlers = new AuthHandlers(
            new Authenticator(directory, hasher, audit, AuthMetrics.NOOP, policy, clock),
            codec, cookies,
            new RegistrationService(directory, settings, hasher, new InputValidator(), audit, clock),
            directory, audit, clock);
        AdminHandlers adminHandlers = new AdminHandlers(new UserAdminService(directory, settings, auditSink, audit, clock));

        PerimeterHandler perimeter = new PerimeterHandler(codec,
            new AuthorizationPolicy(RouteTable.defaults()), cookies, AuthMetrics.NOOP,
            App.routes(authHandlers, adminHandlers));

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(App.withCors(new BlockingHandler(perimeter), "http://localhost:3000"))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    @DisplayName("Login sets an HttpOnly session cookie that passes session-check")
    void testLoginAndSessionCheck() throws Exception {
        HttpResponse<String> login = post("/api/auth/login", "{\"username\":\"alice\",\"password\":\"alice-password\"}", null);

        assertEquals(200, login.statusCode());
        JsonNode body = MAPPER.readTree(login.body());
        assertTrue(body.get("success").asBoolean());
        assertEquals("U00000001", body.at("/user/id").asText());
        assertEquals("USER", body.at("/user/role").asText());

        String setCookie = login.headers().firstValue("Set-Cookie").orElseThrow();
        assertTrue(setCookie.startsWith(COOKIE + "="));
        assertTrue(setCookie.toLowerCase().contains("httponly"));
        assertTrue(setCookie.toLowerCase().contains("samesite=lax"));

        String token = tokenFrom(setCookie);
        HttpResponse<String> check = get("/api/auth/session-check", token);

        assertEquals(200, check.statusCode());
        JsonNode session = MAPPER.readTree(check.body());
        assertEquals("ok", session.get("status").asText());
        assertEquals("U00000001", session.at("/session/user/id").asText());
        assertTrue(session.at("/session/user/active").asBoolean());
        assertTrue(check.headers().firstValue("Cache-Control").orElse("").contains("no-store"));
    }

    @Test
    @DisplayName("Wrong password, unknown user and locked account share one response")
    void testUniformLoginFailures() throws Exception {
        HttpResponse<String> wrong = post("/api/auth/login", "{\"username\":\"alice\",\"password\":\"nope-nope\"}", null);
        HttpResponse<String> unknown = post("/api/auth/login", "{\"username\":\"mallory\",\"password\":\"nope-nope\"}", null);

        directory.put(directory.get("U00000001").withLockout(5, Instant.now().plus(Duration.ofMinutes(10))));
        HttpResponse<String> locked = post("/api/auth/login", "{\"username\":\"alice\",\"password\":\"alice-password\"}", null);

        assertEquals(401, wrong.statusCode());
        assertEquals(401, unknown.statusCode());
        assertEquals(401, locked.statusCode());
        assertEquals(wrong.body(), unknown.body());
        assertEquals(wrong.body(), locked.body());
        assertTrue(wrong.headers().firstValue("Set-Cookie").isEmpty());
    }

    @Test
    @DisplayName("Missing credentials and malformed JSON are bad requests")
    void testBadLoginRequests() throws Exception {
        assertEquals(400, post("/api/auth/login", "{\"username\":\"alice\"}", null).statusCode());
        assertEquals(400, post("/api/auth/login", "not json", null).statusCode());
    }

    @Test
    @DisplayName("Anonymous callers: API gets 401 JSON, pages get redirected to login")
    void testAnonymousPerimeter() throws Exception {
        HttpResponse<String> api = get("/api/admin/users", null);
        assertEquals(401, api.statusCode());
        assertEquals("/login", MAPPER.readTree(api.body()).get("redirect").asText());

        HttpResponse<String> page = get("/admin", null);
        assertEquals(302, page.statusCode());
        assertEquals("/login", page.headers().firstValue("Location").orElse(""));

        assertEquals(401, get("/api/auth/session-check", null).statusCode());
    }

    @Test
    @DisplayName("Regular user is forbidden from admin APIs and bounced from admin pages")
    void testUserCannotReachAdmin() throws Exception {
        String token = login("alice", "alice-password");

        assertEquals(403, get("/api/admin/users", token).statusCode());

        HttpResponse<String> page = get("/admin/users", token);
        assertEquals(302, page.statusCode());
        assertEquals("/", page.headers().firstValue("Location").orElse(""));

        HttpResponse<String> loginPage = get("/login", token);
        assertEquals(302, loginPage.statusCode());
        assertEquals("/", loginPage.headers().firstValue("Location").orElse(""));
    }

    @Test
    @DisplayName("Pending user is steered to the pending page")
    void testPendingUser() throws Exception {
        String token = login("pete", "pete-password");

        HttpResponse<String> api = get("/api/admin/users", token);
        assertEquals(403, api.statusCode());
        assertEquals("/pending", MAPPER.readTree(api.body()).get("redirect").asText());

        HttpResponse<String> page = get("/journal", token);
        assertEquals(302, page.statusCode());
        assertEquals("/pending", page.headers().firstValue("Location").orElse(""));
    }

    @Test
    @DisplayName("Deactivated user is denied protected APIs but keeps auth endpoints")
    void testInactiveUser() throws Exception {
        String token = login("ian", "ian-password");

        assertEquals(403, get("/api/entries", token).statusCode());
        assertEquals(200, get("/api/auth/session-check", token).statusCode());
    }

    @Test
    @DisplayName("Tampered cookie is treated as no cookie and cleared")
    void testTamperedCookie() throws Exception {
        String token = codec.issue(new Principal("U00000001", "alice", "alice", UserRole.USER, true, "UTC"));
        String tampered = token.substring(0, token.length() - 4) + "AAAA";

        HttpResponse<String> anonymous = get("/api/admin/users", null);
        HttpResponse<String> response = get("/api/admin/users", tampered);

        assertEquals(anonymous.statusCode(), response.statusCode());
        assertEquals(anonymous.body(), response.body());
        String cleared = response.headers().firstValue("Set-Cookie").orElseThrow();
        assertTrue(cleared.startsWith(COOKIE + "=;") || cleared.startsWith(COOKIE + "=\"\""), cleared);
        assertTrue(cleared.toLowerCase().contains("max-age=0"));
    }

    @Test
    @DisplayName("Admin lists users and approves a pending account")
    void testAdminApprovesPendingUser() throws Exception {
        String token = login("admin", "admin-password");

        HttpResponse<String> list = get("/api/admin/users", token);
        assertEquals(200, list.statusCode());
        assertEquals(4, MAPPER.readTree(list.body()).get("users").size());

        HttpResponse<String> approve = post("/api/admin/users/U00000002/approve", "", token);
        assertEquals(200, approve.statusCode());
        assertEquals(UserRole.USER, directory.get("U00000002").role());
        assertTrue(directory.get("U00000002").active());

        HttpResponse<String> again = post("/api/admin/users/U00000002/approve", "", token);
        assertEquals(400, again.statusCode());

        assertEquals(404, post("/api/admin/users/U0000FFFF/approve", "", token).statusCode());
        assertEquals(400, post("/api/admin/users/U000000AD/deactivate", "", token).statusCode());
    }

    @Test
    @DisplayName("Admin lock and settings update")
    void testAdminLockAndSettings() throws Exception {
        String token = login("admin", "admin-password");

        HttpResponse<String> lock = post("/api/admin/users/U00000001/lock", "{\"minutes\":30}", token);
        assertEquals(200, lock.statusCode());
        assertTrue(directory.get("U00000001").isLockedAt(Instant.now()));
        assertEquals(400, post("/api/admin/users/U00000001/lock", "{\"minutes\":0}", token).statusCode());

        assertEquals(200, post("/api/admin/users/U00000001/unlock", "", token).statusCode());
        assertNull(directory.get("U00000001").lockedUntil());

        HttpResponse<String> update = send(HttpRequest.newBuilder(URI.create(BASE + "/api/admin/settings"))
            .header("Cookie", COOKIE + "=" + token)
            .header("Content-Type", "application/json")
            .PUT(HttpRequest.BodyPublishers.ofString("{\"registrationEnabled\":false}")));
        assertEquals(200, update.statusCode());
        assertFalse(MAPPER.readTree(update.body()).get("appliesOnRestart").asBoolean());

        HttpResponse<String> lockoutUpdate = send(HttpRequest.newBuilder(URI.create(BASE + "/api/admin/settings"))
            .header("Cookie", COOKIE + "=" + token)
            .header("Content-Type", "application/json")
            .PUT(HttpRequest.BodyPublishers.ofString("{\"maxFailedLogins\":5,\"lockoutDurationMinutes\":30}")));
        assertEquals(200, lockoutUpdate.statusCode());
        assertTrue(MAPPER.readTree(lockoutUpdate.body()).get("appliesOnRestart").asBoolean());

        JsonNode settings = MAPPER.readTree(get("/api/admin/settings", token).body()).get("settings");
        assertFalse(settings.get("registrationEnabled").asBoolean());
        assertEquals(5, settings.get("maxFailedLogins").asInt(), "Missing fields keep current values");

        HttpResponse<String> register = post("/api/auth/register",
            "{\"username\":\"newbie\",\"email\":\"newbie@example.com\",\"password\":\"password123\",\"displayName\":\"Newbie\"}",
            null);
        assertEquals(403, register.statusCode());
    }

    @Test
    @DisplayName("Admin reads the audit log with filters and a capped page size")
    void testAdminAuditLog() throws Exception {
        post("/api/auth/login", "{\"username\":\"alice\",\"password\":\"wrong-password\"}", null);
        for (int i = 0; i < 110; i++) {
            auditSink.record(new AuditEvent(Instant.now(), "U00000003", AuditAction.LOGOUT,
                AuditEvent.RESOURCE_AUTH, "192.0.2.1", "seed", null));
        }
        String token = login("admin", "admin-password");

        HttpResponse<String> capped = get("/api/admin/audit?limit=500", token);
        assertEquals(200, capped.statusCode());
        JsonNode body = MAPPER.readTree(capped.body());
        assertEquals(100, body.get("logs").size());
        assertEquals(100, body.get("limit").asInt());
        assertEquals("LOGIN_SUCCESS", body.at("/logs/0/action").asText(), "Newest first");

        JsonNode failed = MAPPER.readTree(get("/api/admin/audit?action=LOGIN_FAILED&userId=U00000001", token).body());
        assertEquals(1, failed.get("logs").size());
        assertEquals("invalid_password", failed.at("/logs/0/details/reason").asText());
        assertFalse(failed.at("/logs/0/ipAddress").asText().isEmpty());

        JsonNode paged = MAPPER.readTree(get("/api/admin/audit?resource=AUTH&limit=10&offset=105", token).body());
        assertEquals(7, paged.get("logs").size());

        assertEquals(400, get("/api/admin/audit?limit=abc", token).statusCode());
        assertEquals(400, get("/api/admin/audit?offset=-1", token).statusCode());
    }

    @Test
    @DisplayName("Audit log is admin-only")
    void testAuditLogForbiddenToUsers() throws Exception {
        assertEquals(401, get("/api/admin/audit", null).statusCode());
        assertEquals(403, get("/api/admin/audit", login("alice", "alice-password")).statusCode());
    }

    @Test
    @DisplayName("Forged X-Forwarded-For does not reach the audit log")
    void testForgedForwardedForIgnored() throws Exception {
        send(HttpRequest.newBuilder(URI.create(BASE + "/api/auth/login"))
            .header("Content-Type", "application/json")
            .header("X-Forwarded-For", "198.51.100.99")
            .POST(HttpRequest.BodyPublishers.ofString("{\"username\":\"alice\",\"password\":\"nope-nope\"}")));

        AuditEvent event = auditSink.events(AuditAction.LOGIN_FAILED).get(0);
        assertNotNull(event.ipAddress());
        assertNotEquals("198.51.100.99", event.ipAddress());
    }

    @Test
    @DisplayName("Registration creates a pending account")
    void testRegistration() throws Exception {
        HttpResponse<String> response = post("/api/auth/register",
            "{\"username\":\"newbie\",\"email\":\"newbie@example.com\",\"password\":\"password123\","
                + "\"displayName\":\"Newbie\",\"timezone\":\"Europe/Paris\"}",
            null);

        assertEquals(200, response.statusCode());
        String userId = MAPPER.readTree(response.body()).get("userId").asText();
        UserRecord created = directory.get(userId);
        assertEquals(UserRole.PENDING, created.role());
        assertFalse(created.active());

        HttpResponse<String> duplicate = post("/api/auth/register",
            "{\"username\":\"newbie\",\"email\":\"other@example.com\",\"password\":\"password123\",\"displayName\":\"N\"}",
            null);
        assertEquals(409, duplicate.statusCode());

        HttpResponse<String> invalid = post("/api/auth/register",
            "{\"username\":\"x\",\"email\":\"x@example.com\",\"password\":\"password123\",\"displayName\":\"X\"}",
            null);
        assertEquals(400, invalid.statusCode());
    }

    @Test
    @DisplayName("Logout clears the cookie and is audited")
    void testLogout() throws Exception {
        String token = login("alice", "alice-password");

        HttpResponse<String> logout = post("/api/auth/logout", "", token);

        assertEquals(200, logout.statusCode());
        assertTrue(logout.headers().firstValue("Set-Cookie").orElse("").toLowerCase().contains("max-age=0"));
        assertEquals(1, auditSink.events(AuditAction.LOGOUT).size());
        assertEquals("U00000001", auditSink.events(AuditAction.LOGOUT).get(0).userId());
    }

    @Test
    @DisplayName("CORS preflight is answered without authentication")
    void testPreflight() throws Exception {
        HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(BASE + "/api/admin/users"))
            .method("OPTIONS", HttpRequest.BodyPublishers.noBody()));

        assertEquals(200, response.statusCode());
        assertEquals("http://localhost:3000",
            response.headers().firstValue("Access-Control-Allow-Origin").orElse(""));
        assertEquals("true", response.headers().firstValue("Access-Control-Allow-Credentials").orElse(""));
    }

    private String login(String username, String password) throws Exception {
        HttpResponse<String> response = post("/api/auth/login",
            "{\"username\":\"" + username + "\",\"password\":\"" + password + "\"}", null);
        assertEquals(200, response.statusCode(), response.body());
        return tokenFrom(response.headers().firstValue("Set-Cookie").orElseThrow());
    }

    private HttpResponse<String> get(String path, String token) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(BASE + path)).GET();
        if (token != null) {
            builder.header("Cookie", COOKIE + "=" + token);
        }
        return send(builder);
    }

    private HttpResponse<String> post(String path, String body, String token) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(BASE + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body));
        if (token != null) {
            builder.header("Cookie", COOKIE + "=" + token);
        }
        return send(builder);
    }

    private HttpResponse<String> send(HttpRequest.Builder builder) throws Exception {
        return httpClient.send(builder.timeout(Duration.ofSeconds(10)).build(), HttpResponse.BodyHandlers.ofString());
    }

    private static String tokenFrom(String setCookie) {
        String pair = setCookie.split(";", 2)[0];
        return pair.substring(pair.indexOf('=') + 1);
    }

    private static UserRecord user(String id, String username, UserRole role, boolean active, String hash) {
        return new UserRecord(id, username, username + "@example.com", username, "UTC", hash,
            role, active, 0, null, null, Instant.now());
    }
}
