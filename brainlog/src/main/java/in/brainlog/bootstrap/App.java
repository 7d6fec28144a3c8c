package in.brainlog.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.brainlog.auth.Authenticator;
import in.brainlog.auth.PasswordHasher;
import in.brainlog.auth.SessionCodec;
import in.brainlog.auth.policy.AuthorizationPolicy;
import in.brainlog.auth.policy.RouteTable;
import in.brainlog.config.SecurityPolicy;
import in.brainlog.config.SystemSettings;
import in.brainlog.metrics.PrometheusAuthMetrics;
import in.brainlog.metrics.PrometheusMetricsHandler;
import in.brainlog.migration.AuthSchemaMigration;
import in.brainlog.repository.PostgresAuditLogRepository;
import in.brainlog.repository.PostgresAuditSink;
import in.brainlog.repository.PostgresSystemSettingsRepository;
import in.brainlog.repository.PostgresUserDirectory;
import in.brainlog.repository.SystemSettingsRepository;
import in.brainlog.repository.UserDirectory;
import in.brainlog.repository.UserDirectoryException;
import in.brainlog.security.InputValidator;
import in.brainlog.security.SecureAuditLogger;
import in.brainlog.service.admin.RegistrationService;
import in.brainlog.service.admin.UserAdminService;
import in.brainlog.service.audit.AuditTrail;
import in.brainlog.transport.http.AdminHandlers;
import in.brainlog.transport.http.AuthHandlers;
import in.brainlog.transport.http.PerimeterHandler;
import in.brainlog.transport.http.SessionCookies;
import in.brainlog.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.server.handlers.ProxyPeerAddressHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Brain Log auth server entry point (NO Spring).
 *
 * Wiring:
 * - PostgreSQL via HikariCP, schema migrated at startup
 * - PBKDF2 password hashing, signed session cookie
 * - Perimeter authorization in front of every route
 * - Async audit trail
 * - Prometheus metrics on a separate listener
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Brain Log Auth Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        int port = Env.getInt("PORT", 8080);
        int metricsPort = Env.getInt("METRICS_PORT", 9091);
        int queryTimeoutSeconds = Env.getInt("DB_QUERY_TIMEOUT_SECONDS", 5);
        boolean productionMode = Env.getBool("PRODUCTION_MODE", false);
        String sessionSecret = Env.get("SESSION_SECRET", StartupConfigValidator.DEVELOPMENT_SECRET);
        String corsOrigin = Env.get("CORS_ORIGIN", "http://localhost:3000");
        boolean trustProxy = Env.getBool("TRUST_PROXY", false);

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource();
        new AuthSchemaMigration(dataSource).migrate();

        SystemSettingsRepository settingsRepo = new PostgresSystemSettingsRepository(dataSource);
        SystemSettings settings = loadSettings(settingsRepo);

        SecurityPolicy policy = SecurityPolicy.fromEnv().withSettings(settings);
        StartupConfigValidator.validate(productionMode, sessionSecret, policy);
        log.info("Security policy: iterations={}, maxFailedLogins={}, lockout={}, sessionMaxAge={}, refreshWindow={}",
            policy.pbkdf2Iterations(), policy.maxFailedLogins(), policy.lockoutDuration(),
            policy.sessionMaxAge(), policy.sessionRefreshWindow());

        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusAuthMetrics metrics = new PrometheusAuthMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Repositories + Audit
        // ═══════════════════════════════════════════════════════════════
        UserDirectory userDirectory = new PostgresUserDirectory(dataSource, queryTimeoutSeconds);
        ExecutorService auditExecutor = AuditTrail.newAuditExecutor(
            Env.getInt("AUDIT_QUEUE_CAPACITY", AuditTrail.DEFAULT_QUEUE_CAPACITY));
        AuditTrail auditTrail = new AuditTrail(
            new PostgresAuditSink(dataSource, queryTimeoutSeconds),
            auditExecutor,
            new SecureAuditLogger("AUTH"),
            metrics,
            clock
        );

        // ═══════════════════════════════════════════════════════════════
        // Auth services
        // ═══════════════════════════════════════════════════════════════
        PasswordHasher hasher = new PasswordHasher(policy);
        Authenticator authenticator = new Authenticator(userDirectory, hasher, auditTrail, metrics, policy, clock);
        SessionCodec sessionCodec = SessionCodec.fromSecret(sessionSecret, policy, clock);
        AuthorizationPolicy authorizationPolicy = new AuthorizationPolicy(RouteTable.defaults());
        SessionCookies cookies = new SessionCookies(policy.secureCookies(), policy.sessionMaxAge());

        RegistrationService registrationService = new RegistrationService(
            userDirectory, settingsRepo, hasher, new InputValidator(), auditTrail, clock);
        UserAdminService userAdminService = new UserAdminService(userDirectory, settingsRepo,
            new PostgresAuditLogRepository(dataSource, queryTimeoutSeconds), auditTrail, clock);

        AuthHandlers authHandlers = new AuthHandlers(
            authenticator, sessionCodec, cookies, registrationService, userDirectory, auditTrail, clock);
        AdminHandlers adminHandlers = new AdminHandlers(userAdminService);

        // ═══════════════════════════════════════════════════════════════
        // HTTP Routes
        // ═══════════════════════════════════════════════════════════════
        RoutingHandler routes = routes(authHandlers, adminHandlers);

        // Directory lookups and PBKDF2 block; run them off the IO threads
        HttpHandler perimeter = new BlockingHandler(
            new PerimeterHandler(sessionCodec, authorizationPolicy, cookies, metrics, routes));

        HttpHandler corsHandler = withClientAddress(withCors(perimeter, corsOrigin), trustProxy);
        log.info("Client address from X-Forwarded-For: {}", trustProxy ? "trusted" : "ignored");

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(corsHandler)
            .build();
        server.start();
        log.info("✓ HTTP API server started on port {}", port);

        // Scraped by the collector only; not routed through the perimeter
        Undertow metricsServer = Undertow.builder()
            .addHttpListener(metricsPort, "0.0.0.0")
            .setHandler(Handlers.path().addExactPath("/metrics",
                new PrometheusMetricsHandler(metrics.getRegistry())))
            .build();
        metricsServer.start();
        log.info("✓ Metrics endpoint started on http://localhost:{}/metrics", metricsPort);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            metricsServer.stop();
            auditExecutor.shutdown();
            try {
                if (!auditExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Audit writer did not drain within 5s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            dataSource.close();
            log.info("Shutdown complete");
        }, "ShutdownHook"));

        log.info("Brain Log Auth started on http://localhost:{}/", port);
    }

    /**
     * API routes. Every route sits behind the perimeter; handlers read the verified
     * claims from the exchange.
     */
    public static RoutingHandler routes(AuthHandlers authHandlers, AdminHandlers adminHandlers) {
        return Handlers.routing()
            .post("/api/auth/login", authHandlers::login)
            .post("/api/auth/logout", authHandlers::logout)
            .get("/api/auth/session-check", authHandlers::sessionCheck)
            .post("/api/auth/register", authHandlers::register)
            .get("/api/admin/users", adminHandlers::listUsers)
            .post("/api/admin/users/{userId}/approve", adminHandlers::approveUser)
            .post("/api/admin/users/{userId}/deactivate", adminHandlers::deactivateUser)
            .post("/api/admin/users/{userId}/promote", adminHandlers::promoteUser)
            .post("/api/admin/users/{userId}/unlock", adminHandlers::unlockUser)
            .post("/api/admin/users/{userId}/lock", adminHandlers::lockUser)
            .get("/api/admin/audit", adminHandlers::listAuditLogs)
            .get("/api/admin/settings", adminHandlers::getSettings)
            .put("/api/admin/settings", adminHandlers::updateSettings)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
                exchange.getResponseSender().send("{\"success\":false,\"error\":\"Not found\"}");
            });
    }

    /**
     * Credentialed CORS for the single front-end origin; preflight requests end here.
     */
    public static HttpHandler withCors(HttpHandler next, String origin) {
        return exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), origin)
                .put(HttpString.tryFromString("Access-Control-Allow-Credentials"), "true")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, PUT, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (Methods.OPTIONS.equals(exchange.getRequestMethod())) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                next.handleRequest(exchange);
            }
        };
    }

    /**
     * Behind a reverse proxy the audited client address comes from X-Forwarded-For;
     * otherwise the header is ignored and the TCP peer is used.
     */
    public static HttpHandler withClientAddress(HttpHandler next, boolean trustProxy) {
        return trustProxy ? new ProxyPeerAddressHandler(next) : next;
    }

    /**
     * Settings row drives the lockout policy. Unreachable settings fall back to defaults
     * rather than blocking startup.
     */
    private static SystemSettings loadSettings(SystemSettingsRepository repo) {
        try {
            return repo.load().orElseGet(() -> {
                log.warn("No system settings row found, using defaults");
                return SystemSettings.defaults();
            });
        } catch (UserDirectoryException e) {
            log.warn("Failed to load system settings, using defaults: {}", e.getMessage());
            return SystemSettings.defaults();
        }
    }

    private static HikariDataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/brainlog");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("brainlog-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    private App() {
    }
}
