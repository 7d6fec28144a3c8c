package in.brainlog.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.brainlog.auth.AuthResult;
import in.brainlog.auth.Authenticator;
import in.brainlog.auth.Principal;
import in.brainlog.auth.RequestMeta;
import in.brainlog.auth.SessionClaims;
import in.brainlog.auth.SessionCodec;
import in.brainlog.domain.audit.AuditAction;
import in.brainlog.domain.audit.AuditEvent;
import in.brainlog.domain.user.UserRecord;
import in.brainlog.repository.UserDirectory;
import in.brainlog.repository.UserDirectoryException;
import in.brainlog.service.admin.AccountAdminException;
import in.brainlog.service.admin.RegistrationRequest;
import in.brainlog.service.admin.RegistrationService;
import in.brainlog.service.audit.AuditTrail;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP handlers for /api/auth endpoints.
 *
 * Provides:
 * - POST /api/auth/login - Check credentials, set session cookie
 * - POST /api/auth/logout - Audit and expire the session cookie
 * - GET /api/auth/session-check - Report the session, refreshing it from the directory when old
 * - POST /api/auth/register - Create a pending account
 */
public final class AuthHandlers {
    private static final Logger log = LoggerFactory.getLogger(AuthHandlers.class);

    static final String INVALID_CREDENTIALS_MESSAGE = "Invalid username or password";

    private final Authenticator authenticator;
    private final SessionCodec codec;
    private final SessionCookies cookies;
    private final RegistrationService registration;
    private final UserDirectory directory;
    private final AuditTrail audit;
    private final Clock clock;

    public AuthHandlers(Authenticator authenticator, SessionCodec codec, SessionCookies cookies,
                        RegistrationService registration, UserDirectory directory,
                        AuditTrail audit, Clock clock) {
        this.authenticator = authenticator;
        this.codec = codec;
        this.cookies = cookies;
        this.registration = registration;
        this.directory = directory;
        this.audit = audit;
        this.clock = clock;
    }

    /**
     * POST /api/auth/login
     *
     * Body: {"username": "...", "password": "..."}. Invalid and locked accounts get the
     * same 401 body.
     */
    public void login(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            JsonNode json;
            try {
                json = HttpSupport.MAPPER.readTree(body);
            } catch (JsonProcessingException e) {
                HttpSupport.sendError(ex, StatusCodes.BAD_REQUEST, "Invalid request");
                return;
            }
            if (json == null || !json.isObject()) {
                HttpSupport.sendError(ex, StatusCodes.BAD_REQUEST, "Invalid request");
                return;
            }

            AuthResult result = authenticator.authenticate(
                HttpSupport.text(json, "username"), HttpSupport.text(json, "password"),
                HttpSupport.requestMeta(ex));

            if (result.isSuccess()) {
                Principal principal = result.principal();
                cookies.set(ex, codec.issue(principal));

                ObjectNode response = HttpSupport.MAPPER.createObjectNode();
                response.put("success", true);
                response.set("user", userJson(principal));
                HttpSupport.sendJson(ex, StatusCodes.OK, response);
                return;
            }

            switch (result.failure()) {
                case MISSING_CREDENTIALS ->
                    HttpSupport.sendError(ex, StatusCodes.BAD_REQUEST, "Username and password are required");
                case INVALID_CREDENTIALS, ACCOUNT_LOCKED ->
                    HttpSupport.sendError(ex, StatusCodes.UNAUTHORIZED, INVALID_CREDENTIALS_MESSAGE);
                case UNAVAILABLE ->
                    HttpSupport.sendError(ex, StatusCodes.SERVICE_UNAVAILABLE, "Authentication service unavailable");
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * POST /api/auth/logout
     */
    public void logout(HttpServerExchange exchange) {
        Optional<SessionClaims> claims = HttpSupport.claims(exchange);
        claims.ifPresent(c -> audit.record(AuditAction.LOGOUT, c.userId(), AuditEvent.RESOURCE_AUTH,
            HttpSupport.requestMeta(exchange), Map.of()));

        cookies.clear(exchange);
        HttpSupport.sendSuccess(exchange, "Logged out");
    }

    /**
     * GET /api/auth/session-check
     *
     * Once the session is older than the refresh window it is re-issued from the
     * directory's current role, active flag and timezone.
     */
    public void sessionCheck(HttpServerExchange exchange) {
        HttpSupport.noCache(exchange);

        Optional<SessionClaims> found = HttpSupport.claims(exchange);
        if (found.isEmpty()) {
            HttpSupport.sendError(exchange, StatusCodes.UNAUTHORIZED, "Unauthorized");
            return;
        }

        SessionClaims claims = found.get();
        if (claims.needsRefresh(clock.instant(), codec.refreshWindow())) {
            try {
                Optional<UserRecord> current = directory.findById(claims.userId());
                if (current.isEmpty()) {
                    log.info("[AUTH] Session for missing user {} cleared", claims.userId());
                    cookies.clear(exchange);
                    HttpSupport.sendError(exchange, StatusCodes.UNAUTHORIZED, "Unauthorized");
                    return;
                }
                String token = codec.refresh(claims, current.get());
                cookies.set(exchange, token);
                claims = codec.verify(token).orElse(claims);
                log.debug("[AUTH] Session refreshed for {}", claims.userId());
            } catch (UserDirectoryException e) {
                // Keep serving the existing session; the next check retries the refresh
                log.warn("[AUTH] Session refresh skipped for {}: {}", claims.userId(), e.getMessage());
            }
        }

        ObjectNode user = HttpSupport.MAPPER.createObjectNode();
        user.put("id", claims.userId());
        user.put("role", claims.role().name());
        user.put("active", claims.active());
        user.put("timezone", claims.timezone());

        ObjectNode session = HttpSupport.MAPPER.createObjectNode();
        session.set("user", user);
        session.put("expiresAt", claims.expiresAt().toString());

        ObjectNode response = HttpSupport.MAPPER.createObjectNode();
        response.put("status", "ok");
        response.set("session", session);
        HttpSupport.sendJson(exchange, StatusCodes.OK, response);
    }

    /**
     * POST /api/auth/register
     *
     * Body: {"username", "email", "password", "displayName", "timezone"?}
     */
    public void register(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            RequestMeta meta = HttpSupport.requestMeta(ex);
            try {
                JsonNode json = HttpSupport.MAPPER.readTree(body);
                if (json == null || !json.isObject()) {
                    HttpSupport.sendError(ex, StatusCodes.BAD_REQUEST, "Invalid request");
                    return;
                }

                RegistrationRequest request = new RegistrationRequest(
                    HttpSupport.text(json, "username"),
                    HttpSupport.text(json, "email"),
                    HttpSupport.text(json, "password"),
                    HttpSupport.text(json, "displayName"),
                    HttpSupport.text(json, "timezone"));

                UserRecord user = registration.register(request, meta);

                ObjectNode response = HttpSupport.MAPPER.createObjectNode();
                response.put("success", true);
                response.put("message", "Registration successful. Please wait for admin approval.");
                response.put("userId", user.userId());
                HttpSupport.sendJson(ex, StatusCodes.OK, response);

            } catch (JsonProcessingException e) {
                HttpSupport.sendError(ex, StatusCodes.BAD_REQUEST, "Invalid request");
            } catch (IllegalArgumentException e) {
                HttpSupport.sendError(ex, StatusCodes.BAD_REQUEST, e.getMessage());
            } catch (AccountAdminException e) {
                HttpSupport.sendError(ex, HttpSupport.statusFor(e), e.getMessage());
            } catch (UserDirectoryException e) {
                log.error("[REGISTRATION] Directory unavailable: {}", e.getMessage());
                HttpSupport.sendError(ex, StatusCodes.SERVICE_UNAVAILABLE, "Registration failed. Please try again.");
            }
        }, StandardCharsets.UTF_8);
    }

    private static ObjectNode userJson(Principal principal) {
        ObjectNode user = HttpSupport.MAPPER.createObjectNode();
        user.put("id", principal.userId());
        user.put("username", principal.username());
        user.put("displayName", principal.displayName());
        user.put("role", principal.role().name());
        user.put("active", principal.active());
        user.put("timezone", principal.timezone());
        return user;
    }
}
