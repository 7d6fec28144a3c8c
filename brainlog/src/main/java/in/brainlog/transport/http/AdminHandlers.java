package in.brainlog.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.brainlog.auth.SessionClaims;
import in.brainlog.config.SystemSettings;
import in.brainlog.domain.audit.AuditLogEntry;
import in.brainlog.domain.audit.AuditLogQuery;
import in.brainlog.domain.user.UserRecord;
import in.brainlog.repository.AuditSinkException;
import in.brainlog.repository.UserDirectoryException;
import in.brainlog.service.admin.AccountAdminException;
import in.brainlog.service.admin.UserAdminService;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * HTTP handlers for admin endpoints. The perimeter has already restricted
 * /api/admin to active administrators.
 *
 * Provides REST API for:
 * - GET /api/admin/users - List accounts (no password hashes)
 * - POST /api/admin/users/{userId}/approve | deactivate | promote | unlock | lock
 * - GET /api/admin/audit - Audit log, newest first (action, resource, userId, limit, offset)
 * - GET /api/admin/settings - Current system settings
 * - PUT /api/admin/settings - Update system settings (missing fields keep their value)
 */
public final class AdminHandlers {
    private static final Logger log = LoggerFactory.getLogger(AdminHandlers.class);

    private final UserAdminService adminService;

    public AdminHandlers(UserAdminService adminService) {
        this.adminService = adminService;
    }

    public void listUsers(HttpServerExchange exchange) {
        run(exchange, "list users", actor -> {
            List<UserRecord> users = adminService.listUsers();

            ArrayNode items = HttpSupport.MAPPER.createArrayNode();
            for (UserRecord user : users) {
                items.add(userJson(user));
            }

            ObjectNode response = HttpSupport.MAPPER.createObjectNode();
            response.put("success", true);
            response.set("users", items);
            HttpSupport.sendJson(exchange, StatusCodes.OK, response);
        });
    }

    public void approveUser(HttpServerExchange exchange) {
        run(exchange, "approve user", actor -> {
            UserRecord user = adminService.approve(actor.userId(), targetId(exchange), HttpSupport.requestMeta(exchange));
            HttpSupport.sendSuccess(exchange, "User " + user.displayName() + " has been approved and activated");
        });
    }

    public void deactivateUser(HttpServerExchange exchange) {
        run(exchange, "deactivate user", actor -> {
            UserRecord user = adminService.deactivate(actor.userId(), targetId(exchange), HttpSupport.requestMeta(exchange));
            HttpSupport.sendSuccess(exchange, "User " + user.displayName() + " has been deactivated");
        });
    }

    public void promoteUser(HttpServerExchange exchange) {
        run(exchange, "promote user", actor -> {
            UserRecord user = adminService.promote(actor.userId(), targetId(exchange), HttpSupport.requestMeta(exchange));
            HttpSupport.sendSuccess(exchange, "User " + user.displayName() + " has been promoted to admin");
        });
    }

    public void unlockUser(HttpServerExchange exchange) {
        run(exchange, "unlock user", actor -> {
            adminService.unlock(actor.userId(), targetId(exchange), HttpSupport.requestMeta(exchange));
            HttpSupport.sendSuccess(exchange, "Account unlocked");
        });
    }

    /**
     * POST /api/admin/users/{userId}/lock
     *
     * Body: {"minutes": 60}
     */
    public void lockUser(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> run(ex, "lock user", actor -> {
            JsonNode json = readObject(body);
            JsonNode minutes = json.get("minutes");
            if (minutes == null || !minutes.canConvertToInt()) {
                throw new IllegalArgumentException("minutes is required");
            }

            Instant until = adminService.lock(actor.userId(), targetId(ex), minutes.intValue(),
                HttpSupport.requestMeta(ex));

            ObjectNode response = HttpSupport.MAPPER.createObjectNode();
            response.put("success", true);
            response.put("lockedUntil", until.toString());
            HttpSupport.sendJson(ex, StatusCodes.OK, response);
        }), StandardCharsets.UTF_8);
    }

    /**
     * GET /api/admin/audit?action=&resource=&userId=&limit=50&offset=0
     *
     * limit is capped at 100.
     */
    public void listAuditLogs(HttpServerExchange exchange) {
        run(exchange, "list audit logs", actor -> {
            AuditLogQuery query = new AuditLogQuery(
                HttpSupport.queryParam(exchange, "action"),
                HttpSupport.queryParam(exchange, "resource"),
                HttpSupport.queryParam(exchange, "userId"),
                intParam(exchange, "limit", AuditLogQuery.DEFAULT_LIMIT),
                intParam(exchange, "offset", 0));

            List<AuditLogEntry> entries = adminService.listAuditLogs(query);

            ArrayNode logs = HttpSupport.MAPPER.createArrayNode();
            for (AuditLogEntry entry : entries) {
                logs.add(auditJson(entry));
            }

            ObjectNode response = HttpSupport.MAPPER.createObjectNode();
            response.put("success", true);
            response.set("logs", logs);
            response.put("total", entries.size());
            response.put("limit", query.limit());
            response.put("offset", query.offset());
            HttpSupport.sendJson(exchange, StatusCodes.OK, response);
        });
    }

    public void getSettings(HttpServerExchange exchange) {
        run(exchange, "get settings", actor -> {
            ObjectNode response = HttpSupport.MAPPER.createObjectNode();
            response.put("success", true);
            response.set("settings", HttpSupport.MAPPER.valueToTree(adminService.getSettings()));
            HttpSupport.sendJson(exchange, StatusCodes.OK, response);
        });
    }

    /**
     * PUT /api/admin/settings
     *
     * Lockout changes take effect on the next restart.
     */
    public void updateSettings(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> run(ex, "update settings", actor -> {
            JsonNode json = readObject(body);
            SystemSettings current = adminService.getSettings();

            SystemSettings merged = new SystemSettings(
                json.has("registrationEnabled") ? json.get("registrationEnabled").asBoolean() : current.registrationEnabled(),
                json.has("siteName") ? json.get("siteName").asText() : current.siteName(),
                json.has("adminEmail") ? json.get("adminEmail").asText() : current.adminEmail(),
                json.has("maxFailedLogins") ? json.get("maxFailedLogins").asInt() : current.maxFailedLogins(),
                json.has("lockoutDurationMinutes") ? json.get("lockoutDurationMinutes").asInt() : current.lockoutDurationMinutes()
            );

            SystemSettings saved = adminService.updateSettings(actor.userId(), merged, HttpSupport.requestMeta(ex));
            boolean lockoutChanged = saved.maxFailedLogins() != current.maxFailedLogins()
                || saved.lockoutDurationMinutes() != current.lockoutDurationMinutes();

            ObjectNode response = HttpSupport.MAPPER.createObjectNode();
            response.put("success", true);
            response.put("message", lockoutChanged
                ? "Settings updated. Lockout changes apply after a restart."
                : "Settings updated successfully");
            response.put("appliesOnRestart", lockoutChanged);
            response.set("settings", HttpSupport.MAPPER.valueToTree(saved));
            HttpSupport.sendJson(ex, StatusCodes.OK, response);
        }), StandardCharsets.UTF_8);
    }

    private void run(HttpServerExchange exchange, String operation, AdminAction action) {
        Optional<SessionClaims> actor = HttpSupport.claims(exchange);
        if (actor.isEmpty()) {
            HttpSupport.sendError(exchange, StatusCodes.UNAUTHORIZED, "Unauthorized");
            return;
        }

        try {
            action.execute(actor.get());
        } catch (AccountAdminException e) {
            log.info("[ADMIN] {} rejected: {}", operation, e.getMessage());
            HttpSupport.sendError(exchange, HttpSupport.statusFor(e), e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("[ADMIN] Invalid {} request: {}", operation, e.getMessage());
            HttpSupport.sendError(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
        } catch (UserDirectoryException | AuditSinkException e) {
            log.error("[ADMIN] Failed to {}: {}", operation, e.getMessage());
            HttpSupport.sendError(exchange, StatusCodes.SERVICE_UNAVAILABLE, "Failed to " + operation);
        } catch (JsonProcessingException e) {
            HttpSupport.sendError(exchange, StatusCodes.BAD_REQUEST, "Invalid request");
        }
    }

    private static String targetId(HttpServerExchange exchange) {
        String userId = HttpSupport.pathParam(exchange, "userId");
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("Invalid user ID");
        }
        return userId;
    }

    private static int intParam(HttpServerExchange exchange, String name, int defaultValue) {
        String value = HttpSupport.queryParam(exchange, name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name);
        }
    }

    private static JsonNode readObject(String body) throws JsonProcessingException {
        JsonNode json = HttpSupport.MAPPER.readTree(body == null || body.isBlank() ? "{}" : body);
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("Request body must be a JSON object");
        }
        return json;
    }

    private static ObjectNode userJson(UserRecord user) {
        ObjectNode node = HttpSupport.MAPPER.createObjectNode();
        node.put("id", user.userId());
        node.put("username", user.username());
        node.put("email", user.email());
        node.put("displayName", user.displayName());
        node.put("role", user.role().name());
        node.put("isActive", user.active());
        node.put("timezone", user.timezone());
        node.put("failedLoginAttempts", user.failedLoginAttempts());
        node.put("lockedUntil", user.lockedUntil() != null ? user.lockedUntil().toString() : null);
        node.put("lastLoginAt", user.lastLoginAt() != null ? user.lastLoginAt().toString() : null);
        node.put("createdAt", user.createdAt() != null ? user.createdAt().toString() : null);
        return node;
    }

    private static ObjectNode auditJson(AuditLogEntry entry) {
        ObjectNode node = HttpSupport.MAPPER.createObjectNode();
        node.put("id", entry.id());
        node.put("action", entry.action());
        node.put("resource", entry.resource());
        node.put("userId", entry.userId());
        node.put("userName", entry.displayName() != null ? entry.displayName()
            : entry.username() != null ? entry.username() : "Unknown User");
        node.set("details", HttpSupport.MAPPER.valueToTree(entry.details()));
        node.put("ipAddress", entry.ipAddress());
        node.put("userAgent", entry.userAgent());
        node.put("createdAt", entry.timestamp() != null ? entry.timestamp().toString() : null);
        return node;
    }

    @FunctionalInterface
    private interface AdminAction {
        void execute(SessionClaims actor) throws JsonProcessingException;
    }
}
