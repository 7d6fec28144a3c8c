package in.brainlog.security;

import in.brainlog.domain.audit.AuditEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Local log channel for security events. Masks credentials before anything
 * reaches the log file.
 *
 * Used for audit events that could not be persisted, so the event is not lost entirely.
 *
 * Detail keys containing any of the sensitive fragments are masked; free text is
 * scrubbed of bearer tokens and key=value credentials.
 *
 * Thread-safe.
 */
public class SecureAuditLogger {
    private static final Logger log = LoggerFactory.getLogger(SecureAuditLogger.class);

    private static final List<String> SENSITIVE_FIELDS = List.of(
        "password", "passwd", "pwd", "secret", "token", "authorization",
        "cookie", "session", "hash", "api_key", "apikey"
    );

    private static final Pattern BEARER_TOKEN_PATTERN =
        Pattern.compile("Bearer\\s+[A-Za-z0-9\\-._~+/]+=*", Pattern.CASE_INSENSITIVE);

    private static final Pattern CREDENTIAL_PAIR_PATTERN =
        Pattern.compile("(password|passwd|pwd|token|secret|api[_-]?key)([=:])\\s*[^&\\s,}]+",
            Pattern.CASE_INSENSITIVE);

    // header.payload.signature, each base64url
    private static final Pattern JWT_PATTERN =
        Pattern.compile("eyJ[A-Za-z0-9_-]*\\.[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+");

    private static final Pattern PBKDF2_PATTERN =
        Pattern.compile("PBKDF2:\\d+:[A-Za-z0-9+/=]+:[A-Za-z0-9+/=]+");

    private final String component;

    public SecureAuditLogger(String component) {
        this.component = component;
    }

    /**
     * Write an audit event to the application log. Used when the audit store
     * rejected it.
     */
    public void logUnpersistedEvent(AuditEvent event, Throwable cause) {
        log.warn("[{}][AUDIT] unpersisted action={}, user_id={}, resource={}, ip={}, details={}, timestamp={}, error={}",
            component, event.action(), event.userId(), event.resource(), event.ipAddress(),
            sanitizeDetails(event.details()), event.timestamp(), getRedactedExceptionMessage(cause));
    }

    /**
     * Mask credentials in free text.
     */
    public String sanitize(String input) {
        if (input == null || input.isBlank()) {
            return input;
        }

        String result = BEARER_TOKEN_PATTERN.matcher(input).replaceAll("Bearer ****");
        result = JWT_PATTERN.matcher(result).replaceAll("****");
        result = PBKDF2_PATTERN.matcher(result).replaceAll("PBKDF2:****");
        result = CREDENTIAL_PAIR_PATTERN.matcher(result).replaceAll("$1$2****");
        return result;
    }

    /**
     * Copy of the details map with sensitive values masked and string values scrubbed.
     */
    public Map<String, Object> sanitizeDetails(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return Map.of();
        }

        Map<String, Object> sanitized = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : details.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();

            if (isSensitiveField(key)) {
                sanitized.put(key, "****");
            } else if (value instanceof String s) {
                sanitized.put(key, sanitize(s));
            } else {
                sanitized.put(key, value);
            }
        }
        return sanitized;
    }

    public String getRedactedExceptionMessage(Throwable throwable) {
        if (throwable == null) {
            return "null";
        }

        String message = throwable.getMessage();
        if (message == null) {
            message = throwable.getClass().getSimpleName();
        }

        return sanitize(message);
    }

    private static boolean isSensitiveField(String fieldName) {
        if (fieldName == null) {
            return false;
        }

        String lower = fieldName.toLowerCase();
        for (String sensitive : SENSITIVE_FIELDS) {
            if (lower.contains(sensitive)) {
                return true;
            }
        }
        return false;
    }
}
