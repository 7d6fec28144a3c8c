package in.brainlog.domain.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable audit record. userId is null for pre-authentication failures
 * against unknown accounts.
 */
public record AuditEvent(
    Instant timestamp,
    String userId,
    AuditAction action,
    String resource,
    String ipAddress,
    String userAgent,
    Map<String, Object> details
) {
    public static final String RESOURCE_AUTH = "AUTH";
    public static final String RESOURCE_USER_MANAGEMENT = "USER_MANAGEMENT";
    public static final String RESOURCE_SYSTEM = "SYSTEM";

    public AuditEvent {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp is required");
        }
        if (action == null) {
            throw new IllegalArgumentException("action is required");
        }
        details = details == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
