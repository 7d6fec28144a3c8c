package in.brainlog.domain.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stored audit row as read back for administrators. Username and display name come
 * from the user directory and are null when the event has no user or the user is gone.
 * The action stays a string so rows written by older releases still read.
 */
public record AuditLogEntry(
    long id,
    String userId,
    String username,
    String displayName,
    String action,
    String resource,
    Map<String, Object> details,
    String ipAddress,
    String userAgent,
    Instant timestamp
) {
    public AuditLogEntry {
        details = details == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
