package in.brainlog.domain.audit;

/**
 * Filter and page for reading the audit log. Null filters match everything.
 * The page size is clamped to {@link #MAX_LIMIT}.
 */
public record AuditLogQuery(
    String action,
    String resource,
    String userId,
    int limit,
    int offset
) {
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;

    public AuditLogQuery {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        limit = Math.min(limit, MAX_LIMIT);
        action = blankToNull(action);
        resource = blankToNull(resource);
        userId = blankToNull(userId);
    }

    public static AuditLogQuery firstPage() {
        return new AuditLogQuery(null, null, null, DEFAULT_LIMIT, 0);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
