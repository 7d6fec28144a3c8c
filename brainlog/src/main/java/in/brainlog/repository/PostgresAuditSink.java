package in.brainlog.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.brainlog.domain.audit.AuditEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;

/**
 * Append-only PostgreSQL audit log. Details are stored as JSONB.
 */
public final class PostgresAuditSink implements AuditSink {
    private static final Logger log = LoggerFactory.getLogger(PostgresAuditSink.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final DataSource dataSource;
    private final int queryTimeoutSeconds;

    public PostgresAuditSink(DataSource dataSource, int queryTimeoutSeconds) {
        this.dataSource = dataSource;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    @Override
    public void record(AuditEvent e) {
        String sql = """
                INSERT INTO audit_log (
                    user_id, action, resource, details, ip_address, user_agent, created_at
                ) VALUES (?, ?, ?, ?::jsonb, ?, ?, ?)
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            if (queryTimeoutSeconds > 0) {
                ps.setQueryTimeout(queryTimeoutSeconds);
            }
            ps.setString(1, e.userId());
            ps.setString(2, e.action().name());
            ps.setString(3, e.resource());
            ps.setString(4, MAPPER.writeValueAsString(e.details()));
            ps.setString(5, e.ipAddress());
            ps.setString(6, e.userAgent());
            ps.setTimestamp(7, Timestamp.from(e.timestamp()));

            ps.executeUpdate();

        } catch (SQLException | JsonProcessingException ex) {
            log.error("Failed to append audit event {}: {}", e.action(), ex.getMessage());
            throw new AuditSinkException("Failed to append audit event", ex);
        }
    }
}
