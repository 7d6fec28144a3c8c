package in.brainlog.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.brainlog.domain.audit.AuditLogEntry;
import in.brainlog.domain.audit.AuditLogQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class PostgresAuditLogRepository implements AuditLogRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresAuditLogRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {};

    private final DataSource dataSource;
    private final int queryTimeoutSeconds;

    public PostgresAuditLogRepository(DataSource dataSource, int queryTimeoutSeconds) {
        this.dataSource = dataSource;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    @Override
    public List<AuditLogEntry> find(AuditLogQuery query) {
        StringBuilder sql = new StringBuilder("""
                SELECT a.id, a.user_id, a.action, a.resource, a.details::text AS details,
                       a.ip_address, a.user_agent, a.created_at,
                       u.username, u.display_name
                FROM audit_log a
                LEFT JOIN users u ON u.user_id = a.user_id
                WHERE 1 = 1
                """);
        List<String> params = new ArrayList<>();
        if (query.action() != null) {
            sql.append(" AND a.action = ?");
            params.add(query.action());
        }
        if (query.resource() != null) {
            sql.append(" AND a.resource = ?");
            params.add(query.resource());
        }
        if (query.userId() != null) {
            sql.append(" AND a.user_id = ?");
            params.add(query.userId());
        }
        sql.append(" ORDER BY a.created_at DESC, a.id DESC LIMIT ? OFFSET ?");

        List<AuditLogEntry> entries = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            if (queryTimeoutSeconds > 0) {
                ps.setQueryTimeout(queryTimeoutSeconds);
            }
            int i = 1;
            for (String param : params) {
                ps.setString(i++, param);
            }
            ps.setInt(i++, query.limit());
            ps.setInt(i, query.offset());

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(mapRow(rs));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            log.error("Failed to query audit log: {}", e.getMessage());
            throw new AuditSinkException("Failed to query audit log", e);
        }

        return entries;
    }

    private AuditLogEntry mapRow(ResultSet rs) throws SQLException, JsonProcessingException {
        String details = rs.getString("details");
        Timestamp createdAt = rs.getTimestamp("created_at");

        return new AuditLogEntry(
            rs.getLong("id"),
            rs.getString("user_id"),
            rs.getString("username"),
            rs.getString("display_name"),
            rs.getString("action"),
            rs.getString("resource"),
            details != null ? MAPPER.readValue(details, DETAILS_TYPE) : Map.of(),
            rs.getString("ip_address"),
            rs.getString("user_agent"),
            createdAt != null ? createdAt.toInstant() : null
        );
    }
}
