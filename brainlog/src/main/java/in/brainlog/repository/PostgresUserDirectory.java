package in.brainlog.repository;

import in.brainlog.domain.user.UserRecord;
import in.brainlog.domain.user.UserRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

public final class PostgresUserDirectory implements UserDirectory {
    private static final Logger log = LoggerFactory.getLogger(PostgresUserDirectory.class);

    private static final String USER_COLUMNS = """
            user_id, username, email, display_name, timezone, password_hash, role, is_active,
            failed_login_attempts, locked_until, last_login_at, created_at
            """;

    private final DataSource dataSource;
    private final int queryTimeoutSeconds;

    public PostgresUserDirectory(DataSource dataSource, int queryTimeoutSeconds) {
        this.dataSource = dataSource;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    @Override
    public Optional<UserRecord> findByUsername(String username) {
        String sql = "SELECT " + USER_COLUMNS + " FROM users WHERE username = ?";
        return findOne(sql, username, "username");
    }

    @Override
    public Optional<UserRecord> findById(String userId) {
        String sql = "SELECT " + USER_COLUMNS + " FROM users WHERE user_id = ?";
        return findOne(sql, userId, "id");
    }

    @Override
    public List<UserRecord> findAll() {
        String sql = "SELECT " + USER_COLUMNS + " FROM users ORDER BY created_at DESC";
        List<UserRecord> users = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = prepare(conn, sql);
                ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                users.add(mapRow(rs));
            }
        } catch (SQLException | IllegalArgumentException e) {
            log.error("Error listing users: {}", e.getMessage());
            throw new UserDirectoryException("Failed to list users", e);
        }

        return users;
    }

    @Override
    public boolean existsByUsername(String username) {
        return exists("SELECT 1 FROM users WHERE username = ?", username);
    }

    @Override
    public boolean existsByEmail(String email) {
        return exists("SELECT 1 FROM users WHERE email = ?", email);
    }

    @Override
    public void create(UserRecord user) {
        String sql = """
                INSERT INTO users (
                    user_id, username, email, display_name, timezone, password_hash,
                    role, is_active, failed_login_attempts, created_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, 0, ?)
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = prepare(conn, sql)) {

            ps.setString(1, user.userId());
            ps.setString(2, user.username());
            ps.setString(3, user.email());
            ps.setString(4, user.displayName());
            ps.setString(5, user.timezone());
            ps.setString(6, user.passwordHash());
            ps.setString(7, user.role().name());
            ps.setBoolean(8, user.active());
            ps.setTimestamp(9, toTimestamp(user.createdAt() != null ? user.createdAt() : Instant.now()));

            ps.executeUpdate();
            log.info("User created: {} ({}) role={}", user.username(), user.userId(), user.role());

        } catch (SQLException e) {
            log.error("Error creating user: {}", e.getMessage());
            throw new UserDirectoryException("Failed to create user", e);
        }
    }

    @Override
    public OptionalInt incrementFailedLogins(String userId, int lockThreshold, Instant lockUntil, Instant now) {
        // Single conditional statement: row lock serializes concurrent attempts and the
        // WHERE clause is re-checked against the latest row version.
        String sql = """
                UPDATE users
                SET failed_login_attempts = failed_login_attempts + 1,
                    locked_until = CASE
                        WHEN failed_login_attempts + 1 >= ? THEN ?
                        ELSE locked_until
                    END,
                    updated_at = NOW()
                WHERE user_id = ?
                  AND (locked_until IS NULL OR locked_until <= ?)
                RETURNING failed_login_attempts
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = prepare(conn, sql)) {

            ps.setInt(1, lockThreshold);
            ps.setTimestamp(2, toTimestamp(lockUntil));
            ps.setString(3, userId);
            ps.setTimestamp(4, toTimestamp(now));

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    int newCount = rs.getInt(1);
                    log.debug("Failed login count incremented: {} -> {}", userId, newCount);
                    return OptionalInt.of(newCount);
                }
            }
        } catch (SQLException e) {
            log.error("Failed to increment failed logins: {}", e.getMessage());
            throw new UserDirectoryException("Failed to increment failed logins", e);
        }

        return OptionalInt.empty();
    }

    @Override
    public void resetFailedLogins(String userId) {
        executeUpdate("UPDATE users SET failed_login_attempts = 0, updated_at = NOW() WHERE user_id = ?",
            "reset failed logins", ps -> ps.setString(1, userId));
    }

    @Override
    public void setLockout(String userId, Instant until) {
        executeUpdate("UPDATE users SET locked_until = ?, updated_at = NOW() WHERE user_id = ?",
            "set lockout", ps -> {
                ps.setTimestamp(1, toTimestamp(until));
                ps.setString(2, userId);
            });
    }

    @Override
    public void clearLockout(String userId) {
        executeUpdate("UPDATE users SET locked_until = NULL, updated_at = NOW() WHERE user_id = ?",
            "clear lockout", ps -> ps.setString(1, userId));
    }

    @Override
    public void updateLastLogin(String userId, Instant at) {
        executeUpdate("UPDATE users SET last_login_at = ?, updated_at = NOW() WHERE user_id = ?",
            "update last login", ps -> {
                ps.setTimestamp(1, toTimestamp(at));
                ps.setString(2, userId);
            });
    }

    @Override
    public boolean updateRoleAndStatus(String userId, UserRole role, boolean active) {
        int updated = executeUpdate(
            "UPDATE users SET role = ?, is_active = ?, updated_at = NOW() WHERE user_id = ?",
            "update role and status", ps -> {
                ps.setString(1, role.name());
                ps.setBoolean(2, active);
                ps.setString(3, userId);
            });
        if (updated > 0) {
            log.info("User status updated: {} role={} active={}", userId, role, active);
        }
        return updated > 0;
    }

    private Optional<UserRecord> findOne(String sql, String key, String keyName) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = prepare(conn, sql)) {

            ps.setString(1, key);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException | IllegalArgumentException e) {
            log.error("Error finding user by {}: {}", keyName, e.getMessage());
            throw new UserDirectoryException("Failed to find user by " + keyName, e);
        }

        return Optional.empty();
    }

    private boolean exists(String sql, String value) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = prepare(conn, sql)) {

            ps.setString(1, value);

            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            log.error("Error checking user existence: {}", e.getMessage());
            throw new UserDirectoryException("Failed to check user existence", e);
        }
    }

    private int executeUpdate(String sql, String operation, StatementBinder binder) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = prepare(conn, sql)) {

            binder.bind(ps);
            return ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to {}: {}", operation, e.getMessage());
            throw new UserDirectoryException("Failed to " + operation, e);
        }
    }

    private PreparedStatement prepare(Connection conn, String sql) throws SQLException {
        PreparedStatement ps = conn.prepareStatement(sql);
        if (queryTimeoutSeconds > 0) {
            ps.setQueryTimeout(queryTimeoutSeconds);
        }
        return ps;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private UserRecord mapRow(ResultSet rs) throws SQLException {
        UserRole role = UserRole.fromString(rs.getString("role"));
        if (role == null) {
            throw new SQLException("Unknown role for user " + rs.getString("user_id"));
        }

        return new UserRecord(
            rs.getString("user_id"),
            rs.getString("username"),
            rs.getString("email"),
            rs.getString("display_name"),
            rs.getString("timezone"),
            rs.getString("password_hash"),
            role,
            rs.getBoolean("is_active"),
            rs.getInt("failed_login_attempts"),
            toInstant(rs.getTimestamp("locked_until")),
            toInstant(rs.getTimestamp("last_login_at")),
            toInstant(rs.getTimestamp("created_at"))
        );
    }

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }
}
