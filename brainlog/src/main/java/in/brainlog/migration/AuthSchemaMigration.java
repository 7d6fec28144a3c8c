package in.brainlog.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Auth schema migration, run on startup.
 *
 * Creates three tables:
 * - users: accounts with role, active flag and lockout bookkeeping
 * - audit_log: append-only security events (JSONB details)
 * - system_settings: single row 'system' with registration and lockout settings
 */
public final class AuthSchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(AuthSchemaMigration.class);

    private final DataSource dataSource;

    public AuthSchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void migrate() {
        log.info("[AUTH MIGRATION] Starting auth schema migration");

        try (Connection conn = dataSource.getConnection()) {
            if (!tableExists(conn, "users")) {
                log.info("[AUTH MIGRATION] Creating users table...");
                createUsersTable(conn);
                log.info("[AUTH MIGRATION] ✓ users table created");
            } else {
                log.info("[AUTH MIGRATION] users table already exists");
                updateUsersSchema(conn);
            }

            if (!tableExists(conn, "audit_log")) {
                log.info("[AUTH MIGRATION] Creating audit_log table...");
                createAuditLogTable(conn);
                log.info("[AUTH MIGRATION] ✓ audit_log table created");
            } else {
                log.info("[AUTH MIGRATION] audit_log table already exists");
            }

            if (!tableExists(conn, "system_settings")) {
                log.info("[AUTH MIGRATION] Creating system_settings table...");
                createSystemSettingsTable(conn);
                insertDefaultSettings(conn);
                log.info("[AUTH MIGRATION] ✓ system_settings table created");
            } else {
                log.info("[AUTH MIGRATION] system_settings table already exists");
            }

            log.info("[AUTH MIGRATION] Migration completed successfully");

        } catch (SQLException e) {
            log.error("[AUTH MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Auth schema migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void createUsersTable(Connection conn) throws SQLException {
        String sql = """
            CREATE TABLE users (
                user_id VARCHAR(20) PRIMARY KEY,
                username VARCHAR(50) NOT NULL UNIQUE,
                email VARCHAR(254) UNIQUE,
                display_name VARCHAR(100),
                timezone VARCHAR(64) NOT NULL DEFAULT 'America/New_York',
                password_hash TEXT NOT NULL,

                role VARCHAR(10) NOT NULL DEFAULT 'PENDING',
                is_active BOOLEAN NOT NULL DEFAULT FALSE,

                -- Lockout
                failed_login_attempts INT NOT NULL DEFAULT 0,
                locked_until TIMESTAMPTZ,
                last_login_at TIMESTAMPTZ,

                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),

                CONSTRAINT users_role_check CHECK (role IN ('PENDING', 'USER', 'ADMIN')),
                CONSTRAINT users_pending_inactive CHECK (role <> 'PENDING' OR is_active = FALSE),
                CONSTRAINT users_attempts_non_negative CHECK (failed_login_attempts >= 0)
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate(sql);
            stmt.executeUpdate("CREATE INDEX idx_users_role ON users(role)");
        }
    }

    private void createAuditLogTable(Connection conn) throws SQLException {
        String sql = """
            CREATE TABLE audit_log (
                id BIGSERIAL PRIMARY KEY,
                user_id VARCHAR(20),
                action VARCHAR(40) NOT NULL,
                resource VARCHAR(40),
                details JSONB NOT NULL DEFAULT '{}'::jsonb,
                ip_address VARCHAR(64),
                user_agent TEXT,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate(sql);
            stmt.executeUpdate("CREATE INDEX idx_audit_log_user_id ON audit_log(user_id)");
            stmt.executeUpdate("CREATE INDEX idx_audit_log_action ON audit_log(action)");
            stmt.executeUpdate("CREATE INDEX idx_audit_log_created_at ON audit_log(created_at)");
        }
    }

    private void createSystemSettingsTable(Connection conn) throws SQLException {
        String sql = """
            CREATE TABLE system_settings (
                id VARCHAR(20) PRIMARY KEY,
                registration_enabled BOOLEAN NOT NULL DEFAULT TRUE,
                site_name VARCHAR(100) NOT NULL DEFAULT 'Brain Log App',
                admin_email VARCHAR(254) NOT NULL DEFAULT 'admin@brainlogapp.com',
                max_failed_logins INT NOT NULL DEFAULT 5,
                lockout_duration_minutes INT NOT NULL DEFAULT 15,
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate(sql);
        }
    }

    private void insertDefaultSettings(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("INSERT INTO system_settings (id) VALUES ('system')");
            log.info("[AUTH MIGRATION] Inserted default system settings row");
        }
    }

    /**
     * Databases created before lockout tracking lack these columns.
     */
    private void updateUsersSchema(Connection conn) throws SQLException {
        addColumnIfNotExists(conn, "users", "failed_login_attempts", "INT NOT NULL DEFAULT 0");
        addColumnIfNotExists(conn, "users", "locked_until", "TIMESTAMPTZ");
        addColumnIfNotExists(conn, "users", "last_login_at", "TIMESTAMPTZ");
        addColumnIfNotExists(conn, "users", "timezone", "VARCHAR(64) NOT NULL DEFAULT 'America/New_York'");
    }

    private void addColumnIfNotExists(Connection conn, String tableName, String columnName,
                                      String columnDef) throws SQLException {
        if (!columnExists(conn, tableName, columnName)) {
            String sql = String.format("ALTER TABLE %s ADD COLUMN %s %s", tableName, columnName, columnDef);

            try (Statement stmt = conn.createStatement()) {
                stmt.executeUpdate(sql);
                log.info("[AUTH MIGRATION] Added column: {}.{}", tableName, columnName);
            }
        }
    }

    private boolean columnExists(Connection conn, String tableName, String columnName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getColumns(null, null, tableName, columnName)) {
            return rs.next();
        }
    }
}
