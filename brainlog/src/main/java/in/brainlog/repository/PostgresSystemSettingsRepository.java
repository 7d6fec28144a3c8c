package in.brainlog.repository;

import in.brainlog.config.SystemSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Single-row settings table keyed by id 'system'.
 */
public final class PostgresSystemSettingsRepository implements SystemSettingsRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresSystemSettingsRepository.class);

    static final String SETTINGS_ID = "system";

    private final DataSource dataSource;

    public PostgresSystemSettingsRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<SystemSettings> load() {
        String sql = """
                SELECT registration_enabled, site_name, admin_email,
                       max_failed_logins, lockout_duration_minutes
                FROM system_settings
                WHERE id = ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, SETTINGS_ID);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new SystemSettings(
                        rs.getBoolean("registration_enabled"),
                        rs.getString("site_name"),
                        rs.getString("admin_email"),
                        rs.getInt("max_failed_logins"),
                        rs.getInt("lockout_duration_minutes")
                    ));
                }
            }
        } catch (SQLException e) {
            log.error("Error loading system settings: {}", e.getMessage());
            throw new UserDirectoryException("Failed to load system settings", e);
        }

        return Optional.empty();
    }

    @Override
    public void save(SystemSettings settings) {
        String sql = """
                INSERT INTO system_settings (
                    id, registration_enabled, site_name, admin_email,
                    max_failed_logins, lockout_duration_minutes, updated_at
                ) VALUES (?, ?, ?, ?, ?, ?, NOW())
                ON CONFLICT (id) DO UPDATE SET
                    registration_enabled = EXCLUDED.registration_enabled,
                    site_name = EXCLUDED.site_name,
                    admin_email = EXCLUDED.admin_email,
                    max_failed_logins = EXCLUDED.max_failed_logins,
                    lockout_duration_minutes = EXCLUDED.lockout_duration_minutes,
                    updated_at = NOW()
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, SETTINGS_ID);
            ps.setBoolean(2, settings.registrationEnabled());
            ps.setString(3, settings.siteName());
            ps.setString(4, settings.adminEmail());
            ps.setInt(5, settings.maxFailedLogins());
            ps.setInt(6, settings.lockoutDurationMinutes());

            ps.executeUpdate();
            log.info("System settings saved: registrationEnabled={} maxFailedLogins={} lockoutMinutes={}",
                settings.registrationEnabled(), settings.maxFailedLogins(), settings.lockoutDurationMinutes());

        } catch (SQLException e) {
            log.error("Error saving system settings: {}", e.getMessage());
            throw new UserDirectoryException("Failed to save system settings", e);
        }
    }
}
