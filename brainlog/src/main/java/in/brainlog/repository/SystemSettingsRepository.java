package in.brainlog.repository;

import in.brainlog.config.SystemSettings;

import java.util.Optional;

/**
 * Settings row stored alongside the user directory; failures raise
 * {@link UserDirectoryException}.
 */
public interface SystemSettingsRepository {

    Optional<SystemSettings> load();

    void save(SystemSettings settings);
}
