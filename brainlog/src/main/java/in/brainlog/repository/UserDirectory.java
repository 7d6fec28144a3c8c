package in.brainlog.repository;

import in.brainlog.domain.user.UserRecord;
import in.brainlog.domain.user.UserRole;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * User record store. All methods throw {@link UserDirectoryException} when the
 * backing store is unreachable or times out.
 */
public interface UserDirectory {

    Optional<UserRecord> findByUsername(String username);

    Optional<UserRecord> findById(String userId);

    List<UserRecord> findAll();

    boolean existsByUsername(String username);

    boolean existsByEmail(String email);

    void create(UserRecord user);

    /**
     * Atomically record one failed password check.
     *
     * The counter is incremented only if the account is not locked at {@code now}.
     * When the new count reaches {@code lockThreshold}, {@code lockedUntil} is set to
     * {@code lockUntil} in the same update, so concurrent failures cannot overshoot
     * the threshold.
     *
     * @return the new counter value, or empty if the account was locked (or vanished)
     */
    OptionalInt incrementFailedLogins(String userId, int lockThreshold, Instant lockUntil, Instant now);

    void resetFailedLogins(String userId);

    void setLockout(String userId, Instant until);

    void clearLockout(String userId);

    void updateLastLogin(String userId, Instant at);

    /**
     * @return true if a row was updated
     */
    boolean updateRoleAndStatus(String userId, UserRole role, boolean active);
}
