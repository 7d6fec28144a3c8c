package in.brainlog.service.admin;

/**
 * Self-service sign-up form. timezone is optional.
 */
public record RegistrationRequest(
    String username,
    String email,
    String password,
    String displayName,
    String timezone
) {
    @Override
    public String toString() {
        return "RegistrationRequest[username=" + username + ", email=" + email + "]";
    }
}
