package in.brainlog.auth;

import java.util.Optional;

/**
 * Outcome of {@link Authenticator#authenticate}. Exactly one of principal / failure is set.
 */
public record AuthResult(Principal principal, AuthFailure failure) {

    public AuthResult {
        if ((principal == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of principal or failure must be set");
        }
    }

    public static AuthResult success(Principal principal) {
        return new AuthResult(principal, null);
    }

    public static AuthResult failure(AuthFailure failure) {
        return new AuthResult(null, failure);
    }

    public boolean isSuccess() {
        return principal != null;
    }

    public Optional<Principal> principalIfPresent() {
        return Optional.ofNullable(principal);
    }
}
