package in.brainlog.auth.policy;

import in.brainlog.auth.SessionClaims;

import java.util.Optional;

/**
 * Route protection over the pending / inactive / active / admin lifecycle.
 *
 * Pure function of (claims, path, request kind). Programmatic endpoints get
 * DENY(403) where a browsable page would be redirected instead:
 * <pre>
 *               Anonymous  Pending          InactiveUser     ActiveUser       ActiveAdmin
 * PUBLIC        allow      home             home             home             home
 * PENDING_PAGE  login      allow            login            home             home
 * ADMIN         login      pending          403 | login      403 | home       allow
 * PROTECTED     login      pending          403 | login      allow            allow
 * </pre>
 * Auth infrastructure under /api/auth/ is always allowed.
 */
public final class AuthorizationPolicy {

    private final RouteTable routes;

    public AuthorizationPolicy(RouteTable routes) {
        this.routes = routes;
    }

    public AuthorizationDecision authorize(Optional<SessionClaims> claims, String path, boolean apiRequest) {
        if (routes.isAuthInfrastructure(path)) {
            return AuthorizationDecision.allow();
        }
        return decide(AccessState.of(claims), routes.classify(path), apiRequest);
    }

    public PathClass classify(String path) {
        return routes.classify(path);
    }

    static AuthorizationDecision decide(AccessState state, PathClass pathClass, boolean apiRequest) {
        return switch (pathClass) {
            case PUBLIC -> state == AccessState.ANONYMOUS
                ? AuthorizationDecision.allow()
                : AuthorizationDecision.redirect(AuthorizationDecision.HOME);

            case PENDING_PAGE -> switch (state) {
                case PENDING -> AuthorizationDecision.allow();
                case ANONYMOUS, INACTIVE_USER -> AuthorizationDecision.redirect(AuthorizationDecision.LOGIN);
                case ACTIVE_USER, ACTIVE_ADMIN -> AuthorizationDecision.redirect(AuthorizationDecision.HOME);
            };

            case ADMIN -> switch (state) {
                case ANONYMOUS -> AuthorizationDecision.redirect(AuthorizationDecision.LOGIN);
                case PENDING -> AuthorizationDecision.redirect(AuthorizationDecision.PENDING);
                case INACTIVE_USER -> apiRequest
                    ? AuthorizationDecision.forbidden()
                    : AuthorizationDecision.redirect(AuthorizationDecision.LOGIN);
                case ACTIVE_USER -> apiRequest
                    ? AuthorizationDecision.forbidden()
                    : AuthorizationDecision.redirect(AuthorizationDecision.HOME);
                case ACTIVE_ADMIN -> AuthorizationDecision.allow();
            };

            case PROTECTED -> switch (state) {
                case ANONYMOUS -> AuthorizationDecision.redirect(AuthorizationDecision.LOGIN);
                case PENDING -> AuthorizationDecision.redirect(AuthorizationDecision.PENDING);
                case INACTIVE_USER -> apiRequest
                    ? AuthorizationDecision.forbidden()
                    : AuthorizationDecision.redirect(AuthorizationDecision.LOGIN);
                case ACTIVE_USER, ACTIVE_ADMIN -> AuthorizationDecision.allow();
            };
        };
    }
}
