package in.brainlog.auth.policy;

/**
 * Perimeter outcome. {@code target} is set only for REDIRECT, {@code status} only for DENY.
 */
public record AuthorizationDecision(Kind kind, String target, int status) {

    public static final String LOGIN = "/login";
    public static final String HOME = "/";
    public static final String PENDING = "/pending";

    public enum Kind { ALLOW, REDIRECT, DENY }

    private static final AuthorizationDecision ALLOW = new AuthorizationDecision(Kind.ALLOW, null, 0);

    public static AuthorizationDecision allow() {
        return ALLOW;
    }

    public static AuthorizationDecision redirect(String target) {
        return new AuthorizationDecision(Kind.REDIRECT, target, 0);
    }

    public static AuthorizationDecision deny(int status) {
        return new AuthorizationDecision(Kind.DENY, null, status);
    }

    public static AuthorizationDecision forbidden() {
        return deny(403);
    }

    public boolean isAllowed() {
        return kind == Kind.ALLOW;
    }
}
