package in.brainlog.auth.policy;

public enum PathClass {
    PUBLIC,
    PENDING_PAGE,
    ADMIN,
    PROTECTED
}
