package in.brainlog.service.admin;

/**
 * Rejected account operation. The message is safe to show to the caller.
 */
public class AccountAdminException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        INVALID_STATE,
        SELF_ACTION,
        REGISTRATION_DISABLED,
        CONFLICT
    }

    private final Reason reason;

    public AccountAdminException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
