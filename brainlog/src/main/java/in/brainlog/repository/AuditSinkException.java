package in.brainlog.repository;

public class AuditSinkException extends RuntimeException {

    public AuditSinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
