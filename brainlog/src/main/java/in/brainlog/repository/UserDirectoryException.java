package in.brainlog.repository;

/**
 * User directory unreachable, timed out, or returned an invalid row.
 */
public class UserDirectoryException extends RuntimeException {

    public UserDirectoryException(String message, Throwable cause) {
        super(message, cause);
    }

    public UserDirectoryException(String message) {
        super(message);
    }
}
