package in.brainlog.auth;

/**
 * Client address and user agent, carried into audit events. Both may be null.
 */
public record RequestMeta(String ipAddress, String userAgent) {

    public static RequestMeta unknown() {
        return new RequestMeta(null, null);
    }
}
