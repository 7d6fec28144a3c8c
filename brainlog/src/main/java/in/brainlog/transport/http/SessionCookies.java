package in.brainlog.transport.http;

import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.Cookie;
import io.undertow.server.handlers.CookieImpl;

import java.time.Duration;
import java.util.Date;
import java.util.Optional;

/**
 * Session cookie transport: HttpOnly, SameSite=Lax, Path=/, Secure in production.
 */
public final class SessionCookies {

    public static final String COOKIE_NAME = "brainlog.session-token";

    private final boolean secure;
    private final int maxAgeSeconds;

    public SessionCookies(boolean secure, Duration maxAge) {
        this.secure = secure;
        this.maxAgeSeconds = (int) Math.min(Integer.MAX_VALUE, maxAge.getSeconds());
    }

    public Optional<String> read(HttpServerExchange exchange) {
        Cookie cookie = exchange.getRequestCookie(COOKIE_NAME);
        if (cookie == null || cookie.getValue() == null || cookie.getValue().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(cookie.getValue());
    }

    public void set(HttpServerExchange exchange, String token) {
        exchange.setResponseCookie(base(token).setMaxAge(maxAgeSeconds));
    }

    public void clear(HttpServerExchange exchange) {
        exchange.setResponseCookie(base("").setMaxAge(0).setExpires(new Date(0)));
    }

    private Cookie base(String value) {
        return new CookieImpl(COOKIE_NAME, value)
            .setPath("/")
            .setHttpOnly(true)
            .setSecure(secure)
            .setSameSiteMode("Lax");
    }
}
