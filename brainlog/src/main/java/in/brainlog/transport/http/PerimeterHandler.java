package in.brainlog.transport.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import in.brainlog.auth.SessionClaims;
import in.brainlog.auth.SessionCodec;
import in.brainlog.auth.policy.AuthorizationDecision;
import in.brainlog.auth.policy.AuthorizationPolicy;
import in.brainlog.metrics.AuthMetrics;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.AttachmentKey;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Runs before every routed request: verify the session cookie, ask the policy,
 * then redirect, deny or continue with the claims attached to the exchange.
 *
 * Paths under /api/ are programmatic. For them a redirect decision is rendered as
 * JSON (401 towards login, 403 otherwise) carrying the redirect target, since
 * API clients do not follow 302s to HTML pages.
 */
public final class PerimeterHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PerimeterHandler.class);

    public static final AttachmentKey<SessionClaims> CLAIMS = AttachmentKey.create(SessionClaims.class);

    private final SessionCodec codec;
    private final AuthorizationPolicy policy;
    private final SessionCookies cookies;
    private final AuthMetrics metrics;
    private final HttpHandler next;

    public PerimeterHandler(SessionCodec codec, AuthorizationPolicy policy, SessionCookies cookies,
                            AuthMetrics metrics, HttpHandler next) {
        this.codec = codec;
        this.policy = policy;
        this.cookies = cookies;
        this.metrics = metrics;
        this.next = next;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String path = exchange.getRequestPath();
        boolean apiRequest = path.startsWith("/api/");

        Optional<String> token = cookies.read(exchange);
        Optional<SessionClaims> claims = token.flatMap(codec::verify);
        if (token.isPresent() && claims.isEmpty()) {
            // Expired or tampered; drop it so the browser stops sending it
            cookies.clear(exchange);
        }

        AuthorizationDecision decision = policy.authorize(claims, path, apiRequest);
        metrics.recordAuthorization(policy.classify(path).name(), decision.kind().name());

        switch (decision.kind()) {
            case ALLOW -> {
                claims.ifPresent(c -> exchange.putAttachment(CLAIMS, c));
                next.handleRequest(exchange);
            }
            case REDIRECT -> redirect(exchange, decision.target(), apiRequest, path);
            case DENY -> {
                log.info("[PERIMETER] {} {} denied ({})", exchange.getRequestMethod(), path, decision.status());
                HttpSupport.sendError(exchange, decision.status(), "Forbidden");
            }
        }
    }

    private void redirect(HttpServerExchange exchange, String target, boolean apiRequest, String path) {
        log.debug("[PERIMETER] {} -> {}", path, target);

        if (!apiRequest) {
            exchange.setStatusCode(StatusCodes.FOUND);
            exchange.getResponseHeaders().put(Headers.LOCATION, target);
            exchange.endExchange();
            return;
        }

        boolean toLogin = AuthorizationDecision.LOGIN.equals(target);
        ObjectNode body = HttpSupport.MAPPER.createObjectNode();
        body.put("success", false);
        body.put("error", toLogin ? "Unauthorized" : "Forbidden");
        body.put("redirect", target);
        HttpSupport.sendJson(exchange, toLogin ? StatusCodes.UNAUTHORIZED : StatusCodes.FORBIDDEN, body);
    }
}
