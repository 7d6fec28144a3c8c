package in.brainlog.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.brainlog.auth.RequestMeta;
import in.brainlog.auth.SessionClaims;
import in.brainlog.service.admin.AccountAdminException;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.Optional;

/**
 * JSON response and request helpers shared by the HTTP handlers.
 */
final class HttpSupport {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    static final String JSON_CONTENT_TYPE = "application/json; charset=utf-8";

    private HttpSupport() {}

    static void sendJson(HttpServerExchange exchange, int status, JsonNode body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON_CONTENT_TYPE);
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }

    static void sendError(HttpServerExchange exchange, int status, String message) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("success", false);
        body.put("error", message);
        sendJson(exchange, status, body);
    }

    static void sendSuccess(HttpServerExchange exchange, String message) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("success", true);
        body.put("message", message);
        sendJson(exchange, 200, body);
    }

    static void noCache(HttpServerExchange exchange) {
        exchange.getResponseHeaders()
            .put(Headers.CACHE_CONTROL, "no-store, no-cache, must-revalidate, proxy-revalidate, max-age=0")
            .put(Headers.PRAGMA, "no-cache")
            .put(Headers.EXPIRES, "0");
    }

    static int statusFor(AccountAdminException e) {
        return switch (e.getReason()) {
            case NOT_FOUND -> 404;
            case INVALID_STATE, SELF_ACTION -> 400;
            case REGISTRATION_DISABLED -> 403;
            case CONFLICT -> 409;
        };
    }

    static Optional<SessionClaims> claims(HttpServerExchange exchange) {
        return Optional.ofNullable(exchange.getAttachment(PerimeterHandler.CLAIMS));
    }

    static String pathParam(HttpServerExchange exchange, String name) {
        PathTemplateMatch match = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY);
        return match != null ? match.getParameters().get(name) : null;
    }

    static String queryParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values != null ? values.peekFirst() : null;
    }

    /**
     * Peer address of the exchange. X-Forwarded-For is never read here; behind a trusted
     * proxy the source address has already been rewritten by ProxyPeerAddressHandler.
     */
    static RequestMeta requestMeta(HttpServerExchange exchange) {
        String ip = null;
        InetSocketAddress peer = exchange.getSourceAddress();
        if (peer != null) {
            ip = peer.getAddress() != null ? peer.getAddress().getHostAddress() : peer.getHostString();
        }
        String userAgent = exchange.getRequestHeaders().getFirst(Headers.USER_AGENT);
        return new RequestMeta(ip, userAgent);
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
