package in.brainlog.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.brainlog.config.SecurityPolicy;
import in.brainlog.domain.user.UserRecord;
import in.brainlog.domain.user.UserRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Base64;
import java.util.Optional;

/**
 * Signed session tokens (HS256 JWT).
 *
 * Verification is pure: no directory access, no shared mutable state. Any structural,
 * signature, version or expiry problem yields an empty result. The signing key is
 * copied at construction and never logged.
 */
public final class SessionCodec {
    private static final Logger log = LoggerFactory.getLogger(SessionCodec.class);

    public static final int MIN_KEY_BYTES = 32;
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String JWT_ALGORITHM = "HS256";

    private static final Base64.Encoder B64_ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder B64_DECODER = Base64.getUrlDecoder();

    private final SecretKeySpec signingKey;
    private final Duration maxAge;
    private final Duration refreshWindow;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String encodedHeader;

    public SessionCodec(byte[] key, SecurityPolicy policy, Clock clock) {
        if (key == null || key.length < MIN_KEY_BYTES) {
            throw new IllegalArgumentException("Session signing key must be at least " + MIN_KEY_BYTES + " bytes");
        }
        byte[] copy = Arrays.copyOf(key, key.length);
        this.signingKey = new SecretKeySpec(copy, HMAC_ALGORITHM);
        Arrays.fill(copy, (byte) 0);
        this.maxAge = policy.sessionMaxAge();
        this.refreshWindow = policy.sessionRefreshWindow();
        this.clock = clock;

        ObjectNode header = mapper.createObjectNode();
        header.put("alg", JWT_ALGORITHM);
        header.put("typ", "JWT");
        this.encodedHeader = encode(header);
    }

    public static SessionCodec fromSecret(String secret, SecurityPolicy policy, Clock clock) {
        if (secret == null) {
            throw new IllegalArgumentException("Session secret is required");
        }
        return new SessionCodec(secret.getBytes(StandardCharsets.UTF_8), policy, clock);
    }

    public String issue(Principal principal) {
        return issue(principal.userId(), principal.role(), principal.active(), principal.timezone());
    }

    /**
     * Re-issue a session from the directory's current view of the user.
     */
    public String refresh(SessionClaims claims, UserRecord current) {
        if (!claims.userId().equals(current.userId())) {
            throw new IllegalArgumentException("Refresh must target the session's own user");
        }
        return issue(current.userId(), current.role(), current.active(), current.timezone());
    }

    public Optional<SessionClaims> verify(String token) {
        if (token == null || token.isEmpty()) {
            return Optional.empty();
        }

        try {
            String[] parts = token.split("\\.", -1);
            if (parts.length != 3) {
                log.debug("Invalid token format");
                return Optional.empty();
            }

            JsonNode header = mapper.readTree(B64_DECODER.decode(parts[0]));
            if (header == null || !JWT_ALGORITHM.equals(header.path("alg").asText(null))) {
                log.debug("Unsupported token algorithm");
                return Optional.empty();
            }

            byte[] expectedSig = sign(parts[0] + "." + parts[1]);
            byte[] actualSig = B64_DECODER.decode(parts[2]);
            if (!MessageDigest.isEqual(expectedSig, actualSig)) {
                log.debug("Invalid token signature");
                return Optional.empty();
            }

            JsonNode payload = mapper.readTree(B64_DECODER.decode(parts[1]));
            SessionClaims claims = readClaims(payload);
            if (claims == null) {
                return Optional.empty();
            }

            if (claims.isExpiredAt(clock.instant())) {
                log.debug("Token expired");
                return Optional.empty();
            }

            return Optional.of(claims);

        } catch (Exception e) {
            log.debug("Token validation error: {}", e.getClass().getSimpleName());
            return Optional.empty();
        }
    }

    public Duration maxAge() {
        return maxAge;
    }

    public Duration refreshWindow() {
        return refreshWindow;
    }

    private String issue(String userId, UserRole role, boolean active, String timezone) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant exp = now.plus(maxAge);

        ObjectNode payload = mapper.createObjectNode();
        payload.put("v", SessionClaims.CURRENT_VERSION);
        payload.put("sub", userId);
        payload.put("role", role.name());
        payload.put("active", active);
        payload.put("tz", timezone);
        payload.put("iat", now.getEpochSecond());
        payload.put("exp", exp.getEpochSecond());

        String signingInput = encodedHeader + "." + encode(payload);
        return signingInput + "." + B64_ENCODER.encodeToString(sign(signingInput));
    }

    private SessionClaims readClaims(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return null;
        }

        JsonNode version = payload.get("v");
        if (version == null || !version.isInt() || version.intValue() != SessionClaims.CURRENT_VERSION) {
            log.debug("Unsupported claims version");
            return null;
        }

        JsonNode sub = payload.get("sub");
        JsonNode role = payload.get("role");
        JsonNode active = payload.get("active");
        JsonNode tz = payload.get("tz");
        JsonNode iat = payload.get("iat");
        JsonNode exp = payload.get("exp");
        if (sub == null || !sub.isTextual() || sub.asText().isBlank()
                || role == null || !role.isTextual()
                || active == null || !active.isBoolean()
                || tz == null || !tz.isTextual()
                || iat == null || !iat.canConvertToLong()
                || exp == null || !exp.canConvertToLong()) {
            log.debug("Missing required claims");
            return null;
        }

        UserRole parsedRole = UserRole.fromString(role.asText());
        if (parsedRole == null) {
            log.debug("Unknown role claim");
            return null;
        }

        return new SessionClaims(
            version.intValue(),
            sub.asText(),
            parsedRole,
            active.booleanValue(),
            tz.asText(),
            Instant.ofEpochSecond(iat.longValue()),
            Instant.ofEpochSecond(exp.longValue())
        );
    }

    private byte[] sign(String data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(signingKey);
            return mac.doFinal(data.getBytes(StandardCharsets.US_ASCII));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign session token", e);
        }
    }

    private String encode(JsonNode node) {
        try {
            return B64_ENCODER.encodeToString(mapper.writeValueAsBytes(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode session token", e);
        }
    }
}
