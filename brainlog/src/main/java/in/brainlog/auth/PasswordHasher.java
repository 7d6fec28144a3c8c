package in.brainlog.auth;

import in.brainlog.config.SecurityPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * PBKDF2-HMAC-SHA256 password hashing.
 *
 * Encoded format: {@code PBKDF2:<iterations>:<salt base64>:<key base64>}.
 * The iteration count travels with the hash, so raising the work factor only
 * affects new hashes; old ones verify at their original cost.
 *
 * Stateless and thread-safe.
 */
public final class PasswordHasher {
    private static final Logger log = LoggerFactory.getLogger(PasswordHasher.class);
    private static final SecureRandom RANDOM = new SecureRandom();

    public static final String ALGORITHM_TAG = "PBKDF2";
    private static final String JCE_ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final int KEY_BYTES = 32;
    private static final int MAX_ITERATIONS = 10_000_000;
    private static final int MAX_KEY_BYTES = 128;
    private static final byte[] DUMMY_SALT = new byte[SecurityPolicy.DEFAULT_SALT_BYTES];
    private static final String DUMMY_PASSWORD = "timing-equalizer";

    private final int iterations;
    private final int saltBytes;

    public PasswordHasher(SecurityPolicy policy) {
        this.iterations = policy.pbkdf2Iterations();
        this.saltBytes = policy.saltBytes();
    }

    /**
     * Hash a password with a fresh random salt.
     *
     * @throws IllegalStateException if the JCE provider cannot derive keys (fatal)
     */
    public String hash(String password) {
        if (password == null) {
            throw new IllegalArgumentException("password is required");
        }

        byte[] salt = new byte[saltBytes];
        RANDOM.nextBytes(salt);

        byte[] key;
        try {
            key = derive(password, salt, iterations, KEY_BYTES);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to hash password", e);
        }

        Base64.Encoder b64 = Base64.getEncoder();
        return ALGORITHM_TAG + ":" + iterations + ":" + b64.encodeToString(salt) + ":" + b64.encodeToString(key);
    }

    /**
     * Verify a password against a stored encoding.
     * Never throws: malformed or unrecognised encodings return false after
     * spending the same derivation cost as a wrong password.
     */
    public boolean verify(String password, String encodedHash) {
        if (password == null) {
            burnDerivation();
            return false;
        }

        ParsedHash parsed = parse(encodedHash);
        if (parsed == null) {
            log.debug("Stored password hash is malformed or uses an unknown algorithm");
            burnDerivation();
            return false;
        }

        try {
            byte[] actual = derive(password, parsed.salt(), parsed.iterations(), parsed.key().length);
            return constantTimeEquals(parsed.key(), actual);
        } catch (GeneralSecurityException | RuntimeException e) {
            log.warn("Password verification error: {}", e.getClass().getSimpleName());
            return false;
        }
    }

    /**
     * Iteration count stored in an encoding, or -1 when it cannot be parsed.
     */
    public static int storedIterations(String encodedHash) {
        ParsedHash parsed = parse(encodedHash);
        return parsed != null ? parsed.iterations() : -1;
    }

    /**
     * XOR-accumulating comparison. A length mismatch fails immediately; lengths are
     * not secret.
     */
    static boolean constantTimeEquals(byte[] expected, byte[] actual) {
        if (expected == null || actual == null || expected.length != actual.length) {
            return false;
        }
        int diff = 0;
        for (int i = 0; i < expected.length; i++) {
            diff |= expected[i] ^ actual[i];
        }
        return diff == 0;
    }

    private static ParsedHash parse(String encodedHash) {
        if (encodedHash == null || encodedHash.isEmpty()) {
            return null;
        }

        String[] parts = encodedHash.split(":", -1);
        if (parts.length != 4 || !ALGORITHM_TAG.equals(parts[0])) {
            return null;
        }

        int storedIterations;
        try {
            storedIterations = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            return null;
        }
        if (storedIterations < 1 || storedIterations > MAX_ITERATIONS) {
            return null;
        }

        byte[] salt;
        byte[] key;
        try {
            salt = Base64.getDecoder().decode(parts[2]);
            key = Base64.getDecoder().decode(parts[3]);
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (salt.length == 0 || key.length == 0 || key.length > MAX_KEY_BYTES) {
            return null;
        }

        return new ParsedHash(storedIterations, salt, key);
    }

    private static byte[] derive(String password, byte[] salt, int rounds, int keyBytes)
            throws GeneralSecurityException {
        char[] chars = password.toCharArray();
        PBEKeySpec spec = new PBEKeySpec(chars, salt, rounds, keyBytes * 8);
        try {
            return SecretKeyFactory.getInstance(JCE_ALGORITHM).generateSecret(spec).getEncoded();
        } finally {
            spec.clearPassword();
            Arrays.fill(chars, '\0');
        }
    }

    private void burnDerivation() {
        try {
            derive(DUMMY_PASSWORD, DUMMY_SALT, iterations, KEY_BYTES);
        } catch (GeneralSecurityException | RuntimeException e) {
            log.warn("Dummy derivation failed: {}", e.getClass().getSimpleName());
        }
    }

    private record ParsedHash(int iterations, byte[] salt, byte[] key) {
    }
}
