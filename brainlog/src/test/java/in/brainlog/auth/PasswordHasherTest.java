package in.brainlog.auth;

import in.brainlog.config.SecurityPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Password Hasher Tests")
class PasswordHasherTest {

    private PasswordHasher hasher;

    @BeforeEach
    void setUp() {
        hasher = new PasswordHasher(SecurityPolicy.defaults().withIterations(1_000));
    }

    @Test
    @DisplayName("Hash verifies against the original password only")
    void testHashAndVerify() {
        String encoded = hasher.hash("correct horse battery staple");

        assertTrue(hasher.verify("correct horse battery staple", encoded));
        assertFalse(hasher.verify("correct horse battery stapl", encoded));
        assertFalse(hasher.verify("", encoded));
    }

    @Test
    @DisplayName("Encoding carries algorithm tag and iteration count")
    void testEncodingFormat() {
        String encoded = hasher.hash("password123");
        String[] parts = encoded.split(":");

        assertEquals(4, parts.length);
        assertEquals("PBKDF2", parts[0]);
        assertEquals("1000", parts[1]);
        assertEquals(1_000, PasswordHasher.storedIterations(encoded));
    }

    @Test
    @DisplayName("Same password hashes differently each time")
    void testSaltIsRandom() {
        String a = hasher.hash("password123");
        String b = hasher.hash("password123");

        assertNotEquals(a, b);
        assertTrue(hasher.verify("password123", a));
        assertTrue(hasher.verify("password123", b));
    }

    @Test
    @DisplayName("Hashes made with an older work factor still verify")
    void testOldIterationCountStillVerifies() {
        PasswordHasher older = new PasswordHasher(SecurityPolicy.defaults().withIterations(500));
        String encoded = older.hash("password123");

        assertTrue(hasher.verify("password123", encoded));
        assertEquals(500, PasswordHasher.storedIterations(encoded));
    }

    @Test
    @DisplayName("Malformed encodings are rejected without throwing")
    void testMalformedEncodings() {
        assertFalse(hasher.verify("password123", null));
        assertFalse(hasher.verify("password123", ""));
        assertFalse(hasher.verify("password123", "not-a-hash"));
        assertFalse(hasher.verify("password123", "BCRYPT:1000:c2FsdA==:a2V5"));
        assertFalse(hasher.verify("password123", "PBKDF2:abc:c2FsdA==:a2V5"));
        assertFalse(hasher.verify("password123", "PBKDF2:0:c2FsdA==:a2V5"));
        assertFalse(hasher.verify("password123", "PBKDF2:1000:!!!:a2V5"));
        assertFalse(hasher.verify("password123", "PBKDF2:1000:c2FsdA=="));
        assertFalse(hasher.verify(null, hasher.hash("password123")));
        assertEquals(-1, PasswordHasher.storedIterations("garbage"));
    }

    @Test
    @DisplayName("Null password cannot be hashed")
    void testHashRejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> hasher.hash(null));
    }

    @Test
    @DisplayName("Constant-time comparison")
    void testConstantTimeEquals() {
        assertTrue(PasswordHasher.constantTimeEquals(new byte[]{1, 2, 3}, new byte[]{1, 2, 3}));
        assertFalse(PasswordHasher.constantTimeEquals(new byte[]{1, 2, 3}, new byte[]{1, 2, 4}));
        assertFalse(PasswordHasher.constantTimeEquals(new byte[]{1, 2, 3}, new byte[]{1, 2}));
        assertFalse(PasswordHasher.constantTimeEquals(null, new byte[]{1}));
    }
}
