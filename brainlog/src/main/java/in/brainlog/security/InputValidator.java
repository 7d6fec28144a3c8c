package in.brainlog.security;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.regex.Pattern;

/**
 * Validates account input taken from request bodies (registration, admin forms).
 *
 * Validation Rules:
 * - Username: 3-50 characters, letters, digits and . _ -
 * - Email: local@domain.tld, no whitespace
 * - Password: 8-256 characters
 * - Display name: required, at most 100 characters, no markup
 * - Timezone: optional, must be a known zone id
 *
 * All validate* methods throw {@link IllegalArgumentException} with a message
 * that is safe to return to the client.
 */
public class InputValidator {

    public static final int MIN_USERNAME_LENGTH = 3;
    public static final int MAX_USERNAME_LENGTH = 50;
    public static final int MIN_PASSWORD_LENGTH = 8;
    public static final int MAX_PASSWORD_LENGTH = 256;
    private static final int MAX_DISPLAY_NAME_LENGTH = 100;
    private static final int MAX_STRING_LENGTH = 1000;

    private static final Pattern USERNAME_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private static final Pattern XSS_PATTERN =
        Pattern.compile(".*(<script|javascript:|onerror=|onload=|<iframe|<object|<embed).*",
            Pattern.CASE_INSENSITIVE);

    public void validateUsername(String username) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username is required");
        }
        if (username.length() < MIN_USERNAME_LENGTH) {
            throw new IllegalArgumentException("Username must be at least " + MIN_USERNAME_LENGTH + " characters");
        }
        if (username.length() > MAX_USERNAME_LENGTH) {
            throw new IllegalArgumentException("Username must be at most " + MAX_USERNAME_LENGTH + " characters");
        }
        if (!USERNAME_PATTERN.matcher(username).matches()) {
            throw new IllegalArgumentException("Username may only contain letters, digits, '.', '_' and '-'");
        }
    }

    public void validateEmail(String email) {
        if (!isValidEmail(email)) {
            throw new IllegalArgumentException("Please enter a valid email address");
        }
    }

    public void validatePassword(String password) {
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new IllegalArgumentException("Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        if (password.length() > MAX_PASSWORD_LENGTH) {
            throw new IllegalArgumentException("Password must be at most " + MAX_PASSWORD_LENGTH + " characters");
        }
    }

    /**
     * @return the sanitized display name
     */
    public String validateDisplayName(String displayName) {
        String clean = sanitize(displayName);
        if (clean == null || clean.isBlank()) {
            throw new IllegalArgumentException("Display name is required");
        }
        if (clean.length() > MAX_DISPLAY_NAME_LENGTH) {
            throw new IllegalArgumentException("Display name must be at most " + MAX_DISPLAY_NAME_LENGTH + " characters");
        }
        if (containsXss(clean)) {
            throw new IllegalArgumentException("Display name contains invalid content");
        }
        return clean;
    }

    /**
     * @return the zone id, or null when none was supplied
     */
    public String validateTimezone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return null;
        }
        try {
            return ZoneId.of(timezone.trim()).getId();
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown timezone: " + sanitize(timezone));
        }
    }

    public boolean isValidEmail(String email) {
        if (email == null || email.isBlank() || email.length() > 254) {
            return false;
        }
        return EMAIL_PATTERN.matcher(email).matches();
    }

    public boolean containsXss(String input) {
        if (input == null || input.isBlank()) {
            return false;
        }
        return XSS_PATTERN.matcher(input).matches();
    }

    /**
     * Trim, drop control characters, cap length.
     */
    public String sanitize(String input) {
        if (input == null) {
            return null;
        }

        String result = input.trim();
        result = result.replaceAll("\\p{Cntrl}", "");

        if (result.length() > MAX_STRING_LENGTH) {
            result = result.substring(0, MAX_STRING_LENGTH);
        }
        return result;
    }
}
