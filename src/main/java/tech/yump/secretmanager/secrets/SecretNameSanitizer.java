package tech.yump.secretmanager.secrets;

import java.util.regex.Pattern;

/**
 * Turns a display name into a Vault path segment: 1-64 ASCII letters, digits or underscores,
 * starting with a letter or underscore.
 */
public final class SecretNameSanitizer {

    static final String DEFAULT_NAME = "secret";
    static final int MAX_LENGTH = 64;

    private static final Pattern DISALLOWED_CHARS = Pattern.compile("[^A-Za-z0-9_]");
    private static final Pattern VALID_START = Pattern.compile("^[A-Za-z_]");

    private SecretNameSanitizer() {
    }

    public static String sanitize(String name) {
        if (name == null || name.trim().isEmpty()) {
            return DEFAULT_NAME;
        }
        String sanitized = DISALLOWED_CHARS.matcher(name.trim()).replaceAll("_");
        if (!VALID_START.matcher(sanitized).find()) {
            sanitized = "_" + sanitized;
        }
        return sanitized.length() > MAX_LENGTH ? sanitized.substring(0, MAX_LENGTH) : sanitized;
    }
}
