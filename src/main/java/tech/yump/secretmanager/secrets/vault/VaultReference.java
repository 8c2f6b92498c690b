package tech.yump.secretmanager.secrets.vault;

/**
 * A parsed {@code path#key} reference to one field of a secret in an external Vault.
 * Only the string form is persisted; it is re-parsed on every resolution.
 */
public record VaultReference(String path, String key) {

    private static final char SEPARATOR = '#';
    private static final int MIN_PATH_LENGTH = 6;

    /**
     * Splits at the first {@code #}.
     *
     * @throws IllegalArgumentException if {@code reference} has no {@code #}.
     */
    public static VaultReference parse(String reference) {
        int idx = reference == null ? -1 : reference.indexOf(SEPARATOR);
        if (idx < 0) {
            throw new IllegalArgumentException("Not a Vault reference (expected path#key)");
        }
        return new VaultReference(reference.substring(0, idx), reference.substring(idx + 1));
    }

    /**
     * Loose shape check used before accepting user input as a reference: a {@code #} preceded by
     * something path-like (contains {@code /}, longer than five characters).
     */
    public static boolean isReference(String value) {
        if (value == null) {
            return false;
        }
        int idx = value.indexOf(SEPARATOR);
        if (idx < 0) {
            return false;
        }
        String path = value.substring(0, idx);
        return path.contains("/") && path.length() >= MIN_PATH_LENGTH;
    }

    @Override
    public String toString() {
        return path + SEPARATOR + key;
    }
}
