package tech.yump.secretmanager.secrets;

import java.util.Locale;

/**
 * Storage backend a {@link SecretManager} writes secret material to.
 */
public enum SecretsManagerType {
    DB,
    VAULT,
    BYOS_VAULT;

    /**
     * Maps the deployment setting onto a backend type. Unknown or missing values select {@link #DB}.
     * {@code READONLY_VAULT} is the deployment name of the bring-your-own-secrets mode.
     */
    public static SecretsManagerType fromSetting(String value) {
        if (value == null) {
            return DB;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "VAULT" -> VAULT;
            case "READONLY_VAULT", "BYOS_VAULT" -> BYOS_VAULT;
            default -> DB;
        };
    }
}
