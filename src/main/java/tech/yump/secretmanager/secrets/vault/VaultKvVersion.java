package tech.yump.secretmanager.secrets.vault;

import java.util.Arrays;
import java.util.Optional;

/**
 * Vault KV secrets engine protocol. v2 nests payloads under {@code data} and keeps versions
 * behind a separate {@code metadata} path.
 */
public enum VaultKvVersion {
    V1("1", "secret/archestra"),
    V2("2", "secret/data/archestra");

    private final String setting;
    private final String defaultSecretPath;

    VaultKvVersion(String setting, String defaultSecretPath) {
        this.setting = setting;
        this.defaultSecretPath = defaultSecretPath;
    }

    public String setting() {
        return setting;
    }

    public String defaultSecretPath() {
        return defaultSecretPath;
    }

    public static Optional<VaultKvVersion> fromSetting(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values()).filter(v -> v.setting.equals(trimmed)).findFirst();
    }
}
