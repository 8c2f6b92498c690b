package tech.yump.secretmanager.secrets.vault;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum VaultAuthMethod {
    /** Static token, valid immediately. */
    TOKEN,
    /** Kubernetes service-account JWT exchanged at the kubernetes auth mount. */
    K8S,
    /** SigV4-signed STS GetCallerIdentity request exchanged at the aws auth mount. */
    AWS;

    public static Optional<VaultAuthMethod> fromSetting(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(m -> m.name().equals(normalized)).findFirst();
    }
}
