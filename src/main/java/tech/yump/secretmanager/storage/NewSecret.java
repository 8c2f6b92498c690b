package tech.yump.secretmanager.storage;

import java.util.Map;

/**
 * Column values for a row about to be inserted. Id and timestamps are assigned by the repository.
 */
public record NewSecret(
        String name,
        Map<String, Object> value,
        boolean isVault,
        boolean isByosVault
) {
    public NewSecret {
        if (isVault && isByosVault) {
            throw new IllegalArgumentException("A secret cannot be both Vault-owned and a BYOS reference");
        }
        value = value == null ? Map.of() : value;
    }

    public static NewSecret plaintext(String name, Map<String, Object> value) {
        return new NewSecret(name, value, false, false);
    }

    public static NewSecret vaultPlaceholder(String name) {
        return new NewSecret(name, Map.of(), true, false);
    }

    public static NewSecret byosReferences(String name, Map<String, Object> references) {
        return new NewSecret(name, references, false, true);
    }
}
