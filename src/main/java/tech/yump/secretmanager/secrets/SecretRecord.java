package tech.yump.secretmanager.secrets;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A persisted secret row, optionally merged with the value resolved from Vault.
 * <p>
 * What {@code value} holds depends on the backend: plaintext for database rows, an empty
 * placeholder for Vault-owned rows as stored, and {@code path#key} references for BYOS rows as stored.
 */
public record SecretRecord(
        UUID id,
        String name,
        Map<String, Object> value,
        boolean isVault,
        boolean isByosVault,
        Instant createdAt,
        Instant updatedAt
) {

    public SecretRecord {
        // LinkedHashMap rather than Map.copyOf: JSON payloads may carry null values
        value = value == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(value));
    }

    /**
     * Returns a copy of this record carrying {@code newValue}, with every other field untouched.
     */
    public SecretRecord withValue(Map<String, Object> newValue) {
        return new SecretRecord(id, name, newValue, isVault, isByosVault, createdAt, updatedAt);
    }

    @Override
    public String toString() {
        // Never print secret material (or BYOS references) in logs
        return "SecretRecord[" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", value=<" + value.size() + " keys masked>" +
                ", isVault=" + isVault +
                ", isByosVault=" + isByosVault +
                ", createdAt=" + createdAt +
                ", updatedAt=" + updatedAt +
                ']';
    }
}
