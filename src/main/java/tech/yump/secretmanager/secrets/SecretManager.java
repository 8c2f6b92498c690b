package tech.yump.secretmanager.secrets;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage-agnostic access to secret bundles.
 * <p>
 * Implementations differ in where the secret material lives (relational store, Vault owned by the
 * platform, or a customer-owned Vault referenced by {@code path#key} strings) but share this contract,
 * so call sites never depend on the configured backend.
 */
public interface SecretManager {

    /**
     * @return the backend this manager writes to.
     */
    SecretsManagerType getType();

    /**
     * Creates a secret.
     *
     * @param value   key/value content of the secret (for BYOS, {@code path#key} references).
     * @param name    display name; Vault-backed managers sanitize it into a path segment.
     * @param forceDb store the value as plaintext in the relational store, bypassing any Vault.
     * @return the created record, carrying the caller's value.
     */
    SecretRecord createSecret(Map<String, Object> value, String name, boolean forceDb);

    default SecretRecord createSecret(Map<String, Object> value, String name) {
        return createSecret(value, name, false);
    }

    /**
     * @return the record with its resolved value, or empty if no row exists for {@code id}.
     */
    Optional<SecretRecord> getSecret(UUID id);

    /**
     * @return the updated record, or empty if no row exists for {@code id}.
     */
    Optional<SecretRecord> updateSecret(UUID id, Map<String, Object> value);

    /**
     * @return {@code true} if a row was removed, {@code false} if none existed.
     */
    boolean deleteSecret(UUID id);

    default boolean removeSecret(UUID id) {
        return deleteSecret(id);
    }

    /**
     * @throws ConnectivityCheckNotSupportedException if the backend cannot be checked without more context.
     */
    SecretsConnectivityResult checkConnectivity();

    SecretManagerDebugInfo getUserVisibleDebugInfo();
}
