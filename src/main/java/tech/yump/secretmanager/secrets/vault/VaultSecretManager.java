package tech.yump.secretmanager.secrets.vault;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import tech.yump.secretmanager.audit.AuditHelper;
import tech.yump.secretmanager.secrets.SecretManagerDebugInfo;
import tech.yump.secretmanager.secrets.SecretManagerException;
import tech.yump.secretmanager.secrets.SecretNameSanitizer;
import tech.yump.secretmanager.secrets.SecretRecord;
import tech.yump.secretmanager.secrets.SecretsConnectivityResult;
import tech.yump.secretmanager.secrets.SecretsManagerType;
import tech.yump.secretmanager.secrets.vault.auth.VaultLoginStrategies;
import tech.yump.secretmanager.secrets.vault.transport.VaultTransportFactory;
import tech.yump.secretmanager.storage.NewSecret;
import tech.yump.secretmanager.storage.SecretRepository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Keeps secret values in a Vault KV engine owned by the platform; the relational row only holds
 * metadata ({@code isVault=true}, empty value).
 * <p>
 * Cross-store ordering: create inserts the row first and deletes it again if the Vault write fails;
 * update and delete touch Vault first and leave the row alone if that fails.
 */
public class VaultSecretManager extends AbstractVaultSecretManager {

    private static final TypeReference<Map<String, Object>> VALUE_TYPE = new TypeReference<>() {};

    public VaultSecretManager(VaultConfig config,
                              SecretRepository repository,
                              VaultTransportFactory transportFactory,
                              VaultLoginStrategies loginStrategies,
                              ObjectMapper objectMapper,
                              AuditHelper auditHelper) {
        super(config, repository, transportFactory, loginStrategies, objectMapper, auditHelper);
    }

    @Override
    public SecretsManagerType getType() {
        return SecretsManagerType.VAULT;
    }

    @Override
    public SecretRecord createSecret(Map<String, Object> value, String name, boolean forceDb) {
        if (forceDb) {
            log.info("VaultSecretManager.createSecret: forceDb=true, storing '{}' in database", name);
            SecretRecord created = repository.create(NewSecret.plaintext(name, value));
            audit("create_secret", "success", Map.of("secret_id", created.id(), "storage", "database"));
            return created;
        }

        String sanitizedName = SecretNameSanitizer.sanitize(name);
        VaultOutcome<Void> auth = authenticate();
        if (!auth.isSuccess()) {
            throw fail("createSecret", auth.failure(), Map.of("name", sanitizedName));
        }
        String json = toJson(value);

        SecretRecord row = repository.create(NewSecret.vaultPlaceholder(sanitizedName));
        String vaultPath = kvAdapter.secretPath(row.name(), row.id());

        VaultOutcome<Void> write = attemptVoid(() -> transport.write(vaultPath, kvAdapter.writePayload(json)));
        if (!write.isSuccess()) {
            rollbackInsert(row.id(), vaultPath);
            throw fail("createSecret", write.failure(), Map.of("vaultPath", vaultPath));
        }

        log.info("VaultSecretManager.createSecret: secret created at {} (kvVersion {})", vaultPath, kvAdapter.kvVersion().setting());
        audit("create_secret", "success", Map.of("secret_id", row.id(), "vault_path", vaultPath));
        return row.withValue(value);
    }

    @Override
    public Optional<SecretRecord> getSecret(UUID id) {
        Optional<SecretRecord> found = repository.findById(id);
        if (found.isEmpty() || !found.get().isVault()) {
            return found;
        }
        SecretRecord row = found.get();

        VaultOutcome<Void> auth = authenticate();
        if (!auth.isSuccess()) {
            throw fail("getSecret", auth.failure(), Map.of("secret_id", id));
        }

        String vaultPath = kvAdapter.secretPath(row.name(), id);
        VaultOutcome<JsonNode> read = attempt(() -> transport.read(vaultPath));
        if (!read.isSuccess()) {
            throw fail("getSecret", read.failure(), Map.of("vaultPath", vaultPath));
        }

        Optional<String> json = kvAdapter.readValue(read.value());
        if (json.isEmpty()) {
            throw fail("getSecret", VaultFailure.malformedResponse("no value field in Vault response"), Map.of("vaultPath", vaultPath));
        }

        log.info("VaultSecretManager.getSecret: secret retrieved from {}", vaultPath);
        return Optional.of(row.withValue(fromJson(json.get(), vaultPath)));
    }

    @Override
    public Optional<SecretRecord> updateSecret(UUID id, Map<String, Object> value) {
        Optional<SecretRecord> found = repository.findById(id);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        SecretRecord row = found.get();
        if (!row.isVault()) {
            return repository.update(id, value);
        }

        VaultOutcome<Void> auth = authenticate();
        if (!auth.isSuccess()) {
            throw fail("updateSecret", auth.failure(), Map.of("secret_id", id));
        }
        String json = toJson(value);

        String vaultPath = kvAdapter.secretPath(row.name(), id);
        VaultOutcome<Void> write = attemptVoid(() -> transport.write(vaultPath, kvAdapter.writePayload(json)));
        if (!write.isSuccess()) {
            // Row (including updatedAt) stays exactly as it was
            audit("update_secret", "failure", Map.of("secret_id", id, "vault_path", vaultPath));
            throw fail("updateSecret", write.failure(), Map.of("vaultPath", vaultPath));
        }

        log.info("VaultSecretManager.updateSecret: secret updated at {}", vaultPath);
        audit("update_secret", "success", Map.of("secret_id", id, "vault_path", vaultPath));
        return repository.touch(id).map(updated -> updated.withValue(value));
    }

    @Override
    public boolean deleteSecret(UUID id) {
        Optional<SecretRecord> found = repository.findById(id);
        if (found.isEmpty()) {
            return false;
        }
        SecretRecord row = found.get();

        if (row.isVault()) {
            VaultOutcome<Void> auth = authenticate();
            if (!auth.isSuccess()) {
                throw fail("deleteSecret", auth.failure(), Map.of("secret_id", id));
            }

            String deletePath = kvAdapter.metadataPath(row.name(), id);
            VaultOutcome<Void> delete = attemptVoid(() -> transport.delete(deletePath));
            if (!delete.isSuccess()) {
                // Keep the row: it is the only pointer to a value that may still be live in Vault
                audit("delete_secret", "failure", Map.of("secret_id", id, "vault_path", deletePath));
                throw fail("deleteSecret", delete.failure(), Map.of("deletePath", deletePath));
            }
            log.info("VaultSecretManager.deleteSecret: secret {} at {}",
                    kvAdapter.kvVersion() == VaultKvVersion.V1 ? "deleted" : "permanently deleted", deletePath);
        }

        boolean deleted = repository.delete(id);
        audit("delete_secret", "success", Map.of("secret_id", id));
        return deleted;
    }

    @Override
    public SecretsConnectivityResult checkConnectivity() {
        VaultOutcome<Void> auth = authenticate();
        if (!auth.isSuccess()) {
            throw fail("checkConnectivity", auth.failure(), Map.of());
        }

        String listBasePath = kvAdapter.listBasePath();
        VaultOutcome<List<String>> listing = attempt(() -> transport.list(listBasePath));
        if (listing.isPathNotFound()) {
            log.info("VaultSecretManager.checkConnectivity: {} not found, no secrets exist yet", listBasePath);
            return new SecretsConnectivityResult(0);
        }
        if (!listing.isSuccess()) {
            throw fail("checkConnectivity", listing.failure(), Map.of("listBasePath", listBasePath));
        }
        return new SecretsConnectivityResult(listing.value().size());
    }

    @Override
    public SecretManagerDebugInfo getUserVisibleDebugInfo() {
        Map<String, String> meta = new LinkedHashMap<>();
        meta.put("KV Version", kvAdapter.kvVersion().setting());
        meta.put("Secret Path", config.secretPath());
        meta.put("Auth Method", config.authMethod().name());
        meta.put("Kubernetes Token Path", config.k8sTokenPath());
        meta.put("Kubernetes Mount Point", config.k8sMountPoint());
        if (kvAdapter.kvVersion() == VaultKvVersion.V2) {
            meta.put("Metadata Path", kvAdapter.listBasePath());
        }
        return new SecretManagerDebugInfo(getType(), meta);
    }

    /**
     * Compensates a failed Vault write by removing the row inserted for it.
     */
    private void rollbackInsert(UUID id, String vaultPath) {
        try {
            repository.delete(id);
            audit("create_secret", "rollback", Map.of("secret_id", id, "vault_path", vaultPath));
        } catch (RuntimeException e) {
            // Caller still gets the Vault failure; the orphan row is left for manual cleanup
            log.error("VaultSecretManager.createSecret: rollback of row {} failed after Vault write failure at {}",
                    id, vaultPath, e);
            audit("create_secret", "rollback_failure", Map.of("secret_id", id, "vault_path", vaultPath));
        }
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value == null ? Map.of() : value);
        } catch (JsonProcessingException e) {
            throw new SecretManagerException("Secret value could not be serialized to JSON", e);
        }
    }

    private Map<String, Object> fromJson(String json, String vaultPath) {
        try {
            return objectMapper.readValue(json, VALUE_TYPE);
        } catch (JsonProcessingException e) {
            throw fail("getSecret", VaultFailure.malformedResponse("value at path is not a JSON object: " + e.getOriginalMessage()),
                    Map.of("vaultPath", vaultPath));
        }
    }
}
