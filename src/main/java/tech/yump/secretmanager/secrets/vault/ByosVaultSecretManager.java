package tech.yump.secretmanager.secrets.vault;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import tech.yump.secretmanager.audit.AuditHelper;
import tech.yump.secretmanager.secrets.ConnectivityCheckNotSupportedException;
import tech.yump.secretmanager.secrets.SecretManagerDebugInfo;
import tech.yump.secretmanager.secrets.SecretManagerException;
import tech.yump.secretmanager.secrets.SecretRecord;
import tech.yump.secretmanager.secrets.SecretsConnectivityResult;
import tech.yump.secretmanager.secrets.SecretsManagerType;
import tech.yump.secretmanager.secrets.vault.auth.VaultLoginStrategies;
import tech.yump.secretmanager.secrets.vault.transport.VaultTransportException;
import tech.yump.secretmanager.secrets.vault.transport.VaultTransportFactory;
import tech.yump.secretmanager.storage.NewSecret;
import tech.yump.secretmanager.storage.SecretRepository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * "Bring your own secrets": values live in Vault folders the customer owns. Rows store
 * {@code path#key} references ({@code isByosVault=true}) which are resolved on every read.
 * This manager never writes to or deletes from Vault.
 */
public class ByosVaultSecretManager extends AbstractVaultSecretManager {

    static final String RESOLVE_FAILURE_MESSAGE =
            "Failed to resolve vault secret references. Please verify the paths exist and the platform has read access.";
    static final String CONNECTIVITY_NOT_SUPPORTED_MESSAGE =
            "Connectivity check for BYOS secrets requires team context. Use team-specific vault folder connectivity check instead.";
    static final String DESCRIPTION = "External Vault (BYOS - Bring Your Own Secrets)";

    private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {};

    public ByosVaultSecretManager(VaultConfig config,
                                  SecretRepository repository,
                                  VaultTransportFactory transportFactory,
                                  VaultLoginStrategies loginStrategies,
                                  ObjectMapper objectMapper,
                                  AuditHelper auditHelper) {
        super(config, repository, transportFactory, loginStrategies, objectMapper, auditHelper);
    }

    @Override
    public SecretsManagerType getType() {
        return SecretsManagerType.BYOS_VAULT;
    }

    /**
     * Stores the references as given; no Vault call is made. With {@code forceDb} the value is stored
     * as plaintext instead.
     */
    @Override
    public SecretRecord createSecret(Map<String, Object> value, String name, boolean forceDb) {
        int keyCount = value == null ? 0 : value.size();
        SecretRecord created;
        if (forceDb) {
            log.info("ByosVaultSecretManager.createSecret: forceDb=true, storing {} value(s) for '{}' in database", keyCount, name);
            created = repository.create(NewSecret.plaintext(name, value));
        } else {
            log.info("ByosVaultSecretManager.createSecret: storing {} vault reference(s) for '{}'", keyCount, name);
            if (value != null) {
                value.forEach((key, ref) -> {
                    if (!(ref instanceof String s) || !VaultReference.isReference(s)) {
                        log.warn("ByosVaultSecretManager.createSecret: value for '{}' does not look like a path#key reference", key);
                    }
                });
            }
            created = repository.create(NewSecret.byosReferences(name, value));
        }
        audit("create_secret", "success", Map.of("secret_id", created.id(), "storage", forceDb ? "database" : "references"));
        return created;
    }

    @Override
    public Optional<SecretRecord> getSecret(UUID id) {
        Optional<SecretRecord> found = repository.findById(id);
        if (found.isEmpty() || !found.get().isByosVault() || found.get().value().isEmpty()) {
            return found;
        }
        SecretRecord row = found.get();
        log.debug("ByosVaultSecretManager.getSecret: resolving {} vault reference(s)", row.value().size());

        VaultOutcome<Void> auth = authenticate();
        if (!auth.isSuccess()) {
            throw fail("getSecret", auth.failure(), Map.of("secret_id", id));
        }

        Map<String, Object> resolved = resolveReferences(id, row.value());
        log.info("ByosVaultSecretManager.getSecret: resolved {} of {} reference(s)", resolved.size(), row.value().size());
        return Optional.of(row.withValue(resolved));
    }

    /**
     * Replaces the stored references. Vault is not touched.
     */
    @Override
    public Optional<SecretRecord> updateSecret(UUID id, Map<String, Object> value) {
        if (repository.findById(id).isEmpty()) {
            return Optional.empty();
        }
        Optional<SecretRecord> updated = repository.update(id, value);
        updated.ifPresent(r -> audit("update_secret", "success", Map.of("secret_id", id)));
        return updated;
    }

    /**
     * Removes the reference row only; the customer's Vault content is left as is.
     */
    @Override
    public boolean deleteSecret(UUID id) {
        log.info("ByosVaultSecretManager.deleteSecret: deleting external vault secret reference {}", id);
        boolean deleted = repository.delete(id);
        if (deleted) {
            audit("delete_secret", "success", Map.of("secret_id", id));
        }
        return deleted;
    }

    @Override
    public SecretsConnectivityResult checkConnectivity() {
        throw new ConnectivityCheckNotSupportedException(CONNECTIVITY_NOT_SUPPORTED_MESSAGE);
    }

    @Override
    public SecretManagerDebugInfo getUserVisibleDebugInfo() {
        return new SecretManagerDebugInfo(getType(), Map.of("description", DESCRIPTION));
    }

    /**
     * Lists the secrets (not sub-folders) directly under a folder. A folder Vault does not know is empty.
     */
    public List<VaultSecretListItem> listSecretsInFolder(String folderPath) {
        log.debug("ByosVaultSecretManager.listSecretsInFolder: listing {}", folderPath);
        VaultOutcome<Void> auth = authenticate();
        if (!auth.isSuccess()) {
            throw fail("listSecretsInFolder", auth.failure(), Map.of("folderPath", folderPath));
        }

        String listPath = kvAdapter.folderListPath(folderPath);
        VaultOutcome<List<String>> listing = attempt(() -> transport.list(listPath));
        if (listing.isPathNotFound()) {
            log.debug("ByosVaultSecretManager.listSecretsInFolder: {} empty or not found", folderPath);
            return List.of();
        }
        if (!listing.isSuccess()) {
            throw fail("listSecretsInFolder", listing.failure(), Map.of("folderPath", folderPath));
        }

        String normalizedFolder = folderPath.replaceAll("/+$", "");
        List<VaultSecretListItem> items = new ArrayList<>();
        for (String key : listing.value()) {
            if (!key.endsWith("/")) {
                items.add(new VaultSecretListItem(key, normalizedFolder + "/" + key));
            }
        }
        log.info("ByosVaultSecretManager.listSecretsInFolder: {} secret(s) in {}", items.size(), folderPath);
        return items;
    }

    /**
     * Reads the key/value map stored at {@code vaultPath}.
     */
    public Map<String, Object> getSecretFromPath(String vaultPath) {
        log.debug("ByosVaultSecretManager.getSecretFromPath: fetching {}", vaultPath);
        VaultOutcome<Void> auth = authenticate();
        if (!auth.isSuccess()) {
            throw fail("getSecretFromPath", auth.failure(), Map.of("vaultPath", vaultPath));
        }
        VaultOutcome<Map<String, Object>> read = readPath(vaultPath);
        if (!read.isSuccess()) {
            throw fail("getSecretFromPath", read.failure(), Map.of("vaultPath", vaultPath));
        }
        return read.value();
    }

    /**
     * Checks that a folder can be listed. Never throws; problems are reported in the result.
     */
    public VaultFolderConnectivityResult checkFolderConnectivity(String folderPath) {
        log.debug("ByosVaultSecretManager.checkFolderConnectivity: checking {}", folderPath);
        VaultOutcome<Void> auth = authenticate();
        if (!auth.isSuccess()) {
            return VaultFolderConnectivityResult.failed("Authentication failed: " + vaultErrorMessage(auth.failure()));
        }

        String listPath = kvAdapter.folderListPath(folderPath);
        VaultOutcome<List<String>> listing = attempt(() -> transport.list(listPath));
        if (listing.isPathNotFound()) {
            log.info("ByosVaultSecretManager.checkFolderConnectivity: connected ({} is empty)", folderPath);
            return VaultFolderConnectivityResult.connected(0);
        }
        if (!listing.isSuccess()) {
            String error = vaultErrorMessage(listing.failure());
            log.warn("ByosVaultSecretManager.checkFolderConnectivity: {} failed: {}", folderPath, error);
            return VaultFolderConnectivityResult.failed(error);
        }

        int secretCount = (int) listing.value().stream().filter(key -> !key.endsWith("/")).count();
        log.info("ByosVaultSecretManager.checkFolderConnectivity: connected, {} secret(s) in {}", secretCount, folderPath);
        return VaultFolderConnectivityResult.connected(secretCount);
    }

    /**
     * Resolves {@code platformKey -> "path#key"} references with one read per distinct path.
     * A key missing from its path's data is logged and left out.
     */
    private Map<String, Object> resolveReferences(UUID id, Map<String, Object> references) {
        Map<String, List<Map.Entry<String, String>>> keysByPath = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : references.entrySet()) {
            if (!(entry.getValue() instanceof String reference) || reference.indexOf('#') < 0) {
                log.error("ByosVaultSecretManager.getSecret: stored value for '{}' of secret {} is not a path#key reference",
                        entry.getKey(), id);
                throw resolveFailure(null);
            }
            VaultReference ref = VaultReference.parse(reference);
            keysByPath.computeIfAbsent(ref.path(), p -> new ArrayList<>()).add(Map.entry(entry.getKey(), ref.key()));
        }

        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, List<Map.Entry<String, String>>> pathEntry : keysByPath.entrySet()) {
            String path = pathEntry.getKey();
            VaultOutcome<Map<String, Object>> read = readPath(path);
            if (!read.isSuccess()) {
                fail("getSecret", read.failure(), Map.of("vaultPath", path));
                throw resolveFailure(read.failure());
            }
            Map<String, Object> data = read.value();
            for (Map.Entry<String, String> wanted : pathEntry.getValue()) {
                if (data.containsKey(wanted.getValue())) {
                    resolved.put(wanted.getKey(), data.get(wanted.getValue()));
                } else {
                    log.warn("Vault key '{}' not found at {} (referenced as '{}')", wanted.getValue(), path, wanted.getKey());
                }
            }
        }
        return resolved;
    }

    private VaultOutcome<Map<String, Object>> readPath(String vaultPath) {
        VaultOutcome<JsonNode> read = attempt(() -> transport.read(vaultPath));
        if (!read.isSuccess()) {
            return VaultOutcome.failed(read.failure());
        }
        JsonNode data = kvAdapter.secretData(read.value());
        if (!data.isObject()) {
            return VaultOutcome.failed(VaultFailure.malformedResponse("no secret data at " + vaultPath));
        }
        log.info("ByosVaultSecretManager: secret retrieved from {} (kvVersion {})", vaultPath, kvAdapter.kvVersion().setting());
        return VaultOutcome.success(objectMapper.convertValue(data, DATA_TYPE));
    }

    private SecretManagerException resolveFailure(VaultFailure failure) {
        if (failure == null) {
            return new VaultAccessException(RESOLVE_FAILURE_MESSAGE, 0, null);
        }
        return failure.toException(RESOLVE_FAILURE_MESSAGE);
    }

    private static String vaultErrorMessage(VaultFailure failure) {
        Throwable cause = failure.cause();
        while (cause != null) {
            if (cause instanceof VaultTransportException transportError) {
                return transportError.vaultErrorMessage();
            }
            cause = cause.getCause();
        }
        return "Connection failed";
    }
}
