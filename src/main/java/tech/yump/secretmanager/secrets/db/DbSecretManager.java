package tech.yump.secretmanager.secrets.db;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tech.yump.secretmanager.audit.AuditHelper;
import tech.yump.secretmanager.secrets.ConnectivityCheckNotSupportedException;
import tech.yump.secretmanager.secrets.SecretManager;
import tech.yump.secretmanager.secrets.SecretManagerDebugInfo;
import tech.yump.secretmanager.secrets.SecretRecord;
import tech.yump.secretmanager.secrets.SecretsConnectivityResult;
import tech.yump.secretmanager.secrets.SecretsManagerType;
import tech.yump.secretmanager.storage.NewSecret;
import tech.yump.secretmanager.storage.SecretRepository;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores secret values as plaintext JSON in the relational store. Default backend and the
 * fallback when Vault is unavailable by configuration or license.
 */
@Slf4j
@RequiredArgsConstructor
public class DbSecretManager implements SecretManager {

    static final String CONNECTIVITY_NOT_SUPPORTED_MESSAGE =
            "Connectivity check is not implemented for database storage";

    private final SecretRepository repository;
    private final AuditHelper auditHelper;

    @Override
    public SecretsManagerType getType() {
        return SecretsManagerType.DB;
    }

    @Override
    public SecretRecord createSecret(Map<String, Object> value, String name, boolean forceDb) {
        SecretRecord created = repository.create(NewSecret.plaintext(name, value));
        log.debug("DbSecretManager.createSecret: created secret {} ('{}')", created.id(), created.name());
        audit("create_secret", Map.of("secret_id", created.id()));
        return created;
    }

    @Override
    public Optional<SecretRecord> getSecret(UUID id) {
        return repository.findById(id);
    }

    @Override
    public Optional<SecretRecord> updateSecret(UUID id, Map<String, Object> value) {
        Optional<SecretRecord> updated = repository.update(id, value);
        if (updated.isPresent()) {
            audit("update_secret", Map.of("secret_id", id));
        } else {
            log.debug("DbSecretManager.updateSecret: no secret {}", id);
        }
        return updated;
    }

    @Override
    public boolean deleteSecret(UUID id) {
        boolean deleted = repository.delete(id);
        if (deleted) {
            audit("delete_secret", Map.of("secret_id", id));
        }
        return deleted;
    }

    @Override
    public SecretsConnectivityResult checkConnectivity() {
        throw new ConnectivityCheckNotSupportedException(CONNECTIVITY_NOT_SUPPORTED_MESSAGE);
    }

    @Override
    public SecretManagerDebugInfo getUserVisibleDebugInfo() {
        return new SecretManagerDebugInfo(getType(), Map.of());
    }

    private void audit(String action, Map<String, Object> data) {
        Map<String, Object> enriched = new LinkedHashMap<>(data);
        enriched.put("backend", getType().name());
        auditHelper.logInternalEvent(AuditHelper.SECRET_OPERATION, action, "success", null, enriched);
    }
}
