package tech.yump.secretmanager.secrets;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tech.yump.secretmanager.audit.AuditHelper;
import tech.yump.secretmanager.config.SecretManagerProperties;
import tech.yump.secretmanager.config.VaultConfigResolver;
import tech.yump.secretmanager.secrets.db.DbSecretManager;
import tech.yump.secretmanager.secrets.vault.ByosVaultSecretManager;
import tech.yump.secretmanager.secrets.vault.VaultConfig;
import tech.yump.secretmanager.secrets.vault.VaultKvVersion;
import tech.yump.secretmanager.secrets.vault.VaultSecretManager;
import tech.yump.secretmanager.secrets.vault.auth.VaultLoginStrategies;
import tech.yump.secretmanager.secrets.vault.transport.VaultTransportFactory;
import tech.yump.secretmanager.storage.SecretRepository;

import java.util.Optional;

/**
 * Chooses and builds the {@link SecretManager} for this deployment.
 * <p>
 * Vault-backed managers need an activated enterprise license and a complete Vault configuration;
 * otherwise the database manager is used and a warning says why.
 */
@Slf4j
@RequiredArgsConstructor
public class SecretManagerFactory {

    private final SecretManagerProperties properties;
    private final VaultConfigResolver vaultConfigResolver;
    private final SecretRepository repository;
    private final VaultTransportFactory transportFactory;
    private final VaultLoginStrategies loginStrategies;
    private final ObjectMapper objectMapper;
    private final AuditHelper auditHelper;

    public SecretsManagerType getSecretsManagerType() {
        return SecretsManagerType.fromSetting(properties.type());
    }

    public SecretManager createSecretManager() {
        SecretsManagerType type = getSecretsManagerType();
        if (type == SecretsManagerType.DB) {
            log.info("createSecretManager: using DbSecretManager");
            return new DbSecretManager(repository, auditHelper);
        }

        if (!properties.enterpriseLicenseActivated()) {
            log.warn("createSecretManager: secrets manager type {} configured but the enterprise license is not activated, "
                    + "falling back to DbSecretManager.", type);
            return new DbSecretManager(repository, auditHelper);
        }

        try {
            VaultConfig vaultConfig = vaultConfigResolver.resolve(properties.vault());
            SecretManager manager = type == SecretsManagerType.VAULT
                    ? new VaultSecretManager(vaultConfig, repository, transportFactory, loginStrategies, objectMapper, auditHelper)
                    : new ByosVaultSecretManager(vaultConfig, repository, transportFactory, loginStrategies, objectMapper, auditHelper);
            log.info("createSecretManager: using {} (address={}, authMethod={})",
                    manager.getClass().getSimpleName(), vaultConfig.address(), vaultConfig.authMethod());
            return manager;
        } catch (SecretsManagerConfigurationException e) {
            log.warn("createSecretManager: Invalid Vault configuration, falling back to DbSecretManager. {}", e.getMessage());
            return new DbSecretManager(repository, auditHelper);
        }
    }

    /**
     * Teams may point secrets at their own Vault folders only in BYOS mode with a license.
     */
    public boolean isByosEnabled() {
        return getSecretsManagerType() == SecretsManagerType.BYOS_VAULT && properties.enterpriseLicenseActivated();
    }

    /**
     * @return the KV version BYOS folders use, or empty when BYOS is not enabled.
     */
    public Optional<VaultKvVersion> getByosVaultKvVersion() {
        if (!isByosEnabled()) {
            return Optional.empty();
        }
        return Optional.of(vaultConfigResolver.resolveKvVersion(properties.vault()));
    }
}
