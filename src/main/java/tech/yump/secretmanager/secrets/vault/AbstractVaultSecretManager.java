package tech.yump.secretmanager.secrets.vault;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.yump.secretmanager.audit.AuditHelper;
import tech.yump.secretmanager.secrets.SecretManager;
import tech.yump.secretmanager.secrets.SecretManagerException;
import tech.yump.secretmanager.secrets.SecretsManagerConfigurationException;
import tech.yump.secretmanager.secrets.vault.auth.AuthSession;
import tech.yump.secretmanager.secrets.vault.auth.VaultLoginStrategies;
import tech.yump.secretmanager.secrets.vault.transport.VaultTransport;
import tech.yump.secretmanager.secrets.vault.transport.VaultTransportException;
import tech.yump.secretmanager.secrets.vault.transport.VaultTransportFactory;
import tech.yump.secretmanager.storage.SecretRepository;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Plumbing shared by the Vault-backed managers: configuration checks, the per-instance
 * {@link AuthSession} and transport, and conversion of Vault errors into {@link VaultOutcome}s.
 */
public abstract class AbstractVaultSecretManager implements SecretManager {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final VaultConfig config;
    protected final KvPathAdapter kvAdapter;
    protected final SecretRepository repository;
    protected final ObjectMapper objectMapper;
    protected final AuditHelper auditHelper;
    protected final AuthSession authSession;
    protected final VaultTransport transport;

    /**
     * @throws SecretsManagerConfigurationException if {@code config} is missing or incomplete.
     */
    protected AbstractVaultSecretManager(VaultConfig config,
                                         SecretRepository repository,
                                         VaultTransportFactory transportFactory,
                                         VaultLoginStrategies loginStrategies,
                                         ObjectMapper objectMapper,
                                         AuditHelper auditHelper) {
        String component = getClass().getSimpleName();
        if (config == null) {
            throw new SecretsManagerConfigurationException(component + ": Vault configuration is required");
        }
        config.requireValid(component);

        this.config = config;
        this.kvAdapter = KvPathAdapter.forConfig(config);
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.auditHelper = auditHelper;
        this.authSession = new AuthSession(loginStrategies.forConfig(config));
        this.transport = transportFactory.create(config.address(), authSession::token);

        log.info("{} configured: address={}, authMethod={}, kvVersion={}, secretPath={}",
                component, config.address(), config.authMethod(), config.kvVersion().setting(), config.secretPath());
    }

    public VaultConfig getConfig() {
        return config;
    }

    /**
     * Logs in on first use. Never throws.
     */
    protected VaultOutcome<Void> authenticate() {
        try {
            authSession.ensureInitialized(transport);
            return VaultOutcome.success(null);
        } catch (VaultAuthenticationException e) {
            return VaultOutcome.failed(VaultFailure.authentication(e));
        }
    }

    /**
     * Runs one transport call, capturing a transport error as a failed outcome.
     */
    protected <T> VaultOutcome<T> attempt(Supplier<T> call) {
        try {
            return VaultOutcome.success(call.get());
        } catch (VaultTransportException e) {
            return VaultOutcome.failed(VaultFailure.transport(e));
        }
    }

    protected VaultOutcome<Void> attemptVoid(Runnable call) {
        return attempt(() -> {
            call.run();
            return null;
        });
    }

    /**
     * Logs the failure with full Vault detail and returns the generic exception for the caller.
     */
    protected SecretManagerException fail(String operation, VaultFailure failure, Map<String, Object> context) {
        log.error("{}.{}: failed ({}): {} {}", getClass().getSimpleName(), operation, failure.kind(),
                failure.detail(), context, failure.cause());
        return failure.toException();
    }

    protected void audit(String action, String outcome, Map<String, Object> data) {
        Map<String, Object> enriched = new LinkedHashMap<>(data);
        enriched.put("backend", getType().name());
        auditHelper.logInternalEvent(AuditHelper.SECRET_OPERATION, action, outcome, null, enriched);
    }
}
