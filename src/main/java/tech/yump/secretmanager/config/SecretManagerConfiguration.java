package tech.yump.secretmanager.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import tech.yump.secretmanager.audit.AuditHelper;
import tech.yump.secretmanager.secrets.SecretManager;
import tech.yump.secretmanager.secrets.SecretManagerFactory;
import tech.yump.secretmanager.secrets.vault.auth.VaultLoginStrategies;
import tech.yump.secretmanager.secrets.vault.transport.RestTemplateVaultTransportFactory;
import tech.yump.secretmanager.secrets.vault.transport.VaultTransportFactory;
import tech.yump.secretmanager.storage.SecretRepository;

import java.time.Duration;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class SecretManagerConfiguration {

    private final SecretManagerProperties properties;

    @Bean
    public VaultConfigResolver vaultConfigResolver() {
        return new VaultConfigResolver();
    }

    @Bean
    public VaultTransportFactory vaultTransportFactory(RestTemplateBuilder restTemplateBuilder, ObjectMapper objectMapper) {
        SecretManagerProperties.VaultProperties vault = properties.vault();
        Duration connectTimeout = vault != null ? vault.connectTimeout()
                : SecretManagerProperties.VaultProperties.DEFAULT_CONNECT_TIMEOUT;
        Duration readTimeout = vault != null ? vault.readTimeout()
                : SecretManagerProperties.VaultProperties.DEFAULT_READ_TIMEOUT;
        return new RestTemplateVaultTransportFactory(restTemplateBuilder, objectMapper, connectTimeout, readTimeout);
    }

    @Bean
    public VaultLoginStrategies vaultLoginStrategies(ObjectMapper objectMapper) {
        // Credentials are resolved lazily, on the first AWS login
        return new VaultLoginStrategies(DefaultCredentialsProvider.create(), objectMapper);
    }

    @Bean
    public SecretManagerFactory secretManagerFactory(VaultConfigResolver vaultConfigResolver,
                                                     SecretRepository secretRepository,
                                                     VaultTransportFactory vaultTransportFactory,
                                                     VaultLoginStrategies vaultLoginStrategies,
                                                     ObjectMapper objectMapper,
                                                     AuditHelper auditHelper) {
        return new SecretManagerFactory(properties, vaultConfigResolver, secretRepository, vaultTransportFactory,
                vaultLoginStrategies, objectMapper, auditHelper);
    }

    @Bean
    public SecretManager secretManager(SecretManagerFactory secretManagerFactory) {
        SecretManager manager = secretManagerFactory.createSecretManager();
        log.info("Secret manager ready: type={}", manager.getType());
        return manager;
    }
}
