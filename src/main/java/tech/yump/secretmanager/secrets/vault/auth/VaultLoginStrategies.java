package tech.yump.secretmanager.secrets.vault.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import tech.yump.secretmanager.secrets.SecretsManagerConfigurationException;
import tech.yump.secretmanager.secrets.vault.VaultConfig;

import java.nio.file.Path;

/**
 * Picks the {@link VaultLoginStrategy} matching a configuration's auth method.
 */
public class VaultLoginStrategies {

    private final AwsCredentialsProvider awsCredentialsProvider;
    private final ObjectMapper objectMapper;

    public VaultLoginStrategies(AwsCredentialsProvider awsCredentialsProvider, ObjectMapper objectMapper) {
        this.awsCredentialsProvider = awsCredentialsProvider;
        this.objectMapper = objectMapper;
    }

    public VaultLoginStrategy forConfig(VaultConfig config) {
        if (config.authMethod() == null) {
            throw new SecretsManagerConfigurationException("Vault authentication method is not set");
        }
        return switch (config.authMethod()) {
            case TOKEN -> new TokenLoginStrategy(config.token());
            case K8S -> new KubernetesLoginStrategy(config.k8sRole(), config.k8sMountPoint(), Path.of(config.k8sTokenPath()));
            case AWS -> new AwsIamLoginStrategy(config.awsRole(), config.awsMountPoint(), config.awsRegion(),
                    config.awsStsEndpoint(), config.awsIamServerId(), awsCredentialsProvider, objectMapper);
        };
    }
}
