package tech.yump.secretmanager.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import tech.yump.secretmanager.secrets.SecretsManagerConfigurationException;
import tech.yump.secretmanager.secrets.vault.VaultAuthMethod;
import tech.yump.secretmanager.secrets.vault.VaultConfig;
import tech.yump.secretmanager.secrets.vault.VaultKvVersion;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns the raw {@code secretmanager.vault.*} settings into a {@link VaultConfig}.
 * Error messages name the deployment environment variables.
 */
@Slf4j
public class VaultConfigResolver {

    static final String ADDR_VAR = "ARCHESTRA_HASHICORP_VAULT_ADDR";
    static final String TOKEN_VAR = "ARCHESTRA_HASHICORP_VAULT_TOKEN";
    static final String K8S_ROLE_VAR = "ARCHESTRA_HASHICORP_VAULT_K8S_ROLE";
    static final String AWS_ROLE_VAR = "ARCHESTRA_HASHICORP_VAULT_AWS_ROLE";
    static final String KV_VERSION_VAR = "ARCHESTRA_HASHICORP_VAULT_KV_VERSION";
    static final String AUTH_METHOD_VAR = "ARCHESTRA_HASHICORP_VAULT_AUTH_METHOD";

    /**
     * @throws SecretsManagerConfigurationException listing every problem found, separated by spaces.
     */
    public VaultConfig resolve(SecretManagerProperties.VaultProperties vault) {
        if (vault == null) {
            throw new SecretsManagerConfigurationException(ADDR_VAR + " is not set.");
        }

        List<String> errors = new ArrayList<>();

        VaultKvVersion kvVersion = VaultKvVersion.V2;
        if (StringUtils.hasText(vault.kvVersion())) {
            Optional<VaultKvVersion> parsed = VaultKvVersion.fromSetting(vault.kvVersion());
            if (parsed.isPresent()) {
                kvVersion = parsed.get();
            } else {
                errors.add("Invalid " + KV_VERSION_VAR + "=\"" + vault.kvVersion() + "\". Expected \"1\" or \"2\".");
            }
        }

        // Unknown method is reported on its own
        VaultAuthMethod authMethod = VaultAuthMethod.TOKEN;
        if (StringUtils.hasText(vault.authMethod())) {
            authMethod = VaultAuthMethod.fromSetting(vault.authMethod())
                    .orElseThrow(() -> new SecretsManagerConfigurationException("Invalid " + AUTH_METHOD_VAR + "=\""
                            + vault.authMethod() + "\". Expected \"TOKEN\", \"K8S\", or \"AWS\"."));
        }

        if (!StringUtils.hasText(vault.address())) {
            errors.add(ADDR_VAR + " is not set.");
        }

        SecretManagerProperties.VaultProperties.KubernetesProperties k8s = vault.kubernetes();
        SecretManagerProperties.VaultProperties.AwsProperties aws = vault.aws();

        switch (authMethod) {
            case TOKEN -> {
                if (!StringUtils.hasText(vault.token())) {
                    errors.add(TOKEN_VAR + " is not set.");
                }
            }
            case K8S -> {
                if (!StringUtils.hasText(k8s.role())) {
                    errors.add(K8S_ROLE_VAR + " is not set.");
                }
            }
            case AWS -> {
                if (!StringUtils.hasText(aws.role())) {
                    errors.add(AWS_ROLE_VAR + " is not set.");
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new SecretsManagerConfigurationException(String.join(" ", errors));
        }

        VaultConfig config = VaultConfig.builder()
                .address(vault.address())
                .authMethod(authMethod)
                .token(vault.token())
                .kvVersion(kvVersion)
                .secretPath(vault.secretPath())
                .secretMetadataPath(vault.secretMetadataPath())
                .k8sRole(k8s.role())
                .k8sMountPoint(k8s.mountPoint())
                .k8sTokenPath(k8s.tokenPath())
                .awsRole(aws.role())
                .awsMountPoint(aws.mountPoint())
                .awsRegion(aws.region())
                .awsStsEndpoint(aws.stsEndpoint())
                .awsIamServerId(aws.iamServerId())
                .build();
        log.debug("Resolved Vault configuration: {}", config);
        return config;
    }

    /**
     * The configured KV version, or v2 when unset or unrecognised.
     */
    public VaultKvVersion resolveKvVersion(SecretManagerProperties.VaultProperties vault) {
        if (vault == null) {
            return VaultKvVersion.V2;
        }
        return VaultKvVersion.fromSetting(vault.kvVersion()).orElse(VaultKvVersion.V2);
    }
}
