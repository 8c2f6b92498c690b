package tech.yump.secretmanager.secrets.vault;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import org.springframework.util.StringUtils;
import tech.yump.secretmanager.config.validation.ValidVaultAuthConfig;
import tech.yump.secretmanager.secrets.SecretsManagerConfigurationException;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable settings for one Vault-backed manager instance.
 * <p>
 * Optional fields fall back to the deployment defaults: mounts {@code kubernetes} and {@code aws},
 * region {@code us-east-1}, the global STS endpoint, KV v2, and the KV version's default secret path.
 * A trailing slash on the address is dropped.
 */
@Builder(toBuilder = true)
@ValidVaultAuthConfig
public record VaultConfig(
        @NotBlank(message = "address is required")
        String address,

        @NotNull(message = "authMethod is required")
        VaultAuthMethod authMethod,

        String token,

        VaultKvVersion kvVersion,

        @NotBlank(message = "secretPath is required")
        String secretPath,

        // KV v2 only; derived from secretPath when absent
        String secretMetadataPath,

        String k8sRole,
        String k8sMountPoint,
        String k8sTokenPath,

        String awsRole,
        String awsMountPoint,
        String awsRegion,
        String awsStsEndpoint,
        String awsIamServerId
) {

    public static final String DEFAULT_K8S_TOKEN_PATH = "/var/run/secrets/kubernetes.io/serviceaccount/token";
    public static final String DEFAULT_K8S_MOUNT_POINT = "kubernetes";
    public static final String DEFAULT_AWS_MOUNT_POINT = "aws";
    public static final String DEFAULT_AWS_REGION = "us-east-1";
    public static final String DEFAULT_AWS_STS_ENDPOINT = "https://sts.amazonaws.com";

    public VaultConfig {
        if (address != null) {
            address = address.trim().replaceAll("/+$", "");
        }
        kvVersion = kvVersion != null ? kvVersion : VaultKvVersion.V2;
        secretPath = StringUtils.hasText(secretPath) ? secretPath : kvVersion.defaultSecretPath();
        secretMetadataPath = StringUtils.hasText(secretMetadataPath) ? secretMetadataPath : null;
        k8sMountPoint = StringUtils.hasText(k8sMountPoint) ? k8sMountPoint : DEFAULT_K8S_MOUNT_POINT;
        k8sTokenPath = StringUtils.hasText(k8sTokenPath) ? k8sTokenPath : DEFAULT_K8S_TOKEN_PATH;
        awsMountPoint = StringUtils.hasText(awsMountPoint) ? awsMountPoint : DEFAULT_AWS_MOUNT_POINT;
        awsRegion = StringUtils.hasText(awsRegion) ? awsRegion : DEFAULT_AWS_REGION;
        awsStsEndpoint = StringUtils.hasText(awsStsEndpoint) ? awsStsEndpoint : DEFAULT_AWS_STS_ENDPOINT;
        awsIamServerId = StringUtils.hasText(awsIamServerId) ? awsIamServerId : null;
    }

    /**
     * Checks the bean constraints of this configuration.
     *
     * @throws SecretsManagerConfigurationException listing every violation, if any.
     */
    public void requireValid(String component) {
        Set<ConstraintViolation<VaultConfig>> violations = ValidatorHolder.VALIDATOR.validate(this);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new SecretsManagerConfigurationException(component + ": invalid Vault configuration: " + details);
        }
    }

    @Override
    public String toString() {
        return "VaultConfig[" +
                "address='" + address + '\'' +
                ", authMethod=" + authMethod +
                ", token=" + (token != null ? "******" : "null") +
                ", kvVersion=" + kvVersion +
                ", secretPath='" + secretPath + '\'' +
                ", secretMetadataPath='" + secretMetadataPath + '\'' +
                ", k8sRole='" + k8sRole + '\'' +
                ", k8sMountPoint='" + k8sMountPoint + '\'' +
                ", k8sTokenPath='" + k8sTokenPath + '\'' +
                ", awsRole='" + awsRole + '\'' +
                ", awsMountPoint='" + awsMountPoint + '\'' +
                ", awsRegion='" + awsRegion + '\'' +
                ", awsStsEndpoint='" + awsStsEndpoint + '\'' +
                ", awsIamServerId='" + awsIamServerId + '\'' +
                ']';
    }

    private static final class ValidatorHolder {
        private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();
    }
}
