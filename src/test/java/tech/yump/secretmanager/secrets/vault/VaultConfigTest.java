package tech.yump.secretmanager.secrets.vault;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.secretmanager.secrets.SecretsManagerConfigurationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VaultConfigTest {

    @Test
    @DisplayName("Blank optional fields take the deployment defaults")
    void defaults() {
        VaultConfig config = VaultConfig.builder()
                .address(" https://vault.example.com// ")
                .authMethod(VaultAuthMethod.AWS)
                .awsRole("role")
                .awsRegion("")
                .secretMetadataPath(" ")
                .build();

        assertThat(config.address()).isEqualTo("https://vault.example.com");
        assertThat(config.kvVersion()).isEqualTo(VaultKvVersion.V2);
        assertThat(config.secretPath()).isEqualTo("secret/data/archestra");
        assertThat(config.secretMetadataPath()).isNull();
        assertThat(config.k8sMountPoint()).isEqualTo(VaultConfig.DEFAULT_K8S_MOUNT_POINT);
        assertThat(config.awsMountPoint()).isEqualTo(VaultConfig.DEFAULT_AWS_MOUNT_POINT);
        assertThat(config.awsRegion()).isEqualTo(VaultConfig.DEFAULT_AWS_REGION);
        assertThat(config.awsStsEndpoint()).isEqualTo(VaultConfig.DEFAULT_AWS_STS_ENDPOINT);
        assertThat(config.awsIamServerId()).isNull();
    }

    @Test
    @DisplayName("requireValid reports every violation, including the method-specific one")
    void requireValid_reportsViolations() {
        VaultConfig config = VaultConfig.builder().authMethod(VaultAuthMethod.K8S).build();

        assertThatThrownBy(() -> config.requireValid("VaultSecretManager"))
                .isInstanceOf(SecretsManagerConfigurationException.class)
                .hasMessageStartingWith("VaultSecretManager: invalid Vault configuration: ")
                .hasMessageContaining("address is required")
                .hasMessageContaining("k8sRole is required for Kubernetes authentication");
    }

    @Test
    void requireValid_missingAuthMethod() {
        VaultConfig config = VaultConfig.builder().address("http://vault:8200").build();

        assertThatThrownBy(() -> config.requireValid("X"))
                .hasMessageContaining("authMethod is required");
    }

    @Test
    void requireValid_completeConfig() {
        VaultConfig config = VaultConfig.builder()
                .address("http://vault:8200")
                .authMethod(VaultAuthMethod.TOKEN)
                .token("root")
                .build();

        assertThatCode(() -> config.requireValid("X")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("toString never prints the token")
    void toString_masksToken() {
        VaultConfig config = VaultConfig.builder()
                .address("http://vault:8200")
                .authMethod(VaultAuthMethod.TOKEN)
                .token("hvs.super-secret")
                .build();

        assertThat(config.toString()).doesNotContain("hvs.super-secret").contains("token=******");
    }
}
