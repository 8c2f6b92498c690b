package tech.yump.secretmanager.secrets.vault.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import tech.yump.secretmanager.secrets.SecretsManagerConfigurationException;
import tech.yump.secretmanager.secrets.vault.VaultAuthMethod;
import tech.yump.secretmanager.secrets.vault.VaultConfig;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VaultLoginStrategiesTest {

    private final VaultLoginStrategies strategies = new VaultLoginStrategies(
            StaticCredentialsProvider.create(AwsBasicCredentials.create("AKIDEXAMPLE", "secret")), new ObjectMapper());

    @Test
    void token_presetWithoutExchange() {
        VaultConfig config = VaultConfig.builder().authMethod(VaultAuthMethod.TOKEN).token("s.root").build();

        VaultLoginStrategy strategy = strategies.forConfig(config);

        assertThat(strategy).isInstanceOf(TokenLoginStrategy.class);
        assertThat(strategy.presetToken()).contains("s.root");
    }

    @Test
    void kubernetes_selected() {
        VaultConfig config = VaultConfig.builder().authMethod(VaultAuthMethod.K8S).k8sRole("app").build();

        VaultLoginStrategy strategy = strategies.forConfig(config);

        assertThat(strategy).isInstanceOf(KubernetesLoginStrategy.class);
        assertThat(strategy.method()).isEqualTo(VaultAuthMethod.K8S);
        assertThat(strategy.presetToken()).isEmpty();
    }

    @Test
    void aws_selected() {
        VaultConfig config = VaultConfig.builder().authMethod(VaultAuthMethod.AWS).awsRole("app").build();

        assertThat(strategies.forConfig(config)).isInstanceOf(AwsIamLoginStrategy.class);
    }

    @Test
    void missingMethod_isConfigurationError() {
        VaultConfig config = VaultConfig.builder().address("http://vault:8200").build();

        assertThatThrownBy(() -> strategies.forConfig(config))
                .isInstanceOf(SecretsManagerConfigurationException.class)
                .hasMessage("Vault authentication method is not set");
    }
}
