package tech.yump.secretmanager.secrets.vault.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.yump.secretmanager.secrets.vault.VaultAuthenticationException;
import tech.yump.secretmanager.secrets.vault.transport.VaultTransport;
import tech.yump.secretmanager.secrets.vault.transport.VaultTransportException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KubernetesLoginStrategyTest {

    @Mock
    private VaultTransport transport;

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Reads the service-account JWT, trims it and exchanges it for a client token")
    void login_success() throws Exception {
        // Arrange
        Path tokenFile = Files.writeString(tempDir.resolve("token"), "eyJhbGciOi.jwt.sig\n");
        when(transport.kubernetesLogin("k8s-prod", "platform", "eyJhbGciOi.jwt.sig"))
                .thenReturn(objectMapper.readTree("{\"auth\":{\"client_token\":\"s.k8s\",\"lease_duration\":3600}}"));
        KubernetesLoginStrategy strategy = new KubernetesLoginStrategy("platform", "k8s-prod", tokenFile);

        // Act
        String token = strategy.login(transport);

        // Assert
        assertThat(token).isEqualTo("s.k8s");
    }

    @Test
    @DisplayName("A missing token file fails before contacting Vault")
    void login_missingTokenFile() {
        KubernetesLoginStrategy strategy = new KubernetesLoginStrategy("platform", "kubernetes", tempDir.resolve("absent"));

        assertThatThrownBy(() -> strategy.login(transport))
                .isInstanceOf(VaultAuthenticationException.class)
                .hasMessageContaining("Failed to read Kubernetes service account token");
        verifyNoInteractions(transport);
    }

    @Test
    @DisplayName("A rejected login carries Vault's error for the logs")
    void login_rejected() throws Exception {
        Path tokenFile = Files.writeString(tempDir.resolve("token"), "jwt");
        when(transport.kubernetesLogin(anyString(), anyString(), anyString()))
                .thenThrow(new VaultTransportException("denied", 403, List.of("permission denied"), null));
        KubernetesLoginStrategy strategy = new KubernetesLoginStrategy("platform", "kubernetes", tokenFile);

        assertThatThrownBy(() -> strategy.login(transport))
                .isInstanceOf(VaultAuthenticationException.class)
                .hasMessageContaining("403: permission denied")
                .hasCauseInstanceOf(VaultTransportException.class);
    }

    @Test
    @DisplayName("A response without auth.client_token is an authentication failure")
    void login_noClientToken() throws Exception {
        Path tokenFile = Files.writeString(tempDir.resolve("token"), "jwt");
        when(transport.kubernetesLogin(anyString(), anyString(), anyString()))
                .thenReturn(objectMapper.readTree("{\"auth\":null}"));
        KubernetesLoginStrategy strategy = new KubernetesLoginStrategy("platform", "kubernetes", tokenFile);

        assertThatThrownBy(() -> strategy.login(transport))
                .isInstanceOf(VaultAuthenticationException.class)
                .hasMessageContaining("auth.client_token");
    }
}
