package tech.yump.secretmanager.secrets.vault.auth;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import tech.yump.secretmanager.secrets.vault.VaultAuthMethod;
import tech.yump.secretmanager.secrets.vault.VaultAuthenticationException;
import tech.yump.secretmanager.secrets.vault.transport.VaultTransport;
import tech.yump.secretmanager.secrets.vault.transport.VaultTransportException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Exchanges the pod's service-account JWT for a Vault token at the Kubernetes auth mount.
 */
@Slf4j
public class KubernetesLoginStrategy implements VaultLoginStrategy {

    private final String role;
    private final String mountPoint;
    private final Path tokenPath;

    public KubernetesLoginStrategy(String role, String mountPoint, Path tokenPath) {
        this.role = role;
        this.mountPoint = mountPoint;
        this.tokenPath = tokenPath;
    }

    @Override
    public VaultAuthMethod method() {
        return VaultAuthMethod.K8S;
    }

    @Override
    public String login(VaultTransport transport) {
        String jwt;
        try {
            jwt = Files.readString(tokenPath).trim();
        } catch (IOException e) {
            throw new VaultAuthenticationException("Failed to read Kubernetes service account token from " + tokenPath, e);
        }

        try {
            JsonNode response = transport.kubernetesLogin(mountPoint, role, jwt);
            String clientToken = VaultLoginStrategy.clientToken(response, method());
            log.info("Authenticated with Vault via Kubernetes auth (role: {}, mount: {})", role, mountPoint);
            return clientToken;
        } catch (VaultTransportException e) {
            throw new VaultAuthenticationException("Kubernetes login at auth/" + mountPoint + " failed: " + e.vaultErrorMessage(), e);
        }
    }
}
