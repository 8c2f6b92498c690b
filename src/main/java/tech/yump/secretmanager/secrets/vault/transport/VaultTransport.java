package tech.yump.secretmanager.secrets.vault.transport;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Minimal HTTP API of a Vault server. Paths are relative to {@code /v1/}.
 * Every method throws {@link VaultTransportException} on a non-2xx answer or when Vault is unreachable.
 */
public interface VaultTransport {

    /** @return the full response body. */
    JsonNode read(String path);

    /** @return the response body, or a missing node when Vault answers without one. */
    JsonNode write(String path, Map<String, ?> payload);

    void delete(String path);

    /** @return the entries under {@code path}; folders end with {@code /}. */
    List<String> list(String path);

    /** Logs in at {@code auth/{mountPoint}/login} with a service-account JWT. @return the response body. */
    JsonNode kubernetesLogin(String mountPoint, String role, String jwt);
}
