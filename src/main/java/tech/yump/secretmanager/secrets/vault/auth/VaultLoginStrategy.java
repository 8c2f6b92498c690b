package tech.yump.secretmanager.secrets.vault.auth;

import com.fasterxml.jackson.databind.JsonNode;
import tech.yump.secretmanager.secrets.vault.VaultAuthMethod;
import tech.yump.secretmanager.secrets.vault.VaultAuthenticationException;
import tech.yump.secretmanager.secrets.vault.transport.VaultTransport;

import java.util.Optional;

/**
 * Obtains a Vault client token for one {@link VaultAuthMethod}.
 */
public interface VaultLoginStrategy {

    VaultAuthMethod method();

    /**
     * A token usable without any exchange, if the method has one.
     */
    default Optional<String> presetToken() {
        return Optional.empty();
    }

    /**
     * Performs the login exchange.
     *
     * @return the client token.
     * @throws VaultAuthenticationException if the exchange fails or returns no token.
     */
    String login(VaultTransport transport);

    /**
     * Reads {@code auth.client_token} from a login response.
     */
    static String clientToken(JsonNode loginResponse, VaultAuthMethod method) {
        JsonNode token = loginResponse.path("auth").path("client_token");
        if (!token.isTextual() || token.asText().isBlank()) {
            throw new VaultAuthenticationException(method + " login response did not contain auth.client_token");
        }
        return token.asText();
    }
}
