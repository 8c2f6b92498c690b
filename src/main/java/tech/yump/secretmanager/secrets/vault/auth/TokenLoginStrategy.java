package tech.yump.secretmanager.secrets.vault.auth;

import tech.yump.secretmanager.secrets.vault.VaultAuthMethod;
import tech.yump.secretmanager.secrets.vault.transport.VaultTransport;

import java.util.Optional;

public class TokenLoginStrategy implements VaultLoginStrategy {

    private final String token;

    public TokenLoginStrategy(String token) {
        this.token = token;
    }

    @Override
    public VaultAuthMethod method() {
        return VaultAuthMethod.TOKEN;
    }

    @Override
    public Optional<String> presetToken() {
        return Optional.of(token);
    }

    @Override
    public String login(VaultTransport transport) {
        return token;
    }
}
