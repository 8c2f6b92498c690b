package tech.yump.secretmanager.secrets.vault.auth;

import lombok.extern.slf4j.Slf4j;
import tech.yump.secretmanager.secrets.vault.VaultAuthenticationException;
import tech.yump.secretmanager.secrets.vault.transport.VaultTransport;

/**
 * The Vault token held by one manager instance for its lifetime.
 * <p>
 * Set by the first successful {@link #ensureInitialized(VaultTransport)}; a failed login leaves the
 * session uninitialized so the next call retries. The token is never refreshed: replace the manager
 * to rotate it.
 */
@Slf4j
public class AuthSession {

    private final VaultLoginStrategy strategy;
    private volatile String token;
    private volatile boolean initialized;

    public AuthSession(VaultLoginStrategy strategy) {
        this.strategy = strategy;
        strategy.presetToken().ifPresent(preset -> {
            this.token = preset;
            this.initialized = true;
        });
    }

    /**
     * No-op once initialized; otherwise performs the strategy's login exchange exactly once,
     * even under concurrent first calls.
     *
     * @throws VaultAuthenticationException if the exchange fails; nothing is cached in that case.
     */
    public void ensureInitialized(VaultTransport transport) {
        if (initialized) {
            return;
        }
        synchronized (this) {
            if (initialized) {
                return;
            }
            log.debug("Vault session not initialized; logging in with method {}", strategy.method());
            String clientToken = strategy.login(transport);
            this.token = clientToken;
            this.initialized = true;
        }
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * @return the current token, or null before the first successful login.
     */
    public String token() {
        return token;
    }
}
