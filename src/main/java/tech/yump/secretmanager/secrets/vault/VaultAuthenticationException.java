package tech.yump.secretmanager.secrets.vault;

import tech.yump.secretmanager.secrets.SecretManagerException;

/**
 * Login exchange with Vault failed. The message carries operator detail; managers rethrow it to
 * callers with a generic message and this exception as the cause.
 */
public class VaultAuthenticationException extends SecretManagerException {
    public VaultAuthenticationException(String message) {
        super(message);
    }

    public VaultAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
