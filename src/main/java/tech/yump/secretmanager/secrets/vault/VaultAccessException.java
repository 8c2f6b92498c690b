package tech.yump.secretmanager.secrets.vault;

import tech.yump.secretmanager.secrets.SecretManagerException;

/**
 * A Vault read, write, delete or list failed for a reason other than "path not found".
 */
public class VaultAccessException extends SecretManagerException {

    private final int statusCode;

    public VaultAccessException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return the HTTP status Vault answered with, or 0 if no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
