package tech.yump.secretmanager.secrets;

/**
 * Base exception for errors raised by any {@link SecretManager} implementation.
 */
public class SecretManagerException extends RuntimeException {
    public SecretManagerException(String message) {
        super(message);
    }

    public SecretManagerException(String message, Throwable cause) {
        super(message, cause);
    }
}
