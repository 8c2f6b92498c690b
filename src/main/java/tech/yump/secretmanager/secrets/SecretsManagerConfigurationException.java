package tech.yump.secretmanager.secrets;

/**
 * Thrown when a backend cannot be built because its configuration is missing or invalid.
 * Callers selecting a backend catch this and fall back to database storage.
 */
public class SecretsManagerConfigurationException extends SecretManagerException {
    public SecretsManagerConfigurationException(String message) {
        super(message);
    }

    public SecretsManagerConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
