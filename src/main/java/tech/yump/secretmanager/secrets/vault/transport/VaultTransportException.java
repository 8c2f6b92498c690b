package tech.yump.secretmanager.secrets.vault.transport;

import java.util.List;

/**
 * A Vault HTTP call failed. Carries the HTTP status (0 when no response arrived) and Vault's
 * {@code errors} array, which may echo request details and therefore only goes to logs.
 */
public class VaultTransportException extends RuntimeException {

    private final int statusCode;
    private final List<String> errors;

    public VaultTransportException(String message, int statusCode, List<String> errors, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public List<String> getErrors() {
        return errors;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    /**
     * Short description for logs: {@code "403: permission denied"}, {@code "503"} or {@code "Connection failed"}.
     */
    public String vaultErrorMessage() {
        if (statusCode > 0 && !errors.isEmpty()) {
            return statusCode + ": " + String.join(", ", errors);
        }
        if (statusCode > 0) {
            return String.valueOf(statusCode);
        }
        return "Connection failed";
    }
}
