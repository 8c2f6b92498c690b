package tech.yump.secretmanager.secrets.vault;

import tech.yump.secretmanager.secrets.SecretManagerException;
import tech.yump.secretmanager.secrets.vault.transport.VaultTransportException;

/**
 * Why a Vault step failed. {@code detail} is meant for logs only.
 */
public record VaultFailure(Kind kind, int statusCode, String detail, Throwable cause) {

    public static final String USER_MESSAGE =
            "An error occurred while accessing secrets. Please try again later or contact your administrator.";

    public enum Kind {
        AUTHENTICATION,
        TRANSPORT,
        /** Vault answered 404; an empty listing rather than an error for list operations. */
        PATH_NOT_FOUND
    }

    public static VaultFailure authentication(VaultAuthenticationException e) {
        return new VaultFailure(Kind.AUTHENTICATION, 0, e.getMessage(), e);
    }

    public static VaultFailure transport(VaultTransportException e) {
        Kind kind = e.isNotFound() ? Kind.PATH_NOT_FOUND : Kind.TRANSPORT;
        return new VaultFailure(kind, e.getStatusCode(), e.vaultErrorMessage(), e);
    }

    /** A response that arrived but could not be used, such as a read without the expected value. */
    public static VaultFailure malformedResponse(String detail) {
        return new VaultFailure(Kind.TRANSPORT, 0, detail, null);
    }

    /**
     * The exception handed to callers: a generic message with this failure's cause attached.
     */
    public SecretManagerException toException() {
        return toException(USER_MESSAGE);
    }

    public SecretManagerException toException(String userMessage) {
        if (kind == Kind.AUTHENTICATION) {
            return new VaultAuthenticationException(userMessage, cause);
        }
        return new VaultAccessException(userMessage, statusCode, cause);
    }
}
