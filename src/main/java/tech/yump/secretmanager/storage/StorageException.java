package tech.yump.secretmanager.storage;

/**
 * Raised when the relational secret store cannot complete an operation.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
