package tech.yump.secretmanager.secrets.vault;

/**
 * Result of one Vault step: a value, or the {@link VaultFailure} that prevented it.
 * Two-step operations inspect the outcome to decide on compensation before anything is thrown.
 */
public record VaultOutcome<T>(T value, VaultFailure failure) {

    public static <T> VaultOutcome<T> success(T value) {
        return new VaultOutcome<>(value, null);
    }

    public static <T> VaultOutcome<T> failed(VaultFailure failure) {
        return new VaultOutcome<>(null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public boolean isPathNotFound() {
        return failure != null && failure.kind() == VaultFailure.Kind.PATH_NOT_FOUND;
    }
}
