package tech.yump.secretmanager.storage;

import tech.yump.secretmanager.secrets.SecretRecord;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for secret metadata rows, keyed by an id the repository assigns.
 */
public interface SecretRepository {

    SecretRecord create(NewSecret secret);

    Optional<SecretRecord> findById(UUID id);

    /**
     * Replaces the stored value and bumps {@code updatedAt}.
     *
     * @return the updated row, or empty if it does not exist.
     */
    Optional<SecretRecord> update(UUID id, Map<String, Object> value);

    /**
     * Bumps {@code updatedAt} without changing the stored value. Used once the authoritative copy
     * of a value living outside the relational store has changed.
     *
     * @return the updated row, or empty if it does not exist.
     */
    Optional<SecretRecord> touch(UUID id);

    /**
     * @return {@code true} if a row was removed.
     */
    boolean delete(UUID id);
}
