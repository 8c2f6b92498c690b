package tech.yump.secretmanager.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import tech.yump.secretmanager.secrets.SecretRecord;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link SecretRepository} backed by the PostgreSQL {@code secret} table (see {@code schema.sql}).
 * The value map is stored as {@code jsonb}.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcSecretRepository implements SecretRepository {

    private static final TypeReference<Map<String, Object>> VALUE_TYPE = new TypeReference<>() {};
    private static final String DEFAULT_NAME = "secret";

    private static final String SELECT_COLUMNS =
            "SELECT id, name, secret, is_vault, is_byos_vault, created_at, updated_at FROM secret";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private final RowMapper<SecretRecord> rowMapper = this::mapRow;

    @Override
    public SecretRecord create(NewSecret secret) {
        UUID id = UUID.randomUUID();
        // PostgreSQL keeps microseconds; truncate so the returned record equals what a later read sees
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        String name = secret.name() != null ? secret.name() : DEFAULT_NAME;

        try {
            jdbcTemplate.update(
                    "INSERT INTO secret (id, name, secret, is_vault, is_byos_vault, created_at, updated_at) " +
                            "VALUES (?, ?, ?::jsonb, ?, ?, ?, ?)",
                    id, name, toJson(secret.value()), secret.isVault(), secret.isByosVault(),
                    Timestamp.from(now), Timestamp.from(now));
        } catch (DataAccessException e) {
            log.error("Failed to insert secret row '{}': {}", name, e.getMessage());
            throw new StorageException("Failed to insert secret row", e);
        }

        log.debug("Inserted secret row {} (isVault={}, isByosVault={})", id, secret.isVault(), secret.isByosVault());
        return new SecretRecord(id, name, secret.value(), secret.isVault(), secret.isByosVault(), now, now);
    }

    @Override
    public Optional<SecretRecord> findById(UUID id) {
        try {
            List<SecretRecord> rows = jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?", rowMapper, id);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            log.error("Failed to read secret row {}: {}", id, e.getMessage());
            throw new StorageException("Failed to read secret row " + id, e);
        }
    }

    @Override
    public Optional<SecretRecord> update(UUID id, Map<String, Object> value) {
        int updated = executeUpdate(id,
                "UPDATE secret SET secret = ?::jsonb, updated_at = ? WHERE id = ?",
                toJson(value), Timestamp.from(Instant.now()), id);
        return updated > 0 ? findById(id) : Optional.empty();
    }

    @Override
    public Optional<SecretRecord> touch(UUID id) {
        int updated = executeUpdate(id,
                "UPDATE secret SET updated_at = ? WHERE id = ?",
                Timestamp.from(Instant.now()), id);
        return updated > 0 ? findById(id) : Optional.empty();
    }

    @Override
    public boolean delete(UUID id) {
        int deleted = executeUpdate(id, "DELETE FROM secret WHERE id = ?", id);
        log.debug("Delete of secret row {} affected {} row(s)", id, deleted);
        return deleted > 0;
    }

    private int executeUpdate(UUID id, String sql, Object... args) {
        try {
            return jdbcTemplate.update(sql, args);
        } catch (DataAccessException e) {
            log.error("Failed to modify secret row {}: {}", id, e.getMessage());
            throw new StorageException("Failed to modify secret row " + id, e);
        }
    }

    private SecretRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new SecretRecord(
                rs.getObject("id", UUID.class),
                rs.getString("name"),
                fromJson(rs.getString("secret")),
                rs.getBoolean("is_vault"),
                rs.getBoolean("is_byos_vault"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant());
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value == null ? Map.of() : value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Secret value could not be serialized to JSON", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, VALUE_TYPE);
        } catch (JsonProcessingException e) {
            throw new StorageException("Stored secret value is not valid JSON", e);
        }
    }
}
