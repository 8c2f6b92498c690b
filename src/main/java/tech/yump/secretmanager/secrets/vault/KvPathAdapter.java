package tech.yump.secretmanager.secrets.vault;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Translates logical secrets into Vault KV paths and payload envelopes for one KV version.
 * Stateless and side-effect free; the managers never branch on the KV version themselves.
 */
public final class KvPathAdapter {

    private static final String DATA_SEGMENT = "/data/";
    private static final String METADATA_SEGMENT = "/metadata/";

    private final VaultKvVersion kvVersion;
    private final String secretPathPrefix;
    private final String configuredMetadataPrefix;

    public KvPathAdapter(VaultKvVersion kvVersion, String secretPathPrefix, String configuredMetadataPrefix) {
        this.kvVersion = kvVersion;
        this.secretPathPrefix = secretPathPrefix;
        this.configuredMetadataPrefix = configuredMetadataPrefix;
    }

    public static KvPathAdapter forConfig(VaultConfig config) {
        return new KvPathAdapter(config.kvVersion(), config.secretPath(), config.secretMetadataPath());
    }

    public VaultKvVersion kvVersion() {
        return kvVersion;
    }

    /** Read/write path of a platform-owned secret: {@code {prefix}/{name}-{id}}. */
    public String secretPath(String name, UUID id) {
        return secretPathPrefix + "/" + name + "-" + id;
    }

    /**
     * Delete path of a platform-owned secret. On v2 this is the metadata path, which removes every
     * version; on v1 it is the data path.
     */
    public String metadataPath(String name, UUID id) {
        if (kvVersion == VaultKvVersion.V1) {
            return secretPath(name, id);
        }
        return metadataPrefix() + "/" + name + "-" + id;
    }

    /** Root listed by connectivity checks. */
    public String listBasePath() {
        return kvVersion == VaultKvVersion.V1 ? secretPathPrefix : metadataPrefix();
    }

    /** List path of an externally-owned folder given by its data path. */
    public String folderListPath(String folderPath) {
        return kvVersion == VaultKvVersion.V1 ? folderPath : toMetadata(folderPath);
    }

    public Map<String, Object> writePayload(String jsonValue) {
        if (kvVersion == VaultKvVersion.V1) {
            return Map.of("value", jsonValue);
        }
        return Map.of("data", Map.of("value", jsonValue));
    }

    /**
     * Extracts the JSON-encoded value written by {@link #writePayload(String)} from a read response body.
     */
    public Optional<String> readValue(JsonNode responseBody) {
        JsonNode value = secretData(responseBody).path("value");
        return value.isTextual() ? Optional.of(value.asText()) : Optional.empty();
    }

    /**
     * The key/value map stored at a path, as found in a read response body
     * ({@code data} on v1, {@code data.data} on v2). Missing node if absent.
     */
    public JsonNode secretData(JsonNode responseBody) {
        JsonNode data = responseBody.path("data");
        return kvVersion == VaultKvVersion.V1 ? data : data.path("data");
    }

    private String metadataPrefix() {
        return configuredMetadataPrefix != null ? configuredMetadataPrefix : toMetadata(secretPathPrefix);
    }

    private static String toMetadata(String path) {
        // First occurrence only, like the KV v2 path layout
        int idx = path.indexOf(DATA_SEGMENT);
        if (idx < 0) {
            return path;
        }
        return path.substring(0, idx) + METADATA_SEGMENT + path.substring(idx + DATA_SEGMENT.length());
    }
}
