package tech.yump.secretmanager.secrets;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator-facing description of the active backend. Never contains secret values or tokens.
 */
@Schema(description = "Active secrets backend and its non-sensitive settings")
public record SecretManagerDebugInfo(
        @Schema(description = "Backend type.", example = "VAULT")
        SecretsManagerType type,
        @Schema(description = "Human readable settings of the backend.")
        Map<String, String> meta
) {
    public SecretManagerDebugInfo {
        meta = meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }
}
