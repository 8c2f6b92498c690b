package tech.yump.secretmanager.secrets;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Secrets features the deployment offers")
public record SecretsFeatures(
        @Schema(description = "Whether teams may reference secrets in their own Vault folders (BYOS).")
        boolean byosEnabled,
        @Schema(description = "Vault KV version of BYOS folders, null when BYOS is disabled.", example = "2", nullable = true)
        String byosVaultKvVersion
) {}
