package tech.yump.secretmanager.secrets;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Result of a connectivity check against the secrets backend")
public record SecretsConnectivityResult(
        @Schema(description = "Number of secrets visible at the backend's base path.", example = "3")
        int secretCount
) {}
