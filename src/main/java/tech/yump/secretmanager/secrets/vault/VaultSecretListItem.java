package tech.yump.secretmanager.secrets.vault;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "A secret found in an external Vault folder")
public record VaultSecretListItem(
        @Schema(description = "Secret name within the folder.", example = "openai")
        String name,
        @Schema(description = "Full data path of the secret.", example = "secret/data/team-a/openai")
        String path
) {}
