package tech.yump.secretmanager.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.secretmanager.audit.AuditHelper;
import tech.yump.secretmanager.secrets.SecretManager;
import tech.yump.secretmanager.secrets.SecretManagerDebugInfo;
import tech.yump.secretmanager.secrets.SecretManagerFactory;
import tech.yump.secretmanager.secrets.SecretsFeatures;
import tech.yump.secretmanager.secrets.vault.VaultKvVersion;
import tech.yump.secretmanager.secrets.SecretsConnectivityResult;

import java.util.Map;

@RestController
@RequestMapping("/api/secrets")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Secrets", description = "Diagnostics for the configured secrets backend")
public class SecretsController {

    private final SecretManager secretManager;
    private final SecretManagerFactory secretManagerFactory;
    private final AuditHelper auditHelper;

    @GetMapping(value = "/type", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Get secrets backend",
            description = "Returns the active secrets backend type and its non-sensitive settings."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Backend described.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = SecretManagerDebugInfo.class))),
            @ApiResponse(responseCode = "403", description = "Missing or invalid operator token.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public SecretManagerDebugInfo getSecretsType() {
        return secretManager.getUserVisibleDebugInfo();
    }

    @PostMapping(value = "/check-connectivity", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Check backend connectivity",
            description = "Authenticates against the backend and counts the secrets under its base path. "
                    + "Not available for database storage or BYOS."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Backend reachable.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = SecretsConnectivityResult.class))),
            @ApiResponse(responseCode = "403", description = "Missing or invalid operator token.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "500", description = "Backend unreachable or authentication failed.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "501", description = "The active backend has no connectivity check.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public SecretsConnectivityResult checkConnectivity() {
        log.info("Checking connectivity of {} secrets backend", secretManager.getType());
        SecretsConnectivityResult result = secretManager.checkConnectivity();
        auditHelper.logHttpEvent(AuditHelper.SECRET_OPERATION, "check_connectivity", "success", HttpStatus.OK.value(),
                null, Map.of("backend", secretManager.getType().name(), "secret_count", result.secretCount()));
        return result;
    }

    @GetMapping(value = "/features", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Get secrets features",
            description = "Tells clients whether BYOS is available and which KV version its folders use."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Features described.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = SecretsFeatures.class))),
            @ApiResponse(responseCode = "403", description = "Missing or invalid operator token.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public SecretsFeatures getFeatures() {
        return new SecretsFeatures(
                secretManagerFactory.isByosEnabled(),
                secretManagerFactory.getByosVaultKvVersion().map(VaultKvVersion::setting).orElse(null));
    }
}
