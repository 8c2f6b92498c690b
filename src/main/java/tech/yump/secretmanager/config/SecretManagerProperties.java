package tech.yump.secretmanager.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Configuration properties under the 'secretmanager' prefix.
 * <p>
 * The Vault block carries no constraints; {@link VaultConfigResolver} reports its problems
 * and the selector falls back to database storage.
 */
@ConfigurationProperties(prefix = "secretmanager")
@Validated
public record SecretManagerProperties(

        // DB, VAULT, READONLY_VAULT or BYOS_VAULT; anything else means DB
        String type,

        boolean enterpriseLicenseActivated,

        @Valid
        @NotNull(message = "Database configuration (secretmanager.database) is required.")
        DatabaseProperties database,

        VaultProperties vault,

        @Valid
        AuthProperties auth,

        @Valid
        AuditProperties audit
) {

    @Validated
    public record DatabaseProperties(
            @NotBlank(message = "Database connection URL (secretmanager.database.connection-url) must be provided.")
            String connectionUrl,

            @NotBlank(message = "Database username (secretmanager.database.username) must be provided.")
            String username,

            char[] password
    ) {
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            DatabaseProperties that = (DatabaseProperties) o;
            return Objects.equals(connectionUrl, that.connectionUrl) &&
                    Objects.equals(username, that.username) &&
                    Arrays.equals(password, that.password);
        }

        @Override
        public int hashCode() {
            int result = Objects.hash(connectionUrl, username);
            result = 31 * result + Arrays.hashCode(password);
            return result;
        }

        @Override
        public String toString() {
            return "DatabaseProperties[" +
                    "connectionUrl='" + connectionUrl + '\'' +
                    ", username='" + username + '\'' +
                    ", password=******" +
                    ']';
        }
    }

    /**
     * Raw Vault settings as strings, exactly as deployed. Converted by {@link VaultConfigResolver}.
     */
    public record VaultProperties(
            String address,
            String authMethod,
            String token,
            String kvVersion,
            String secretPath,
            String secretMetadataPath,
            Duration connectTimeout,
            Duration readTimeout,
            KubernetesProperties kubernetes,
            AwsProperties aws
    ) {
        public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
        public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);

        public VaultProperties {
            connectTimeout = connectTimeout != null ? connectTimeout : DEFAULT_CONNECT_TIMEOUT;
            readTimeout = readTimeout != null ? readTimeout : DEFAULT_READ_TIMEOUT;
            kubernetes = kubernetes != null ? kubernetes : new KubernetesProperties(null, null, null);
            aws = aws != null ? aws : new AwsProperties(null, null, null, null, null);
        }

        public record KubernetesProperties(String role, String mountPoint, String tokenPath) {}

        public record AwsProperties(String role, String mountPoint, String region, String stsEndpoint, String iamServerId) {}

        @Override
        public String toString() {
            return "VaultProperties[" +
                    "address='" + address + '\'' +
                    ", authMethod='" + authMethod + '\'' +
                    ", token=" + (token != null && !token.isEmpty() ? "******" : "unset") +
                    ", kvVersion='" + kvVersion + '\'' +
                    ", secretPath='" + secretPath + '\'' +
                    ", secretMetadataPath='" + secretMetadataPath + '\'' +
                    ", connectTimeout=" + connectTimeout +
                    ", readTimeout=" + readTimeout +
                    ", kubernetes=" + kubernetes +
                    ", aws=" + aws +
                    ']';
        }
    }

    @Validated
    public record AuthProperties(
            @Valid
            StaticTokenAuthProperties staticTokens
    ) {

        /**
         * An operator token for the diagnostics API. {@code name} is what audit records show.
         */
        @Validated
        public record StaticToken(
                @NotBlank(message = "Static token name cannot be blank")
                String name,

                @NotBlank(message = "Static token value cannot be blank")
                String token
        ) {
            @Override
            public String toString() {
                return "StaticToken[name='" + name + "', token=******]";
            }
        }

        @Validated
        public record StaticTokenAuthProperties(
                boolean enabled,

                @Valid
                List<StaticToken> tokens
        ) {
            public StaticTokenAuthProperties {
                if (tokens == null) {
                    tokens = Collections.emptyList();
                }
            }

            @AssertTrue(message = "Static tokens (secretmanager.auth.static-tokens.tokens) cannot be empty when static token auth is enabled.")
            public boolean isTokensValid() {
                return !enabled || !tokens.isEmpty();
            }
        }
    }

    @Validated
    public record AuditProperties(
            @NotBlank(message = "Audit backend (secretmanager.audit.backend) must be 'slf4j' or 'file'.")
            String backend,

            @Valid
            FileAuditProperties file
    ) {
        public record FileAuditProperties(String path) {
            public static final String PATH_PROPERTY = "secretmanager.audit.file.path";
        }
    }
}
