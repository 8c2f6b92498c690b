package tech.yump.secretmanager.secrets.vault;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import tech.yump.secretmanager.audit.AuditHelper;
import tech.yump.secretmanager.secrets.ConnectivityCheckNotSupportedException;
import tech.yump.secretmanager.secrets.SecretRecord;
import tech.yump.secretmanager.secrets.SecretsManagerType;
import tech.yump.secretmanager.secrets.vault.auth.VaultLoginStrategies;
import tech.yump.secretmanager.secrets.vault.transport.VaultTransport;
import tech.yump.secretmanager.secrets.vault.transport.VaultTransportException;
import tech.yump.secretmanager.storage.InMemorySecretRepository;
import tech.yump.secretmanager.storage.NewSecret;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ByosVaultSecretManagerTest {

    private static final String OPENAI_PATH = "secret/data/team-a/openai";
    private static final String DB_PATH = "secret/data/team-a/database";

    @Mock
    private VaultTransport transport;

    @Mock
    private AuditHelper auditHelper;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private InMemorySecretRepository repository;
    private ByosVaultSecretManager manager;

    @BeforeEach
    void setUp() {
        repository = new InMemorySecretRepository();
        manager = newManager(VaultKvVersion.V2);
    }

    private ByosVaultSecretManager newManager(VaultKvVersion kvVersion) {
        VaultConfig config = VaultConfig.builder()
                .address("https://vault.customer.example")
                .authMethod(VaultAuthMethod.TOKEN)
                .token("customer-token")
                .kvVersion(kvVersion)
                .build();
        VaultLoginStrategies loginStrategies = new VaultLoginStrategies(
                StaticCredentialsProvider.create(AwsBasicCredentials.create("AKIDEXAMPLE", "secret")), objectMapper);
        return new ByosVaultSecretManager(config, repository, (address, tokenSupplier) -> transport,
                loginStrategies, objectMapper, auditHelper);
    }

    private static VaultTransportException vaultError(int status, String... errors) {
        return new VaultTransportException("Vault request failed", status, List.of(errors), null);
    }

    private SecretRecord storeReferences(Map<String, Object> references) {
        return repository.create(NewSecret.byosReferences("openai-key", references));
    }

    @Test
    void getType_isByosVault() {
        assertThat(manager.getType()).isEqualTo(SecretsManagerType.BYOS_VAULT);
        assertThat(manager.getUserVisibleDebugInfo().meta())
                .containsExactly(entry("description", "External Vault (BYOS - Bring Your Own Secrets)"));
    }

    @Nested
    @DisplayName("createSecret / updateSecret / deleteSecret")
    class Writes {

        @Test
        @DisplayName("Create stores the references as a BYOS row without calling Vault")
        void create_storesReferences() {
            Map<String, Object> refs = Map.of("api_key", OPENAI_PATH + "#api_key");

            SecretRecord created = manager.createSecret(refs, "openai key");

            assertThat(created.isByosVault()).isTrue();
            assertThat(created.isVault()).isFalse();
            assertThat(created.name()).isEqualTo("openai key");
            assertThat(repository.findById(created.id()).orElseThrow().value()).isEqualTo(refs);
            verifyNoInteractions(transport);
        }

        @Test
        @DisplayName("Create with forceDb stores a plaintext row")
        void create_forceDb_plaintext() {
            SecretRecord created = manager.createSecret(Map.of("api_key", "sk-live"), "openai", true);

            assertThat(created.isByosVault()).isFalse();
            assertThat(created.value()).containsExactly(entry("api_key", "sk-live"));
            verifyNoInteractions(transport);
        }

        @Test
        @DisplayName("Update replaces the references in the row only")
        void update_replacesReferences() {
            SecretRecord row = storeReferences(Map.of("api_key", OPENAI_PATH + "#api_key"));

            SecretRecord updated = manager.updateSecret(row.id(), Map.of("api_key", OPENAI_PATH + "#rotated")).orElseThrow();

            assertThat(updated.value()).containsExactly(entry("api_key", OPENAI_PATH + "#rotated"));
            assertThat(updated.updatedAt()).isAfter(row.updatedAt());
            verifyNoInteractions(transport);
        }

        @Test
        @DisplayName("Delete removes the row and never touches the customer's Vault")
        void delete_rowOnly() {
            SecretRecord row = storeReferences(Map.of("api_key", OPENAI_PATH + "#api_key"));

            assertThat(manager.deleteSecret(row.id())).isTrue();
            assertThat(manager.deleteSecret(row.id())).isFalse();

            assertThat(repository.size()).isZero();
            verifyNoInteractions(transport);
        }
    }

    @Nested
    @DisplayName("getSecret")
    class GetSecret {

        @Test
        @DisplayName("References sharing a path are resolved with a single read")
        void get_groupsReadsByPath() throws Exception {
            // Arrange
            Map<String, Object> refs = new LinkedHashMap<>();
            refs.put("OPENAI_KEY", OPENAI_PATH + "#api_key");
            refs.put("OPENAI_ORG", OPENAI_PATH + "#org");
            refs.put("DB_PASSWORD", DB_PATH + "#password");
            SecretRecord row = storeReferences(refs);

            when(transport.read(OPENAI_PATH)).thenReturn(objectMapper.readTree(
                    "{\"data\":{\"data\":{\"api_key\":\"sk-1\",\"org\":\"org-9\"},\"metadata\":{}}}"));
            when(transport.read(DB_PATH)).thenReturn(objectMapper.readTree(
                    "{\"data\":{\"data\":{\"password\":\"hunter2\"}}}"));

            // Act
            SecretRecord resolved = manager.getSecret(row.id()).orElseThrow();

            // Assert
            assertThat(resolved.value()).containsExactly(
                    entry("OPENAI_KEY", "sk-1"),
                    entry("OPENAI_ORG", "org-9"),
                    entry("DB_PASSWORD", "hunter2"));
            verify(transport, times(1)).read(OPENAI_PATH);
            verify(transport, times(1)).read(DB_PATH);
            assertThat(repository.findById(row.id()).orElseThrow().value()).isEqualTo(refs);
        }

        @Test
        @DisplayName("A key missing at its path is left out of the result")
        void get_missingKeyOmitted() throws Exception {
            Map<String, Object> refs = new LinkedHashMap<>();
            refs.put("OPENAI_KEY", OPENAI_PATH + "#api_key");
            refs.put("OPENAI_ORG", OPENAI_PATH + "#org");
            SecretRecord row = storeReferences(refs);
            when(transport.read(OPENAI_PATH)).thenReturn(objectMapper.readTree("{\"data\":{\"data\":{\"api_key\":\"sk-1\"}}}"));

            SecretRecord resolved = manager.getSecret(row.id()).orElseThrow();

            assertThat(resolved.value()).containsExactly(entry("OPENAI_KEY", "sk-1"));
        }

        @Test
        @DisplayName("KV v1: the key/value map is read from data")
        void get_v1() throws Exception {
            ByosVaultSecretManager v1Manager = newManager(VaultKvVersion.V1);
            SecretRecord row = storeReferences(Map.of("TOKEN", "secret/team-a/ci#token"));
            when(transport.read("secret/team-a/ci")).thenReturn(objectMapper.readTree("{\"data\":{\"token\":\"ghp_x\"}}"));

            assertThat(v1Manager.getSecret(row.id()).orElseThrow().value()).containsExactly(entry("TOKEN", "ghp_x"));
        }

        @Test
        @DisplayName("Plaintext rows and rows with no references are returned as stored")
        void get_nonByosRows_asStored() {
            SecretRecord plaintext = repository.create(NewSecret.plaintext("legacy", Map.of("k", "v")));
            SecretRecord empty = storeReferences(Map.of());

            assertThat(manager.getSecret(plaintext.id())).contains(plaintext);
            assertThat(manager.getSecret(empty.id())).contains(empty);
            verifyNoInteractions(transport);
        }

        @Test
        @DisplayName("A failed read is reported with the resolve-failure message")
        void get_readFails_resolveMessage() {
            SecretRecord row = storeReferences(Map.of("OPENAI_KEY", OPENAI_PATH + "#api_key"));
            when(transport.read(anyString())).thenThrow(vaultError(403, "permission denied"));

            assertThatThrownBy(() -> manager.getSecret(row.id()))
                    .isInstanceOf(VaultAccessException.class)
                    .hasMessage(ByosVaultSecretManager.RESOLVE_FAILURE_MESSAGE);
        }

        @Test
        @DisplayName("A stored value that is not a path#key reference fails resolution")
        void get_malformedReference_fails() {
            SecretRecord row = storeReferences(Map.of("OPENAI_KEY", "not-a-reference"));

            assertThatThrownBy(() -> manager.getSecret(row.id()))
                    .isInstanceOf(VaultAccessException.class)
                    .hasMessage(ByosVaultSecretManager.RESOLVE_FAILURE_MESSAGE);
            verifyNoInteractions(transport);
        }
    }

    @Nested
    @DisplayName("Folder operations")
    class Folders {

        @Test
        @DisplayName("listSecretsInFolder lists the metadata path and skips sub-folders")
        void list_skipsFolders() {
            when(transport.list("secret/metadata/team-a/")).thenReturn(List.of("openai", "database", "nested/"));

            List<VaultSecretListItem> items = manager.listSecretsInFolder("secret/data/team-a/");

            assertThat(items).containsExactly(
                    new VaultSecretListItem("openai", "secret/data/team-a/openai"),
                    new VaultSecretListItem("database", "secret/data/team-a/database"));
        }

        @Test
        @DisplayName("listSecretsInFolder returns an empty list for an unknown folder")
        void list_notFound_empty() {
            when(transport.list(anyString())).thenThrow(vaultError(404));

            assertThat(manager.listSecretsInFolder("secret/data/none")).isEmpty();
        }

        @Test
        @DisplayName("listSecretsInFolder raises other failures")
        void list_forbidden_throws() {
            when(transport.list(anyString())).thenThrow(vaultError(403, "permission denied"));

            assertThatThrownBy(() -> manager.listSecretsInFolder("secret/data/team-a"))
                    .isInstanceOf(VaultAccessException.class)
                    .hasMessage(VaultFailure.USER_MESSAGE);
        }

        @Test
        @DisplayName("getSecretFromPath returns the whole key/value map")
        void getSecretFromPath_returnsData() throws Exception {
            when(transport.read(OPENAI_PATH)).thenReturn(objectMapper.readTree(
                    "{\"data\":{\"data\":{\"api_key\":\"sk-1\",\"org\":\"org-9\"}}}"));

            assertThat(manager.getSecretFromPath(OPENAI_PATH))
                    .containsEntry("api_key", "sk-1")
                    .containsEntry("org", "org-9")
                    .hasSize(2);
        }

        @Test
        @DisplayName("checkFolderConnectivity counts secrets, not sub-folders")
        void folderConnectivity_counts() {
            when(transport.list("secret/metadata/team-a")).thenReturn(List.of("openai", "nested/", "database"));

            assertThat(manager.checkFolderConnectivity("secret/data/team-a"))
                    .isEqualTo(VaultFolderConnectivityResult.connected(2));
        }

        @Test
        @DisplayName("checkFolderConnectivity treats an unknown folder as connected and empty")
        void folderConnectivity_notFound() {
            when(transport.list(anyString())).thenThrow(vaultError(404));

            assertThat(manager.checkFolderConnectivity("secret/data/team-a"))
                    .isEqualTo(VaultFolderConnectivityResult.connected(0));
        }

        @Test
        @DisplayName("checkFolderConnectivity reports failures instead of throwing")
        void folderConnectivity_failure() {
            when(transport.list(anyString())).thenThrow(vaultError(403, "permission denied"));

            VaultFolderConnectivityResult result = manager.checkFolderConnectivity("secret/data/team-a");

            assertThat(result.connected()).isFalse();
            assertThat(result.secretCount()).isZero();
            assertThat(result.error()).isEqualTo("403: permission denied");
        }

        @Test
        @DisplayName("checkFolderConnectivity reports an unreachable Vault")
        void folderConnectivity_unreachable() {
            when(transport.list(anyString())).thenThrow(vaultError(0));

            assertThat(manager.checkFolderConnectivity("secret/data/team-a").error()).isEqualTo("Connection failed");
        }
    }

    @Test
    @DisplayName("Global connectivity check needs a team folder and is not supported")
    void checkConnectivity_notSupported() {
        assertThatThrownBy(() -> manager.checkConnectivity())
                .isInstanceOf(ConnectivityCheckNotSupportedException.class)
                .hasMessage(ByosVaultSecretManager.CONNECTIVITY_NOT_SUPPORTED_MESSAGE);
        verifyNoInteractions(transport);
    }
}
